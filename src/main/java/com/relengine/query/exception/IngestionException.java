package com.relengine.query.exception;

import java.nio.file.Path;

/**
 * A source table could not be opened or holds a malformed line.
 */
public class IngestionException extends QueryException {

    private static final long serialVersionUID = 1L;

    private final transient Path source;

    public IngestionException(Path source, String message) {
        super(message);
        this.source = source;
    }

    public IngestionException(Path source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public Path getSource() {
        return source;
    }
}
