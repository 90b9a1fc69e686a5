package com.relengine.query.exception;

/**
 * Base class for every failure raised by the query engine.
 * Operators never retry; callers decide whether to abort the run.
 */
public class QueryException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public QueryException(String message) {
        super(message);
    }

    public QueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
