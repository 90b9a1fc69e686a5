package com.relengine.query.exception;

/**
 * A text operation needed a column that the row does not hold.
 */
public class MissingColumnException extends QueryException {

    private static final long serialVersionUID = 1L;

    private final String column;

    public MissingColumnException(String column) {
        super(String.format("Column '%s' is absent from row", column));
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
