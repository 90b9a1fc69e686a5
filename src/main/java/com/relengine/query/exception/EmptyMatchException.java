package com.relengine.query.exception;

/**
 * A required dimension filter matched no rows.
 */
public class EmptyMatchException extends QueryException {

    private static final long serialVersionUID = 1L;

    private final String table;
    private final String column;
    private final String value;

    public EmptyMatchException(String table, String column, String value) {
        super(String.format("No rows in table '%s' where %s = '%s'", table, column, value));
        this.table = table;
        this.column = column;
        this.value = value;
    }

    public String getTable() {
        return table;
    }

    public String getColumn() {
        return column;
    }

    public String getValue() {
        return value;
    }
}
