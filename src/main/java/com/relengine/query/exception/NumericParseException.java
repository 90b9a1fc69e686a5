package com.relengine.query.exception;

/**
 * A field that must be read as a number is absent or not numeric.
 */
public class NumericParseException extends QueryException {

    private static final long serialVersionUID = 1L;

    private final String column;
    private final String text;

    public NumericParseException(String column, String text, Throwable cause) {
        super(text == null
                ? String.format("Column '%s' is absent, expected a numeric value", column)
                : String.format("Column '%s' holds non-numeric text '%s'", column, text), cause);
        this.column = column;
        this.text = text;
    }

    public String getColumn() {
        return column;
    }

    /**
     * The offending text, or {@code null} when the column was absent.
     */
    public String getText() {
        return text;
    }
}
