package com.relengine.query.util;

import com.relengine.query.domain.Row;
import com.relengine.query.exception.NumericParseException;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * On-demand numeric reading and writing of text fields.
 */
public class NumericValues {

    // no type suffixes, hex, NaN or Infinity
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private NumericValues() {
    }

    /**
     * Parses a column of a row as a double.
     *
     * @throws NumericParseException if the column is absent or not numeric
     */
    public static double parse(Row row, String column) {
        return parse(column, row.getFieldValue(column));
    }

    public static double parse(String column, String text) {
        if (text == null) {
            throw new NumericParseException(column, null, null);
        }
        if (!DECIMAL.matcher(text).matches()) {
            throw new NumericParseException(column, text, null);
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new NumericParseException(column, text, e);
        }
    }

    /**
     * Formats a double as plain decimal text that parses back to the same value.
     */
    public static String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        return BigDecimal.valueOf(value).toPlainString();
    }
}
