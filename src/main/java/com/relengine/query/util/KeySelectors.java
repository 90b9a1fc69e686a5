package com.relengine.query.util;

import com.google.common.collect.ImmutableList;
import com.relengine.query.domain.Row;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Key selectors used for grouping and deduplication.
 */
public class KeySelectors {

    /** Separator appended after each value of a composite text key. */
    public static final String COMPOSITE_KEY_SEPARATOR = "|";

    private KeySelectors() {
    }

    /**
     * Extracts a key from a row.
     */
    @FunctionalInterface
    public interface KeySelector<K> {
        /**
         * Returns the key, or {@code null} when the row has no key.
         */
        K getKey(Row row);
    }

    /**
     * Selects the value of a single column; rows lacking it have no key.
     */
    public static KeySelector<String> column(String column) {
        return row -> row.getFieldValue(column);
    }

    /**
     * Concatenates the present values of the columns, each followed by the separator.
     * Absent columns contribute nothing, so distinct tuples may alias
     * (for example {@code "a|b"} alone and {@code "a"},{@code "b"}).
     */
    public static KeySelector<String> composite(List<String> columns) {
        List<String> copy = ImmutableList.copyOf(columns);
        return row -> {
            StringBuilder key = new StringBuilder();
            for (String column : copy) {
                String value = row.getFieldValue(column);
                if (value != null) {
                    key.append(value).append(COMPOSITE_KEY_SEPARATOR);
                }
            }
            return key.toString();
        };
    }

    /**
     * Selects the values of the columns as a list, in column order.
     * An absent column is a {@code null} element, distinct from any text value.
     */
    public static KeySelector<List<String>> columnValues(List<String> columns) {
        List<String> copy = ImmutableList.copyOf(columns);
        return row -> {
            List<String> values = new ArrayList<>(copy.size());
            for (String column : copy) {
                values.add(row.getFieldValue(column));
            }
            return Collections.unmodifiableList(values);
        };
    }
}
