package com.relengine.query.processor;

import com.relengine.query.domain.Row;
import com.relengine.query.domain.Table;
import com.relengine.query.util.KeySelectors;
import com.relengine.query.util.KeySelectors.KeySelector;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * DISTINCT: keeps the first occurrence of each row, in original order.
 */
public class Deduplicator {

    private Deduplicator() {
    }

    /** Compares rows by their whole field set and values. */
    public static Table distinct(Table table) {
        Set<Row> seen = new HashSet<>();
        List<Row> result = new ArrayList<>();
        for (Row row : table) {
            if (seen.add(row)) {
                result.add(row);
            }
        }
        return Table.of(result);
    }

    /**
     * Compares rows by the values of the listed columns only.
     * Absence of a column is a value of its own, so it never equals a present empty field.
     */
    public static Table distinctOn(Table table, List<String> columns) {
        KeySelector<List<String>> selector = KeySelectors.columnValues(columns);
        Set<List<String>> seen = new HashSet<>();
        List<Row> result = new ArrayList<>();
        for (Row row : table) {
            if (seen.add(selector.getKey(row))) {
                result.add(row);
            }
        }
        return Table.of(result);
    }
}
