package com.relengine.query.processor;

import com.relengine.query.domain.Row;
import com.relengine.query.domain.Table;

import java.util.ArrayList;
import java.util.List;

/**
 * SELECT: column projection.
 */
public class Projector {

    private Projector() {
    }

    /**
     * Keeps only the listed columns. A column absent from a row is left out
     * of that output row; no placeholder is added.
     */
    public static Table project(Table table, List<String> columns) {
        List<Row> result = new ArrayList<>(table.size());
        for (Row row : table) {
            Row.Builder projected = Row.builder();
            for (String column : columns) {
                String value = row.getFieldValue(column);
                if (value != null) {
                    projected.set(column, value);
                }
            }
            result.add(projected.build());
        }
        return Table.of(result);
    }

    /** SELECT * */
    public static Table projectAll(Table table) {
        return table;
    }
}
