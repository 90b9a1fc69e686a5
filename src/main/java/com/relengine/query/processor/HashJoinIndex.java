package com.relengine.query.processor;

import com.google.common.collect.ImmutableListMultimap;
import com.relengine.query.domain.Row;
import com.relengine.query.domain.Table;

import java.util.List;

/**
 * Build side of a hash join: maps a column value to the indices of the rows
 * holding it, in table order. Immutable once built, so probe workers share it
 * without synchronization.
 */
final class HashJoinIndex {

    private final Table table;
    private final ImmutableListMultimap<String, Integer> positions;

    private HashJoinIndex(Table table, ImmutableListMultimap<String, Integer> positions) {
        this.table = table;
        this.positions = positions;
    }

    /** Rows lacking the column are not indexed. */
    static HashJoinIndex build(Table table, String column) {
        ImmutableListMultimap.Builder<String, Integer> builder = ImmutableListMultimap.builder();
        for (int i = 0; i < table.size(); i++) {
            String value = table.getRow(i).getFieldValue(column);
            if (value != null) {
                builder.put(value, i);
            }
        }
        return new HashJoinIndex(table, builder.build());
    }

    /** Indices of matching rows; empty when the value is unknown. */
    List<Integer> lookup(String value) {
        return positions.get(value);
    }

    Row row(int index) {
        return table.getRow(index);
    }

    int keyCount() {
        return positions.keySet().size();
    }
}
