package com.relengine.query.processor;

import com.relengine.query.domain.Row;
import com.relengine.query.domain.Table;

import java.util.ArrayList;
import java.util.List;

/**
 * UNION and UNION ALL.
 */
public class SetOperations {

    private SetOperations() {
    }

    /** Rows of {@code first} followed by rows of {@code second}, duplicates kept. */
    public static Table unionAll(Table first, Table second) {
        List<Row> combined = new ArrayList<>(first.size() + second.size());
        combined.addAll(first.getRows());
        combined.addAll(second.getRows());
        return Table.of(combined);
    }

    public static Table unionDistinct(Table first, Table second) {
        return Deduplicator.distinct(unionAll(first, second));
    }
}
