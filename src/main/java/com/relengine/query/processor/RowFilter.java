package com.relengine.query.processor;

import com.google.common.collect.ImmutableList;
import com.relengine.query.domain.Row;
import com.relengine.query.domain.Table;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * WHERE: keeps the rows that satisfy a predicate.
 */
public class RowFilter {

    private RowFilter() {
    }

    public static Table filter(Table table, Predicate<Row> predicate) {
        List<Row> result = new ArrayList<>();
        for (Row row : table) {
            if (predicate.test(row)) {
                result.add(row);
            }
        }
        return Table.of(result);
    }

    /**
     * Keeps rows matching every predicate; stops at the first failing one.
     * An empty list keeps all rows.
     */
    public static Table filterAnd(Table table, List<Predicate<Row>> predicates) {
        List<Predicate<Row>> conditions = ImmutableList.copyOf(predicates);
        return filter(table, row -> {
            for (Predicate<Row> condition : conditions) {
                if (!condition.test(row)) {
                    return false;
                }
            }
            return true;
        });
    }

    /**
     * Keeps rows matching any predicate; stops at the first matching one.
     * An empty list keeps no rows.
     */
    public static Table filterOr(Table table, List<Predicate<Row>> predicates) {
        List<Predicate<Row>> conditions = ImmutableList.copyOf(predicates);
        return filter(table, row -> {
            for (Predicate<Row> condition : conditions) {
                if (condition.test(row)) {
                    return true;
                }
            }
            return false;
        });
    }
}
