package com.relengine.query.processor;

import com.relengine.query.domain.Row;
import com.relengine.query.domain.Table;
import com.relengine.query.util.NumericValues;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Turns groups into one result row each.
 */
public class Aggregator {

    private Aggregator() {
    }

    /**
     * Produces, for every group, a row with the group key under {@code groupColumnName}
     * and one text field per named aggregate. Rows follow the ascending order of
     * the group keys, not the order in which groups were first seen.
     */
    public static Table aggregate(SortedMap<String, Table> groups, String groupColumnName,
            Map<String, AggregateFunction> functions) {
        List<Row> result = new ArrayList<>(groups.size());
        for (Map.Entry<String, Table> group : groups.entrySet()) {
            Row.Builder row = Row.builder().set(groupColumnName, group.getKey());
            for (Map.Entry<String, AggregateFunction> function : functions.entrySet()) {
                row.set(function.getKey(), NumericValues.format(function.getValue().apply(group.getValue())));
            }
            result.add(row.build());
        }
        return Table.of(result);
    }
}
