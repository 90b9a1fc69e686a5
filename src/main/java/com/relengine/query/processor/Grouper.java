package com.relengine.query.processor;

import com.relengine.query.domain.Row;
import com.relengine.query.domain.Table;
import com.relengine.query.util.KeySelectors;
import com.relengine.query.util.KeySelectors.KeySelector;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * GROUP BY. Groups are keyed in ascending text order; rows inside a group keep
 * their original order.
 */
public class Grouper {

    private Grouper() {
    }

    /** Rows lacking the column belong to no group. */
    public static SortedMap<String, Table> groupBy(Table table, String column) {
        return group(table, KeySelectors.column(column));
    }

    /**
     * Groups by a composite text key made of the present column values.
     * Rows lacking some of the columns are still grouped, under a shorter key,
     * so logically different tuples can share a group.
     */
    public static SortedMap<String, Table> groupByMulti(Table table, List<String> columns) {
        return group(table, KeySelectors.composite(columns));
    }

    private static SortedMap<String, Table> group(Table table, KeySelector<String> selector) {
        Map<String, List<Row>> buckets = new LinkedHashMap<>();
        for (Row row : table) {
            String key = selector.getKey(row);
            if (key != null) {
                buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
            }
        }
        SortedMap<String, Table> groups = new TreeMap<>();
        for (Map.Entry<String, List<Row>> bucket : buckets.entrySet()) {
            groups.put(bucket.getKey(), Table.of(bucket.getValue()));
        }
        return groups;
    }
}
