package com.relengine.query.processor;

import com.relengine.query.domain.Row;
import com.relengine.query.domain.Table;
import com.relengine.query.util.NumericValues;

/**
 * SUM, COUNT, AVG, MIN and MAX over a group.
 */
public class Aggregates {

    private Aggregates() {
    }

    /**
     * Absent fields count as zero; a present field that is not numeric fails.
     */
    public static double sum(Table group, String column) {
        double sum = 0.0;
        for (Row row : group) {
            String value = row.getFieldValue(column);
            if (value != null) {
                sum += NumericValues.parse(column, value);
            }
        }
        return sum;
    }

    /** COUNT(*) */
    public static long count(Table group) {
        return group.size();
    }

    /** COUNT(column): rows where the field is present and not empty. */
    public static long countColumn(Table group, String column) {
        long count = 0;
        for (Row row : group) {
            String value = row.getFieldValue(column);
            if (value != null && !value.isEmpty()) {
                count++;
            }
        }
        return count;
    }

    /** Sum divided by the group size, absent fields included; 0 for an empty group. */
    public static double avg(Table group, String column) {
        if (group.isEmpty()) {
            return 0.0;
        }
        return sum(group, column) / group.size();
    }

    /**
     * Seeded from the first row, which must hold the column; later rows lacking it are skipped.
     * 0 for an empty group.
     */
    public static double max(Table group, String column) {
        if (group.isEmpty()) {
            return 0.0;
        }
        double max = NumericValues.parse(group.getRow(0), column);
        for (Row row : group) {
            String value = row.getFieldValue(column);
            if (value != null) {
                max = Math.max(max, NumericValues.parse(column, value));
            }
        }
        return max;
    }

    /**
     * Seeded from the first row, which must hold the column; later rows lacking it are skipped.
     * 0 for an empty group.
     */
    public static double min(Table group, String column) {
        if (group.isEmpty()) {
            return 0.0;
        }
        double min = NumericValues.parse(group.getRow(0), column);
        for (Row row : group) {
            String value = row.getFieldValue(column);
            if (value != null) {
                min = Math.min(min, NumericValues.parse(column, value));
            }
        }
        return min;
    }

    public static AggregateFunction sumOf(String column) {
        return group -> sum(group, column);
    }

    public static AggregateFunction countAll() {
        return group -> count(group);
    }

    public static AggregateFunction countOf(String column) {
        return group -> countColumn(group, column);
    }

    public static AggregateFunction avgOf(String column) {
        return group -> avg(group, column);
    }

    public static AggregateFunction maxOf(String column) {
        return group -> max(group, column);
    }

    public static AggregateFunction minOf(String column) {
        return group -> min(group, column);
    }
}
