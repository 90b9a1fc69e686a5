package com.relengine.query.processor;

import com.google.common.collect.ImmutableSet;
import com.relengine.query.domain.Row;

import java.util.Collection;
import java.util.Set;
import java.util.function.BiPredicate;
import java.util.function.Predicate;

/**
 * Builders for reusable row and join predicates.
 * Values are compared as text; a row lacking the referenced column never matches.
 */
public class Predicates {

    private Predicates() {
    }

    /** {@code column = value} */
    public static Predicate<Row> equalTo(String column, String value) {
        return row -> {
            String field = row.getFieldValue(column);
            return field != null && field.equals(value);
        };
    }

    /** {@code column > value} */
    public static Predicate<Row> greaterThan(String column, String value) {
        return row -> {
            String field = row.getFieldValue(column);
            return field != null && field.compareTo(value) > 0;
        };
    }

    /** {@code column >= value} */
    public static Predicate<Row> greaterEqual(String column, String value) {
        return row -> {
            String field = row.getFieldValue(column);
            return field != null && field.compareTo(value) >= 0;
        };
    }

    /** {@code column < value} */
    public static Predicate<Row> lessThan(String column, String value) {
        return row -> {
            String field = row.getFieldValue(column);
            return field != null && field.compareTo(value) < 0;
        };
    }

    /** {@code column <= value} */
    public static Predicate<Row> lessEqual(String column, String value) {
        return row -> {
            String field = row.getFieldValue(column);
            return field != null && field.compareTo(value) <= 0;
        };
    }

    /** {@code column IN (values...)} */
    public static Predicate<Row> in(String column, Collection<String> values) {
        Set<String> accepted = ImmutableSet.copyOf(values);
        return row -> {
            String field = row.getFieldValue(column);
            return field != null && accepted.contains(field);
        };
    }

    /**
     * {@code lowerInclusive <= column < upperExclusive}. Date ranges are only
     * ordered correctly for zero-padded fixed-width text such as {@code YYYY-MM-DD}.
     */
    public static Predicate<Row> between(String column, String lowerInclusive, String upperExclusive) {
        return row -> {
            String field = row.getFieldValue(column);
            return field != null
                    && field.compareTo(lowerInclusive) >= 0
                    && field.compareTo(upperExclusive) < 0;
        };
    }

    /** {@code left = right}, two columns of the same row. */
    public static Predicate<Row> columnsEqual(String left, String right) {
        return row -> {
            String leftValue = row.getFieldValue(left);
            return leftValue != null && leftValue.equals(row.getFieldValue(right));
        };
    }

    /** {@code left.leftColumn = right.rightColumn} */
    public static BiPredicate<Row, Row> joinOn(String leftColumn, String rightColumn) {
        return (left, right) -> {
            String leftValue = left.getFieldValue(leftColumn);
            return leftValue != null && leftValue.equals(right.getFieldValue(rightColumn));
        };
    }
}
