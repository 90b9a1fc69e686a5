package com.relengine.query.processor;

import com.relengine.query.domain.Row;
import com.relengine.query.domain.Table;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiPredicate;

/**
 * Joins that compare every left row with every right row.
 * A merged row holds the fields of both rows; right fields win on name collision.
 * Output follows left order, then right order within a left row.
 */
public class NestedLoopJoiner {

    private NestedLoopJoiner() {
    }

    public static Table innerJoin(Table left, Table right, BiPredicate<Row, Row> condition) {
        List<Row> result = new ArrayList<>();
        for (Row leftRow : left) {
            for (Row rightRow : right) {
                if (condition.test(leftRow, rightRow)) {
                    result.add(leftRow.mergeFields(rightRow));
                }
            }
        }
        return Table.of(result);
    }

    /**
     * Like {@link #innerJoin} but a left row without any match is emitted as is,
     * without placeholder columns for the right side.
     */
    public static Table leftJoin(Table left, Table right, BiPredicate<Row, Row> condition) {
        List<Row> result = new ArrayList<>();
        for (Row leftRow : left) {
            boolean matched = false;
            for (Row rightRow : right) {
                if (condition.test(leftRow, rightRow)) {
                    result.add(leftRow.mergeFields(rightRow));
                    matched = true;
                }
            }
            if (!matched) {
                result.add(leftRow);
            }
        }
        return Table.of(result);
    }

    /** Cartesian product. */
    public static Table crossJoin(Table left, Table right) {
        List<Row> result = new ArrayList<>(left.size() * right.size());
        for (Row leftRow : left) {
            for (Row rightRow : right) {
                result.add(leftRow.mergeFields(rightRow));
            }
        }
        return Table.of(result);
    }
}
