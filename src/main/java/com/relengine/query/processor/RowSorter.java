package com.relengine.query.processor;

import com.google.common.collect.ImmutableList;
import com.relengine.query.domain.Row;
import com.relengine.query.domain.Table;
import com.relengine.query.exception.MissingColumnException;
import com.relengine.query.util.NumericValues;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * ORDER BY. All sorts are stable: rows that compare equal keep their prior order.
 */
public class RowSorter {

    private RowSorter() {
    }

    /**
     * Sorts by the text value of a column.
     *
     * @throws MissingColumnException if a compared row lacks the column
     */
    public static Table orderBy(Table table, String column, boolean ascending) {
        return orderByMulti(table, ImmutableList.of(SortKey.of(column, ascending)));
    }

    /**
     * Sorts by the numeric value of a column.
     *
     * @throws com.relengine.query.exception.NumericParseException if a compared
     *         row lacks the column or holds non-numeric text
     */
    public static Table orderByNumeric(Table table, String column, boolean ascending) {
        if (table.size() < 2) {
            return table;
        }
        // every row takes part in at least one comparison, so parse them all up front
        List<ParsedRow> parsed = new ArrayList<>(table.size());
        for (Row row : table) {
            parsed.add(new ParsedRow(row, NumericValues.parse(row, column)));
        }
        Comparator<ParsedRow> comparator = Comparator.comparingDouble(ParsedRow::getKey);
        parsed.sort(ascending ? comparator : comparator.reversed());

        List<Row> result = new ArrayList<>(parsed.size());
        for (ParsedRow entry : parsed) {
            result.add(entry.getRow());
        }
        return Table.of(result);
    }

    /**
     * Sorts by several columns; a later key only breaks ties of the earlier ones.
     */
    public static Table orderByMulti(Table table, List<SortKey> keys) {
        if (table.size() < 2 || keys.isEmpty()) {
            return table;
        }
        List<SortKey> sortKeys = ImmutableList.copyOf(keys);
        List<Row> rows = new ArrayList<>(table.getRows());
        rows.sort((a, b) -> {
            for (SortKey key : sortKeys) {
                int cmp = textValue(a, key.getColumn()).compareTo(textValue(b, key.getColumn()));
                if (cmp != 0) {
                    return key.isAscending() ? cmp : -cmp;
                }
            }
            return 0;
        });
        return Table.of(rows);
    }

    private static String textValue(Row row, String column) {
        String value = row.getFieldValue(column);
        if (value == null) {
            throw new MissingColumnException(column);
        }
        return value;
    }

    private static final class ParsedRow {

        private final Row row;
        private final double key;

        ParsedRow(Row row, double key) {
            this.row = row;
            this.key = key;
        }

        Row getRow() {
            return row;
        }

        double getKey() {
            return key;
        }
    }
}
