package com.relengine.query.processor;

import java.util.Objects;

/**
 * One column of a multi-column ORDER BY.
 */
public final class SortKey {

    private final String column;
    private final boolean ascending;

    private SortKey(String column, boolean ascending) {
        this.column = Objects.requireNonNull(column, "column is null");
        this.ascending = ascending;
    }

    public static SortKey asc(String column) {
        return new SortKey(column, true);
    }

    public static SortKey desc(String column) {
        return new SortKey(column, false);
    }

    public static SortKey of(String column, boolean ascending) {
        return new SortKey(column, ascending);
    }

    public String getColumn() {
        return column;
    }

    public boolean isAscending() {
        return ascending;
    }

    @Override
    public String toString() {
        return column + (ascending ? " ASC" : " DESC");
    }
}
