package com.relengine.query.domain;

import com.google.common.collect.ImmutableList;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * An immutable, ordered sequence of rows. Operators never modify a table,
 * they return a new one.
 */
public final class Table implements Iterable<Row> {

    private static final Table EMPTY = new Table(ImmutableList.of());

    private final ImmutableList<Row> rows;

    private Table(ImmutableList<Row> rows) {
        this.rows = rows;
    }

    public static Table empty() {
        return EMPTY;
    }

    public static Table of(List<Row> rows) {
        return rows.isEmpty() ? EMPTY : new Table(ImmutableList.copyOf(rows));
    }

    public static Table of(Row... rows) {
        return of(ImmutableList.copyOf(rows));
    }

    public List<Row> getRows() {
        return rows;
    }

    public Row getRow(int index) {
        return rows.get(index);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    @Override
    public Iterator<Row> iterator() {
        return rows.iterator();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Table that = (Table) obj;
        return Objects.equals(rows, that.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rows);
    }

    @Override
    public String toString() {
        return "Table" + rows;
    }
}
