package com.relengine.query.processor;

import com.relengine.query.domain.Table;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * LIMIT and OFFSET. Bounds past the end of the table are clamped.
 */
public class Paginator {

    private Paginator() {
    }

    public static Table limit(Table table, int n) {
        checkArgument(n >= 0, "limit must not be negative: %s", n);
        if (table.size() <= n) {
            return table;
        }
        return Table.of(table.getRows().subList(0, n));
    }

    public static Table offset(Table table, int n) {
        checkArgument(n >= 0, "offset must not be negative: %s", n);
        if (table.size() <= n) {
            return Table.empty();
        }
        return Table.of(table.getRows().subList(n, table.size()));
    }

    /** {@code LIMIT limit OFFSET offset} */
    public static Table limitOffset(Table table, int limit, int offset) {
        checkArgument(limit >= 0, "limit must not be negative: %s", limit);
        checkArgument(offset >= 0, "offset must not be negative: %s", offset);
        if (table.size() <= offset) {
            return Table.empty();
        }
        int end = (int) Math.min((long) offset + limit, table.size());
        return Table.of(table.getRows().subList(offset, end));
    }
}
