package com.relengine.query.processor;

import com.google.common.collect.ImmutableList;
import com.relengine.query.domain.Row;
import com.relengine.query.domain.Table;
import org.junit.jupiter.api.Test;

import java.util.SortedMap;

import static org.assertj.core.api.Assertions.assertThat;

public class GrouperTest {

    private static final Table TABLE = Table.of(
            Row.of("NATION", "JAPAN", "SEGMENT", "A", "V", "1"),
            Row.of("NATION", "CHINA", "SEGMENT", "B", "V", "2"),
            Row.of("V", "3"),
            Row.of("NATION", "JAPAN", "SEGMENT", "B", "V", "4"),
            Row.of("NATION", "CHINA", "SEGMENT", "B", "V", "5"));

    @Test
    public void testGroupBy() {
        SortedMap<String, Table> groups = Grouper.groupBy(TABLE, "NATION");

        assertThat(groups.keySet()).containsExactly("CHINA", "JAPAN");
        assertThat(groups.get("JAPAN").getRows()).containsExactly(TABLE.getRow(0), TABLE.getRow(3));
        assertThat(groups.get("CHINA").getRows()).containsExactly(TABLE.getRow(1), TABLE.getRow(4));
    }

    @Test
    public void testGroupCountsCoverRowsWithColumn() {
        SortedMap<String, Table> groups = Grouper.groupBy(TABLE, "NATION");

        long grouped = groups.values().stream().mapToLong(Aggregates::count).sum();
        long withColumn = TABLE.getRows().stream().filter(row -> row.hasField("NATION")).count();
        assertThat(grouped).isEqualTo(withColumn);
    }

    @Test
    public void testGroupByMulti() {
        SortedMap<String, Table> groups = Grouper.groupByMulti(TABLE, ImmutableList.of("NATION", "SEGMENT"));

        assertThat(groups.keySet()).containsExactly("", "CHINA|B|", "JAPAN|A|", "JAPAN|B|");
        assertThat(groups.get("CHINA|B|").size()).isEqualTo(2);
        assertThat(groups.get("").getRows()).containsExactly(TABLE.getRow(2));
    }

    @Test
    public void testGroupByMultiAliasesPartialRows() {
        Table table = Table.of(
                Row.of("A", "x", "B", "y"),
                Row.of("A", "x|y"));

        SortedMap<String, Table> groups = Grouper.groupByMulti(table, ImmutableList.of("A", "B"));

        assertThat(groups).hasSize(1);
        assertThat(groups.get("x|y|").size()).isEqualTo(2);
    }
}
