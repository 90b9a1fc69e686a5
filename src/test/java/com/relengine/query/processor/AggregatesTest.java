package com.relengine.query.processor;

import com.relengine.query.domain.Row;
import com.relengine.query.domain.Table;
import com.relengine.query.exception.NumericParseException;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.SortedMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class AggregatesTest {

    private static final Table GROUP = Table.of(
            Row.of("V", "1.5"),
            Row.of("V", "4"),
            Row.of("OTHER", "x"),
            Row.of("V", "-2"),
            Row.of("V", ""));

    @Test
    public void testSumTreatsAbsenceAsZero() {
        Table group = Table.of(Row.of("V", "1.5"), Row.of("OTHER", "x"), Row.of("V", "2.5"));

        assertThat(Aggregates.sum(group, "V")).isEqualTo(4.0);
        assertThat(Aggregates.sum(Table.empty(), "V")).isEqualTo(0.0);
    }

    @Test
    public void testSumFailsOnPresentNonNumericText() {
        assertThatThrownBy(() -> Aggregates.sum(GROUP, "V"))
                .isInstanceOfSatisfying(NumericParseException.class, e -> assertThat(e.getText()).isEmpty());
    }

    @Test
    public void testCount() {
        assertThat(Aggregates.count(GROUP)).isEqualTo(5);
        assertThat(Aggregates.countColumn(GROUP, "V")).isEqualTo(3);
        assertThat(Aggregates.countColumn(GROUP, "OTHER")).isEqualTo(1);
        assertThat(Aggregates.count(Table.empty())).isZero();
    }

    @Test
    public void testAvgDividesByGroupSize() {
        Table group = Table.of(Row.of("V", "3"), Row.of("OTHER", "x"), Row.of("V", "6"));

        assertThat(Aggregates.avg(group, "V")).isEqualTo(3.0);
        assertThat(Aggregates.avg(Table.empty(), "V")).isEqualTo(0.0);
    }

    @Test
    public void testAvgTimesCountIsSum() {
        Table table = Table.of(
                Row.of("K", "a", "V", "0.1"),
                Row.of("K", "a", "V", "0.7"),
                Row.of("K", "b", "V", "3.3"),
                Row.of("K", "a"),
                Row.of("K", "b", "V", "1e3"));

        SortedMap<String, Table> groups = Grouper.groupBy(table, "K");
        for (Map.Entry<String, Table> group : groups.entrySet()) {
            Table rows = group.getValue();
            assertThat(Aggregates.avg(rows, "V") * Aggregates.count(rows))
                    .isCloseTo(Aggregates.sum(rows, "V"), within(1e-9));
        }
    }

    @Test
    public void testMaxAndMin() {
        Table group = Table.of(Row.of("V", "2"), Row.of("OTHER", "x"), Row.of("V", "10"), Row.of("V", "-3.5"));

        assertThat(Aggregates.max(group, "V")).isEqualTo(10.0);
        assertThat(Aggregates.min(group, "V")).isEqualTo(-3.5);
        assertThat(Aggregates.max(Table.empty(), "V")).isEqualTo(0.0);
        assertThat(Aggregates.min(Table.empty(), "V")).isEqualTo(0.0);
    }

    @Test
    public void testMaxAndMinNeedFirstRowValue() {
        Table group = Table.of(Row.of("OTHER", "x"), Row.of("V", "10"));

        assertThatThrownBy(() -> Aggregates.max(group, "V")).isInstanceOf(NumericParseException.class);
        assertThatThrownBy(() -> Aggregates.min(group, "V")).isInstanceOf(NumericParseException.class);
    }

    @Test
    public void testFunctionFactories() {
        Table group = Table.of(Row.of("V", "2"), Row.of("V", "6"), Row.of("V", ""));
        Table numeric = Table.of(Row.of("V", "2"), Row.of("V", "6"));

        assertThat(Aggregates.countAll().apply(group)).isEqualTo(3.0);
        assertThat(Aggregates.countOf("V").apply(group)).isEqualTo(2.0);
        assertThat(Aggregates.sumOf("V").apply(numeric)).isEqualTo(8.0);
        assertThat(Aggregates.avgOf("V").apply(numeric)).isEqualTo(4.0);
        assertThat(Aggregates.maxOf("V").apply(numeric)).isEqualTo(6.0);
        assertThat(Aggregates.minOf("V").apply(numeric)).isEqualTo(2.0);
    }
}
