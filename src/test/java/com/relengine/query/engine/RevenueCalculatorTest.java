package com.relengine.query.engine;

import com.relengine.query.domain.Row;
import com.relengine.query.domain.Table;
import com.relengine.query.exception.MissingColumnException;
import com.relengine.query.exception.NumericParseException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class RevenueCalculatorTest {

    @Test
    public void testProjectKeepsNationAndRevenueOnly() {
        Table table = Table.of(Row.of("N_NAME", "JAPAN", "L_EXTENDEDPRICE", "200", "L_DISCOUNT", "0.25", "C_CUSTKEY", "1"));

        Table result = RevenueCalculator.project(table);

        assertThat(result.getRows()).containsExactly(Row.of("N_NAME", "JAPAN", "REVENUE", "150.0"));
    }

    @Test
    public void testProjectFailures() {
        assertThatThrownBy(() -> RevenueCalculator.project(Table.of(Row.of("N_NAME", "JAPAN", "L_EXTENDEDPRICE", "1"))))
                .isInstanceOfSatisfying(NumericParseException.class, e -> assertThat(e.getColumn()).isEqualTo("L_DISCOUNT"));
        assertThatThrownBy(() -> RevenueCalculator.project(Table.of(Row.of("L_EXTENDEDPRICE", "1", "L_DISCOUNT", "0"))))
                .isInstanceOfSatisfying(MissingColumnException.class, e -> assertThat(e.getColumn()).isEqualTo("N_NAME"));
    }

    @Test
    public void testSumByNation() {
        Table revenues = Table.of(
                Row.of("N_NAME", "JAPAN", "REVENUE", "10.5"),
                Row.of("N_NAME", "CHINA", "REVENUE", "3"),
                Row.of("N_NAME", "JAPAN", "REVENUE", "4.5"));

        Table result = RevenueCalculator.sumByNation(revenues);

        assertThat(result.getRows())
                .extracting(row -> row.getFieldValue("N_NAME"))
                .containsExactly("CHINA", "JAPAN");
        assertThat(Double.parseDouble(result.getRow(1).getFieldValue("REVENUE"))).isCloseTo(15.0, within(1e-9));
    }
}
