package com.relengine.query.engine;

import com.google.common.collect.ImmutableMap;
import com.relengine.query.domain.Row;
import com.relengine.query.domain.Table;
import com.relengine.query.exception.MissingColumnException;
import com.relengine.query.processor.Aggregates;
import com.relengine.query.processor.Aggregator;
import com.relengine.query.processor.Grouper;
import com.relengine.query.util.NumericValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;

import static com.relengine.query.config.QueryConfig.FIELD_L_DISCOUNT;
import static com.relengine.query.config.QueryConfig.FIELD_L_EXTENDEDPRICE;
import static com.relengine.query.config.QueryConfig.FIELD_N_NAME;
import static com.relengine.query.config.QueryConfig.FIELD_REVENUE;

/**
 * Derives per-line revenue and sums it per nation.
 */
public class RevenueCalculator {

    private static final Logger LOG = LoggerFactory.getLogger(RevenueCalculator.class);

    private RevenueCalculator() {
    }

    /**
     * Reduces every row to its nation name and {@code L_EXTENDEDPRICE * (1 - L_DISCOUNT)}.
     */
    public static Table project(Table table) {
        List<Row> result = new ArrayList<>(table.size());
        for (Row row : table) {
            String nation = row.getFieldValue(FIELD_N_NAME);
            if (nation == null) {
                throw new MissingColumnException(FIELD_N_NAME);
            }
            result.add(Row.builder()
                    .set(FIELD_N_NAME, nation)
                    .set(FIELD_REVENUE, NumericValues.format(computeRevenue(row)))
                    .build());
        }
        LOG.debug("[RevenueCalculator] Projected {} rows with revenue", result.size());
        return Table.of(result);
    }

    public static double computeRevenue(Row row) {
        double price = NumericValues.parse(row, FIELD_L_EXTENDEDPRICE);
        double discount = NumericValues.parse(row, FIELD_L_DISCOUNT);
        return price * (1.0 - discount);
    }

    /**
     * One row per nation, in ascending nation order, holding the summed revenue.
     */
    public static Table sumByNation(Table revenues) {
        SortedMap<String, Table> groups = Grouper.groupBy(revenues, FIELD_N_NAME);
        Table aggregated = Aggregator.aggregate(groups, FIELD_N_NAME,
                ImmutableMap.of(FIELD_REVENUE, Aggregates.sumOf(FIELD_REVENUE)));
        LOG.debug("[RevenueCalculator] Aggregated revenue for {} nations", aggregated.size());
        return aggregated;
    }
}
