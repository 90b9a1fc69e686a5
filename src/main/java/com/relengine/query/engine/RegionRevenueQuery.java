package com.relengine.query.engine;

import com.relengine.query.config.QueryConfig;
import com.relengine.query.domain.QueryResult;
import com.relengine.query.domain.Row;
import com.relengine.query.domain.Table;
import com.relengine.query.domain.TpchTables;
import com.relengine.query.exception.EmptyMatchException;
import com.relengine.query.processor.NestedLoopJoiner;
import com.relengine.query.processor.ParallelHashJoiner;
import com.relengine.query.processor.Predicates;
import com.relengine.query.processor.RowFilter;
import com.relengine.query.processor.RowSorter;
import com.relengine.query.util.NumericValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.relengine.query.config.QueryConfig.FIELD_C_CUSTKEY;
import static com.relengine.query.config.QueryConfig.FIELD_C_NATIONKEY;
import static com.relengine.query.config.QueryConfig.FIELD_L_ORDERKEY;
import static com.relengine.query.config.QueryConfig.FIELD_L_SUPPKEY;
import static com.relengine.query.config.QueryConfig.FIELD_N_NAME;
import static com.relengine.query.config.QueryConfig.FIELD_N_NATIONKEY;
import static com.relengine.query.config.QueryConfig.FIELD_N_REGIONKEY;
import static com.relengine.query.config.QueryConfig.FIELD_O_CUSTKEY;
import static com.relengine.query.config.QueryConfig.FIELD_O_ORDERDATE;
import static com.relengine.query.config.QueryConfig.FIELD_O_ORDERKEY;
import static com.relengine.query.config.QueryConfig.FIELD_REVENUE;
import static com.relengine.query.config.QueryConfig.FIELD_R_NAME;
import static com.relengine.query.config.QueryConfig.FIELD_R_REGIONKEY;
import static com.relengine.query.config.QueryConfig.FIELD_S_NATIONKEY;
import static com.relengine.query.config.QueryConfig.FIELD_S_SUPPKEY;

/**
 * Revenue of local suppliers per nation of one region (TPC-H query 5).
 *
 * <pre>
 * SELECT n_name, SUM(l_extendedprice * (1 - l_discount)) AS revenue
 * FROM customer, orders, lineitem, supplier, nation, region
 * WHERE c_custkey = o_custkey AND l_orderkey = o_orderkey AND l_suppkey = s_suppkey
 *   AND c_nationkey = s_nationkey AND s_nationkey = n_nationkey AND n_regionkey = r_regionkey
 *   AND r_name = :region AND o_orderdate >= :start AND o_orderdate < :end
 * GROUP BY n_name
 * ORDER BY revenue DESC
 * </pre>
 */
public class RegionRevenueQuery {

    private static final Logger LOG = LoggerFactory.getLogger(RegionRevenueQuery.class);

    private final QueryConfig config;

    public RegionRevenueQuery(QueryConfig config) {
        this.config = config;
    }

    /**
     * @throws EmptyMatchException if no region carries the configured name
     */
    public QueryResult execute(TpchTables tables) {
        LOG.info("[Query] Executing with {}", config);

        Table region = RowFilter.filter(tables.getRegion(), Predicates.equalTo(FIELD_R_NAME, config.getRegionName()));
        if (region.isEmpty()) {
            throw new EmptyMatchException("region", FIELD_R_NAME, config.getRegionName());
        }
        logStage("region", region);

        Table nationRegion = join(tables.getNation(), region, FIELD_N_REGIONKEY, FIELD_R_REGIONKEY);
        logStage("nation-region", nationRegion);

        Table customerNation = join(tables.getCustomer(), nationRegion, FIELD_C_NATIONKEY, FIELD_N_NATIONKEY);
        logStage("customer-nation", customerNation);

        Table orders = RowFilter.filter(tables.getOrders(),
                Predicates.between(FIELD_O_ORDERDATE, config.getStartDate(), config.getEndDate()));
        logStage("orders in date range", orders);

        Table customerOrders = join(customerNation, orders, FIELD_C_CUSTKEY, FIELD_O_CUSTKEY);
        logStage("customer-orders", customerOrders);

        Table supplierNation = join(tables.getSupplier(), nationRegion, FIELD_S_NATIONKEY, FIELD_N_NATIONKEY);
        logStage("supplier-nation", supplierNation);

        // lineitem is the largest table, always probe it in parallel
        Table lineitemOrders = ParallelHashJoiner.innerJoin(tables.getLineitem(), customerOrders,
                FIELD_L_ORDERKEY, FIELD_O_ORDERKEY, config.getThreadCount());
        logStage("lineitem-orders", lineitemOrders);

        // c_nationkey = s_nationkey cannot be expressed as a single equi-join key
        Table lineitemSupplier = join(lineitemOrders, supplierNation, FIELD_L_SUPPKEY, FIELD_S_SUPPKEY);
        Table localSupplier = RowFilter.filter(lineitemSupplier,
                Predicates.columnsEqual(FIELD_C_NATIONKEY, FIELD_S_NATIONKEY));
        logStage("local supplier lines", localSupplier);

        Table revenues = RevenueCalculator.project(localSupplier);
        Table aggregated = RevenueCalculator.sumByNation(revenues);
        Table sorted = RowSorter.orderByNumeric(aggregated, FIELD_REVENUE, false);

        Map<String, Double> revenueByNation = new LinkedHashMap<>();
        for (Row row : sorted) {
            revenueByNation.put(row.getFieldValue(FIELD_N_NAME), NumericValues.parse(row, FIELD_REVENUE));
        }
        QueryResult result = new QueryResult(revenueByNation);
        LOG.info("[Query] Result: {} nations", result.size());
        return result;
    }

    /**
     * Nested loop for small inputs, concurrent hash join otherwise. Both produce
     * rows in left order, then right order.
     */
    Table join(Table left, Table right, String leftColumn, String rightColumn) {
        long pairs = (long) left.size() * right.size();
        if (pairs <= config.getNestedLoopThreshold()) {
            LOG.debug("[Query] Nested loop join {}={} over {} pairs", leftColumn, rightColumn, pairs);
            return NestedLoopJoiner.innerJoin(left, right, Predicates.joinOn(leftColumn, rightColumn));
        }
        return ParallelHashJoiner.innerJoin(left, right, leftColumn, rightColumn, config.getThreadCount());
    }

    private static void logStage(String stage, Table table) {
        LOG.debug("[Query] {}: {} rows", stage, table.size());
    }
}
