package com.relengine.query.domain;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Column layout of the TPC-H tables read by the engine.
 * Columns are listed in file order.
 */
public enum TpchSchema {

    REGION("region", "R_REGIONKEY", "R_NAME", "R_COMMENT"),

    NATION("nation", "N_NATIONKEY", "N_NAME", "N_REGIONKEY", "N_COMMENT"),

    CUSTOMER("customer", "C_CUSTKEY", "C_NAME", "C_ADDRESS", "C_NATIONKEY",
            "C_PHONE", "C_ACCTBAL", "C_MKTSEGMENT", "C_COMMENT"),

    ORDERS("orders", "O_ORDERKEY", "O_CUSTKEY", "O_ORDERSTATUS", "O_TOTALPRICE",
            "O_ORDERDATE", "O_ORDERPRIORITY", "O_CLERK", "O_SHIPPRIORITY", "O_COMMENT"),

    LINEITEM("lineitem", "L_ORDERKEY", "L_PARTKEY", "L_SUPPKEY", "L_LINENUMBER",
            "L_QUANTITY", "L_EXTENDEDPRICE", "L_DISCOUNT", "L_TAX", "L_RETURNFLAG",
            "L_LINESTATUS", "L_SHIPDATE", "L_COMMITDATE", "L_RECEIPTDATE",
            "L_SHIPINSTRUCT", "L_SHIPMODE", "L_COMMENT"),

    SUPPLIER("supplier", "S_SUPPKEY", "S_NAME", "S_ADDRESS", "S_NATIONKEY",
            "S_PHONE", "S_ACCTBAL", "S_COMMENT");

    private static final String FILE_EXTENSION = ".tbl";

    private final String tableName;
    private final ImmutableList<String> columns;

    TpchSchema(String tableName, String... columns) {
        this.tableName = tableName;
        this.columns = ImmutableList.copyOf(columns);
    }

    public String getTableName() {
        return tableName;
    }

    public String getFileName() {
        return tableName + FILE_EXTENSION;
    }

    public List<String> getColumns() {
        return columns;
    }
}
