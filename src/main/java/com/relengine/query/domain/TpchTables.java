package com.relengine.query.domain;

import java.util.EnumMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkState;

/**
 * The six source tables of the regional revenue query, keyed by schema.
 */
public class TpchTables {

    private final Map<TpchSchema, Table> tables;

    private TpchTables(Map<TpchSchema, Table> tables) {
        this.tables = tables;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Table get(TpchSchema schema) {
        return tables.get(schema);
    }

    public Table getRegion() {
        return get(TpchSchema.REGION);
    }

    public Table getNation() {
        return get(TpchSchema.NATION);
    }

    public Table getCustomer() {
        return get(TpchSchema.CUSTOMER);
    }

    public Table getOrders() {
        return get(TpchSchema.ORDERS);
    }

    public Table getLineitem() {
        return get(TpchSchema.LINEITEM);
    }

    public Table getSupplier() {
        return get(TpchSchema.SUPPLIER);
    }

    public static class Builder {

        private final Map<TpchSchema, Table> tables = new EnumMap<>(TpchSchema.class);

        public Builder put(TpchSchema schema, Table table) {
            tables.put(schema, table);
            return this;
        }

        public TpchTables build() {
            for (TpchSchema schema : TpchSchema.values()) {
                checkState(tables.containsKey(schema), "Table %s was not provided", schema.getTableName());
            }
            return new TpchTables(new EnumMap<>(tables));
        }
    }
}
