package com.relengine.query.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Final output of the regional revenue query: revenue per nation,
 * iterated in descending revenue order.
 */
public class QueryResult {

    private final Map<String, Double> revenueByNation;

    public QueryResult(Map<String, Double> revenueByNation) {
        this.revenueByNation = Collections.unmodifiableMap(new LinkedHashMap<>(revenueByNation));
    }

    public Map<String, Double> getRevenueByNation() {
        return revenueByNation;
    }

    public Double getRevenue(String nation) {
        return revenueByNation.get(nation);
    }

    public boolean isEmpty() {
        return revenueByNation.isEmpty();
    }

    public int size() {
        return revenueByNation.size();
    }

    @Override
    public String toString() {
        return "QueryResult" + revenueByNation;
    }
}
