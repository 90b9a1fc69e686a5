package com.relengine.query.config;

import com.relengine.query.exception.ConfigurationException;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

import static com.relengine.query.util.ValidationUtil.requireParameter;
import static com.relengine.query.util.ValidationUtil.requirePositiveInt;

/**
 * Parameters of the regional revenue query, and the column names it uses.
 */
public class QueryConfig {

    // Parameter names
    public static final String PARAM_REGION_NAME = "r_name";
    public static final String PARAM_START_DATE = "start_date";
    public static final String PARAM_END_DATE = "end_date";
    public static final String PARAM_THREADS = "threads";
    public static final String PARAM_NESTED_LOOP_THRESHOLD = "nested_loop_threshold";

    /** Largest |left| * |right| joined with a nested loop instead of the hash join. */
    public static final long DEFAULT_NESTED_LOOP_THRESHOLD = 10_000L;

    // Field name constants
    public static final String FIELD_R_REGIONKEY = "R_REGIONKEY";
    public static final String FIELD_R_NAME = "R_NAME";
    public static final String FIELD_N_NATIONKEY = "N_NATIONKEY";
    public static final String FIELD_N_NAME = "N_NAME";
    public static final String FIELD_N_REGIONKEY = "N_REGIONKEY";
    public static final String FIELD_C_CUSTKEY = "C_CUSTKEY";
    public static final String FIELD_C_NATIONKEY = "C_NATIONKEY";
    public static final String FIELD_O_ORDERKEY = "O_ORDERKEY";
    public static final String FIELD_O_CUSTKEY = "O_CUSTKEY";
    public static final String FIELD_O_ORDERDATE = "O_ORDERDATE";
    public static final String FIELD_L_ORDERKEY = "L_ORDERKEY";
    public static final String FIELD_L_SUPPKEY = "L_SUPPKEY";
    public static final String FIELD_L_EXTENDEDPRICE = "L_EXTENDEDPRICE";
    public static final String FIELD_L_DISCOUNT = "L_DISCOUNT";
    public static final String FIELD_S_SUPPKEY = "S_SUPPKEY";
    public static final String FIELD_S_NATIONKEY = "S_NATIONKEY";
    public static final String FIELD_REVENUE = "REVENUE";

    private final String regionName;
    private final String startDate;
    private final String endDate;
    private final int threadCount;
    private final long nestedLoopThreshold;

    public QueryConfig(String regionName, String startDate, String endDate, int threadCount, long nestedLoopThreshold) {
        this.regionName = requireParameter(PARAM_REGION_NAME, regionName);
        this.startDate = requireDate(PARAM_START_DATE, startDate);
        this.endDate = requireDate(PARAM_END_DATE, endDate);
        if (threadCount <= 0) {
            throw new ConfigurationException(PARAM_THREADS, "Parameter threads must be positive, got " + threadCount);
        }
        if (nestedLoopThreshold < 0) {
            throw new ConfigurationException(PARAM_NESTED_LOOP_THRESHOLD,
                    "Parameter nested_loop_threshold must not be negative, got " + nestedLoopThreshold);
        }
        this.threadCount = threadCount;
        this.nestedLoopThreshold = nestedLoopThreshold;
    }

    public QueryConfig(String regionName, String startDate, String endDate, int threadCount) {
        this(regionName, startDate, endDate, threadCount, DEFAULT_NESTED_LOOP_THRESHOLD);
    }

    public static QueryConfig from(ConfigSource source) {
        return new QueryConfig(
                source.getProperty(PARAM_REGION_NAME),
                source.getProperty(PARAM_START_DATE),
                source.getProperty(PARAM_END_DATE),
                requirePositiveInt(PARAM_THREADS, source.getProperty(PARAM_THREADS)),
                parseThreshold(source.getProperty(PARAM_NESTED_LOOP_THRESHOLD)));
    }

    /**
     * Dates are compared as text, so only the zero-padded ISO form is accepted.
     */
    private static String requireDate(String name, String value) {
        String date = requireParameter(name, value);
        try {
            LocalDate.parse(date);
        } catch (DateTimeParseException e) {
            throw new ConfigurationException(name,
                    "Parameter " + name + " must be a YYYY-MM-DD date, got '" + date + "'", e);
        }
        return date;
    }

    private static long parseThreshold(String value) {
        if (value == null) {
            return DEFAULT_NESTED_LOOP_THRESHOLD;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(PARAM_NESTED_LOOP_THRESHOLD,
                    "Parameter nested_loop_threshold must be an integer, got '" + value + "'", e);
        }
    }

    public String getRegionName() {
        return regionName;
    }

    public String getStartDate() {
        return startDate;
    }

    public String getEndDate() {
        return endDate;
    }

    public int getThreadCount() {
        return threadCount;
    }

    public long getNestedLoopThreshold() {
        return nestedLoopThreshold;
    }

    @Override
    public String toString() {
        return String.format("QueryConfig{region=%s, dates=[%s, %s), threads=%d, nestedLoopThreshold=%d}",
                regionName, startDate, endDate, threadCount, nestedLoopThreshold);
    }
}
