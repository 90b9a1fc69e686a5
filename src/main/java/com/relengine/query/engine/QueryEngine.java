package com.relengine.query.engine;

import com.google.common.base.Stopwatch;
import com.relengine.query.config.CommandLineOptions;
import com.relengine.query.config.ConfigSource;
import com.relengine.query.config.DataPathConfig;
import com.relengine.query.config.QueryConfig;
import com.relengine.query.domain.QueryResult;
import com.relengine.query.domain.TpchTables;
import com.relengine.query.exception.ConfigurationException;
import com.relengine.query.exception.QueryException;
import com.relengine.query.sink.ResultWriter;
import com.relengine.query.source.TableReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Command line entry point: reads the TPC-H tables, runs the regional revenue
 * query and writes the result file.
 */
public class QueryEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(QueryEngine.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String... args) {
        QueryConfig queryConfig;
        DataPathConfig pathConfig;
        try {
            ConfigSource source = new ConfigSource(CommandLineOptions.parse(args));
            queryConfig = QueryConfig.from(source);
            pathConfig = DataPathConfig.from(source);
        } catch (ConfigurationException e) {
            LOGGER.error("Invalid parameter '{}': {}", e.getParameter(), e.getMessage());
            return EXIT_FAILURE;
        }
        return run(queryConfig, pathConfig);
    }

    static int run(QueryConfig queryConfig, DataPathConfig pathConfig) {
        try {
            TpchTables tables = TableReader.readAll(pathConfig);

            Stopwatch stopwatch = Stopwatch.createStarted();
            QueryResult result = new RegionRevenueQuery(queryConfig).execute(tables);
            new ResultWriter(pathConfig.getResultScale()).write(result, pathConfig.getResultPath());

            LOGGER.info("Query completed in {} ms", stopwatch.elapsed(TimeUnit.MILLISECONDS));
            return EXIT_SUCCESS;
        } catch (QueryException e) {
            LOGGER.error("Query failed: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        } catch (IOException e) {
            LOGGER.error("Failed to write results to {}", pathConfig.getResultPath(), e);
            return EXIT_FAILURE;
        }
    }
}
