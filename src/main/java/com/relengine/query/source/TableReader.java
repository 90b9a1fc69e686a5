package com.relengine.query.source;

import com.google.common.base.Splitter;
import com.relengine.query.config.DataPathConfig;
import com.relengine.query.domain.Row;
import com.relengine.query.domain.Table;
import com.relengine.query.domain.TpchSchema;
import com.relengine.query.domain.TpchTables;
import com.relengine.query.exception.IngestionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads pipe-delimited table files. Fields are matched to columns by position;
 * fields beyond the column list are ignored.
 */
public class TableReader {

    private static final Logger LOG = LoggerFactory.getLogger(TableReader.class);

    private static final Splitter FIELD_SPLITTER = Splitter.on('|');

    private TableReader() {
    }

    /**
     * @throws IngestionException if the file cannot be read or a line has fewer fields than columns
     */
    public static Table read(Path file, List<String> columns) {
        List<Row> rows = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                List<String> fields = FIELD_SPLITTER.splitToList(line);
                if (fields.size() < columns.size()) {
                    throw new IngestionException(file, String.format(
                            "Line %d of %s has %d fields, expected at least %d",
                            lineNumber, file, fields.size(), columns.size()));
                }
                Row.Builder row = Row.builder();
                for (int i = 0; i < columns.size(); i++) {
                    row.set(columns.get(i), fields.get(i));
                }
                rows.add(row.build());
            }
        } catch (IOException e) {
            throw new IngestionException(file, "Failed to read table file " + file, e);
        }
        LOG.debug("Read {} rows from {}", rows.size(), file);
        return Table.of(rows);
    }

    public static Table read(Path file, TpchSchema schema) {
        return read(file, schema.getColumns());
    }

    /**
     * Loads every TPC-H table from the configured directory.
     */
    public static TpchTables readAll(DataPathConfig paths) {
        TpchTables.Builder tables = TpchTables.builder();
        for (TpchSchema schema : TpchSchema.values()) {
            Table table = read(paths.getTableFile(schema), schema);
            LOG.info("Loaded table {}: {} rows", schema.getTableName(), table.size());
            tables.put(schema, table);
        }
        return tables.build();
    }
}
