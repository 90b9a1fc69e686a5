package com.relengine.query.sink;

import com.relengine.query.domain.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes the query result as pipe-delimited text, highest revenue first.
 */
public class ResultWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ResultWriter.class);

    static final String HEADER = "N_NAME|REVENUE";
    private static final String DELIMITER = "|";

    private final int scale;

    public ResultWriter(int scale) {
        this.scale = scale;
    }

    public void write(QueryResult result, Path outputPath) throws IOException {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        List<Map.Entry<String, Double>> entries = new ArrayList<>(result.getRevenueByNation().entrySet());
        entries.sort(Map.Entry.<String, Double>comparingByValue().reversed());

        try (BufferedWriter writer = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
            writer.write(HEADER);
            writer.newLine();
            for (Map.Entry<String, Double> entry : entries) {
                writer.write(formatLine(entry.getKey(), entry.getValue()));
                writer.newLine();
            }
        }
        LOG.info("[ResultWriter] Wrote {} result lines to {}", entries.size(), outputPath);
    }

    String formatLine(String nation, double revenue) {
        if (Double.isNaN(revenue) || Double.isInfinite(revenue)) {
            return nation + DELIMITER + revenue;
        }
        return nation + DELIMITER + BigDecimal.valueOf(revenue).setScale(scale, RoundingMode.HALF_UP).toPlainString();
    }
}
