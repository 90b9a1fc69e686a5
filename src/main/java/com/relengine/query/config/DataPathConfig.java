package com.relengine.query.config;

import com.relengine.query.domain.TpchSchema;
import com.relengine.query.exception.ConfigurationException;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

import static com.relengine.query.util.ValidationUtil.requireParameter;

/**
 * Location of the source tables and of the result file.
 */
public class DataPathConfig {

    public static final String PARAM_TABLE_PATH = "table_path";
    public static final String PARAM_RESULT_PATH = "result_path";
    public static final String PARAM_RESULT_SCALE = "result_scale";

    /** Decimal places written for each revenue value. */
    public static final int DEFAULT_RESULT_SCALE = 4;

    private final Path tablePath;
    private final Path resultPath;
    private final int resultScale;

    public DataPathConfig(Path tablePath, Path resultPath, int resultScale) {
        this.tablePath = tablePath;
        this.resultPath = resultPath;
        this.resultScale = resultScale;
    }

    public static DataPathConfig from(ConfigSource source) {
        return new DataPathConfig(
                toPath(PARAM_TABLE_PATH, source.getProperty(PARAM_TABLE_PATH)),
                toPath(PARAM_RESULT_PATH, source.getProperty(PARAM_RESULT_PATH)),
                parseScale(source.getProperty(PARAM_RESULT_SCALE)));
    }

    private static Path toPath(String name, String value) {
        try {
            return Paths.get(requireParameter(name, value));
        } catch (InvalidPathException e) {
            throw new ConfigurationException(name, "Parameter " + name + " is not a valid path: " + value, e);
        }
    }

    private static int parseScale(String value) {
        if (value == null) {
            return DEFAULT_RESULT_SCALE;
        }
        try {
            int scale = Integer.parseInt(value.trim());
            if (scale < 0) {
                throw new ConfigurationException(PARAM_RESULT_SCALE,
                        "Parameter result_scale must not be negative, got " + scale);
            }
            return scale;
        } catch (NumberFormatException e) {
            throw new ConfigurationException(PARAM_RESULT_SCALE,
                    "Parameter result_scale must be an integer, got '" + value + "'", e);
        }
    }

    /** {@code <table_path>/<table>.tbl} */
    public Path getTableFile(TpchSchema schema) {
        return tablePath.resolve(schema.getFileName());
    }

    public Path getResultPath() {
        return resultPath;
    }

    public int getResultScale() {
        return resultScale;
    }
}
