package com.relengine.query.config;

import com.relengine.query.exception.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeParseException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class QueryConfigTest {

    @TempDir
    Path tempDir;

    private ConfigSource source(String... args) {
        return new ConfigSource(CommandLineOptions.parse(args), tempDir.resolve("missing.env"));
    }

    @Test
    public void testFromCommandLine() {
        QueryConfig config = QueryConfig.from(source(
                "--r_name", "ASIA", "--start_date", "1994-01-01", "--end_date", "1995-01-01", "--threads", "4"));

        assertThat(config.getRegionName()).isEqualTo("ASIA");
        assertThat(config.getStartDate()).isEqualTo("1994-01-01");
        assertThat(config.getEndDate()).isEqualTo("1995-01-01");
        assertThat(config.getThreadCount()).isEqualTo(4);
        assertThat(config.getNestedLoopThreshold()).isEqualTo(QueryConfig.DEFAULT_NESTED_LOOP_THRESHOLD);
    }

    @Test
    public void testMissingParameterIsNamed() {
        assertThatThrownBy(() -> QueryConfig.from(source(
                "--r_name", "ASIA", "--end_date", "1995-01-01", "--threads", "4")))
                .isInstanceOfSatisfying(ConfigurationException.class,
                        e -> assertThat(e.getParameter()).isEqualTo(QueryConfig.PARAM_START_DATE));
    }

    @Test
    public void testThreadCountMustBePositiveInteger() {
        assertThatThrownBy(() -> QueryConfig.from(source(
                "--r_name", "ASIA", "--start_date", "1994-01-01", "--end_date", "1995-01-01", "--threads", "0")))
                .isInstanceOfSatisfying(ConfigurationException.class,
                        e -> assertThat(e.getParameter()).isEqualTo(QueryConfig.PARAM_THREADS))
                .hasMessageContaining("positive");
        assertThatThrownBy(() -> QueryConfig.from(source(
                "--r_name", "ASIA", "--start_date", "1994-01-01", "--end_date", "1995-01-01", "--threads", "four")))
                .isInstanceOf(ConfigurationException.class)
                .hasCauseInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> new QueryConfig("ASIA", "1994-01-01", "1995-01-01", -1))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    public void testDatesMustBeZeroPaddedIso() {
        assertThatThrownBy(() -> QueryConfig.from(source(
                "--r_name", "ASIA", "--start_date", "1994-1-1", "--end_date", "1995-01-01", "--threads", "2")))
                .isInstanceOfSatisfying(ConfigurationException.class,
                        e -> assertThat(e.getParameter()).isEqualTo(QueryConfig.PARAM_START_DATE))
                .hasMessageContaining("1994-1-1")
                .hasCauseInstanceOf(DateTimeParseException.class);
        assertThatThrownBy(() -> new QueryConfig("ASIA", "1994-01-01", "1995-13-01", 2))
                .isInstanceOfSatisfying(ConfigurationException.class,
                        e -> assertThat(e.getParameter()).isEqualTo(QueryConfig.PARAM_END_DATE));
    }

    @Test
    public void testNestedLoopThreshold() {
        QueryConfig config = QueryConfig.from(source("--r_name", "ASIA", "--start_date", "1994-01-01", "--end_date", "1995-01-01",
                "--threads", "2", "--nested_loop_threshold", "0"));

        assertThat(config.getNestedLoopThreshold()).isZero();
        assertThatThrownBy(() -> QueryConfig.from(source("--r_name", "ASIA", "--start_date", "1994-01-01", "--end_date", "1995-01-01",
                "--threads", "2", "--nested_loop_threshold", "lots")))
                .isInstanceOfSatisfying(ConfigurationException.class,
                        e -> assertThat(e.getParameter()).isEqualTo(QueryConfig.PARAM_NESTED_LOOP_THRESHOLD));
    }

    @Test
    public void testEnvFileFallback() throws IOException {
        Path envFile = tempDir.resolve(".env");
        Files.write(envFile, String.join("\n",
                "r_name=EUROPE",
                "start_date=1995-01-01",
                "end_date=1996-01-01",
                "threads=3").getBytes(StandardCharsets.UTF_8));

        QueryConfig config = QueryConfig.from(new ConfigSource(CommandLineOptions.parse("--r_name", "ASIA"), envFile));

        assertThat(config.getRegionName()).isEqualTo("ASIA");
        assertThat(config.getStartDate()).isEqualTo("1995-01-01");
        assertThat(config.getThreadCount()).isEqualTo(3);
    }
}
