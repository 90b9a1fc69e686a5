package com.relengine.query.config;

import com.relengine.query.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CommandLineOptionsTest {

    @Test
    public void testParsePairs() {
        CommandLineOptions options = CommandLineOptions.parse(
                "--r_name", "ASIA", "--threads", "4", "--start_date", "1994-01-01");

        assertThat(options.get("r_name")).isEqualTo("ASIA");
        assertThat(options.get("threads")).isEqualTo("4");
        assertThat(options.get("start_date")).isEqualTo("1994-01-01");
        assertThat(options.get("end_date")).isNull();
        assertThat(options.asMap()).hasSize(3);
    }

    @Test
    public void testEmptyArguments() {
        assertThat(CommandLineOptions.parse().asMap()).isEmpty();
    }

    @Test
    public void testMissingValue() {
        assertThatThrownBy(() -> CommandLineOptions.parse("--r_name"))
                .isInstanceOfSatisfying(ConfigurationException.class, e -> assertThat(e.getParameter()).isEqualTo("r_name"));
        assertThatThrownBy(() -> CommandLineOptions.parse("--r_name", "--threads", "4"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("--threads");
    }

    @Test
    public void testMalformedKey() {
        assertThatThrownBy(() -> CommandLineOptions.parse("r_name", "ASIA"))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> CommandLineOptions.parse("--", "ASIA"))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    public void testDuplicateKey() {
        assertThatThrownBy(() -> CommandLineOptions.parse("--threads", "4", "--threads", "8"))
                .isInstanceOfSatisfying(ConfigurationException.class, e -> assertThat(e.getParameter()).isEqualTo("threads"))
                .hasMessageContaining("more than once");
    }
}
