package com.relengine.query.config;

import com.relengine.query.exception.ConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses {@code --key value} command line pairs.
 * Example: {@code --r_name ASIA --start_date 1994-01-01 --end_date 1995-01-01 --threads 4
 * --table_path /data/tpch --result_path /tmp/result.tbl}
 */
public class CommandLineOptions {

    private static final String OPTION_PREFIX = "--";

    private final Map<String, String> options;

    private CommandLineOptions(Map<String, String> options) {
        this.options = Collections.unmodifiableMap(options);
    }

    public static CommandLineOptions parse(String... args) {
        Map<String, String> options = new LinkedHashMap<>();
        int i = 0;
        while (i < args.length) {
            String arg = args[i];
            if (!arg.startsWith(OPTION_PREFIX) || arg.length() == OPTION_PREFIX.length()) {
                throw new ConfigurationException(arg, "Expected an option of the form --key, got '" + arg + "'");
            }
            String key = arg.substring(OPTION_PREFIX.length());
            if (i + 1 >= args.length) {
                throw new ConfigurationException(key, "Option --" + key + " has no value");
            }
            String value = args[i + 1];
            if (value.startsWith(OPTION_PREFIX)) {
                throw new ConfigurationException(key, "Option --" + key + " has no value, found option " + value);
            }
            if (options.putIfAbsent(key, value) != null) {
                throw new ConfigurationException(key, "Option --" + key + " given more than once");
            }
            i += 2;
        }
        return new CommandLineOptions(options);
    }

    public String get(String key) {
        return options.get(key);
    }

    public Map<String, String> asMap() {
        return options;
    }
}
