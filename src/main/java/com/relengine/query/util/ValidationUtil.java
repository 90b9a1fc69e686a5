package com.relengine.query.util;

import com.relengine.query.exception.ConfigurationException;

/**
 * Utility class for parameter validation.
 */
public class ValidationUtil {

    private ValidationUtil() {
    }

    public static boolean isNullOrEmpty(String str) {
        return str == null || str.trim().isEmpty();
    }

    public static String requireParameter(String name, String value) {
        if (isNullOrEmpty(value)) {
            throw new ConfigurationException(name, "Missing required parameter: " + name);
        }
        return value.trim();
    }

    public static int requirePositiveInt(String name, String value) {
        int parsed;
        try {
            parsed = Integer.parseInt(requireParameter(name, value));
        } catch (NumberFormatException e) {
            throw new ConfigurationException(name,
                    String.format("Parameter %s must be an integer, got '%s'", name, value), e);
        }
        if (parsed <= 0) {
            throw new ConfigurationException(name,
                    String.format("Parameter %s must be positive, got %d", name, parsed));
        }
        return parsed;
    }
}
