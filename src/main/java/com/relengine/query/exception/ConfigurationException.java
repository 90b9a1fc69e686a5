package com.relengine.query.exception;

/**
 * A required parameter is missing or malformed.
 */
public class ConfigurationException extends QueryException {

    private static final long serialVersionUID = 1L;

    private final String parameter;

    public ConfigurationException(String parameter, String message) {
        super(message);
        this.parameter = parameter;
    }

    public ConfigurationException(String parameter, String message, Throwable cause) {
        super(message, cause);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }
}
