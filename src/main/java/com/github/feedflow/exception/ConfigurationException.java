package com.github.feedflow.exception;

/**
 * Exception thrown when configuration is invalid or missing.
 */
public class ConfigurationException extends StreamProxyException {

    private final String configKey;

    public ConfigurationException(String message, String configKey) {
        super(message);
        this.configKey = configKey;
    }

    public ConfigurationException(String message, String configKey, Throwable cause) {
        super(message, cause);
        this.configKey = configKey;
    }

    public String getConfigKey() {
        return configKey;
    }
}
