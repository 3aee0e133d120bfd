package com.github.revdownloader.exception;

/**
 * Exception thrown when a configured value cannot be used.
 */
public class ConfigurationException extends DownloadException {

    private final String property;
    private final String value;

    public ConfigurationException(String message) {
        super(message);
        this.property = null;
        this.value = null;
    }

    public ConfigurationException(String message, String property, Object value) {
        super(String.format("%s (%s=%s)", message, property, value));
        this.property = property;
        this.value = value != null ? value.toString() : null;
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.property = null;
        this.value = null;
    }

    public String getProperty() {
        return property;
    }

    public String getValue() {
        return value;
    }
}
