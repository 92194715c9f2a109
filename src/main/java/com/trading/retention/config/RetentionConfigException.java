package com.trading.retention.config;

/**
 * Thrown when a retention configuration file exists but cannot be read or parsed.
 */
public class RetentionConfigException extends RuntimeException {

    public RetentionConfigException(String message) {
        super(message);
    }

    public RetentionConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
