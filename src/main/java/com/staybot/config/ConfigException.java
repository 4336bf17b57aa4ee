package com.staybot.config;

/**
 * Invalid or unreadable configuration. Fatal at startup only.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
