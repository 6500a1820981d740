package com.ilmarlopez.plausible.config;

public class InvalidConfigurationException extends IllegalArgumentException {

    private final String key;

    public InvalidConfigurationException(String key, Object value, String expected) {
        super("Invalid context value " + key + "=" + value + ", expected " + expected);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
