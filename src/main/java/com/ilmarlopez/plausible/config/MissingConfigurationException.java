package com.ilmarlopez.plausible.config;

public class MissingConfigurationException extends IllegalArgumentException {

    private final String key;

    public MissingConfigurationException(String key, String source) {
        super("Missing " + source + " value " + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
