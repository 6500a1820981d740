package com.ilmarlopez.plausible.config;

import software.amazon.awscdk.core.App;
import software.amazon.awscdk.core.ConstructNode;

import java.util.Map;

/**
 * Read access to CDK context values, as passed with {@code -c key=value} or set in cdk.json.
 */
@FunctionalInterface
public interface AppContext {

    Object get(String key);

    default String getStringOrDefault(String key, String defaultValue) {
        Object object = get(key);
        if (object == null) {
            return defaultValue;
        } else if (object instanceof String) {
            return (String) object;
        } else {
            throw new InvalidConfigurationException(key, object, "a string");
        }
    }

    default boolean getBooleanOrDefault(String key, boolean defaultValue) {
        Object object = get(key);
        if (object == null) {
            return defaultValue;
        } else if (object instanceof Boolean) {
            return (Boolean) object;
        }
        String value = object.toString().trim();
        if ("true".equalsIgnoreCase(value)) {
            return true;
        } else if ("false".equalsIgnoreCase(value)) {
            return false;
        } else {
            throw new InvalidConfigurationException(key, object, "true or false");
        }
    }

    static AppContext of(App app) {
        return of(app.getNode());
    }

    static AppContext of(ConstructNode node) {
        return node::tryGetContext;
    }

    static AppContext of(Map<String, ?> values) {
        return values::get;
    }

    static AppContext empty() {
        return key -> null;
    }
}
