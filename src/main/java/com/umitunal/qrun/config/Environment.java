package com.umitunal.qrun.config;

import java.util.Map;

/**
 * Typed reads of {@code QRUN_*} settings from an environment map.
 */
final class Environment {
    private final Map<String, String> values;

    Environment(Map<String, String> values) {
        this.values = values;
    }

    String string(String key, String fallback) {
        String value = values.get(key);
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    int integer(String key, int fallback) {
        String value = values.get(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    boolean bool(String key, boolean fallback) {
        String value = values.get(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return Boolean.parseBoolean(value.trim()) || "1".equals(value.trim());
    }
}
