package com.stockbook.application.config;

import com.stockbook.application.ports.ConfigPort;

import java.util.HashMap;
import java.util.Map;

/** In-memory ConfigPort for tests. */
final class MapConfig implements ConfigPort {

    private final Map<String, String> values = new HashMap<>();

    MapConfig with(String key, String value) {
        values.put(key, value);
        return this;
    }

    @Override
    public String get(String key) {
        return values.get(key);
    }

    @Override
    public String get(String key, String defaultValue) {
        return values.getOrDefault(key, defaultValue);
    }

    @Override
    public int getInt(String key, int defaultValue) {
        String v = values.get(key);
        return v == null ? defaultValue : Integer.parseInt(v.trim());
    }

    @Override
    public double getDouble(String key, double defaultValue) {
        String v = values.get(key);
        return v == null ? defaultValue : Double.parseDouble(v.trim());
    }
}
