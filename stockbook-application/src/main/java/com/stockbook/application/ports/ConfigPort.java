package com.stockbook.application.ports;

/**
 * Abstraction over configuration.
 * Infrastructure provides the implementation (defaults, files, environment).
 */
public interface ConfigPort {

    String get(String key);

    String get(String key, String defaultValue);

    int getInt(String key, int defaultValue);

    double getDouble(String key, double defaultValue);
}
