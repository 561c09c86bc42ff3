package com.stockbook.infrastructure.config;

import com.stockbook.application.config.ConfigKey;
import com.stockbook.application.ports.ConfigPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * File + env configuration.
 *
 * Load order (low -> high priority):
 *  1) stockbook-defaults.properties (classpath)
 *  2) config.properties (config dir, optional)
 *  3) .env (config dir, optional)
 *  4) OS environment variables, STOCKBOOK_* names (highest priority)
 *
 * Both env layers go through {@link EnvOverrides}: db.busyTimeoutMs is overridden by
 * STOCKBOOK_DB_BUSY_TIMEOUT_MS, and .env may also set dotted keys directly.
 */
public final class FileConfigService implements ConfigPort {

    private static final Logger log = LoggerFactory.getLogger(FileConfigService.class);

    public static final String DEFAULTS_RESOURCE = "stockbook-defaults.properties";

    private final Properties props = new Properties();
    private final Path configDir;

    FileConfigService(Path configDir, Map<String, String> environment) throws IOException {
        this.configDir = configDir;
        loadDefaults();
        loadFiles();
        EnvOverrides.fromEnvironment(environment).applyTo(props, knownKeys());
    }

    public static FileConfigService defaultFromWorkingDir() throws IOException {
        return fromDirectory(Path.of(System.getProperty("user.dir")).resolve("config"));
    }

    public static FileConfigService fromDirectory(Path configDir) throws IOException {
        return new FileConfigService(configDir, System.getenv());
    }

    public Path getConfigDir() {
        return configDir;
    }

    private void loadDefaults() throws IOException {
        try (InputStream in = FileConfigService.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                log.warn("{} not found on classpath", DEFAULTS_RESOURCE);
                return;
            }
            try (Reader r = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                props.load(r);
            }
        }
    }

    private void loadFiles() throws IOException {
        if (configDir == null) return;

        Path file = configDir.resolve("config.properties");
        if (Files.exists(file)) {
            try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                props.load(r);
            }
            log.debug("Loaded {}", file);
        }

        EnvOverrides.fromFile(configDir.resolve(".env")).applyTo(props, knownKeys());
    }

    private static List<String> knownKeys() {
        return Arrays.stream(ConfigKey.values()).map(ConfigKey::key).toList();
    }

    @Override
    public String get(String key) {
        return get(key, null);
    }

    @Override
    public String get(String key, String defaultValue) {
        String v = props.getProperty(key);
        return (v == null) ? defaultValue : v;
    }

    @Override
    public int getInt(String key, int defaultValue) {
        String v = get(key, null);
        if (v == null || v.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            log.warn("Config {}='{}' is not an integer, using {}", key, v, defaultValue);
            return defaultValue;
        }
    }

    @Override
    public double getDouble(String key, double defaultValue) {
        String v = get(key, null);
        if (v == null || v.isBlank()) return defaultValue;
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            log.warn("Config {}='{}' is not a number, using {}", key, v, defaultValue);
            return defaultValue;
        }
    }
}
