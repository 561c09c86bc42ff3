package com.stockbook.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Config overrides coming from environment-style variables: either a {@code .env} file or the
 * process environment.
 *
 * <p>A dotted key is overridden by its {@code STOCKBOOK_} name, e.g. {@code db.busyTimeoutMs}
 * by {@code STOCKBOOK_DB_BUSY_TIMEOUT_MS}. A {@code .env} file may also set dotted keys
 * directly; the process environment may not.
 */
final class EnvOverrides {

    private static final Logger log = LoggerFactory.getLogger(EnvOverrides.class);

    static final String PREFIX = "STOCKBOOK_";

    private final Map<String, String> vars;
    private final boolean dottedKeysAllowed;

    private EnvOverrides(Map<String, String> vars, boolean dottedKeysAllowed) {
        this.vars = vars;
        this.dottedKeysAllowed = dottedKeysAllowed;
    }

    static EnvOverrides fromEnvironment(Map<String, String> environment) {
        return new EnvOverrides(environment == null ? Map.of() : environment, false);
    }

    /**
     * Reads {@code KEY=value} lines. {@code export }, blank lines, {@code #} comments and a
     * trailing {@code  # comment} after an unquoted value are ignored; matching single or
     * double quotes around the value are removed. Lines without a key are skipped with a warning.
     * A missing file yields no overrides.
     */
    static EnvOverrides fromFile(Path envFile) throws IOException {
        Map<String, String> vars = new LinkedHashMap<>();
        if (envFile == null || !Files.exists(envFile)) return new EnvOverrides(vars, true);

        List<String> lines = Files.readAllLines(envFile, StandardCharsets.UTF_8);
        for (int n = 0; n < lines.size(); n++) {
            String t = lines.get(n).trim();
            if (t.isEmpty() || t.startsWith("#")) continue;
            if (t.startsWith("export ")) t = t.substring("export ".length()).trim();

            int eq = t.indexOf('=');
            if (eq <= 0) {
                log.warn("{}:{} ignored, expected KEY=value", envFile.getFileName(), n + 1);
                continue;
            }
            vars.put(t.substring(0, eq).trim(), unquote(t.substring(eq + 1).trim()));
        }
        log.debug("Loaded {} entries from {}", vars.size(), envFile);
        return new EnvOverrides(vars, true);
    }

    /**
     * Maps a dotted key to its variable name.
     * <ul>
     *   <li>db.path -> STOCKBOOK_DB_PATH</li>
     *   <li>db.busyTimeoutMs -> STOCKBOOK_DB_BUSY_TIMEOUT_MS</li>
     *   <li>currency.default -> STOCKBOOK_CURRENCY_DEFAULT</li>
     * </ul>
     */
    static String envName(String key) {
        String s = key.replace('.', '_').replaceAll("([a-z0-9])([A-Z])", "$1_$2");
        return PREFIX + s.toUpperCase(Locale.ROOT);
    }

    /**
     * Writes the overrides into {@code props}: dotted keys first (files only), then the
     * {@code STOCKBOOK_} variables of every key in {@code props} or {@code knownKeys}, which win.
     */
    void applyTo(Properties props, Collection<String> knownKeys) {
        if (dottedKeysAllowed) {
            vars.forEach((k, v) -> {
                if (!k.startsWith(PREFIX)) props.setProperty(k, v);
            });
        }
        Set<String> keys = new LinkedHashSet<>(props.stringPropertyNames());
        keys.addAll(knownKeys);
        for (String key : keys) {
            String v = vars.get(envName(key));
            if (v != null) props.setProperty(key, v);
        }
    }

    private static String unquote(String v) {
        if (v.length() >= 2) {
            char first = v.charAt(0);
            if ((first == '"' || first == '\'') && v.charAt(v.length() - 1) == first) {
                return v.substring(1, v.length() - 1);
            }
        }
        int comment = v.indexOf(" #");
        return comment >= 0 ? v.substring(0, comment).trim() : v;
    }
}
