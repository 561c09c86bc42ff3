package com.stockbook.application.config;

/**
 * Known configuration keys. Defaults live in stockbook-defaults.properties on the classpath.
 */
public enum ConfigKey {
    DB_PATH("db.path", false),
    DB_BUSY_TIMEOUT_MS("db.busyTimeoutMs", true),

    PORTFOLIO_MAX_POSITIONS("portfolio.maxPositions", true),
    PORTFOLIO_MAX_RISK_PER_TRADE("portfolio.maxRiskPerTrade", true),

    CURRENCY_DEFAULT("currency.default", true);

    private final String key;
    private final boolean optional;

    ConfigKey(String key, boolean optional) {
        this.key = key;
        this.optional = optional;
    }

    public String key() { return key; }
    public boolean isOptional() { return optional; }
}
