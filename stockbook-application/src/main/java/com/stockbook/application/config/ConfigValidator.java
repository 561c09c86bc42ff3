package com.stockbook.application.config;

import com.stockbook.application.ports.ConfigPort;
import com.stockbook.domain.ValidationException;
import com.stockbook.domain.money.CurrencyCode;

import java.math.BigDecimal;

public final class ConfigValidator {

    private static final BigDecimal MAX_RISK_PERCENT = BigDecimal.valueOf(100);

    public ConfigValidationResult validate(ConfigPort config) {
        ConfigValidationResult res = new ConfigValidationResult();

        for (ConfigKey k : ConfigKey.values()) {
            if (k.isOptional()) continue;

            String v = config.get(k.key());
            if (v == null || v.isBlank()) {
                res.reject(k, "required but not set");
            }
        }

        checkInt(config, ConfigKey.DB_BUSY_TIMEOUT_MS, 0, res);
        checkInt(config, ConfigKey.PORTFOLIO_MAX_POSITIONS, 1, res);

        String risk = value(config, ConfigKey.PORTFOLIO_MAX_RISK_PER_TRADE);
        if (risk != null) {
            try {
                BigDecimal r = new BigDecimal(risk);
                if (r.signum() <= 0 || r.compareTo(MAX_RISK_PERCENT) > 0) {
                    res.reject(ConfigKey.PORTFOLIO_MAX_RISK_PER_TRADE, "must be in (0, 100], got " + risk);
                }
            } catch (NumberFormatException e) {
                res.reject(ConfigKey.PORTFOLIO_MAX_RISK_PER_TRADE, "must be a decimal number, got " + risk);
            }
        }

        String currency = value(config, ConfigKey.CURRENCY_DEFAULT);
        if (currency != null) {
            try {
                CurrencyCode.parse(currency);
            } catch (ValidationException e) {
                res.reject(ConfigKey.CURRENCY_DEFAULT, e.getMessage());
            }
        }

        return res;
    }

    private static void checkInt(ConfigPort config, ConfigKey key, int min, ConfigValidationResult res) {
        String v = value(config, key);
        if (v == null) return;
        try {
            int n = Integer.parseInt(v);
            if (n < min) {
                res.reject(key, "must be >= " + min + ", got " + v);
            }
        } catch (NumberFormatException e) {
            res.reject(key, "must be an integer, got " + v);
        }
    }

    private static String value(ConfigPort config, ConfigKey key) {
        String v = config.get(key.key());
        return v == null || v.isBlank() ? null : v.trim();
    }
}
