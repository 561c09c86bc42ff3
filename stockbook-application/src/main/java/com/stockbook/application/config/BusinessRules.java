package com.stockbook.application.config;

import com.stockbook.application.ports.ConfigPort;
import com.stockbook.domain.ValidationException;
import com.stockbook.domain.money.CurrencyCode;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Process-wide business settings, built once at startup and handed to whatever needs them.
 *
 * @param maxPositions    default position limit for new portfolios
 * @param maxRiskPerTrade default risk per trade for new portfolios, in percent
 * @param currency        currency in which money columns are stored and read back
 */
public record BusinessRules(int maxPositions, BigDecimal maxRiskPerTrade, CurrencyCode currency) {

    public static final int DEFAULT_MAX_POSITIONS = 10;
    public static final BigDecimal DEFAULT_MAX_RISK_PER_TRADE = new BigDecimal("2.0");

    public BusinessRules {
        Objects.requireNonNull(maxRiskPerTrade, "maxRiskPerTrade");
        Objects.requireNonNull(currency, "currency");
        if (maxPositions <= 0) {
            throw new ValidationException("maxPositions", "Max positions must be positive");
        }
        if (maxRiskPerTrade.signum() <= 0) {
            throw new ValidationException("maxRiskPerTrade", "Max risk per trade must be positive");
        }
    }

    public static BusinessRules defaults() {
        return new BusinessRules(DEFAULT_MAX_POSITIONS, DEFAULT_MAX_RISK_PER_TRADE, CurrencyCode.USD);
    }

    public static BusinessRules fromConfig(ConfigPort config) {
        int positions = config.getInt(ConfigKey.PORTFOLIO_MAX_POSITIONS.key(), DEFAULT_MAX_POSITIONS);
        String risk = config.get(ConfigKey.PORTFOLIO_MAX_RISK_PER_TRADE.key(), null);
        String currency = config.get(ConfigKey.CURRENCY_DEFAULT.key(), CurrencyCode.USD.name());
        BigDecimal riskValue;
        try {
            riskValue = risk == null || risk.isBlank() ? DEFAULT_MAX_RISK_PER_TRADE : new BigDecimal(risk.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("maxRiskPerTrade", "Max risk per trade must be numeric: " + risk);
        }
        return new BusinessRules(positions, riskValue, CurrencyCode.parse(currency));
    }
}
