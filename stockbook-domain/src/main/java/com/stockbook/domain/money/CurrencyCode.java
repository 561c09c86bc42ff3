package com.stockbook.domain.money;

import com.stockbook.domain.ValidationException;

import java.util.Locale;

/**
 * Currencies accepted for trading. Anything outside this list is rejected at parse time.
 */
public enum CurrencyCode {
    USD, CAD, EUR, GBP, JPY;

    public static CurrencyCode parse(String code) {
        if (code == null || code.isBlank()) {
            throw new ValidationException("currency", "Currency code cannot be empty");
        }
        String v = code.trim().toUpperCase(Locale.ROOT);
        if (!v.matches("[A-Z]{3}")) {
            throw new ValidationException("currency", "Currency code must be 3 letters: " + code);
        }
        try {
            return CurrencyCode.valueOf(v);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("currency", "Unsupported currency: " + v);
        }
    }
}
