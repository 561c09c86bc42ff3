package com.stockbook.domain.stock;

import com.stockbook.domain.ValidationException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Ticker symbol: 1 to 5 letters, stored upper-case. Input is trimmed first, so
 * {@code " aapl "} becomes {@code AAPL}.
 */
public final class Symbol implements Comparable<Symbol> {

    public static final int MAX_LENGTH = 5;
    private static final Pattern FORMAT = Pattern.compile("^[A-Z]{1,5}$");

    private final String value;

    private Symbol(String value) {
        this.value = value;
    }

    public static Symbol of(String raw) {
        if (raw == null) {
            throw new ValidationException("symbol", "Stock symbol cannot be null");
        }
        String v = normalize(raw);
        if (v.isEmpty() || v.length() > MAX_LENGTH) {
            throw new ValidationException("symbol",
                    "Stock symbol must be between 1 and " + MAX_LENGTH + " characters: '" + raw + "'");
        }
        if (!FORMAT.matcher(v).matches()) {
            throw new ValidationException("symbol", "Stock symbol must contain only letters: '" + raw + "'");
        }
        return new Symbol(v);
    }

    public static String normalize(String raw) {
        return raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
    }

    public static boolean isValid(String raw) {
        return raw != null && FORMAT.matcher(normalize(raw)).matches();
    }

    public String value() { return value; }

    @Override
    public int compareTo(Symbol o) {
        return value.compareTo(o.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Symbol other)) return false;
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
