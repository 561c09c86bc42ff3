package com.stockbook.domain.trade;

import com.stockbook.domain.ValidationException;

import java.util.Locale;

public enum TransactionType {
    BUY("buy"),
    SELL("sell");

    private final String code;

    TransactionType(String code) {
        this.code = code;
    }

    /** Lower-case value stored in {@code stock_transaction.type}. */
    public String code() { return code; }

    public static TransactionType fromCode(String code) {
        if (code == null) throw new ValidationException("type", "Transaction type is required");
        String v = code.trim().toLowerCase(Locale.ROOT);
        for (TransactionType t : values()) {
            if (t.code.equals(v)) return t;
        }
        throw new ValidationException("type", "Transaction type must be 'buy' or 'sell': " + code);
    }
}
