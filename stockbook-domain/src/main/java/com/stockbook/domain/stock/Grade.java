package com.stockbook.domain.stock;

import com.stockbook.domain.ValidationException;

import java.util.Locale;

public enum Grade {
    A, B, C;

    /** Parses a stored or user-supplied grade; blank means "no grade" (null). */
    public static Grade parseNullable(String code) {
        if (code == null || code.isBlank()) return null;
        String v = code.trim().toUpperCase(Locale.ROOT);
        return switch (v) {
            case "A" -> A;
            case "B" -> B;
            case "C" -> C;
            default -> throw new ValidationException("grade", "Grade must be one of A, B, C: " + code);
        };
    }
}
