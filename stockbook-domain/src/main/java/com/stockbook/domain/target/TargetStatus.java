package com.stockbook.domain.target;

import com.stockbook.domain.ValidationException;

import java.util.Locale;

public enum TargetStatus {
    ACTIVE, HIT, FAILED, CANCELLED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TargetStatus fromCode(String code) {
        if (code == null || code.isBlank()) return ACTIVE;
        try {
            return valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("status", "Target status must be one of: active, cancelled, failed, hit");
        }
    }
}
