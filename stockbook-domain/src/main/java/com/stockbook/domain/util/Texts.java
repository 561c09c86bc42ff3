package com.stockbook.domain.util;

import com.stockbook.domain.ValidationException;

/** Text normalisation shared by entities. */
public final class Texts {

    private Texts() {}

    /** Trimmed value; empty string for null. */
    public static String trimToEmpty(String s) {
        return s == null ? "" : s.trim();
    }

    /** Trimmed value; null for null or blank. */
    public static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    public static String maxLength(String field, String value, int max) {
        if (value != null && value.length() > max) {
            throw new ValidationException(field, capitalize(field) + " cannot exceed " + max + " characters");
        }
        return value;
    }

    public static String required(String field, String value, int max) {
        String t = trimToEmpty(value);
        if (t.isEmpty()) {
            throw new ValidationException(field, capitalize(field) + " cannot be empty");
        }
        return maxLength(field, t, max);
    }

    private static String capitalize(String s) {
        if (s == null || s.isEmpty()) return "Value";
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
