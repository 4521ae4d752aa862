package com.fintech.history.domain;

import java.util.Locale;

public enum ExerciseStyle {

    AMERICAN,
    EUROPEAN;

    /** Unknown or missing values default to {@link #EUROPEAN}, the style of cash-settled index options. */
    public static ExerciseStyle parseOrDefault(String value) {
        if (value == null || value.isBlank()) {
            return EUROPEAN;
        }
        return "AMERICAN".equals(value.trim().toUpperCase(Locale.ROOT)) ? AMERICAN : EUROPEAN;
    }
}
