package com.appraisalplatform.common.agent;

import java.util.Locale;

public enum AccessLevel {
    USER,
    ADMIN,
    SYSTEM;

    /**
     * Lenient parse of a metadata value. Unknown or missing values resolve to {@code fallback}.
     */
    public static AccessLevel parse(Object value, AccessLevel fallback) {
        if (value instanceof AccessLevel level) {
            return level;
        }
        if (value == null) {
            return fallback;
        }
        try {
            return valueOf(value.toString().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
