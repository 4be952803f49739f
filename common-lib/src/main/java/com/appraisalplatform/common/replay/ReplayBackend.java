package com.appraisalplatform.common.replay;

import java.util.Locale;

public enum ReplayBackend {
    IN_MEMORY,
    REDIS,
    DATABASE,
    FILE;

    /**
     * Parses configuration values such as {@code "in-memory"} or {@code "file"}.
     *
     * @throws IllegalArgumentException for an unknown backend name
     */
    public static ReplayBackend fromName(String name) {
        if (name == null || name.isBlank()) {
            return IN_MEMORY;
        }
        return valueOf(name.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
