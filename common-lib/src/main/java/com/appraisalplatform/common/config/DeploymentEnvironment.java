package com.appraisalplatform.common.config;

import java.util.Locale;

public enum DeploymentEnvironment {
    DEVELOPMENT,
    STAGING,
    PRODUCTION;

    /**
     * Resolves a profile-style name ({@code "production"}, {@code "Staging"}).
     * Anything unrecognized falls back to {@link #DEVELOPMENT}.
     */
    public static DeploymentEnvironment fromName(String name) {
        if (name == null || name.isBlank()) {
            return DEVELOPMENT;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return DEVELOPMENT;
        }
    }
}
