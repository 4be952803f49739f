package com.appraisalplatform.orchestrator.config;

import java.util.Locale;

public enum BrokerType {
    IN_MEMORY,
    REDIS,
    KAFKA,
    MQTT;

    public static BrokerType fromName(String name) {
        if (name == null || name.isBlank()) {
            return IN_MEMORY;
        }
        return valueOf(name.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
