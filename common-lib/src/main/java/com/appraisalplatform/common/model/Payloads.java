package com.appraisalplatform.common.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Defensive copies for the free-form {@code Map<String, Object>} payloads carried by
 * messages, responses and status reports. Unlike {@link Map#copyOf}, null values are kept.
 */
public final class Payloads {

    private Payloads() {}

    public static Map<String, Object> copyOf(Map<String, ?> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
