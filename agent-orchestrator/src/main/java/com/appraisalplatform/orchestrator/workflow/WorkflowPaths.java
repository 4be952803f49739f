package com.appraisalplatform.orchestrator.workflow;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dot-path access into nested maps, as used by step mappings and conditions.
 * A numeric segment indexes into a list.
 */
public final class WorkflowPaths {

    private WorkflowPaths() {}

    /**
     * Value at {@code path}, or {@code null} when any segment is missing.
     */
    public static Object get(Object root, String path) {
        Object current = root;
        for (String part : path.split("\\.")) {
            if (current instanceof Map<?, ?> map) {
                current = map.get(part);
            } else if (current instanceof List<?> list && isIndex(part, list.size())) {
                current = list.get(Integer.parseInt(part));
            } else {
                return null;
            }
        }
        return current;
    }

    /**
     * Writes {@code value} at {@code path}, replacing any non-map value along the way
     * with a fresh map. Nested maps are copied, so maps shared with responses stay untouched.
     */
    public static void put(Map<String, Object> root, String path, Object value) {
        String[] parts = path.split("\\.");
        Map<String, Object> current = root;
        for (int i = 0; i < parts.length - 1; i++) {
            Object next = current.get(parts[i]);
            Map<String, Object> child = new LinkedHashMap<>();
            if (next instanceof Map<?, ?> existing) {
                existing.forEach((k, v) -> child.put(String.valueOf(k), v));
            }
            current.put(parts[i], child);
            current = child;
        }
        current.put(parts[parts.length - 1], value);
    }

    /**
     * {@code null}, {@code false}, zero, NaN and the empty string are false; everything
     * else, empty maps and lists included, is true.
     */
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return d != 0.0 && !Double.isNaN(d);
        }
        if (value instanceof CharSequence s) {
            return s.length() > 0;
        }
        return true;
    }

    private static boolean isIndex(String part, int size) {
        if (part.isEmpty() || part.length() > 9 || !part.chars().allMatch(Character::isDigit)) {
            return false;
        }
        return Integer.parseInt(part) < size;
    }
}
