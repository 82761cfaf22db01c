package com.chicu.riskwatch.ai.ml.features;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * One student's raw attributes (demographics, attendance, scores, fees...).
 * Column names follow the storage schema ({@code attendance_rate}, {@code is_active}, ...).
 * Immutable; null values are allowed and treated as missing by the codec.
 */
public record StudentFeatureRecord(
        String studentId,
        Map<String, Object> attributes
) {
    public StudentFeatureRecord {
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes != null ? attributes : Map.of()));
    }

    public static StudentFeatureRecord of(String studentId, Map<String, Object> attributes) {
        return new StudentFeatureRecord(studentId, attributes);
    }

    public Object get(String name) {
        return attributes.get(name);
    }

    public boolean has(String name) {
        return attributes.get(name) != null;
    }

    /**
     * Ground-truth label from the target column: 0/1 numbers, booleans, "0"/"1".
     * Anything else (absent, null, 0.5, "yes") is empty.
     */
    public OptionalInt label(String targetColumn) {
        Object v = attributes.get(targetColumn);
        if (v instanceof Boolean b) {
            return OptionalInt.of(b ? 1 : 0);
        }
        if (v instanceof Number n) {
            double d = n.doubleValue();
            if (d == 0.0) return OptionalInt.of(0);
            if (d == 1.0) return OptionalInt.of(1);
            return OptionalInt.empty();
        }
        if (v instanceof String s) {
            String t = s.trim();
            if ("0".equals(t)) return OptionalInt.of(0);
            if ("1".equals(t)) return OptionalInt.of(1);
        }
        return OptionalInt.empty();
    }

    public String idOrUnknown() {
        return (studentId == null || studentId.isBlank()) ? "unknown" : studentId;
    }
}
