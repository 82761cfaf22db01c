package com.chicu.riskwatch.ai.ml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Categorical value → integer code. Known categories are sorted and frozen at fit time,
 * the code of a category is its index in {@link #getClasses()}.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class LabelEncoder {

    private final List<String> classes;

    @JsonCreator
    public LabelEncoder(@JsonProperty("classes") List<String> classes) {
        if (classes == null || classes.isEmpty()) {
            throw new IllegalArgumentException("LabelEncoder: classes are empty");
        }
        this.classes = List.copyOf(classes);
    }

    public static LabelEncoder fit(Collection<?> values) {
        TreeSet<String> sorted = new TreeSet<>();
        if (values != null) {
            for (Object v : values) {
                if (v != null) sorted.add(String.valueOf(v));
            }
        }
        if (sorted.isEmpty()) {
            throw new IllegalArgumentException("LabelEncoder.fit: no non-null values");
        }
        return new LabelEncoder(new ArrayList<>(sorted));
    }

    public boolean knows(Object value) {
        return value != null && classes.contains(String.valueOf(value));
    }

    /** Fallback category for values outside the fitted set. */
    public String firstClass() {
        return classes.get(0);
    }

    /**
     * Unknown (or null) values are encoded as {@link #firstClass()}.
     */
    public int encodeOrFallback(Object value) {
        if (!knows(value)) return 0;
        return classes.indexOf(String.valueOf(value));
    }
}
