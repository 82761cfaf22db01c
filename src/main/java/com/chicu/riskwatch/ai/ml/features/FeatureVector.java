package com.chicu.riskwatch.ai.ml.features;

import java.util.List;

/**
 * Model-ready row laid out exactly as {@code featureNames}.
 *
 * @param defaulted features that were absent in the raw record and were set to 0
 */
public record FeatureVector(
        String recordId,
        List<String> featureNames,
        double[] values,
        List<String> defaulted
) {
    public FeatureVector {
        featureNames = List.copyOf(featureNames);
        values = values.clone();
        defaulted = List.copyOf(defaulted);
    }

    @Override
    public double[] values() {
        return values.clone();
    }
}
