package com.chicu.riskwatch.ai.ml.features;

import com.chicu.riskwatch.ai.ml.model.LabelEncoder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Input layout of a model: ordered feature names plus the frozen categorical encoders.
 * Every consumer reproduces {@link #featureNames()} order exactly.
 */
public record FeatureContract(
        List<String> featureNames,
        Map<String, LabelEncoder> encoders
) {
    public FeatureContract {
        featureNames = List.copyOf(featureNames);
        encoders = Collections.unmodifiableMap(new LinkedHashMap<>(encoders != null ? encoders : Map.of()));
    }

    public int size() {
        return featureNames.size();
    }

    public boolean isCategorical(String feature) {
        return encoders.containsKey(feature);
    }
}
