package com.chicu.riskwatch.ai.ml.model;

import com.chicu.riskwatch.ai.ml.features.FeatureContract;
import com.chicu.riskwatch.common.exception.SchemaMismatchException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deployable unit: model + scaler + encoders + feature order, all from ONE training pass.
 * <p>
 * Immutable. The constructor rejects bundles whose parts disagree with each other
 * (encoder for an unknown feature, scaler fitted on another width, duplicate names).
 */
@Getter
@ToString(of = {"version", "featureNames", "createdAt", "retrainedAt"})
public final class ModelArtifact {

    private final String version;
    private final BinaryClassifier model;
    private final FeatureScaler scaler;
    private final Map<String, LabelEncoder> encoders;
    private final List<String> featureNames;
    private final Instant createdAt;

    /** Set only by retraining. */
    private final Instant retrainedAt;

    @Builder
    @JsonCreator
    public ModelArtifact(@JsonProperty("version") String version,
                         @JsonProperty("model") BinaryClassifier model,
                         @JsonProperty("scaler") FeatureScaler scaler,
                         @JsonProperty("encoders") Map<String, LabelEncoder> encoders,
                         @JsonProperty("featureNames") List<String> featureNames,
                         @JsonProperty("createdAt") Instant createdAt,
                         @JsonProperty("retrainedAt") Instant retrainedAt) {

        if (model == null) throw new SchemaMismatchException("artifact: model=null");
        if (scaler == null) throw new SchemaMismatchException("artifact: scaler=null");
        if (featureNames == null || featureNames.isEmpty()) {
            throw new SchemaMismatchException("artifact: featureNames are empty");
        }

        Set<String> seen = new HashSet<>();
        for (String name : featureNames) {
            if (name == null || name.isBlank()) {
                throw new SchemaMismatchException("artifact: blank feature name in " + featureNames);
            }
            if (!seen.add(name)) {
                throw new SchemaMismatchException("artifact: duplicate feature name '" + name + "'");
            }
        }

        Map<String, LabelEncoder> enc = encoders != null ? encoders : Map.of();
        for (String col : enc.keySet()) {
            if (!seen.contains(col)) {
                throw new SchemaMismatchException("artifact: encoder for '" + col + "' which is not in featureNames");
            }
        }

        if (scaler.dimension() != featureNames.size()) {
            throw new SchemaMismatchException("artifact: scaler dimension " + scaler.dimension()
                    + " != featureNames " + featureNames.size());
        }

        this.version = (version == null || version.isBlank()) ? "unversioned" : version.trim();
        this.model = model;
        this.scaler = scaler;
        this.encoders = Collections.unmodifiableMap(new LinkedHashMap<>(enc));
        this.featureNames = List.copyOf(featureNames);
        this.createdAt = createdAt;
        this.retrainedAt = retrainedAt;
    }

    public FeatureContract contract() {
        return new FeatureContract(featureNames, encoders);
    }
}
