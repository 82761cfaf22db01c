package com.chicu.riskwatch.ai.ml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import smile.feature.Standardizer;

/**
 * z = (x - mean) / sd via Smile's {@link Standardizer}; a zero-variance column keeps sd = 1.
 */
public final class StandardScaler implements FeatureScaler {

    private final int dimension;
    private final Standardizer transform;

    public StandardScaler() {
        this(0, (Standardizer) null);
    }

    @JsonCreator
    public StandardScaler(@JsonProperty("dimension") int dimension,
                          @JsonProperty("transform") byte[] transform) {
        this(dimension, SmileModels.fromBytes(transform, Standardizer.class));
    }

    private StandardScaler(int dimension, Standardizer transform) {
        this.dimension = dimension;
        this.transform = transform;
    }

    @Override
    public StandardScaler fit(double[][] x) {
        FeatureScaler.requireMatrix(x);
        return new StandardScaler(x[0].length, Standardizer.fit(x));
    }

    @Override
    public double[] transform(double[] row) {
        if (transform == null) throw new IllegalStateException("StandardScaler: not fitted");
        if (row.length != dimension) {
            throw new IllegalArgumentException("StandardScaler: expected " + dimension + " features, got " + row.length);
        }
        return transform.transform(row);
    }

    @Override
    @JsonProperty("dimension")
    public int dimension() {
        return dimension;
    }

    @JsonProperty("transform")
    public byte[] transformBytes() {
        return SmileModels.toBytes(transform);
    }
}
