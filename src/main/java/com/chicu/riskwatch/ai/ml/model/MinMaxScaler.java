package com.chicu.riskwatch.ai.ml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import smile.feature.Scaler;

/**
 * Maps each column into [0..1] with Smile's {@link Scaler} using the fitted min/max.
 */
public final class MinMaxScaler implements FeatureScaler {

    private final int dimension;
    private final Scaler transform;

    public MinMaxScaler() {
        this(0, (Scaler) null);
    }

    @JsonCreator
    public MinMaxScaler(@JsonProperty("dimension") int dimension,
                        @JsonProperty("transform") byte[] transform) {
        this(dimension, SmileModels.fromBytes(transform, Scaler.class));
    }

    private MinMaxScaler(int dimension, Scaler transform) {
        this.dimension = dimension;
        this.transform = transform;
    }

    @Override
    public MinMaxScaler fit(double[][] x) {
        FeatureScaler.requireMatrix(x);
        return new MinMaxScaler(x[0].length, Scaler.fit(x));
    }

    @Override
    public double[] transform(double[] row) {
        if (transform == null) throw new IllegalStateException("MinMaxScaler: not fitted");
        if (row.length != dimension) {
            throw new IllegalArgumentException("MinMaxScaler: expected " + dimension + " features, got " + row.length);
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
