package com.chicu.riskwatch.ai.ml.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Numeric normalizer that lives and dies with one model.
 * Implementations are immutable: {@link #fit(double[][])} returns a new fitted instance of the same class.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = StandardScaler.class, name = "standard"),
        @JsonSubTypes.Type(value = MinMaxScaler.class, name = "min_max")
})
public interface FeatureScaler {

    FeatureScaler fit(double[][] x);

    double[] transform(double[] row);

    /** Number of columns the scaler was fitted on (0 when unfitted). */
    int dimension();

    default double[][] transformAll(double[][] x) {
        double[][] out = new double[x.length][];
        for (int i = 0; i < x.length; i++) {
            out[i] = transform(x[i]);
        }
        return out;
    }

    static void requireMatrix(double[][] x) {
        if (x == null || x.length == 0) {
            throw new IllegalArgumentException("scaler: empty matrix");
        }
        int f = x[0].length;
        for (int i = 1; i < x.length; i++) {
            if (x[i].length != f) {
                throw new IllegalArgumentException("scaler: ragged row " + i + " len=" + x[i].length + " expected=" + f);
            }
        }
    }
}
