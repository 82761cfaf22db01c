package com.chicu.riskwatch.ai.ml.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Binary classifier over already-scaled feature rows. Labels are 0/1.
 * <p>
 * Instances are immutable: {@link #fit(double[][], int[])} trains a NEW instance with the
 * same hyper-parameters and leaves the receiver untouched, so an active model can be used
 * as the prototype of its own challenger.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = GradientBoostingClassifier.class, name = "gradient_boosting"),
        @JsonSubTypes.Type(value = LogisticRegressionClassifier.class, name = "logistic_regression")
})
public interface BinaryClassifier {

    BinaryClassifier fit(double[][] x, int[] y);

    /** P(label = 1 | x). */
    double probabilityOfPositive(double[] x);

    default int predict(double[] x) {
        return probabilityOfPositive(x) > 0.5 ? 1 : 0;
    }

    default int[] predictAll(double[][] x) {
        int[] out = new int[x.length];
        for (int i = 0; i < x.length; i++) {
            out[i] = predict(x[i]);
        }
        return out;
    }

    static void requireTrainingSet(double[][] x, int[] y) {
        if (x == null || y == null || x.length == 0) {
            throw new IllegalArgumentException("classifier: empty training set");
        }
        if (x.length != y.length) {
            throw new IllegalArgumentException("classifier: X/y size mismatch " + x.length + " vs " + y.length);
        }
        for (int i = 0; i < y.length; i++) {
            if (y[i] != 0 && y[i] != 1) {
                throw new IllegalArgumentException("classifier: y[" + i + "] must be 0/1, got " + y[i]);
            }
        }
    }
}
