package com.chicu.riskwatch.ai.ml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import smile.classification.LogisticRegression;

/**
 * L2-regularised binomial logistic regression (Smile, L-BFGS).
 */
public final class LogisticRegressionClassifier implements BinaryClassifier {

    public static final double DEFAULT_LAMBDA = 0.1;
    public static final double DEFAULT_TOLERANCE = 1e-5;
    public static final int DEFAULT_MAX_ITERATIONS = 500;

    @Getter private final double lambda;
    @Getter private final double tolerance;
    @Getter private final int maxIterations;
    @Getter private final int dimension;

    private final LogisticRegression model;

    public LogisticRegressionClassifier() {
        this(DEFAULT_LAMBDA, DEFAULT_TOLERANCE, DEFAULT_MAX_ITERATIONS, 0, (LogisticRegression) null);
    }

    @JsonCreator
    public LogisticRegressionClassifier(@JsonProperty("lambda") double lambda,
                                        @JsonProperty("tolerance") double tolerance,
                                        @JsonProperty("maxIterations") int maxIterations,
                                        @JsonProperty("dimension") int dimension,
                                        @JsonProperty("model") byte[] model) {
        this(lambda, tolerance, maxIterations, dimension, SmileModels.fromBytes(model, LogisticRegression.class));
    }

    private LogisticRegressionClassifier(double lambda, double tolerance, int maxIterations,
                                         int dimension, LogisticRegression model) {
        if (lambda < 0) throw new IllegalArgumentException("lambda must be >= 0");
        if (tolerance <= 0) throw new IllegalArgumentException("tolerance must be > 0");
        if (maxIterations <= 0) throw new IllegalArgumentException("maxIterations must be > 0");
        this.lambda = lambda;
        this.tolerance = tolerance;
        this.maxIterations = maxIterations;
        this.dimension = dimension;
        this.model = model;
    }

    @Override
    public LogisticRegressionClassifier fit(double[][] x, int[] y) {
        BinaryClassifier.requireTrainingSet(x, y);
        LogisticRegression fitted = LogisticRegression.binomial(x, y, lambda, tolerance, maxIterations);
        return new LogisticRegressionClassifier(lambda, tolerance, maxIterations, x[0].length, fitted);
    }

    @Override
    public double probabilityOfPositive(double[] x) {
        if (model == null) throw new IllegalStateException("LogisticRegression: not fitted");
        if (x.length != dimension) {
            throw new IllegalArgumentException("LogisticRegression: expected " + dimension + " features, got " + x.length);
        }
        double[] posteriori = new double[2];
        model.predict(x, posteriori);
        return posteriori[1];
    }

    @JsonProperty("model")
    public byte[] modelBytes() {
        return SmileModels.toBytes(model);
    }
}
