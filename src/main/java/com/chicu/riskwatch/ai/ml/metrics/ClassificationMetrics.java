package com.chicu.riskwatch.ai.ml.metrics;

/**
 * Accuracy and F1 of the positive label 1. F1 is 0 when precision + recall is 0.
 */
public record ClassificationMetrics(double accuracy, double f1, int samples) {

    public static ClassificationMetrics of(int[] yTrue, int[] yPred) {
        if (yTrue == null || yPred == null || yTrue.length != yPred.length) {
            throw new IllegalArgumentException("metrics: yTrue/yPred size mismatch");
        }
        if (yTrue.length == 0) {
            throw new IllegalArgumentException("metrics: empty input");
        }

        int correct = 0;
        int tp = 0;
        int fp = 0;
        int fn = 0;
        for (int i = 0; i < yTrue.length; i++) {
            if (yTrue[i] == yPred[i]) correct++;
            if (yPred[i] == 1 && yTrue[i] == 1) tp++;
            else if (yPred[i] == 1) fp++;
            else if (yTrue[i] == 1) fn++;
        }

        double accuracy = (double) correct / yTrue.length;
        double denom = 2.0 * tp + fp + fn;
        double f1 = denom == 0 ? 0.0 : (2.0 * tp) / denom;
        return new ClassificationMetrics(accuracy, f1, yTrue.length);
    }
}
