package com.chicu.riskwatch.common.enums;

/**
 * Classifier family used when a model is trained from scratch.
 * Retraining always reuses the incumbent's family.
 */
public enum ModelAlgorithm {
    GRADIENT_BOOSTING,
    LOGISTIC_REGRESSION
}
