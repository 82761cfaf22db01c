package com.chicu.riskwatch.ai.lifecycle;

import com.chicu.riskwatch.ai.ml.model.ModelArtifact;

/**
 * Challenger produced by a retrain. Not active until promoted.
 */
public record RetrainResult(
        ModelArtifact candidate,
        double holdoutAccuracy,
        int trainRows,
        int testRows
) {}
