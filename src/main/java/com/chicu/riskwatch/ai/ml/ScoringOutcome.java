package com.chicu.riskwatch.ai.ml;

/**
 * One entry of a batch: either {@code result} or an isolated error.
 */
public record ScoringOutcome(
        String recordId,
        PredictionResult result,
        String errorCode,
        String message
) {
    public static ScoringOutcome success(PredictionResult result) {
        return new ScoringOutcome(result.recordId(), result, null, null);
    }

    public static ScoringOutcome failure(String recordId, String errorCode, String message) {
        return new ScoringOutcome(recordId, null, errorCode, message);
    }

    public boolean isSuccess() {
        return result != null;
    }
}
