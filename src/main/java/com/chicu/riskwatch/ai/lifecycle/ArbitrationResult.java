package com.chicu.riskwatch.ai.lifecycle;

import com.chicu.riskwatch.ai.ml.metrics.ClassificationMetrics;
import com.chicu.riskwatch.common.enums.ArbitrationVerdict;
import lombok.Builder;

@Builder
public record ArbitrationResult(
        ArbitrationVerdict verdict,
        ClassificationMetrics incumbent,   // null when arbitration could not score
        ClassificationMetrics candidate,
        String reason
) {
    public static ArbitrationResult failSafe(String reason) {
        return ArbitrationResult.builder()
                .verdict(ArbitrationVerdict.INCUMBENT)
                .reason(reason)
                .build();
    }

    public boolean candidateWins() {
        return verdict == ArbitrationVerdict.CANDIDATE;
    }
}
