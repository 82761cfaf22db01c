package com.chicu.riskwatch.ai.lifecycle;

import com.chicu.riskwatch.ai.ml.metrics.ClassificationMetrics;
import com.chicu.riskwatch.common.enums.LifecycleBranch;
import lombok.Builder;

/**
 * Outcome of one daily model evaluation, as reported in the summary alert.
 */
@Builder
public record LifecycleReport(
        LifecycleBranch branch,
        String reason,
        ClassificationMetrics incumbentMetrics,
        ClassificationMetrics candidateMetrics,
        String candidateVersion
) {
    public static LifecycleReport skipped(String reason) {
        return LifecycleReport.builder()
                .branch(LifecycleBranch.RETRAIN_SKIPPED)
                .reason(reason)
                .build();
    }

    public static LifecycleReport failed(String reason) {
        return LifecycleReport.builder()
                .branch(LifecycleBranch.RETRAIN_FAILED)
                .reason(reason)
                .build();
    }

    /** "candidate promoted", "retrain failed: &lt;reason&gt;", ... */
    public String summaryLine() {
        if (branch == LifecycleBranch.RETRAIN_FAILED) {
            return branch.label() + ": " + reason;
        }
        return branch.label();
    }
}
