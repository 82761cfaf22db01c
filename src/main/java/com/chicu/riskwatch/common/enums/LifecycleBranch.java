package com.chicu.riskwatch.common.enums;

/**
 * Which way a daily lifecycle evaluation went. The label is what ends up in the summary alert.
 */
public enum LifecycleBranch {

    RETRAIN_SKIPPED("retrain skipped"),
    CANDIDATE_PROMOTED("candidate promoted"),
    INCUMBENT_RETAINED("incumbent retained"),
    RETRAIN_FAILED("retrain failed");

    private final String label;

    LifecycleBranch(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
