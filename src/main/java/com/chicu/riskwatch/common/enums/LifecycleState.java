package com.chicu.riskwatch.common.enums;

/**
 * STABLE → RETRAINING → ARBITRATING → {PROMOTED | ROLLED_BACK} → STABLE.
 * RETRAIN_FAILED also falls back to STABLE with the incumbent untouched.
 */
public enum LifecycleState {
    STABLE,
    RETRAINING,
    ARBITRATING,
    PROMOTED,
    ROLLED_BACK,
    RETRAIN_FAILED
}
