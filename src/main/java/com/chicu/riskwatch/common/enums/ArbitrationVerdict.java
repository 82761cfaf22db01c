package com.chicu.riskwatch.common.enums;

public enum ArbitrationVerdict {
    CANDIDATE,
    INCUMBENT
}
