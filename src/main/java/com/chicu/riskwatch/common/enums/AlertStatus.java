package com.chicu.riskwatch.common.enums;

public enum AlertStatus {
    SENT,
    FAILED
}
