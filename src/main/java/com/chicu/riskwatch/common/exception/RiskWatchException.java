package com.chicu.riskwatch.common.exception;

import lombok.Getter;

/**
 * Base of every failure the scoring / lifecycle core reports to its callers.
 * Each subclass carries a stable error code, used in batch error entries and REST bodies.
 */
@Getter
public abstract class RiskWatchException extends RuntimeException {

    private final String errorCode;

    protected RiskWatchException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected RiskWatchException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    protected abstract String getDefaultErrorCode();
}
