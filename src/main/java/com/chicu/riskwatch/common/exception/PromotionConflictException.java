package com.chicu.riskwatch.common.exception;

/**
 * Another retrain / arbitrate / promote transition is already in flight. Retry later.
 */
public class PromotionConflictException extends RiskWatchException {

    private static final String DEFAULT_ERROR_CODE = "ERR-CONFLICT";

    public PromotionConflictException(String message) {
        super(message);
    }

    public PromotionConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
