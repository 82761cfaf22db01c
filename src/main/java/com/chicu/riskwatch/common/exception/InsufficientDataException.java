package com.chicu.riskwatch.common.exception;

/**
 * Retraining refused: not enough rows, no target column, or a class too small to stratify.
 */
public class InsufficientDataException extends RiskWatchException {

    private static final String DEFAULT_ERROR_CODE = "ERR-DATA";

    public InsufficientDataException(String message) {
        super(message);
    }

    public InsufficientDataException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
