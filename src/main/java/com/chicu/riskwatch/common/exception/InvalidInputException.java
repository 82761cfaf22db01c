package com.chicu.riskwatch.common.exception;

/**
 * Precondition failure on evaluation / arbitration input (empty or unlabeled batch).
 */
public class InvalidInputException extends RiskWatchException {

    private static final String DEFAULT_ERROR_CODE = "ERR-INPUT";

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
