package com.chicu.riskwatch.common.exception;

/**
 * A record (or an artifact) does not satisfy the feature contract. Local to one record in batch paths.
 */
public class SchemaMismatchException extends RiskWatchException {

    private static final String DEFAULT_ERROR_CODE = "ERR-SCHEMA";

    public SchemaMismatchException(String message) {
        super(message);
    }

    public SchemaMismatchException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
