package com.chicu.riskwatch.common.exception;

/**
 * Scoring or a lifecycle step was requested before any model artifact was activated.
 */
public class ArtifactNotLoadedException extends RiskWatchException {

    private static final String DEFAULT_ERROR_CODE = "ERR-ARTIFACT";

    public ArtifactNotLoadedException(String message) {
        super(message);
    }

    public ArtifactNotLoadedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
