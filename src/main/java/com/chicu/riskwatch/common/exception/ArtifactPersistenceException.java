package com.chicu.riskwatch.common.exception;

/**
 * Artifact store I/O failure. The active artifact is left untouched.
 */
public class ArtifactPersistenceException extends RiskWatchException {

    private static final String DEFAULT_ERROR_CODE = "ERR-PERSIST";

    public ArtifactPersistenceException(String message) {
        super(message);
    }

    public ArtifactPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
