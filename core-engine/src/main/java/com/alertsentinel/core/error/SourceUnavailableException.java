package com.alertsentinel.core.error;

/**
 * Raised when the series source fails or does not answer within the fetch timeout.
 */
public class SourceUnavailableException extends AlertEngineException {

    private static final long serialVersionUID = 1L;

    public SourceUnavailableException(String message) {
        super(ErrorKind.SOURCE_UNAVAILABLE, message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(ErrorKind.SOURCE_UNAVAILABLE, message, cause);
    }
}
