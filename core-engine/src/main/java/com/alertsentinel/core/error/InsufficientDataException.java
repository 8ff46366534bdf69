package com.alertsentinel.core.error;

/**
 * Raised when a window holds too few usable points to evaluate.
 */
public class InsufficientDataException extends AlertEngineException {

    private static final long serialVersionUID = 1L;

    public InsufficientDataException(String message) {
        super(ErrorKind.INSUFFICIENT_DATA, message);
    }

    public InsufficientDataException(String message, Throwable cause) {
        super(ErrorKind.INSUFFICIENT_DATA, message, cause);
    }
}
