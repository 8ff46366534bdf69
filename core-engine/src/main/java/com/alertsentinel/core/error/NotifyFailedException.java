package com.alertsentinel.core.error;

/**
 * Raised by notifiers when a notification could not be handed off.
 */
public class NotifyFailedException extends AlertEngineException {

    private static final long serialVersionUID = 1L;

    public NotifyFailedException(String message) {
        super(ErrorKind.NOTIFY_FAILED, message);
    }

    public NotifyFailedException(String message, Throwable cause) {
        super(ErrorKind.NOTIFY_FAILED, message, cause);
    }
}
