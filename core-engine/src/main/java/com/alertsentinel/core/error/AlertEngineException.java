package com.alertsentinel.core.error;

import java.util.Objects;

/**
 * Base class for all failures raised by the alert engine.
 *
 * <p>
 * Unchecked so that detectors and ports can surface failures without
 * widening every signature. The {@link ErrorKind} decides how the failure is
 * handled further up.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertEngineException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    public AlertEngineException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "ErrorKind must not be null");
    }

    public AlertEngineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "ErrorKind must not be null");
    }

    /**
     * @return the failure classification
     */
    public ErrorKind getKind() {
        return kind;
    }
}
