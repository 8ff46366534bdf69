package com.alertsentinel.core.error;

import java.util.List;

/**
 * Raised when an alert or detector configuration is rejected at the
 * acceptance boundary.
 *
 * <p>
 * Validators collect every problem they find and report them together via
 * {@link #fromErrors(String, List)}, so a single round trip shows the caller
 * everything that needs fixing.
 * </p>
 */
public class InvalidConfigException extends AlertEngineException {

    private static final long serialVersionUID = 1L;

    public InvalidConfigException(String message) {
        super(ErrorKind.INVALID_CONFIG, message);
    }

    public InvalidConfigException(String message, Throwable cause) {
        super(ErrorKind.INVALID_CONFIG, message, cause);
    }

    /**
     * Build an exception listing all collected validation errors.
     *
     * @param subject what was validated, e.g. {@code "ZScoreConfig"}
     * @param errors  non-empty list of error messages
     * @return exception whose message joins every error with {@code "; "}
     */
    public static InvalidConfigException fromErrors(String subject, List<String> errors) {
        return new InvalidConfigException("Invalid " + subject + ": " + String.join("; ", errors));
    }
}
