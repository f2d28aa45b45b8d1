package com.usagesentinel.core.exception;

/**
 * Raised when a request or a loaded record is malformed: missing region or
 * item, a negative or non-numeric quantity, an unparsable window.
 *
 * <p>
 * Never retryable; the message is safe to return to the caller verbatim.
 * </p>
 *
 * @since 1.0.0
 */
public class InvalidInputException extends SentinelException {

    private static final long serialVersionUID = 1L;

    public InvalidInputException(String message) {
        super(message, ErrorCode.MISSING_REQUIRED_FIELD, false);
    }

    public InvalidInputException(String message, ErrorCode errorCode) {
        super(message, errorCode, false);
    }

    public InvalidInputException(String message, ErrorCode errorCode, Throwable cause) {
        super(message, errorCode, false, cause);
    }
}
