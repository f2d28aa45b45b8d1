package com.usagesentinel.core.exception;

/**
 * Base exception for every failure the detection engine reports to callers.
 *
 * <p>
 * Carries a stable {@link ErrorCode} and a flag telling the caller whether
 * repeating the same request may succeed. The engine itself never retries.
 * </p>
 *
 * @since 1.0.0
 */
public class SentinelException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode errorCode;
    private final boolean retryable;

    public SentinelException(String message, ErrorCode errorCode, boolean retryable) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public SentinelException(String message, ErrorCode errorCode, boolean retryable, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
