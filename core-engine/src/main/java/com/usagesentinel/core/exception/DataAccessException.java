package com.usagesentinel.core.exception;

/**
 * Raised by a {@link com.usagesentinel.core.loader.SeriesLoader} when the
 * backing store cannot be reached or queried. Retryable.
 *
 * @since 1.0.0
 */
public class DataAccessException extends SentinelException {

    private static final long serialVersionUID = 1L;

    public DataAccessException(String message) {
        super(message, ErrorCode.DATA_ACCESS_FAILED, true);
    }

    public DataAccessException(String message, Throwable cause) {
        super(message, ErrorCode.DATA_ACCESS_FAILED, true, cause);
    }

    public DataAccessException(String message, ErrorCode errorCode, Throwable cause) {
        super(message, errorCode, true, cause);
    }
}
