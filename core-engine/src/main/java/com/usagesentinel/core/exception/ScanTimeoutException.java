package com.usagesentinel.core.exception;

/**
 * Raised when a fleet scan is cut short by the caller's deadline or by
 * thread interruption. Pending per-key fetches are cancelled before this is
 * thrown.
 *
 * @since 1.0.0
 */
public class ScanTimeoutException extends SentinelException {

    private static final long serialVersionUID = 1L;

    public ScanTimeoutException(String message) {
        super(message, ErrorCode.SCAN_TIMEOUT, true);
    }

    public ScanTimeoutException(String message, ErrorCode errorCode, Throwable cause) {
        super(message, errorCode, true, cause);
    }
}
