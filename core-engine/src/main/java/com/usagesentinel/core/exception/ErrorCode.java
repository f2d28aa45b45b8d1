package com.usagesentinel.core.exception;

/**
 * Stable error codes carried by every {@link SentinelException}.
 *
 * <p>
 * The prefix identifies the error family: {@code VAL} for rejected input,
 * {@code DAT} for storage access, {@code SCN} for fleet-scan control flow.
 * </p>
 *
 * @since 1.0.0
 */
public enum ErrorCode {

    // Validation errors (VAL_XXX)
    MISSING_REQUIRED_FIELD("VAL_001", "Required field is missing"),
    INVALID_QUANTITY("VAL_002", "Quantity must be a non-negative number"),
    INVALID_WINDOW("VAL_003", "Window days must be a positive integer"),
    MALFORMED_REQUEST("VAL_004", "Request query or body could not be parsed"),

    // Data access errors (DAT_XXX)
    DATA_ACCESS_FAILED("DAT_001", "Usage data could not be read"),
    SCHEMA_INITIALIZATION_FAILED("DAT_002", "Usage table could not be initialised"),

    // Scan errors (SCN_XXX)
    SCAN_TIMEOUT("SCN_001", "Fleet scan did not finish in time"),
    SCAN_INTERRUPTED("SCN_002", "Fleet scan was interrupted");

    private final String code;
    private final String description;

    ErrorCode(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    public static ErrorCode fromCode(String code) {
        for (ErrorCode errorCode : values()) {
            if (errorCode.code.equals(code)) {
                return errorCode;
            }
        }
        throw new IllegalArgumentException("Unknown error code: " + code);
    }
}
