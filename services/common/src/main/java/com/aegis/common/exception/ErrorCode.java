package com.aegis.common.exception;

/**
 * Error codes for the Aegis screening platform
 * Format: MODULE_CATEGORY_SPECIFIC_ERROR
 */
public enum ErrorCode {

    // ===== VALIDATION ERRORS (VAL_XXX) =====
    VALIDATION_FAILED("VAL_000", "Validation failed"),
    VAL_REQUIRED_FIELD("VAL_001", "Required field is missing"),
    VAL_INVALID_FORMAT("VAL_002", "Invalid field format"),

    // ===== SCREENING ERRORS (SCR_XXX) =====
    SCR_MALFORMED_RECORD("SCR_001", "Malformed watchlist record"),
    SCR_SIMILARITY_UNAVAILABLE("SCR_002", "Similarity provider unavailable"),
    SCR_TIMEOUT("SCR_003", "Screening timed out"),

    // ===== INTEGRATION ERRORS (INT_XXX) =====
    INT_WATCHLIST_LOAD_FAILED("INT_001", "Watchlist could not be loaded"),

    // ===== SYSTEM ERRORS (SYS_XXX) =====
    SYS_INTERNAL_ERROR("SYS_001", "Internal system error"),
    SYS_CONFIGURATION_ERROR("SYS_002", "System configuration error");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    /**
     * Whether the caller supplied bad input (as opposed to a platform failure)
     */
    public boolean isClientError() {
        return code.startsWith("VAL_");
    }

    /**
     * Find error code by code string
     */
    public static ErrorCode fromCode(String code) {
        for (ErrorCode errorCode : values()) {
            if (errorCode.code.equals(code)) {
                return errorCode;
            }
        }
        return SYS_INTERNAL_ERROR;
    }
}
