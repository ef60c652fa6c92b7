package com.aegis.screening.exception;

import com.aegis.common.exception.ErrorCode;

/**
 * Thrown when a screening candidate is rejected before matching begins
 * (blank name, malformed date of birth, unknown entity type).
 */
public class InvalidCandidateException extends ScreeningException {

    private final String field;

    public InvalidCandidateException(String field, String message) {
        super(ErrorCode.VALIDATION_FAILED, message);
        this.field = field;
        withMetadata("field", field);
    }

    public InvalidCandidateException(String field, String message, Throwable cause) {
        super(ErrorCode.VAL_INVALID_FORMAT, message, cause);
        this.field = field;
        withMetadata("field", field);
    }

    public String getField() {
        return field;
    }
}
