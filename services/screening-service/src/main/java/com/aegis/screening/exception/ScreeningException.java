package com.aegis.screening.exception;

import com.aegis.common.exception.BusinessException;
import com.aegis.common.exception.ErrorCode;

/**
 * Base exception for screening failures
 */
public class ScreeningException extends BusinessException {

    public ScreeningException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public ScreeningException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
