package com.aegis.screening.exception;

import com.aegis.common.exception.ErrorCode;

/**
 * Fatal misconfiguration detected while starting the pipeline
 */
public class ScreeningConfigurationException extends ScreeningException {

    public ScreeningConfigurationException(String message) {
        super(ErrorCode.SYS_CONFIGURATION_ERROR, message);
    }

    public ScreeningConfigurationException(String message, Throwable cause) {
        super(ErrorCode.SYS_CONFIGURATION_ERROR, message, cause);
    }
}
