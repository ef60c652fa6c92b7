package com.aegis.screening.exception;

import com.aegis.common.exception.ErrorCode;

/**
 * Raised by a similarity provider when it cannot produce a score.
 * The semantic matcher converts it into a failed strategy outcome.
 */
public class SimilarityProviderException extends ScreeningException {

    public SimilarityProviderException(String message) {
        super(ErrorCode.SCR_SIMILARITY_UNAVAILABLE, message);
    }

    public SimilarityProviderException(String message, Throwable cause) {
        super(ErrorCode.SCR_SIMILARITY_UNAVAILABLE, message, cause);
    }
}
