package com.aegis.screening.engine;

import com.aegis.screening.domain.Decision;

/**
 * Decision together with the confidence reported for it
 */
public record Classification(Decision decision, double confidence) {
}
