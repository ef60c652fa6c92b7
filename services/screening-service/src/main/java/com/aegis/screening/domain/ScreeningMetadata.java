package com.aegis.screening.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Set;

/**
 * Audit summary attached to every screening result
 */
@Getter
@Builder
@ToString
public class ScreeningMetadata {

    private final int recordsEvaluated;
    private final int failedEvaluations;
    private final int degradedStrategies;
    private final Set<String> sources;
    private final Set<MatchStrategy> strategies;
}
