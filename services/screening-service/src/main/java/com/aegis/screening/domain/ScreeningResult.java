package com.aegis.screening.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of screening one candidate against one watchlist snapshot.
 *
 * <p>Findings are ordered by descending risk contribution and always
 * included, even for a CLEAR decision, so the result can be audited.
 */
@Getter
@Builder
@ToString
public class ScreeningResult {

    private final String screeningId;
    private final Candidate candidate;
    private final List<MatchFinding> findings;
    private final double riskScore;
    private final Decision decision;
    private final double confidence;
    private final Duration latency;
    private final Instant screenedAt;
    private final ScreeningMetadata metadata;

    public boolean hasFindings() {
        return findings != null && !findings.isEmpty();
    }

    @JsonIgnore
    public Optional<MatchFinding> getTopFinding() {
        return hasFindings() ? Optional.of(findings.get(0)) : Optional.empty();
    }
}
