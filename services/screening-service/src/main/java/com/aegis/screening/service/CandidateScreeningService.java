package com.aegis.screening.service;

import com.aegis.screening.domain.Candidate;
import com.aegis.screening.domain.EntityType;
import com.aegis.screening.domain.ScreeningResult;
import com.aegis.screening.domain.ScreeningThresholds;
import com.aegis.screening.engine.ScreeningEngine;
import com.aegis.screening.exception.InvalidCandidateException;
import com.aegis.screening.metrics.ScreeningMetricsService;
import com.aegis.screening.persistence.ScreeningResultStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Ad hoc screening of a single identity.
 *
 * <p>Input is validated before any matching runs; a blank name, malformed
 * date of birth or unknown entity type is rejected with
 * {@link InvalidCandidateException}. Results are stored for audit, and a
 * failing store is logged without affecting the returned result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CandidateScreeningService {

    private final ScreeningEngine screeningEngine;
    private final ScreeningResultStore resultStore;
    private final ScreeningMetricsService metricsService;

    public ScreeningResult screen(ScreeningRequest request) {
        return screen(request, null);
    }

    /**
     * @param overrides thresholds for this call only, or null for the configured defaults
     */
    public ScreeningResult screen(ScreeningRequest request, ScreeningThresholds overrides) {
        Candidate candidate = toCandidate(request);
        ScreeningResult result = overrides != null
            ? screeningEngine.screen(candidate, overrides)
            : screeningEngine.screen(candidate);

        metricsService.recordCandidateScreening(result);
        try {
            resultStore.store(result);
        } catch (RuntimeException e) {
            metricsService.recordStoreFailure();
            log.error("Failed to store screening result {}", result.getScreeningId(), e);
        }

        log.info("Screened '{}': decision={}, risk={}, findings={}",
            candidate.getName(), result.getDecision(), result.getRiskScore(), result.getFindings().size());
        return result;
    }

    static Candidate toCandidate(ScreeningRequest request) {
        if (request == null) {
            throw new InvalidCandidateException("request", "Screening request is required");
        }
        return Candidate.builder()
            .name(request.getName())
            .aliases(request.getAliases())
            .dateOfBirth(parseDate(request.getDateOfBirth()))
            .nationality(request.getNationality())
            .documentNumber(request.getDocumentNumber())
            .entityType(EntityType.fromValue(request.getEntityType()))
            .build();
    }

    private static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidCandidateException("dateOfBirth", "Date of birth must be an ISO date: " + value, e);
        }
    }
}
