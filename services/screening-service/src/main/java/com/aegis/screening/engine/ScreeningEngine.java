package com.aegis.screening.engine;

import com.aegis.screening.domain.Candidate;
import com.aegis.screening.domain.MatchFinding;
import com.aegis.screening.domain.MatchStrategy;
import com.aegis.screening.domain.ScreeningMetadata;
import com.aegis.screening.domain.ScreeningResult;
import com.aegis.screening.domain.ScreeningThresholds;
import com.aegis.screening.domain.WatchlistRecord;
import com.aegis.screening.matching.EntryEvaluation;
import com.aegis.screening.matching.EntryEvaluator;
import com.aegis.screening.watchlist.WatchlistStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Screens one candidate against every active watchlist record.
 *
 * <p>The engine holds no mutable state: the same candidate, thresholds and
 * watchlist snapshot always give the same findings, risk and decision, so it
 * is safe to call from many threads at once.
 *
 * @author Aegis Screening Team
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScreeningEngine {

    private static final Comparator<MatchFinding> BY_RISK_DESCENDING =
        Comparator.comparingDouble(MatchFinding::getRiskContribution).reversed();

    private final WatchlistStore watchlistStore;
    private final EntryEvaluator entryEvaluator;
    private final ScreeningThresholds defaultThresholds;

    public ScreeningResult screen(Candidate candidate) {
        return screen(candidate, defaultThresholds);
    }

    public ScreeningResult screen(Candidate candidate, ScreeningThresholds thresholds) {
        long startNanos = System.nanoTime();
        ScreeningThresholds effective = thresholds != null ? thresholds : defaultThresholds;
        List<WatchlistRecord> records = watchlistStore.activeRecords();

        List<MatchFinding> findings = new ArrayList<>();
        int evaluated = 0;
        int failed = 0;
        int degraded = 0;
        for (WatchlistRecord record : records) {
            if (record == null || !record.isActive()) {
                continue;
            }
            evaluated++;
            EntryEvaluation evaluation = entryEvaluator.evaluate(candidate, record, effective);
            if (evaluation.isFailed()) {
                failed++;
            }
            if (evaluation.isDegraded()) {
                degraded++;
            }
            evaluation.finding().ifPresent(findings::add);
        }

        // stable sort keeps watchlist order among equal risks
        findings.sort(BY_RISK_DESCENDING);
        double risk = RiskAggregator.aggregate(findings);
        Classification classification = DecisionClassifier.classify(risk, !findings.isEmpty(), effective);
        Duration latency = Duration.ofNanos(System.nanoTime() - startNanos);

        if (failed > 0) {
            log.warn("Screening of '{}' skipped {} of {} records", candidate.getName(), failed, evaluated);
        }
        log.debug("Screened '{}': {} findings, risk {}, decision {}",
            candidate.getName(), findings.size(), risk, classification.decision());

        return ScreeningResult.builder()
            .screeningId(UUID.randomUUID().toString())
            .candidate(candidate)
            .findings(List.copyOf(findings))
            .riskScore(risk)
            .decision(classification.decision())
            .confidence(classification.confidence())
            .latency(latency)
            .screenedAt(Instant.now())
            .metadata(metadata(findings, evaluated, failed, degraded))
            .build();
    }

    private static ScreeningMetadata metadata(List<MatchFinding> findings, int evaluated, int failed, int degraded) {
        Set<String> sources = new LinkedHashSet<>();
        Set<MatchStrategy> strategies = EnumSet.noneOf(MatchStrategy.class);
        for (MatchFinding finding : findings) {
            if (finding.getRecord().getSource() != null) {
                sources.add(finding.getRecord().getSource());
            }
            strategies.add(finding.getStrategy());
        }
        return ScreeningMetadata.builder()
            .recordsEvaluated(evaluated)
            .failedEvaluations(failed)
            .degradedStrategies(degraded)
            .sources(Set.copyOf(sources))
            .strategies(Set.copyOf(strategies))
            .build();
    }
}
