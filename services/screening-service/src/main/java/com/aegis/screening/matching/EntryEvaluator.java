package com.aegis.screening.matching;

import com.aegis.screening.domain.Candidate;
import com.aegis.screening.domain.MatchFinding;
import com.aegis.screening.domain.MatchStrategy;
import com.aegis.screening.domain.MatchedField;
import com.aegis.screening.domain.ScreeningThresholds;
import com.aegis.screening.domain.WatchlistRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Evaluates one candidate against one watchlist record.
 *
 * <p>Strategies run in a fixed order and the first that clears its threshold
 * produces the finding:
 * <ol>
 *   <li>exact name (confidence 1.0, never consults the similarity provider)</li>
 *   <li>fuzzy name score at or above the fuzzy threshold</li>
 *   <li>semantic score at or above the similarity threshold</li>
 *   <li>field score at or above the field threshold, reported as FUZZY</li>
 * </ol>
 * A failing strategy scores 0 and evaluation continues with the next one.
 * A malformed record yields no finding and is flagged as failed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EntryEvaluator {

    private final LexicalMatcher lexicalMatcher;
    private final SemanticMatcher semanticMatcher;
    private final FieldMatcher fieldMatcher;

    public EntryEvaluation evaluate(Candidate candidate, WatchlistRecord record, ScreeningThresholds thresholds) {
        if (record == null || record.getName() == null || record.getName().isBlank()) {
            log.warn("Skipping malformed watchlist record {}", record != null ? record.getId() : null);
            return EntryEvaluation.failed();
        }

        try {
            List<String> candidateNames = candidate.allNames();
            List<String> recordNames = record.allNames();

            if (lexicalMatcher.isExactMatch(candidateNames, recordNames)) {
                return EntryEvaluation.match(MatchFinding.exact(record, nameFields(candidate, record)), false);
            }

            double fuzzyScore = lexicalMatcher.fuzzyScore(candidateNames, recordNames);
            if (fuzzyScore >= thresholds.getFuzzyThreshold()) {
                return EntryEvaluation.match(
                    MatchFinding.of(record, nameFields(candidate, record), MatchStrategy.FUZZY, fuzzyScore), false);
            }

            StrategyOutcome semantic = semanticMatcher.score(candidateNames, recordNames);
            if (semantic.meets(thresholds.getSimilarityThreshold())) {
                return EntryEvaluation.match(
                    MatchFinding.of(record, nameFields(candidate, record), MatchStrategy.SEMANTIC, semantic.getScore()),
                    false);
            }

            double fieldScore = fieldMatcher.score(candidate, record);
            if (fieldScore >= thresholds.getFieldThreshold() && fieldScore > 0.0) {
                return EntryEvaluation.match(
                    MatchFinding.of(record, fieldMatcher.matchedFields(candidate, record), MatchStrategy.FUZZY, fieldScore),
                    semantic.isFailed());
            }

            log.debug("No match against {} (fuzzy {}, semantic {}, field {})",
                record.getId(), fuzzyScore, semantic.getScore(), fieldScore);
            return EntryEvaluation.noMatch(semantic.isFailed());
        } catch (RuntimeException e) {
            log.warn("Evaluation of watchlist record {} failed: {}", record.getId(), e.getMessage(), e);
            return EntryEvaluation.failed();
        }
    }

    private Set<MatchedField> nameFields(Candidate candidate, WatchlistRecord record) {
        Set<MatchedField> fields = EnumSet.of(MatchedField.NAME);
        fields.addAll(fieldMatcher.matchedFields(candidate, record));
        return fields;
    }
}
