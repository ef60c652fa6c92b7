package com.aegis.screening.matching;

import com.aegis.screening.domain.Candidate;
import com.aegis.screening.domain.MatchFinding;
import com.aegis.screening.domain.MatchStrategy;
import com.aegis.screening.domain.MatchedField;
import com.aegis.screening.domain.ScreeningThresholds;
import com.aegis.screening.domain.WatchlistRecord;
import com.aegis.screening.exception.SimilarityProviderException;
import com.aegis.screening.semantic.SimilarityProvider;
import com.aegis.screening.support.WatchlistFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("EntryEvaluator")
class EntryEvaluatorTest {

    @Mock
    private SimilarityProvider similarityProvider;

    private EntryEvaluator evaluator;
    private final ScreeningThresholds thresholds = ScreeningThresholds.defaults();
    private final WatchlistRecord johnSmith = WatchlistFixtures.johnSmith();

    @BeforeEach
    void setUp() {
        evaluator = WatchlistFixtures.evaluator(similarityProvider);
    }

    @Test
    @DisplayName("Exact name match short-circuits without consulting the similarity provider")
    void exactMatchShortCircuits() {
        Candidate candidate = Candidate.builder().name("john SMITH").nationality("American").build();

        EntryEvaluation evaluation = evaluator.evaluate(candidate, johnSmith, thresholds);

        MatchFinding finding = evaluation.finding().orElseThrow();
        assertThat(finding.getStrategy()).isEqualTo(MatchStrategy.EXACT);
        assertThat(finding.getConfidence()).isEqualTo(1.0);
        assertThat(finding.getRiskContribution()).isEqualTo(1.0);
        assertThat(finding.getMatchedFields()).containsExactlyInAnyOrder(MatchedField.NAME, MatchedField.NATIONALITY);
        verifyNoInteractions(similarityProvider);
    }

    @Test
    @DisplayName("Fuzzy name match at or above the fuzzy threshold")
    void fuzzyMatch() {
        WatchlistRecord withoutAliases = WatchlistFixtures.record("OFAC-1", "OFAC", "John Smith");
        Candidate candidate = Candidate.builder().name("Johnny Smith").build();

        EntryEvaluation evaluation = evaluator.evaluate(candidate, withoutAliases, thresholds);

        MatchFinding finding = evaluation.finding().orElseThrow();
        assertThat(finding.getStrategy()).isEqualTo(MatchStrategy.FUZZY);
        assertThat(finding.getConfidence()).isCloseTo(0.887, within(0.001));
        assertThat(finding.getRiskContribution()).isEqualTo(finding.getConfidence());
        assertThat(finding.getMatchedFields()).containsExactly(MatchedField.NAME);
        verifyNoInteractions(similarityProvider);
    }

    @Test
    @DisplayName("Semantic match is tried when the fuzzy score is too low")
    void semanticMatch() {
        WatchlistRecord hezbollah = WatchlistFixtures.record("OFAC-3", "OFAC", "Hezbollah", "Party of God");
        when(similarityProvider.batchSimilarity(anyString(), anyList())).thenReturn(List.of(0.90, 0.40));

        EntryEvaluation evaluation = evaluator.evaluate(
            Candidate.builder().name("Hizb Allah").build(), hezbollah, thresholds);

        MatchFinding finding = evaluation.finding().orElseThrow();
        assertThat(finding.getStrategy()).isEqualTo(MatchStrategy.SEMANTIC);
        assertThat(finding.getConfidence()).isEqualTo(0.90);
        assertThat(evaluation.isDegraded()).isFalse();
    }

    @Test
    @DisplayName("Semantic score below the similarity threshold produces no finding")
    void semanticBelowThreshold() {
        WatchlistRecord hamas = WatchlistFixtures.record("OFAC-4", "OFAC", "Hamas");
        when(similarityProvider.batchSimilarity(anyString(), anyList())).thenReturn(List.of(0.84));

        EntryEvaluation evaluation = evaluator.evaluate(
            Candidate.builder().name("Peter Parker").build(), hamas, thresholds);

        assertThat(evaluation.finding()).isEmpty();
        assertThat(evaluation.isFailed()).isFalse();
    }

    @Test
    @DisplayName("Field-only match is reported as FUZZY without NAME")
    void fieldOnlyMatchIsReportedAsFuzzy() {
        when(similarityProvider.batchSimilarity(anyString(), anyList())).thenReturn(List.of(0.0, 0.0, 0.0));
        Candidate candidate = Candidate.builder()
            .name("Peter Parker")
            .documentNumber("A12345678")
            .build();

        EntryEvaluation evaluation = evaluator.evaluate(candidate, johnSmith, thresholds);

        MatchFinding finding = evaluation.finding().orElseThrow();
        assertThat(finding.getStrategy()).isEqualTo(MatchStrategy.FUZZY);
        assertThat(finding.getConfidence()).isEqualTo(0.95);
        assertThat(finding.getMatchedFields()).containsExactly(MatchedField.PASSPORT_NUMBER);
    }

    @Test
    @DisplayName("A failing provider degrades to 0 and evaluation continues with fields")
    void providerFailureContinuesWithFields() {
        when(similarityProvider.batchSimilarity(anyString(), anyList()))
            .thenThrow(new SimilarityProviderException("timeout"));
        Candidate candidate = Candidate.builder()
            .name("Peter Parker")
            .dateOfBirth(LocalDate.of(1980, 5, 15))
            .build();

        EntryEvaluation evaluation = evaluator.evaluate(candidate, johnSmith, thresholds);

        assertThat(evaluation.isDegraded()).isTrue();
        assertThat(evaluation.isFailed()).isFalse();
        assertThat(evaluation.finding()).map(MatchFinding::getConfidence).contains(0.9);
    }

    @Test
    @DisplayName("Malformed record is skipped and flagged as failed")
    void malformedRecordIsSkipped() {
        WatchlistRecord nameless = WatchlistRecord.builder().id("BROKEN-1").source("OFAC").build();

        EntryEvaluation evaluation = evaluator.evaluate(
            Candidate.builder().name("John Smith").build(), nameless, thresholds);

        assertThat(evaluation.isFailed()).isTrue();
        assertThat(evaluation.finding()).isEmpty();
        verifyNoInteractions(similarityProvider);
    }

    @Test
    @DisplayName("Raising the fuzzy threshold turns a fuzzy hit into a miss")
    void thresholdOverrideApplies() {
        WatchlistRecord withoutAliases = WatchlistFixtures.record("OFAC-1", "OFAC", "John Smith");
        when(similarityProvider.batchSimilarity(anyString(), anyList())).thenReturn(List.of(0.0));
        ScreeningThresholds strict = thresholds.toBuilder().fuzzyThreshold(0.95).build();

        EntryEvaluation evaluation = evaluator.evaluate(
            Candidate.builder().name("Johnny Smith").build(), withoutAliases, strict);

        assertThat(evaluation.finding()).isEmpty();
    }
}
