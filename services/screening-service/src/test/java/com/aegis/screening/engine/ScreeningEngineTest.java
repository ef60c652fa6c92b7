package com.aegis.screening.engine;

import com.aegis.screening.domain.Candidate;
import com.aegis.screening.domain.Decision;
import com.aegis.screening.domain.MatchFinding;
import com.aegis.screening.domain.MatchStrategy;
import com.aegis.screening.domain.ScreeningResult;
import com.aegis.screening.domain.ScreeningThresholds;
import com.aegis.screening.domain.WatchlistRecord;
import com.aegis.screening.semantic.NoOpSimilarityProvider;
import com.aegis.screening.support.WatchlistFixtures;
import com.aegis.screening.watchlist.InMemoryWatchlistStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("ScreeningEngine")
class ScreeningEngineTest {

    private static ScreeningEngine engineOver(InMemoryWatchlistStore store) {
        return new ScreeningEngine(store, WatchlistFixtures.evaluator(new NoOpSimilarityProvider()),
            ScreeningThresholds.defaults());
    }

    @Nested
    @DisplayName("against the sample watchlist")
    class SampleWatchlist {

        private final ScreeningEngine engine = engineOver(WatchlistFixtures.seededStore());

        @Test
        @DisplayName("John Smith is an exact OFAC hit and is blocked")
        void johnSmithIsBlocked() {
            ScreeningResult result = engine.screen(Candidate.builder().name("John Smith").build());

            assertThat(result.getDecision()).isEqualTo(Decision.BLOCK);
            assertThat(result.getRiskScore()).isEqualTo(1.0);
            assertThat(result.getConfidence()).isEqualTo(0.95);
            assertThat(result.getFindings()).hasSize(1);
            MatchFinding finding = result.getFindings().get(0);
            assertThat(finding.getStrategy()).isEqualTo(MatchStrategy.EXACT);
            assertThat(finding.getRecord().getSource()).isEqualTo("OFAC");
            assertThat(result.getMetadata().getSources()).containsExactly("OFAC");
            assertThat(result.getMetadata().getRecordsEvaluated()).isEqualTo(10);
        }

        @Test
        @DisplayName("Alice Johnson has no correspondence and is cleared with full confidence")
        void aliceJohnsonIsCleared() {
            ScreeningResult result = engine.screen(Candidate.builder().name("Alice Johnson").build());

            assertThat(result.getDecision()).isEqualTo(Decision.CLEAR);
            assertThat(result.getRiskScore()).isZero();
            assertThat(result.getConfidence()).isEqualTo(1.0);
            assertThat(result.getFindings()).isEmpty();
            assertThat(result.hasFindings()).isFalse();
        }

        @Test
        @DisplayName("A spelling variant of a listed alias is blocked as a fuzzy hit")
        void spellingVariantIsFuzzyHit() {
            ScreeningResult result = engine.screen(Candidate.builder().name("Usama bin Ladin").build());

            assertThat(result.getDecision()).isEqualTo(Decision.BLOCK);
            assertThat(result.getFindings()).singleElement()
                .extracting(MatchFinding::getStrategy)
                .isEqualTo(MatchStrategy.FUZZY);
            assertThat(result.getRiskScore()).isCloseTo(0.933, within(0.001));
        }

        @Test
        @DisplayName("Screening the same candidate twice yields the same findings and score")
        void screeningIsIdempotent() {
            Candidate candidate = Candidate.builder().name("Jon Smyth").nationality("American").build();

            ScreeningResult first = engine.screen(candidate);
            ScreeningResult second = engine.screen(candidate);

            assertThat(second.getFindings()).isEqualTo(first.getFindings());
            assertThat(second.getRiskScore()).isEqualTo(first.getRiskScore());
            assertThat(second.getDecision()).isEqualTo(first.getDecision());
            assertThat(second.getScreeningId()).isNotEqualTo(first.getScreeningId());
        }
    }

    @Test
    @DisplayName("Johnny Smith against a plain John Smith entry goes to review")
    void johnnySmithNeedsReview() {
        ScreeningEngine engine = engineOver(WatchlistFixtures.storeWith(
            WatchlistFixtures.record("OFAC-1", "OFAC", "John Smith")));

        ScreeningResult result = engine.screen(Candidate.builder().name("Johnny Smith").build());

        assertThat(result.getDecision()).isIn(Decision.REVIEW, Decision.BLOCK);
        assertThat(result.getDecision()).isEqualTo(Decision.REVIEW);
        assertThat(result.getConfidence()).isEqualTo(0.85);
        assertThat(result.getFindings()).singleElement()
            .extracting(MatchFinding::getStrategy)
            .isEqualTo(MatchStrategy.FUZZY);
    }

    @Test
    @DisplayName("Per-call thresholds override the defaults")
    void perCallThresholdsOverrideDefaults() {
        ScreeningEngine engine = engineOver(WatchlistFixtures.storeWith(
            WatchlistFixtures.record("OFAC-1", "OFAC", "John Smith")));
        ScreeningThresholds strict = ScreeningThresholds.defaults().toBuilder().fuzzyThreshold(0.95).build();

        ScreeningResult result = engine.screen(Candidate.builder().name("Johnny Smith").build(), strict);

        assertThat(result.getDecision()).isEqualTo(Decision.CLEAR);
        assertThat(result.getFindings()).isEmpty();
    }

    @Test
    @DisplayName("Inactive records are never evaluated")
    void inactiveRecordsAreIgnored() {
        WatchlistRecord delisted = WatchlistFixtures.johnSmith().toBuilder().active(false).build();
        ScreeningEngine engine = engineOver(WatchlistFixtures.storeWith(delisted));

        ScreeningResult result = engine.screen(Candidate.builder().name("John Smith").build());

        assertThat(result.getDecision()).isEqualTo(Decision.CLEAR);
        assertThat(result.getMetadata().getRecordsEvaluated()).isZero();
    }

    @Test
    @DisplayName("Findings are sorted by descending risk and a malformed record is skipped")
    void findingsSortedAndMalformedSkipped() {
        WatchlistRecord broken = WatchlistRecord.builder().id("BROKEN").source("UN").build();
        ScreeningEngine engine = engineOver(WatchlistFixtures.storeWith(
            WatchlistFixtures.record("OFAC-1", "OFAC", "John Smith"),
            broken,
            WatchlistFixtures.record("EU-1", "EU", "Johnny Smith")));

        ScreeningResult result = engine.screen(Candidate.builder().name("Johnny Smith").build());

        List<MatchFinding> findings = result.getFindings();
        assertThat(findings).hasSize(2);
        assertThat(findings.get(0).getStrategy()).isEqualTo(MatchStrategy.EXACT);
        assertThat(findings.get(0).getRiskContribution())
            .isGreaterThanOrEqualTo(findings.get(1).getRiskContribution());
        assertThat(result.getMetadata().getFailedEvaluations()).isEqualTo(1);
        assertThat(result.getMetadata().getSources()).containsExactlyInAnyOrder("OFAC", "EU");
        // (1.0^2 + r^2) / (1.0 + r) with r the fuzzy score
        double fuzzy = findings.get(1).getRiskContribution();
        assertThat(result.getRiskScore()).isCloseTo((1.0 + fuzzy * fuzzy) / (1.0 + fuzzy), within(1e-12));
        assertThat(result.getDecision()).isEqualTo(Decision.BLOCK);
    }
}
