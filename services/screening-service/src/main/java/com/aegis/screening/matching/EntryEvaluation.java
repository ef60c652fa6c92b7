package com.aegis.screening.matching;

import com.aegis.screening.domain.MatchFinding;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * What evaluating one record produced: at most one finding, plus whether a
 * strategy degraded or the record could not be evaluated at all
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class EntryEvaluation {

    private static final EntryEvaluation NO_MATCH = new EntryEvaluation(null, false, false);

    private final MatchFinding finding;
    private final boolean degraded;
    private final boolean failed;

    public static EntryEvaluation match(MatchFinding finding, boolean degraded) {
        return new EntryEvaluation(finding, degraded, false);
    }

    public static EntryEvaluation noMatch(boolean degraded) {
        return degraded ? new EntryEvaluation(null, true, false) : NO_MATCH;
    }

    public static EntryEvaluation failed() {
        return new EntryEvaluation(null, false, true);
    }

    public Optional<MatchFinding> finding() {
        return Optional.ofNullable(finding);
    }
}
