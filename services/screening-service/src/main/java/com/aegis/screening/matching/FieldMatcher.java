package com.aegis.screening.matching;

import com.aegis.screening.domain.Candidate;
import com.aegis.screening.domain.MatchedField;
import com.aegis.screening.domain.WatchlistRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Compares the identity attributes that both sides actually carry.
 *
 * <p>Date of birth equality scores 0.9, document number equality 0.95 and
 * nationality contributes its weighted lexical similarity scaled by 0.7.
 * The field score is the maximum of whatever could be computed, 0 when nothing could.
 */
@Component
@RequiredArgsConstructor
public class FieldMatcher {

    static final double DATE_OF_BIRTH_SCORE = 0.9;
    static final double DOCUMENT_NUMBER_SCORE = 0.95;
    static final double NATIONALITY_WEIGHT = 0.7;

    private final LexicalMatcher lexicalMatcher;

    public double score(Candidate candidate, WatchlistRecord record) {
        double best = 0.0;
        if (candidate.getDateOfBirth() != null && record.getDateOfBirth() != null
                && candidate.getDateOfBirth().equals(record.getDateOfBirth())) {
            best = Math.max(best, DATE_OF_BIRTH_SCORE);
        }
        if (hasText(candidate.getDocumentNumber()) && hasText(record.getDocumentNumber())
                && candidate.getDocumentNumber().trim().equals(record.getDocumentNumber().trim())) {
            best = Math.max(best, DOCUMENT_NUMBER_SCORE);
        }
        if (hasText(candidate.getNationality()) && hasText(record.getNationality())) {
            best = Math.max(best,
                lexicalMatcher.similarity(candidate.getNationality(), record.getNationality()) * NATIONALITY_WEIGHT);
        }
        return best;
    }

    /**
     * Fields that agree exactly (nationality case-insensitively)
     */
    public Set<MatchedField> matchedFields(Candidate candidate, WatchlistRecord record) {
        Set<MatchedField> fields = EnumSet.noneOf(MatchedField.class);
        if (candidate.getDateOfBirth() != null && candidate.getDateOfBirth().equals(record.getDateOfBirth())) {
            fields.add(MatchedField.DATE_OF_BIRTH);
        }
        if (hasText(candidate.getNationality()) && hasText(record.getNationality())
                && candidate.getNationality().trim().equalsIgnoreCase(record.getNationality().trim())) {
            fields.add(MatchedField.NATIONALITY);
        }
        if (hasText(candidate.getDocumentNumber()) && hasText(record.getDocumentNumber())
                && candidate.getDocumentNumber().trim().equals(record.getDocumentNumber().trim())) {
            fields.add(MatchedField.PASSPORT_NUMBER);
        }
        return fields;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
