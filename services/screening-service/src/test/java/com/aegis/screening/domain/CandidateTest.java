package com.aegis.screening.domain;

import com.aegis.screening.exception.InvalidCandidateException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CandidateTest {

    @Test
    @DisplayName("Blank names are rejected")
    void rejectsBlankName() {
        assertThatThrownBy(() -> Candidate.builder().name(" \t").build())
            .isInstanceOf(InvalidCandidateException.class)
            .extracting("field")
            .isEqualTo("name");
        assertThatThrownBy(() -> Candidate.builder().build())
            .isInstanceOf(InvalidCandidateException.class);
    }

    @Test
    @DisplayName("Aliases are trimmed and blanks dropped")
    void cleansAliases() {
        Candidate candidate = Candidate.builder()
            .name(" John Smith ")
            .aliases(Arrays.asList(" Johnny ", null, "", "J. Smith"))
            .nationality("  ")
            .build();

        assertThat(candidate.getName()).isEqualTo("John Smith");
        assertThat(candidate.getAliases()).containsExactly("Johnny", "J. Smith");
        assertThat(candidate.allNames()).containsExactly("John Smith", "Johnny", "J. Smith");
        assertThat(candidate.getNationality()).isNull();
        assertThat(candidate.getEntityType()).isEqualTo(EntityType.INDIVIDUAL);
    }
}
