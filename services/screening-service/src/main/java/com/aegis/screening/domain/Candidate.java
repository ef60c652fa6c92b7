package com.aegis.screening.domain;

import com.aegis.screening.exception.InvalidCandidateException;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * The party being screened. Immutable; construction rejects a blank name.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Candidate {

    private final String name;
    private final List<String> aliases;
    private final LocalDate dateOfBirth;
    private final String nationality;
    private final String documentNumber;
    private final EntityType entityType;

    @Builder(toBuilder = true)
    private Candidate(String name, List<String> aliases, LocalDate dateOfBirth,
                      String nationality, String documentNumber, EntityType entityType) {
        if (name == null || name.isBlank()) {
            throw new InvalidCandidateException("name", "Candidate name is required");
        }
        this.name = name.trim();
        this.aliases = cleanAliases(aliases);
        this.dateOfBirth = dateOfBirth;
        this.nationality = blankToNull(nationality);
        this.documentNumber = blankToNull(documentNumber);
        this.entityType = entityType != null ? entityType : EntityType.INDIVIDUAL;
    }

    /**
     * Primary name followed by every alias
     */
    public List<String> allNames() {
        List<String> names = new ArrayList<>(aliases.size() + 1);
        names.add(name);
        names.addAll(aliases);
        return names;
    }

    private static List<String> cleanAliases(List<String> aliases) {
        if (aliases == null) {
            return List.of();
        }
        return aliases.stream()
            .filter(alias -> alias != null && !alias.isBlank())
            .map(String::trim)
            .toList();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
