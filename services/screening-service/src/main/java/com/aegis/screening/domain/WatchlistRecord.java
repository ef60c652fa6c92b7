package com.aegis.screening.domain;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * One sanctioned-entity entry as published by a list authority.
 *
 * <p>Records are read-only snapshots owned by the watchlist store. No
 * validation happens here: a malformed record is detected and skipped by
 * the entry evaluator so a single bad entry cannot abort a screening call.
 */
@Getter
@Builder(toBuilder = true)
@Jacksonized
@ToString
@EqualsAndHashCode
public class WatchlistRecord {

    private final String id;
    private final String listName;
    private final String source;
    private final String country;
    private final String name;
    @Builder.Default
    private final List<String> aliases = List.of();
    private final LocalDate dateOfBirth;
    private final String nationality;
    private final String documentNumber;
    @Builder.Default
    private final EntityType entityType = EntityType.INDIVIDUAL;
    private final LocalDate designationDate;
    private final String reason;
    @Builder.Default
    private final boolean active = true;

    /**
     * Canonical name followed by every non-blank alias
     */
    public List<String> allNames() {
        List<String> names = new ArrayList<>();
        names.add(name);
        if (aliases != null) {
            aliases.stream()
                .filter(alias -> alias != null && !alias.isBlank())
                .forEach(names::add);
        }
        return names;
    }
}
