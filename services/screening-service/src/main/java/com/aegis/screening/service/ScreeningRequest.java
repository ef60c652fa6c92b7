package com.aegis.screening.service;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Raw screening input as received from a caller. Dates and types are still
 * strings here and are validated when the candidate is built.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScreeningRequest {

    private String name;
    private List<String> aliases;
    /**
     * ISO-8601 date, e.g. 1980-05-15
     */
    private String dateOfBirth;
    private String nationality;
    private String documentNumber;
    private String entityType;
}
