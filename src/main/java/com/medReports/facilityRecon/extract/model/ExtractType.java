package com.medReports.facilityRecon.extract.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * Kinds of source extract the reconciliation consumes.
 *
 * Each kind names the columns a row must carry and the identifier scheme of its patient ids.
 * Ids from different schemes are never compared with each other.
 */
@Getter
@RequiredArgsConstructor
public enum ExtractType {

    ADMISSION_DISCHARGE_TRANSFER("adt", "resident", List.of("first_name", "last_name")),
    LENGTH_OF_STAY("los", null, List.of("first_name", "last_name")),
    CHARGE_CAPTURE("visits", "billing", List.of("first_name", "last_name")),
    FUNCTIONAL_ASSESSMENT("gg", null, List.of("first_name", "last_name"));

    /**
     * Short code used in upload file names and issue reports.
     */
    private final String code;

    /**
     * Identifier scheme of the patient ids this extract supplies, or null when it carries none.
     */
    private final String identifierScheme;

    private final List<String> requiredColumns;
}
