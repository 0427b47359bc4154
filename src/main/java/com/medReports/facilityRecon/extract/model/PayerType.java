package com.medReports.facilityRecon.extract.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Payer classification of a stay. Every label other than Medicare A counts as managed care.
 */
@Getter
@RequiredArgsConstructor
public enum PayerType {

    MANAGED_CARE("Managed Care", "MC"),
    MEDICARE_A("Medicare A", "MA");

    private final String label;
    private final String shortCode;

    /**
     * @param rawLabel Payer label as written in the extract
     * @return Payer type, or null when the label is blank (unclassified)
     */
    public static PayerType fromLabel(String rawLabel) {
        if (rawLabel == null || rawLabel.isBlank()) {
            return null;
        }
        return rawLabel.trim().equalsIgnoreCase(MEDICARE_A.label) ? MEDICARE_A : MANAGED_CARE;
    }
}
