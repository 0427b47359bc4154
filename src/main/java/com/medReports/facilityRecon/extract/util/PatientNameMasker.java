package com.medReports.facilityRecon.extract.util;

/**
 * Utility class for masking patient names in logs (privacy compliance).
 */
public class PatientNameMasker {

    /**
     * Masks a patient name for logging.
     * Shows the first letter of each part, masks the rest.
     *
     * @param firstName Patient first name
     * @param lastName Patient last name
     * @return Masked name (e.g., "J*** S***")
     */
    public static String mask(String firstName, String lastName) {
        return maskPart(firstName) + " " + maskPart(lastName);
    }

    private static String maskPart(String part) {
        if (part == null || part.isBlank()) {
            return "****";
        }
        return part.trim().charAt(0) + "***";
    }
}
