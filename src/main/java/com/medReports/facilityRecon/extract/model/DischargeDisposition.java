package com.medReports.facilityRecon.extract.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;

@Getter
@RequiredArgsConstructor
public enum DischargeDisposition {

    HOME_DISCHARGE("HD", "%Home Discharge"),
    HOSPITAL_TRANSFER("HT", "%Hospital Transfer"),
    EXPIRED("Ex", "%Expired"),
    OTHER("OT", "%Other");

    private final String ratioColumn;
    private final String percentColumn;

    /**
     * Maps an ADT "to type" value. A funeral home destination means the patient expired.
     *
     * @return Disposition, or null when the value is blank (no discharge)
     */
    public static DischargeDisposition fromToType(String toType) {
        if (toType == null || toType.isBlank()) {
            return null;
        }
        String value = toType.toLowerCase(Locale.ROOT);
        if (value.contains("hospital")) {
            return HOSPITAL_TRANSFER;
        }
        if (value.contains("funeral")) {
            return EXPIRED;
        }
        if (value.contains("home")) {
            return HOME_DISCHARGE;
        }
        return OTHER;
    }
}
