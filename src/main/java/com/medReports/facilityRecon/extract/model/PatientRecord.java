package com.medReports.facilityRecon.extract.model;

import com.medReports.facilityRecon.facility.model.FacilityKey;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * One validated row of a source extract.
 *
 * The extract type tags which optional fields are meaningful: ADT rows carry admission and
 * discharge data, length-of-stay rows carry payer and days, charge-capture rows carry
 * place of service and CPT codes, functional-assessment rows carry scores.
 */
@Value
@Builder(toBuilder = true)
public class PatientRecord {

    /**
     * Unique within a run ({@code batchId#row}); identical rows stay distinct encounters.
     */
    String recordId;

    String batchId;

    ExtractType extractType;

    /**
     * Facility label as it appeared in the source.
     */
    String facilityLabel;

    /**
     * Canonical facility, set by the normalization stage.
     */
    FacilityKey facilityKey;

    String firstName;

    String lastName;

    /**
     * Patient id in the extract type's identifier scheme, when the source supplies one.
     */
    String patientId;

    LocalDate encounterDate;

    String placeOfServiceCode;

    /**
     * Null when the source left the payer blank.
     */
    PayerType payerType;

    @Builder.Default
    List<String> cptCodes = List.of();

    AssessmentScores assessmentScores;

    Integer lengthOfStayDays;

    LocalDate admissionDate;

    LocalDate dischargeDate;

    DischargeDisposition dischargeDisposition;

    public String getIdentifierScheme() {
        return extractType.getIdentifierScheme();
    }

    public boolean hasPatientId() {
        return patientId != null && !patientId.isBlank() && getIdentifierScheme() != null;
    }
}
