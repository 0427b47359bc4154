package com.medReports.facilityRecon.reconcile.service;

import com.medReports.facilityRecon.extract.model.AssessmentScores;
import com.medReports.facilityRecon.extract.model.DischargeDisposition;
import com.medReports.facilityRecon.extract.model.ExtractType;
import com.medReports.facilityRecon.extract.model.PatientRecord;
import com.medReports.facilityRecon.extract.model.PayerType;
import com.medReports.facilityRecon.extract.util.CptCodes;
import com.medReports.facilityRecon.facility.model.FacilityKey;
import com.medReports.facilityRecon.reconcile.model.EncounterCounts;
import com.medReports.facilityRecon.reconcile.model.FacilityMetricsRow;
import com.medReports.facilityRecon.reconcile.model.IdentityResolution;
import com.medReports.facilityRecon.reconcile.model.MatchedIdentity;
import com.medReports.facilityRecon.reconcile.model.PatientSummaryRow;
import com.medReports.facilityRecon.reconcile.model.PayerMetrics;
import com.medReports.facilityRecon.reconcile.model.ReconciledRecordSet;
import com.medReports.facilityRecon.reconcile.model.ReconciliationSettings;
import com.medReports.facilityRecon.reconcile.model.ReportingCategory;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Computes the metrics row of one facility from its reconciled records.
 *
 * Pure computation: nothing is kept between calls and the input is not modified.
 * Averages are rounded to two decimals, half-up. A group without qualifying patients
 * averages 0, and a ratio over no patients reads "0:0".
 */
@Slf4j
public class MetricsAggregator {

    private static final Comparator<PatientRecord> BY_ENCOUNTER_DATE =
            Comparator.comparing(PatientRecord::getEncounterDate, Comparator.nullsLast(Comparator.naturalOrder()));

    private final ReconciliationSettings settings;

    public MetricsAggregator(ReconciliationSettings settings) {
        this.settings = settings;
    }

    /**
     * Aggregates one facility.
     *
     * @param facility Facility being aggregated
     * @param records Its matched and deduplicated records
     * @return A new, fully populated metrics row
     */
    public FacilityMetricsRow aggregate(FacilityKey facility, ReconciledRecordSet records) {
        if (!facility.equals(records.getFacilityKey())) {
            throw new IllegalArgumentException("Record set of " + records.getFacilityKey() + " cannot be aggregated as " + facility);
        }

        List<MatchedIdentity> identities = records.getIdentities().getIdentities();
        int patientsServed = identities.size();
        int totalVisits = records.recordsOf(ExtractType.CHARGE_CAPTURE).size();

        Map<PayerType, PayerMetrics> payerMetrics = new EnumMap<>(PayerType.class);
        for (PayerType payerType : PayerType.values()) {
            List<MatchedIdentity> group = identities.stream()
                    .filter(identity -> payerTypesOf(identity).contains(payerType))
                    .toList();
            List<Double> gains = gainsOf(group);
            payerMetrics.put(payerType, PayerMetrics.builder()
                    .payerType(payerType)
                    .patientCount(group.size())
                    .ratio(ratio(group.size(), patientsServed))
                    .averageGain(average(gains))
                    .gainPatientCount(gains.size())
                    .averageLengthOfStay(averageLengthOfStay(group))
                    .build());
        }
        List<Double> overallGains = gainsOf(identities);

        Map<DischargeDisposition, Integer> dischargeCounts = dischargeCounts(records.getIdentities());
        Map<DischargeDisposition, String> dischargeRatios = new EnumMap<>(DischargeDisposition.class);
        Map<DischargeDisposition, Double> dischargePercentages = new EnumMap<>(DischargeDisposition.class);
        dischargeCounts.forEach((disposition, count) -> {
            dischargeRatios.put(disposition, ratio(count, patientsServed));
            dischargePercentages.put(disposition, patientsServed == 0 ? 0.0 : round(count * 100.0 / patientsServed));
        });

        FacilityMetricsRow row = FacilityMetricsRow.builder()
                .facilityKey(facility)
                .facilityName(records.getFacilityName())
                .patientsServed(patientsServed)
                .totalVisits(totalVisits)
                .averageVisitsPerPatient(patientsServed == 0 ? 0.0 : round((double) totalVisits / patientsServed))
                .averageLengthOfStay(averageLengthOfStay(identities))
                .categoryCounts(categoryCounts(records))
                .cptCodeCounts(cptCodeCounts(records))
                .payerMetrics(Collections.unmodifiableMap(payerMetrics))
                .overallAverageGain(average(overallGains))
                .overallGainPatientCount(overallGains.size())
                .dischargeCounts(Collections.unmodifiableMap(dischargeCounts))
                .dischargeRatios(Collections.unmodifiableMap(dischargeRatios))
                .dischargePercentages(Collections.unmodifiableMap(dischargePercentages))
                .build();

        log.debug("Facility aggregated - facility: {}, patientsServed: {}, totalVisits: {}",
                facility, patientsServed, totalVisits);
        return row;
    }

    /**
     * Lists every matched patient of the facility, in identity order.
     */
    public List<PatientSummaryRow> listPatients(ReconciledRecordSet records) {
        List<PatientSummaryRow> rows = new ArrayList<>();
        for (MatchedIdentity identity : records.getIdentities().getIdentities()) {
            PatientRecord named = namingRecord(identity);
            int visits = identity.recordsOf(ExtractType.CHARGE_CAPTURE).size();
            OptionalInt lengthOfStay = lengthOfStay(identity);
            rows.add(PatientSummaryRow.builder()
                    .facilityName(records.getFacilityName())
                    .identityId(identity.getIdentityId())
                    .firstName(named.getFirstName())
                    .lastName(named.getLastName())
                    .payer(payerTypesOf(identity).stream().map(PayerType::getLabel).collect(Collectors.joining("/")))
                    .lengthOfStayDays(lengthOfStay.isPresent() ? lengthOfStay.getAsInt() : null)
                    .visitCount(visits)
                    .seenByProvider(visits > 0)
                    .build());
        }
        return rows;
    }

    private Map<String, EncounterCounts> categoryCounts(ReconciledRecordSet records) {
        Map<String, EncounterCounts> counts = new LinkedHashMap<>();
        for (ReportingCategory category : settings.categories()) {
            counts.put(category.name(), EncounterCounts.of(records.encountersOf(category.name())));
        }
        return Collections.unmodifiableMap(counts);
    }

    private Map<String, Integer> cptCodeCounts(ReconciledRecordSet records) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        settings.getReportedCptCodes().forEach(code -> counts.put(code, 0));
        for (PatientRecord record : records.recordsOf(ExtractType.CHARGE_CAPTURE)) {
            if (records.getIdentities().identityOf(record) == null) {
                continue;
            }
            for (String code : CptCodes.codesOf(record)) {
                counts.computeIfPresent(code, (k, count) -> count + 1);
            }
        }
        return Collections.unmodifiableMap(counts);
    }

    private Map<DischargeDisposition, Integer> dischargeCounts(IdentityResolution resolution) {
        Map<DischargeDisposition, Integer> counts = new EnumMap<>(DischargeDisposition.class);
        for (DischargeDisposition disposition : DischargeDisposition.values()) {
            counts.put(disposition, 0);
        }
        Set<DischargeCycle> seen = new HashSet<>();
        for (MatchedIdentity identity : resolution.getIdentities()) {
            for (PatientRecord record : identity.recordsOf(ExtractType.ADMISSION_DISCHARGE_TRANSFER)) {
                DischargeDisposition disposition = record.getDischargeDisposition();
                if (disposition != null
                        && seen.add(new DischargeCycle(identity.getIdentityId(), record.getDischargeDate(), disposition))) {
                    counts.merge(disposition, 1, Integer::sum);
                }
            }
        }
        return counts;
    }

    /**
     * Gain of each patient with a complete assessment: start score of the earliest assessment
     * that has one, end score of the latest assessment that has one. Patients missing either
     * score are left out.
     */
    private static List<Double> gainsOf(List<MatchedIdentity> identities) {
        List<Double> gains = new ArrayList<>();
        for (MatchedIdentity identity : identities) {
            List<AssessmentScores> assessments = identity.recordsOf(ExtractType.FUNCTIONAL_ASSESSMENT).stream()
                    .filter(r -> r.getAssessmentScores() != null)
                    .sorted(BY_ENCOUNTER_DATE)
                    .map(PatientRecord::getAssessmentScores)
                    .toList();
            Double start = null;
            Double end = null;
            for (AssessmentScores assessment : assessments) {
                if (start == null) {
                    start = assessment.startScore();
                }
                if (assessment.endScore() != null) {
                    end = assessment.endScore();
                }
            }
            AssessmentScores scores = new AssessmentScores(start, end);
            if (scores.isComplete()) {
                gains.add(scores.gain());
            }
        }
        return gains;
    }

    private static double averageLengthOfStay(List<MatchedIdentity> identities) {
        List<Double> days = new ArrayList<>();
        for (MatchedIdentity identity : identities) {
            lengthOfStay(identity).ifPresent(d -> days.add((double) d));
        }
        return average(days);
    }

    /**
     * Overlapping extracts report cumulative days, so the largest value is the stay.
     */
    private static OptionalInt lengthOfStay(MatchedIdentity identity) {
        return identity.recordsOf(ExtractType.LENGTH_OF_STAY).stream()
                .map(PatientRecord::getLengthOfStayDays)
                .filter(Objects::nonNull)
                .mapToInt(Integer::intValue)
                .max();
    }

    private static Set<PayerType> payerTypesOf(MatchedIdentity identity) {
        Set<PayerType> payerTypes = EnumSet.noneOf(PayerType.class);
        for (PatientRecord record : identity.getRecords()) {
            if (record.getPayerType() != null) {
                payerTypes.add(record.getPayerType());
            }
        }
        return payerTypes;
    }

    /**
     * First member record carrying both names, else the primary record.
     */
    private static PatientRecord namingRecord(MatchedIdentity identity) {
        return identity.getRecords().stream()
                .filter(r -> r.getFirstName() != null && !r.getFirstName().isBlank()
                        && r.getLastName() != null && !r.getLastName().isBlank())
                .findFirst()
                .orElse(identity.getPrimaryRecord());
    }

    private static String ratio(int count, int patientsServed) {
        return patientsServed == 0 ? "0:0" : count + ":" + patientsServed;
    }

    private static double average(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return round(sum / values.size());
    }

    static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private record DischargeCycle(String identityId, LocalDate dischargeDate, DischargeDisposition disposition) {
    }
}
