package com.medReports.facilityRecon.extract.service;

import com.medReports.facilityRecon.extract.exception.ExtractParseException;
import com.medReports.facilityRecon.extract.model.DischargeDisposition;
import com.medReports.facilityRecon.extract.model.ExtractType;
import com.medReports.facilityRecon.extract.model.PatientRecord;
import com.medReports.facilityRecon.extract.model.PayerType;
import com.medReports.facilityRecon.reconcile.model.IssueType;
import com.medReports.facilityRecon.reconcile.model.ReconciliationIssue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class CsvExtractLoaderTest {

    private final CsvExtractLoader loader = new CsvExtractLoader();

    private static byte[] csv(String... lines) {
        return String.join("\n", lines).getBytes(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("charge capture")
    class ChargeCapture {

        @Test
        void load_shouldMapHeaderVariantsAndSplitFullNames() throws IOException {
            // GIVEN
            byte[] content;
            try (InputStream in = getClass().getResourceAsStream("/extracts/visits_medilodge_of_wyoming.csv")) {
                content = in.readAllBytes();
            }

            // WHEN
            ExtractLoadResult result = loader.load(ExtractType.CHARGE_CAPTURE, "visits-1", "Visits Medilodge of Wyoming.csv", content);

            // THEN
            List<PatientRecord> records = result.getBatch().getRecords();
            assertThat(records).hasSize(4);
            assertThat(result.getIssues()).isEmpty();

            PatientRecord ann = records.get(0);
            assertThat(ann.getRecordId()).isEqualTo("visits-1#1");
            assertThat(ann.getFirstName()).isEqualTo("Ann");
            assertThat(ann.getLastName()).isEqualTo("Lee");
            assertThat(ann.getFacilityLabel()).isEqualTo("Medilodge of Wyoming (M)");
            assertThat(ann.getEncounterDate()).isEqualTo(LocalDate.of(2025, 7, 15));
            assertThat(ann.getPlaceOfServiceCode()).isEqualTo("32");
            assertThat(ann.getCptCodes()).containsExactly("20600", "20610");
            assertThat(ann.getPatientId()).isEqualTo("B-1");

            assertThat(records.get(2).getEncounterDate()).isEqualTo(LocalDate.of(2025, 7, 30));
            assertThat(records.get(2).getCptCodes()).containsExactly("20610");
        }

        @Test
        void load_shouldFallBackToTheFileNameForTheFacility() throws IOException {
            byte[] content;
            try (InputStream in = getClass().getResourceAsStream("/extracts/visits_medilodge_of_wyoming.csv")) {
                content = in.readAllBytes();
            }

            PatientRecord cid = loader.load(ExtractType.CHARGE_CAPTURE, "visits-1", "Visits Medilodge of Wyoming.csv", content)
                    .getBatch().getRecords().get(3);

            assertThat(cid.getFacilityLabel()).isEqualTo("Medilodge of Wyoming");
            assertThat(cid.getEncounterDate()).isEqualTo(LocalDate.of(2025, 7, 3));
            assertThat(cid.getCptCodes()).isEmpty();
        }
    }

    @Test
    void load_shouldReadPayerAndRoundedDaysOfLengthOfStayExtracts() {
        byte[] content = csv(
                "First Name,Last Name,Payer,LOS",
                "Ann,Lee,Medicare A,12.6",
                "Bob,Ray,Humana Gold,\"1,234\"",
                "Cid,Moss,,");

        List<PatientRecord> records = loader.load(ExtractType.LENGTH_OF_STAY, "los-1",
                "LOS Medilodge at the Shore_cycles.csv", content).getBatch().getRecords();

        assertThat(records)
                .extracting(PatientRecord::getPayerType, PatientRecord::getLengthOfStayDays)
                .containsExactly(
                        tuple(PayerType.MEDICARE_A, 13),
                        tuple(PayerType.MANAGED_CARE, 1234),
                        tuple(null, null));
        assertThat(records).allSatisfy(record -> {
            assertThat(record.getFacilityLabel()).isEqualTo("Medilodge at the Shore");
            assertThat(record.getPatientId()).isNull();
        });
    }

    @Test
    void load_shouldMapDischargeDestinationsAndDefaultTheEncounterDate() {
        byte[] content = csv(
                "Resident ID,First Name,Last Name,Admit Date,Discharge Date,To Type",
                "R1,Ann,Lee,2025-07-01,2025-07-20,Home with services",
                "R2,Bob,Ray,7/2/25,,",
                "R3,Cid,Moss,2025-06-01,2025-07-09,Smith Funeral Home",
                "R4,Dee,Park,2025-06-05,2025-07-11,General Hospital");

        List<PatientRecord> records = loader.load(ExtractType.ADMISSION_DISCHARGE_TRANSFER, "adt-1",
                "ADT Medilodge of Wyoming.csv", content).getBatch().getRecords();

        assertThat(records)
                .extracting(PatientRecord::getDischargeDisposition)
                .containsExactly(DischargeDisposition.HOME_DISCHARGE, null,
                        DischargeDisposition.EXPIRED, DischargeDisposition.HOSPITAL_TRANSFER);
        assertThat(records.get(0).getPatientId()).isEqualTo("R1");
        assertThat(records.get(0).getEncounterDate()).isEqualTo(LocalDate.of(2025, 7, 1));
        assertThat(records.get(1).getAdmissionDate()).isEqualTo(LocalDate.of(2025, 7, 2));
        assertThat(records.get(1).getDischargeDate()).isNull();
    }

    @Test
    void load_shouldReadScoresOfFunctionalAssessments() {
        byte[] content = csv(
                "Patient First Name,Patient Last Name,Assessment Date,GG Start,GG End",
                "Ann,Lee,2025-07-01,41,55",
                "Bob,Ray,2025-07-02,38,");

        List<PatientRecord> records = loader.load(ExtractType.FUNCTIONAL_ASSESSMENT, "gg-1",
                "GG Medilodge of Wyoming.csv", content).getBatch().getRecords();

        assertThat(records.get(0).getAssessmentScores().gain()).isEqualTo(14.0);
        assertThat(records.get(1).getAssessmentScores().isComplete()).isFalse();
    }

    @Nested
    @DisplayName("row problems")
    class RowProblems {

        @Test
        void load_shouldMoveAFirstNameOutOfTheLastNameColumn() {
            byte[] content = csv("First Name,Last Name", ",Ann Lee");

            PatientRecord record = loader.load(ExtractType.LENGTH_OF_STAY, "los-1", "los.csv", content)
                    .getBatch().getRecords().get(0);

            assertThat(record.getFirstName()).isEqualTo("Ann");
            assertThat(record.getLastName()).isEqualTo("Lee");
        }

        @Test
        void load_shouldExcludeRowsWithoutANameAndReportThem() {
            byte[] content = csv("First Name,Last Name,DOS", "Ann,Lee,2025-07-01", ",,2025-07-02", "Bob,,2025-07-03");

            ExtractLoadResult result = loader.load(ExtractType.CHARGE_CAPTURE, "visits-1", "visits.csv", content);

            assertThat(result.getBatch().getRecords()).hasSize(1);
            assertThat(result.getIssues())
                    .extracting(ReconciliationIssue::getType, ReconciliationIssue::getRecordId)
                    .containsExactly(
                            tuple(IssueType.MALFORMED_RECORD, "visits-1#2"),
                            tuple(IssueType.MALFORMED_RECORD, "visits-1#3"));
        }

        @Test
        void load_shouldKeepRowsWithUnparseableValuesButDropTheValue() {
            byte[] content = csv("First Name,Last Name,DOS,LOS", "Ann,Lee,someday,ten");

            ExtractLoadResult result = loader.load(ExtractType.LENGTH_OF_STAY, "los-1", "los.csv", content);

            PatientRecord record = result.getBatch().getRecords().get(0);
            assertThat(record.getEncounterDate()).isNull();
            assertThat(record.getLengthOfStayDays()).isNull();
            assertThat(result.getIssues()).hasSize(2).allMatch(issue -> issue.getType() == IssueType.MALFORMED_RECORD);
        }

        @Test
        void load_shouldIgnoreAByteOrderMark() {
            byte[] body = csv("First Name,Last Name", "Ann,Lee");
            byte[] content = new byte[body.length + 3];
            content[0] = (byte) 0xEF;
            content[1] = (byte) 0xBB;
            content[2] = (byte) 0xBF;
            System.arraycopy(body, 0, content, 3, body.length);

            assertThat(loader.load(ExtractType.LENGTH_OF_STAY, "los-1", "los.csv", content).getBatch().getRecords())
                    .singleElement()
                    .extracting(PatientRecord::getFirstName)
                    .isEqualTo("Ann");
        }
    }

    @Nested
    @DisplayName("unreadable files")
    class UnreadableFiles {

        @Test
        void load_shouldRejectAFileWithoutNameColumns() {
            byte[] content = csv("Facility,DOS", "Medilodge of Wyoming,2025-07-01");

            assertThatThrownBy(() -> loader.load(ExtractType.CHARGE_CAPTURE, "visits.csv", content))
                    .isInstanceOf(ExtractParseException.class)
                    .hasMessageContaining("first_name");
        }

        @Test
        void load_shouldRejectAnEmptyFile() {
            assertThatThrownBy(() -> loader.load(ExtractType.CHARGE_CAPTURE, "visits.csv", new byte[0]))
                    .isInstanceOf(ExtractParseException.class)
                    .hasMessageContaining("no header row");
        }

        @Test
        void load_shouldGenerateABatchIdFromTheExtractCode() {
            ExtractLoadResult result = loader.load(ExtractType.FUNCTIONAL_ASSESSMENT, "gg.csv", csv("First,Last", "Ann,Lee"));

            assertThat(result.getBatch().getBatchId()).startsWith("gg-");
            assertThat(result.getBatch().getRecords().get(0).getRecordId()).startsWith(result.getBatch().getBatchId() + "#");
        }
    }

    @ParameterizedTest
    @CsvSource({
            "'ADT Medilodge at the Shore_cycles.csv', Medilodge at the Shore",
            "'uploads/los_Medilodge_of_Wyoming.csv', Medilodge of Wyoming",
            "'exports/visits-Medilodge of Farmington.xlsx', Medilodge of Farmington",
            "'GG.csv', ''"
    })
    void facilityFromFileName_shouldStripTypePrefixAndSuffixes(String fileName, String expected) {
        assertThat(CsvExtractLoader.facilityFromFileName(fileName)).isEqualTo(expected.isEmpty() ? null : expected);
    }

    @Test
    void snakeCase_shouldNormalizeHeaderNames() {
        assertThat(CsvExtractLoader.snakeCase(" Resident ID ")).isEqualTo("resident_id");
        assertThat(CsvExtractLoader.snakeCase("Date of Service (DOS)")).isEqualTo("date_of_service_dos");
        assertThat(CsvExtractLoader.snakeCase("CPT-Code")).isEqualTo("cpt_code");
    }
}
