package com.medReports.facilityRecon.extract.service;

import com.medReports.facilityRecon.extract.exception.ExtractParseException;
import com.medReports.facilityRecon.extract.model.AssessmentScores;
import com.medReports.facilityRecon.extract.model.DischargeDisposition;
import com.medReports.facilityRecon.extract.model.ExtractBatch;
import com.medReports.facilityRecon.extract.model.ExtractType;
import com.medReports.facilityRecon.extract.model.PatientRecord;
import com.medReports.facilityRecon.extract.model.PayerType;
import com.medReports.facilityRecon.extract.util.CptCodes;
import com.medReports.facilityRecon.extract.util.PatientNames;
import com.medReports.facilityRecon.reconcile.model.IssueType;
import com.medReports.facilityRecon.reconcile.model.ReconciliationIssue;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Loads uploaded CSV extracts into typed record batches.
 *
 * Responsibilities:
 * - Map header variants to the canonical column names
 * - Split "Last, First" names and repair rows whose first name landed in the last-name column
 * - Derive the facility label from the file name when the extract has no facility column
 * - Report rows missing a name or carrying unparseable values as malformed
 */
@Slf4j
@Service
public class CsvExtractLoader {

    static final String FIRST_NAME = "first_name";
    static final String LAST_NAME = "last_name";
    static final String PATIENT_NAME = "patient_name";
    static final String PATIENT_ID = "patient_id";
    static final String FACILITY = "facility";
    static final String ENCOUNTER_DATE = "encounter_date";
    static final String PLACE_OF_SERVICE = "place_of_service";
    static final String CPT_CODES = "cpt_codes";
    static final String PAYER = "payer_type";
    static final String DAYS = "days";
    static final String ADMISSION_DATE = "admission_date";
    static final String DISCHARGE_DATE = "discharge_date";
    static final String TO_TYPE = "to_type";
    static final String START_SCORE = "start_score";
    static final String END_SCORE = "end_score";

    private static final Map<String, String> ALIASES = buildAliases();

    private static final DateTimeFormatter ISO_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-M-d");
    private static final DateTimeFormatter US_DATE = DateTimeFormatter.ofPattern("M/d/yyyy");
    private static final DateTimeFormatter US_SHORT_DATE = DateTimeFormatter.ofPattern("M/d/yy");
    private static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{1,2}-\\d{1,2}");
    private static final Pattern SHORT_YEAR = Pattern.compile(".*/\\d{2}");

    private static final Pattern EXTENSION = Pattern.compile("\\.[A-Za-z0-9]{1,5}$");
    private static final Pattern TYPE_PREFIX = Pattern.compile("^(?i)(?:adt|los|visits?|gg)(?:[\\s_-]+|$)");
    private static final Pattern CYCLES_SUFFIX = Pattern.compile("(?i)[\\s_-]*cycles$");
    private static final Pattern UNDERSCORES = Pattern.compile("_+");

    /**
     * Loads one extract under a generated batch id.
     */
    public ExtractLoadResult load(ExtractType type, String fileName, byte[] content) {
        String batchId = type.getCode() + "-" + UUID.randomUUID().toString().substring(0, 8);
        return load(type, batchId, fileName, content);
    }

    /**
     * Loads one extract.
     *
     * @param type Kind of extract
     * @param batchId Id of the batch, unique within the run
     * @param fileName Original file name; names the facility when no facility column exists
     * @param content Raw CSV bytes, UTF-8
     * @return The batch and the row-level issues found
     * @throws ExtractParseException when the file has no header or lacks the name columns
     */
    public ExtractLoadResult load(ExtractType type, String batchId, String fileName, byte[] content) {
        try (Reader reader = new InputStreamReader(new ByteArrayInputStream(stripBom(content)), StandardCharsets.UTF_8)) {
            return parse(type, batchId, fileName, reader);
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            throw new ExtractParseException("Failed to read extract '" + fileName + "': " + e.getMessage(), e);
        }
    }

    private ExtractLoadResult parse(ExtractType type, String batchId, String fileName, Reader reader) throws IOException {
        CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setTrim(true)
                .setIgnoreEmptyLines(true)
                .setAllowMissingColumnNames(true)
                .setDuplicateHeaderMode(DuplicateHeaderMode.ALLOW_ALL)
                .build();

        try (CSVParser parser = csvFormat.parse(reader)) {
            Map<String, Integer> columns = canonicalColumns(parser.getHeaderNames());
            requireColumns(type, fileName, columns);

            String fileFacility = facilityFromFileName(fileName);
            List<PatientRecord> records = new ArrayList<>();
            List<ReconciliationIssue> issues = new ArrayList<>();
            for (CSVRecord row : parser) {
                String recordId = batchId + "#" + row.getRecordNumber();
                RowReader values = new RowReader(row, columns, type, batchId, recordId, issues);
                PatientRecord record = toRecord(type, batchId, recordId, fileFacility, values);
                if (record != null) {
                    records.add(record);
                }
            }

            log.info("Extract loaded - batchId: {}, type: {}, file: {}, records: {}, issues: {}",
                    batchId, type, fileName, records.size(), issues.size());
            ExtractBatch batch = ExtractBatch.builder()
                    .batchId(batchId)
                    .extractType(type)
                    .fileName(fileName)
                    .records(List.copyOf(records))
                    .build();
            return new ExtractLoadResult(batch, List.copyOf(issues));
        }
    }

    private PatientRecord toRecord(ExtractType type, String batchId, String recordId, String fileFacility, RowReader values) {
        String firstName = values.text(FIRST_NAME);
        String lastName = values.text(LAST_NAME);
        if ((firstName == null || lastName == null) && values.text(PATIENT_NAME) != null) {
            String[] split = PatientNames.splitFullName(values.text(PATIENT_NAME));
            firstName = firstName != null ? firstName : blankToNull(split[0]);
            lastName = lastName != null ? lastName : blankToNull(split[1]);
        }
        if (firstName == null && lastName != null && lastName.contains(" ")) {
            String[] parts = lastName.trim().split("\\s+", 2);
            firstName = parts[0];
            lastName = parts[1];
        }
        if (firstName == null || lastName == null) {
            values.malformed("row has no " + (firstName == null ? "first" : "last") + " name; row excluded");
            return null;
        }

        String facility = values.text(FACILITY);
        LocalDate admissionDate = values.date(ADMISSION_DATE);
        LocalDate dischargeDate = values.date(DISCHARGE_DATE);
        LocalDate encounterDate = values.date(ENCOUNTER_DATE);
        if (encounterDate == null && type == ExtractType.ADMISSION_DISCHARGE_TRANSFER) {
            encounterDate = admissionDate != null ? admissionDate : dischargeDate;
        }

        AssessmentScores scores = null;
        if (type == ExtractType.FUNCTIONAL_ASSESSMENT) {
            scores = new AssessmentScores(values.number(START_SCORE), values.number(END_SCORE));
        }
        Double days = values.number(DAYS);

        return PatientRecord.builder()
                .recordId(recordId)
                .batchId(batchId)
                .extractType(type)
                .facilityLabel(facility != null ? facility : fileFacility)
                .firstName(firstName)
                .lastName(lastName)
                .patientId(type.getIdentifierScheme() != null ? values.text(PATIENT_ID) : null)
                .encounterDate(encounterDate)
                .placeOfServiceCode(values.text(PLACE_OF_SERVICE))
                .payerType(PayerType.fromLabel(values.text(PAYER)))
                .cptCodes(CptCodes.parse(values.text(CPT_CODES)))
                .assessmentScores(scores)
                .lengthOfStayDays(days != null ? (int) Math.round(days) : null)
                .admissionDate(admissionDate)
                .dischargeDate(dischargeDate)
                .dischargeDisposition(type == ExtractType.ADMISSION_DISCHARGE_TRANSFER
                        ? DischargeDisposition.fromToType(values.text(TO_TYPE)) : null)
                .build();
    }

    /**
     * Facility label carried by an upload file name, e.g. "ADT Medilodge at the Shore_cycles.csv"
     * gives "Medilodge at the Shore".
     */
    static String facilityFromFileName(String fileName) {
        if (fileName == null) {
            return null;
        }
        String name = fileName.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        name = EXTENSION.matcher(name.trim()).replaceFirst("");
        name = CYCLES_SUFFIX.matcher(name).replaceFirst("");
        name = TYPE_PREFIX.matcher(name).replaceFirst("");
        name = UNDERSCORES.matcher(name).replaceAll(" ").trim();
        return name.isEmpty() ? null : name;
    }

    /**
     * Snake-case header name, e.g. "Resident ID" becomes "resident_id".
     */
    static String snakeCase(String header) {
        String value = header == null ? "" : header.trim().toLowerCase(Locale.ROOT);
        value = value.replaceAll("[^a-z0-9_]", "_");
        value = value.replaceAll("_+", "_");
        return value.replaceAll("^_+|_+$", "");
    }

    private static Map<String, Integer> canonicalColumns(List<String> headers) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            String header = snakeCase(headers.get(i));
            String canonical = ALIASES.getOrDefault(header, header);
            columns.putIfAbsent(canonical, i);
        }
        return columns;
    }

    private static void requireColumns(ExtractType type, String fileName, Map<String, Integer> columns) {
        if (columns.isEmpty()) {
            throw new ExtractParseException("Extract '" + fileName + "' has no header row");
        }
        boolean fullName = columns.containsKey(PATIENT_NAME);
        for (String required : type.getRequiredColumns()) {
            boolean coveredByFullName = fullName && (required.equals(FIRST_NAME) || required.equals(LAST_NAME));
            if (!columns.containsKey(required) && !coveredByFullName) {
                throw new ExtractParseException("Extract '" + fileName + "' of type " + type
                        + " lacks required column '" + required + "'");
            }
        }
    }

    private static byte[] stripBom(byte[] content) {
        if (content.length >= 3 && (content[0] & 0xFF) == 0xEF && (content[1] & 0xFF) == 0xBB && (content[2] & 0xFF) == 0xBF) {
            byte[] stripped = new byte[content.length - 3];
            System.arraycopy(content, 3, stripped, 0, stripped.length);
            return stripped;
        }
        return content;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static Map<String, String> buildAliases() {
        Map<String, String> aliases = new HashMap<>();
        alias(aliases, FIRST_NAME, "first", "firstname", "patient_first_name", "resident_first_name");
        alias(aliases, LAST_NAME, "last", "lastname", "surname", "patient_last_name", "resident_last_name");
        alias(aliases, PATIENT_NAME, "resident_name", "name", "patient", "resident", "full_name");
        alias(aliases, PATIENT_ID, "resident_id", "mrn", "patient_number", "account_number");
        alias(aliases, FACILITY, "facility_name", "location_name");
        alias(aliases, ENCOUNTER_DATE, "date_of_service", "dos", "service_date", "visit_date", "assessment_date", "date");
        alias(aliases, PLACE_OF_SERVICE, "pos", "pos_code", "place_of_service_code");
        alias(aliases, CPT_CODES, "cpt", "cpt_code", "procedure_code", "procedure_codes");
        alias(aliases, PAYER, "payer", "payor", "payer_name", "insurance");
        alias(aliases, DAYS, "los", "los_days", "length_of_stay");
        alias(aliases, ADMISSION_DATE, "admit_date");
        alias(aliases, TO_TYPE, "discharge_type", "discharge_to");
        alias(aliases, START_SCORE, "gg_start", "admission_score", "start");
        alias(aliases, END_SCORE, "gg_end", "discharge_score", "end");
        return Map.copyOf(aliases);
    }

    private static void alias(Map<String, String> aliases, String canonical, String... variants) {
        for (String variant : variants) {
            aliases.put(variant, canonical);
        }
    }

    /**
     * Typed access to the canonical columns of one row. Unparseable values are reported and read as null.
     */
    private static final class RowReader {

        private final CSVRecord row;
        private final Map<String, Integer> columns;
        private final ExtractType type;
        private final String batchId;
        private final String recordId;
        private final List<ReconciliationIssue> issues;

        private RowReader(CSVRecord row, Map<String, Integer> columns, ExtractType type,
                          String batchId, String recordId, List<ReconciliationIssue> issues) {
            this.row = row;
            this.columns = columns;
            this.type = type;
            this.batchId = batchId;
            this.recordId = recordId;
            this.issues = issues;
        }

        private String text(String column) {
            Integer index = columns.get(column);
            if (index == null || !row.isSet(index)) {
                return null;
            }
            return blankToNull(row.get(index));
        }

        private LocalDate date(String column) {
            String value = text(column);
            if (value == null) {
                return null;
            }
            String date = value.split("[ T]", 2)[0];
            DateTimeFormatter format = ISO_DATE.matcher(date).matches() ? ISO_DATE_FORMAT
                    : SHORT_YEAR.matcher(date).matches() ? US_SHORT_DATE : US_DATE;
            try {
                return LocalDate.parse(date, format);
            } catch (DateTimeParseException e) {
                malformed(column + " '" + value + "' is not a date; value dropped");
                return null;
            }
        }

        private Double number(String column) {
            String value = text(column);
            if (value == null) {
                return null;
            }
            try {
                return Double.parseDouble(value.replace(",", ""));
            } catch (NumberFormatException e) {
                malformed(column + " '" + value + "' is not a number; value dropped");
                return null;
            }
        }

        private void malformed(String detail) {
            issues.add(ReconciliationIssue.builder()
                    .type(IssueType.MALFORMED_RECORD)
                    .extractType(type)
                    .batchId(batchId)
                    .recordId(recordId)
                    .detail(detail)
                    .build());
        }
    }
}
