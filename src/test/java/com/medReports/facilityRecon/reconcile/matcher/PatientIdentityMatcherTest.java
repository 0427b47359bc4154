package com.medReports.facilityRecon.reconcile.matcher;

import com.medReports.facilityRecon.extract.model.ExtractType;
import com.medReports.facilityRecon.extract.model.PatientRecord;
import com.medReports.facilityRecon.reconcile.model.IssueLog;
import com.medReports.facilityRecon.reconcile.model.IssueType;
import com.medReports.facilityRecon.reconcile.model.MatchRule;
import com.medReports.facilityRecon.reconcile.model.MatchedIdentity;
import com.medReports.facilityRecon.reconcile.model.ReconciliationIssue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.medReports.facilityRecon.TestRecords.SHORE;
import static com.medReports.facilityRecon.TestRecords.WYOMING;
import static com.medReports.facilityRecon.TestRecords.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class PatientIdentityMatcherTest {

    private PatientIdentityMatcher matcher;
    private IssueLog issues;

    @BeforeEach
    void setUp() {
        matcher = PatientIdentityMatcher.standard(3);
        issues = new IssueLog("run-1");
    }

    @Nested
    @DisplayName("patient id pass")
    class PatientIdPass {

        @Test
        void match_shouldPairSameIdWhateverTheNames() {
            // GIVEN
            PatientRecord a = record(ExtractType.ADMISSION_DISCHARGE_TRANSFER, "John", "Smith").patientId("R100").build();
            PatientRecord b = record(ExtractType.ADMISSION_DISCHARGE_TRANSFER, "Jon", "Smyth").patientId("r100 ").build();

            // WHEN
            List<MatchedIdentity> identities = matcher.match(List.of(a), List.of(b), WYOMING, issues);

            // THEN
            assertThat(identities).hasSize(1);
            assertThat(identities.get(0).getRecords()).containsExactly(a, b);
            assertThat(identities.get(0).getRules()).containsExactly(MatchRule.PATIENT_ID);
        }

        @Test
        void pair_shouldLetTheIdPassWinOverAnEarlierNameCandidate() {
            // GIVEN
            PatientRecord a = record(ExtractType.ADMISSION_DISCHARGE_TRANSFER, "Mary", "Jones").patientId("R5").build();
            PatientRecord sameName = record(ExtractType.CHARGE_CAPTURE, "Mary", "Jones").build();
            PatientRecord sameId = record(ExtractType.ADMISSION_DISCHARGE_TRANSFER, "M", "Jones").patientId("R5").build();

            // WHEN
            PatientIdentityMatcher.Pairing pairing = matcher.pair(List.of(a), List.of(sameName, sameId), WYOMING, issues);

            // THEN
            assertThat(pairing.pairs()).containsExactly(new PatientIdentityMatcher.MatchedPair(a, sameId, MatchRule.PATIENT_ID));
        }

        @Test
        void match_shouldNotCompareIdsOfDifferentSchemes() {
            PatientRecord resident = record(ExtractType.ADMISSION_DISCHARGE_TRANSFER, "Ann", "Lee").patientId("100").build();
            PatientRecord billing = record(ExtractType.CHARGE_CAPTURE, "Bob", "Ray").patientId("100").build();

            List<MatchedIdentity> identities = matcher.match(List.of(resident), List.of(billing), WYOMING, issues);

            assertThat(identities).hasSize(2).allMatch(MatchedIdentity::isSingleton);
        }

        @Test
        void match_shouldKeepConflictingIdsApartEvenWithEqualNames() {
            PatientRecord a = record(ExtractType.ADMISSION_DISCHARGE_TRANSFER, "John", "Smith").patientId("R1").build();
            PatientRecord b = record(ExtractType.ADMISSION_DISCHARGE_TRANSFER, "John", "Smith").patientId("R2").build();

            List<MatchedIdentity> identities = matcher.match(List.of(a), List.of(b), WYOMING, issues);

            assertThat(identities).hasSize(2);
        }
    }

    @Nested
    @DisplayName("name passes")
    class NamePasses {

        @Test
        void match_shouldPairExactNamesIgnoringCaseAndSpacing() {
            PatientRecord a = record(ExtractType.LENGTH_OF_STAY, "JOHN", "SMITH").build();
            PatientRecord b = record(ExtractType.CHARGE_CAPTURE, " john ", "smith").build();

            List<MatchedIdentity> identities = matcher.match(List.of(a), List.of(b), WYOMING, issues);

            assertThat(identities).hasSize(1);
            assertThat(identities.get(0).getRules()).containsExactly(MatchRule.EXACT_NAME);
        }

        @Test
        void match_shouldPairFirstNameAndSurnamePrefix() {
            PatientRecord a = record(ExtractType.LENGTH_OF_STAY, "Mary", "Smithson").build();
            PatientRecord b = record(ExtractType.CHARGE_CAPTURE, "Mary", "Smith").build();

            List<MatchedIdentity> identities = matcher.match(List.of(a), List.of(b), WYOMING, issues);

            assertThat(identities).hasSize(1);
            assertThat(identities.get(0).getRules()).containsExactly(MatchRule.PARTIAL_NAME);
            assertThat(issues.toList()).isEmpty();
        }

        @Test
        void match_shouldListUnmatchedSourceBRecordsAfterThePairs() {
            PatientRecord a = record(ExtractType.LENGTH_OF_STAY, "Ann", "Lee").build();
            PatientRecord onlyInB = record(ExtractType.CHARGE_CAPTURE, "Bob", "Ray").build();
            PatientRecord b = record(ExtractType.CHARGE_CAPTURE, "Ann", "Lee").build();

            List<MatchedIdentity> identities = matcher.match(List.of(a), List.of(onlyInB, b), WYOMING);

            assertThat(identities).extracting(MatchedIdentity::getRecords)
                    .containsExactly(List.of(a, b), List.of(onlyInB));
            assertThat(identities).extracting(MatchedIdentity::getIdentityId)
                    .containsExactly("medilodge of wyoming#1", "medilodge of wyoming#2");
        }

        @Test
        void match_shouldNotPairDifferentFirstNames() {
            PatientRecord a = record(ExtractType.LENGTH_OF_STAY, "Mary", "Smith").build();
            PatientRecord b = record(ExtractType.CHARGE_CAPTURE, "Martha", "Smith").build();

            assertThat(matcher.match(List.of(a), List.of(b), WYOMING, issues)).hasSize(2);
        }

        @Test
        void match_shouldPreferExactOverPartialCandidates() {
            PatientRecord a = record(ExtractType.LENGTH_OF_STAY, "Mary", "Johnson").build();
            PatientRecord partial = record(ExtractType.CHARGE_CAPTURE, "Mary", "Johnston").build();
            PatientRecord exact = record(ExtractType.CHARGE_CAPTURE, "Mary", "Johnson").build();

            PatientIdentityMatcher.Pairing pairing = matcher.pair(List.of(a), List.of(partial, exact), WYOMING, issues);

            assertThat(pairing.pairs()).containsExactly(new PatientIdentityMatcher.MatchedPair(a, exact, MatchRule.EXACT_NAME));
        }
    }

    @Nested
    @DisplayName("consumption and ties")
    class Consumption {

        @Test
        void match_shouldConsumeEachRecordAtMostOnce() {
            PatientRecord a1 = record(ExtractType.LENGTH_OF_STAY, "John", "Smith").build();
            PatientRecord a2 = record(ExtractType.LENGTH_OF_STAY, "John", "Smith").build();
            PatientRecord b = record(ExtractType.CHARGE_CAPTURE, "John", "Smith").build();

            List<MatchedIdentity> identities = matcher.match(List.of(a1, a2), List.of(b), WYOMING, issues);

            assertThat(identities).hasSize(2);
            assertThat(identities.get(0).getRecords()).containsExactly(a1, b);
            assertThat(identities.get(1).getRecords()).containsExactly(a2);
        }

        @Test
        void pair_shouldTakeFirstPartialCandidateAndReportTheTie() {
            // GIVEN
            PatientRecord a = record(ExtractType.LENGTH_OF_STAY, "Mary", "Johnson").build();
            PatientRecord first = record(ExtractType.CHARGE_CAPTURE, "Mary", "Johnston").build();
            PatientRecord second = record(ExtractType.CHARGE_CAPTURE, "Mary", "Johns").build();

            // WHEN
            PatientIdentityMatcher.Pairing pairing = matcher.pair(List.of(a), List.of(first, second), WYOMING, issues);

            // THEN
            assertThat(pairing.pairs()).containsExactly(new PatientIdentityMatcher.MatchedPair(a, first, MatchRule.PARTIAL_NAME));
            assertThat(issues.toList())
                    .singleElement()
                    .satisfies(issue -> {
                        assertThat(issue.getType()).isEqualTo(IssueType.AMBIGUOUS_MATCH);
                        assertThat(issue.getRecordId()).isEqualTo(a.getRecordId());
                        assertThat(issue.getDetail()).contains(first.getRecordId());
                    });
        }

        @Test
        void pairGroups_shouldMatchOnAnyMemberAndConsumeEachGroupOnce() {
            PatientRecord jon = record(ExtractType.CHARGE_CAPTURE, "Jon", "Doe").patientId("100").build();
            PatientRecord john = record(ExtractType.CHARGE_CAPTURE, "John", "Doe").patientId("100").build();
            PatientRecord firstStay = record(ExtractType.LENGTH_OF_STAY, "John", "Doe").build();
            PatientRecord secondStay = record(ExtractType.LENGTH_OF_STAY, "John", "Doe").build();

            List<PatientIdentityMatcher.GroupPair> pairs = matcher.pairGroups(
                    List.of(List.of(jon, john)), List.of(List.of(firstStay), List.of(secondStay)), WYOMING, issues);

            assertThat(pairs).containsExactly(new PatientIdentityMatcher.GroupPair(0, 0,
                    new PatientIdentityMatcher.MatchedPair(john, firstStay, MatchRule.EXACT_NAME)));
        }

        @Test
        void pair_shouldBeDeterministicForTheSameInput() {
            List<PatientRecord> sourceA = List.of(
                    record(ExtractType.LENGTH_OF_STAY, "Mary", "Johnson").build(),
                    record(ExtractType.LENGTH_OF_STAY, "Ann", "Lee").build(),
                    record(ExtractType.LENGTH_OF_STAY, "Mary", "Johnsen").build());
            List<PatientRecord> sourceB = List.of(
                    record(ExtractType.CHARGE_CAPTURE, "Mary", "Johns").build(),
                    record(ExtractType.CHARGE_CAPTURE, "Mary", "Johnston").build(),
                    record(ExtractType.CHARGE_CAPTURE, "Ann", "Leeds").build());

            List<PatientIdentityMatcher.MatchedPair> first = matcher.pair(sourceA, sourceB, WYOMING, issues).pairs();
            List<PatientIdentityMatcher.MatchedPair> second = matcher.pair(sourceA, sourceB, WYOMING, new IssueLog("run-2")).pairs();

            assertThat(second).isEqualTo(first);
            assertThat(first).hasSize(3);
        }
    }

    @Nested
    @DisplayName("facility boundary")
    class FacilityBoundary {

        @Test
        void match_shouldDiscardRecordsOfAnotherFacility() {
            // GIVEN
            PatientRecord local = record(ExtractType.LENGTH_OF_STAY, "John", "Smith").build();
            PatientRecord foreign = record(ExtractType.CHARGE_CAPTURE, "John", "Smith").facilityKey(SHORE).build();

            // WHEN
            List<MatchedIdentity> identities = matcher.match(List.of(local), List.of(foreign), WYOMING, issues);

            // THEN
            assertThat(identities).hasSize(1);
            assertThat(identities.get(0).getRecords()).containsExactly(local);
            assertThat(issues.toList())
                    .extracting(ReconciliationIssue::getType, ReconciliationIssue::getRecordId)
                    .containsExactly(tuple(IssueType.CROSS_FACILITY_MATCH_ATTEMPT, foreign.getRecordId()));
        }
    }

    @Test
    void standard_shouldRejectNonPositivePrefixLength() {
        assertThatThrownBy(() -> PatientIdentityMatcher.standard(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("prefix length");
    }
}
