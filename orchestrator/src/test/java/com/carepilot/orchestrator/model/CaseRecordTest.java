package com.carepilot.orchestrator.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.carepilot.orchestrator.CaseFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CaseRecordTest {

    @Test
    void create_carriesIntakeAndStartsEmpty() {
        PatientInfo patient = new PatientInfo("Jane Doe", "P-1", 42, "F");
        CaseRecord record = CaseRecord.create("case-9",
                new CaseIntake("sore throat", patient, "asthma", chestPng()));

        assertThat(record.caseId()).isEqualTo("case-9");
        assertThat(record.complaint()).isEqualTo("sore throat");
        assertThat(record.patient()).isEqualTo(patient);
        assertThat(record.medicalHistory()).isEqualTo("asthma");
        assertThat(record.hasImage()).isTrue();
        assertThat(record.urgency()).isNull();
        assertThat(record.diagnosis()).isEmpty();
        assertThat(record.history()).isEmpty();
        assertThat(record.knowledgeContext().isEmpty()).isTrue();
    }

    @Test
    void diagnosis_isSortedByDescendingConfidenceThenName() {
        CaseRecord record = fresh("cough").toBuilder()
                .diagnosis(List.of(
                        new ConditionHypothesis("B", 0.5, ""),
                        new ConditionHypothesis("C", 0.9, ""),
                        new ConditionHypothesis("A", 0.5, "")))
                .build();

        assertThat(record.diagnosis()).extracting(ConditionHypothesis::condition)
                .containsExactly("C", "A", "B");
        assertThat(record.topHypothesis().condition()).isEqualTo("C");
    }

    @Test
    void findingWithoutOrder_isRejected() {
        assertThatThrownBy(() -> fresh("cough").toBuilder()
                .imagingFinding(new ImagingFinding("Normal", 0.9, "", ""))
                .build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withEscalatedUrgency_neverLowers() {
        CaseRecord high = fresh("cough").withEscalatedUrgency(UrgencyLevel.HIGH);

        assertThat(high.withEscalatedUrgency(UrgencyLevel.LOW).urgency()).isEqualTo(UrgencyLevel.HIGH);
        assertThat(high.withEscalatedUrgency(UrgencyLevel.CRITICAL).urgency()).isEqualTo(UrgencyLevel.CRITICAL);
    }

    @Test
    void withUrgencyOverride_lowering_recordsPendingOverride() {
        CaseRecord lowered = fresh("cough").withEscalatedUrgency(UrgencyLevel.HIGH)
                .withUrgencyOverride(UrgencyLevel.MODERATE, "vital signs normal");

        assertThat(lowered.urgency()).isEqualTo(UrgencyLevel.MODERATE);
        assertThat(lowered.pendingOverride())
                .isEqualTo(new UrgencyOverride(UrgencyLevel.HIGH, UrgencyLevel.MODERATE, "vital signs normal"));
    }

    @Test
    void withUrgencyOverride_raising_isPlainEscalation() {
        CaseRecord raised = fresh("cough").withEscalatedUrgency(UrgencyLevel.LOW)
                .withUrgencyOverride(UrgencyLevel.HIGH, "new finding");

        assertThat(raised.urgency()).isEqualTo(UrgencyLevel.HIGH);
        assertThat(raised.pendingOverride()).isNull();
    }

    @Test
    void withHistoryEntry_appendsWithoutTouchingOriginal() {
        CaseRecord base = fresh("cough");
        CaseRecord next = base.withHistoryEntry(StageHistoryEntry.succeeded(StageName.INTAKE, T0, 1, null));

        assertThat(base.history()).isEmpty();
        assertThat(next.history()).hasSize(1);
        assertThat(next.hasCompleted(StageName.INTAKE)).isTrue();
        assertThat(next.hasCompleted(StageName.EXAMINATION)).isFalse();
    }

    @Test
    void symptomTags_areNormalisedAndOrderIndependent() {
        SymptomProfile a = SymptomProfile.ofComplaint("x").withTags(List.of("Fever", " cough "));
        SymptomProfile b = SymptomProfile.ofComplaint("x").withTags(List.of("cough", "fever"));

        assertThat(a).isEqualTo(b);
        assertThat(a.tags()).containsExactly("cough", "fever");
    }
}
