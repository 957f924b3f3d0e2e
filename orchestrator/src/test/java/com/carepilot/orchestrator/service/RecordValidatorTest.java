package com.carepilot.orchestrator.service;

import com.carepilot.orchestrator.model.CaseRecord;
import com.carepilot.orchestrator.model.FailureReason;
import com.carepilot.orchestrator.model.ImagingFinding;
import com.carepilot.orchestrator.model.StageHistoryEntry;
import com.carepilot.orchestrator.model.StageName;
import com.carepilot.orchestrator.model.UrgencyLevel;
import com.carepilot.orchestrator.model.UrgencyOverride;
import com.carepilot.orchestrator.stage.StageException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.carepilot.orchestrator.CaseFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordValidatorTest {

    final RecordValidator validator = new RecordValidator();

    @Test
    void validResult_passes() {
        CaseRecord before = afterIntake(UrgencyLevel.HIGH, null);
        CaseRecord after  = afterExamination(false, null).toBuilder().history(before.history()).build();

        assertThatCode(() -> validator.validate(StageName.EXAMINATION, before, after)).doesNotThrowAnyException();
    }

    @Test
    void nullResult_isInvariantViolation() {
        assertThatThrownBy(() -> validator.validate(StageName.INTAKE, fresh(MILD_COUGH), null))
                .isInstanceOfSatisfying(StageException.class,
                        e -> assertThat(e.getReason()).isEqualTo(FailureReason.INVARIANT_VIOLATED));
    }

    @Test
    void historyWrittenByStage_isRejected() {
        CaseRecord before = fresh(MILD_COUGH);
        CaseRecord after  = before.toBuilder()
                .urgency(UrgencyLevel.LOW)
                .history(List.of(StageHistoryEntry.succeeded(StageName.INTAKE, T0, 1, null)))
                .build();

        assertThatThrownBy(() -> validator.validate(StageName.INTAKE, before, after))
                .hasMessageContaining("history");
    }

    @Test
    void changedCaseId_isRejected() {
        CaseRecord before = fresh(MILD_COUGH);
        CaseRecord after  = new CaseRecord.Builder("other", before.symptoms()).urgency(UrgencyLevel.LOW).build();

        assertThatThrownBy(() -> validator.validate(StageName.INTAKE, before, after))
                .hasMessageContaining("case id changed");
    }

    @Test
    void silentDowngrade_isRejected() {
        CaseRecord before = afterIntake(UrgencyLevel.HIGH, null);
        CaseRecord after  = afterExamination(false, null).toBuilder()
                .history(before.history())
                .urgency(UrgencyLevel.LOW)
                .build();

        assertThatThrownBy(() -> validator.validate(StageName.EXAMINATION, before, after))
                .hasMessageContaining("without an override");
    }

    @Test
    void downgradeWithMatchingOverride_passes() {
        CaseRecord before = afterIntake(UrgencyLevel.HIGH, null);
        CaseRecord after  = afterExamination(false, null).toBuilder()
                .history(before.history())
                .urgency(UrgencyLevel.LOW)
                .pendingOverride(new UrgencyOverride(UrgencyLevel.HIGH, UrgencyLevel.LOW, "viral picture"))
                .build();

        assertThatCode(() -> validator.validate(StageName.EXAMINATION, before, after)).doesNotThrowAnyException();
    }

    @Test
    void clearedUrgency_isRejected() {
        CaseRecord before = afterIntake(UrgencyLevel.HIGH, null);
        CaseRecord after  = afterExamination(false, null).toBuilder()
                .history(before.history())
                .urgency(null)
                .build();

        assertThatThrownBy(() -> validator.validate(StageName.EXAMINATION, before, after))
                .hasMessageContaining("urgency was cleared");
    }

    @Test
    void missingStageOutput_isRejected() {
        CaseRecord before = afterExamination(true, chestPng());

        assertThatThrownBy(() -> validator.validate(StageName.IMAGING, before, before))
                .hasMessageContaining("imaging produced no finding");
        assertThatThrownBy(() -> validator.validate(StageName.REPORT_SYNTHESIS, before, before))
                .hasMessageContaining("no report");
    }

    @Test
    void findingWithoutOrder_isRejected() {
        CaseRecord before = afterExamination(false, null);
        CaseRecord after  = before.toBuilder()
                .imagingFinding(new ImagingFinding("Normal", 0.9, "", ""))
                .build();

        assertThatThrownBy(() -> validator.validate(StageName.IMAGING, before, after))
                .hasMessageContaining("without an imaging order");
    }
}
