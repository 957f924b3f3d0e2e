package com.carepilot.orchestrator.service;

import com.carepilot.orchestrator.model.CaseRecord;
import com.carepilot.orchestrator.model.FinalReport;
import com.carepilot.orchestrator.model.ImagingFinding;
import com.carepilot.orchestrator.model.RunState;
import com.carepilot.orchestrator.model.UrgencyLevel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.carepilot.orchestrator.CaseFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StageTransitionsTest {

    @Test
    void next_followsImagingOrder() {
        assertThat(StageTransitions.next(RunState.CREATED, fresh(MILD_COUGH))).isEqualTo(RunState.INTAKE);
        assertThat(StageTransitions.next(RunState.INTAKE, afterIntake(UrgencyLevel.LOW, null)))
                .isEqualTo(RunState.EXAMINATION);
        assertThat(StageTransitions.next(RunState.EXAMINATION, afterExamination(true, chestPng())))
                .isEqualTo(RunState.IMAGING);
        assertThat(StageTransitions.next(RunState.EXAMINATION, afterExamination(false, null)))
                .isEqualTo(RunState.REPORT_SYNTHESIS);
    }

    @Test
    void next_orderWithoutImage_skipsImagingToReport() {
        assertThat(StageTransitions.next(RunState.EXAMINATION, afterExamination(true, null)))
                .isEqualTo(RunState.REPORT_SYNTHESIS);
    }

    @Test
    void next_imagingToReport_requiresFinding() {
        CaseRecord withFinding = afterExamination(true, chestPng()).toBuilder()
                .imagingFinding(new ImagingFinding("Normal", 0.9, "", ""))
                .build();

        assertThat(StageTransitions.next(RunState.IMAGING, withFinding)).isEqualTo(RunState.REPORT_SYNTHESIS);
        assertThatThrownBy(() -> StageTransitions.next(RunState.IMAGING, afterExamination(true, chestPng())))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void next_reportToCompleted_requiresReport() {
        CaseRecord in = afterExamination(false, null);
        CaseRecord withReport = in.toBuilder()
                .report(new FinalReport("case-1", in.patient(), in.complaint(), in.symptoms().tags(),
                        in.urgency(), in.triage(), in.diagnosis(), in.carePlan(), null, null,
                        in.history(), "# report"))
                .build();

        assertThat(StageTransitions.next(RunState.REPORT_SYNTHESIS, withReport)).isEqualTo(RunState.COMPLETED);
        assertThatThrownBy(() -> StageTransitions.next(RunState.REPORT_SYNTHESIS, in))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void next_fromTerminal_throws() {
        for (RunState terminal : List.of(RunState.COMPLETED, RunState.FAILED, RunState.CANCELLED)) {
            assertThatThrownBy(() -> StageTransitions.next(terminal, fresh(MILD_COUGH)))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    void table_neverLeavesATerminalState() {
        assertThat(StageTransitions.table())
                .noneMatch(t -> t.from().isTerminal())
                .extracting(StageTransitions.Transition::to)
                .doesNotContain(RunState.CREATED, RunState.FAILED, RunState.CANCELLED);
    }

    @Test
    void examinationBranches_areMutuallyExclusive() {
        for (CaseRecord r : List.of(afterExamination(true, chestPng()), afterExamination(false, null))) {
            assertThat(StageTransitions.table())
                    .filteredOn(t -> t.from() == RunState.EXAMINATION && t.allows(r))
                    .hasSize(1);
        }
    }
}
