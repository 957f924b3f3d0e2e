package com.carepilot.orchestrator.stage;

import com.carepilot.orchestrator.config.PipelineSettings;
import com.carepilot.orchestrator.inference.InferenceClient;
import com.carepilot.orchestrator.model.CaseRecord;
import com.carepilot.orchestrator.model.ConditionHypothesis;
import com.carepilot.orchestrator.model.FailureReason;
import com.carepilot.orchestrator.model.ImagingOrder;
import com.carepilot.orchestrator.model.KnowledgeContext;
import com.carepilot.orchestrator.model.UrgencyLevel;
import com.carepilot.orchestrator.model.UrgencyOverride;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.carepilot.orchestrator.CaseFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExaminationAgentTest {

    @Mock InferenceClient inference;

    ExaminationAgent agent;

    @BeforeEach
    void setUp() {
        PipelineSettings settings = PipelineSettings.defaults();
        agent = new ExaminationAgent(new GroundedGenerator(inference, settings), settings);
    }

    @Test
    void process_pneumoniaLeads_sortsDiagnosisAndOrdersChestXray() {
        when(inference.generate(any())).thenReturn(pneumoniaExamination());

        CaseRecord out = agent.process(afterIntake(UrgencyLevel.HIGH, null), KnowledgeContext.empty());

        assertThat(out.diagnosis()).extracting(ConditionHypothesis::condition)
                .containsExactly("Community-acquired pneumonia", "Acute bronchitis");
        assertThat(out.imagingOrder()).isEqualTo(new ImagingOrder("X-RAY", "CHEST", "pneumonia"));
        assertThat(out.carePlan().recommendedTests()).contains("Chest X-ray");
    }

    @Test
    void process_coldLeads_noImagingOrder() {
        when(inference.generate(any())).thenReturn(coldExamination());

        CaseRecord out = agent.process(afterIntake(UrgencyLevel.LOW, null), KnowledgeContext.empty());

        assertThat(out.hasImagingOrder()).isFalse();
        assertThat(out.topHypothesis().condition()).isEqualTo("Common cold");
    }

    @Test
    void imagingOrderFor_matchesRationaleAsWellAsCondition() {
        ImagingOrder order = agent.imagingOrderFor(
                new ConditionHypothesis("Lower respiratory infection", 0.6, "rule out pneumonia"));

        assertThat(order).isEqualTo(new ImagingOrder("X-RAY", "CHEST", "pneumonia"));
    }

    @Test
    void imagingOrderFor_conditionOutsideClassifierScope_ordersNothing() {
        assertThat(agent.imagingOrderFor(new ConditionHypothesis("Distal radius fracture", 0.7, "Fall on hand")))
                .isNull();
        assertThat(agent.imagingOrderFor(new ConditionHypothesis("Pulmonary embolism", 0.5, "Pleuritic pain")))
                .isNull();
    }

    // ------------------------------------------------------------------
    // Proposed urgency
    // ------------------------------------------------------------------

    @Test
    void process_lowerUrgencyWithoutReason_isIgnored() {
        ObjectNode reply = (ObjectNode) coldExamination();
        reply.put("urgency", "LOW");
        when(inference.generate(any())).thenReturn(reply);

        CaseRecord out = agent.process(afterIntake(UrgencyLevel.HIGH, null), KnowledgeContext.empty());

        assertThat(out.urgency()).isEqualTo(UrgencyLevel.HIGH);
        assertThat(out.pendingOverride()).isNull();
    }

    @Test
    void process_lowerUrgencyWithReason_recordsOverride() {
        ObjectNode reply = (ObjectNode) coldExamination();
        reply.put("urgency", "LOW");
        reply.put("urgencyOverrideReason", "Normal vital signs and no chest findings");
        when(inference.generate(any())).thenReturn(reply);

        CaseRecord out = agent.process(afterIntake(UrgencyLevel.HIGH, null), KnowledgeContext.empty());

        assertThat(out.urgency()).isEqualTo(UrgencyLevel.LOW);
        assertThat(out.pendingOverride()).isEqualTo(new UrgencyOverride(
                UrgencyLevel.HIGH, UrgencyLevel.LOW, "Normal vital signs and no chest findings"));
    }

    @Test
    void process_higherUrgency_isEscalation() {
        ObjectNode reply = (ObjectNode) pneumoniaExamination();
        reply.put("urgency", "CRITICAL");
        when(inference.generate(any())).thenReturn(reply);

        CaseRecord out = agent.process(afterIntake(UrgencyLevel.HIGH, null), KnowledgeContext.empty());

        assertThat(out.urgency()).isEqualTo(UrgencyLevel.CRITICAL);
        assertThat(out.pendingOverride()).isNull();
    }

    // ------------------------------------------------------------------
    // Preconditions and validation
    // ------------------------------------------------------------------

    @Test
    void process_beforeIntake_isPreconditionWithoutModelCall() {
        assertThatThrownBy(() -> agent.process(fresh(CHEST_CASE), KnowledgeContext.empty()))
                .isInstanceOfSatisfying(StageException.class,
                        e -> assertThat(e.getReason()).isEqualTo(FailureReason.PRECONDITION_VIOLATED));
        verifyNoInteractions(inference);
    }

    @Test
    void process_confidenceOutOfRange_isMalformed() {
        when(inference.generate(any())).thenReturn(json("""
                {"hypotheses":[{"condition":"Flu","confidence":1.4,"rationale":"x"}],
                 "recommendedTests":[],"treatmentPlan":"rest"}
                """));

        assertThatThrownBy(() -> agent.process(afterIntake(UrgencyLevel.LOW, null), KnowledgeContext.empty()))
                .isInstanceOfSatisfying(StageException.class,
                        e -> assertThat(e.getReason()).isEqualTo(FailureReason.MALFORMED_OUTPUT));
    }

    @Test
    void process_emptyDifferential_isMalformed() {
        when(inference.generate(any())).thenReturn(json("""
                {"hypotheses":[],"recommendedTests":[],"treatmentPlan":"rest"}
                """));

        assertThatThrownBy(() -> agent.process(afterIntake(UrgencyLevel.LOW, null), KnowledgeContext.empty()))
                .isInstanceOfSatisfying(StageException.class,
                        e -> assertThat(e.getReason()).isEqualTo(FailureReason.MALFORMED_OUTPUT));
    }

    @Test
    void knowledgeQuery_usesSymptomTags() {
        assertThat(agent.knowledgeQuery(afterIntake(UrgencyLevel.HIGH, null)))
                .hasValueSatisfying(q -> assertThat(q).startsWith("differential diagnosis").contains("chest pain"));
    }
}
