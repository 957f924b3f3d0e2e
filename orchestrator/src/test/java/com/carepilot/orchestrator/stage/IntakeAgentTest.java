package com.carepilot.orchestrator.stage;

import com.carepilot.orchestrator.config.PipelineSettings;
import com.carepilot.orchestrator.inference.InferenceClient;
import com.carepilot.orchestrator.inference.InferenceException;
import com.carepilot.orchestrator.inference.InferenceRequest;
import com.carepilot.orchestrator.model.CaseRecord;
import com.carepilot.orchestrator.model.ErrorCategory;
import com.carepilot.orchestrator.model.FailureReason;
import com.carepilot.orchestrator.model.KnowledgeContext;
import com.carepilot.orchestrator.model.KnowledgeSnippet;
import com.carepilot.orchestrator.model.UrgencyLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.carepilot.orchestrator.CaseFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IntakeAgentTest {

    static final KnowledgeContext TRIAGE_CONTEXT = new KnowledgeContext("triage",
            List.of(new KnowledgeSnippet("triage-001", "Chest pain warrants HIGH urgency.", 0.6)));

    @Mock InferenceClient inference;

    IntakeAgent agent;

    @BeforeEach
    void setUp() {
        agent = new IntakeAgent(new GroundedGenerator(inference, PipelineSettings.defaults()));
    }

    // ------------------------------------------------------------------
    // Urgency
    // ------------------------------------------------------------------

    @Test
    void process_mildCough_rubricSettlesModerateAtLow() {
        when(inference.generate(any())).thenReturn(intakeReply("MODERATE", "General Medicine", "cough"));

        CaseRecord out = agent.process(fresh(MILD_COUGH), KnowledgeContext.empty());

        assertThat(out.urgency()).isEqualTo(UrgencyLevel.LOW);
        assertThat(out.symptoms().tags()).containsExactly("cough");
        assertThat(out.triage().department()).isEqualTo("General Medicine");
    }

    @Test
    void process_mildCough_modelHighIsNotLowered() {
        when(inference.generate(any())).thenReturn(intakeReply("HIGH", "General Medicine", "cough"));

        CaseRecord out = agent.process(fresh(MILD_COUGH), KnowledgeContext.empty());

        assertThat(out.urgency()).isEqualTo(UrgencyLevel.HIGH);
    }

    @Test
    void process_mildlyWordedStrokeSigns_keepModelCritical() {
        when(inference.generate(any())).thenReturn(intakeReply("CRITICAL", "Emergency", "slurred speech", "facial droop"));

        CaseRecord out = agent.process(fresh("mild slurred speech and facial droop since this morning"),
                KnowledgeContext.empty());

        assertThat(out.urgency()).isEqualTo(UrgencyLevel.CRITICAL);
    }

    @Test
    void process_rubricHigh_doesNotDiscardModelCritical() {
        when(inference.generate(any())).thenReturn(intakeReply("CRITICAL", "Emergency", "chest pain"));

        CaseRecord out = agent.process(fresh("sudden chest pain after climbing stairs"), KnowledgeContext.empty());

        assertThat(out.urgency()).isEqualTo(UrgencyLevel.CRITICAL);
    }

    @Test
    void process_chestCase_isAtLeastHighAndTagsIncludeRubricTerms() {
        when(inference.generate(any())).thenReturn(intakeReply("MODERATE", "Emergency", "fever"));

        CaseRecord out = agent.process(fresh(CHEST_CASE), TRIAGE_CONTEXT);

        assertThat(out.urgency()).isGreaterThanOrEqualTo(UrgencyLevel.HIGH);
        assertThat(out.symptoms().tags()).contains("fever", "chest pain", "shortness of breath");
        assertThat(out.knowledgeContext()).isEqualTo(TRIAGE_CONTEXT);
    }

    @Test
    void process_rubricSilent_usesModelUrgency() {
        when(inference.generate(any())).thenReturn(intakeReply("medium", "Dermatology", "itch"));

        CaseRecord out = agent.process(fresh("itchy patch on the left forearm"), KnowledgeContext.empty());

        assertThat(out.urgency()).isEqualTo(UrgencyLevel.MODERATE);
    }

    // ------------------------------------------------------------------
    // Grounding and prompt modes
    // ------------------------------------------------------------------

    @Test
    void process_sendsRetrievedSnippetsAndSchema() {
        when(inference.generate(any())).thenReturn(intakeReply("HIGH", "Emergency", "chest pain"));

        agent.process(fresh(CHEST_CASE), TRIAGE_CONTEXT);

        ArgumentCaptor<InferenceRequest> captor = ArgumentCaptor.forClass(InferenceRequest.class);
        verify(inference).generate(captor.capture());
        InferenceRequest sent = captor.getValue();
        assertThat(sent.userPrompt())
                .contains(CHEST_CASE)
                .contains("REFERENCE KNOWLEDGE")
                .contains("[triage-001] Chest pain warrants HIGH urgency.");
        assertThat(sent.systemPrompt()).contains("\"urgency\"").doesNotContain("IMPORTANT");
        assertThat(sent.schema().name()).isEqualTo("intake");
        assertThat(sent.parameters().temperature()).isEqualTo(0.7);
    }

    @Test
    void process_strictMode_usesStrictTemperatureAndSuffix() {
        when(inference.generate(any())).thenReturn(intakeReply("LOW", "General Medicine", "cough"));

        agent.process(fresh(MILD_COUGH), KnowledgeContext.empty(), PromptMode.STRICT);

        ArgumentCaptor<InferenceRequest> captor = ArgumentCaptor.forClass(InferenceRequest.class);
        verify(inference).generate(captor.capture());
        assertThat(captor.getValue().parameters().temperature()).isEqualTo(0.0);
        assertThat(captor.getValue().systemPrompt()).contains("JSON object ONLY");
    }

    @Test
    void process_isDeterministicForSameInputs() {
        when(inference.generate(any())).thenReturn(intakeReply("HIGH", "Emergency", "fever", "cough"));

        CaseRecord first  = agent.process(fresh(CHEST_CASE), TRIAGE_CONTEXT);
        CaseRecord second = agent.process(fresh(CHEST_CASE), TRIAGE_CONTEXT);

        assertThat(first).isEqualTo(second);
    }

    // ------------------------------------------------------------------
    // Errors
    // ------------------------------------------------------------------

    @Test
    void process_inferenceTimeout_isTransientStageError() {
        when(inference.generate(any()))
                .thenThrow(new InferenceException(InferenceException.Kind.TIMEOUT, "slow"));

        assertThatThrownBy(() -> agent.process(fresh(CHEST_CASE), KnowledgeContext.empty()))
                .isInstanceOfSatisfying(StageException.class, e -> {
                    assertThat(e.getReason()).isEqualTo(FailureReason.TIMEOUT);
                    assertThat(e.category()).isEqualTo(ErrorCategory.TRANSIENT);
                });
    }

    @Test
    void process_replyMissingFields_isStructural() {
        when(inference.generate(any())).thenReturn(json("{\"symptoms\":[\"cough\"],\"urgency\":\"LOW\"}"));

        assertThatThrownBy(() -> agent.process(fresh(MILD_COUGH), KnowledgeContext.empty()))
                .isInstanceOfSatisfying(StageException.class, e -> {
                    assertThat(e.getReason()).isEqualTo(FailureReason.MALFORMED_OUTPUT);
                    assertThat(e.category()).isEqualTo(ErrorCategory.STRUCTURAL);
                    assertThat(e.getMessage()).contains("$.department", "$.summary");
                });
    }

    @Test
    void knowledgeQuery_isDerivedFromComplaint() {
        assertThat(agent.knowledgeQuery(fresh(CHEST_CASE))).hasValueSatisfying(q -> assertThat(q).contains("chest pain"));
    }
}
