package com.carepilot.orchestrator.stage;

import com.carepilot.orchestrator.model.StageName;

/**
 * System prompts for the model-backed stages.
 *
 * Every prompt tells the model:
 *   1. Which role it is playing
 *   2. That it must reason only from the case and the REFERENCE KNOWLEDGE block
 *   3. That it must answer with one JSON object matching the attached schema
 *
 * The schema itself is appended by {@link GroundedGenerator}, so the prompt
 * text and the validator can never drift apart.
 */
public final class StagePrompts {

    private StagePrompts() {}

    public static String system(StageName stage) {
        return switch (stage) {
            case INTAKE      -> INTAKE_PROMPT;
            case EXAMINATION -> EXAMINATION_PROMPT;
            case IMAGING     -> IMAGING_PROMPT;
            case REPORT_SYNTHESIS ->
                    throw new IllegalArgumentException("REPORT_SYNTHESIS does not call the model");
        };
    }

    /** Appended for the single retry after a schema violation. */
    public static final String STRICT_SUFFIX = """

            IMPORTANT: your previous reply could not be parsed against the schema.
            Reply with the JSON object ONLY. No prose before or after it, no code fences.
            Every required field must be present with the declared type.
            Numbers must be plain decimals, enum values must be spelled exactly as listed.
            """;

    // ------------------------------------------------------------------
    // Role prompts
    // ------------------------------------------------------------------

    private static final String INTAKE_PROMPT = """
            You are the front-desk triage nurse of a hospital emergency department.

            YOUR GOAL: read the patient's complaint and route the case.
              - Extract the individual symptoms as short lower-case tags
                ("chest pain", "fever", "cough").
              - Assign an urgency: LOW, MODERATE, HIGH or CRITICAL.
              - Name the department that should see the patient.
              - Write a two or three sentence summary for the physician.

            RULES:
              - Use only the complaint, the patient details and the REFERENCE KNOWLEDGE.
              - Do not diagnose. That is the physician's job.
              - When in doubt between two urgency levels, choose the higher one.
            """;

    private static final String EXAMINATION_PROMPT = """
            You are the examining physician.

            YOUR GOAL: produce a differential diagnosis and a care plan.
              - List the candidate conditions with a confidence between 0 and 1
                and a short rationale that cites the reference sources by id.
              - Recommend follow-up tests. If a chest condition such as pneumonia
                is suspected, say that imaging is needed.
              - Outline an initial treatment plan.
              - You may propose an urgency. If you propose a LOWER urgency than the
                triage level, you MUST explain why in urgencyOverrideReason;
                a lower urgency without a reason is ignored.

            RULES:
              - Reason only from the case and the REFERENCE KNOWLEDGE.
              - Never invent test results you were not given.
            """;

    private static final String IMAGING_PROMPT = """
            You are the radiologist.

            YOUR GOAL: write the narrative for an imaging study.
              - You are given the imaging order, the automated classifier label and its
                confidence, and the physician's differential.
              - Write a short findings narrative and a one-line impression.

            RULES:
              - Do not contradict the classifier label. If its confidence is low, say so.
              - Reason only from the case and the REFERENCE KNOWLEDGE.
            """;
}
