package com.carepilot.orchestrator.model;

/**
 * The four specialist stages a case passes through.
 *
 * Each stage maps to one StageAgent and to one RunState while it is active.
 * IMAGING is optional: it only runs when EXAMINATION places an imaging order.
 */
public enum StageName {
    INTAKE,             // Front-desk triage: symptom tags, urgency, department
    EXAMINATION,        // Physician assessment: differential diagnosis, optional imaging order
    IMAGING,            // Radiology: classifier finding plus grounded narrative
    REPORT_SYNTHESIS    // Deterministic assembly of the final report
}
