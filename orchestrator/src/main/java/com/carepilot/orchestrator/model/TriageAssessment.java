package com.carepilot.orchestrator.model;

/** Front-desk routing produced by Intake. */
public record TriageAssessment(String department, String summary) {}
