package com.carepilot.orchestrator.model;

import java.util.List;

/** Recommended tests and treatment plan produced by Examination. */
public record CarePlan(List<String> recommendedTests, String treatmentPlan) {

    public CarePlan {
        recommendedTests = recommendedTests == null ? List.of() : List.copyOf(recommendedTests);
        treatmentPlan    = treatmentPlan == null ? "" : treatmentPlan;
    }
}
