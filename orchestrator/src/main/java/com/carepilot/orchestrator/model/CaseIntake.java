package com.carepilot.orchestrator.model;

import java.util.Objects;

/**
 * Everything the caller supplies when starting a run.
 * Only the complaint is required.
 */
public record CaseIntake(String complaint, PatientInfo patient, String medicalHistory, MedicalImage image) {

    public CaseIntake {
        Objects.requireNonNull(complaint, "complaint");
        if (complaint.isBlank()) {
            throw new IllegalArgumentException("complaint must not be blank");
        }
        patient = patient == null ? PatientInfo.anonymous() : patient;
    }

    public static CaseIntake of(String complaint) {
        return new CaseIntake(complaint, null, null, null);
    }

    public static CaseIntake withImage(String complaint, MedicalImage image) {
        return new CaseIntake(complaint, null, null, image);
    }
}
