package com.carepilot.orchestrator.model;

/**
 * Optional demographics supplied with the complaint.
 * All fields may be null; prompts render missing values as "unknown".
 */
public record PatientInfo(String name, String patientId, Integer age, String gender) {

    public static PatientInfo anonymous() {
        return new PatientInfo(null, null, null, null);
    }

    /** Multi-line block used in stage prompts and the final report. */
    public String describe() {
        return "- Name: " + orUnknown(name) + "\n"
             + "- ID: " + orUnknown(patientId) + "\n"
             + "- Age: " + (age == null ? "unknown" : age) + "\n"
             + "- Gender: " + orUnknown(gender);
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? "unknown" : value;
    }
}
