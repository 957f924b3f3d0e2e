package com.carepilot.orchestrator.api.dto;

import com.carepilot.orchestrator.model.PatientInfo;

/**
 * Request body for POST /cases.
 *
 * Required: complaint
 * Optional: patient, medicalHistory, imageBase64 (with imageFilename) for
 *   cases that may need imaging. Without an image an imaging order is
 *   reported as pending and the Imaging stage is skipped.
 */
public record StartCaseRequest(String complaint,
                               PatientInfo patient,
                               String medicalHistory,
                               String imageBase64,
                               String imageFilename) {}
