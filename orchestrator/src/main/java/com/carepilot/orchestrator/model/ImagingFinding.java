package com.carepilot.orchestrator.model;

import java.util.Objects;

/**
 * Radiology result: classifier label and confidence plus the drafted narrative.
 */
public record ImagingFinding(String label, double confidence, String narrative, String impression) {

    public ImagingFinding {
        Objects.requireNonNull(label, "label");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got " + confidence);
        }
        narrative  = narrative == null ? "" : narrative;
        impression = impression == null ? "" : impression;
    }
}
