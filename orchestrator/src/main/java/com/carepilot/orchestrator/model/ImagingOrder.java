package com.carepilot.orchestrator.model;

import java.util.Objects;

/**
 * Imaging requested by the Examination stage, e.g. X-RAY of the CHEST.
 *
 * @param indication the configured condition that triggered the order
 */
public record ImagingOrder(String modality, String bodyRegion, String indication) {

    public ImagingOrder {
        Objects.requireNonNull(modality, "modality");
        Objects.requireNonNull(bodyRegion, "bodyRegion");
    }
}
