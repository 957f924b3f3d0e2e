package com.carepilot.orchestrator.vision;

import com.carepilot.orchestrator.model.MedicalImage;

import java.util.List;

/**
 * Capability contract for the image-classification service.
 *
 * The core never looks at model internals; it only needs a label from the
 * expected set and a confidence score. Callers still check both, since a
 * misconfigured endpoint can return labels outside the set.
 */
public interface VisionClassifier {

    /**
     * @param expectedLabels the fixed label set the model was trained on
     * @throws ClassifierException when the service is unavailable or rejects the image format
     */
    Classification classify(MedicalImage image, List<String> expectedLabels);
}
