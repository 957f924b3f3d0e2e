package com.carepilot.orchestrator.stage;

import com.carepilot.orchestrator.config.PipelineSettings;
import com.carepilot.orchestrator.inference.OutputSchema;
import com.carepilot.orchestrator.model.CaseRecord;
import com.carepilot.orchestrator.model.ConditionHypothesis;
import com.carepilot.orchestrator.model.FailureReason;
import com.carepilot.orchestrator.model.ImagingFinding;
import com.carepilot.orchestrator.model.ImagingOrder;
import com.carepilot.orchestrator.model.KnowledgeContext;
import com.carepilot.orchestrator.model.StageName;
import com.carepilot.orchestrator.model.UrgencyLevel;
import com.carepilot.orchestrator.vision.Classification;
import com.carepilot.orchestrator.vision.ClassifierException;
import com.carepilot.orchestrator.vision.ImagePreValidator;
import com.carepilot.orchestrator.vision.VisionClassifier;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Radiologist: classifies the attached image for the ordered study and drafts
 * the narrative.
 *
 * Runs only when Examination produced an {@link ImagingOrder} and the case
 * carries an image; invoked without an order it fails with a precondition
 * error regardless of the rest of the record. An order for a study other than
 * the one the classifier reads fails with UNSUPPORTED_STUDY before the
 * classifier is called.
 * An abnormal finding the differential does not mention is added to it, and a
 * confident abnormal finding raises urgency to at least HIGH.
 */
@Component
public class ImagingAgent implements StageAgent {

    private static final Logger log = LoggerFactory.getLogger(ImagingAgent.class);

    static final OutputSchema SCHEMA = OutputSchema.builder("imaging")
            .requiredString("narrative", "Findings narrative")
            .requiredString("impression", "One-line impression")
            .build();

    private final GroundedGenerator          generator;
    private final VisionClassifier           classifier;
    private final ImagePreValidator          preValidator;
    private final PipelineSettings.Imaging   imaging;

    public ImagingAgent(GroundedGenerator generator, VisionClassifier classifier,
                        ImagePreValidator preValidator, PipelineSettings settings) {
        this.generator    = generator;
        this.classifier   = classifier;
        this.preValidator = preValidator;
        this.imaging      = settings.imaging();
    }

    @Override
    public StageName stage() {
        return StageName.IMAGING;
    }

    @Override
    public Optional<String> knowledgeQuery(CaseRecord record) {
        if (!record.hasImagingOrder()) {
            return Optional.empty();
        }
        ImagingOrder order = record.imagingOrder();
        return Optional.of(order.modality() + " " + order.bodyRegion() + " interpretation " + order.indication());
    }

    @Override
    public void prepare(CaseRecord record) {
        requireReadableOrder(record);
        try {
            preValidator.validate(record.image());
        } catch (ClassifierException e) {
            throw StageException.from(StageName.IMAGING, e);
        }
    }

    @Override
    public CaseRecord process(CaseRecord record, KnowledgeContext context, PromptMode mode) {
        requireReadableOrder(record);
        ImagingOrder order = record.imagingOrder();

        Classification result;
        try {
            result = classifier.classify(record.image(), imaging.labels());
        } catch (ClassifierException e) {
            throw StageException.from(StageName.IMAGING, e);
        }
        String label = imaging.canonicalLabel(result.label())
                .orElseThrow(() -> new StageException(StageName.IMAGING, FailureReason.MALFORMED_OUTPUT,
                        "classifier label '" + result.label() + "' is not one of " + imaging.labels()));
        double confidence = result.confidence();
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new StageException(StageName.IMAGING, FailureReason.MALFORMED_OUTPUT,
                    "classifier confidence " + confidence + " is outside [0, 1]");
        }

        JsonNode out = generator.generate(StageName.IMAGING, SCHEMA,
                buildPrompt(record, label, confidence), context, mode);

        boolean abnormal = !imaging.isNormal(label);
        List<ConditionHypothesis> diagnosis = new ArrayList<>(record.diagnosis());
        if (abnormal && diagnosis.stream().noneMatch(h -> h.mentions(label))) {
            diagnosis.add(new ConditionHypothesis(label, confidence,
                    "Imaging classifier reported " + label + " on " + order.modality() + " " + order.bodyRegion()));
        }

        CaseRecord next = record.toBuilder()
                .diagnosis(diagnosis)
                .imagingFinding(new ImagingFinding(label, confidence,
                        out.get("narrative").asText(), out.get("impression").asText()))
                .knowledgeContext(context)
                .build();

        if (abnormal && confidence >= imaging.escalationConfidence()) {
            log.info("Abnormal finding {} at {} escalates urgency", label, confidence);
            next = next.withEscalatedUrgency(UrgencyLevel.HIGH);
        }
        return next;
    }

    private void requireReadableOrder(CaseRecord record) {
        if (!record.hasImagingOrder()) {
            throw StageException.precondition(StageName.IMAGING, "no imaging order on the case");
        }
        ImagingOrder order = record.imagingOrder();
        if (!imaging.classifies(order.modality(), order.bodyRegion())) {
            PipelineSettings.Study study = imaging.classifierStudy();
            throw new StageException(StageName.IMAGING, FailureReason.UNSUPPORTED_STUDY,
                    "imaging ordered " + order.modality() + " of " + order.bodyRegion()
                            + " but the classifier only reads " + study.modality() + " of " + study.bodyRegion());
        }
        if (!record.hasImage()) {
            throw new StageException(StageName.IMAGING, FailureReason.IMAGE_NOT_SUPPLIED,
                    "imaging ordered (" + order.modality() + " " + order.bodyRegion()
                            + ") but no image was supplied");
        }
    }

    private static String buildPrompt(CaseRecord record, String label, double confidence) {
        ImagingOrder order = record.imagingOrder();
        StringBuilder sb = new StringBuilder();
        sb.append("PATIENT:\n").append(record.patient().describe()).append("\n\n");
        sb.append("IMAGING ORDER: ").append(order.modality()).append(" of ").append(order.bodyRegion())
          .append(" for suspected ").append(order.indication()).append("\n");
        sb.append("CLASSIFIER RESULT: ").append(label)
          .append(String.format(Locale.ROOT, " (confidence %.2f)", confidence)).append("\n\n");
        sb.append("DIFFERENTIAL:\n");
        for (ConditionHypothesis h : record.diagnosis()) {
            sb.append(String.format(Locale.ROOT, "- %s (%.2f): %s\n", h.condition(), h.confidence(), h.rationale()));
        }
        return sb.toString();
    }
}
