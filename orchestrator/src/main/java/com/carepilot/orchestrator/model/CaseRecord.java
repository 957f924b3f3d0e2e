package com.carepilot.orchestrator.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The progressively enriched state of one case.
 *
 * Immutable: every stage returns a new version built with {@link #toBuilder()}
 * and the orchestrator alone decides which version is current. Optional parts
 * (urgency, triage, care plan, imaging, report) are null until the stage that
 * owns them has succeeded.
 *
 * Invariants enforced on construction:
 *   - an ImagingFinding can only exist alongside an ImagingOrder
 *   - the diagnosis list is held in descending confidence order
 */
public record CaseRecord(
        String                    caseId,
        PatientInfo               patient,
        String                    medicalHistory,
        MedicalImage              image,
        SymptomProfile            symptoms,
        UrgencyLevel              urgency,
        TriageAssessment          triage,
        List<ConditionHypothesis> diagnosis,
        CarePlan                  carePlan,
        ImagingOrder              imagingOrder,
        ImagingFinding            imagingFinding,
        KnowledgeContext          knowledgeContext,
        UrgencyOverride           pendingOverride,
        List<StageHistoryEntry>   history,
        FinalReport               report
) {
    public CaseRecord {
        Objects.requireNonNull(caseId, "caseId");
        Objects.requireNonNull(symptoms, "symptoms");
        patient          = patient == null ? PatientInfo.anonymous() : patient;
        medicalHistory   = medicalHistory == null ? "" : medicalHistory;
        knowledgeContext = knowledgeContext == null ? KnowledgeContext.empty() : knowledgeContext;
        history          = history == null ? List.of() : List.copyOf(history);

        List<ConditionHypothesis> sorted = new ArrayList<>(diagnosis == null ? List.of() : diagnosis);
        sorted.sort(ConditionHypothesis.BY_CONFIDENCE);
        diagnosis = List.copyOf(sorted);

        if (imagingFinding != null && imagingOrder == null) {
            throw new IllegalArgumentException("an imaging finding requires an imaging order");
        }
    }

    /** A fresh case: identifier, complaint and whatever the caller supplied at run start. */
    public static CaseRecord create(String caseId, CaseIntake intake) {
        return new Builder(caseId, SymptomProfile.ofComplaint(intake.complaint()))
                .patient(intake.patient())
                .medicalHistory(intake.medicalHistory())
                .image(intake.image())
                .build();
    }

    public String complaint()           { return symptoms.complaint(); }
    public boolean hasImagingOrder()    { return imagingOrder != null; }
    public boolean hasImage()           { return image != null; }

    /** The highest-confidence hypothesis, or null before Examination. */
    public ConditionHypothesis topHypothesis() {
        return diagnosis.isEmpty() ? null : diagnosis.get(0);
    }

    /** True when the history holds a successful entry for the given stage. */
    public boolean hasCompleted(StageName stage) {
        return history.stream().anyMatch(e -> e.stage() == stage && e.isSuccess());
    }

    /**
     * Raise urgency to at least the given level. Never lowers it; use
     * {@link #withUrgencyOverride} for an explicit downgrade.
     */
    public CaseRecord withEscalatedUrgency(UrgencyLevel level) {
        UrgencyLevel next = urgency == null ? level : urgency.max(level);
        return next == urgency ? this : toBuilder().urgency(next).build();
    }

    /** Lower (or set) urgency with a recorded reason. */
    public CaseRecord withUrgencyOverride(UrgencyLevel level, String reason) {
        if (urgency == null || !level.isLowerThan(urgency)) {
            return withEscalatedUrgency(level);
        }
        return toBuilder()
                .urgency(level)
                .pendingOverride(new UrgencyOverride(urgency, level, reason))
                .build();
    }

    /** Append one audit entry. Used only by the orchestrator. */
    public CaseRecord withHistoryEntry(StageHistoryEntry entry) {
        List<StageHistoryEntry> next = new ArrayList<>(history);
        next.add(entry);
        return toBuilder().history(next).build();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    // ------------------------------------------------------------------
    // Builder
    // ------------------------------------------------------------------

    public static final class Builder {
        private final String caseId;
        private PatientInfo               patient;
        private String                    medicalHistory;
        private MedicalImage              image;
        private SymptomProfile            symptoms;
        private UrgencyLevel              urgency;
        private TriageAssessment          triage;
        private List<ConditionHypothesis> diagnosis = List.of();
        private CarePlan                  carePlan;
        private ImagingOrder              imagingOrder;
        private ImagingFinding            imagingFinding;
        private KnowledgeContext          knowledgeContext;
        private UrgencyOverride           pendingOverride;
        private List<StageHistoryEntry>   history = List.of();
        private FinalReport               report;

        public Builder(String caseId, SymptomProfile symptoms) {
            this.caseId   = caseId;
            this.symptoms = symptoms;
        }

        private Builder(CaseRecord r) {
            this.caseId           = r.caseId;
            this.patient          = r.patient;
            this.medicalHistory   = r.medicalHistory;
            this.image            = r.image;
            this.symptoms         = r.symptoms;
            this.urgency          = r.urgency;
            this.triage           = r.triage;
            this.diagnosis        = r.diagnosis;
            this.carePlan         = r.carePlan;
            this.imagingOrder     = r.imagingOrder;
            this.imagingFinding   = r.imagingFinding;
            this.knowledgeContext = r.knowledgeContext;
            this.pendingOverride  = r.pendingOverride;
            this.history          = r.history;
            this.report           = r.report;
        }

        public Builder patient(PatientInfo v)                   { this.patient = v; return this; }
        public Builder medicalHistory(String v)                 { this.medicalHistory = v; return this; }
        public Builder image(MedicalImage v)                    { this.image = v; return this; }
        public Builder symptoms(SymptomProfile v)               { this.symptoms = v; return this; }
        public Builder urgency(UrgencyLevel v)                  { this.urgency = v; return this; }
        public Builder triage(TriageAssessment v)               { this.triage = v; return this; }
        public Builder diagnosis(List<ConditionHypothesis> v)   { this.diagnosis = v; return this; }
        public Builder carePlan(CarePlan v)                     { this.carePlan = v; return this; }
        public Builder imagingOrder(ImagingOrder v)             { this.imagingOrder = v; return this; }
        public Builder imagingFinding(ImagingFinding v)         { this.imagingFinding = v; return this; }
        public Builder knowledgeContext(KnowledgeContext v)     { this.knowledgeContext = v; return this; }
        public Builder pendingOverride(UrgencyOverride v)       { this.pendingOverride = v; return this; }
        public Builder history(List<StageHistoryEntry> v)       { this.history = v; return this; }
        public Builder report(FinalReport v)                    { this.report = v; return this; }

        public CaseRecord build() {
            return new CaseRecord(caseId, patient, medicalHistory, image, symptoms, urgency,
                    triage, diagnosis, carePlan, imagingOrder, imagingFinding,
                    knowledgeContext, pendingOverride, history, report);
        }
    }
}
