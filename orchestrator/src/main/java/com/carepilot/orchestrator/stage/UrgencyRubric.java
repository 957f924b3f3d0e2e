package com.carepilot.orchestrator.stage;

import com.carepilot.orchestrator.model.UrgencyLevel;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword rubric applied to the raw complaint at Intake.
 *
 * The rubric only ever raises the model's urgency. A severity match is a
 * floor: the result is the higher of the rubric's level and the model's.
 * Mitigating phrases alone can settle LOW against MODERATE but never pull a
 * HIGH or CRITICAL model level down. Mitigating phrases ("mild", "no fever") are removed
 * from the text before the severity terms are searched, so a negated symptom
 * does not count.
 *
 * Levels:
 *   any critical term          → CRITICAL
 *   three or more high terms   → CRITICAL
 *   one or two high terms      → HIGH
 *   any moderate term          → MODERATE
 *   only mitigating terms      → LOW
 */
public final class UrgencyRubric {

    static final List<String> CRITICAL_TERMS = List.of(
            "unconscious", "unresponsive", "not breathing", "cardiac arrest",
            "severe bleeding", "seizure", "stroke", "anaphylaxis", "suicidal",
            "crushing chest pain", "coughing blood", "blue lips");

    static final List<String> HIGH_TERMS = List.of(
            "chest pain", "shortness of breath", "difficulty breathing", "high fever",
            "confusion", "fainting", "severe pain", "severe headache", "vomiting blood",
            "head injury", "persistent vomiting");

    static final List<String> MODERATE_TERMS = List.of(
            "fever", "vomiting", "dizziness", "infection", "swelling", "wheezing",
            "productive cough", "rash", "moderate pain", "persistent cough");

    static final List<String> MITIGATING_TERMS = List.of(
            "no fever", "no pain", "mild", "slight", "minor", "seasonal", "occasional",
            "runny nose", "sneezing");

    /** Which kind of term decided the rubric's level. */
    public enum Basis { SEVERITY, MITIGATING, NONE }

    /**
     * @param level        the rubric's level; meaningful only when a term matched
     * @param basis        what the level rests on
     * @param matchedTerms severity terms found, used as additional symptom tags
     */
    public record Assessment(UrgencyLevel level, Basis basis, List<String> matchedTerms) {
        public Assessment {
            matchedTerms = List.copyOf(matchedTerms);
        }

        /** Combines the rubric with the model's level; never lowers HIGH or CRITICAL. */
        public UrgencyLevel apply(UrgencyLevel model) {
            return switch (basis) {
                case SEVERITY   -> level.max(model);
                case MITIGATING -> model.isLowerThan(UrgencyLevel.HIGH) ? UrgencyLevel.LOW : model;
                case NONE       -> model;
            };
        }
    }

    private UrgencyRubric() {}

    public static Assessment assess(String complaint) {
        if (complaint == null || complaint.isBlank()) {
            return new Assessment(UrgencyLevel.LOW, Basis.NONE, List.of());
        }
        StringBuilder text = new StringBuilder(complaint.toLowerCase(Locale.ROOT));

        int mitigating = strip(text, MITIGATING_TERMS, new ArrayList<>());

        List<String> critical = new ArrayList<>();
        List<String> high     = new ArrayList<>();
        List<String> moderate = new ArrayList<>();
        strip(text, CRITICAL_TERMS, critical);
        strip(text, HIGH_TERMS, high);
        strip(text, MODERATE_TERMS, moderate);

        List<String> matched = new ArrayList<>(critical);
        matched.addAll(high);
        matched.addAll(moderate);

        if (!critical.isEmpty() || high.size() >= 3) {
            return new Assessment(UrgencyLevel.CRITICAL, Basis.SEVERITY, matched);
        }
        if (!high.isEmpty()) {
            return new Assessment(UrgencyLevel.HIGH, Basis.SEVERITY, matched);
        }
        if (!moderate.isEmpty()) {
            return new Assessment(UrgencyLevel.MODERATE, Basis.SEVERITY, matched);
        }
        if (mitigating > 0) {
            return new Assessment(UrgencyLevel.LOW, Basis.MITIGATING, matched);
        }
        return new Assessment(UrgencyLevel.LOW, Basis.NONE, matched);
    }

    /** Blank out every whole-word occurrence of each term; returns how many terms matched. */
    private static int strip(StringBuilder text, List<String> terms, List<String> found) {
        int count = 0;
        for (String term : terms) {
            Matcher m = Pattern.compile("\\b" + Pattern.quote(term) + "\\b").matcher(text);
            if (m.find()) {
                count++;
                found.add(term);
                String replaced = m.replaceAll(" ".repeat(term.length()));
                text.setLength(0);
                text.append(replaced);
            }
        }
        return count;
    }
}
