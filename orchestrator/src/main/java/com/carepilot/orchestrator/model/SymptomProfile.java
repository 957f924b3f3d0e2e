package com.carepilot.orchestrator.model;

import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Symptom tags plus the raw complaint text.
 *
 * Tags are normalised to lower case and kept sorted so that two profiles built
 * from the same inputs compare equal regardless of the order the model listed them.
 */
public record SymptomProfile(SortedSet<String> tags, String complaint) {

    public SymptomProfile {
        Objects.requireNonNull(complaint, "complaint");
        TreeSet<String> normalized = new TreeSet<>();
        if (tags != null) {
            for (String tag : tags) {
                if (tag != null && !tag.isBlank()) {
                    normalized.add(tag.strip().toLowerCase(Locale.ROOT));
                }
            }
        }
        tags = Collections.unmodifiableSortedSet(normalized);
    }

    /** A profile with no tags yet: the state of a freshly created case. */
    public static SymptomProfile ofComplaint(String complaint) {
        return new SymptomProfile(new TreeSet<>(), complaint);
    }

    public SymptomProfile withTags(Collection<String> moreTags) {
        TreeSet<String> merged = new TreeSet<>(tags);
        merged.addAll(moreTags);
        return new SymptomProfile(merged, complaint);
    }
}
