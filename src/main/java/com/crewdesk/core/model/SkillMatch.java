package com.crewdesk.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;

/**
 * Best registry skill for one sub-task.
 *
 * @param plugin            owning plugin, empty when nothing matched
 * @param skill             skill name, empty when nothing matched
 * @param userLabel         label shown to the operator
 * @param confidence        fit score in [0, 1]
 * @param needsConfirmation true iff confidence is below {@link #CONFIRMATION_THRESHOLD}
 */
public record SkillMatch(
    String plugin,
    String skill,
    String userLabel,
    double confidence,
    boolean needsConfirmation
) implements Serializable {

    public static final double CONFIRMATION_THRESHOLD = 0.7;

    public static SkillMatch of(String plugin, String skill, String userLabel, double confidence) {
        return new SkillMatch(plugin, skill, userLabel, confidence, confidence < CONFIRMATION_THRESHOLD);
    }

    public static SkillMatch unmatched(String domain) {
        return of("", "", domain, 0);
    }

    @JsonIgnore
    public boolean isMatched() {
        return plugin != null && !plugin.isEmpty();
    }
}
