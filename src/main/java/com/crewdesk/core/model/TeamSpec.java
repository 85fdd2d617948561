package com.crewdesk.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Team composition: one lead plus one to four specialists.
 */
public record TeamSpec(
    String leadPrompt,
    List<SpecialistSpec> specialists,
    CostEstimate estimatedCost
) implements Serializable {

    public TeamSpec {
        specialists = specialists == null ? List.of() : List.copyOf(specialists);
    }

    public int teamSize() {
        return specialists.size() + 1;
    }
}
