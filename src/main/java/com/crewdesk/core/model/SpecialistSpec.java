package com.crewdesk.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * One specialist slot in a team.
 *
 * @param role        human-readable role, also the basis of the specialist id
 * @param skillPlugin plugin of the matched skill (empty for the generalist)
 * @param skillName   matched skill name (empty for the generalist)
 * @param contextKeys business-context keys the specialist may see
 */
public record SpecialistSpec(
    String role,
    String skillPlugin,
    String skillName,
    List<String> contextKeys
) implements Serializable {

    public SpecialistSpec {
        contextKeys = contextKeys == null ? List.of() : List.copyOf(contextKeys);
    }
}
