package com.crewdesk.skills;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * One indexed skill.
 *
 * @param pluginName      owning plugin (manifest name)
 * @param skillName       skill name from SKILL.md frontmatter
 * @param label           operator-facing label, e.g. "Customer Support: Ticket Triage"
 * @param description     frontmatter description
 * @param skillPath       directory containing SKILL.md
 * @param frontmatter     all frontmatter key/value pairs
 * @param mcpIntegrations MCP server names declared by the plugin
 */
public record SkillEntry(
    String pluginName,
    String skillName,
    String label,
    String description,
    Path skillPath,
    Map<String, String> frontmatter,
    Set<String> mcpIntegrations
) {

    public SkillEntry {
        frontmatter = frontmatter == null ? Map.of() : Map.copyOf(frontmatter);
        mcpIntegrations = mcpIntegrations == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(mcpIntegrations));
    }

    public static SkillEntry of(String pluginName, String skillName, String description) {
        return new SkillEntry(pluginName, skillName, SkillLabels.toLabel(pluginName, skillName),
                description, null, Map.of("name", skillName, "description", description), Set.of());
    }
}
