package com.crewdesk.skills;

import java.util.List;
import java.util.Optional;

/**
 * Read-only lookup over the installed skills.
 */
public interface SkillRegistry {

    /** Rebuilds the index from its source. */
    void scan();

    boolean isScanned();

    List<SkillEntry> getAllSkills();

    Optional<SkillEntry> getSkill(String pluginName, String skillName);

    /** Skills whose plugin name equals {@code domain}. */
    List<SkillEntry> getSkillsByDomain(String domain);

    /**
     * Label, description truncated to 200 chars, and MCP integrations.
     */
    Optional<String> getSkillSummary(String pluginName, String skillName);

    /**
     * SKILL.md instructions for prompting, frontmatter stripped and truncated to
     * roughly {@code maxTokens} tokens. Empty string when the skill has no readable SKILL.md.
     */
    String instructionSummary(String pluginName, String skillName, int maxTokens);
}
