package com.crewdesk.skills;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * SKILL.md parsing helpers: frontmatter extraction and label generation.
 */
public final class SkillLabels {

    static final Pattern FRONTMATTER = Pattern.compile("^---\\r?\\n([\\s\\S]*?)\\r?\\n---");
    static final Pattern FRONTMATTER_BLOCK = Pattern.compile("^---\\r?\\n[\\s\\S]*?\\r?\\n---\\r?\\n?");
    private static final Pattern KEY_VALUE = Pattern.compile("^(\\w[\\w-]*)\\s*:\\s*(.+)$");

    private SkillLabels() {}

    /**
     * Parses flat {@code key: value} frontmatter. Both {@code name} and
     * {@code description} are required.
     */
    public static Optional<Map<String, String>> parseFrontmatter(String content) {
        Matcher m = FRONTMATTER.matcher(content);
        if (!m.find()) return Optional.empty();

        Map<String, String> result = new LinkedHashMap<>();
        for (String line : m.group(1).split("\n")) {
            Matcher kv = KEY_VALUE.matcher(line.stripTrailing());
            if (kv.matches()) {
                result.put(kv.group(1), kv.group(2).trim());
            }
        }
        if (!result.containsKey("name") || !result.containsKey("description")) {
            return Optional.empty();
        }
        return Optional.of(result);
    }

    public static String stripFrontmatter(String content) {
        return FRONTMATTER_BLOCK.matcher(content).replaceFirst("").trim();
    }

    /**
     * "customer-support" + "ticket-triage" → "Customer Support: Ticket Triage".
     */
    public static String toLabel(String pluginName, String skillName) {
        return humanize(pluginName) + ": " + humanize(skillName);
    }

    private static String humanize(String s) {
        return Arrays.stream(s.split("-"))
                .map(w -> w.isEmpty() ? w : Character.toUpperCase(w.charAt(0)) + w.substring(1))
                .collect(Collectors.joining(" "));
    }
}
