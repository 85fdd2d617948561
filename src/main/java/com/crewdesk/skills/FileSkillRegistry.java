package com.crewdesk.skills;

import com.crewdesk.core.config.CrewdeskProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Indexes skills from a plugins directory laid out as:
 * <pre>
 *   {plugins}/{plugin}/.claude-plugin/plugin.json
 *   {plugins}/{plugin}/.mcp.json                    (optional)
 *   {plugins}/{plugin}/skills/{skill}/SKILL.md
 * </pre>
 * Plugins without a valid manifest and skills without valid frontmatter are skipped.
 * An unreadable plugins directory yields an empty index.
 */
@Service
public class FileSkillRegistry implements SkillRegistry {

    private static final Logger log = LoggerFactory.getLogger(FileSkillRegistry.class);

    static final int SUMMARY_DESCRIPTION_CHARS = 200;
    static final int CHARS_PER_TOKEN = 4;

    private final Path pluginsPath;
    private final ObjectMapper mapper = new ObjectMapper();

    /** plugin name → skill name → entry; swapped atomically on rescan. */
    private volatile Map<String, Map<String, SkillEntry>> index = Map.of();
    private volatile boolean scanned;

    @Autowired
    public FileSkillRegistry(CrewdeskProperties properties) {
        this(resolvePluginsPath(properties));
    }

    public FileSkillRegistry(Path pluginsPath) {
        this.pluginsPath = pluginsPath;
    }

    private static Path resolvePluginsPath(CrewdeskProperties properties) {
        String configured = properties.getSkills().getPluginsPath();
        return configured == null || configured.isBlank()
                ? properties.homePath().resolve("plugins")
                : Path.of(configured);
    }

    @PostConstruct
    @Override
    public void scan() {
        Map<String, Map<String, SkillEntry>> newIndex = new LinkedHashMap<>();
        if (!Files.isDirectory(pluginsPath)) {
            log.warn("Cannot read plugins directory: {}", pluginsPath);
            index = newIndex;
            scanned = true;
            return;
        }
        try (Stream<Path> dirs = Files.list(pluginsPath)) {
            for (Path pluginDir : dirs.filter(Files::isDirectory).sorted().toList()) {
                try {
                    indexPlugin(pluginDir).ifPresent(p -> newIndex.put(p.name, p.skills));
                } catch (IOException | RuntimeException e) {
                    log.warn("Skipping plugin \"{}\": {}", pluginDir.getFileName(), e.getMessage());
                }
            }
        } catch (IOException e) {
            log.warn("Cannot list plugins directory {}: {}", pluginsPath, e.getMessage());
        }
        index = newIndex;
        scanned = true;
        log.info("Indexed {} skill(s) across {} plugin(s) from {}",
                newIndex.values().stream().mapToInt(Map::size).sum(), newIndex.size(), pluginsPath);
    }

    @Override
    public boolean isScanned() {
        return scanned;
    }

    @Override
    public List<SkillEntry> getAllSkills() {
        List<SkillEntry> all = new ArrayList<>();
        index.values().forEach(skills -> all.addAll(skills.values()));
        return all;
    }

    @Override
    public Optional<SkillEntry> getSkill(String pluginName, String skillName) {
        Map<String, SkillEntry> skills = index.get(pluginName);
        return skills == null ? Optional.empty() : Optional.ofNullable(skills.get(skillName));
    }

    @Override
    public List<SkillEntry> getSkillsByDomain(String domain) {
        Map<String, SkillEntry> skills = index.get(domain);
        return skills == null ? List.of() : List.copyOf(skills.values());
    }

    @Override
    public Optional<String> getSkillSummary(String pluginName, String skillName) {
        return getSkill(pluginName, skillName).map(skill -> {
            String desc = skill.description().length() > SUMMARY_DESCRIPTION_CHARS
                    ? skill.description().substring(0, SUMMARY_DESCRIPTION_CHARS) + "..."
                    : skill.description();
            String mcp = skill.mcpIntegrations().isEmpty()
                    ? ""
                    : "\nIntegrations: " + String.join(", ", skill.mcpIntegrations());
            return skill.label() + "\n" + desc + mcp;
        });
    }

    @Override
    public String instructionSummary(String pluginName, String skillName, int maxTokens) {
        Optional<SkillEntry> skill = getSkill(pluginName, skillName);
        if (skill.isEmpty() || skill.get().skillPath() == null) {
            return "";
        }
        String content;
        try {
            content = Files.readString(skill.get().skillPath().resolve("SKILL.md"), StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "";
        }
        return summarize(content, maxTokens);
    }

    /**
     * Header of name and description, then the body truncated to the remaining
     * character budget at {@value #CHARS_PER_TOKEN} chars per token.
     */
    static String summarize(String content, int maxTokens) {
        Optional<Map<String, String>> frontmatter = SkillLabels.parseFrontmatter(content);
        if (frontmatter.isEmpty()) return "";

        String body = SkillLabels.stripFrontmatter(content);
        String header = "# " + frontmatter.get().get("name") + "\n" + frontmatter.get().get("description") + "\n\n";
        int charBudget = maxTokens * CHARS_PER_TOKEN - header.length();
        if (charBudget <= 0) {
            return header.trim();
        }
        String truncated = body.length() > charBudget ? body.substring(0, charBudget) + "\n..." : body;
        return header + truncated;
    }

    private record IndexedPlugin(String name, Map<String, SkillEntry> skills) {}

    private Optional<IndexedPlugin> indexPlugin(Path pluginDir) throws IOException {
        Path manifestPath = pluginDir.resolve(".claude-plugin").resolve("plugin.json");
        JsonNode manifest;
        try {
            manifest = mapper.readTree(manifestPath.toFile());
        } catch (IOException e) {
            log.warn("No valid plugin.json for \"{}\", skipping", pluginDir.getFileName());
            return Optional.empty();
        }
        if (manifest == null || !manifest.hasNonNull("name")) {
            log.warn("plugin.json for \"{}\" has no name, skipping", pluginDir.getFileName());
            return Optional.empty();
        }
        String pluginName = manifest.get("name").asText();
        Set<String> mcp = readMcpServers(pluginDir);

        Map<String, SkillEntry> skills = new LinkedHashMap<>();
        Path skillsDir = pluginDir.resolve("skills");
        if (Files.isDirectory(skillsDir)) {
            try (Stream<Path> dirs = Files.list(skillsDir)) {
                for (Path skillDir : dirs.filter(Files::isDirectory).sorted().toList()) {
                    indexSkill(skillDir, pluginName, mcp).ifPresent(s -> skills.put(s.skillName(), s));
                }
            }
        }
        return Optional.of(new IndexedPlugin(pluginName, Collections.unmodifiableMap(skills)));
    }

    private Optional<SkillEntry> indexSkill(Path skillDir, String pluginName, Set<String> mcp) {
        String content;
        try {
            content = Files.readString(skillDir.resolve("SKILL.md"), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("No SKILL.md in \"{}/skills/{}\", skipping", pluginName, skillDir.getFileName());
            return Optional.empty();
        }
        Optional<Map<String, String>> frontmatter = SkillLabels.parseFrontmatter(content);
        if (frontmatter.isEmpty()) {
            log.warn("Invalid frontmatter in \"{}/skills/{}/SKILL.md\", skipping", pluginName, skillDir.getFileName());
            return Optional.empty();
        }
        String name = frontmatter.get().get("name");
        return Optional.of(new SkillEntry(pluginName, name, SkillLabels.toLabel(pluginName, name),
                frontmatter.get().get("description"), skillDir, frontmatter.get(), mcp));
    }

    private Set<String> readMcpServers(Path pluginDir) {
        Path mcpFile = pluginDir.resolve(".mcp.json");
        if (!Files.isRegularFile(mcpFile)) return Set.of();
        try {
            JsonNode servers = mapper.readTree(mcpFile.toFile()).get("mcpServers");
            Set<String> names = new LinkedHashSet<>();
            if (servers != null) servers.fieldNames().forEachRemaining(names::add);
            return names;
        } catch (IOException e) {
            log.debug("Ignoring unreadable .mcp.json in {}", pluginDir.getFileName());
            return Set.of();
        }
    }
}
