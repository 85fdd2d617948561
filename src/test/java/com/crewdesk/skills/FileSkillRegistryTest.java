package com.crewdesk.skills;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FileSkillRegistryTest {

    @TempDir
    Path plugins;

    private void plugin(String dir, String manifestName) throws IOException {
        Path manifest = plugins.resolve(dir).resolve(".claude-plugin");
        Files.createDirectories(manifest);
        Files.writeString(manifest.resolve("plugin.json"), "{\"name\":\"" + manifestName + "\"}");
    }

    private void skill(String plugin, String dir, String skillMd) throws IOException {
        Path skillDir = plugins.resolve(plugin).resolve("skills").resolve(dir);
        Files.createDirectories(skillDir);
        Files.writeString(skillDir.resolve("SKILL.md"), skillMd);
    }

    private static String skillMd(String name, String description, String body) {
        return "---\nname: " + name + "\ndescription: " + description + "\n---\n" + body;
    }

    @Nested
    @DisplayName("scan")
    class Scan {

        @BeforeEach
        void layout() throws IOException {
            plugin("customer-support", "customer-support");
            skill("customer-support", "ticket-triage",
                    skillMd("ticket-triage", "Triage and route support tickets", "Read the ticket.\nAssign it."));
            skill("customer-support", "broken", "no frontmatter here");
            Files.writeString(plugins.resolve("customer-support/.mcp.json"),
                    "{\"mcpServers\":{\"zendesk\":{},\"intercom\":{}}}");

            plugin("sales", "sales");
            skill("sales", "outreach", skillMd("outreach", "Draft outreach emails", "Be brief."));

            Files.createDirectories(plugins.resolve("no-manifest/skills/x"));
        }

        @Test
        @DisplayName("indexes valid skills and skips invalid plugins and skills")
        void indexes() {
            var registry = new FileSkillRegistry(plugins);
            assertFalse(registry.isScanned());
            registry.scan();

            assertTrue(registry.isScanned());
            List<SkillEntry> all = registry.getAllSkills();
            assertEquals(2, all.size());
            assertEquals("customer-support", all.get(0).pluginName());
            assertEquals("sales", all.get(1).pluginName());
        }

        @Test
        @DisplayName("entries carry label, frontmatter and MCP integrations")
        void entryDetails() {
            var registry = new FileSkillRegistry(plugins);
            registry.scan();

            SkillEntry triage = registry.getSkill("customer-support", "ticket-triage").orElseThrow();
            assertEquals("Customer Support: Ticket Triage", triage.label());
            assertEquals("Triage and route support tickets", triage.description());
            assertEquals(Set.of("zendesk", "intercom"), triage.mcpIntegrations());
            assertTrue(registry.getSkill("customer-support", "broken").isEmpty());
        }

        @Test
        @DisplayName("lookup by domain uses the plugin name")
        void byDomain() {
            var registry = new FileSkillRegistry(plugins);
            registry.scan();

            assertEquals(1, registry.getSkillsByDomain("sales").size());
            assertTrue(registry.getSkillsByDomain("legal").isEmpty());
        }

        @Test
        @DisplayName("summary lists label, description and integrations")
        void summary() {
            var registry = new FileSkillRegistry(plugins);
            registry.scan();

            String summary = registry.getSkillSummary("customer-support", "ticket-triage").orElseThrow();
            assertTrue(summary.startsWith("Customer Support: Ticket Triage\nTriage and route support tickets"));
            assertTrue(summary.contains("Integrations: zendesk, intercom"));
            assertTrue(registry.getSkillSummary("sales", "missing").isEmpty());
        }

        @Test
        @DisplayName("instruction summary strips frontmatter and keeps the body")
        void instructions() {
            var registry = new FileSkillRegistry(plugins);
            registry.scan();

            String text = registry.instructionSummary("sales", "outreach", 500);
            assertEquals("# outreach\nDraft outreach emails\n\nBe brief.", text);
            assertEquals("", registry.instructionSummary("sales", "missing", 500));
        }

        @Test
        @DisplayName("a rescan picks up newly installed skills")
        void rescan() throws IOException {
            var registry = new FileSkillRegistry(plugins);
            registry.scan();
            skill("sales", "forecast", skillMd("forecast", "Forecast quarterly revenue", ""));
            registry.scan();

            assertTrue(registry.getSkill("sales", "forecast").isPresent());
        }
    }

    @Test
    @DisplayName("a missing plugins directory yields an empty index")
    void missingDirectory() {
        var registry = new FileSkillRegistry(plugins.resolve("absent"));
        registry.scan();

        assertTrue(registry.isScanned());
        assertTrue(registry.getAllSkills().isEmpty());
    }

    @Test
    @DisplayName("long bodies are truncated to the token budget")
    void truncation() {
        String body = "x".repeat(1_000);
        String summary = FileSkillRegistry.summarize(skillMd("big", "Large skill", body), 50);

        assertTrue(summary.startsWith("# big\nLarge skill\n\n"));
        assertTrue(summary.endsWith("\n..."));
        assertTrue(summary.length() < 50 * FileSkillRegistry.CHARS_PER_TOKEN + 5);
    }

    @Test
    @DisplayName("label generation title-cases hyphenated names")
    void labels() {
        assertEquals("Product Management: Roadmap Review", SkillLabels.toLabel("product-management", "roadmap-review"));
        assertTrue(SkillLabels.parseFrontmatter("---\nname: only-name\n---\n").isEmpty());
    }
}
