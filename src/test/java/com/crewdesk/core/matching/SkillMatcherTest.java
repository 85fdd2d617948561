package com.crewdesk.core.matching;

import com.crewdesk.core.model.SkillMatch;
import com.crewdesk.core.model.Subtask;
import com.crewdesk.skills.SkillEntry;
import com.crewdesk.skills.SkillRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SkillMatcherTest {

    private final SkillMatcher matcher = new SkillMatcher();

    private static SkillRegistry registryOf(SkillEntry... skills) {
        SkillRegistry registry = mock(SkillRegistry.class);
        when(registry.getAllSkills()).thenReturn(List.of(skills));
        return registry;
    }

    @Test
    @DisplayName("domain match plus keyword overlap gives a confident match")
    void confidentMatch() {
        var registry = registryOf(
                SkillEntry.of("customer-support", "ticket-triage", "Triage and route support tickets"),
                SkillEntry.of("finance", "invoice-review", "Review vendor invoices"));

        List<SkillMatch> matches = matcher.match(
                List.of(new Subtask("Triage incoming support tickets", "customer-support")), registry);

        SkillMatch m = matches.get(0);
        assertEquals("customer-support", m.plugin());
        assertEquals("ticket-triage", m.skill());
        assertEquals("Customer Support: Ticket Triage", m.userLabel());
        assertEquals(0.875, m.confidence(), 1e-9);
        assertFalse(m.needsConfirmation());
    }

    @Test
    @DisplayName("an empty registry yields unmatched entries labelled by domain")
    void emptyRegistry() {
        List<SkillMatch> matches = matcher.match(
                List.of(new Subtask("Write copy", "marketing"), new Subtask("Check totals", "finance")),
                registryOf());

        assertEquals(2, matches.size());
        SkillMatch first = matches.get(0);
        assertFalse(first.isMatched());
        assertEquals("", first.plugin());
        assertEquals("marketing", first.userLabel());
        assertEquals(0.0, first.confidence());
        assertTrue(first.needsConfirmation());
    }

    @Test
    @DisplayName("ties go to the first skill in registry order")
    void tieBreak() {
        var registry = registryOf(
                SkillEntry.of("sales", "first", "unrelated"),
                SkillEntry.of("sales", "second", "unrelated"));

        SkillMatch m = matcher.match(List.of(new Subtask("Qualify leads", "sales")), registry).get(0);

        assertEquals("first", m.skill());
        assertEquals(0.5, m.confidence(), 1e-9);
        assertTrue(m.needsConfirmation());
    }

    @Test
    @DisplayName("the same inputs always give the same matches in input order")
    void deterministic() {
        var registry = registryOf(
                SkillEntry.of("sales", "pipeline-review", "Review the sales pipeline"),
                SkillEntry.of("marketing", "campaign-brief", "Write a campaign brief"));
        var subtasks = List.of(
                new Subtask("Write a campaign brief for spring", "marketing"),
                new Subtask("Review pipeline health", "sales"));

        List<SkillMatch> first = matcher.match(subtasks, registry);
        List<SkillMatch> second = matcher.match(subtasks, registry);

        assertEquals(first, second);
        assertEquals("marketing", first.get(0).plugin());
        assertEquals("sales", first.get(1).plugin());
    }

    @Test
    @DisplayName("two sub-tasks may pick the same skill")
    void duplicatesAllowed() {
        var registry = registryOf(SkillEntry.of("legal", "contract-review", "Review contracts"));
        List<SkillMatch> matches = matcher.match(List.of(
                new Subtask("Review supplier contract", "legal"),
                new Subtask("Review customer contract", "legal")), registry);

        assertEquals(matches.get(0).skill(), matches.get(1).skill());
    }

    @Test
    @DisplayName("confirmation is needed strictly below 0.7")
    void confirmationBoundary() {
        assertFalse(SkillMatch.of("p", "s", "P: S", 0.7).needsConfirmation());
        assertTrue(SkillMatch.of("p", "s", "P: S", 0.6999).needsConfirmation());
    }

    @Test
    @DisplayName("term extraction drops short words and punctuation")
    void terms() {
        assertEquals(List.of("draft", "reply", "customers"),
                List.copyOf(SkillMatcher.extractTerms("Draft a reply to customers!")));
        assertEquals("customersupport", SkillMatcher.normalizeName("Customer-Support"));
    }
}
