package com.crewdesk.core.team;

import com.crewdesk.context.BusinessContext;
import com.crewdesk.core.config.CrewdeskProperties;
import com.crewdesk.core.model.Complexity;
import com.crewdesk.core.model.CostEstimate;
import com.crewdesk.core.model.SkillMatch;
import com.crewdesk.core.model.SpecialistSpec;
import com.crewdesk.core.model.TeamSpec;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Turns skill matches into a team: one lead plus up to four specialists,
 * one per distinct (plugin, skill). Sub-tasks without a matching skill share a
 * single generalist, so a team is never empty.
 */
@Component
public class TeamAssembler {

    public static final int MAX_SPECIALISTS = 4;
    public static final String GENERALIST_ROLE = "Generalist";

    private final CostEstimator costEstimator;
    private final int maxSpecialists;
    private final String tasksRoot;

    public TeamAssembler(CostEstimator costEstimator, CrewdeskProperties properties) {
        this.costEstimator = costEstimator;
        this.maxSpecialists = Math.max(1, Math.min(properties.getMaxSpecialists(), MAX_SPECIALISTS));
        this.tasksRoot = properties.homePath().resolve("tasks").toString();
    }

    public TeamSpec assemble(List<SkillMatch> matches, BusinessContext context, Complexity complexity) {
        List<String> contextKeys = resolveContextKeys(context);
        Set<String> seen = new HashSet<>();
        List<SpecialistSpec> specialists = new ArrayList<>();
        boolean generalistAdded = false;

        for (SkillMatch match : matches) {
            if (specialists.size() >= maxSpecialists) break;
            if (!match.isMatched()) {
                if (!generalistAdded) {
                    specialists.add(new SpecialistSpec(GENERALIST_ROLE, "", "", contextKeys));
                    generalistAdded = true;
                }
                continue;
            }
            if (seen.add(match.plugin() + "/" + match.skill())) {
                specialists.add(new SpecialistSpec(match.userLabel(), match.plugin(), match.skill(), contextKeys));
            }
        }
        if (specialists.isEmpty()) {
            specialists.add(new SpecialistSpec(GENERALIST_ROLE, "", "", contextKeys));
        }

        CostEstimate cost = costEstimator.estimate(1 + specialists.size(),
                complexity == null ? Complexity.MEDIUM : complexity);
        return new TeamSpec(buildLeadPrompt(specialists, context, cost), specialists, cost);
    }

    static List<String> resolveContextKeys(BusinessContext context) {
        List<String> keys = new ArrayList<>();
        if (context.hasBusinessName()) keys.add("businessName");
        if (context.hasIndustry()) keys.add("industry");
        if (!context.documentAccess().isEmpty()) keys.add("documentAccess");
        return keys;
    }

    String buildLeadPrompt(List<SpecialistSpec> specialists, BusinessContext context, CostEstimate cost) {
        String businessIntro = context.hasBusinessName()
                ? "Business: " + context.profile().businessName()
                    + (context.hasIndustry() ? " (" + context.profile().industry() + ")" : "")
                : "Business context not yet configured.";

        String specialistLines = String.join("\n", IntStream.range(0, specialists.size())
                .mapToObj(i -> {
                    SpecialistSpec s = specialists.get(i);
                    return s.skillPlugin().isEmpty()
                            ? "  %d. %s (no matching skill)".formatted(i + 1, s.role())
                            : "  %d. %s, plugin: %s, skill: %s".formatted(i + 1, s.role(), s.skillPlugin(), s.skillName());
                })
                .toList());

        int n = specialists.size();
        return """
                You are the team lead coordinating a task for a business AI assistant.

                %s

                Team composition (%d specialist%s):
                %s

                Budget: ~%s tokens (~$%s)

                Coordination instructions:
                1. Break the task into clear subtasks and assign each to the appropriate specialist.
                2. WAIT for ALL teammates to complete their subtasks before synthesizing results.
                3. Each specialist should write intermediate results to the shared task directory.
                4. After all specialists finish, synthesize a final unified result.
                5. If a specialist reports an error, note it in the final result rather than retrying.

                Checkpoint instructions:
                - Each teammate must write results to %s/{taskId}/ as they complete work.
                - Write intermediate results even if the work is partial. Partial results are better than no results.
                - The final synthesized result goes in final.json.

                Do NOT start implementing tasks yourself. Delegate all work to your specialist teammates.""".formatted(
                businessIntro,
                n, n == 1 ? "" : "s",
                specialistLines,
                String.format(Locale.US, "%,d", cost.estimatedTokens()),
                String.format(Locale.US, "%.2f", cost.estimatedCostUsd()),
                tasksRoot);
    }
}
