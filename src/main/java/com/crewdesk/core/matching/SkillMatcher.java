package com.crewdesk.core.matching;

import com.crewdesk.core.model.SkillMatch;
import com.crewdesk.core.model.Subtask;
import com.crewdesk.skills.SkillEntry;
import com.crewdesk.skills.SkillRegistry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Maps each sub-task to its best-scoring skill by domain and keyword overlap.
 * <p>
 * Matching is greedy per sub-task: two sub-tasks may pick the same skill, and
 * duplicates collapse later in team assembly. Output order follows input order
 * and the result depends only on the inputs.
 */
@Component
public class SkillMatcher {

    private static final Pattern TERM_SEPARATORS = Pattern.compile("[\\s\\-_:,./]+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]");
    private static final Pattern NAME_SEPARATORS = Pattern.compile("[\\s\\-_]");
    private static final int MIN_TERM_LENGTH = 3;

    public List<SkillMatch> match(List<Subtask> subtasks, SkillRegistry registry) {
        List<SkillEntry> skills = registry.getAllSkills();
        List<SkillMatch> matches = new ArrayList<>(subtasks.size());

        for (Subtask subtask : subtasks) {
            SkillEntry best = null;
            double bestScore = -1;
            for (SkillEntry skill : skills) {
                double score = score(subtask, skill);
                if (score > bestScore) {
                    bestScore = score;
                    best = skill;
                }
            }
            if (best == null) {
                matches.add(SkillMatch.unmatched(subtask.domain()));
            } else {
                double confidence = Math.min(Math.max(bestScore, 0), 1);
                matches.add(SkillMatch.of(best.pluginName(), best.skillName(), best.label(), confidence));
            }
        }
        return matches;
    }

    /**
     * 0.5 for a domain/plugin-name match plus 0.5 scaled by the fraction of the
     * sub-task's terms found on the skill side.
     */
    static double score(Subtask subtask, SkillEntry skill) {
        double score = 0;
        if (normalizeName(skill.pluginName()).equals(normalizeName(subtask.domain()))) {
            score += 0.5;
        }
        Set<String> subtaskTerms = extractTerms(subtask.description());
        Set<String> skillTerms = extractTerms(
                skill.label() + " " + skill.description() + " " + skill.pluginName() + " " + skill.skillName());
        long overlap = subtaskTerms.stream().filter(skillTerms::contains).count();
        int maxTerms = Math.max(subtaskTerms.size(), 1);
        score += 0.5 * Math.min((double) overlap / maxTerms, 1);
        return score;
    }

    static Set<String> extractTerms(String text) {
        Set<String> terms = new LinkedHashSet<>();
        if (text == null) return terms;
        for (String word : TERM_SEPARATORS.split(text.toLowerCase(Locale.ROOT))) {
            String cleaned = NON_ALNUM.matcher(word).replaceAll("");
            if (cleaned.length() >= MIN_TERM_LENGTH) {
                terms.add(cleaned);
            }
        }
        return terms;
    }

    static String normalizeName(String s) {
        return s == null ? "" : NAME_SEPARATORS.matcher(s.toLowerCase(Locale.ROOT)).replaceAll("");
    }
}
