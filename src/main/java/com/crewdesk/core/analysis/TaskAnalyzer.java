package com.crewdesk.core.analysis;

import com.crewdesk.backend.BackendException;
import com.crewdesk.backend.BackendRequest;
import com.crewdesk.backend.BackendResult;
import com.crewdesk.backend.CliEnvelope;
import com.crewdesk.backend.ExecutionBackend;
import com.crewdesk.core.config.CrewdeskProperties;
import com.crewdesk.core.metrics.CrewdeskMetrics;
import com.crewdesk.core.model.Complexity;
import com.crewdesk.core.model.Subtask;
import com.crewdesk.core.model.TaskDecomposition;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decomposes a free-text request into sub-tasks with one backend call.
 * <p>
 * The call is never retried. Output that cannot be parsed degrades to a single
 * "productivity" sub-task; a failed call raises {@link AnalysisException}.
 */
@Service
public class TaskAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(TaskAnalyzer.class);

    static final String FALLBACK_DOMAIN = "productivity";

    static final String SYSTEM_PROMPT = """
            You are a task decomposition assistant for a business AI platform.
            Given a user request, break it down into concrete subtasks that can each be handled by a specialist.

            Each subtask must have:
            - description: what the specialist should do (clear, actionable)
            - domain: the business domain this falls under (one of: sales, customer-support, product-management, marketing, finance, legal, data, enterprise-search, productivity)

            Also determine:
            - domains: the unique set of domains involved
            - estimatedComplexity: "low" (1-2 subtasks, straightforward), "medium" (3-4 subtasks, some coordination), "high" (5+ subtasks or complex dependencies)

            Respond with ONLY valid JSON matching this schema:
            {
              "subtasks": [{"description": "...", "domain": "..."}],
              "domains": ["..."],
              "estimatedComplexity": "low" | "medium" | "high"
            }""";

    private static final Pattern LEADING_FENCE = Pattern.compile("^```(?:json)?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_FENCE = Pattern.compile("\\s*```\\s*$");

    private final ExecutionBackend backend;
    private final CrewdeskProperties properties;
    private final CrewdeskMetrics metrics;
    private final ObjectMapper mapper = new ObjectMapper();

    public TaskAnalyzer(ExecutionBackend backend, CrewdeskProperties properties, CrewdeskMetrics metrics) {
        this.backend = backend;
        this.properties = properties;
        this.metrics = metrics;
    }

    public TaskDecomposition analyze(String text) {
        var request = new BackendRequest(
                text,
                SYSTEM_PROMPT,
                properties.getBackend().getAnalyzerModel(),
                Duration.ofSeconds(properties.getBackend().getAnalyzerTimeoutSeconds()),
                null,
                Map.of());

        log.info("Analyzing task ({} chars) with {}", text.length(), backend.name());
        BackendResult result;
        try {
            result = backend.execute(request);
        } catch (BackendException e) {
            throw new AnalysisException("Task analysis failed: " + e.getMessage(), e);
        }
        metrics.recordAnalysisDuration(result.elapsedMs());

        if (result.timedOut()) {
            throw new AnalysisException("Task analysis timed out after "
                    + properties.getBackend().getAnalyzerTimeoutSeconds() + "s");
        }
        if (result.exitCode() != 0) {
            String detail = result.stderr() != null && !result.stderr().isBlank() ? result.stderr() : result.stdout();
            throw new AnalysisException("Task analysis failed (exit " + result.exitCode() + "): " + detail);
        }

        TaskDecomposition decomposition = parseDecomposition(CliEnvelope.extractText(result.stdout()), text);
        log.info("Analysis produced {} subtask(s), complexity {}",
                decomposition.subtasks().size(), decomposition.estimatedComplexity().wireName());
        return decomposition;
    }

    /**
     * Lenient parse of the model's answer.
     *
     * @param output   model output, envelope already removed
     * @param taskText the original request, used by the single-sub-task fallback
     */
    TaskDecomposition parseDecomposition(String output, String taskText) {
        JsonNode root = readObject(stripFences(output));
        if (root == null) {
            log.warn("Analysis output was not JSON; falling back to a single subtask");
            return fallback(taskText, Complexity.LOW);
        }

        List<Subtask> subtasks = new ArrayList<>();
        JsonNode subtasksNode = root.get("subtasks");
        if (subtasksNode != null && subtasksNode.isArray()) {
            for (JsonNode s : subtasksNode) {
                String description = s.hasNonNull("description") ? s.get("description").asText() : "";
                String domain = s.hasNonNull("domain") ? s.get("domain").asText() : FALLBACK_DOMAIN;
                subtasks.add(new Subtask(description, domain));
            }
        }
        if (subtasks.isEmpty()) {
            subtasks.add(new Subtask(taskText, FALLBACK_DOMAIN));
        }

        List<String> domains = new ArrayList<>();
        JsonNode domainsNode = root.get("domains");
        if (domainsNode != null && domainsNode.isArray()) {
            domainsNode.forEach(d -> domains.add(d.asText()));
        } else {
            Set<String> derived = new LinkedHashSet<>();
            subtasks.forEach(s -> derived.add(s.domain()));
            domains.addAll(derived);
        }

        Complexity complexity = root.hasNonNull("estimatedComplexity")
                ? Complexity.fromWire(root.get("estimatedComplexity").asText())
                : null;
        return new TaskDecomposition(subtasks, domains, complexity == null ? Complexity.MEDIUM : complexity);
    }

    static String stripFences(String text) {
        String cleaned = LEADING_FENCE.matcher(text.trim()).replaceFirst("");
        return TRAILING_FENCE.matcher(cleaned).replaceFirst("").trim();
    }

    private JsonNode readObject(String text) {
        JsonNode node = tryRead(text);
        if (node == null) {
            int start = text.indexOf('{');
            int end = text.lastIndexOf('}');
            if (start >= 0 && end > start) {
                node = tryRead(text.substring(start, end + 1));
            }
        }
        return node != null && node.isObject() ? node : null;
    }

    private JsonNode tryRead(String text) {
        try {
            return mapper.readTree(text);
        } catch (Exception e) {
            return null;
        }
    }

    private static TaskDecomposition fallback(String text, Complexity complexity) {
        return new TaskDecomposition(
                List.of(new Subtask(text, FALLBACK_DOMAIN)),
                List.of(FALLBACK_DOMAIN),
                complexity);
    }
}
