package com.crewdesk.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for task dispatch.
 */
@Service
public class CrewdeskMetrics {

    private final MeterRegistry registry;

    public CrewdeskMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAnalysisDuration(long ms) {
        Timer.builder("crewdesk.analysis.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordSpecialistExecution(String skillPlugin, String status, long ms) {
        Timer.builder("crewdesk.specialist.duration")
                .tag("plugin", skillPlugin == null || skillPlugin.isEmpty() ? "generalist" : skillPlugin)
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTaskResult(String status) {
        Counter.builder("crewdesk.tasks.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordStuckTask() {
        Counter.builder("crewdesk.tasks.stuck")
                .description("Tasks force-failed by the inactivity monitor")
                .register(registry)
                .increment();
    }

    /**
     * @param scope "per_task" or "monthly"
     */
    public void recordBudgetRejection(String scope) {
        Counter.builder("crewdesk.budget.rejections")
                .tag("scope", scope)
                .register(registry)
                .increment();
    }

    public void recordEstimatedCost(double usd) {
        DistributionSummary.builder("crewdesk.team.estimated_cost_usd")
                .description("Estimated cost per launched team")
                .register(registry)
                .record(usd);
    }

    public void recordTeamSize(int specialists) {
        DistributionSummary.builder("crewdesk.team.specialists")
                .description("Specialists per launched team")
                .register(registry)
                .record(specialists);
    }
}
