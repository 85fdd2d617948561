package com.crewdesk.core.team;

import com.crewdesk.core.config.CrewdeskProperties;
import com.crewdesk.core.model.Complexity;
import com.crewdesk.core.model.CostEstimate;
import org.springframework.stereotype.Component;

/**
 * Conservative token and cost estimate for a team, computed before dispatch.
 * <p>
 * Default pricing blends Sonnet-class rates ($3 / 1M input, $15 / 1M output)
 * at a 3:1 input/output ratio.
 */
@Component
public class CostEstimator {

    static final double INPUT_PRICE = 3.0 / 1_000_000;
    static final double OUTPUT_PRICE = 15.0 / 1_000_000;
    public static final double DEFAULT_BLENDED_PRICE = INPUT_PRICE * 0.75 + OUTPUT_PRICE * 0.25;

    static final long ANALYSIS_TOKENS = 2_000;
    static final long SYNTHESIS_TOKENS = 4_000;

    private final double pricePerToken;

    public CostEstimator(CrewdeskProperties properties) {
        Double override = properties.getBudget().getPricePerToken();
        this.pricePerToken = override != null && override > 0 ? override : DEFAULT_BLENDED_PRICE;
    }

    /**
     * @param teamSize lead plus specialists
     */
    public CostEstimate estimate(int teamSize, Complexity complexity) {
        return estimate(teamSize, complexity, pricePerToken);
    }

    public static CostEstimate estimate(int teamSize, Complexity complexity, double pricePerToken) {
        long agentTokens = perAgentTokens(complexity) * teamSize;
        long total = ANALYSIS_TOKENS + agentTokens + SYNTHESIS_TOKENS;
        return new CostEstimate(
                total,
                roundUsd(total * pricePerToken),
                new CostEstimate.Breakdown(ANALYSIS_TOKENS, agentTokens, SYNTHESIS_TOKENS));
    }

    static long perAgentTokens(Complexity complexity) {
        return switch (complexity) {
            case LOW -> 50_000;
            case MEDIUM -> 100_000;
            case HIGH -> 200_000;
        };
    }

    private static double roundUsd(double value) {
        return Math.round(value * 10_000) / 10_000.0;
    }
}
