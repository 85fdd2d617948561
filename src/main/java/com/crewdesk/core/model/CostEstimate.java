package com.crewdesk.core.model;

import java.io.Serializable;

/**
 * Pre-dispatch token and cost estimate.
 */
public record CostEstimate(
    long estimatedTokens,
    double estimatedCostUsd,
    Breakdown breakdown
) implements Serializable {

    public record Breakdown(long analysis, long perAgent, long synthesis) implements Serializable {}
}
