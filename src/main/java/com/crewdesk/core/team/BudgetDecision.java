package com.crewdesk.core.team;

/**
 * Result of a pre-spend budget check.
 *
 * @param allowed true if the team may launch
 * @param scope   "per_task" or "monthly" when rejected, null otherwise
 * @param reason  operator-readable rejection reason, null when allowed
 */
public record BudgetDecision(boolean allowed, String scope, String reason) {

    public static BudgetDecision allow() {
        return new BudgetDecision(true, null, null);
    }

    public static BudgetDecision reject(String scope, String reason) {
        return new BudgetDecision(false, scope, reason);
    }
}
