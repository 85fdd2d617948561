package com.crewdesk.core.team;

import com.crewdesk.core.config.CrewdeskProperties;
import com.crewdesk.core.model.CostEstimate;
import com.crewdesk.core.persistence.SpendLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Rejects a team whose estimate breaks the per-task ceiling or would push
 * month-to-date spend over the monthly ceiling. Hitting a ceiling exactly is
 * allowed; a ceiling of zero or less is disabled.
 */
@Component
public class BudgetGuard {

    private static final Logger log = LoggerFactory.getLogger(BudgetGuard.class);

    private final CrewdeskProperties properties;
    private final SpendLedger ledger;

    public BudgetGuard(CrewdeskProperties properties, SpendLedger ledger) {
        this.properties = properties;
        this.ledger = ledger;
    }

    public BudgetDecision check(CostEstimate estimate) {
        double cost = estimate.estimatedCostUsd();
        double perTask = properties.getBudget().getPerTaskMaxUsd();
        double monthly = properties.getBudget().getMonthlyMaxUsd();

        if (perTask > 0 && cost > perTask) {
            String reason = String.format(Locale.US, "Budget exceeded: estimated $%.4f exceeds per-task limit $%.2f", cost, perTask);
            log.warn(reason);
            return BudgetDecision.reject("per_task", reason);
        }
        if (monthly > 0) {
            double spent = ledger.monthToDate();
            if (spent + cost > monthly) {
                String reason = String.format(Locale.US,
                        "Budget exceeded: month-to-date $%.4f plus estimated $%.4f exceeds monthly limit $%.2f",
                        spent, cost, monthly);
                log.warn(reason);
                return BudgetDecision.reject("monthly", reason);
            }
        }
        return BudgetDecision.allow();
    }
}
