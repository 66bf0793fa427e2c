package com.autosem.digital.process.optimizer.application.service.rule;

import com.autosem.digital.process.optimizer.domain.DTO.PerformanceSnapshot;

import java.math.BigDecimal;

/**
 * Banderas que no modifican la campaña: CTR bajo (refrescar creativos) y CPC mayor
 * a la mitad del presupuesto diario (revisar pujas).
 */
public class InformationalFlagsRule implements OptimizationRule {

    private static final BigDecimal HALF = new BigDecimal("0.5");

    @Override
    public String name() {
        return "informational_flags";
    }

    @Override
    public RuleOutcome apply(RuleContext context) {
        PerformanceSnapshot perf = context.getPerformance();
        if (perf.getClicks() >= BudgetPolicy.MIN_CLICKS_FOR_DECISION
                && perf.getCtr() < BudgetPolicy.LOW_CTR_THRESHOLD) {
            context.flag("flag_low_ctr", "CTR " + RuleContext.percent(perf.getCtr(), 3)
                    + " below threshold, consider refreshing creatives");
        }

        BigDecimal halfBudget = context.getBudget().multiply(HALF);
        if (perf.getClicks() > 0 && BigDecimal.valueOf(perf.getCpc()).compareTo(halfBudget) > 0) {
            context.flag("flag_high_cpc", "CPC " + RuleContext.money(perf.getCpc())
                    + " exceeds 50% of daily budget " + RuleContext.money(context.getBudget())
                    + ", review bids");
        }
        return RuleOutcome.CONTINUE;
    }
}
