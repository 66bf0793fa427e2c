package com.autosem.digital.process.optimizer.application.service.rule;

import com.autosem.digital.process.optimizer.domain.DTO.PerformanceSnapshot;

import java.math.BigDecimal;

/**
 * Sube un 20% el presupuesto de campañas con CTR alto y clics baratos, hasta $25 diarios.
 */
public class ScaleWinnerRule implements OptimizationRule {

    static final double MAX_CPC = 0.20;

    @Override
    public String name() {
        return "scale_winner";
    }

    @Override
    public RuleOutcome apply(RuleContext context) {
        PerformanceSnapshot perf = context.getPerformance();
        if (perf.getCtr() > BudgetPolicy.HIGH_CTR_THRESHOLD
                && perf.getCpc() < MAX_CPC
                && perf.getClicks() >= BudgetPolicy.MIN_CLICKS_FOR_DECISION) {
            BigDecimal current = context.getBudget();
            BigDecimal scaled = BudgetPolicy.increase(current, BudgetPolicy.SCALE_WINNER_FACTOR,
                    BudgetPolicy.SCALE_WINNER_CAP);
            if (scaled.compareTo(current) > 0) {
                context.changeBudget(name(), "CTR " + RuleContext.percent(perf.getCtr(), 2)
                        + " at CPC " + RuleContext.money(perf.getCpc()) + ", budget "
                        + RuleContext.money(current) + " -> " + RuleContext.money(scaled), scaled);
            }
        }
        return RuleOutcome.CONTINUE;
    }
}
