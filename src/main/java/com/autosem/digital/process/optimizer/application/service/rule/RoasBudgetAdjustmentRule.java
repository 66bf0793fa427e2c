package com.autosem.digital.process.optimizer.application.service.rule;

import com.autosem.digital.process.optimizer.domain.DTO.PerformanceSnapshot;

import java.math.BigDecimal;

/**
 * Ajusta el presupuesto según el ROAS una vez gastados más de $20. La pausa por ROAS
 * muy bajo sólo se alcanza cuando no aplicó ninguno de los ajustes anteriores y no
 * detiene las banderas informativas. En modo awareness los ajustes siguen aplicando
 * pero la pausa no.
 */
public class RoasBudgetAdjustmentRule implements OptimizationRule {

    static final double MIN_SPEND = 20.0;
    static final double DECREASE_MIN_SPEND = 50.0;
    static final double PAUSE_MIN_SPEND = 100.0;
    static final double PAUSE_MAX_ROAS = 0.5;
    static final double STRONG_ROAS_MULTIPLIER = 1.5;

    @Override
    public String name() {
        return "roas_budget_adjustment";
    }

    @Override
    public RuleOutcome apply(RuleContext context) {
        PerformanceSnapshot perf = context.getPerformance();
        double minRoas = context.getSettings().getMinRoasThreshold();
        if (perf.getSpend() <= MIN_SPEND) {
            return RuleOutcome.CONTINUE;
        }

        double roas = perf.getRoas();
        BigDecimal current = context.getBudget();
        if (roas >= minRoas * STRONG_ROAS_MULTIPLIER) {
            BigDecimal increased = BudgetPolicy.increase(current, BudgetPolicy.BUDGET_INCREASE_FACTOR,
                    BudgetPolicy.MAX_DAILY_BUDGET);
            if (increased.compareTo(current) > 0) {
                context.changeBudget("budget_increase", "Strong ROAS (" + RuleContext.roas(roas) + "), budget "
                        + RuleContext.money(current) + " -> " + RuleContext.money(increased), increased);
            }
        } else if (roas < minRoas && perf.getSpend() > DECREASE_MIN_SPEND) {
            BigDecimal decreased = BudgetPolicy.decrease(current, BudgetPolicy.BUDGET_DECREASE_FACTOR);
            context.changeBudget("budget_decrease", "Low ROAS (" + RuleContext.roas(roas) + "), budget "
                    + RuleContext.money(current) + " -> " + RuleContext.money(decreased), decreased);
        } else if (roas < PAUSE_MAX_ROAS && perf.getSpend() > PAUSE_MIN_SPEND
                && !context.getSettings().isAwarenessMode()) {
            context.pause("roas_pause", "Very low ROAS (" + RuleContext.roas(roas) + ") after "
                    + RuleContext.money(perf.getSpend()) + " spend");
        }
        return RuleOutcome.CONTINUE;
    }
}
