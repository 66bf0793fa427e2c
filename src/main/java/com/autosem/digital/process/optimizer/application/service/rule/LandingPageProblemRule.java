package com.autosem.digital.process.optimizer.application.service.rule;

import com.autosem.digital.process.optimizer.domain.DTO.PerformanceSnapshot;

import java.math.BigDecimal;

/**
 * Anuncios atractivos que no convierten: CTR alto y tasa de conversión menor al 1%.
 * Con CPC mayor a $1 se pausa; entre $0.50 y $1 se recorta el presupuesto un 25%.
 */
public class LandingPageProblemRule implements OptimizationRule {

    static final double PAUSE_CPC = 1.00;
    static final double CUT_CPC = 0.50;

    @Override
    public String name() {
        return "landing_page_problem";
    }

    @Override
    public RuleOutcome apply(RuleContext context) {
        PerformanceSnapshot perf = context.getPerformance();
        boolean landingProblem = perf.getClicks() >= BudgetPolicy.MIN_CLICKS_FOR_DECISION
                && perf.getCtr() > BudgetPolicy.HIGH_CTR_THRESHOLD
                && perf.getConversionRate() < BudgetPolicy.LOW_CONVERSION_RATE;
        if (!landingProblem) {
            return RuleOutcome.CONTINUE;
        }

        String symptoms = "CTR " + RuleContext.percent(perf.getCtr(), 2)
                + " but conversion rate " + RuleContext.percent(perf.getConversionRate(), 2);
        if (perf.getCpc() > PAUSE_CPC) {
            context.pause("landing_page_pause", symptoms + ", CPC " + RuleContext.money(perf.getCpc()));
            return RuleOutcome.TERMINAL;
        }
        if (perf.getCpc() > CUT_CPC) {
            BigDecimal current = context.getBudget();
            BigDecimal reduced = BudgetPolicy.decrease(current, BudgetPolicy.BUDGET_DECREASE_FACTOR);
            context.changeBudget("landing_page_budget_cut", symptoms + ", budget "
                    + RuleContext.money(current) + " -> " + RuleContext.money(reduced), reduced);
        }
        return RuleOutcome.CONTINUE;
    }
}
