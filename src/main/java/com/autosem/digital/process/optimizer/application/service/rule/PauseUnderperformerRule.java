package com.autosem.digital.process.optimizer.application.service.rule;

import com.autosem.digital.process.optimizer.domain.DTO.PerformanceSnapshot;

/**
 * Pausa la campaña con pérdida decisiva: gasto de al menos $20 con ROAS menor a 0.5.
 */
public class PauseUnderperformerRule implements OptimizationRule {

    static final double MIN_SPEND = 20.0;
    static final double MAX_ROAS = 0.5;

    @Override
    public String name() {
        return "pause_underperformer";
    }

    @Override
    public RuleOutcome apply(RuleContext context) {
        if (context.getSettings().isAwarenessMode()) {
            return RuleOutcome.CONTINUE;
        }
        PerformanceSnapshot perf = context.getPerformance();
        if (perf.getSpend() >= MIN_SPEND && perf.getRoas() < MAX_ROAS) {
            context.pause(name(), "ROAS " + RuleContext.roas(perf.getRoas())
                    + " after " + RuleContext.money(perf.getSpend()) + " spend");
            return RuleOutcome.TERMINAL;
        }
        return RuleOutcome.CONTINUE;
    }
}
