package com.autosem.digital.process.optimizer.application.service.rule;

/**
 * Regla de optimización por campaña. Las reglas se evalúan en el orden fijo de
 * {@link RuleEvaluator} y acumulan sus decisiones en el {@link RuleContext}.
 */
public interface OptimizationRule {

    String name();

    RuleOutcome apply(RuleContext context);
}
