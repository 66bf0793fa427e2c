package com.autosem.digital.process.optimizer.application.service.rule;

import com.autosem.digital.process.optimizer.domain.DTO.OptimizationSettings;
import com.autosem.digital.process.optimizer.domain.DTO.PerformanceSnapshot;
import com.autosem.digital.process.optimizer.domain.DTO.RuleDecision;
import com.autosem.digital.process.optimizer.domain.model.Campaign;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Evalúa una campaña contra la lista ordenada de reglas. La primera regla que termina
 * detiene la evaluación; las demás acumulan decisiones.
 */
@Component
@Slf4j
public class RuleEvaluator {

    private final List<OptimizationRule> rules;

    public RuleEvaluator() {
        this(List.of(
                new PauseUnderperformerRule(),
                new LandingPageProblemRule(),
                new ScaleWinnerRule(),
                new RoasBudgetAdjustmentRule(),
                new InformationalFlagsRule()));
    }

    RuleEvaluator(List<OptimizationRule> rules) {
        this.rules = rules;
    }

    public List<RuleDecision> evaluate(Campaign campaign, OptimizationSettings settings) {
        PerformanceSnapshot performance = PerformanceSnapshot.of(campaign);
        if (performance.getImpressions() < BudgetPolicy.MIN_IMPRESSIONS_FOR_DECISION) {
            return List.of(RuleDecision.info("waiting",
                    "Insufficient data (" + performance.getImpressions() + " impressions)"));
        }

        RuleContext context = new RuleContext(campaign, settings);
        for (OptimizationRule rule : rules) {
            if (rule.apply(context) == RuleOutcome.TERMINAL) {
                log.debug("Regla terminal {} para campaña {}", rule.name(), campaign.getId());
                break;
            }
        }

        if (context.getDecisions().isEmpty()) {
            return List.of(RuleDecision.info("no_change", "Performance within targets (ROAS: "
                    + RuleContext.roas(performance.getRoas()) + ", CTR: "
                    + RuleContext.percent(performance.getCtr(), 2) + ")"));
        }
        return context.getDecisions();
    }

    public List<String> ruleNames() {
        return rules.stream().map(OptimizationRule::name).collect(Collectors.toList());
    }
}
