package com.autosem.digital.process.optimizer.application.service.rule;

import com.autosem.digital.process.optimizer.domain.DTO.OptimizationSettings;
import com.autosem.digital.process.optimizer.domain.DTO.PerformanceSnapshot;
import com.autosem.digital.process.optimizer.domain.DTO.RuleDecision;
import com.autosem.digital.process.optimizer.domain.model.Campaign;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Estado de la evaluación de una campaña. El presupuesto de trabajo refleja los
 * cambios de las reglas anteriores; la campaña en sí no se modifica aquí.
 */
@Getter
public class RuleContext {

    private final Campaign campaign;
    private final PerformanceSnapshot performance;
    private final OptimizationSettings settings;
    private BigDecimal budget;
    private final List<RuleDecision> decisions = new ArrayList<>();

    public RuleContext(Campaign campaign, OptimizationSettings settings) {
        this.campaign = campaign;
        this.performance = PerformanceSnapshot.of(campaign);
        this.settings = settings;
        this.budget = BudgetPolicy.orDefault(campaign.getDailyBudget());
    }

    public void changeBudget(String action, String reason, BigDecimal newBudget) {
        decisions.add(RuleDecision.budget(action, reason, budget, newBudget));
        budget = newBudget;
    }

    public void pause(String action, String reason) {
        decisions.add(RuleDecision.pause(action, reason));
    }

    public void flag(String action, String reason) {
        decisions.add(RuleDecision.flag(action, reason));
    }

    public List<RuleDecision> getDecisions() {
        return Collections.unmodifiableList(decisions);
    }

    static String money(double amount) {
        return String.format(Locale.ROOT, "$%.2f", amount);
    }

    static String money(BigDecimal amount) {
        return "$" + BudgetPolicy.round(amount).toPlainString();
    }

    static String roas(double roas) {
        return String.format(Locale.ROOT, "%.2fx", roas);
    }

    static String percent(double rate, int decimals) {
        return String.format(Locale.ROOT, "%." + decimals + "f%%", rate * 100);
    }
}
