package com.autosem.digital.process.optimizer.application.service;

import com.autosem.digital.process.optimizer.application.service.rule.BudgetPolicy;
import com.autosem.digital.process.optimizer.domain.DTO.OptimizationSettings;
import com.autosem.digital.process.optimizer.domain.DTO.RuleDecision;
import com.autosem.digital.process.optimizer.domain.entity.AuditSeverity;
import com.autosem.digital.process.optimizer.domain.model.Campaign;
import com.autosem.digital.process.optimizer.domain.model.CampaignStatus;
import com.autosem.digital.process.optimizer.domain.port.service.AdminNotificationService;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Límites de la cuenta, evaluados después de todas las reglas por campaña de la pasada.
 * <ul>
 * <li>Reducción global: si la suma de presupuestos de las campañas que siguen activas
 * supera el límite diario, todas se escalan por límite/suma, sin piso.</li>
 * <li>Pausa de emergencia: si gasto menos ingresos de las campañas cargadas al inicio de la
 * pasada alcanza el umbral, se pausan todas las que sigan activas.</li>
 * </ul>
 * Las campañas se modifican en memoria; el llamador persiste y sincroniza con la plataforma.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SafetyGuard {

    public static final String GLOBAL_BUDGET_SCALE = "global_budget_scale";
    public static final String EMERGENCY_PAUSE_ALL = "emergency_pause_all";

    private final AdminNotificationService adminNotificationService;

    @Getter
    @AllArgsConstructor
    public static class GuardAction {
        private final List<Campaign> targets;
        private final RuleDecision decision;
    }

    public List<GuardAction> check(List<Campaign> passCampaigns, OptimizationSettings settings) {
        List<GuardAction> actions = new ArrayList<>();
        actions.addAll(scaleDown(passCampaigns, settings));

        GuardAction emergency = emergencyPause(passCampaigns, settings);
        if (emergency != null) {
            actions.add(emergency);
        }
        return actions;
    }

    private List<GuardAction> scaleDown(List<Campaign> passCampaigns, OptimizationSettings settings) {
        List<Campaign> active = stillActive(passCampaigns).stream()
                .filter(c -> c.getDailyBudget() != null && c.getDailyBudget().signum() > 0)
                .collect(Collectors.toList());
        BigDecimal total = active.stream()
                .map(Campaign::getDailyBudget)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal limit = BigDecimal.valueOf(settings.getDailySpendLimit());

        if (total.compareTo(limit) <= 0) {
            return List.of();
        }

        BigDecimal factor = limit.divide(total, MathContext.DECIMAL64);
        log.warn("Presupuesto diario total {} supera el límite {}, factor de escala {}", total, limit, factor);

        String reason = String.format(Locale.ROOT, "Total budget $%.2f exceeds limit $%.2f, scaled by %.3f",
                total, limit, factor);
        List<GuardAction> actions = new ArrayList<>();
        for (Campaign campaign : active) {
            BigDecimal previous = campaign.getDailyBudget();
            BigDecimal scaled = BudgetPolicy.round(previous.multiply(factor));
            campaign.setDailyBudget(scaled);
            actions.add(new GuardAction(List.of(campaign),
                    RuleDecision.budget(GLOBAL_BUDGET_SCALE, reason, previous, scaled)));
        }
        return actions;
    }

    private GuardAction emergencyPause(List<Campaign> passCampaigns, OptimizationSettings settings) {
        double totalSpend = passCampaigns.stream()
                .mapToDouble(c -> c.getSpend() != null ? c.getSpend().doubleValue() : 0.0)
                .sum();
        double totalRevenue = passCampaigns.stream()
                .mapToDouble(c -> c.getRevenue() != null ? c.getRevenue().doubleValue() : 0.0)
                .sum();
        double netLoss = totalSpend - totalRevenue;

        if (netLoss < settings.getEmergencyPauseLoss()) {
            return null;
        }

        List<Campaign> toPause = stillActive(passCampaigns);
        toPause.forEach(c -> c.setStatus(CampaignStatus.PAUSED));
        log.error("PAUSA DE EMERGENCIA: pérdida neta {} >= umbral {}, {} campañas pausadas",
                netLoss, settings.getEmergencyPauseLoss(), toPause.size());

        adminNotificationService.notifyEmergencyPause(netLoss, settings.getEmergencyPauseLoss(), toPause.size());

        String reason = String.format(Locale.ROOT, "Net loss $%.2f exceeds emergency threshold $%.2f, %d campaigns paused",
                netLoss, settings.getEmergencyPauseLoss(), toPause.size());
        return new GuardAction(toPause, new RuleDecision(EMERGENCY_PAUSE_ALL, reason,
                RuleDecision.Mutation.PAUSE, null, null, AuditSeverity.CRITICAL));
    }

    private static List<Campaign> stillActive(List<Campaign> campaigns) {
        return campaigns.stream()
                .filter(c -> c.getStatus() == CampaignStatus.ACTIVE)
                .collect(Collectors.toList());
    }
}
