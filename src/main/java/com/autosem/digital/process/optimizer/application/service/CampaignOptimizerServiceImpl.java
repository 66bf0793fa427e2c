package com.autosem.digital.process.optimizer.application.service;

import com.autosem.digital.process.optimizer.application.service.rule.RuleEvaluator;
import com.autosem.digital.process.optimizer.domain.DTO.ActionRecord;
import com.autosem.digital.process.optimizer.domain.DTO.ExecutionOutcome;
import com.autosem.digital.process.optimizer.domain.DTO.OptimizationResult;
import com.autosem.digital.process.optimizer.domain.DTO.OptimizationSettings;
import com.autosem.digital.process.optimizer.domain.DTO.OptimizationSummary;
import com.autosem.digital.process.optimizer.domain.DTO.RuleDecision;
import com.autosem.digital.process.optimizer.domain.entity.AuditSeverity;
import com.autosem.digital.process.optimizer.domain.entity.OptimizationExecution;
import com.autosem.digital.process.optimizer.domain.exception.OptimizationPreconditionException;
import com.autosem.digital.process.optimizer.domain.model.Campaign;
import com.autosem.digital.process.optimizer.domain.model.CampaignStatus;
import com.autosem.digital.process.optimizer.domain.port.repository.CampaignRepository;
import com.autosem.digital.process.optimizer.domain.port.service.AuditLogService;
import com.autosem.digital.process.optimizer.domain.port.service.CampaignOptimizerService;
import com.autosem.digital.process.optimizer.domain.port.service.SettingsService;
import com.autosem.digital.process.optimizer.infrastructure.config.OptimizationExecutionLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Pasada de optimización sobre las campañas activas.<br/>
 * <b>Class</b>: CampaignOptimizerServiceImpl<br/>
 * <b>Copyright</b>: &copy; 2025 Digital.<br/>
 * <b>Company</b>: Digital.<br/>
 *
 * <u>Developed by</u>: <br/>
 * <ul>
 * <li>Equipo de Optimización</li>
 * </ul>
 * <u>Changes</u>:<br/>
 * <ul>
 * <li>Mar 10, 2025 Creación de la clase.</li>
 * <li>Abr 02, 2025 Control de versión optimista al guardar campañas.</li>
 * </ul>
 * @version 1.0
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CampaignOptimizerServiceImpl implements CampaignOptimizerService {

    public static final String OPERATION = "optimize_all";
    public static final String PASS_AUDIT_ACTION = "OPTIMIZATION_PASS";
    static final String EVALUATION_ERROR = "evaluation_error";
    static final String PERSIST_ERROR = "persist_error";

    private static final Set<String> NOT_AUDITED = Set.of("waiting", "no_change");

    private final CampaignRepository campaignRepository;
    private final SettingsService settingsService;
    private final RuleEvaluator ruleEvaluator;
    private final SafetyGuard safetyGuard;
    private final ActionExecutor actionExecutor;
    private final AuditLogService auditLogService;
    private final OptimizationExecutionLogger executionLogger;

    @Override
    public Mono<OptimizationResult> optimizeAll() {
        return Mono.defer(() -> {
            OptimizationExecution execution = executionLogger.logExecutionStart(OPERATION);

            return loadPassInputs()
                    .flatMap(inputs -> runPass(inputs.settings, inputs.campaigns))
                    .doOnSuccess(result -> executionLogger.logExecutionSuccess(execution, result.getOptimizedCount()))
                    .doOnError(error -> executionLogger.logExecutionError(execution, error));
        });
    }

    private static class PassInputs {
        final OptimizationSettings settings;
        final List<Campaign> campaigns;

        PassInputs(OptimizationSettings settings, List<Campaign> campaigns) {
            this.settings = settings;
            this.campaigns = campaigns;
        }
    }

    private Mono<PassInputs> loadPassInputs() {
        return Mono.zip(
                        settingsService.getSettings()
                                .defaultIfEmpty(OptimizationSettings.defaults()),
                        campaignRepository.findByStatus(CampaignStatus.ACTIVE).collectList())
                .map(tuple -> new PassInputs(tuple.getT1(), tuple.getT2()))
                .onErrorMap(error -> !(error instanceof OptimizationPreconditionException),
                        error -> new OptimizationPreconditionException(
                                "No se pudo cargar la configuración o las campañas activas: " + error.getMessage(), error));
    }

    private Mono<OptimizationResult> runPass(OptimizationSettings settings, List<Campaign> campaigns) {
        if (campaigns.isEmpty()) {
            log.info("No hay campañas activas para optimizar");
            return Mono.just(OptimizationResult.builder()
                    .optimizedCount(0)
                    .actions(List.of())
                    .timestamp(LocalDateTime.now())
                    .message("No active campaigns")
                    .build());
        }

        log.info("Optimizando {} campañas activas (umbral ROAS {}, límite diario {})",
                campaigns.size(), settings.getMinRoasThreshold(), settings.getDailySpendLimit());

        List<ActionRecord> actions = new ArrayList<>();

        return Flux.fromIterable(campaigns)
                .concatMap(campaign -> optimizeCampaign(campaign, settings))
                .doOnNext(actions::addAll)
                .then(Mono.defer(() -> applySafetyLimits(campaigns, settings)))
                .doOnNext(actions::addAll)
                .then(Mono.defer(() -> persistCampaigns(campaigns)))
                .doOnNext(actions::addAll)
                .then(Mono.defer(() -> auditPass(campaigns.size(), actions)))
                .then(Mono.fromSupplier(() -> OptimizationResult.builder()
                        .optimizedCount(campaigns.size())
                        .actions(actions)
                        .timestamp(LocalDateTime.now())
                        .build()));
    }

    /**
     * Evalúa una campaña y aplica sus decisiones. Un error se convierte en un
     * registro {@code evaluation_error} sin afectar a las demás campañas.
     */
    private Mono<List<ActionRecord>> optimizeCampaign(Campaign campaign, OptimizationSettings settings) {
        return Mono.fromCallable(() -> ruleEvaluator.evaluate(campaign, settings))
                .flatMapMany(Flux::fromIterable)
                .concatMap(decision -> applyDecision(campaign, decision))
                .collectList()
                .onErrorResume(error -> {
                    log.error("Error evaluando la campaña {}: {}", campaign.getId(), error.getMessage(), error);
                    return Mono.just(List.of(errorRecord(campaign, EVALUATION_ERROR, error)));
                });
    }

    private Mono<ActionRecord> applyDecision(Campaign campaign, RuleDecision decision) {
        campaign.setUpdatedAt(LocalDateTime.now());
        switch (decision.getMutation()) {
            case PAUSE:
                campaign.setStatus(CampaignStatus.PAUSED);
                return actionExecutor.pause(campaign.getPlatform(), campaign.getExternalId())
                        .map(outcome -> toRecord(campaign, decision, outcome));
            case SET_BUDGET:
                campaign.setDailyBudget(decision.getNewBudget());
                return actionExecutor.setBudget(campaign.getPlatform(), campaign.getExternalId(), decision.getNewBudget())
                        .map(outcome -> toRecord(campaign, decision, outcome));
            default:
                return Mono.just(toRecord(campaign, decision, null));
        }
    }

    private Mono<List<ActionRecord>> applySafetyLimits(List<Campaign> campaigns, OptimizationSettings settings) {
        return Flux.fromIterable(safetyGuard.check(campaigns, settings))
                .concatMap(guardAction -> {
                    RuleDecision decision = guardAction.getDecision();
                    if (SafetyGuard.EMERGENCY_PAUSE_ALL.equals(decision.getAction())) {
                        return pauseAll(guardAction.getTargets(), decision);
                    }
                    Campaign campaign = guardAction.getTargets().get(0);
                    campaign.setUpdatedAt(LocalDateTime.now());
                    return actionExecutor.setBudget(campaign.getPlatform(), campaign.getExternalId(), decision.getNewBudget())
                            .map(outcome -> toRecord(campaign, decision, outcome));
                })
                .collectList();
    }

    private Mono<ActionRecord> pauseAll(List<Campaign> targets, RuleDecision decision) {
        return Flux.fromIterable(targets)
                .concatMap(campaign -> {
                    campaign.setUpdatedAt(LocalDateTime.now());
                    return actionExecutor.pause(campaign.getPlatform(), campaign.getExternalId());
                })
                .collectList()
                .map(outcomes -> {
                    long pushed = outcomes.stream().filter(ExecutionOutcome::isExecuted).count();
                    return ActionRecord.builder()
                            .action(decision.getAction())
                            .reason(decision.getReason())
                            .executed(!outcomes.isEmpty() && pushed == outcomes.size())
                            .detail(pushed + " of " + outcomes.size() + " campaigns paused on platform")
                            .severity(decision.getSeverity())
                            .build();
                });
    }

    /**
     * Guarda cada campaña con control de versión; un conflicto con otra pasada sólo
     * afecta a esa campaña.
     */
    private Mono<List<ActionRecord>> persistCampaigns(List<Campaign> campaigns) {
        return Flux.fromIterable(campaigns)
                .concatMap(campaign -> campaignRepository.save(campaign)
                        .then(Mono.<ActionRecord>empty())
                        .onErrorResume(error -> {
                            if (error instanceof OptimisticLockingFailureException) {
                                log.warn("La campaña {} fue modificada por otra pasada, no se guardan los cambios",
                                        campaign.getId());
                            } else {
                                log.error("Error guardando la campaña {}: {}", campaign.getId(), error.getMessage());
                            }
                            return Mono.just(errorRecord(campaign, PERSIST_ERROR, error));
                        }))
                .collectList();
    }

    private Mono<Void> auditPass(int campaignCount, List<ActionRecord> actions) {
        return Flux.fromIterable(actions)
                .filter(action -> !NOT_AUDITED.contains(action.getAction()))
                .concatMap(action -> auditLogService.record(
                        action.getAction(),
                        action.getCampaignId() != null ? AuditLogService.ENTITY_CAMPAIGN : AuditLogService.ENTITY_ACCOUNT,
                        action.getCampaignId(),
                        auditDetails(action),
                        action.getSeverity()))
                .then(auditLogService.record(PASS_AUDIT_ACTION, AuditLogService.ENTITY_ACCOUNT, null,
                        campaignCount + " campaigns evaluated, " + actions.size() + " actions", AuditSeverity.INFO))
                .then();
    }

    private static String auditDetails(ActionRecord action) {
        String details = action.getReason();
        if (action.getDetail() != null) {
            details = details + " [executed=" + action.isExecuted() + ": " + action.getDetail() + "]";
        }
        return details;
    }

    private static ActionRecord toRecord(Campaign campaign, RuleDecision decision, ExecutionOutcome outcome) {
        return ActionRecord.builder()
                .campaignId(campaign.getId())
                .campaignName(campaign.getName())
                .action(decision.getAction())
                .reason(decision.getReason())
                .executed(outcome != null && outcome.isExecuted())
                .detail(outcome != null ? outcome.getDetail() : null)
                .severity(decision.getSeverity())
                .build();
    }

    private static ActionRecord errorRecord(Campaign campaign, String action, Throwable error) {
        return ActionRecord.builder()
                .campaignId(campaign.getId())
                .campaignName(campaign.getName())
                .action(action)
                .reason(String.valueOf(error.getMessage()))
                .executed(false)
                .severity(AuditSeverity.WARNING)
                .build();
    }

    @Override
    public Mono<OptimizationSummary> getSummary() {
        return campaignRepository.findAll()
                .collectList()
                .map(campaigns -> {
                    double totalSpend = campaigns.stream()
                            .mapToDouble(c -> c.getSpend() != null ? c.getSpend().doubleValue() : 0.0)
                            .sum();
                    double totalRevenue = campaigns.stream()
                            .mapToDouble(c -> c.getRevenue() != null ? c.getRevenue().doubleValue() : 0.0)
                            .sum();
                    long active = campaigns.stream()
                            .filter(c -> c.getStatus() == CampaignStatus.ACTIVE)
                            .count();
                    double overallRoas = totalSpend > 0
                            ? BigDecimal.valueOf(totalRevenue / totalSpend).setScale(2, RoundingMode.HALF_UP).doubleValue()
                            : 0.0;

                    return OptimizationSummary.builder()
                            .totalCampaigns(campaigns.size())
                            .active(active)
                            .totalSpend(round(totalSpend))
                            .totalRevenue(round(totalRevenue))
                            .overallRoas(overallRoas)
                            .build();
                });
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
