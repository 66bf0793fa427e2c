package com.autosem.digital.process.optimizer.application.service;

import com.autosem.digital.process.optimizer.domain.DTO.AutoOptimizeResult;
import com.autosem.digital.process.optimizer.domain.DTO.CreateABTestRequest;
import com.autosem.digital.process.optimizer.domain.DTO.ExecutionOutcome;
import com.autosem.digital.process.optimizer.domain.DTO.SkipReason;
import com.autosem.digital.process.optimizer.domain.DTO.StatResult;
import com.autosem.digital.process.optimizer.domain.DTO.TestResult;
import com.autosem.digital.process.optimizer.domain.DTO.VariantSpec;
import com.autosem.digital.process.optimizer.domain.entity.AuditSeverity;
import com.autosem.digital.process.optimizer.domain.entity.OptimizationExecution;
import com.autosem.digital.process.optimizer.domain.exception.ABTestNotFoundException;
import com.autosem.digital.process.optimizer.domain.exception.InvalidABTestRequestException;
import com.autosem.digital.process.optimizer.domain.model.ABTest;
import com.autosem.digital.process.optimizer.domain.model.ABTestStatus;
import com.autosem.digital.process.optimizer.domain.model.Campaign;
import com.autosem.digital.process.optimizer.domain.model.SyncStatus;
import com.autosem.digital.process.optimizer.domain.model.TestWinner;
import com.autosem.digital.process.optimizer.domain.model.VariantType;
import com.autosem.digital.process.optimizer.domain.port.repository.ABTestRepository;
import com.autosem.digital.process.optimizer.domain.port.service.ABTestService;
import com.autosem.digital.process.optimizer.domain.port.service.AdPlatformClient;
import com.autosem.digital.process.optimizer.domain.port.service.AuditLogService;
import com.autosem.digital.process.optimizer.infrastructure.ReferentialIntegrityValidator;
import com.autosem.digital.process.optimizer.infrastructure.config.OptimizationExecutionLogger;
import com.autosem.digital.process.optimizer.infrastructure.config.PerformanceMonitor;
import com.autosem.digital.process.optimizer.infrastructure.outbound.adapter.AdPlatformRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Motor de pruebas A/B: evaluación estadística, adjudicación del ganador y creación
 * de nuevas pruebas.<br/>
 * <b>Class</b>: ABTestServiceImpl<br/>
 * <b>Copyright</b>: &copy; 2025 Digital.<br/>
 * <b>Company</b>: Digital.<br/>
 *
 * <u>Developed by</u>: <br/>
 * <ul>
 * <li>Equipo de Optimización</li>
 * </ul>
 * <u>Changes</u>:<br/>
 * <ul>
 * <li>Mar 18, 2025 Creación de la clase.</li>
 * <li>Abr 02, 2025 Estado de sincronización separado de la decisión del ganador.</li>
 * </ul>
 * @version 1.0
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ABTestServiceImpl implements ABTestService {

    public static final String AUTO_OPTIMIZE_OPERATION = "auto_optimize_ab_tests";

    private final ABTestRepository abTestRepository;
    private final SignificanceCalculator significanceCalculator;
    private final ActionExecutor actionExecutor;
    private final AdPlatformRegistry platformRegistry;
    private final ReferentialIntegrityValidator referentialIntegrityValidator;
    private final AuditLogService auditLogService;
    private final PerformanceMonitor performanceMonitor;
    private final OptimizationExecutionLogger executionLogger;

    private static class Evaluation {
        final ABTest test;
        final StatResult stat;

        Evaluation(ABTest test, StatResult stat) {
            this.test = test;
            this.stat = stat;
        }
    }

    @Override
    public Flux<TestResult> evaluateABTests(String testId) {
        Flux<ABTest> tests = testId != null
                ? abTestRepository.findById(testId)
                        .switchIfEmpty(Mono.error(new ABTestNotFoundException(testId)))
                        .flux()
                : abTestRepository.findByStatus(ABTestStatus.RUNNING);

        return tests.concatMap(test -> evaluate(test)
                .map(evaluation -> TestResult.of(test.getId(), test.getTestName(), evaluation.test.getStatus(),
                        evaluation.stat))
                .onErrorResume(error -> {
                    log.error("Error evaluando la prueba A/B {}: {}", test.getId(), error.getMessage());
                    return Mono.just(TestResult.failed(test.getId(), test.getTestName(), error.getMessage()));
                }));
    }

    /**
     * Lee las métricas de ambos anuncios desde la creación de la prueba y actualiza la
     * confianza. El ganador sólo se guarda si es significativo con impresiones suficientes.
     */
    private Mono<Evaluation> evaluate(ABTest test) {
        return Mono.defer(() -> {
            AdPlatformClient client = platformRegistry.get(test.getPlatform());
            LocalDateTime since = test.getCreatedAt();

            return Mono.zip(
                            client.getAdInsights(test.getOriginalAdId(), since),
                            client.getAdInsights(test.getVariantAdId(), since))
                    .map(insights -> significanceCalculator.compute(insights.getT1(), insights.getT2()))
                    .flatMap(stat -> {
                        if (test.getStatus() != ABTestStatus.RUNNING) {
                            return Mono.just(new Evaluation(test, stat));
                        }
                        test.setConfidenceLevel(stat.getConfidence());
                        if (stat.isSignificant() && stat.isMinImpressionsMet()
                                && stat.getWinner() != TestWinner.INCONCLUSIVE) {
                            test.setWinner(stat.getWinner());
                        }
                        return abTestRepository.save(test).map(saved -> new Evaluation(saved, stat));
                    });
        });
    }

    @Override
    public Mono<AutoOptimizeResult> autoOptimizeABTests() {
        return Mono.defer(() -> {
            OptimizationExecution execution = executionLogger.logExecutionStart(AUTO_OPTIMIZE_OPERATION);
            List<TestResult> optimized = new ArrayList<>();
            List<SkipReason> skipped = new ArrayList<>();

            return abTestRepository.findByStatus(ABTestStatus.RUNNING)
                    .concatMap(test -> evaluate(test)
                            .flatMap(evaluation -> {
                                String skipReason = skipReason(evaluation.stat);
                                if (skipReason != null) {
                                    skipped.add(new SkipReason(test.getId(), test.getTestName(), skipReason));
                                    return Mono.empty();
                                }
                                return declareWinner(evaluation)
                                        .doOnNext(optimized::add);
                            })
                            .onErrorResume(error -> {
                                log.error("Error en auto-optimización de la prueba {}: {}", test.getId(), error.getMessage());
                                skipped.add(new SkipReason(test.getId(), test.getTestName(),
                                        "evaluation failed: " + error.getMessage()));
                                return Mono.empty();
                            }))
                    .then(Mono.fromSupplier(() -> AutoOptimizeResult.builder()
                            .optimizedCount(optimized.size())
                            .optimized(optimized)
                            .skipped(skipped)
                            .build()))
                    .doOnSuccess(result -> executionLogger.logExecutionSuccess(execution, result.getOptimizedCount()))
                    .doOnError(error -> executionLogger.logExecutionError(execution, error));
        });
    }

    static String skipReason(StatResult stat) {
        if (!stat.isMinImpressionsMet()) {
            return "need " + SignificanceCalculator.MIN_IMPRESSIONS_PER_ARM + "+ impressions each";
        }
        if (stat.getConfidence() < SignificanceCalculator.CONFIDENCE_THRESHOLD) {
            return "confidence " + BigDecimal.valueOf(stat.getConfidence()).stripTrailingZeros().toPlainString()
                    + "% < " + (int) SignificanceCalculator.CONFIDENCE_THRESHOLD + "%";
        }
        if (stat.getWinner() == TestWinner.INCONCLUSIVE) {
            return "no decisive winner";
        }
        return null;
    }

    /**
     * Pausa el conjunto de anuncios perdedor y devuelve al ganador el presupuesto completo.
     * La decisión se guarda aunque la sincronización con la plataforma falle.
     */
    private Mono<TestResult> declareWinner(Evaluation evaluation) {
        ABTest test = evaluation.test;
        boolean variantWins = evaluation.stat.getWinner() == TestWinner.VARIANT;
        String loserAdset = variantWins ? test.getOriginalAdsetId() : test.getVariantAdsetId();
        String winnerAdset = variantWins ? test.getVariantAdsetId() : test.getOriginalAdsetId();

        Mono<ExecutionOutcome> restore = test.getOriginalBudgetCents() != null
                ? actionExecutor.setBudgetCents(test.getPlatform(), winnerAdset, test.getOriginalBudgetCents())
                : Mono.just(ExecutionOutcome.notAttempted("original budget unknown"));

        return actionExecutor.pause(test.getPlatform(), loserAdset)
                .zipWith(restore)
                .flatMap(outcomes -> {
                    ExecutionOutcome paused = outcomes.getT1();
                    ExecutionOutcome restored = outcomes.getT2();

                    test.setStatus(variantWins ? ABTestStatus.WINNER_VARIANT : ABTestStatus.WINNER_ORIGINAL);
                    test.setWinner(evaluation.stat.getWinner());
                    test.setCompletedAt(LocalDateTime.now());
                    test.setSyncStatus(syncStatus(paused, restored));
                    test.setSyncDetail("pause " + loserAdset + ": " + paused.getDetail()
                            + "; restore " + winnerAdset + ": " + restored.getDetail());

                    log.info("Prueba A/B {} adjudicada a {} con confianza {}% (sincronización {})",
                            test.getId(), test.getWinner().value(), evaluation.stat.getConfidence(), test.getSyncStatus());

                    return abTestRepository.save(test);
                })
                .flatMap(saved -> auditLogService.record("ab_test_winner", AuditLogService.ENTITY_AB_TEST, saved.getId(),
                                "Winner " + saved.getWinner().value() + " at " + evaluation.stat.getConfidence()
                                        + "% confidence; " + saved.getSyncDetail(),
                                saved.getSyncStatus() == SyncStatus.SYNCED ? AuditSeverity.INFO : AuditSeverity.WARNING)
                        .thenReturn(TestResult.of(saved.getId(), saved.getTestName(), saved.getStatus(), evaluation.stat)));
    }

    static SyncStatus syncStatus(ExecutionOutcome paused, ExecutionOutcome restored) {
        if (paused.isExecuted() && restored.isExecuted()) {
            return SyncStatus.SYNCED;
        }
        if (paused.isExecuted() || restored.isExecuted()) {
            return SyncStatus.PARTIAL;
        }
        return SyncStatus.FAILED;
    }

    @Override
    public Mono<ABTest> createTest(CreateABTestRequest request) {
        VariantType variantType;
        try {
            variantType = validateRequest(request);
        } catch (InvalidABTestRequestException e) {
            return Mono.error(e);
        }

        return referentialIntegrityValidator.validateNewTest(request.getCampaignId(), request.getOriginalAdId())
                .flatMap(campaign -> splitAndPersist(campaign, request, variantType))
                .onErrorResume(error -> !(error instanceof InvalidABTestRequestException),
                        error -> auditLogService.record("ab_test_create_failed", AuditLogService.ENTITY_CAMPAIGN,
                                        request.getCampaignId(), request.getTestName() + ": " + error.getMessage(),
                                        AuditSeverity.WARNING)
                                .then(Mono.<ABTest>error(error)));
    }

    static VariantType validateRequest(CreateABTestRequest request) {
        if (request == null) {
            throw new InvalidABTestRequestException("Request body is required");
        }
        VariantType variantType = VariantType.fromValue(request.getVariantType())
                .orElseThrow(() -> new InvalidABTestRequestException("Invalid variant_type '"
                        + request.getVariantType() + "'. Must be one of: " + VariantType.allowedValues()));
        requireText(request.getTestName(), "test_name");
        requireText(request.getCampaignId(), "campaign_id");
        requireText(request.getOriginalAdId(), "original_ad_id");
        requireText(request.getOriginalAdsetId(), "original_adset_id");
        requireText(request.getVariantValue(), "variant_value");
        return variantType;
    }

    private static void requireText(String value, String field) {
        if (!StringUtils.hasText(value)) {
            throw new InvalidABTestRequestException(field + " is required");
        }
    }

    /**
     * Duplica el conjunto de anuncios con el creativo de la variante a mitad de presupuesto
     * y reduce el original a la otra mitad.
     */
    private Mono<ABTest> splitAndPersist(Campaign campaign, CreateABTestRequest request, VariantType variantType) {
        AdPlatformClient client = platformRegistry.get(campaign.getPlatform());
        String metricPrefix = "abtest." + campaign.getPlatform().name().toLowerCase(Locale.ROOT);

        return performanceMonitor.monitorMono(metricPrefix + ".get_adset_budget",
                        () -> client.getAdSetBudget(request.getOriginalAdsetId()))
                .flatMap(originalCents -> {
                    long halfCents = originalCents / 2;
                    VariantSpec spec = VariantSpec.builder()
                            .testName(request.getTestName())
                            .originalAdId(request.getOriginalAdId())
                            .originalAdsetId(request.getOriginalAdsetId())
                            .variantType(variantType)
                            .variantValue(request.getVariantValue())
                            .budgetCents(halfCents)
                            .build();

                    return performanceMonitor.monitorMono(metricPrefix + ".create_variant", () -> client.createVariant(spec))
                            .flatMap(variant -> performanceMonitor.monitorMono(metricPrefix + ".set_budget",
                                            () -> client.setBudget(request.getOriginalAdsetId(), halfCents))
                                    .thenReturn(ABTest.builder()
                                            .testName(request.getTestName())
                                            .campaignId(campaign.getId())
                                            .platform(campaign.getPlatform())
                                            .originalAdId(request.getOriginalAdId())
                                            .originalAdsetId(request.getOriginalAdsetId())
                                            .variantAdId(variant.getAdId())
                                            .variantAdsetId(variant.getAdsetId())
                                            .variantType(variantType)
                                            .variantValue(request.getVariantValue())
                                            .status(ABTestStatus.RUNNING)
                                            .confidenceLevel(0.0)
                                            .originalBudgetCents(originalCents)
                                            .syncStatus(SyncStatus.SYNCED)
                                            .createdAt(LocalDateTime.now())
                                            .build()));
                })
                .flatMap(abTestRepository::save)
                .flatMap(saved -> auditLogService.record("ab_test_created", AuditLogService.ENTITY_AB_TEST, saved.getId(),
                                saved.getTestName() + " (" + variantType.value() + ") on ad " + saved.getOriginalAdId()
                                        + ", budget split from " + saved.getOriginalBudgetCents() + " cents",
                                AuditSeverity.INFO)
                        .thenReturn(saved))
                .doOnNext(saved -> log.info("Prueba A/B creada: {} ({})", saved.getId(), saved.getTestName()));
    }
}
