package com.autosem.digital.process.optimizer.application.service;

import com.autosem.digital.process.optimizer.application.service.rule.RuleEvaluator;
import com.autosem.digital.process.optimizer.domain.DTO.ActionRecord;
import com.autosem.digital.process.optimizer.domain.DTO.ExecutionOutcome;
import com.autosem.digital.process.optimizer.domain.DTO.OptimizationResult;
import com.autosem.digital.process.optimizer.domain.DTO.OptimizationSettings;
import com.autosem.digital.process.optimizer.domain.entity.AuditSeverity;
import com.autosem.digital.process.optimizer.domain.exception.OptimizationPreconditionException;
import com.autosem.digital.process.optimizer.domain.model.Campaign;
import com.autosem.digital.process.optimizer.domain.model.CampaignStatus;
import com.autosem.digital.process.optimizer.domain.model.Platform;
import com.autosem.digital.process.optimizer.domain.port.repository.CampaignRepository;
import com.autosem.digital.process.optimizer.domain.port.service.AdminNotificationService;
import com.autosem.digital.process.optimizer.domain.port.service.AuditLogService;
import com.autosem.digital.process.optimizer.domain.port.service.SettingsService;
import com.autosem.digital.process.optimizer.infrastructure.config.OptimizationExecutionLogger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.OptimisticLockingFailureException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CampaignOptimizerServiceImplTest {

    @Mock
    private CampaignRepository campaignRepository;
    @Mock
    private SettingsService settingsService;
    @Mock
    private ActionExecutor actionExecutor;
    @Mock
    private AuditLogService auditLogService;
    @Mock
    private OptimizationExecutionLogger executionLogger;
    @Mock
    private AdminNotificationService adminNotificationService;

    private CampaignOptimizerServiceImpl service;

    @BeforeEach
    void setUp() {
        service = new CampaignOptimizerServiceImpl(
                campaignRepository,
                settingsService,
                new RuleEvaluator(),
                new SafetyGuard(adminNotificationService),
                actionExecutor,
                auditLogService,
                executionLogger);

        lenient().when(settingsService.getSettings()).thenReturn(Mono.just(OptimizationSettings.defaults()));
        lenient().when(campaignRepository.save(any(Campaign.class)))
                .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));
        lenient().when(auditLogService.record(any(), any(), any(), any(), any())).thenReturn(Mono.empty());
    }

    @Test
    @DisplayName("Una campaña con ROAS 0.2 tras $25 queda pausada y auditada")
    void pausesUnderperformingCampaign() {
        Campaign campaign = campaign("c-1", "10.00", 500, 20, "25.00", "5.00");
        when(campaignRepository.findByStatus(CampaignStatus.ACTIVE)).thenReturn(Flux.just(campaign));
        when(actionExecutor.pause(Platform.META, "ext-c-1")).thenReturn(Mono.just(ExecutionOutcome.success("paused ext-c-1")));

        StepVerifier.create(service.optimizeAll())
                .assertNext(result -> {
                    assertThat(result.getOptimizedCount()).isEqualTo(1);
                    assertThat(result.getActions()).extracting(ActionRecord::getAction)
                            .containsExactly("pause_underperformer");
                    assertThat(result.getActions().get(0).isExecuted()).isTrue();
                })
                .verifyComplete();

        assertThat(campaign.getStatus()).isEqualTo(CampaignStatus.PAUSED);
        verify(campaignRepository).save(campaign);
        verify(auditLogService).record(eq("pause_underperformer"), eq(AuditLogService.ENTITY_CAMPAIGN),
                eq("c-1"), anyString(), eq(AuditSeverity.WARNING));
        verify(auditLogService).record(eq(CampaignOptimizerServiceImpl.PASS_AUDIT_ACTION),
                eq(AuditLogService.ENTITY_ACCOUNT), any(), anyString(), eq(AuditSeverity.INFO));
    }

    @Test
    @DisplayName("Las campañas sin datos suficientes no llaman a la plataforma ni se auditan")
    void waitingCampaignsAreNotAudited() {
        Campaign campaign = campaign("c-1", "10.00", 50, 2, "1.00", "0.00");
        when(campaignRepository.findByStatus(CampaignStatus.ACTIVE)).thenReturn(Flux.just(campaign));

        StepVerifier.create(service.optimizeAll())
                .assertNext(result -> assertThat(result.getActions()).extracting(ActionRecord::getAction)
                        .containsExactly("waiting"))
                .verifyComplete();

        verify(auditLogService, never()).record(eq("waiting"), any(), any(), any(), any());
        verify(actionExecutor, never()).pause(any(), any());
    }

    @Test
    @DisplayName("Un fallo en una campaña no impide procesar las demás")
    void failuresAreIsolatedPerCampaign() {
        Campaign failing = campaign("c-1", "10.00", 500, 20, "25.00", "5.00");
        Campaign healthy = campaign("c-2", "10.00", 1500, 60, "9.00", "0.00");
        healthy.setConversions(3L);
        when(campaignRepository.findByStatus(CampaignStatus.ACTIVE)).thenReturn(Flux.just(failing, healthy));
        when(actionExecutor.pause(Platform.META, "ext-c-1")).thenReturn(Mono.error(new IllegalStateException("boom")));
        when(actionExecutor.setBudget(eq(Platform.META), eq("ext-c-2"), any(BigDecimal.class)))
                .thenReturn(Mono.just(ExecutionOutcome.success("budget ext-c-2")));

        StepVerifier.create(service.optimizeAll())
                .assertNext(result -> {
                    assertThat(result.getActions()).extracting(ActionRecord::getAction)
                            .containsExactly(CampaignOptimizerServiceImpl.EVALUATION_ERROR, "scale_winner");
                    assertThat(result.getActions().get(0).getReason()).isEqualTo("boom");
                })
                .verifyComplete();

        assertThat(healthy.getDailyBudget()).isEqualByComparingTo("12.00");
    }

    @Test
    @DisplayName("Una pérdida neta mayor al umbral pausa todas las campañas con una sola acción crítica")
    void emergencyPauseProducesSingleCriticalRecord() {
        Campaign first = campaign("c-1", "10.00", 50, 2, "400.00", "30.00");
        Campaign second = campaign("c-2", "10.00", 50, 2, "200.00", "20.00");
        when(campaignRepository.findByStatus(CampaignStatus.ACTIVE)).thenReturn(Flux.just(first, second));
        when(actionExecutor.pause(eq(Platform.META), anyString()))
                .thenReturn(Mono.just(ExecutionOutcome.success("paused")));

        StepVerifier.create(service.optimizeAll())
                .assertNext(result -> {
                    assertThat(result.getActions()).extracting(ActionRecord::getAction)
                            .containsExactly("waiting", "waiting", SafetyGuard.EMERGENCY_PAUSE_ALL);
                    ActionRecord emergency = result.getActions().get(2);
                    assertThat(emergency.getSeverity()).isEqualTo(AuditSeverity.CRITICAL);
                    assertThat(emergency.getDetail()).isEqualTo("2 of 2 campaigns paused on platform");
                    assertThat(emergency.isExecuted()).isTrue();
                })
                .verifyComplete();

        assertThat(first.getStatus()).isEqualTo(CampaignStatus.PAUSED);
        assertThat(second.getStatus()).isEqualTo(CampaignStatus.PAUSED);
        verify(auditLogService).record(eq(SafetyGuard.EMERGENCY_PAUSE_ALL), eq(AuditLogService.ENTITY_ACCOUNT),
                any(), anyString(), eq(AuditSeverity.CRITICAL));
    }

    @Test
    @DisplayName("Repetir la pasada sobre los mismos contadores sólo cambia por el presupuesto actualizado")
    void repeatedPassDependsOnlyOnUpdatedBudget() {
        Campaign growing = strongRoasCampaign("c-1", "10.00");
        Campaign capped = strongRoasCampaign("c-2", "50.00");
        when(campaignRepository.findByStatus(CampaignStatus.ACTIVE))
                .thenAnswer(invocation -> Flux.just(growing, capped));
        when(actionExecutor.setBudget(eq(Platform.META), eq("ext-c-1"), any(BigDecimal.class)))
                .thenReturn(Mono.just(ExecutionOutcome.success("budget ext-c-1")));

        OptimizationResult first = service.optimizeAll().block();
        assertThat(growing.getDailyBudget()).isEqualByComparingTo("12.50");

        OptimizationResult second = service.optimizeAll().block();
        assertThat(growing.getDailyBudget()).isEqualByComparingTo("15.63");

        assertThat(first.getActions()).extracting(ActionRecord::getCampaignId, ActionRecord::getAction)
                .containsExactly(tuple("c-1", "budget_increase"), tuple("c-2", "no_change"));
        assertThat(second.getActions()).extracting(ActionRecord::getCampaignId, ActionRecord::getAction)
                .containsExactly(tuple("c-1", "budget_increase"), tuple("c-2", "no_change"));
        assertThat(second.getActions().get(1).getReason()).isEqualTo(first.getActions().get(1).getReason());

        Campaign fresh = strongRoasCampaign("c-1", "12.50");
        when(campaignRepository.findByStatus(CampaignStatus.ACTIVE)).thenReturn(Flux.just(fresh));
        OptimizationResult fromScratch = service.optimizeAll().block();

        assertThat(second.getActions().get(0).getReason()).isEqualTo(fromScratch.getActions().get(0).getReason());
        assertThat(fresh.getDailyBudget()).isEqualByComparingTo(growing.getDailyBudget());
        verify(actionExecutor, never()).setBudget(eq(Platform.META), eq("ext-c-2"), any(BigDecimal.class));
    }

    @Test
    @DisplayName("Un conflicto de versión al guardar produce un registro persist_error")
    void persistConflictIsReported() {
        Campaign campaign = campaign("c-1", "10.00", 50, 2, "1.00", "0.00");
        when(campaignRepository.findByStatus(CampaignStatus.ACTIVE)).thenReturn(Flux.just(campaign));
        when(campaignRepository.save(campaign))
                .thenReturn(Mono.error(new OptimisticLockingFailureException("version 3 expected")));

        StepVerifier.create(service.optimizeAll())
                .assertNext(result -> assertThat(result.getActions()).extracting(ActionRecord::getAction)
                        .containsExactly("waiting", CampaignOptimizerServiceImpl.PERSIST_ERROR))
                .verifyComplete();
    }

    @Test
    @DisplayName("Sin campañas activas la pasada termina con un mensaje")
    void noActiveCampaigns() {
        when(campaignRepository.findByStatus(CampaignStatus.ACTIVE)).thenReturn(Flux.empty());

        StepVerifier.create(service.optimizeAll())
                .assertNext(result -> {
                    assertThat(result.getOptimizedCount()).isZero();
                    assertThat(result.getActions()).isEmpty();
                    assertThat(result.getMessage()).isEqualTo("No active campaigns");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Si no se puede leer la configuración la pasada se aborta")
    void settingsFailureAbortsPass() {
        when(settingsService.getSettings()).thenReturn(Mono.error(new IllegalStateException("mongo down")));
        when(campaignRepository.findByStatus(CampaignStatus.ACTIVE)).thenReturn(Flux.empty());

        StepVerifier.create(service.optimizeAll())
                .expectError(OptimizationPreconditionException.class)
                .verify();

        verify(executionLogger).logExecutionError(any(), any(OptimizationPreconditionException.class));
        verify(campaignRepository, never()).save(any(Campaign.class));
    }

    @Test
    @DisplayName("El resumen agrega gasto, ingresos y ROAS de todas las campañas")
    void summaryAggregatesAllCampaigns() {
        Campaign active = campaign("c-1", "10.00", 500, 20, "100.00", "250.00");
        Campaign paused = campaign("c-2", "10.00", 500, 20, "50.00", "20.00");
        paused.setStatus(CampaignStatus.PAUSED);
        when(campaignRepository.findAll()).thenReturn(Flux.just(active, paused));

        StepVerifier.create(service.getSummary())
                .assertNext(summary -> {
                    assertThat(summary.getTotalCampaigns()).isEqualTo(2);
                    assertThat(summary.getActive()).isEqualTo(1);
                    assertThat(summary.getTotalSpend()).isEqualTo(150.0);
                    assertThat(summary.getTotalRevenue()).isEqualTo(270.0);
                    assertThat(summary.getOverallRoas()).isEqualTo(1.8);
                })
                .verifyComplete();
    }

    private static Campaign strongRoasCampaign(String id, String budget) {
        Campaign campaign = campaign(id, budget, 1000, 40, "40.00", "200.00");
        campaign.setConversions(5L);
        return campaign;
    }

    private static Campaign campaign(String id, String budget, long impressions, long clicks,
                                     String spend, String revenue) {
        return Campaign.builder()
                .id(id)
                .name("Campaña " + id)
                .platform(Platform.META)
                .externalId("ext-" + id)
                .status(CampaignStatus.ACTIVE)
                .dailyBudget(new BigDecimal(budget))
                .impressions(impressions)
                .clicks(clicks)
                .conversions(0L)
                .spend(new BigDecimal(spend))
                .revenue(new BigDecimal(revenue))
                .build();
    }
}
