package com.autosem.digital.process.optimizer.application.service;

import com.autosem.digital.process.optimizer.domain.DTO.AdInsights;
import com.autosem.digital.process.optimizer.domain.DTO.CreateABTestRequest;
import com.autosem.digital.process.optimizer.domain.DTO.ExecutionOutcome;
import com.autosem.digital.process.optimizer.domain.DTO.SkipReason;
import com.autosem.digital.process.optimizer.domain.DTO.VariantRef;
import com.autosem.digital.process.optimizer.domain.DTO.VariantSpec;
import com.autosem.digital.process.optimizer.domain.entity.AuditSeverity;
import com.autosem.digital.process.optimizer.domain.exception.ABTestNotFoundException;
import com.autosem.digital.process.optimizer.domain.exception.InvalidABTestRequestException;
import com.autosem.digital.process.optimizer.domain.exception.PlatformCallException;
import com.autosem.digital.process.optimizer.domain.model.ABTest;
import com.autosem.digital.process.optimizer.domain.model.ABTestStatus;
import com.autosem.digital.process.optimizer.domain.model.Campaign;
import com.autosem.digital.process.optimizer.domain.model.CampaignStatus;
import com.autosem.digital.process.optimizer.domain.model.Platform;
import com.autosem.digital.process.optimizer.domain.model.SyncStatus;
import com.autosem.digital.process.optimizer.domain.model.TestWinner;
import com.autosem.digital.process.optimizer.domain.model.VariantType;
import com.autosem.digital.process.optimizer.domain.port.repository.ABTestRepository;
import com.autosem.digital.process.optimizer.domain.port.service.AdPlatformClient;
import com.autosem.digital.process.optimizer.domain.port.service.AuditLogService;
import com.autosem.digital.process.optimizer.infrastructure.ReferentialIntegrityValidator;
import com.autosem.digital.process.optimizer.infrastructure.config.OptimizationExecutionLogger;
import com.autosem.digital.process.optimizer.infrastructure.config.PerformanceMonitor;
import com.autosem.digital.process.optimizer.infrastructure.outbound.adapter.AdPlatformRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ABTestServiceImplTest {

    private static final LocalDateTime CREATED_AT = LocalDateTime.of(2025, 3, 1, 10, 0);

    @Mock
    private ABTestRepository abTestRepository;
    @Mock
    private ActionExecutor actionExecutor;
    @Mock
    private AdPlatformClient metaClient;
    @Mock
    private ReferentialIntegrityValidator referentialIntegrityValidator;
    @Mock
    private AuditLogService auditLogService;
    @Mock
    private OptimizationExecutionLogger executionLogger;

    private ABTestServiceImpl service;

    @BeforeEach
    void setUp() {
        when(metaClient.platform()).thenReturn(Platform.META);
        service = new ABTestServiceImpl(
                abTestRepository,
                new SignificanceCalculator(),
                actionExecutor,
                new AdPlatformRegistry(List.of(metaClient)),
                referentialIntegrityValidator,
                auditLogService,
                new PerformanceMonitor(),
                executionLogger);

        lenient().when(abTestRepository.save(any(ABTest.class)))
                .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));
        lenient().when(auditLogService.record(any(), any(), any(), any(), any())).thenReturn(Mono.empty());
    }

    @Test
    @DisplayName("Variante con 55/1200 contra 30/1200 gana: se pausa el original y se restaura el presupuesto")
    void autoOptimizeDeclaresVariantWinner() {
        ABTest test = runningTest("t-1");
        when(abTestRepository.findByStatus(ABTestStatus.RUNNING)).thenReturn(Flux.just(test));
        stubInsights(new AdInsights(1200, 30), new AdInsights(1200, 55));
        when(actionExecutor.pause(Platform.META, "adset-orig")).thenReturn(Mono.just(ExecutionOutcome.success("paused")));
        when(actionExecutor.setBudgetCents(Platform.META, "adset-var", 2000L))
                .thenReturn(Mono.just(ExecutionOutcome.success("budget 2000")));

        StepVerifier.create(service.autoOptimizeABTests())
                .assertNext(result -> {
                    assertThat(result.getOptimizedCount()).isEqualTo(1);
                    assertThat(result.getSkipped()).isEmpty();
                    assertThat(result.getOptimized().get(0).getWinner()).isEqualTo(TestWinner.VARIANT);
                    assertThat(result.getOptimized().get(0).getConfidence()).isGreaterThanOrEqualTo(95.0);
                })
                .verifyComplete();

        assertThat(test.getStatus()).isEqualTo(ABTestStatus.WINNER_VARIANT);
        assertThat(test.getWinner()).isEqualTo(TestWinner.VARIANT);
        assertThat(test.getSyncStatus()).isEqualTo(SyncStatus.SYNCED);
        assertThat(test.getCompletedAt()).isNotNull();
        verify(auditLogService).record(eq("ab_test_winner"), eq(AuditLogService.ENTITY_AB_TEST), eq("t-1"),
                anyString(), eq(AuditSeverity.INFO));
    }

    @Test
    @DisplayName("Con 400 impresiones por brazo la prueba se omite sin mutaciones")
    void autoOptimizeSkipsSmallSamples() {
        ABTest test = runningTest("t-1");
        when(abTestRepository.findByStatus(ABTestStatus.RUNNING)).thenReturn(Flux.just(test));
        stubInsights(new AdInsights(400, 5), new AdInsights(400, 30));

        StepVerifier.create(service.autoOptimizeABTests())
                .assertNext(result -> {
                    assertThat(result.getOptimizedCount()).isZero();
                    assertThat(result.getSkipped()).extracting(SkipReason::getReason)
                            .containsExactly("need 1000+ impressions each");
                })
                .verifyComplete();

        assertThat(test.getStatus()).isEqualTo(ABTestStatus.RUNNING);
        assertThat(test.getWinner()).isNull();
        verifyNoInteractions(actionExecutor);
    }

    @Test
    @DisplayName("Una confianza menor a 95% se informa como motivo de omisión")
    void autoOptimizeSkipsLowConfidence() {
        when(abTestRepository.findByStatus(ABTestStatus.RUNNING)).thenReturn(Flux.just(runningTest("t-1")));
        stubInsights(new AdInsights(1200, 30), new AdInsights(1200, 35));

        StepVerifier.create(service.autoOptimizeABTests())
                .assertNext(result -> assertThat(result.getSkipped().get(0).getReason())
                        .startsWith("confidence ")
                        .endsWith("% < 95%"))
                .verifyComplete();
    }

    @Test
    @DisplayName("Si falla la restauración del presupuesto la decisión se guarda con sincronización parcial")
    void partialSyncKeepsDecision() {
        ABTest test = runningTest("t-1");
        when(abTestRepository.findByStatus(ABTestStatus.RUNNING)).thenReturn(Flux.just(test));
        stubInsights(new AdInsights(1200, 30), new AdInsights(1200, 55));
        when(actionExecutor.pause(Platform.META, "adset-orig")).thenReturn(Mono.just(ExecutionOutcome.success("paused")));
        when(actionExecutor.setBudgetCents(Platform.META, "adset-var", 2000L))
                .thenReturn(Mono.just(ExecutionOutcome.failed("set_budget failed: 500")));

        StepVerifier.create(service.autoOptimizeABTests())
                .assertNext(result -> assertThat(result.getOptimizedCount()).isEqualTo(1))
                .verifyComplete();

        assertThat(test.getStatus()).isEqualTo(ABTestStatus.WINNER_VARIANT);
        assertThat(test.getSyncStatus()).isEqualTo(SyncStatus.PARTIAL);
        assertThat(test.getSyncDetail()).contains("set_budget failed: 500");
        verify(auditLogService).record(eq("ab_test_winner"), any(), any(), anyString(), eq(AuditSeverity.WARNING));
    }

    @Test
    @DisplayName("Un error al leer métricas omite sólo esa prueba")
    void insightFailureIsSkipped() {
        when(abTestRepository.findByStatus(ABTestStatus.RUNNING)).thenReturn(Flux.just(runningTest("t-1")));
        when(metaClient.getAdInsights(eq("ad-orig"), any()))
                .thenReturn(Mono.error(new PlatformCallException(Platform.META, "insights failed: timeout")));
        when(metaClient.getAdInsights(eq("ad-var"), any())).thenReturn(Mono.just(new AdInsights(1200, 55)));

        StepVerifier.create(service.autoOptimizeABTests())
                .assertNext(result -> assertThat(result.getSkipped()).extracting(SkipReason::getReason)
                        .containsExactly("evaluation failed: insights failed: timeout"))
                .verifyComplete();
    }

    @Test
    @DisplayName("Evaluar actualiza la confianza de las pruebas en curso")
    void evaluateUpdatesConfidence() {
        ABTest test = runningTest("t-1");
        when(abTestRepository.findByStatus(ABTestStatus.RUNNING)).thenReturn(Flux.just(test));
        stubInsights(new AdInsights(1200, 30), new AdInsights(1200, 55));

        StepVerifier.create(service.evaluateABTests(null))
                .assertNext(result -> {
                    assertThat(result.getTestId()).isEqualTo("t-1");
                    assertThat(result.getStatus()).isEqualTo(ABTestStatus.RUNNING);
                    assertThat(result.isSignificant()).isTrue();
                })
                .verifyComplete();

        assertThat(test.getConfidenceLevel()).isGreaterThan(99.0);
        assertThat(test.getWinner()).isEqualTo(TestWinner.VARIANT);
        verifyNoInteractions(actionExecutor);
    }

    @Test
    @DisplayName("Evaluar una prueba inexistente devuelve error de no encontrada")
    void evaluateUnknownTest() {
        when(abTestRepository.findById("missing")).thenReturn(Mono.empty());

        StepVerifier.create(service.evaluateABTests("missing"))
                .expectError(ABTestNotFoundException.class)
                .verify();
    }

    @Test
    @DisplayName("Un tipo de variante inválido se rechaza sin consultar la base")
    void createRejectsInvalidVariantType() {
        CreateABTestRequest request = validRequest();
        request.setVariantType("video");

        StepVerifier.create(service.createTest(request))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(InvalidABTestRequestException.class)
                        .hasMessage("Invalid variant_type 'video'. Must be one of: headline, image, cta"))
                .verify();

        verifyNoInteractions(referentialIntegrityValidator);
    }

    @Test
    @DisplayName("Los campos obligatorios vacíos se rechazan")
    void createRequiresFields() {
        CreateABTestRequest request = validRequest();
        request.setTestName(" ");

        StepVerifier.create(service.createTest(request))
                .expectErrorMessage("test_name is required")
                .verify();
    }

    @Test
    @DisplayName("Crear una prueba divide el presupuesto del conjunto original a la mitad")
    void createSplitsBudget() {
        CreateABTestRequest request = validRequest();
        when(referentialIntegrityValidator.validateNewTest("c-1", "ad-orig")).thenReturn(Mono.just(campaign()));
        when(metaClient.getAdSetBudget("adset-orig")).thenReturn(Mono.just(2000L));
        when(metaClient.createVariant(any(VariantSpec.class))).thenReturn(Mono.just(new VariantRef("ad-var", "adset-var")));
        when(metaClient.setBudget("adset-orig", 1000L)).thenReturn(Mono.just("budget adset-orig 1000"));

        StepVerifier.create(service.createTest(request))
                .assertNext(test -> {
                    assertThat(test.getStatus()).isEqualTo(ABTestStatus.RUNNING);
                    assertThat(test.getVariantAdId()).isEqualTo("ad-var");
                    assertThat(test.getVariantAdsetId()).isEqualTo("adset-var");
                    assertThat(test.getOriginalBudgetCents()).isEqualTo(2000L);
                    assertThat(test.getVariantType()).isEqualTo(VariantType.HEADLINE);
                    assertThat(test.getConfidenceLevel()).isZero();
                })
                .verifyComplete();

        ArgumentCaptor<VariantSpec> spec = ArgumentCaptor.forClass(VariantSpec.class);
        verify(metaClient).createVariant(spec.capture());
        assertThat(spec.getValue().getBudgetCents()).isEqualTo(1000L);
        assertThat(spec.getValue().getVariantValue()).isEqualTo("Envío gratis hoy");
        verify(auditLogService).record(eq("ab_test_created"), eq(AuditLogService.ENTITY_AB_TEST), any(),
                anyString(), eq(AuditSeverity.INFO));
    }

    @Test
    @DisplayName("Un fallo de plataforma al crear se audita y se propaga")
    void createFailureIsAudited() {
        CreateABTestRequest request = validRequest();
        when(referentialIntegrityValidator.validateNewTest("c-1", "ad-orig")).thenReturn(Mono.just(campaign()));
        when(metaClient.getAdSetBudget("adset-orig")).thenReturn(Mono.just(2000L));
        when(metaClient.createVariant(any(VariantSpec.class)))
                .thenReturn(Mono.error(new PlatformCallException(Platform.META, "create_variant failed: 400")));

        StepVerifier.create(service.createTest(request))
                .expectError(PlatformCallException.class)
                .verify();

        verify(metaClient, never()).setBudget(anyString(), anyLong());
        verify(abTestRepository, never()).save(any(ABTest.class));
        verify(auditLogService).record(eq("ab_test_create_failed"), eq(AuditLogService.ENTITY_CAMPAIGN), eq("c-1"),
                anyString(), eq(AuditSeverity.WARNING));
    }

    private void stubInsights(AdInsights original, AdInsights variant) {
        when(metaClient.getAdInsights("ad-orig", CREATED_AT)).thenReturn(Mono.just(original));
        when(metaClient.getAdInsights("ad-var", CREATED_AT)).thenReturn(Mono.just(variant));
    }

    private static ABTest runningTest(String id) {
        return ABTest.builder()
                .id(id)
                .testName("Titular envío gratis")
                .campaignId("c-1")
                .platform(Platform.META)
                .originalAdId("ad-orig")
                .originalAdsetId("adset-orig")
                .variantAdId("ad-var")
                .variantAdsetId("adset-var")
                .variantType(VariantType.HEADLINE)
                .variantValue("Envío gratis hoy")
                .status(ABTestStatus.RUNNING)
                .confidenceLevel(0.0)
                .originalBudgetCents(2000L)
                .syncStatus(SyncStatus.SYNCED)
                .createdAt(CREATED_AT)
                .build();
    }

    private static Campaign campaign() {
        return Campaign.builder()
                .id("c-1")
                .name("Campaña c-1")
                .platform(Platform.META)
                .status(CampaignStatus.ACTIVE)
                .build();
    }

    private static CreateABTestRequest validRequest() {
        return CreateABTestRequest.builder()
                .testName("Titular envío gratis")
                .campaignId("c-1")
                .originalAdId("ad-orig")
                .originalAdsetId("adset-orig")
                .variantType("headline")
                .variantValue("Envío gratis hoy")
                .build();
    }
}
