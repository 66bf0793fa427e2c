package com.autosem.digital.process.optimizer.infrastructure.inbound.controller;

import com.autosem.digital.process.optimizer.domain.entity.AuditLogEntry;
import com.autosem.digital.process.optimizer.domain.entity.AuditSeverity;
import com.autosem.digital.process.optimizer.domain.exception.OptimizationPreconditionException;
import com.autosem.digital.process.optimizer.domain.port.service.AuditLogService;
import com.autosem.digital.process.optimizer.domain.port.service.AutomationService;
import com.autosem.digital.process.optimizer.domain.port.service.CampaignOptimizerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OptimizerControllerTest {

    @Mock
    private CampaignOptimizerService campaignOptimizerService;

    @Mock
    private AutomationService automationService;

    @Mock
    private AuditLogService auditLogService;

    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        webTestClient = WebTestClient.bindToController(
                        new OptimizerController(campaignOptimizerService, automationService, auditLogService))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("GET /audit devuelve las entradas con el conteo")
    void auditReturnsEntries() {
        AuditLogEntry pause = AuditLogEntry.builder()
                .id("a-2")
                .action("pause_underperformer")
                .entityType(AuditLogService.ENTITY_CAMPAIGN)
                .entityId("c-1")
                .severity(AuditSeverity.WARNING)
                .build();
        AuditLogEntry cycle = AuditLogEntry.builder()
                .id("a-1")
                .action("AUTOMATION_CYCLE")
                .entityType(AuditLogService.ENTITY_ACCOUNT)
                .severity(AuditSeverity.INFO)
                .build();
        when(auditLogService.recent(10, null)).thenReturn(Flux.just(pause, cycle));

        webTestClient.get().uri("/api/v1/optimizer/audit?limit=10")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.count").isEqualTo(2)
                .jsonPath("$.entries[0].action").isEqualTo("pause_underperformer")
                .jsonPath("$.entries[1].entityType").isEqualTo("account");
    }

    @Test
    @DisplayName("GET /audit usa el límite por defecto y filtra por tipo")
    void auditUsesDefaultLimit() {
        when(auditLogService.recent(50, "ab_test")).thenReturn(Flux.empty());

        webTestClient.get().uri("/api/v1/optimizer/audit?entityType=ab_test")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.count").isEqualTo(0);

        verify(auditLogService).recent(50, "ab_test");
    }

    @Test
    @DisplayName("POST /optimize responde 503 cuando faltan precondiciones")
    void optimizeUnavailable() {
        when(campaignOptimizerService.optimizeAll())
                .thenReturn(Mono.error(new OptimizationPreconditionException("No se pudieron leer los ajustes")));

        webTestClient.post().uri("/api/v1/optimizer/optimize")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.code").isEqualTo("OPTIMIZATION_UNAVAILABLE");
    }

    @Test
    @DisplayName("GET /audit sin parámetros consulta las 50 más recientes")
    void auditWithoutParams() {
        when(auditLogService.recent(50, null)).thenReturn(Flux.empty());

        webTestClient.get().uri("/api/v1/optimizer/audit")
                .exchange()
                .expectStatus().isOk();

        verify(auditLogService).recent(eq(50), isNull());
    }
}
