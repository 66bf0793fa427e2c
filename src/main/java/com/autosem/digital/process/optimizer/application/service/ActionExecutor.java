package com.autosem.digital.process.optimizer.application.service;

import com.autosem.digital.process.optimizer.domain.DTO.ExecutionOutcome;
import com.autosem.digital.process.optimizer.domain.model.Platform;
import com.autosem.digital.process.optimizer.domain.port.service.AdPlatformClient;
import com.autosem.digital.process.optimizer.infrastructure.MoneyUtils;
import com.autosem.digital.process.optimizer.infrastructure.config.PerformanceMonitor;
import com.autosem.digital.process.optimizer.infrastructure.outbound.adapter.AdPlatformRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Lleva a la plataforma las pausas y cambios de presupuesto decididos por el motor.
 * Nunca emite error: cualquier fallo se devuelve como {@code executed=false}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ActionExecutor {

    static final String NOT_PUSHED = "not pushed to platform (no external id)";

    private final AdPlatformRegistry platformRegistry;
    private final PerformanceMonitor performanceMonitor;

    public Mono<ExecutionOutcome> pause(Platform platform, String entityId) {
        return execute("pause", platform, entityId, client -> client.pause(entityId));
    }

    public Mono<ExecutionOutcome> setBudget(Platform platform, String entityId, BigDecimal dailyBudget) {
        return setBudgetCents(platform, entityId, MoneyUtils.toCents(dailyBudget));
    }

    public Mono<ExecutionOutcome> setBudgetCents(Platform platform, String entityId, long cents) {
        return execute("set_budget", platform, entityId, client -> client.setBudget(entityId, cents));
    }

    private Mono<ExecutionOutcome> execute(String operation, Platform platform, String entityId,
                                           Function<AdPlatformClient, Mono<String>> call) {
        if (!StringUtils.hasText(entityId)) {
            return Mono.just(ExecutionOutcome.notAttempted(NOT_PUSHED));
        }
        Optional<AdPlatformClient> client = platformRegistry.find(platform);
        if (client.isEmpty()) {
            log.warn("Sin cliente para la plataforma {}, {} de {} no se aplica", platform, operation, entityId);
            return Mono.just(ExecutionOutcome.failed("no client for platform " + platform));
        }

        String metricName = "platform." + String.valueOf(platform).toLowerCase(Locale.ROOT) + "." + operation;
        return performanceMonitor.monitorMono(metricName, () -> Mono.defer(() -> call.apply(client.get())))
                .map(ExecutionOutcome::success)
                .defaultIfEmpty(ExecutionOutcome.success(operation + " " + entityId))
                .onErrorResume(error -> {
                    log.error("Fallo {} en {} para {}: {}", operation, platform, entityId, error.getMessage());
                    return Mono.just(ExecutionOutcome.failed(error.getMessage()));
                });
    }
}
