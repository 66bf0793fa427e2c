package com.autosem.digital.process.optimizer.application.service;

import com.autosem.digital.process.optimizer.domain.DTO.AutoOptimizeResult;
import com.autosem.digital.process.optimizer.domain.DTO.OptimizationSettings;
import com.autosem.digital.process.optimizer.domain.port.service.ABTestService;
import com.autosem.digital.process.optimizer.domain.port.service.SettingsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Job programado de auto-optimización de pruebas A/B, cada 6 horas por defecto.
 * No se ejecuta mientras la automatización esté pausada.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ABTestOptimizationJob {

    private final ABTestService abTestService;
    private final SettingsService settingsService;

    @Scheduled(cron = "${optimizer.schedule.ab-test-cron:0 0 */6 * * *}")
    public void autoOptimizeTests() {
        log.info("Iniciando job de auto-optimización de pruebas A/B");

        settingsService.getSettings()
                .defaultIfEmpty(OptimizationSettings.defaults())
                .flatMap(settings -> {
                    if (!settings.isAutomationEnabled()) {
                        log.info("Automatización pausada, se omite la auto-optimización de pruebas A/B");
                        return Mono.<AutoOptimizeResult>empty();
                    }
                    return abTestService.autoOptimizeABTests();
                })
                .subscribe(
                        result -> log.info("Auto-optimización completada: {} ganadores, {} omitidas",
                                result.getOptimizedCount(), result.getSkipped().size()),
                        error -> log.error("Error en job de auto-optimización de pruebas A/B: {}", error.getMessage(), error)
                );
    }
}
