package com.autosem.digital.process.optimizer.application.service;

import com.autosem.digital.process.optimizer.domain.port.service.AdminNotificationService;
import com.autosem.digital.process.optimizer.domain.port.service.AutomationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Job programado del ciclo de automatización. Con cron "-" queda deshabilitado.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OptimizationJob {

    private final AutomationService automationService;
    private final AdminNotificationService adminNotificationService;
    private static final DateTimeFormatter DATE_TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    @Scheduled(cron = "${optimizer.schedule.optimize-cron:0 0 * * * *}")
    public void runOptimizationCycle() {
        LocalDateTime startTime = LocalDateTime.now();
        log.info("Iniciando job de optimización de campañas: {}", startTime.format(DATE_TIME_FORMATTER));

        automationService.runCycle()
                .subscribe(
                        result -> {
                            log.info("Job de optimización completado con estado {} en {} ms",
                                    result.get("status"), Duration.between(startTime, LocalDateTime.now()).toMillis());
                            String failure = failedStep(result);
                            if (failure != null) {
                                notifyFailure(startTime, failure);
                            }
                        },
                        error -> {
                            log.error("Error en job de optimización: {}", error.getMessage(), error);
                            notifyFailure(startTime, error.getMessage());
                        }
                );
    }

    /**
     * Mensaje del primer paso fallido del ciclo, o null. Un ciclo omitido por la
     * automatización pausada no tiene pasos y no cuenta como fallo.
     */
    static String failedStep(Map<String, Object> result) {
        if (!"error".equals(result.get("status")) || !(result.get("steps") instanceof List)) {
            return null;
        }
        for (Object step : (List<?>) result.get("steps")) {
            if (step instanceof Map && ((Map<?, ?>) step).containsKey("error")) {
                return String.valueOf(((Map<?, ?>) step).get("error"));
            }
        }
        return null;
    }

    private void notifyFailure(LocalDateTime startTime, String message) {
        adminNotificationService.notifyCriticalError(
                "Fallo del job de optimización",
                "El ciclo iniciado a las " + startTime.format(DATE_TIME_FORMATTER)
                        + " terminó con error: " + message);
    }
}
