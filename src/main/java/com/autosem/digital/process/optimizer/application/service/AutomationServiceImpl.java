package com.autosem.digital.process.optimizer.application.service;

import com.autosem.digital.process.optimizer.domain.DTO.OptimizationSettings;
import com.autosem.digital.process.optimizer.domain.entity.AuditLogEntry;
import com.autosem.digital.process.optimizer.domain.entity.AuditSeverity;
import com.autosem.digital.process.optimizer.domain.port.service.AuditLogService;
import com.autosem.digital.process.optimizer.domain.port.service.AutomationService;
import com.autosem.digital.process.optimizer.domain.port.service.CampaignOptimizerService;
import com.autosem.digital.process.optimizer.domain.port.service.SettingsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ciclo de automatización. El indicador {@code automation_enabled} se lee de la
 * configuración persistida en cada invocación.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AutomationServiceImpl implements AutomationService {

    public static final String CYCLE_AUDIT_ACTION = "AUTOMATION_CYCLE";
    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final SettingsService settingsService;
    private final CampaignOptimizerService campaignOptimizerService;
    private final AuditLogService auditLogService;

    @Override
    public Mono<Map<String, Object>> runCycle() {
        return settingsService.getSettings()
                .defaultIfEmpty(OptimizationSettings.defaults())
                .flatMap(settings -> {
                    if (!settings.isAutomationEnabled()) {
                        log.info("Automatización pausada, no se ejecuta el ciclo");
                        Map<String, Object> response = new HashMap<>();
                        response.put("status", "error");
                        response.put("message", "Automation is paused");
                        return Mono.just(response);
                    }
                    return executeCycle();
                });
    }

    private Mono<Map<String, Object>> executeCycle() {
        Map<String, Object> results = new LinkedHashMap<>();
        List<Map<String, Object>> steps = new ArrayList<>();
        results.put("cycleStart", LocalDateTime.now().format(DATE_FORMATTER));
        results.put("steps", steps);

        return campaignOptimizerService.optimizeAll()
                .map(result -> {
                    Map<String, Object> step = new LinkedHashMap<>();
                    step.put("step", "optimize");
                    step.put("result", result);
                    return step;
                })
                .onErrorResume(error -> {
                    log.error("Error en el paso de optimización del ciclo: {}", error.getMessage());
                    Map<String, Object> step = new LinkedHashMap<>();
                    step.put("step", "optimize");
                    step.put("error", error.getMessage());
                    return Mono.just(step);
                })
                .flatMap(step -> {
                    steps.add(step);
                    results.put("status", step.containsKey("error") ? "error" : "success");
                    results.put("cycleEnd", LocalDateTime.now().format(DATE_FORMATTER));
                    return auditLogService.record(CYCLE_AUDIT_ACTION, AuditLogService.ENTITY_ACCOUNT, null,
                                    "status=" + results.get("status") + ", steps=" + steps.size(),
                                    step.containsKey("error") ? AuditSeverity.WARNING : AuditSeverity.INFO)
                            .thenReturn(results);
                });
    }

    @Override
    public Mono<Map<String, Object>> start() {
        return settingsService.setAutomationEnabled(true)
                .map(settings -> toggleResponse("started", settings));
    }

    @Override
    public Mono<Map<String, Object>> stop() {
        return settingsService.setAutomationEnabled(false)
                .map(settings -> toggleResponse("stopped", settings));
    }

    private static Map<String, Object> toggleResponse(String status, OptimizationSettings settings) {
        Map<String, Object> response = new HashMap<>();
        response.put("status", status);
        response.put("automationEnabled", settings.isAutomationEnabled());
        return response;
    }

    @Override
    public Mono<Map<String, Object>> status() {
        return Mono.zip(
                        settingsService.getSettings().defaultIfEmpty(OptimizationSettings.defaults()),
                        auditLogService.lastOf(CampaignOptimizerServiceImpl.PASS_AUDIT_ACTION)
                                .map(Optional::of)
                                .defaultIfEmpty(Optional.empty()))
                .map(tuple -> {
                    OptimizationSettings settings = tuple.getT1();
                    Optional<AuditLogEntry> lastPass = tuple.getT2();

                    Map<String, Object> response = new HashMap<>();
                    response.put("automationEnabled", settings.isAutomationEnabled());
                    response.put("lastOptimization", lastPass
                            .map(entry -> entry.getCreatedAt().format(DATE_FORMATTER))
                            .orElse(null));
                    response.put("settings", settings.toMap());
                    return response;
                });
    }
}
