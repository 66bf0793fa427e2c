package com.autosem.digital.process.optimizer.infrastructure.inbound.controller;

import com.autosem.digital.process.optimizer.domain.DTO.OptimizationResult;
import com.autosem.digital.process.optimizer.domain.DTO.OptimizationSummary;
import com.autosem.digital.process.optimizer.domain.port.service.AuditLogService;
import com.autosem.digital.process.optimizer.domain.port.service.AutomationService;
import com.autosem.digital.process.optimizer.domain.port.service.CampaignOptimizerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;

/**
 * Controlador que expone el optimizador de campañas a trav&eacute;s de HTTP/Rest<br/>
 * <b>Class</b>: OptimizerController<br/>
 * <b>Copyright</b>: 2025 Digital.<br/>
 * <b>Company</b>: Digital.<br/>
 *
 * <u>Developed by</u>: <br/>
 * <ul>
 * <li>Equipo de Optimización</li>
 * </ul>
 * <u>Changes</u>:<br/>
 * <ul>
 * <li>Mar 10, 2025 Creaci&oacute;n de Clase.</li>
 * <li>Mar 24, 2025 Ciclo de automatizaci&oacute;n y consulta de auditor&iacute;a.</li>
 * </ul>
 * @version 1.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/optimizer")
@RequiredArgsConstructor
public class OptimizerController {

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final CampaignOptimizerService campaignOptimizerService;
    private final AutomationService automationService;
    private final AuditLogService auditLogService;

    @PostMapping("/optimize")
    public Mono<OptimizationResult> optimize() {
        log.info("Solicitud de optimización manual");
        return campaignOptimizerService.optimizeAll();
    }

    @PostMapping("/run-cycle")
    public Mono<Map<String, Object>> runCycle() {
        log.info("Solicitud de ciclo de automatización");
        return automationService.runCycle();
    }

    @GetMapping("/status")
    public Mono<Map<String, Object>> status() {
        return automationService.status();
    }

    @PostMapping("/start")
    public Mono<Map<String, Object>> start() {
        log.info("Activando automatización");
        return automationService.start();
    }

    @PostMapping("/stop")
    public Mono<Map<String, Object>> stop() {
        log.info("Pausando automatización");
        return automationService.stop();
    }

    @GetMapping("/summary")
    public Mono<OptimizationSummary> summary() {
        return campaignOptimizerService.getSummary();
    }

    @GetMapping("/audit")
    public Mono<Map<String, Object>> audit(@RequestParam(defaultValue = "50") int limit,
                                           @RequestParam(required = false) String entityType) {
        return auditLogService.recent(limit, entityType)
                .collectList()
                .map(entries -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("timestamp", LocalDateTime.now().format(DATE_FORMATTER));
                    response.put("count", entries.size());
                    response.put("entries", entries);
                    return response;
                });
    }
}
