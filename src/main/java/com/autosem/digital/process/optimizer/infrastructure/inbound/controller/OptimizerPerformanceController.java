package com.autosem.digital.process.optimizer.infrastructure.inbound.controller;

import com.autosem.digital.process.optimizer.infrastructure.config.PerformanceMonitor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;

/**
 * Controlador para consultar los tiempos de las llamadas a plataformas
 */
@RestController
@RequestMapping("/api/v1/optimizer/metrics")
@Slf4j
@RequiredArgsConstructor
public class OptimizerPerformanceController {

    private final PerformanceMonitor performanceMonitor;
    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    @GetMapping("/performance")
    public ResponseEntity<Map<String, Object>> getPerformanceStatistics() {
        log.info("Solicitando estadísticas de rendimiento");

        Map<String, Object> response = new HashMap<>();
        response.put("timestamp", LocalDateTime.now().format(DATE_FORMATTER));
        response.put("statistics", performanceMonitor.getPerformanceStatistics());

        return ResponseEntity.ok(response);
    }

    @PostMapping("/performance/reset")
    public ResponseEntity<Map<String, Object>> resetStatistics() {
        log.info("Reseteando estadísticas de rendimiento");

        performanceMonitor.resetStatistics();

        Map<String, Object> response = new HashMap<>();
        response.put("timestamp", LocalDateTime.now().format(DATE_FORMATTER));
        response.put("message", "Estadísticas de rendimiento reseteadas correctamente");

        return ResponseEntity.ok(response);
    }
}
