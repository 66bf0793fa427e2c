package com.autosem.digital.process.optimizer.infrastructure.inbound.controller;

import com.autosem.digital.process.optimizer.domain.DTO.AutoOptimizeResult;
import com.autosem.digital.process.optimizer.domain.DTO.CreateABTestRequest;
import com.autosem.digital.process.optimizer.domain.model.ABTest;
import com.autosem.digital.process.optimizer.domain.port.service.ABTestService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;

/**
 * Controlador REST para las pruebas A/B
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/ab-tests")
@RequiredArgsConstructor
public class ABTestController {

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ABTestService abTestService;

    @GetMapping("/results")
    public Mono<Map<String, Object>> results(@RequestParam(required = false) String testId) {
        log.info("Evaluando pruebas A/B {}", testId != null ? testId : "en curso");
        return abTestService.evaluateABTests(testId)
                .collectList()
                .map(results -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("timestamp", LocalDateTime.now().format(DATE_FORMATTER));
                    response.put("results", results);
                    return response;
                });
    }

    @PostMapping("/auto-optimize")
    public Mono<AutoOptimizeResult> autoOptimize() {
        log.info("Solicitud de auto-optimización de pruebas A/B");
        return abTestService.autoOptimizeABTests();
    }

    @PostMapping
    public Mono<ResponseEntity<ABTest>> create(@RequestBody CreateABTestRequest request) {
        log.info("Creando prueba A/B {}", request.getTestName());
        return abTestService.createTest(request)
                .map(test -> ResponseEntity.status(HttpStatus.CREATED).body(test));
    }
}
