package com.autosem.digital.process.optimizer.domain.port.service;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Ciclo de automatización controlado por el indicador persistido {@code automation_enabled}.
 */
public interface AutomationService {

    Mono<Map<String, Object>> runCycle();

    Mono<Map<String, Object>> start();

    Mono<Map<String, Object>> stop();

    Mono<Map<String, Object>> status();
}
