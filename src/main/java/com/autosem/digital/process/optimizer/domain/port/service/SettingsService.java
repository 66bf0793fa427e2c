package com.autosem.digital.process.optimizer.domain.port.service;

import com.autosem.digital.process.optimizer.domain.DTO.OptimizationSettings;
import reactor.core.publisher.Mono;

import java.util.Map;

public interface SettingsService {

    /**
     * Configuración actual con valores por defecto para las claves ausentes.
     */
    Mono<OptimizationSettings> getSettings();

    /**
     * Actualización parcial. Las claves desconocidas o los valores no numéricos se rechazan.
     */
    Mono<OptimizationSettings> updateSettings(Map<String, Object> values);

    Mono<OptimizationSettings> setAutomationEnabled(boolean enabled);
}
