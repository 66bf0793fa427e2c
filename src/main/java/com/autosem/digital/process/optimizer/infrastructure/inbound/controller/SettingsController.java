package com.autosem.digital.process.optimizer.infrastructure.inbound.controller;

import com.autosem.digital.process.optimizer.domain.port.service.SettingsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Controlador REST para la configuración de la cuenta
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/settings")
@RequiredArgsConstructor
public class SettingsController {

    private final SettingsService settingsService;

    @GetMapping
    public Mono<Map<String, Object>> getSettings() {
        return settingsService.getSettings()
                .map(settings -> settings.toMap());
    }

    @PutMapping
    public Mono<Map<String, Object>> updateSettings(@RequestBody Map<String, Object> values) {
        log.info("Actualizando configuración: {}", values.keySet());
        return settingsService.updateSettings(values)
                .map(settings -> settings.toMap());
    }
}
