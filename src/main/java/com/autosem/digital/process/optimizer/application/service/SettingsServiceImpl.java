package com.autosem.digital.process.optimizer.application.service;

import com.autosem.digital.process.optimizer.domain.DTO.OptimizationSettings;
import com.autosem.digital.process.optimizer.domain.entity.AuditSeverity;
import com.autosem.digital.process.optimizer.domain.exception.InvalidSettingException;
import com.autosem.digital.process.optimizer.domain.model.Setting;
import com.autosem.digital.process.optimizer.domain.port.repository.SettingRepository;
import com.autosem.digital.process.optimizer.domain.port.service.AuditLogService;
import com.autosem.digital.process.optimizer.domain.port.service.SettingsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuración de la cuenta guardada como pares clave/valor en la colección {@code settings}.
 * Las claves ausentes, ilegibles, negativas o no finitas toman el valor por defecto.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SettingsServiceImpl implements SettingsService {

    private static final List<String> NUMERIC_KEYS = List.of(
            OptimizationSettings.DAILY_SPEND_LIMIT,
            OptimizationSettings.MONTHLY_SPEND_LIMIT,
            OptimizationSettings.MIN_ROAS_THRESHOLD,
            OptimizationSettings.EMERGENCY_PAUSE_LOSS);

    private final SettingRepository settingRepository;
    private final AuditLogService auditLogService;

    @Override
    public Mono<OptimizationSettings> getSettings() {
        return settingRepository.findAll()
                .filter(setting -> setting.getKey() != null && setting.getValue() != null)
                .collectMap(Setting::getKey, Setting::getValue)
                .map(SettingsServiceImpl::toSnapshot);
    }

    @Override
    public Mono<OptimizationSettings> updateSettings(Map<String, Object> values) {
        Map<String, String> normalized;
        try {
            normalized = validate(values);
        } catch (InvalidSettingException e) {
            return Mono.error(e);
        }

        return Flux.fromIterable(normalized.entrySet())
                .concatMap(entry -> upsert(entry.getKey(), entry.getValue()))
                .then(auditLogService.record("SETTINGS_UPDATED", AuditLogService.ENTITY_ACCOUNT, null,
                        normalized.toString(), AuditSeverity.INFO))
                .then(getSettings())
                .doOnNext(settings -> log.info("Configuración actualizada: {}", normalized.keySet()));
    }

    @Override
    public Mono<OptimizationSettings> setAutomationEnabled(boolean enabled) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(OptimizationSettings.AUTOMATION_ENABLED, enabled);
        return updateSettings(values);
    }

    private Mono<Setting> upsert(String key, String value) {
        return settingRepository.findByKey(key)
                .defaultIfEmpty(Setting.builder().key(key).build())
                .flatMap(setting -> {
                    setting.setValue(value);
                    setting.setUpdatedDate(LocalDateTime.now());
                    return settingRepository.save(setting);
                });
    }

    static Map<String, String> validate(Map<String, Object> values) {
        if (values == null || values.isEmpty()) {
            throw new InvalidSettingException("No settings provided");
        }
        Map<String, String> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            String key = entry.getKey();
            Object raw = entry.getValue();
            if (NUMERIC_KEYS.contains(key)) {
                double number = parseNumber(key, raw);
                if (!Double.isFinite(number)) {
                    throw new InvalidSettingException(key + " must be a finite number");
                }
                if (number < 0) {
                    throw new InvalidSettingException(key + " must be greater than or equal to 0");
                }
                normalized.put(key, String.valueOf(number));
            } else if (OptimizationSettings.AUTOMATION_ENABLED.equals(key)) {
                normalized.put(key, String.valueOf(parseBoolean(key, raw)));
            } else {
                throw new InvalidSettingException("Unknown setting: " + key);
            }
        }
        return normalized;
    }

    static OptimizationSettings toSnapshot(Map<String, String> stored) {
        return OptimizationSettings.builder()
                .dailySpendLimit(readDouble(stored, OptimizationSettings.DAILY_SPEND_LIMIT,
                        OptimizationSettings.DEFAULT_DAILY_SPEND_LIMIT))
                .monthlySpendLimit(readDouble(stored, OptimizationSettings.MONTHLY_SPEND_LIMIT,
                        OptimizationSettings.DEFAULT_MONTHLY_SPEND_LIMIT))
                .minRoasThreshold(readDouble(stored, OptimizationSettings.MIN_ROAS_THRESHOLD,
                        OptimizationSettings.DEFAULT_MIN_ROAS_THRESHOLD))
                .emergencyPauseLoss(readDouble(stored, OptimizationSettings.EMERGENCY_PAUSE_LOSS,
                        OptimizationSettings.DEFAULT_EMERGENCY_PAUSE_LOSS))
                .automationEnabled(!"false".equalsIgnoreCase(stored.get(OptimizationSettings.AUTOMATION_ENABLED)))
                .build();
    }

    private static double readDouble(Map<String, String> stored, String key, double defaultValue) {
        String value = stored.get(key);
        if (value == null) {
            return defaultValue;
        }
        double number;
        try {
            number = Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Valor no numérico para {}: '{}', se usa {}", key, value, defaultValue);
            return defaultValue;
        }
        if (!Double.isFinite(number) || number < 0) {
            log.warn("Valor fuera de rango para {}: '{}', se usa {}", key, value, defaultValue);
            return defaultValue;
        }
        return number;
    }

    private static double parseNumber(String key, Object raw) {
        if (raw instanceof Number) {
            return ((Number) raw).doubleValue();
        }
        if (raw instanceof String) {
            try {
                return Double.parseDouble(((String) raw).trim());
            } catch (NumberFormatException e) {
                throw new InvalidSettingException(key + " must be numeric");
            }
        }
        throw new InvalidSettingException(key + " must be numeric");
    }

    private static boolean parseBoolean(String key, Object raw) {
        if (raw instanceof Boolean) {
            return (Boolean) raw;
        }
        if (raw instanceof String) {
            String text = ((String) raw).trim();
            if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
                return Boolean.parseBoolean(text);
            }
        }
        throw new InvalidSettingException(key + " must be true or false");
    }
}
