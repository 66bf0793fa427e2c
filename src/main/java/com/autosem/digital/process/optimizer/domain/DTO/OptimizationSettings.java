package com.autosem.digital.process.optimizer.domain.DTO;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fotografía inmutable de la configuración de la cuenta. Se carga una vez por pasada
 * y no cambia durante ella.
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor
@ToString
public class OptimizationSettings {

    public static final String DAILY_SPEND_LIMIT = "daily_spend_limit";
    public static final String MONTHLY_SPEND_LIMIT = "monthly_spend_limit";
    public static final String MIN_ROAS_THRESHOLD = "min_roas_threshold";
    public static final String EMERGENCY_PAUSE_LOSS = "emergency_pause_loss";
    public static final String AUTOMATION_ENABLED = "automation_enabled";

    public static final double DEFAULT_DAILY_SPEND_LIMIT = 200.0;
    public static final double DEFAULT_MONTHLY_SPEND_LIMIT = 5000.0;
    public static final double DEFAULT_MIN_ROAS_THRESHOLD = 1.5;
    public static final double DEFAULT_EMERGENCY_PAUSE_LOSS = 500.0;

    private final double dailySpendLimit;
    private final double monthlySpendLimit;
    private final double minRoasThreshold;
    private final double emergencyPauseLoss;
    private final boolean automationEnabled;

    public static OptimizationSettings defaults() {
        return new OptimizationSettings(
                DEFAULT_DAILY_SPEND_LIMIT,
                DEFAULT_MONTHLY_SPEND_LIMIT,
                DEFAULT_MIN_ROAS_THRESHOLD,
                DEFAULT_EMERGENCY_PAUSE_LOSS,
                true);
    }

    /**
     * Modo awareness: sin umbral de ROAS no se pausa por ROAS. Los ajustes de presupuesto
     * por ROAS siguen activos.
     */
    public boolean isAwarenessMode() {
        return minRoasThreshold <= 0;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(DAILY_SPEND_LIMIT, dailySpendLimit);
        map.put(MONTHLY_SPEND_LIMIT, monthlySpendLimit);
        map.put(MIN_ROAS_THRESHOLD, minRoasThreshold);
        map.put(EMERGENCY_PAUSE_LOSS, emergencyPauseLoss);
        map.put(AUTOMATION_ENABLED, automationEnabled);
        return map;
    }
}
