package com.autosem.digital.process.optimizer.application.service.rule;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Umbrales y límites de presupuesto de las reglas por campaña. Los montos están en dólares.
 */
public final class BudgetPolicy {

    public static final long MIN_IMPRESSIONS_FOR_DECISION = 100;
    public static final long MIN_CLICKS_FOR_DECISION = 10;

    public static final BigDecimal MIN_DAILY_BUDGET = new BigDecimal("3.00");
    public static final BigDecimal MAX_DAILY_BUDGET = new BigDecimal("50.00");
    public static final BigDecimal SCALE_WINNER_CAP = new BigDecimal("25.00");
    public static final BigDecimal DEFAULT_DAILY_BUDGET = new BigDecimal("10.00");

    public static final BigDecimal BUDGET_INCREASE_FACTOR = new BigDecimal("1.25");
    public static final BigDecimal BUDGET_DECREASE_FACTOR = new BigDecimal("0.75");
    public static final BigDecimal SCALE_WINNER_FACTOR = new BigDecimal("1.20");

    public static final double LOW_CTR_THRESHOLD = 0.005;
    public static final double HIGH_CTR_THRESHOLD = 0.03;
    public static final double LOW_CONVERSION_RATE = 0.01;

    private BudgetPolicy() {
    }

    public static BigDecimal orDefault(BigDecimal dailyBudget) {
        return dailyBudget != null ? round(dailyBudget) : DEFAULT_DAILY_BUDGET;
    }

    /**
     * Todo cambio de presupuesto de una regla queda en [MIN_DAILY_BUDGET, MAX_DAILY_BUDGET].
     */
    public static BigDecimal clamp(BigDecimal amount) {
        return round(amount.max(MIN_DAILY_BUDGET).min(MAX_DAILY_BUDGET));
    }

    public static BigDecimal increase(BigDecimal current, BigDecimal factor, BigDecimal cap) {
        return clamp(current.multiply(factor).min(cap));
    }

    public static BigDecimal decrease(BigDecimal current, BigDecimal factor) {
        return clamp(current.multiply(factor).max(MIN_DAILY_BUDGET));
    }

    public static BigDecimal round(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP);
    }
}
