package com.autosem.digital.process.optimizer.domain.DTO;

import com.autosem.digital.process.optimizer.domain.model.Campaign;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Métricas acumuladas de una campaña y sus derivadas (CTR, tasa de conversión, ROAS, CPC).
 * Los contadores nulos se tratan como cero.
 */
@Getter
@AllArgsConstructor
@ToString
public class PerformanceSnapshot {
    private final long impressions;
    private final long clicks;
    private final long conversions;
    private final double spend;
    private final double revenue;

    public static PerformanceSnapshot of(Campaign campaign) {
        return new PerformanceSnapshot(
                orZero(campaign.getImpressions()),
                orZero(campaign.getClicks()),
                orZero(campaign.getConversions()),
                orZero(campaign.getSpend()),
                orZero(campaign.getRevenue()));
    }

    public double getCtr() {
        return impressions > 0 ? (double) clicks / impressions : 0.0;
    }

    public double getConversionRate() {
        return clicks > 0 ? (double) conversions / clicks : 0.0;
    }

    public double getRoas() {
        return spend > 0 ? revenue / spend : 0.0;
    }

    public double getCpc() {
        return clicks > 0 ? spend / clicks : 0.0;
    }

    private static long orZero(Long value) {
        return value != null ? value : 0L;
    }

    private static double orZero(BigDecimal value) {
        return value != null ? value.doubleValue() : 0.0;
    }
}
