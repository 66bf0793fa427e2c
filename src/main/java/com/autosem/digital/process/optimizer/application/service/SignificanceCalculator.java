package com.autosem.digital.process.optimizer.application.service;

import com.autosem.digital.process.optimizer.domain.DTO.AdInsights;
import com.autosem.digital.process.optimizer.domain.DTO.ArmStats;
import com.autosem.digital.process.optimizer.domain.DTO.StatResult;
import com.autosem.digital.process.optimizer.domain.model.TestWinner;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Prueba z de dos proporciones sobre el CTR del anuncio original y su variante.
 * El p-valor es de dos colas y usa la aproximación de Abramowitz y Stegun (26.2.17)
 * para la normal acumulada.
 */
@Component
public class SignificanceCalculator {

    public static final double CONFIDENCE_THRESHOLD = 95.0;
    public static final long MIN_IMPRESSIONS_PER_ARM = 1000;

    private static final double P = 0.2316419;
    private static final double B1 = 0.319381530;
    private static final double B2 = -0.356563782;
    private static final double B3 = 1.781477937;
    private static final double B4 = -1.821255978;
    private static final double B5 = 1.330274429;
    private static final double INV_SQRT_2PI = 0.3989422804014327;

    public StatResult compute(AdInsights original, AdInsights variant) {
        ArmStats originalArm = arm(original);
        ArmStats variantArm = arm(variant);
        boolean minImpressionsMet = original.getImpressions() >= MIN_IMPRESSIONS_PER_ARM
                && variant.getImpressions() >= MIN_IMPRESSIONS_PER_ARM;

        if (original.getImpressions() == 0 || variant.getImpressions() == 0) {
            return inconclusive(originalArm, variantArm, minImpressionsMet);
        }

        double pooled = (double) (original.getClicks() + variant.getClicks())
                / (original.getImpressions() + variant.getImpressions());
        if (pooled <= 0.0 || pooled >= 1.0) {
            return inconclusive(originalArm, variantArm, minImpressionsMet);
        }

        double se = Math.sqrt(pooled * (1 - pooled)
                * (1.0 / original.getImpressions() + 1.0 / variant.getImpressions()));
        double z = (variantArm.getCtr() - originalArm.getCtr()) / se;
        double pValue = 2 * (1 - normalCdf(Math.abs(z)));
        double confidence = round((1 - pValue) * 100, 2);
        boolean significant = confidence >= CONFIDENCE_THRESHOLD;

        TestWinner winner = TestWinner.INCONCLUSIVE;
        if (significant && z > 0) {
            winner = TestWinner.VARIANT;
        } else if (significant && z < 0) {
            winner = TestWinner.ORIGINAL;
        }

        return StatResult.builder()
                .original(originalArm)
                .variant(variantArm)
                .zScore(round(z, 4))
                .pValue(pValue)
                .confidence(confidence)
                .significant(significant)
                .winner(winner)
                .minImpressionsMet(minImpressionsMet)
                .build();
    }

    /**
     * Φ(x) para x ≥ 0.
     */
    static double normalCdf(double x) {
        double t = 1.0 / (1.0 + P * x);
        double d = INV_SQRT_2PI * Math.exp(-x * x / 2);
        double poly = t * (B1 + t * (B2 + t * (B3 + t * (B4 + t * B5))));
        return 1 - d * poly;
    }

    private static StatResult inconclusive(ArmStats original, ArmStats variant, boolean minImpressionsMet) {
        return StatResult.builder()
                .original(original)
                .variant(variant)
                .zScore(0)
                .pValue(1)
                .confidence(0)
                .significant(false)
                .winner(TestWinner.INCONCLUSIVE)
                .minImpressionsMet(minImpressionsMet)
                .build();
    }

    private static ArmStats arm(AdInsights insights) {
        double ctr = insights.getImpressions() > 0
                ? (double) insights.getClicks() / insights.getImpressions()
                : 0.0;
        return new ArmStats(insights.getImpressions(), insights.getClicks(), ctr);
    }

    private static double round(double value, int decimals) {
        return BigDecimal.valueOf(value).setScale(decimals, RoundingMode.HALF_UP).doubleValue();
    }
}
