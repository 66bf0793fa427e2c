package com.autosem.digital.process.optimizer.infrastructure;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Conversión entre dólares (presupuestos locales) y centavos (unidad de las plataformas).
 */
public final class MoneyUtils {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private MoneyUtils() {
    }

    public static long toCents(BigDecimal amount) {
        if (amount == null) {
            return 0L;
        }
        return amount.multiply(HUNDRED).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    public static BigDecimal fromCents(long cents) {
        return BigDecimal.valueOf(cents).divide(HUNDRED, 2, RoundingMode.HALF_UP);
    }
}
