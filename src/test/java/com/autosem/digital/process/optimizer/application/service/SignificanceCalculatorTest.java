package com.autosem.digital.process.optimizer.application.service;

import com.autosem.digital.process.optimizer.domain.DTO.AdInsights;
import com.autosem.digital.process.optimizer.domain.DTO.StatResult;
import com.autosem.digital.process.optimizer.domain.model.TestWinner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SignificanceCalculatorTest {

    private final SignificanceCalculator calculator = new SignificanceCalculator();

    @Test
    @DisplayName("30/1200 contra 55/1200 da una variante ganadora con confianza mayor a 99%")
    void variantWinsWithHighConfidence() {
        StatResult result = calculator.compute(new AdInsights(1200, 30), new AdInsights(1200, 55));

        assertThat(result.getOriginal().getCtr()).isCloseTo(0.025, within(1e-9));
        assertThat(result.getVariant().getCtr()).isCloseTo(0.0458, within(1e-4));
        assertThat(result.getZScore()).isCloseTo(2.76, within(0.01));
        assertThat(result.getConfidence()).isBetween(99.0, 99.9);
        assertThat(result.isSignificant()).isTrue();
        assertThat(result.isMinImpressionsMet()).isTrue();
        assertThat(result.getWinner()).isEqualTo(TestWinner.VARIANT);
    }

    @Test
    @DisplayName("Intercambiar los brazos conserva |z| e invierte el ganador")
    void swappingArmsIsSymmetric() {
        StatResult forward = calculator.compute(new AdInsights(1200, 30), new AdInsights(1200, 55));
        StatResult swapped = calculator.compute(new AdInsights(1200, 55), new AdInsights(1200, 30));

        assertThat(swapped.getZScore()).isCloseTo(-forward.getZScore(), within(1e-9));
        assertThat(swapped.getConfidence()).isEqualTo(forward.getConfidence());
        assertThat(swapped.getWinner()).isEqualTo(TestWinner.ORIGINAL);
    }

    @Test
    @DisplayName("Un brazo sin impresiones es inconcluso")
    void zeroImpressionsIsInconclusive() {
        StatResult result = calculator.compute(new AdInsights(0, 0), new AdInsights(1500, 60));

        assertThat(result.isSignificant()).isFalse();
        assertThat(result.getWinner()).isEqualTo(TestWinner.INCONCLUSIVE);
        assertThat(result.getConfidence()).isZero();
        assertThat(result.isMinImpressionsMet()).isFalse();
    }

    @Test
    @DisplayName("Sin clics en ningún brazo la tasa combinada es cero y el resultado inconcluso")
    void zeroPooledRateIsInconclusive() {
        StatResult result = calculator.compute(new AdInsights(2000, 0), new AdInsights(2000, 0));

        assertThat(result.getWinner()).isEqualTo(TestWinner.INCONCLUSIVE);
        assertThat(result.isMinImpressionsMet()).isTrue();
    }

    @Test
    @DisplayName("Con 400 impresiones por brazo no se alcanza el mínimo")
    void smallSampleDoesNotMeetMinimum() {
        StatResult result = calculator.compute(new AdInsights(400, 5), new AdInsights(400, 30));

        assertThat(result.isMinImpressionsMet()).isFalse();
        assertThat(result.isSignificant()).isTrue();
    }

    @Test
    @DisplayName("CTR iguales no son significativos")
    void equalRatesAreNotSignificant() {
        StatResult result = calculator.compute(new AdInsights(5000, 100), new AdInsights(5000, 100));

        assertThat(result.getZScore()).isZero();
        assertThat(result.isSignificant()).isFalse();
        assertThat(result.getWinner()).isEqualTo(TestWinner.INCONCLUSIVE);
    }

    @Test
    @DisplayName("La normal acumulada aproxima los valores de tabla")
    void normalCdfMatchesTable() {
        assertThat(SignificanceCalculator.normalCdf(0)).isCloseTo(0.5, within(1e-6));
        assertThat(SignificanceCalculator.normalCdf(1.96)).isCloseTo(0.975, within(1e-4));
        assertThat(SignificanceCalculator.normalCdf(3.0)).isCloseTo(0.99865, within(1e-4));
    }
}
