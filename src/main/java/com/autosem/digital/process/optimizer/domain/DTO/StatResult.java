package com.autosem.digital.process.optimizer.domain.DTO;

import com.autosem.digital.process.optimizer.domain.model.TestWinner;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Resultado de la prueba z de dos proporciones sobre el CTR de ambos brazos.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatResult {
    private ArmStats original;
    private ArmStats variant;
    private double zScore;
    private double pValue;
    private double confidence;
    private boolean significant;
    private TestWinner winner;
    private boolean minImpressionsMet;
}
