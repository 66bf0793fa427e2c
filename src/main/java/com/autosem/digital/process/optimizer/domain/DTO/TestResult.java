package com.autosem.digital.process.optimizer.domain.DTO;

import com.autosem.digital.process.optimizer.domain.model.ABTestStatus;
import com.autosem.digital.process.optimizer.domain.model.TestWinner;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TestResult {
    private String testId;
    private String testName;
    private ABTestStatus status;
    private ArmStats original;
    private ArmStats variant;
    private double zScore;
    private double confidence;
    private boolean significant;
    private TestWinner winner;
    private boolean minImpressionsMet;
    private String error;

    public static TestResult of(String testId, String testName, ABTestStatus status, StatResult stat) {
        return TestResult.builder()
                .testId(testId)
                .testName(testName)
                .status(status)
                .original(stat.getOriginal())
                .variant(stat.getVariant())
                .zScore(stat.getZScore())
                .confidence(stat.getConfidence())
                .significant(stat.isSignificant())
                .winner(stat.getWinner())
                .minImpressionsMet(stat.isMinImpressionsMet())
                .build();
    }

    public static TestResult failed(String testId, String testName, String error) {
        return TestResult.builder()
                .testId(testId)
                .testName(testName)
                .status(ABTestStatus.ERROR)
                .winner(TestWinner.INCONCLUSIVE)
                .error(error)
                .build();
    }
}
