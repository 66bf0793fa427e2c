package com.autosem.digital.process.optimizer.domain.DTO;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AutoOptimizeResult {
    private int optimizedCount;
    private List<TestResult> optimized;
    private List<SkipReason> skipped;
}
