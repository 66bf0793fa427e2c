package com.autosem.digital.process.optimizer.domain.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

@AllArgsConstructor
@NoArgsConstructor
@Data
@Builder
@Document(collection = "optimization_execution_logs")
public class OptimizationExecution {
    @Id
    private String id;
    private String operation;       // optimize_all, evaluate_ab_tests, auto_optimize_ab_tests
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private Long durationMs;
    private Integer itemsProcessed;
    private String status;          // RUNNING, SUCCESS, ERROR
    private String errorMessage;
}
