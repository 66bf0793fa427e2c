package com.autosem.digital.process.optimizer.infrastructure.config;

import com.autosem.digital.process.optimizer.domain.entity.OptimizationExecution;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Registra el inicio y fin de cada pasada (optimización, evaluación y auto-optimización
 * de pruebas A/B) y guarda un documento por ejecución en {@code optimization_execution_logs}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OptimizationExecutionLogger {

    private final ReactiveMongoTemplate mongoTemplate;

    public OptimizationExecution logExecutionStart(String operation) {
        log.info("Inicio de ejecución - operación: {}", operation);

        return OptimizationExecution.builder()
                .operation(operation)
                .startTime(LocalDateTime.now())
                .status("RUNNING")
                .build();
    }

    public void logExecutionSuccess(OptimizationExecution execution, int itemsProcessed) {
        LocalDateTime endTime = LocalDateTime.now();
        Duration duration = Duration.between(execution.getStartTime(), endTime);

        log.info("Ejecución exitosa - operación: {}, elementos: {}, duración: {} ms",
                execution.getOperation(), itemsProcessed, duration.toMillis());

        execution.setEndTime(endTime);
        execution.setDurationMs(duration.toMillis());
        execution.setItemsProcessed(itemsProcessed);
        execution.setStatus("SUCCESS");
        saveExecution(execution);
    }

    public void logExecutionError(OptimizationExecution execution, Throwable error) {
        LocalDateTime endTime = LocalDateTime.now();
        Duration duration = Duration.between(execution.getStartTime(), endTime);

        log.error("Error en ejecución - operación: {}, error: {}, duración: {} ms",
                execution.getOperation(), error.getMessage(), duration.toMillis());

        execution.setEndTime(endTime);
        execution.setDurationMs(duration.toMillis());
        execution.setErrorMessage(error.getMessage());
        execution.setStatus("ERROR");
        saveExecution(execution);
    }

    private void saveExecution(OptimizationExecution execution) {
        mongoTemplate.save(execution)
                .subscribe(
                        saved -> log.debug("Ejecución registrada: {}", saved.getId()),
                        error -> log.error("Error al guardar el registro de ejecución: {}", error.getMessage())
                );
    }
}
