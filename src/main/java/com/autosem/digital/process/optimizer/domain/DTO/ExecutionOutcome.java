package com.autosem.digital.process.optimizer.domain.DTO;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Resultado de aplicar una acción en la plataforma. {@code executed=false} distingue
 * "decidido" de "aplicado remotamente".
 */
@Getter
@AllArgsConstructor
@ToString
public class ExecutionOutcome {
    private final boolean executed;
    private final String detail;

    public static ExecutionOutcome success(String detail) {
        return new ExecutionOutcome(true, detail);
    }

    public static ExecutionOutcome failed(String detail) {
        return new ExecutionOutcome(false, detail);
    }

    public static ExecutionOutcome notAttempted(String detail) {
        return new ExecutionOutcome(false, detail);
    }
}
