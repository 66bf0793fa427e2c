package com.autosem.digital.process.optimizer.application.service.rule;

/**
 * Resultado de aplicar una regla: TERMINAL detiene la evaluación de la campaña.
 */
public enum RuleOutcome {
    CONTINUE,
    TERMINAL
}
