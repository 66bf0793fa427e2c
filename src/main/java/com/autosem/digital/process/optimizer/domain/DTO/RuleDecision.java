package com.autosem.digital.process.optimizer.domain.DTO;

import com.autosem.digital.process.optimizer.domain.entity.AuditSeverity;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Decisión producida por una regla para una campaña. Sólo las mutaciones
 * PAUSE y SET_BUDGET llegan a la plataforma.
 */
@Getter
@AllArgsConstructor
@ToString
public class RuleDecision {

    public enum Mutation {
        NONE,
        PAUSE,
        SET_BUDGET
    }

    private final String action;
    private final String reason;
    private final Mutation mutation;
    private final BigDecimal previousBudget;
    private final BigDecimal newBudget;
    private final AuditSeverity severity;

    public static RuleDecision info(String action, String reason) {
        return new RuleDecision(action, reason, Mutation.NONE, null, null, AuditSeverity.INFO);
    }

    public static RuleDecision flag(String action, String reason) {
        return new RuleDecision(action, reason, Mutation.NONE, null, null, AuditSeverity.WARNING);
    }

    public static RuleDecision pause(String action, String reason) {
        return new RuleDecision(action, reason, Mutation.PAUSE, null, null, AuditSeverity.WARNING);
    }

    public static RuleDecision budget(String action, String reason, BigDecimal previousBudget, BigDecimal newBudget) {
        return new RuleDecision(action, reason, Mutation.SET_BUDGET, previousBudget, newBudget, AuditSeverity.INFO);
    }

    public boolean isMutation() {
        return mutation != Mutation.NONE;
    }
}
