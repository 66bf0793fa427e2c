package com.autosem.digital.process.optimizer.domain.exception;

/**
 * No se pudo cargar la configuración o el conjunto de campañas al inicio de la pasada.
 */
public class OptimizationPreconditionException extends RuntimeException {

    public OptimizationPreconditionException(String message) {
        super(message);
    }

    public OptimizationPreconditionException(String message, Throwable cause) {
        super(message, cause);
    }
}
