package com.autosem.digital.process.optimizer.domain.exception;

import com.autosem.digital.process.optimizer.domain.model.Platform;

/**
 * Fallo de una llamada a la API de una plataforma publicitaria
 * (red, autenticación o rechazo de la solicitud).
 */
public class PlatformCallException extends RuntimeException {

    private final Platform platform;

    public PlatformCallException(Platform platform, String message) {
        super(message);
        this.platform = platform;
    }

    public PlatformCallException(Platform platform, String message, Throwable cause) {
        super(message, cause);
        this.platform = platform;
    }

    public Platform getPlatform() {
        return platform;
    }
}
