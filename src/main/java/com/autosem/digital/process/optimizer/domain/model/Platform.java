package com.autosem.digital.process.optimizer.domain.model;

/**
 * Plataformas publicitarias con las que se sincronizan las campañas.
 */
public enum Platform {
    META,
    GOOGLE,
    TIKTOK
}
