package com.autosem.digital.process.optimizer.domain.model;

/**
 * Estado de sincronización con la plataforma, independiente de la decisión
 * estadística registrada en la prueba A/B.
 */
public enum SyncStatus {
    PENDING,
    SYNCED,
    PARTIAL,
    FAILED
}
