package com.autosem.digital.process.optimizer.domain.port.service;

import com.autosem.digital.process.optimizer.domain.entity.AuditLogEntry;
import com.autosem.digital.process.optimizer.domain.entity.AuditSeverity;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface AuditLogService {

    String ENTITY_CAMPAIGN = "campaign";
    String ENTITY_AB_TEST = "ab_test";
    String ENTITY_ACCOUNT = "account";

    /**
     * Inserta una entrada. Un fallo al escribir se registra en el log y no se propaga.
     */
    Mono<AuditLogEntry> record(String action, String entityType, String entityId,
                               String details, AuditSeverity severity);

    Flux<AuditLogEntry> recent(int limit, String entityType);

    Mono<AuditLogEntry> lastOf(String action);
}
