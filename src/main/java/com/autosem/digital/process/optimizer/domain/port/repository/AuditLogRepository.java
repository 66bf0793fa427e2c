package com.autosem.digital.process.optimizer.domain.port.repository;

import com.autosem.digital.process.optimizer.domain.entity.AuditLogEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Repositorio del registro de auditoría. Sólo se insertan documentos.
 */
@Repository
public interface AuditLogRepository extends ReactiveMongoRepository<AuditLogEntry, String> {

    /**
     * Última entrada registrada para una acción
     */
    Mono<AuditLogEntry> findFirstByActionOrderByCreatedAtDesc(String action);

    /**
     * Entradas más recientes, opcionalmente filtradas por tipo de entidad
     */
    Flux<AuditLogEntry> findAllByOrderByCreatedAtDesc(Pageable pageable);

    Flux<AuditLogEntry> findByEntityTypeOrderByCreatedAtDesc(String entityType, Pageable pageable);
}
