package com.autosem.digital.process.optimizer.domain.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

/**
 * Registro de auditoría de sólo inserción. Guarda tanto las decisiones del motor
 * como el resultado de las llamadas a las plataformas.
 */
@AllArgsConstructor
@NoArgsConstructor
@Data
@Builder
@Document(collection = "audit_log")
public class AuditLogEntry {
    @Id
    private String id;
    private String action;
    private String entityType;      // campaign, ab_test, account
    private String entityId;
    private String details;
    private AuditSeverity severity;
    private LocalDateTime createdAt;
}
