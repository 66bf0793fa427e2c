package com.autosem.digital.process.optimizer.application.service;

import com.autosem.digital.process.optimizer.domain.entity.AuditLogEntry;
import com.autosem.digital.process.optimizer.domain.entity.AuditSeverity;
import com.autosem.digital.process.optimizer.domain.port.repository.AuditLogRepository;
import com.autosem.digital.process.optimizer.domain.port.service.AuditLogService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Service
@Slf4j
@RequiredArgsConstructor
public class AuditLogServiceImpl implements AuditLogService {

    static final int MAX_LIMIT = 500;

    private final AuditLogRepository auditLogRepository;

    @Override
    public Mono<AuditLogEntry> record(String action, String entityType, String entityId,
                                      String details, AuditSeverity severity) {
        AuditLogEntry entry = AuditLogEntry.builder()
                .action(action)
                .entityType(entityType)
                .entityId(entityId)
                .details(details)
                .severity(severity != null ? severity : AuditSeverity.INFO)
                .createdAt(LocalDateTime.now())
                .build();

        if (entry.getSeverity() == AuditSeverity.CRITICAL) {
            log.error("AUDITORÍA CRÍTICA [{}] {} {}: {}", action, entityType, entityId, details);
        }

        return auditLogRepository.save(entry)
                .onErrorResume(error -> {
                    log.error("No se pudo registrar la auditoría {} para {} {}: {}",
                            action, entityType, entityId, error.getMessage());
                    return Mono.empty();
                });
    }

    @Override
    public Flux<AuditLogEntry> recent(int limit, String entityType) {
        int boundedLimit = Math.max(1, Math.min(limit, MAX_LIMIT));
        PageRequest page = PageRequest.of(0, boundedLimit);
        if (StringUtils.hasText(entityType)) {
            return auditLogRepository.findByEntityTypeOrderByCreatedAtDesc(entityType, page);
        }
        return auditLogRepository.findAllByOrderByCreatedAtDesc(page);
    }

    @Override
    public Mono<AuditLogEntry> lastOf(String action) {
        return auditLogRepository.findFirstByActionOrderByCreatedAtDesc(action);
    }
}
