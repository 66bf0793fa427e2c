package com.autosem.digital.process.optimizer.domain.entity;

public enum AuditSeverity {
    INFO,
    WARNING,
    CRITICAL
}
