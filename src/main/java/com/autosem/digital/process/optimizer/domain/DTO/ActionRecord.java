package com.autosem.digital.process.optimizer.domain.DTO;

import com.autosem.digital.process.optimizer.domain.entity.AuditSeverity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionRecord {
    private String campaignId;      // nulo para acciones de cuenta
    private String campaignName;
    private String action;
    private String reason;
    private boolean executed;
    private String detail;
    private AuditSeverity severity;
}
