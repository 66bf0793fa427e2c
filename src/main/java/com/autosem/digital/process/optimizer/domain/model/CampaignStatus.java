package com.autosem.digital.process.optimizer.domain.model;

public enum CampaignStatus {
    DRAFT,
    ACTIVE,
    PAUSED,
    REMOVED
}
