package com.autosem.digital.process.optimizer.domain.model;

public enum ABTestStatus {
    RUNNING,
    WINNER_ORIGINAL,
    WINNER_VARIANT,
    ERROR
}
