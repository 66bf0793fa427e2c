package com.autosem.digital.process.optimizer.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TestWinner {
    ORIGINAL,
    VARIANT,
    INCONCLUSIVE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
