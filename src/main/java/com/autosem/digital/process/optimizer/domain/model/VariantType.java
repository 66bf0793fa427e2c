package com.autosem.digital.process.optimizer.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Elemento creativo que cambia entre el anuncio original y su variante.
 */
public enum VariantType {
    HEADLINE,
    IMAGE,
    CTA;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<VariantType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.value().equals(value.trim().toLowerCase(Locale.ROOT)))
                .findFirst();
    }

    public static String allowedValues() {
        return Arrays.stream(values()).map(VariantType::value).collect(Collectors.joining(", "));
    }
}
