/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;

/**
 * Report severity of a rule, ordered {@code INFO < WARNING < ERROR}.
 */
public enum Severity {
    INFO("Info"),
    WARNING("Warning"),
    ERROR("Error");

    private static final Map<String, String> ALIASES = Map.of("WARN", "WARNING");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    /**
     * Parses a severity cell. Matching is case-insensitive and ignores surrounding
     * whitespace; {@code Warn} is accepted for {@code Warning}. Anything else,
     * including null and non-string cells, is {@link #ERROR}.
     */
    public static Severity parse(Object value) {
        if (!(value instanceof String text)) {
            return ERROR;
        }
        String normalized = text.trim().toUpperCase(Locale.ROOT);
        normalized = ALIASES.getOrDefault(normalized, normalized);
        for (Severity severity : values()) {
            if (severity.name().equals(normalized)) {
                return severity;
            }
        }
        return ERROR;
    }

    public boolean isAtLeast(Severity threshold) {
        return compareTo(threshold) >= 0;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
