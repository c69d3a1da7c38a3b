/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.config;

import com.verity.modelchecker.core.property.PropertyMatchMode;
import com.verity.modelchecker.model.Severity;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * User-facing run configuration.
 *
 * Configuration via environment variables or system properties (environment wins):
 * - CHECKER_SPREADSHEET_URL / checker.spreadsheet.url: rule table location (required)
 * - CHECKER_MINIMUM_SEVERITY / checker.minimum.severity: Info|Warning|Error (default: Info)
 * - CHECKER_HIDE_SKIPPED / checker.hide.skipped: hide skipped-rule annotations (default: false)
 * - CHECKER_PROPERTY_MATCH_MODE / checker.property.match.mode: strict|fuzzy|mixed (default: mixed)
 * - CHECKER_MODEL_FILE / checker.model.file: JSON model file for the file-backed host
 */
public record CheckerConfiguration(
        String spreadsheetUrl,
        Severity minimumSeverity,
        boolean hideSkipped,
        PropertyMatchMode propertyMatchMode,
        Path modelFile
) {

    public static final String SPREADSHEET_URL = "checker.spreadsheet.url";
    public static final String MINIMUM_SEVERITY = "checker.minimum.severity";
    public static final String HIDE_SKIPPED = "checker.hide.skipped";
    public static final String PROPERTY_MATCH_MODE = "checker.property.match.mode";
    public static final String MODEL_FILE = "checker.model.file";

    public CheckerConfiguration {
        if (spreadsheetUrl == null || spreadsheetUrl.isBlank()) {
            throw new IllegalArgumentException("Spreadsheet URL is required (" + SPREADSHEET_URL + ")");
        }
        minimumSeverity = Objects.requireNonNullElse(minimumSeverity, Severity.INFO);
        propertyMatchMode = Objects.requireNonNullElse(propertyMatchMode, PropertyMatchMode.MIXED);
    }

    public static CheckerConfiguration load() {
        return from(CheckerConfiguration::getEnvOrProperty);
    }

    /**
     * Builds a configuration from a key lookup; keys are the dotted property names.
     */
    public static CheckerConfiguration from(UnaryOperator<String> lookup) {
        String severity = lookup.apply(MINIMUM_SEVERITY);
        String modelFile = lookup.apply(MODEL_FILE);
        return new CheckerConfiguration(
                lookup.apply(SPREADSHEET_URL),
                severity == null || severity.isBlank() ? Severity.INFO : Severity.parse(severity),
                Boolean.parseBoolean(lookup.apply(HIDE_SKIPPED)),
                PropertyMatchMode.fromString(lookup.apply(PROPERTY_MATCH_MODE)),
                modelFile == null || modelFile.isBlank() ? null : Path.of(modelFile.trim()));
    }

    /**
     * Get value from environment variable, falling back to system property.
     */
    private static String getEnvOrProperty(String key) {
        String value = System.getenv(key.toUpperCase(Locale.ROOT).replace('.', '_'));
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value;
    }
}
