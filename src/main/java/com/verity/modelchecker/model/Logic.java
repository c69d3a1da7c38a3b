/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.model;

import java.util.Locale;

/**
 * Position of a condition within a rule group.
 */
public enum Logic {
    WHERE, AND, CHECK;

    /**
     * Case-insensitive lookup of a spreadsheet logic cell.
     * @param text The cell text (e.g., "where", " Check ").
     * @return The corresponding Logic, or null if the text names none.
     */
    public static Logic fromString(String text) {
        if (text == null) return null;
        try {
            return Logic.valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
