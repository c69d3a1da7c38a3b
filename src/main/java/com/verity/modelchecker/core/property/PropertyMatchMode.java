/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.core.property;

import java.util.Locale;

/**
 * How strictly a property path must follow the element hierarchy.
 */
public enum PropertyMatchMode {
    /** Only the exact path as written, walked from the element root. */
    STRICT,
    /** The final path segment anywhere in the element, ignoring hierarchy. */
    FUZZY,
    /** The exact path from the root first, then from every nested container. */
    MIXED;

    public static PropertyMatchMode fromString(String text) {
        if (text == null || text.isBlank()) return MIXED;
        try {
            return PropertyMatchMode.valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return MIXED;
        }
    }
}
