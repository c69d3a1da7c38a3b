/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.core.property;

/**
 * Result of a property search. {@code value} may be null even when {@code found} is true:
 * a member can exist and hold no value.
 */
public record PropertyLookup(boolean found, Object value) {

    public static final PropertyLookup NOT_FOUND = new PropertyLookup(false, null);

    public static PropertyLookup of(Object value) {
        return new PropertyLookup(true, value);
    }

    public Object valueOr(Object defaultValue) {
        return found ? value : defaultValue;
    }
}
