/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.core.evaluation.predicates;

import com.verity.modelchecker.core.property.PropertyResolver;

import java.util.Locale;
import java.util.Set;

/**
 * "true" / "false" predicates.
 *
 * Not complements of each other: a value that reads as neither (a number, a missing
 * property, "maybe") fails both.
 */
public final class BooleanPredicates {
    private static final Set<String> TRUE_VALUES = Set.of("yes", "true", "1");
    private static final Set<String> FALSE_VALUES = Set.of("no", "false", "0");

    private final PropertyResolver resolver;

    public BooleanPredicates(PropertyResolver resolver) {
        this.resolver = resolver;
    }

    public boolean isParameterValueTrue(Object element, String propertyPath) {
        return matches(resolver.getParameterValue(element, propertyPath), true, TRUE_VALUES);
    }

    public boolean isParameterValueFalse(Object element, String propertyPath) {
        return matches(resolver.getParameterValue(element, propertyPath), false, FALSE_VALUES);
    }

    private static boolean matches(Object value, boolean target, Set<String> spellings) {
        if (value instanceof Boolean bool) {
            return bool == target;
        }
        if (value instanceof String text) {
            return spellings.contains(text.toLowerCase(Locale.ROOT));
        }
        return false;
    }
}
