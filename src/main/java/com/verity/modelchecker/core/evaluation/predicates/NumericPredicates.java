/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.core.evaluation.predicates;

import com.verity.modelchecker.core.property.PropertyResolver;

import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * "greater than", "less than" and "in range".
 *
 * The comparisons are literal: "greater than 2401" passes elements whose value exceeds 2401.
 * Rule authors phrase the check as the condition that must hold; nothing is inverted here.
 * A missing property, a value that does not read as a number, or a threshold that does
 * not parse all make the predicate false.
 */
public final class NumericPredicates {
    private static final Logger logger = Logger.getLogger(NumericPredicates.class.getName());

    // Plain decimal notation with an optional exponent; no type suffixes, no hex.
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private final PropertyResolver resolver;

    public NumericPredicates(PropertyResolver resolver) {
        this.resolver = resolver;
    }

    public boolean isParameterValueGreaterThan(Object element, String propertyPath, Object threshold) {
        Double value = toDouble(resolver.getParameterValue(element, propertyPath));
        Double limit = parseThreshold(threshold);
        return value != null && limit != null && value > limit;
    }

    public boolean isParameterValueLessThan(Object element, String propertyPath, Object threshold) {
        Double value = toDouble(resolver.getParameterValue(element, propertyPath));
        Double limit = parseThreshold(threshold);
        return value != null && limit != null && value < limit;
    }

    /**
     * Inclusive range check; the range is written {@code "min,max"}.
     */
    public boolean isParameterValueInRange(Object element, String propertyPath, Object range) {
        if (range == null) {
            return false;
        }
        String[] bounds = String.valueOf(range).split(",");
        if (bounds.length != 2) {
            logger.fine(() -> "Range '" + range + "' is not of the form min,max");
            return false;
        }
        Double min = parseThreshold(bounds[0]);
        Double max = parseThreshold(bounds[1]);
        if (min == null || max == null) {
            return false;
        }
        Double value = toDouble(resolver.getParameterValue(element, propertyPath));
        return value != null && min <= value && value <= max;
    }

    /**
     * Parses a threshold as an integer first, then as a decimal number.
     * Returns null when it is neither.
     */
    static Double parseThreshold(Object threshold) {
        if (threshold instanceof Number number) {
            return number.doubleValue();
        }
        if (threshold == null) {
            return null;
        }
        String text = String.valueOf(threshold).strip();
        try {
            return (double) Long.parseLong(text);
        } catch (NumberFormatException notInteger) {
            Double parsed = parseDecimal(text);
            if (parsed == null) {
                logger.fine(() -> "Threshold is not a number: " + threshold);
            }
            return parsed;
        }
    }

    static Double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            return parseDecimal(text.strip());
        }
        return null;
    }

    /**
     * Parses decimal text such as {@code -12}, {@code 3.5} or {@code 1e3}. Java-only forms
     * ({@code 300d}, {@code 10f}, {@code 0x1p9}, {@code NaN}) are not numbers here.
     */
    static Double parseDecimal(String text) {
        if (text == null || !DECIMAL.matcher(text).matches()) {
            return null;
        }
        return Double.valueOf(text);
    }
}
