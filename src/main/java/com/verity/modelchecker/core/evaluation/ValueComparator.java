/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.core.evaluation;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Type-aware equality shared by the equality predicates.
 *
 * Rules, first match wins:
 * <ol>
 *   <li>if both sides read as booleans ({@code true}/{@code false} literals or strings, plus
 *       {@code yes}/{@code no} when allowed), compare the booleans</li>
 *   <li>strings are trimmed; numeric ones ({@code -12}, {@code 3.5}, {@code " 1400 "}) become doubles</li>
 *   <li>two strings compare textually, case-folded unless case-sensitive</li>
 *   <li>two numbers compare exactly or within an absolute tolerance</li>
 *   <li>anything else uses {@link Objects#equals}</li>
 * </ol>
 */
public final class ValueComparator {

    public static final double DEFAULT_TOLERANCE = 1e-6;

    private static final Pattern NUMERIC_STRING = Pattern.compile("-?(\\d+\\.?\\d*|\\.\\d+)");

    /**
     * Loose comparison: case-insensitive, Yes/No aware, tolerance {@value #DEFAULT_TOLERANCE}.
     */
    public boolean compare(Object value1, Object value2) {
        return compare(value1, value2, false, DEFAULT_TOLERANCE, true, false);
    }

    public boolean compare(Object value1, Object value2, boolean caseSensitive, double tolerance) {
        return compare(value1, value2, caseSensitive, tolerance, true, false);
    }

    /**
     * Strict comparison: case-sensitive, no Yes/No conversion, exact numeric equality.
     */
    public boolean compareIdentical(Object value1, Object value2) {
        return compare(value1, value2, true, 0, false, true);
    }

    public boolean compare(Object value1, Object value2, boolean caseSensitive, double tolerance,
                           boolean allowYesNo, boolean exact) {
        Boolean bool1 = toBoolean(value1, allowYesNo);
        Boolean bool2 = toBoolean(value2, allowYesNo);
        if (bool1 != null && bool2 != null) {
            return bool1.booleanValue() == bool2.booleanValue();
        }

        Object left = toNumberIfNumeric(value1);
        Object right = toNumberIfNumeric(value2);

        if (left instanceof String leftText && right instanceof String rightText) {
            return caseSensitive ? leftText.equals(rightText) : leftText.equalsIgnoreCase(rightText);
        }

        if (left instanceof Number leftNumber && right instanceof Number rightNumber) {
            double a = leftNumber.doubleValue();
            double b = rightNumber.doubleValue();
            return exact ? a == b : Math.abs(a - b) <= tolerance;
        }

        return Objects.equals(left, right);
    }

    /**
     * Parses a string of an optional leading minus, digits and at most one dot (surrounding
     * whitespace ignored). Returns null for anything else.
     */
    public static Double parseNumericString(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.strip();
        if (!NUMERIC_STRING.matcher(trimmed).matches()) {
            return null;
        }
        return Double.valueOf(trimmed);
    }

    private static Object toNumberIfNumeric(Object value) {
        if (value instanceof String text) {
            Double parsed = parseNumericString(text);
            return parsed != null ? parsed : text.strip();
        }
        return value;
    }

    private static Boolean toBoolean(Object value, boolean allowYesNo) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (!(value instanceof String text)) {
            return null;
        }
        String lower = StringUtils.lowerCase(text.strip(), Locale.ROOT);
        switch (lower) {
            case "true":
                return Boolean.TRUE;
            case "false":
                return Boolean.FALSE;
            case "yes":
                return allowYesNo ? Boolean.TRUE : null;
            case "no":
                return allowYesNo ? Boolean.FALSE : null;
            default:
                return null;
        }
    }
}
