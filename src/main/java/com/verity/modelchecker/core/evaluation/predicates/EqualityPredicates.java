/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.core.evaluation.predicates;

import com.verity.modelchecker.core.evaluation.ValueComparator;
import com.verity.modelchecker.core.property.PropertyLookup;
import com.verity.modelchecker.core.property.PropertyResolver;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Equality family: "matches", "equals", "not equal", "identical", "not identical", "in list".
 *
 * <ul>
 *   <li>matches: the value, or its string form, equals the expected cell as written</li>
 *   <li>equals: {@link ValueComparator} semantics (case-insensitive, Yes/No aware, tolerant)</li>
 *   <li>identical: the uncoerced value, case-sensitive, exact numbers, no Yes/No</li>
 * </ul>
 * The negated forms treat a missing property as "not equal" / "not identical".
 */
public final class EqualityPredicates {

    private final PropertyResolver resolver;
    private final ValueComparator comparator;

    public EqualityPredicates(PropertyResolver resolver, ValueComparator comparator) {
        this.resolver = resolver;
        this.comparator = comparator;
    }

    public boolean isParameterValue(Object element, String propertyPath, Object expected) {
        Object value = resolver.getParameterValue(element, propertyPath);
        if (Objects.equals(value, expected)) {
            return true;
        }
        if (value == null || expected == null) {
            return false;
        }
        if (value instanceof Number number && expected instanceof Number other) {
            return number.doubleValue() == other.doubleValue();
        }
        return String.valueOf(value).equals(String.valueOf(expected));
    }

    public boolean isEqualValue(Object element, String propertyPath, Object expected) {
        return isEqualValue(element, propertyPath, expected, false, ValueComparator.DEFAULT_TOLERANCE);
    }

    public boolean isEqualValue(Object element, String propertyPath, Object expected,
                                boolean caseSensitive, double tolerance) {
        Object value = resolver.getParameterValue(element, propertyPath);
        if (value == null) {
            return false;
        }
        return comparator.compare(value, expected, caseSensitive, tolerance);
    }

    public boolean isNotEqualValue(Object element, String propertyPath, Object expected) {
        return isNotEqualValue(element, propertyPath, expected, false, ValueComparator.DEFAULT_TOLERANCE);
    }

    public boolean isNotEqualValue(Object element, String propertyPath, Object expected,
                                   boolean caseSensitive, double tolerance) {
        Object value = resolver.getParameterValue(element, propertyPath);
        if (value == null) {
            return true;
        }
        return !comparator.compare(value, expected, caseSensitive, tolerance);
    }

    public boolean isIdenticalValue(Object element, String propertyPath, Object expected) {
        PropertyLookup lookup = resolver.findProperty(element, propertyPath, true);
        Object value = PropertyResolver.unwrapRecordValue(lookup.value());
        if (!lookup.found() || value == null) {
            return false;
        }
        return comparator.compareIdentical(value, expected);
    }

    public boolean isNotIdenticalValue(Object element, String propertyPath, Object expected) {
        return !isIdenticalValue(element, propertyPath, expected);
    }

    /**
     * Membership in a list given either as a collection or as a comma-separated string
     * (items trimmed, empty items dropped). The value matches itself or its string form.
     */
    public boolean isParameterValueInList(Object element, String propertyPath, Object list) {
        Object value = resolver.getParameterValue(element, propertyPath);
        if (value == null) {
            return false;
        }
        Collection<?> items = toItems(list);
        return items.contains(value) || items.contains(String.valueOf(value));
    }

    private static Collection<?> toItems(Object list) {
        if (list instanceof Collection<?> collection) {
            return collection;
        }
        if (list instanceof String text) {
            return Arrays.stream(text.split(","))
                    .map(String::strip)
                    .filter(item -> !item.isEmpty())
                    .toList();
        }
        return List.of();
    }
}
