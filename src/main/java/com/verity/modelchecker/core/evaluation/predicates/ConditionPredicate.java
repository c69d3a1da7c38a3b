/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.core.evaluation.predicates;

/**
 * A named boolean test over one element property, as referenced from the
 * {@code Predicate} column of a rule table.
 */
@FunctionalInterface
public interface ConditionPredicate {

    /**
     * Predicate that never matches, bound to conditions naming an unknown predicate.
     */
    ConditionPredicate NEVER = (element, propertyPath, value) -> false;

    /**
     * @param element      the element under test (a {@code ModelElement} or a map)
     * @param propertyPath dotted, case-insensitive property path
     * @param value        the condition's {@code Value} cell, may be null
     * @return whether the element satisfies the condition
     */
    boolean test(Object element, String propertyPath, Object value);
}
