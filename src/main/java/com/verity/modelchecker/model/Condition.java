/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.verity.modelchecker.core.evaluation.predicates.ConditionPredicate;

import java.util.Objects;

/**
 * One row of a rule group, with its predicate already resolved from the predicate name.
 *
 * {@code logic} is null when the row's logic cell is not one of WHERE/AND/CHECK; the raw
 * text is kept in {@code logicText} so structural validation can report it.
 */
public record Condition(
        @JsonProperty("row") int row,
        @JsonProperty("rule_id") String ruleId,
        @JsonProperty("logic") Logic logic,
        @JsonProperty("logic_text") String logicText,
        @JsonProperty("property_path") String propertyPath,
        @JsonProperty("predicate") String predicateName,
        @JsonProperty("value") Object value,
        @JsonIgnore ConditionPredicate predicate
) {

    public Condition {
        Objects.requireNonNull(ruleId, "Rule id cannot be null");
        Objects.requireNonNull(predicate, "Predicate cannot be null for rule " + ruleId);
    }

    /**
     * Convenience constructor for conditions with a known logic value.
     */
    public Condition(String ruleId, Logic logic, String propertyPath, String predicateName,
                     Object value, ConditionPredicate predicate) {
        this(0, ruleId, logic, logic == null ? null : logic.name(), propertyPath, predicateName, value, predicate);
    }

    /**
     * Evaluates this condition against one element.
     */
    public boolean test(Object element) {
        return predicate.test(element, propertyPath, value);
    }

    @Override
    public String toString() {
        return logicText + " " + propertyPath + " " + predicateName + " " + value;
    }
}
