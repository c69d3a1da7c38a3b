/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.verity.modelchecker.core.compiler.RuleStructureException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One user-authored validation rule: the ordered conditions sharing a rule id, plus the
 * message and severity reported for it. Immutable once built by the rule-table compiler.
 */
public record RuleGroup(
        @JsonProperty("rule_id") String ruleId,
        @JsonProperty("conditions") List<Condition> conditions,
        @JsonProperty("message") String message,
        @JsonProperty("severity") Severity severity
) {

    public RuleGroup {
        Objects.requireNonNull(ruleId, "Rule id cannot be null");
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        severity = severity == null ? Severity.ERROR : severity;
    }

    /**
     * Checks the WHERE/AND/CHECK grammar of this group.
     *
     * @throws RuleStructureException if the group does not open with WHERE, has more than one
     *                                CHECK, has a CHECK that is not last, or uses an unknown logic value
     */
    public void validate() {
        if (conditions.isEmpty()) {
            return;
        }
        if (conditions.get(0).logic() != Logic.WHERE) {
            throw new RuleStructureException("Rule " + ruleId + " must start with WHERE");
        }

        long checkCount = conditions.stream().filter(c -> c.logic() == Logic.CHECK).count();
        if (checkCount > 1) {
            throw new RuleStructureException("Rule " + ruleId + " has multiple CHECK conditions");
        }
        if (checkCount == 1 && conditions.get(conditions.size() - 1).logic() != Logic.CHECK) {
            throw new RuleStructureException("CHECK must be the last condition in rule " + ruleId);
        }

        Set<String> invalid = new LinkedHashSet<>();
        for (Condition condition : conditions) {
            if (condition.logic() == null) {
                invalid.add(String.valueOf(condition.logicText()));
            }
        }
        if (!invalid.isEmpty()) {
            throw new RuleStructureException("Invalid Logic values found in rule " + ruleId + ": " + invalid);
        }
    }

    /**
     * The condition that decides pass/fail for elements surviving the filters: the explicit
     * CHECK row, else the last AND row, else the opening WHERE row. Null for an empty group.
     */
    public Condition finalCheck() {
        if (conditions.isEmpty()) {
            return null;
        }
        for (Condition condition : conditions) {
            if (condition.logic() == Logic.CHECK) {
                return condition;
            }
        }
        int lastAnd = lastAndIndex();
        return lastAnd >= 0 ? conditions.get(lastAnd) : conditions.get(0);
    }

    /**
     * The conditions that narrow the element set before the final check.
     * <ul>
     *   <li>explicit CHECK: every other row</li>
     *   <li>no CHECK: the rows before the last AND</li>
     *   <li>no CHECK and no AND: every row (the WHERE filters and is then re-applied as the check)</li>
     * </ul>
     */
    public List<Condition> filters() {
        boolean hasCheck = conditions.stream().anyMatch(c -> c.logic() == Logic.CHECK);
        if (hasCheck) {
            List<Condition> filters = new ArrayList<>(conditions.size() - 1);
            for (Condition condition : conditions) {
                if (condition.logic() != Logic.CHECK) {
                    filters.add(condition);
                }
            }
            return List.copyOf(filters);
        }
        int lastAnd = lastAndIndex();
        return lastAnd >= 0 ? conditions.subList(0, lastAnd) : conditions;
    }

    private int lastAndIndex() {
        for (int i = conditions.size() - 1; i >= 0; i--) {
            if (conditions.get(i).logic() == Logic.AND) {
                return i;
            }
        }
        return -1;
    }
}
