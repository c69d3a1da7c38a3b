/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.model;

import com.verity.modelchecker.core.compiler.RuleStructureException;
import com.verity.modelchecker.core.evaluation.predicates.ConditionPredicate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.assertThatCode;

class RuleGroupTest {

    private static Condition condition(String logic, String path) {
        return new Condition(0, "1", Logic.fromString(logic), logic, path, "exists", null, ConditionPredicate.NEVER);
    }

    private static RuleGroup group(Condition... conditions) {
        return new RuleGroup("1", List.of(conditions), "message", Severity.WARNING);
    }

    @Test
    @DisplayName("Should split WHERE, AND, CHECK into filters and the CHECK")
    void testExplicitCheck() {
        Condition where = condition("WHERE", "a");
        Condition and = condition("AND", "b");
        Condition check = condition("CHECK", "c");
        RuleGroup group = group(where, and, check);

        assertThat(group.filters()).containsExactly(where, and);
        assertThat(group.finalCheck()).isSameAs(check);
    }

    @Test
    @DisplayName("Should use the last AND as the check when no CHECK exists")
    void testLegacyCheck() {
        Condition where = condition("WHERE", "a");
        Condition and1 = condition("AND", "b");
        Condition and2 = condition("AND", "c");
        RuleGroup group = group(where, and1, and2);

        assertThat(group.filters()).containsExactly(where, and1);
        assertThat(group.finalCheck()).isSameAs(and2);
    }

    @Test
    @DisplayName("Should use the WHERE as the check when it stands alone")
    void testWhereOnly() {
        Condition where = condition("WHERE", "a");
        RuleGroup group = group(where);

        assertThat(group.filters()).containsExactly(where);
        assertThat(group.finalCheck()).isSameAs(where);
    }

    @Test
    @DisplayName("Should accept well-formed groups")
    void testValid() {
        assertThatCode(() -> group(condition("where", "a"), condition("And", "b"), condition("check", "c")).validate())
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should reject structural violations")
    void testInvalid() {
        assertThatThrownBy(() -> group(condition("AND", "a"), condition("CHECK", "b")).validate())
                .isInstanceOf(RuleStructureException.class)
                .hasMessage("Rule 1 must start with WHERE");
        assertThatThrownBy(() -> group(condition("WHERE", "a"), condition("CHECK", "b"), condition("CHECK", "c")).validate())
                .hasMessage("Rule 1 has multiple CHECK conditions");
        assertThatThrownBy(() -> group(condition("WHERE", "a"), condition("CHECK", "b"), condition("AND", "c")).validate())
                .hasMessage("CHECK must be the last condition in rule 1");
        assertThatThrownBy(() -> group(condition("WHERE", "a"), condition("OR", "b")).validate())
                .hasMessageContaining("Invalid Logic values found in rule 1")
                .hasMessageContaining("OR");
    }

    @Test
    @DisplayName("Should default a missing severity to Error")
    void testDefaultSeverity() {
        assertThat(new RuleGroup("7", List.of(), null, null).severity()).isEqualTo(Severity.ERROR);
    }
}
