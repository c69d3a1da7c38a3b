/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.core.evaluation;

import com.verity.modelchecker.core.compiler.RuleTableCompilation;
import com.verity.modelchecker.core.compiler.RuleTableCompiler;
import com.verity.modelchecker.core.evaluation.predicates.ConditionPredicate;
import com.verity.modelchecker.core.evaluation.predicates.PredicateLibrary;
import com.verity.modelchecker.infrastructure.telemetry.TracingService;
import com.verity.modelchecker.model.Condition;
import com.verity.modelchecker.model.EvaluationResult;
import com.verity.modelchecker.model.Logic;
import com.verity.modelchecker.model.ModelElement;
import com.verity.modelchecker.model.RawRuleTable;
import com.verity.modelchecker.model.RuleGroup;
import com.verity.modelchecker.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static com.verity.modelchecker.fixtures.TestElements.currentWall;
import static com.verity.modelchecker.fixtures.TestElements.legacyWall;
import static com.verity.modelchecker.fixtures.TestElements.simple;
import static org.assertj.core.api.Assertions.assertThat;

class RuleEvaluatorTest {

    private final PredicateLibrary library = PredicateLibrary.standard();
    private EvaluatorMetrics metrics;
    private RuleEvaluator evaluator;

    private final ModelElement wallA = simple("A", "Walls", 300);
    private final ModelElement wallB = simple("B", "Walls", 100);
    private final ModelElement doorC = simple("C", "Doors", 500);

    @BeforeEach
    void setUp() {
        metrics = new EvaluatorMetrics();
        evaluator = new RuleEvaluator(TracingService.getInstance().getTracer(), metrics);
    }

    private Condition condition(String logic, String path, String predicate, Object value) {
        return new Condition("1", Logic.fromString(logic), path, predicate, value, library.resolve(predicate));
    }

    private static RuleGroup group(Condition... conditions) {
        return new RuleGroup("1", List.of(conditions), "message", Severity.ERROR);
    }

    @Test
    @DisplayName("Should filter by WHERE and partition by CHECK for a table-defined rule")
    void testEndToEndWallWidth() {
        RawRuleTable table = new RawRuleTable(
                List.of("Rule Number", "Logic", "Property Name", "Predicate", "Value", "Message", "Report Severity"),
                List.of(
                        Arrays.asList("1", "WHERE", "category", "matches", "Walls", "Wall width ok", "Warning"),
                        Arrays.asList("1", "CHECK", "width", "greater than", "200", "", "")));
        RuleTableCompilation compilation =
                new RuleTableCompiler(library, TracingService.getInstance().getTracer()).compile(table);

        EvaluationResult result = evaluator.evaluate(compilation.ruleGroups().get(0), List.of(wallA, wallB, doorC));

        assertThat(result.outcome()).isEqualTo(EvaluationResult.Outcome.EVALUATED);
        assertThat(result.passed()).containsExactly(wallA);
        assertThat(result.failed()).containsExactly(wallB);
        assertThat(compilation.ruleGroups().get(0).severity()).isEqualTo(Severity.WARNING);
    }

    @Test
    @DisplayName("Should apply every filter before the check")
    void testMultipleFilters() {
        RuleGroup group = group(
                condition("WHERE", "category", "matches", "Walls"),
                condition("AND", "width", "greater than", "50"),
                condition("CHECK", "width", "greater than", "200"));
        ModelElement thin = simple("D", "Walls", 20);

        EvaluationResult result = evaluator.evaluate(group, List.of(thin, wallA, doorC, wallB));

        assertThat(result.passed()).containsExactly(wallA);
        assertThat(result.failed()).containsExactly(wallB);
    }

    @Test
    @DisplayName("Should use the last AND as the check without an explicit CHECK")
    void testLegacyCheck() {
        RuleGroup group = group(
                condition("WHERE", "category", "matches", "Walls"),
                condition("AND", "width", "less than", "200"));

        EvaluationResult result = evaluator.evaluate(group, List.of(wallA, wallB, doorC));

        assertThat(result.passed()).containsExactly(wallB);
        assertThat(result.failed()).containsExactly(wallA);
    }

    @Test
    @DisplayName("Should skip without evaluating the check when filters match nothing")
    void testSkipped() {
        AtomicInteger checkCalls = new AtomicInteger();
        ConditionPredicate countingCheck = (element, path, value) -> checkCalls.incrementAndGet() > 0;
        RuleGroup group = group(
                condition("WHERE", "category", "matches", "Windows"),
                condition("AND", "width", "exists", null),
                new Condition("1", Logic.CHECK, "width", "counting", null, countingCheck));

        EvaluationResult result = evaluator.evaluate(group, List.of(wallA, wallB, doorC));

        assertThat(result.isSkipped()).isTrue();
        assertThat(result.isInvalid()).isFalse();
        assertThat(result.passed()).isEmpty();
        assertThat(result.failed()).isEmpty();
        assertThat(checkCalls).hasValue(0);
        assertThat(metrics.groupsSkipped()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should skip when there are no elements")
    void testNoElements() {
        RuleGroup group = group(condition("WHERE", "category", "exists", null));

        assertThat(evaluator.evaluate(group, List.of()).isSkipped()).isTrue();
    }

    @Test
    @DisplayName("Should report a malformed group as invalid without evaluating it")
    void testInvalidGroup() {
        RuleGroup group = group(
                condition("AND", "category", "matches", "Walls"),
                condition("CHECK", "width", "exists", null));

        EvaluationResult result = evaluator.evaluate(group, List.of(wallA));

        assertThat(result.isSkipped()).isTrue();
        assertThat(result.isInvalid()).isTrue();
        assertThat(result.diagnostic()).isEqualTo("Rule 1 must start with WHERE");
        assertThat(metrics.groupsInvalid()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should count a throwing predicate as not satisfied")
    void testThrowingPredicate() {
        ConditionPredicate broken = (element, path, value) -> {
            throw new IllegalStateException("broken");
        };
        RuleGroup group = group(
                condition("WHERE", "category", "matches", "Walls"),
                new Condition("1", Logic.CHECK, "width", "broken", null, broken));

        EvaluationResult result = evaluator.evaluate(group, List.of(wallA, wallB));

        assertThat(result.passed()).isEmpty();
        assertThat(result.failed()).containsExactly(wallA, wallB);
    }

    @Test
    @DisplayName("Should evaluate both element layouts with the same rule")
    void testMixedLayouts() {
        RuleGroup group = group(
                condition("WHERE", "category", "equals", "walls"),
                condition("CHECK", "Width", "in range", "250,350"));
        ModelElement legacy = legacyWall();
        ModelElement current = currentWall();

        EvaluationResult result = evaluator.evaluate(group, List.of(legacy, current));

        assertThat(result.passed()).containsExactly(current);
        assertThat(result.failed()).containsExactly(legacy);
    }

    @Test
    @DisplayName("Should record evaluation metrics")
    void testMetrics() {
        RuleGroup group = group(
                condition("WHERE", "category", "matches", "Walls"),
                condition("CHECK", "width", "greater than", "200"));

        evaluator.evaluate(group, List.of(wallA, wallB, doorC));

        assertThat(metrics.getSnapshot())
                .containsEntry("ruleGroupsEvaluated", 1L)
                .containsEntry("conditionsEvaluated", 5L)
                .containsEntry("elementsPassed", 1L)
                .containsEntry("elementsFailed", 1L);
        assertThat(evaluator.getMetrics()).isSameAs(metrics);
    }
}
