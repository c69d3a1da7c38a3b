/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.core.compiler;

import com.verity.modelchecker.core.evaluation.predicates.ConditionPredicate;
import com.verity.modelchecker.core.evaluation.predicates.PredicateLibrary;
import com.verity.modelchecker.infrastructure.telemetry.TracingService;
import com.verity.modelchecker.model.Condition;
import com.verity.modelchecker.model.Logic;
import com.verity.modelchecker.model.RawRuleTable;
import com.verity.modelchecker.model.RuleGroup;
import com.verity.modelchecker.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleTableCompilerTest {

    private static final List<String> COLUMNS = List.of(
            "Rule Number", "Logic", "Property Name", "Predicate", "Value", "Message", "Report Severity");

    private RuleTableCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new RuleTableCompiler(PredicateLibrary.standard(), TracingService.getInstance().getTracer());
    }

    private static RawRuleTable table(List<String> columns, Object[]... rows) {
        List<List<Object>> data = new ArrayList<>();
        for (Object[] row : rows) {
            data.add(Arrays.asList(row));
        }
        return new RawRuleTable(columns, data);
    }

    private static Object[] row(Object... cells) {
        return cells;
    }

    @Test
    @DisplayName("Should compile a WHERE/CHECK rule with message and severity from its last populated row")
    void testSimpleRule() {
        RuleTableCompilation compilation = compiler.compile(table(COLUMNS,
                row("1", "WHERE", "category", "matches", "Walls", "Wall width ok", "Warning"),
                row("1", "CHECK", "width", "greater than", "200", null, null)));

        assertThat(compilation.isFailed()).isFalse();
        assertThat(compilation.messages()).isEmpty();
        assertThat(compilation.ruleGroups()).hasSize(1);

        RuleGroup group = compilation.ruleGroups().get(0);
        assertThat(group.ruleId()).isEqualTo("1");
        assertThat(group.message()).isEqualTo("Wall width ok");
        assertThat(group.severity()).isEqualTo(Severity.WARNING);
        assertThat(group.conditions()).extracting(Condition::logic).containsExactly(Logic.WHERE, Logic.CHECK);
        assertThat(group.conditions()).extracting(Condition::value).containsExactly("Walls", "200");
        assertThat(group.finalCheck().propertyPath()).isEqualTo("width");
    }

    @Test
    @DisplayName("Should auto-number unnumbered groups around explicit numbers")
    void testAutoNumbering() {
        RuleTableCompilation compilation = compiler.compile(table(COLUMNS,
                row(null, "WHERE", "category", "matches", "Walls", "a", "Info"),
                row(null, "CHECK", "width", "exists", null, null, null),
                row("1", "WHERE", "category", "matches", "Doors", "b", "Info"),
                row("1", "CHECK", "width", "exists", null, null, null),
                row(null, "where", "category", "matches", "Floors", "c", "Info"),
                row(null, "AND", "width", "exists", null, null, null)));

        assertThat(compilation.ruleGroups()).extracting(RuleGroup::ruleId).containsExactly("2", "1", "3");
        assertThat(compilation.ruleGroups()).allSatisfy(group -> assertThat(group.conditions()).hasSize(2));
        assertThat(compilation.messages()).containsExactly(RuleTableCompiler.MISSING_NUMBERS_WARNING);
    }

    @Test
    @DisplayName("Should keep explicit rule numbers verbatim")
    void testVerbatimNumbers() {
        RuleTableCompilation compilation = compiler.compile(table(COLUMNS,
                row("R-10", "WHERE", "category", "matches", "Walls", "a", "Info"),
                row(3.0, "WHERE", "category", "matches", "Doors", "b", "Info"),
                row(3.0, "CHECK", "width", "exists", null, null, null)));

        assertThat(compilation.ruleGroups()).extracting(RuleGroup::ruleId).containsExactly("R-10", "3");
    }

    @Test
    @DisplayName("Should warn about duplicate rule numbers and merge their rows")
    void testDuplicateNumbers() {
        RuleTableCompilation compilation = compiler.compile(table(COLUMNS,
                row("1", "WHERE", "category", "matches", "Walls", "a", "Info"),
                row("1", "CHECK", "width", "exists", null, null, null),
                row("1", "WHERE", "category", "matches", "Doors", "b", "Info"),
                row("1", "CHECK", "height", "exists", null, null, null)));

        assertThat(compilation.messages()).containsExactly("Warning: Duplicate rule numbers found: [1]");
        assertThat(compilation.ruleGroups()).hasSize(1);
        RuleGroup merged = compilation.ruleGroups().get(0);
        assertThat(merged.conditions()).hasSize(4);
        assertThatThrownBy(merged::validate).isInstanceOf(RuleStructureException.class);
    }

    @Test
    @DisplayName("Should prefer Report Severity over Severity and default to Error")
    void testSeverityColumns() {
        List<String> columns = List.of("Rule Number", "Logic", "Property Path", "Predicate", "Value",
                "Message", "Report Severity", "Severity");
        RuleTableCompilation compilation = compiler.compile(table(columns,
                row("1", "WHERE", "category", "exists", null, "m", "Info", "Error"),
                row("2", "WHERE", "category", "exists", null, "m", null, "warn"),
                row("3", "WHERE", "category", "exists", null, "m", "Critical", null),
                row("4", "WHERE", "category", "exists", null, null, null, null)));

        assertThat(compilation.ruleGroups()).extracting(RuleGroup::severity)
                .containsExactly(Severity.INFO, Severity.WARNING, Severity.ERROR, Severity.ERROR);
        assertThat(compilation.ruleGroups().get(3).message()).isNull();
    }

    @Test
    @DisplayName("Should bind unknown predicates to a never-matching predicate and warn")
    void testUnknownPredicate() {
        RuleTableCompilation compilation = compiler.compile(table(COLUMNS,
                row("1", "WHERE", "category", "bigger than", "1", "m", "Info")));

        Condition condition = compilation.ruleGroups().get(0).conditions().get(0);
        assertThat(condition.predicate()).isSameAs(ConditionPredicate.NEVER);
        assertThat(condition.predicateName()).isEqualTo("bigger than");
        assertThat(compilation.messages()).anyMatch(m -> m.contains("Unknown predicate 'bigger than'"));
    }

    @Test
    @DisplayName("Should fail softly when a required column is missing")
    void testMissingColumn() {
        RuleTableCompilation compilation = compiler.compile(table(
                List.of("Rule Number", "Logic", "Predicate", "Value"),
                row("1", "WHERE", "exists", null)));

        assertThat(compilation.isFailed()).isTrue();
        assertThat(compilation.ruleGroups()).isEmpty();
        assertThat(compilation.messages()).singleElement().asString()
                .contains("missing required columns").contains("Property Name|Property Path");
    }

    @Test
    @DisplayName("Should fail softly without a table")
    void testNullTable() {
        assertThat(compiler.compile(null).isFailed()).isTrue();
    }

    @Test
    @DisplayName("Should default message and severity when their columns are absent")
    void testOptionalColumns() {
        RuleTableCompilation compilation = compiler.compile(table(
                List.of("Rule Number", "Logic", "Property Name", "Predicate", "Value"),
                row("1", "WHERE", "category", "exists", null)));

        assertThat(compilation.isFailed()).isFalse();
        assertThat(compilation.messages()).hasSize(2);
        assertThat(compilation.ruleGroups().get(0).severity()).isEqualTo(Severity.ERROR);
    }

    @Test
    @DisplayName("Should put rows before the first WHERE in their own group")
    void testLeadingRows() {
        RuleTableCompilation compilation = compiler.compile(table(COLUMNS,
                row("9", "AND", "category", "exists", null, "m", "Info"),
                row("1", "WHERE", "category", "exists", null, "m", "Info")));

        assertThat(compilation.ruleGroups()).extracting(RuleGroup::ruleId).containsExactly("9", "1");
        assertThatThrownBy(() -> compilation.ruleGroups().get(0).validate())
                .hasMessage("Rule 9 must start with WHERE");
    }

    @Test
    @DisplayName("Should stringify text columns and leave numeric-looking columns as read")
    void testColumnNormalisation() {
        RuleTableCompilation compilation = compiler.compile(table(COLUMNS,
                row("1", "WHERE", "category", "matches", "Walls", "m", "Info"),
                row("1", "AND", "mark", "exists", null, null, null),
                row("2", "WHERE", "category", "matches", 12.5, "m", "Info")));

        List<Condition> first = compilation.ruleGroups().get(0).conditions();
        assertThat(first.get(1).value()).isNull();
        assertThat(compilation.ruleGroups().get(1).conditions().get(0).value()).isEqualTo(12.5);

        RuleTableCompilation text = compiler.compile(table(COLUMNS,
                row("1", "WHERE", "category", "matches", "Walls", "m", "Info"),
                row("1", "AND", "mark", "exists", null, null, null)));
        assertThat(text.ruleGroups().get(0).conditions().get(1).value()).isEqualTo("");
    }

    @Test
    @DisplayName("Should recognise numeric-looking cells")
    void testLooksNumeric() {
        assertThat(RuleTableCompiler.looksNumeric("12")).isTrue();
        assertThat(RuleTableCompiler.looksNumeric("12.5")).isTrue();
        assertThat(RuleTableCompiler.looksNumeric(3.0)).isTrue();
        assertThat(RuleTableCompiler.looksNumeric("-12")).isFalse();
        assertThat(RuleTableCompiler.looksNumeric("1.2.3")).isFalse();
        assertThat(RuleTableCompiler.looksNumeric("Walls")).isFalse();
        assertThat(RuleTableCompiler.formatRuleNumber(4.0)).isEqualTo("4");
        assertThat(RuleTableCompiler.formatRuleNumber(4.5)).isEqualTo("4.5");
    }
}
