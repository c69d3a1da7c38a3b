/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.core.compiler;

import com.verity.modelchecker.api.IRuleTableCompiler;
import com.verity.modelchecker.core.evaluation.predicates.ConditionPredicate;
import com.verity.modelchecker.core.evaluation.predicates.PredicateLibrary;
import com.verity.modelchecker.model.Condition;
import com.verity.modelchecker.model.Logic;
import com.verity.modelchecker.model.RawRuleTable;
import com.verity.modelchecker.model.RuleGroup;
import com.verity.modelchecker.model.Severity;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compiles a spreadsheet rule table into validated-ready rule groups.
 *
 * The compilation process:
 * 1. Locating the required columns (Rule Number, Logic, Property Name|Path, Predicate, Value).
 * 2. Normalising cell types per column: a column with any numeric-looking cell keeps its
 *    cells as read, every other column is stringified with missing cells as "".
 * 3. Slicing the rows into groups, each starting at a WHERE row, and numbering them. An
 *    explicit rule number is kept verbatim; a missing one gets the smallest positive integer
 *    not used by any explicit number or earlier assignment.
 * 4. Collecting warnings for missing and duplicate rule numbers.
 * 5. Resolving predicate names once per condition through the {@link PredicateLibrary}.
 * 6. Picking each group's message and severity from its last row that carries one.
 *
 * Compilation never throws: grammar problems are left for the evaluator to report per group,
 * and an unusable table yields {@link RuleTableCompilation#failed(List)}.
 */
public class RuleTableCompiler implements IRuleTableCompiler {
    private static final Logger logger = Logger.getLogger(RuleTableCompiler.class.getName());

    public static final String RULE_NUMBER = "Rule Number";
    public static final String LOGIC = "Logic";
    public static final String PROPERTY_NAME = "Property Name";
    public static final String PROPERTY_PATH = "Property Path";
    public static final String PREDICATE = "Predicate";
    public static final String VALUE = "Value";
    public static final String MESSAGE = "Message";
    public static final String REPORT_SEVERITY = "Report Severity";
    public static final String SEVERITY = "Severity";

    static final String MISSING_NUMBERS_WARNING = "Warning: Some rules are missing rule numbers";
    static final String DUPLICATE_NUMBERS_WARNING = "Warning: Duplicate rule numbers found: ";

    private final PredicateLibrary library;
    private final Tracer tracer;

    public RuleTableCompiler(PredicateLibrary library, Tracer tracer) {
        this.library = library;
        this.tracer = tracer;
    }

    @Override
    public RuleTableCompilation compile(RawRuleTable table) {
        Span span = tracer.spanBuilder("compile-rule-table").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long startTime = System.nanoTime();
            if (table == null) {
                return RuleTableCompilation.failed(List.of("Error processing rules: no rule table"));
            }
            span.setAttribute("rowCount", table.rowCount());

            List<String> messages = new ArrayList<>();
            Columns columns = locateColumns(table, messages);
            Map<String, List<Object>> cells = normalizeColumns(table, columns);

            List<String> ruleIds = assignRuleNumbers(table, cells, columns, messages);
            List<RuleGroup> groups = buildGroups(table, cells, columns, ruleIds, messages);

            span.setAttribute("ruleGroupCount", groups.size());
            span.setAttribute("compilationTimeMs",
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime));
            logger.info(String.format("Compiled %d rule groups from %d rows", groups.size(), table.rowCount()));
            return RuleTableCompilation.of(groups, messages);

        } catch (RuntimeException e) {
            span.recordException(e);
            logger.log(Level.WARNING, "Rule table could not be compiled", e);
            return RuleTableCompilation.failed(List.of("Error processing rules: " + e.getMessage()));
        } finally {
            span.end();
        }
    }

    private record Columns(String ruleNumber, String logic, String property, String predicate,
                           String value, String message, String reportSeverity, String severity) {
    }

    private Columns locateColumns(RawRuleTable table, List<String> messages) {
        String property = table.firstPresent(PROPERTY_NAME, PROPERTY_PATH);
        List<String> missing = new ArrayList<>();
        for (String required : List.of(RULE_NUMBER, LOGIC, PREDICATE, VALUE)) {
            if (!table.hasColumn(required)) {
                missing.add(required);
            }
        }
        if (property == null) {
            missing.add(PROPERTY_NAME + "|" + PROPERTY_PATH);
        }
        if (!missing.isEmpty()) {
            throw new RuleStructureException("Rule table is missing required columns: " + missing);
        }

        String message = table.hasColumn(MESSAGE) ? MESSAGE : null;
        String reportSeverity = table.hasColumn(REPORT_SEVERITY) ? REPORT_SEVERITY : null;
        String severity = table.hasColumn(SEVERITY) ? SEVERITY : null;
        if (message == null) {
            messages.add("Warning: Rule table has no Message column, using default messages");
        }
        if (reportSeverity == null && severity == null) {
            messages.add("Warning: Rule table has no Severity column, defaulting to Error");
        }
        return new Columns(RULE_NUMBER, LOGIC, property, PREDICATE, VALUE, message, reportSeverity, severity);
    }

    private Map<String, List<Object>> normalizeColumns(RawRuleTable table, Columns columns) {
        Map<String, List<Object>> normalized = new LinkedHashMap<>();
        for (String column : table.columns()) {
            String name = column.trim();
            if (normalized.containsKey(name)) continue;
            List<Object> values = table.column(name);
            normalized.put(name, isNumericColumn(values) ? values : stringify(values));
        }
        return normalized;
    }

    static boolean isNumericColumn(List<Object> values) {
        for (Object value : values) {
            if (value != null && looksNumeric(value)) {
                return true;
            }
        }
        return false;
    }

    // Digits with at most one dot; a leading sign or exponent does not count.
    static boolean looksNumeric(Object value) {
        if (value instanceof Number) {
            return true;
        }
        String text = String.valueOf(value).replaceFirst("\\.", "");
        return !text.isEmpty() && StringUtils.isNumeric(text);
    }

    private static List<Object> stringify(List<Object> values) {
        List<Object> strings = new ArrayList<>(values.size());
        for (Object value : values) {
            strings.add(value == null ? "" : String.valueOf(value));
        }
        return strings;
    }

    private List<String> assignRuleNumbers(RawRuleTable table, Map<String, List<Object>> cells,
                                           Columns columns, List<String> messages) {
        List<Object> numbers = cells.get(columns.ruleNumber());
        List<Object> logic = cells.get(columns.logic());
        int rowCount = table.rowCount();

        // A new group starts at every WHERE row, and at row 0 whatever its logic.
        IntList starts = new IntArrayList();
        for (int row = 0; row < rowCount; row++) {
            if (row == 0 || Logic.fromString(text(logic.get(row))) == Logic.WHERE) {
                starts.add(row);
            }
        }

        Set<String> used = new HashSet<>();
        for (int row = 0; row < rowCount; row++) {
            if (!isMissing(numbers.get(row))) {
                used.add(formatRuleNumber(numbers.get(row)));
            }
        }

        boolean anyMissing = false;
        for (int row = 0; row < rowCount; row++) {
            if (isMissing(numbers.get(row))) {
                anyMissing = true;
                break;
            }
        }
        if (anyMissing) {
            messages.add(MISSING_NUMBERS_WARNING);
        }

        List<String> ruleIds = new ArrayList<>(rowCount);
        List<String> whereIds = new ArrayList<>();
        int next = 1;
        for (int s = 0; s < starts.size(); s++) {
            int start = starts.getInt(s);
            int end = s + 1 < starts.size() ? starts.getInt(s + 1) : rowCount;

            String ruleId;
            Object explicit = numbers.get(start);
            if (!isMissing(explicit)) {
                ruleId = formatRuleNumber(explicit);
            } else {
                while (used.contains(String.valueOf(next))) {
                    next++;
                }
                ruleId = String.valueOf(next);
                used.add(ruleId);
            }

            if (Logic.fromString(text(logic.get(start))) == Logic.WHERE) {
                whereIds.add(ruleId);
            }
            for (int row = start; row < end; row++) {
                ruleIds.add(ruleId);
            }
        }

        List<String> duplicates = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String ruleId : whereIds) {
            if (!seen.add(ruleId)) {
                duplicates.add(ruleId);
            }
        }
        if (!duplicates.isEmpty()) {
            messages.add(DUPLICATE_NUMBERS_WARNING + duplicates);
        }
        return ruleIds;
    }

    private List<RuleGroup> buildGroups(RawRuleTable table, Map<String, List<Object>> cells, Columns columns,
                                        List<String> ruleIds, List<String> messages) {
        Map<String, List<Integer>> rowsByRule = new LinkedHashMap<>();
        for (int row = 0; row < ruleIds.size(); row++) {
            rowsByRule.computeIfAbsent(ruleIds.get(row), k -> new ArrayList<>()).add(row);
        }

        Set<String> unknownPredicates = new LinkedHashSet<>();
        List<RuleGroup> groups = new ArrayList<>(rowsByRule.size());
        for (Map.Entry<String, List<Integer>> entry : rowsByRule.entrySet()) {
            String ruleId = entry.getKey();
            List<Condition> conditions = new ArrayList<>();
            String message = null;
            Object severity = null;

            for (int row : entry.getValue()) {
                String logicText = text(cells.get(columns.logic()).get(row));
                String predicateName = text(cells.get(columns.predicate()).get(row));
                ConditionPredicate predicate = library.resolve(predicateName);
                if (predicate == null) {
                    if (unknownPredicates.add(ruleId + ":" + predicateName)) {
                        messages.add("Warning: Unknown predicate '" + predicateName + "' in rule " + ruleId);
                        logger.warning("Rule '" + ruleId + "' uses unknown predicate '" + predicateName
                                + "' - condition will never match");
                    }
                    predicate = ConditionPredicate.NEVER;
                }

                conditions.add(new Condition(
                        row,
                        ruleId,
                        Logic.fromString(logicText),
                        logicText,
                        text(cells.get(columns.property()).get(row)),
                        predicateName,
                        cells.get(columns.value()).get(row),
                        predicate));

                Object rowMessage = cell(cells, columns.message(), row);
                if (!isMissing(rowMessage)) {
                    message = String.valueOf(rowMessage);
                }
                Object rowSeverity = cell(cells, columns.reportSeverity(), row);
                if (isMissing(rowSeverity)) {
                    rowSeverity = cell(cells, columns.severity(), row);
                }
                if (!isMissing(rowSeverity)) {
                    severity = rowSeverity;
                }
            }

            groups.add(new RuleGroup(ruleId, conditions, message, Severity.parse(severity)));
        }
        return groups;
    }

    private static Object cell(Map<String, List<Object>> cells, String column, int row) {
        return column == null ? null : cells.get(column).get(row);
    }

    private static String text(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    private static boolean isMissing(Object value) {
        if (value == null) return true;
        if (value instanceof Double d && d.isNaN()) return true;
        return value instanceof String s && s.isBlank();
    }

    /**
     * Rule numbers read as numbers print without a trailing ".0" when integral.
     */
    static String formatRuleNumber(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                return String.valueOf((long) d);
            }
        }
        return String.valueOf(value);
    }
}
