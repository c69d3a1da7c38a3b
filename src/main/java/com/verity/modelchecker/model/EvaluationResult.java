/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.model;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one rule group over the element set: disjoint passed/failed partitions.
 *
 * <h2>Usage</h2>
 * <pre>
 * EvaluationResult result = evaluator.evaluate(group, elements);
 * if (result.isSkipped()) {
 *     // filters matched no element, or the group was malformed
 * }
 * </pre>
 *
 * @param diagnostic structural error text when the group was rejected, otherwise null
 */
public record EvaluationResult(
        String ruleId,
        List<Object> passed,
        List<Object> failed,
        Outcome outcome,
        String diagnostic
) {

    public enum Outcome {
        /** At least one element survived the filters. */
        EVALUATED,
        /** No element survived the filters. */
        SKIPPED
    }

    public EvaluationResult {
        Objects.requireNonNull(ruleId, "Rule id cannot be null");
        passed = passed == null ? List.of() : List.copyOf(passed);
        failed = failed == null ? List.of() : List.copyOf(failed);
        outcome = passed.isEmpty() && failed.isEmpty() ? Outcome.SKIPPED : Outcome.EVALUATED;
    }

    public static EvaluationResult of(String ruleId, List<?> passed, List<?> failed) {
        return new EvaluationResult(ruleId, List.<Object>copyOf(passed), List.<Object>copyOf(failed), null, null);
    }

    public static EvaluationResult skipped(String ruleId) {
        return new EvaluationResult(ruleId, List.of(), List.of(), Outcome.SKIPPED, null);
    }

    public static EvaluationResult invalid(String ruleId, String diagnostic) {
        return new EvaluationResult(ruleId, List.of(), List.of(), Outcome.SKIPPED, diagnostic);
    }

    public boolean isSkipped() {
        return outcome == Outcome.SKIPPED;
    }

    public boolean isInvalid() {
        return diagnostic != null;
    }
}
