/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.core.evaluation;

import com.verity.modelchecker.api.IRuleEvaluator;
import com.verity.modelchecker.core.compiler.RuleStructureException;
import com.verity.modelchecker.model.Condition;
import com.verity.modelchecker.model.EvaluationResult;
import com.verity.modelchecker.model.RuleGroup;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.roaringbitmap.IntIterator;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies one rule group to the flattened model.
 *
 * The working set is a bitmap of element positions. Each filter keeps the positions whose
 * element satisfies it; once the set is empty the group is skipped without testing the
 * remaining conditions. The surviving elements are then partitioned by the final check,
 * preserving model order in both partitions.
 *
 * A group with a broken WHERE/AND/CHECK structure is not evaluated: it yields an invalid
 * (skipped) result carrying the diagnostic, and evaluation of other groups continues.
 */
public class RuleEvaluator implements IRuleEvaluator {
    private static final Logger logger = Logger.getLogger(RuleEvaluator.class.getName());

    private final Tracer tracer;
    private final EvaluatorMetrics metrics;

    public RuleEvaluator(Tracer tracer) {
        this(tracer, new EvaluatorMetrics());
    }

    public RuleEvaluator(Tracer tracer, EvaluatorMetrics metrics) {
        this.tracer = tracer;
        this.metrics = metrics;
    }

    @Override
    public EvaluationResult evaluate(RuleGroup group, List<?> elements) {
        Span span = tracer.spanBuilder("evaluate-rule-group").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("ruleId", group.ruleId());
            long startTime = System.nanoTime();

            try {
                group.validate();
            } catch (RuleStructureException e) {
                logger.warning("Error in rule " + group.ruleId() + ": " + e.getMessage());
                metrics.recordInvalid();
                span.setAttribute("outcome", "INVALID");
                return EvaluationResult.invalid(group.ruleId(), e.getMessage());
            }

            int[] conditionTests = {0};
            RoaringBitmap working = new RoaringBitmap();
            if (elements != null && !elements.isEmpty()) {
                working.add(0L, (long) elements.size());
            }

            for (Condition filter : group.filters()) {
                if (working.isEmpty()) {
                    break;
                }
                working = applyFilter(filter, elements, working, conditionTests);
            }

            Condition check = group.finalCheck();
            if (working.isEmpty() || check == null) {
                metrics.recordSkipped(conditionTests[0]);
                span.setAttribute("outcome", EvaluationResult.Outcome.SKIPPED.name());
                return EvaluationResult.skipped(group.ruleId());
            }

            List<Object> passed = new ArrayList<>();
            List<Object> failed = new ArrayList<>();
            IntIterator it = working.getIntIterator();
            while (it.hasNext()) {
                Object element = elements.get(it.next());
                conditionTests[0]++;
                if (test(check, element)) {
                    passed.add(element);
                } else {
                    failed.add(element);
                }
            }

            metrics.recordEvaluation(System.nanoTime() - startTime, conditionTests[0], passed.size(), failed.size());
            span.setAttribute("passed", passed.size());
            span.setAttribute("failed", failed.size());
            span.setAttribute("outcome", EvaluationResult.Outcome.EVALUATED.name());
            return EvaluationResult.of(group.ruleId(), passed, failed);

        } finally {
            span.end();
        }
    }

    private RoaringBitmap applyFilter(Condition filter, List<?> elements, RoaringBitmap working,
                                      int[] conditionTests) {
        RoaringBitmap survivors = new RoaringBitmap();
        IntIterator it = working.getIntIterator();
        while (it.hasNext()) {
            int position = it.next();
            conditionTests[0]++;
            if (test(filter, elements.get(position))) {
                survivors.add(position);
            }
        }
        return survivors;
    }

    // A condition that throws counts as not satisfied.
    private boolean test(Condition condition, Object element) {
        try {
            return condition.test(element);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Error evaluating condition '" + condition + "' of rule "
                    + condition.ruleId(), e);
            return false;
        }
    }

    public EvaluatorMetrics getMetrics() {
        return metrics;
    }
}
