/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.core.evaluation;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters for rule group evaluation.
 *
 * Lock-free (LongAdder), so one instance may be shared by evaluators on different threads.
 */
public final class EvaluatorMetrics {

    private final LongAdder groupsEvaluated = new LongAdder();
    private final LongAdder groupsSkipped = new LongAdder();
    private final LongAdder groupsInvalid = new LongAdder();
    private final LongAdder conditionsEvaluated = new LongAdder();
    private final LongAdder elementsPassed = new LongAdder();
    private final LongAdder elementsFailed = new LongAdder();
    private final LongAdder totalEvaluationTimeNanos = new LongAdder();

    public void recordEvaluation(long evaluationTimeNanos, int conditionTests, int passed, int failed) {
        groupsEvaluated.increment();
        totalEvaluationTimeNanos.add(evaluationTimeNanos);
        conditionsEvaluated.add(conditionTests);
        elementsPassed.add(passed);
        elementsFailed.add(failed);
    }

    public void recordSkipped(int conditionTests) {
        groupsSkipped.increment();
        conditionsEvaluated.add(conditionTests);
    }

    public void recordInvalid() {
        groupsInvalid.increment();
    }

    public long groupsEvaluated() {
        return groupsEvaluated.sum();
    }

    public long groupsSkipped() {
        return groupsSkipped.sum();
    }

    public long groupsInvalid() {
        return groupsInvalid.sum();
    }

    /**
     * Point-in-time copy of all counters, in a stable key order.
     */
    public Map<String, Object> getSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        long evaluated = groupsEvaluated.sum();

        snapshot.put("ruleGroupsEvaluated", evaluated);
        snapshot.put("ruleGroupsSkipped", groupsSkipped.sum());
        snapshot.put("ruleGroupsInvalid", groupsInvalid.sum());
        snapshot.put("conditionsEvaluated", conditionsEvaluated.sum());
        snapshot.put("elementsPassed", elementsPassed.sum());
        snapshot.put("elementsFailed", elementsFailed.sum());
        snapshot.put("avgEvaluationTimeNanos", evaluated > 0 ? totalEvaluationTimeNanos.sum() / evaluated : 0);
        return snapshot;
    }
}
