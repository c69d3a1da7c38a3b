/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.api;

import com.verity.modelchecker.model.EvaluationResult;
import com.verity.modelchecker.model.RuleGroup;

import java.util.List;

/**
 * Contract for applying one rule group to a flat element sequence.
 */
public interface IRuleEvaluator {

    /**
     * Runs the group's filters and final check over the elements.
     *
     * @param group    the rule group
     * @param elements flattened model elements, in model order
     * @return passed/failed partitions; skipped when no element survives the filters
     */
    EvaluationResult evaluate(RuleGroup group, List<?> elements);
}
