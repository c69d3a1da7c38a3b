/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.core.compiler;

import com.verity.modelchecker.model.RuleGroup;

import java.util.List;

/**
 * Result of compiling a rule table: the rule groups in table order and the diagnostics
 * collected on the way. A failed compilation has no groups and must not be evaluated.
 */
public record RuleTableCompilation(List<RuleGroup> ruleGroups, List<String> messages, boolean failed) {

    public RuleTableCompilation {
        ruleGroups = ruleGroups == null ? List.of() : List.copyOf(ruleGroups);
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public static RuleTableCompilation of(List<RuleGroup> ruleGroups, List<String> messages) {
        return new RuleTableCompilation(ruleGroups, messages, false);
    }

    public static RuleTableCompilation failed(List<String> messages) {
        return new RuleTableCompilation(List.of(), messages, true);
    }

    public boolean isFailed() {
        return failed;
    }

    public int size() {
        return ruleGroups.size();
    }
}
