/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.report;

import com.verity.modelchecker.api.AutomationContext;
import com.verity.modelchecker.model.EvaluationResult;
import com.verity.modelchecker.model.ModelElement;
import com.verity.modelchecker.model.RuleGroup;
import com.verity.modelchecker.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Turns evaluation results into annotations on the host context.
 *
 * <ul>
 *   <li>passed elements are reported as info, and only when the minimum severity is Info</li>
 *   <li>failed elements are reported at the rule's severity when it reaches the minimum</li>
 *   <li>a skipped rule gets one info annotation on the placeholder id {@value #SKIPPED_PLACEHOLDER_ID}
 *       unless skipped rules are hidden</li>
 * </ul>
 */
public class ResultReporter {
    private static final Logger logger = Logger.getLogger(ResultReporter.class.getName());

    static final String SKIPPED_PLACEHOLDER_ID = "0";
    static final String DEFAULT_MESSAGE = "No Message";

    private final AutomationContext context;
    private final Severity minimumSeverity;
    private final boolean hideSkipped;
    private final ResultMetadata metadata;

    public ResultReporter(AutomationContext context, Severity minimumSeverity, boolean hideSkipped) {
        this(context, minimumSeverity, hideSkipped, new ResultMetadata());
    }

    public ResultReporter(AutomationContext context, Severity minimumSeverity, boolean hideSkipped,
                          ResultMetadata metadata) {
        this.context = context;
        this.minimumSeverity = minimumSeverity == null ? Severity.INFO : minimumSeverity;
        this.hideSkipped = hideSkipped;
        this.metadata = metadata;
    }

    public void report(RuleGroup group, EvaluationResult result) {
        String ruleId = result.ruleId();
        String message = formatMessage(group.message());
        Severity severity = group.severity();

        if (result.isInvalid()) {
            logger.info("Rule " + ruleId + " was not evaluated: " + result.diagnostic());
        }

        if (minimumSeverity == Severity.INFO && !result.passed().isEmpty()) {
            context.attachInfo(category(ruleId), idsOf(result.passed()), message,
                    metadata.create(ruleId, true, severity, message, result.passed().size()));
        }

        if (severity.isAtLeast(minimumSeverity) && !result.failed().isEmpty()) {
            context.attachResult(category(ruleId), idsOf(result.failed()), message, severity,
                    metadata.create(ruleId, false, severity, message, result.failed().size()));
        }

        if (result.isSkipped() && !hideSkipped) {
            context.attachInfo(
                    "Rule " + ruleId + " Skipped",
                    List.of(SKIPPED_PLACEHOLDER_ID),
                    "No objects found for rule " + ruleId,
                    Map.of());
        }
    }

    static String formatMessage(String message) {
        return message == null || message.isBlank() ? DEFAULT_MESSAGE : message;
    }

    private static String category(String ruleId) {
        return "Rule " + ruleId;
    }

    private static List<String> idsOf(List<Object> elements) {
        List<String> ids = new ArrayList<>(elements.size());
        for (Object element : elements) {
            String id = ModelElement.idOf(element);
            if (id != null) {
                ids.add(id);
            }
        }
        return ids;
    }

    public Severity minimumSeverity() {
        return minimumSeverity;
    }

    public boolean hideSkipped() {
        return hideSkipped;
    }
}
