/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.host;

import com.verity.modelchecker.api.AutomationContext;
import com.verity.modelchecker.api.IRuleEvaluator;
import com.verity.modelchecker.api.IRuleTableCompiler;
import com.verity.modelchecker.config.CheckerConfiguration;
import com.verity.modelchecker.core.compiler.RuleTableCompilation;
import com.verity.modelchecker.core.compiler.RuleTableCompiler;
import com.verity.modelchecker.core.evaluation.EvaluatorMetrics;
import com.verity.modelchecker.core.evaluation.RuleEvaluator;
import com.verity.modelchecker.core.evaluation.ValueComparator;
import com.verity.modelchecker.core.evaluation.predicates.PredicateLibrary;
import com.verity.modelchecker.core.property.PropertyResolver;
import com.verity.modelchecker.model.EvaluationResult;
import com.verity.modelchecker.model.ModelElement;
import com.verity.modelchecker.model.RawRuleTable;
import com.verity.modelchecker.model.RuleGroup;
import com.verity.modelchecker.report.ResultReporter;
import io.opentelemetry.api.trace.Tracer;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One checker run against a host context:
 * 1. Receive the model and flatten it.
 * 2. Read and compile the rule table; any failure here ends the run with an exception.
 * 3. Evaluate every rule group in table order and report its results.
 * 4. Mark the run successful with a summary.
 */
public class ModelCheckRunner {
    private static final Logger logger = Logger.getLogger(ModelCheckRunner.class.getName());

    static final String RULES_FAILED = "Failed to process rules";

    private final CheckerConfiguration configuration;
    private final TsvRuleTableReader tableReader;
    private final ElementFlattener flattener;
    private final IRuleTableCompiler compiler;
    private final IRuleEvaluator evaluator;
    private final EvaluatorMetrics metrics = new EvaluatorMetrics();

    public ModelCheckRunner(CheckerConfiguration configuration, Tracer tracer) {
        this(configuration, new TsvRuleTableReader(), new ElementFlattener(), tracer);
    }

    public ModelCheckRunner(CheckerConfiguration configuration, TsvRuleTableReader tableReader,
                            ElementFlattener flattener, Tracer tracer) {
        this.configuration = configuration;
        this.tableReader = tableReader;
        this.flattener = flattener;
        PredicateLibrary library = new PredicateLibrary(
                new PropertyResolver(configuration.propertyMatchMode()), new ValueComparator());
        this.compiler = new RuleTableCompiler(library, tracer);
        this.evaluator = new RuleEvaluator(tracer, metrics);
    }

    /**
     * Runs the check. Failures are reported through the context, never thrown.
     *
     * @return results per rule id in table order; empty when the run failed
     */
    public Map<String, EvaluationResult> run(AutomationContext context) {
        List<Object> elements;
        try {
            Object root = context.receiveModel();
            elements = flattener.flatten(root);
            logger.info(String.format("Detected object schema version: %s", schemaVersion(root)));
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Model could not be received", e);
            context.markRunException("Failed to receive model: " + e.getMessage());
            return Map.of();
        }

        RuleTableCompilation compilation;
        try {
            RawRuleTable table = tableReader.read(resolveRuleTable(configuration.spreadsheetUrl()));
            compilation = compiler.compile(table);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Rule table could not be read", e);
            context.markRunException(RULES_FAILED);
            return Map.of();
        }

        compilation.messages().forEach(logger::info);
        if (compilation.isFailed()) {
            context.markRunException(RULES_FAILED);
            return Map.of();
        }

        ResultReporter reporter = new ResultReporter(
                context, configuration.minimumSeverity(), configuration.hideSkipped());
        Map<String, EvaluationResult> results = new LinkedHashMap<>();
        for (RuleGroup group : compilation.ruleGroups()) {
            EvaluationResult result = evaluator.evaluate(group, elements);
            reporter.report(group, result);
            results.put(group.ruleId(), result);
        }

        logger.info("Evaluation metrics: " + metrics.getSnapshot());
        context.markRunSuccess(String.format("Successfully applied %d rules to %d objects.",
                compilation.size(), elements.size()));
        return results;
    }

    /**
     * Counters accumulated over every run of this runner.
     */
    public EvaluatorMetrics getMetrics() {
        return metrics;
    }

    /**
     * Rule tables are read from the local file system; {@code file:} URLs and plain paths
     * are accepted.
     */
    static Path resolveRuleTable(String location) throws IOException {
        String trimmed = location.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            throw new IOException("Rule tables must be exported to a local file: " + trimmed);
        }
        try {
            return lower.startsWith("file:") ? Path.of(URI.create(trimmed)) : Path.of(trimmed);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid rule table location: " + trimmed, e);
        }
    }

    private static Object schemaVersion(Object root) {
        Object version = root instanceof ModelElement element ? element.get("version")
                : root instanceof Map<?, ?> map ? map.get("version") : null;
        return version == null ? 2 : version;
    }
}
