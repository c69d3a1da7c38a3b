/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker;

import com.verity.modelchecker.config.CheckerConfiguration;
import com.verity.modelchecker.host.FileAutomationContext;
import com.verity.modelchecker.host.ModelCheckRunner;
import com.verity.modelchecker.infrastructure.telemetry.TracingService;

import java.io.IOException;
import java.io.InputStream;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command-line entry point: checks a JSON model file against a TSV rule table.
 *
 * Usage: {@code ModelCheckerApplication [rule-table] [model-file]}. Arguments override
 * {@code checker.spreadsheet.url} and {@code checker.model.file}.
 */
public class ModelCheckerApplication {
    private static final Logger logger = Logger.getLogger(ModelCheckerApplication.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_RUN_FAILED = 1;
    static final int EXIT_INVALID_CONFIGURATION = 2;

    public static void main(String[] args) {
        configureLogging();
        if (args.length > 0) System.setProperty(CheckerConfiguration.SPREADSHEET_URL, args[0]);
        if (args.length > 1) System.setProperty(CheckerConfiguration.MODEL_FILE, args[1]);

        int exitCode = run(CheckerConfiguration::load, TracingService.getInstance());
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    /**
     * Runs one check and returns the process exit code. Tracing is shut down before returning,
     * whatever the outcome.
     */
    static int run(Supplier<CheckerConfiguration> configurationSource, TracingService tracingService) {
        try {
            CheckerConfiguration configuration = configurationSource.get();
            logger.info("Starting model check: rules=" + configuration.spreadsheetUrl()
                    + ", model=" + configuration.modelFile()
                    + ", minimumSeverity=" + configuration.minimumSeverity().label());

            FileAutomationContext context = new FileAutomationContext(configuration.modelFile());
            new ModelCheckRunner(configuration, tracingService.getTracer()).run(context);

            return context.status() == FileAutomationContext.RunStatus.SUCCEEDED ? EXIT_OK : EXIT_RUN_FAILED;
        } catch (IllegalArgumentException e) {
            logger.log(Level.SEVERE, "Invalid configuration: " + e.getMessage(), e);
            return EXIT_INVALID_CONFIGURATION;
        } finally {
            tracingService.shutdown();
        }
    }

    private static void configureLogging() {
        try (InputStream config = ModelCheckerApplication.class.getResourceAsStream("/logging.properties")) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not load logging.properties, using JVM defaults", e);
        }
    }
}
