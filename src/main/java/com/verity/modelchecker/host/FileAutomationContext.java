/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.host;

import com.verity.modelchecker.api.AutomationContext;
import com.verity.modelchecker.model.Severity;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Host context for local runs: the model comes from a JSON file and annotations are kept
 * in memory and written to the log.
 */
public class FileAutomationContext implements AutomationContext {
    private static final Logger logger = Logger.getLogger(FileAutomationContext.class.getName());

    public enum RunStatus { RUNNING, SUCCEEDED, EXCEPTION }

    /**
     * One attached annotation. {@code level} is null for informational annotations.
     */
    public record Annotation(String category, List<String> elementIds, String message, Severity level,
                             Map<String, Object> metadata) {

        public Annotation {
            elementIds = List.copyOf(elementIds);
            metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(metadata);
        }

        public boolean isInfo() {
            return level == null;
        }
    }

    private final Path modelFile;
    private final ElementJsonReader jsonReader;
    private final List<Annotation> annotations = new ArrayList<>();
    private RunStatus status = RunStatus.RUNNING;
    private String statusMessage;

    public FileAutomationContext(Path modelFile) {
        this(modelFile, new ElementJsonReader());
    }

    public FileAutomationContext(Path modelFile, ElementJsonReader jsonReader) {
        this.modelFile = modelFile;
        this.jsonReader = jsonReader;
    }

    @Override
    public Object receiveModel() throws IOException {
        if (modelFile == null || !Files.isRegularFile(modelFile)) {
            throw new IOException("Model file not found: " + modelFile);
        }
        return jsonReader.read(modelFile);
    }

    @Override
    public void attachInfo(String category, List<String> elementIds, String message, Map<String, Object> metadata) {
        annotations.add(new Annotation(category, elementIds, message, null, metadata));
        logger.info(String.format("[%s] %s (%d objects)", category, message, elementIds.size()));
    }

    @Override
    public void attachResult(String category, List<String> elementIds, String message, Severity level,
                             Map<String, Object> metadata) {
        annotations.add(new Annotation(category, elementIds, message, level, metadata));
        logger.log(level == Severity.ERROR ? Level.SEVERE : Level.WARNING,
                String.format("[%s] %s: %s %s", category, level.label(), message, elementIds));
    }

    @Override
    public void markRunSuccess(String summary) {
        status = RunStatus.SUCCEEDED;
        statusMessage = summary;
        logger.info(summary);
    }

    @Override
    public void markRunException(String reason) {
        status = RunStatus.EXCEPTION;
        statusMessage = reason;
        logger.severe(reason);
    }

    public List<Annotation> annotations() {
        return Collections.unmodifiableList(annotations);
    }

    public RunStatus status() {
        return status;
    }

    public String statusMessage() {
        return statusMessage;
    }
}
