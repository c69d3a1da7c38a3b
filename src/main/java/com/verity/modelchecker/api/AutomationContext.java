/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.api;

import com.verity.modelchecker.model.Severity;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Host automation runtime: supplies the model and collects result annotations.
 * The host owns the run lifecycle; the checker only marks the run's outcome.
 */
public interface AutomationContext {

    /**
     * Returns the root of the model under check.
     *
     * @throws IOException if the model cannot be received
     */
    Object receiveModel() throws IOException;

    /**
     * Attaches an informational annotation to the given elements.
     */
    void attachInfo(String category, List<String> elementIds, String message, Map<String, Object> metadata);

    /**
     * Attaches a result annotation at the given level to the given elements.
     */
    void attachResult(String category, List<String> elementIds, String message, Severity level,
                      Map<String, Object> metadata);

    void markRunSuccess(String summary);

    void markRunException(String reason);
}
