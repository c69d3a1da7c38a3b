/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.verity.modelchecker.model.Severity;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Builds the structured metadata attached with every rule annotation.
 *
 * Metadata is only handed to the host when Jackson can serialise it; otherwise an empty
 * map is used and the problem is logged.
 */
public class ResultMetadata {
    private static final Logger logger = Logger.getLogger(ResultMetadata.class.getName());

    public static final String RULE_ID = "rule_id";
    public static final String STATUS = "status";
    public static final String SEVERITY = "severity";
    public static final String MESSAGE = "message";
    public static final String OBJECT_COUNT = "object_count";

    private final ObjectMapper objectMapper;

    public ResultMetadata() {
        this(new ObjectMapper());
    }

    public ResultMetadata(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> create(String ruleId, boolean passed, Severity severity, String message,
                                      int objectCount) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(RULE_ID, ruleId);
        metadata.put(STATUS, passed ? "PASS" : "FAIL");
        metadata.put(SEVERITY, severity.label());
        metadata.put(MESSAGE, message);
        metadata.put(OBJECT_COUNT, objectCount);
        return serializableOrEmpty(metadata);
    }

    /**
     * Returns the metadata unchanged if it serialises to JSON, else an empty map.
     */
    public Map<String, Object> serializableOrEmpty(Map<String, Object> metadata) {
        try {
            objectMapper.writeValueAsString(metadata);
            return metadata;
        } catch (JsonProcessingException e) {
            logger.warning("Error creating metadata: " + e.getOriginalMessage());
            return Map.of();
        }
    }
}
