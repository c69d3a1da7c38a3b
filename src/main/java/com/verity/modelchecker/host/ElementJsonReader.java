/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.host;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.verity.modelchecker.model.ModelElement;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a model tree from JSON.
 *
 * Objects with an {@code id} or {@code speckle_type} member become {@link ModelElement}s,
 * other objects become ordered maps (parameter records, property groups), arrays become
 * lists. Member order is preserved.
 */
public class ElementJsonReader {
    static final String TYPE_MEMBER = "speckle_type";

    private final ObjectMapper objectMapper;

    public ElementJsonReader() {
        this(new ObjectMapper());
    }

    public ElementJsonReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Object read(Path path) throws IOException {
        return convert(objectMapper.readTree(path.toFile()));
    }

    public Object read(Reader reader) throws IOException {
        return convert(objectMapper.readTree(reader));
    }

    public Object parse(String json) throws IOException {
        return convert(objectMapper.readTree(json));
    }

    Object convert(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isObject()) {
            Map<String, Object> members = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                members.put(field.getKey(), convert(field.getValue()));
            }
            if (node.has(ModelElement.ID_MEMBER) || node.has(TYPE_MEMBER)) {
                ModelElement element = new ModelElement();
                members.forEach(element::set);
                return element;
            }
            return members;
        }
        if (node.isArray()) {
            List<Object> items = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                items.add(convert(item));
            }
            return items;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        return node.asText();
    }
}
