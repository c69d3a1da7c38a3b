/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.core.property;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * A dotted property path with the schema container segments removed.
 *
 * "properties" and "parameters" are elided at any position (case-insensitively), so
 * {@code properties.Parameters.Instance Parameters.Dimensions.Length} and
 * {@code Instance Parameters.Dimensions.Length} address the same value, and
 * {@code parameters.WALL_ATTR_WIDTH_PARAM} is just {@code WALL_ATTR_WIDTH_PARAM}.
 */
public final class PropertyPath {
    private static final Set<String> SCHEMA_SEGMENTS = Set.of("properties", "parameters");

    private final String source;
    private final List<String> segments;
    private final List<String> literalSegments;

    private PropertyPath(String source, List<String> segments, List<String> literalSegments) {
        this.source = source;
        this.segments = segments;
        this.literalSegments = literalSegments;
    }

    public static PropertyPath parse(String path) {
        if (path == null || path.isEmpty()) {
            return new PropertyPath(path, List.of(), List.of());
        }
        List<String> segments = new ArrayList<>();
        List<String> literal = new ArrayList<>();
        for (String part : path.split("\\.", -1)) {
            if (part.isEmpty()) continue;
            literal.add(part);
            if (!SCHEMA_SEGMENTS.contains(part.toLowerCase(Locale.ROOT))) {
                segments.add(part);
            }
        }
        return new PropertyPath(path, List.copyOf(segments), List.copyOf(literal));
    }

    public List<String> segments() {
        return segments;
    }

    /**
     * All segments as written, schema container segments included.
     */
    public List<String> literalSegments() {
        return literalSegments;
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    /**
     * The last segment only, used for hierarchy-agnostic matching.
     */
    public PropertyPath leaf() {
        if (segments.size() <= 1) {
            return this;
        }
        List<String> last = List.of(segments.get(segments.size() - 1));
        return new PropertyPath(source, last, last);
    }

    public String normalized() {
        return String.join(".", segments);
    }

    @Override
    public String toString() {
        return source;
    }
}
