/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.host;

import com.verity.modelchecker.model.ModelElement;
import it.unimi.dsi.fastutil.objects.ReferenceOpenHashSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flattens a model tree into the ordered element sequence rules are applied to.
 *
 * Each element is listed before its children; children are found under
 * {@code elements} or {@code @elements}. An element reachable twice is listed once.
 */
public class ElementFlattener {
    static final String ELEMENTS = "elements";
    static final String DETACHED_ELEMENTS = "@elements";

    public List<Object> flatten(Object root) {
        List<Object> flat = new ArrayList<>();
        collect(root, flat, new ReferenceOpenHashSet<>());
        return flat;
    }

    private void collect(Object node, List<Object> flat, Set<Object> seen) {
        if (!(node instanceof ModelElement || node instanceof Map<?, ?>) || !seen.add(node)) {
            return;
        }
        flat.add(node);
        for (Object child : children(node)) {
            collect(child, flat, seen);
        }
    }

    private static List<?> children(Object node) {
        Object elements = member(node, ELEMENTS);
        if (elements == null) {
            elements = member(node, DETACHED_ELEMENTS);
        }
        return elements instanceof List<?> list ? list : List.of();
    }

    private static Object member(Object node, String name) {
        if (node instanceof ModelElement element) {
            return element.get(name);
        }
        return ((Map<?, ?>) node).get(name);
    }
}
