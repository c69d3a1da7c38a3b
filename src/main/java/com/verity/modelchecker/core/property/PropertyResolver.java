/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.core.property;

import com.verity.modelchecker.model.ModelElement;
import it.unimi.dsi.fastutil.objects.ReferenceOpenHashSet;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Locates property values inside schema-ambiguous elements.
 *
 * The same search serves both element layouts: the path is normalised (see
 * {@link PropertyPath}), matched segment by segment from the element root, and, when that
 * fails, retried from every nested container in depth-first order. Matching is
 * case-insensitive at every segment. A segment that names no key may also match a legacy
 * parameter record through its display {@code name}.
 *
 * In {@link PropertyMatchMode#STRICT} mode only the path as written is walked from the root,
 * schema container segments included.
 *
 * Containers are {@link ModelElement}s and maps; lists and primitives are leaves. Members
 * of model elements whose names start with an underscore are not descended into.
 *
 * Thread-safety: stateless apart from the configured mode; the visited set used for cycle
 * detection is created per lookup.
 */
public final class PropertyResolver {
    private static final Object MISSING = new Object();
    private static final String VALUE_MEMBER = "value";
    private static final String NAME_MEMBER = "name";

    private final PropertyMatchMode matchMode;

    public PropertyResolver() {
        this(PropertyMatchMode.MIXED);
    }

    public PropertyResolver(PropertyMatchMode matchMode) {
        this.matchMode = matchMode == null ? PropertyMatchMode.MIXED : matchMode;
    }

    public PropertyMatchMode matchMode() {
        return matchMode;
    }

    public PropertyLookup findProperty(Object element, String path) {
        return findProperty(element, path, false);
    }

    /**
     * Searches an element for a property.
     *
     * @param element the element (model element or map)
     * @param path    dotted property path
     * @param raw     when true the matched leaf is returned as is; otherwise a record's
     *                {@code value} member is unwrapped and Yes/No strings become booleans
     * @return the lookup result; never null
     */
    public PropertyLookup findProperty(Object element, String path, boolean raw) {
        PropertyPath propertyPath = PropertyPath.parse(path);
        if (propertyPath.isEmpty() || !isContainer(element)) {
            return PropertyLookup.NOT_FOUND;
        }

        PropertyLookup lookup = switch (matchMode) {
            case STRICT -> walk(element, propertyPath.literalSegments());
            case FUZZY -> traverse(element, propertyPath.leaf().segments(), new ReferenceOpenHashSet<>());
            case MIXED -> traverse(element, propertyPath.segments(), new ReferenceOpenHashSet<>());
        };
        return lookup.found() ? PropertyLookup.of(extractValue(lookup.value(), raw)) : lookup;
    }

    /**
     * True iff the property exists, whatever its value.
     */
    public boolean hasParameter(Object element, String path) {
        return findProperty(element, path).found();
    }

    public Object getParameterValue(Object element, String path) {
        return getParameterValue(element, path, null, false);
    }

    public Object getParameterValue(Object element, String path, Object defaultValue, boolean raw) {
        return findProperty(element, path, raw).valueOr(defaultValue);
    }

    /**
     * Unwraps a parameter record's {@code value} member without any coercion. Anything that
     * is not a record with a value is returned unchanged.
     */
    public static Object unwrapRecordValue(Object leaf) {
        if (leaf instanceof Map<?, ?> map && map.containsKey(VALUE_MEMBER)) {
            return map.get(VALUE_MEMBER);
        }
        if (leaf instanceof ModelElement modelElement && modelElement.has(VALUE_MEMBER)) {
            return modelElement.get(VALUE_MEMBER);
        }
        return leaf;
    }

    /**
     * Converts "Yes"/"No" (any case) to booleans; every other value is returned unchanged.
     */
    public static Object convertYesNo(Object value) {
        if (value instanceof String text) {
            String lower = text.trim().toLowerCase(Locale.ROOT);
            if (lower.equals("yes")) return Boolean.TRUE;
            if (lower.equals("no")) return Boolean.FALSE;
        }
        return value;
    }

    static Object extractValue(Object leaf, boolean raw) {
        if (raw) {
            return leaf;
        }
        if (isContainer(leaf)) {
            Object unwrapped = unwrapRecordValue(leaf);
            return unwrapped == leaf ? leaf : convertYesNo(unwrapped);
        }
        if (leaf instanceof List<?>) {
            return leaf;
        }
        return convertYesNo(leaf);
    }

    private PropertyLookup traverse(Object node, List<String> segments, Set<Object> visited) {
        if (!isContainer(node) || !visited.add(node)) {
            return PropertyLookup.NOT_FOUND;
        }

        PropertyLookup direct = walk(node, segments);
        if (direct.found()) {
            return direct;
        }

        if (node instanceof Map<?, ?> map) {
            for (Object child : map.values()) {
                if (isContainer(child)) {
                    PropertyLookup nested = traverse(child, segments, visited);
                    if (nested.found()) return nested;
                }
            }
        } else if (node instanceof ModelElement modelElement) {
            for (String name : modelElement.memberNames()) {
                if (name.startsWith("_")) continue;
                Object child = modelElement.get(name);
                if (isContainer(child)) {
                    PropertyLookup nested = traverse(child, segments, visited);
                    if (nested.found()) return nested;
                }
            }
        }
        return PropertyLookup.NOT_FOUND;
    }

    /**
     * Follows the segments from {@code node}, taking the first matching member at each level.
     */
    private PropertyLookup walk(Object node, List<String> segments) {
        Object current = node;
        for (String segment : segments) {
            current = child(current, segment);
            if (current == MISSING) {
                return PropertyLookup.NOT_FOUND;
            }
        }
        return PropertyLookup.of(current);
    }

    private Object child(Object node, String segment) {
        if (node instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (String.valueOf(entry.getKey()).equalsIgnoreCase(segment)) {
                    return entry.getValue();
                }
            }
            for (Object value : map.values()) {
                if (hasDisplayName(value, segment)) {
                    return value;
                }
            }
        } else if (node instanceof ModelElement modelElement) {
            for (String name : modelElement.memberNames()) {
                if (name.equalsIgnoreCase(segment)) {
                    return modelElement.get(name);
                }
            }
            for (String name : modelElement.memberNames()) {
                Object value = modelElement.get(name);
                if (hasDisplayName(value, segment)) {
                    return value;
                }
            }
        }
        return MISSING;
    }

    // Legacy parameter records are keyed by internal name or GUID and carry the display name.
    private static boolean hasDisplayName(Object record, String segment) {
        Object name = null;
        if (record instanceof Map<?, ?> map && map.containsKey(VALUE_MEMBER)) {
            name = map.get(NAME_MEMBER);
        } else if (record instanceof ModelElement modelElement && modelElement.has(VALUE_MEMBER)) {
            name = modelElement.get(NAME_MEMBER);
        }
        return name instanceof String text && text.equalsIgnoreCase(segment);
    }

    private static boolean isContainer(Object value) {
        return value instanceof Map<?, ?> || value instanceof ModelElement;
    }
}
