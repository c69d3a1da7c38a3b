/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A dynamically-typed model object: an identifier plus an ordered set of named members.
 *
 * Members hold primitives, lists, nested {@code ModelElement}s or plain maps, so both
 * historical element layouts can be represented without a fixed schema:
 * <ul>
 *   <li>legacy: a {@code parameters} member whose members are parameter records
 *       ({@code name}, {@code value}, {@code units}, ...)</li>
 *   <li>current: a {@code properties} map holding a categorised {@code Parameters} tree</li>
 * </ul>
 *
 * The identifier is also exposed as the {@code id} member. Elements are read-only while
 * rules are evaluated; equality is identity.
 */
public final class ModelElement {
    public static final String ID_MEMBER = "id";

    private final Map<String, Object> members = new LinkedHashMap<>();

    public ModelElement() {
    }

    public ModelElement(String id) {
        if (id != null) {
            members.put(ID_MEMBER, id);
        }
    }

    public ModelElement(String id, Map<String, ?> members) {
        this(id);
        if (members != null) {
            members.forEach(this::set);
        }
    }

    /**
     * Returns the element identifier, or null when the element carries none.
     */
    public String id() {
        Object id = members.get(ID_MEMBER);
        return id == null ? null : String.valueOf(id);
    }

    /**
     * Identifier of any element representation: {@link #id()} for model elements, the
     * {@code id} entry for maps, null otherwise.
     */
    public static String idOf(Object element) {
        if (element instanceof ModelElement modelElement) {
            return modelElement.id();
        }
        if (element instanceof Map<?, ?> map) {
            Object id = map.get(ID_MEMBER);
            return id == null ? null : String.valueOf(id);
        }
        return null;
    }

    /**
     * Sets a member, replacing any previous value. Returns this element for chaining.
     */
    public ModelElement set(String name, Object value) {
        Objects.requireNonNull(name, "Member name cannot be null");
        members.put(name, value);
        return this;
    }

    public Object get(String name) {
        return members.get(name);
    }

    public boolean has(String name) {
        return members.containsKey(name);
    }

    /**
     * Member names in insertion order.
     */
    public List<String> memberNames() {
        return List.copyOf(members.keySet());
    }

    public Map<String, Object> members() {
        return Collections.unmodifiableMap(members);
    }

    @Override
    public String toString() {
        return "ModelElement[id=" + id() + ", members=" + members.keySet() + ']';
    }
}
