/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns stable 1-based indices to variable names in declaration order.
 * <p>
 * Names are normalized by trimming surrounding whitespace. Instances are
 * immutable.
 * </p>
 */
public final class VariableRegistry {

    private final Map<String, Integer> indices;
    private final List<String> names;

    private VariableRegistry(Map<String, Integer> indices, List<String> names) {
        this.indices = indices;
        this.names = names;
    }

    /**
     * Creates a registry from an ordered list of names.
     * @param names Variable names in declaration order
     * @return Registry
     * @throws DuplicateVariableException if two names collide after normalization
     */
    public static VariableRegistry of(List<String> names) {
        if (names == null) {
            throw new IllegalArgumentException("Variable names cannot be null");
        }
        Map<String, Integer> indices = new LinkedHashMap<>();
        List<String> normalized = new ArrayList<>(names.size());
        for (String name : names) {
            String key = normalize(name);
            if (indices.containsKey(key)) {
                throw new DuplicateVariableException("Variable '" + key + "' is declared more than once");
            }
            indices.put(key, normalized.size() + 1);
            normalized.add(key);
        }
        return new VariableRegistry(Collections.unmodifiableMap(indices), Collections.unmodifiableList(normalized));
    }

    /**
     * Creates a registry from names given inline.
     * @param names Variable names in declaration order
     * @return Registry
     */
    public static VariableRegistry of(String... names) {
        return of(Arrays.asList(names));
    }

    /**
     * Normalizes a variable name.
     * @param name Raw name
     * @return Trimmed name
     * @throws IllegalArgumentException if the name is null or blank
     */
    public static String normalize(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Variable name cannot be null or blank");
        }
        return name.trim();
    }

    /**
     * Gets the 1-based index of a variable.
     * @param name Variable name
     * @return Index in {@code 1..size()}
     * @throws IllegalArgumentException if the name is not registered
     */
    public int indexOf(String name) {
        Integer index = indices.get(normalize(name));
        if (index == null) {
            throw new IllegalArgumentException("Unknown variable: " + name);
        }
        return index;
    }

    /**
     * Checks if a variable is registered.
     * @param name Variable name
     * @return true if registered
     */
    public boolean contains(String name) {
        return name != null && indices.containsKey(name.trim());
    }

    /**
     * Gets the name at a 1-based index.
     * @param index Index in {@code 1..size()}
     * @return Variable name
     */
    public String nameAt(int index) {
        return names.get(index - 1);
    }

    /**
     * Gets the registered names in index order.
     * @return Unmodifiable list of names
     */
    public List<String> names() {
        return names;
    }

    /**
     * Gets the number of registered variables.
     * @return Variable count
     */
    public int size() {
        return names.size();
    }

    @Override
    public String toString() {
        return "VariableRegistry" + indices;
    }
}
