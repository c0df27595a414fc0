/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for VariableRegistry.
 */
public class VariableRegistryTest {

    @Test
    @DisplayName("Indices are 1-based in declaration order")
    void testIndices() {
        VariableRegistry registry = VariableRegistry.of("t", "x", "y");

        assertThat(registry.indexOf("t")).isEqualTo(1);
        assertThat(registry.indexOf("x")).isEqualTo(2);
        assertThat(registry.indexOf("y")).isEqualTo(3);
        assertThat(registry.nameAt(2)).isEqualTo("x");
        assertThat(registry.names()).containsExactly("t", "x", "y");
        assertThat(registry.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("Names are trimmed before lookup")
    void testNormalization() {
        VariableRegistry registry = VariableRegistry.of(Arrays.asList(" x", "y "));

        assertThat(registry.contains("x")).isTrue();
        assertThat(registry.indexOf(" y")).isEqualTo(2);
        assertThat(registry.contains("z")).isFalse();
    }

    @Test
    @DisplayName("Duplicate names are rejected")
    void testDuplicates() {
        assertThatThrownBy(() -> VariableRegistry.of("x", "y", "x"))
                .isInstanceOf(DuplicateVariableException.class)
                .hasMessageContaining("x");
        assertThatThrownBy(() -> VariableRegistry.of("x", " x "))
                .isInstanceOf(DuplicateVariableException.class);
    }

    @Test
    @DisplayName("Blank names and unknown lookups are rejected")
    void testInvalidNames() {
        assertThatThrownBy(() -> VariableRegistry.of("x", " "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> VariableRegistry.of("x").indexOf("y"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("PDE system builder rejects repeated independent variables")
    void testSystemDuplicate() {
        PdeSystem.Builder builder = PdeSystem.builder().independentVariable("x", Interval.between(0, 1));

        assertThatThrownBy(() -> builder.independentVariable("x", Interval.between(0, 2)))
                .isInstanceOf(DuplicateVariableException.class)
                .satisfies(e -> assertThat(((DiscretizationException) e).getError())
                        .isEqualTo(DiscretizationError.DUPLICATE_VARIABLE));
    }
}
