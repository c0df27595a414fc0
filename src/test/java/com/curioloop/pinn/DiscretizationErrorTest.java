/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for DiscretizationError codes and the exceptions carrying them.
 */
public class DiscretizationErrorTest {

    @ParameterizedTest
    @EnumSource(DiscretizationError.class)
    @DisplayName("Codes map back to their error")
    void testFromCode(DiscretizationError error) {
        assertThat(DiscretizationError.fromCode(error.getCode())).isSameAs(error);
        assertThat(error.toString()).contains(error.getMessage());
    }

    @Test
    @DisplayName("Unknown codes are rejected")
    void testUnknownCode() {
        assertThatThrownBy(() -> DiscretizationError.fromCode(99))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Each exception carries its error")
    void testExceptionErrors() {
        assertThat(new DuplicateVariableException("x").getError()).isEqualTo(DiscretizationError.DUPLICATE_VARIABLE);
        assertThat(new MalformedBoundaryConditionException("x").getError())
                .isEqualTo(DiscretizationError.MALFORMED_BOUNDARY_CONDITION);
        assertThat(new ParameterLengthMismatchException("x").getError())
                .isEqualTo(DiscretizationError.PARAMETER_LENGTH_MISMATCH);
        assertThat(new DimensionalityException("x").getError()).isEqualTo(DiscretizationError.DIMENSIONALITY);
        assertThat(new UnrecognizedExpressionPatternException("x").getError())
                .isEqualTo(DiscretizationError.UNRECOGNIZED_EXPRESSION_PATTERN);

        IllegalStateException cause = new IllegalStateException("boom");
        QuadratureException failure = new QuadratureException("x", cause);
        assertThat(failure.getError()).isEqualTo(DiscretizationError.QUADRATURE_FAILURE);
        assertThat(failure.getError().isCompileTime()).isFalse();
        assertThat(failure).hasCause(cause);
    }
}
