/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.expr;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Arrays;

import static com.curioloop.pinn.expr.Expressions.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for operators and expression construction.
 */
public class OperatorTest {

    @ParameterizedTest
    @EnumSource(Operator.class)
    @DisplayName("Fixed-arity operators reject other argument counts")
    void testArity(Operator operator) {
        if (operator.getArity() < 0) {
            assertThat(operator.accepts(1)).isTrue();
            assertThat(operator.accepts(5)).isTrue();
            assertThat(operator.accepts(0)).isFalse();
        } else {
            assertThat(operator.accepts(operator.getArity())).isTrue();
            assertThat(operator.accepts(operator.getArity() + 1)).isFalse();
        }
    }

    @Test
    @DisplayName("Operators apply to evaluated arguments")
    void testApply() {
        assertThat(Operator.ADD.apply(new double[]{1, 2, 3})).isEqualTo(6);
        assertThat(Operator.MULTIPLY.apply(new double[]{2, 3, 4})).isEqualTo(24);
        assertThat(Operator.SUBTRACT.apply(new double[]{5, 2})).isEqualTo(3);
        assertThat(Operator.DIVIDE.apply(new double[]{1, 4})).isEqualTo(0.25);
        assertThat(Operator.POWER.apply(new double[]{2, 10})).isEqualTo(1024);
        assertThat(Operator.NEGATE.apply(new double[]{2})).isEqualTo(-2);
        assertThat(Operator.TANH.apply(new double[]{0.3})).isCloseTo(Math.tanh(0.3), within(1e-15));
    }

    @Test
    @DisplayName("Operations check their argument count")
    void testOperationArity() {
        assertThatThrownBy(() -> new Operation(Operator.SIN, Arrays.asList(constant(1), constant(2))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Expressions render readably")
    void testRendering() {
        Expression e = subtract(derivative(apply("u", "x", "t"), "t"), multiply(constant(0.5), sin(variable("x"))));

        assertThat(e.toString()).contains("u(x, t)").contains("0.5").contains("sin(x)");
        assertThat(constant(2).toString()).isEqualTo("2");
    }
}
