/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.expr;

import com.curioloop.pinn.TrialSolutionAdapter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the central-difference derivative operator.
 */
public class NumericDerivativeTest {

    private static final double H = NumericDerivative.STEP;

    private static final TrialSolutionAdapter SQUARE = new TrialSolutionAdapter((c, p) -> new double[]{c[0] * c[0]});

    @Test
    @DisplayName("Step is the cube root of single-precision epsilon")
    void testStep() {
        assertThat(H).isCloseTo(Math.cbrt(Math.pow(2, -23)), within(1e-15));
    }

    @Test
    @DisplayName("First derivative of x² at 2 is 4")
    void testFirstOrder() {
        double d = NumericDerivative.INSTANCE.evaluate(SQUARE, new double[]{2.0}, new double[][]{{H}}, 1, new double[0]);

        assertThat(d).isCloseTo(4.0, within(1e-6));
    }

    @Test
    @DisplayName("Second derivative of x² at 2 is 2")
    void testSecondOrder() {
        double d = NumericDerivative.INSTANCE.evaluate(SQUARE, new double[]{2.0}, new double[][]{{H}, {H}}, 2, new double[0]);

        assertThat(d).isCloseTo(2.0, within(1e-5));
    }

    @Test
    @DisplayName("Mixed partial of x·y is 1")
    void testMixedPartial() {
        TrialSolutionAdapter product = new TrialSolutionAdapter((c, p) -> new double[]{p[0] * c[0] * c[1]});
        double[][] eps = {{0, H}, {H, 0}};

        double d = NumericDerivative.INSTANCE.evaluate(product, new double[]{0.3, -1.2}, eps, 2, new double[]{3});

        assertThat(d).isCloseTo(3.0, within(1e-5));
    }

    @Test
    @DisplayName("Only output component 0 is differentiated")
    void testFirstComponent() {
        TrialSolutionAdapter vector = new TrialSolutionAdapter((c, p) -> new double[]{Math.sin(c[0]), 100 * c[0]});

        double d = NumericDerivative.INSTANCE.evaluate(vector, new double[]{0.5}, new double[][]{{H}}, 1, new double[0]);

        assertThat(d).isCloseTo(Math.cos(0.5), within(1e-5));
    }

    @Test
    @DisplayName("Order must fit the perturbation vectors")
    void testInvalidOrder() {
        assertThatThrownBy(() -> NumericDerivative.INSTANCE.evaluate(SQUARE, new double[]{1}, new double[][]{{H}}, 2, new double[0]))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new NumericDerivative(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
