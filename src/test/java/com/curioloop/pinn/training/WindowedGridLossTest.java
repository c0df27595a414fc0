/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.training;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the growing evaluation window.
 */
public class WindowedGridLossTest {

    private static List<double[]> points(int n) {
        List<double[]> points = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            points.add(new double[]{i});
        }
        return points;
    }

    @Test
    @DisplayName("Window grows by half a chunk per call and saturates")
    void testGrowth() {
        WindowedGridLoss loss = new WindowedGridLoss(new CountingResidual(1, 1), points(81), false, 10);

        // chunk = 8.1 points; cursor 1, 1.5, 2, 2.5
        assertThat(loss.windowAt(0)).isEqualTo(8);
        assertThat(loss.windowAt(1)).isEqualTo(12);
        assertThat(loss.windowAt(2)).isEqualTo(16);
        assertThat(loss.windowAt(3)).isEqualTo(20);
        assertThat(loss.windowAt(18)).isEqualTo(81);
        assertThat(loss.windowAt(1000)).isEqualTo(81);
    }

    @Test
    @DisplayName("Window is at least one point")
    void testLowerClamp() {
        WindowedGridLoss loss = new WindowedGridLoss(new CountingResidual(1, 1), points(5), false, 100);

        assertThat(loss.windowAt(0)).isEqualTo(1);
    }

    @Test
    @DisplayName("Each call evaluates the current prefix and advances the cursor")
    void testEvaluation() {
        CountingResidual residual = new CountingResidual(1, 2);
        List<double[]> points = points(81);
        WindowedGridLoss loss = new WindowedGridLoss(residual, points, false, 10);

        assertThat(loss.evaluate(new double[0])).isCloseTo(8 * 4.0 / 81, within(1e-12));
        assertThat(residual.points()).containsExactlyElementsOf(points.subList(0, 8));
        assertThat(loss.nextWindow()).isEqualTo(12);

        residual.clear();
        assertThat(loss.evaluate(new double[0])).isCloseTo(12 * 4.0 / 81, within(1e-12));
        assertThat(residual.calls()).isEqualTo(12);

        WindowedGridLoss fresh = new WindowedGridLoss(residual, points, false, 10);
        assertThat(fresh.nextWindow()).isEqualTo(8);
        assertThat(loss.nextWindow()).isEqualTo(16);
    }

    @Test
    @DisplayName("Configuration is validated")
    void testValidation() {
        assertThatThrownBy(() -> WindowedGridTraining.of(0.1, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(WindowedGridTraining.of(5).getSteps()).containsExactly(GridTraining.DEFAULT_STEP);
    }
}
