/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.training;

import com.curioloop.pinn.PdeFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for stochastic training.
 */
public class StochasticTrainingTest {

    @Test
    @DisplayName("Each evaluation draws exactly P fresh points in the domain")
    void testPointCount() {
        CountingResidual pde = new CountingResidual(2, 2.0);
        List<CountingResidual> boundaries = new ArrayList<>();
        TrainingLosses losses = StochasticTraining.of(100)
                .discretize(TrainingFixtures.context(PdeFixtures.poisson(), pde, boundaries));

        double value = losses.getPdeLoss().evaluate(new double[0]);

        assertThat(pde.calls()).isEqualTo(100);
        assertThat(value).isCloseTo(4.0, within(1e-12));
        assertThat(pde.points()).allSatisfy(p -> {
            assertThat(p[0]).isBetween(0.0, 1.0);
            assertThat(p[1]).isBetween(0.0, 1.0);
        });

        List<double[]> first = new ArrayList<>(pde.points());
        pde.clear();
        losses.getPdeLoss().evaluate(new double[0]);
        assertThat(pde.calls()).isEqualTo(100);
        assertThat(pde.points().get(0)).isNotEqualTo(first.get(0));
    }

    @Test
    @DisplayName("Boundary point count is rescaled to the boundary dimension")
    void testBoundaryRescaling() {
        CountingResidual pde = new CountingResidual(2, 0.0);
        List<CountingResidual> boundaries = new ArrayList<>();
        TrainingContext context = TrainingFixtures.context(PdeFixtures.poisson(), pde, boundaries);

        assertThat(context.boundaryPointCount(100)).isEqualTo(10);

        double value = StochasticTraining.of(100).discretize(context).getBoundaryLoss().evaluate(new double[0]);

        assertThat(boundaries).hasSize(4).allSatisfy(bc -> assertThat(bc.calls()).isEqualTo(10));
        // 4 conditions * 10 unit residuals / 10
        assertThat(value).isCloseTo(4.0, within(1e-12));
    }

    @Test
    @DisplayName("Rescaling rounds and handles point-like boundaries")
    void testRescale() {
        assertThat(TrainingContext.rescale(100, 1, 2)).isEqualTo(10);
        assertThat(TrainingContext.rescale(50, 1, 2)).isEqualTo(7);
        assertThat(TrainingContext.rescale(1000, 2, 3)).isEqualTo(100);
        assertThat(TrainingContext.rescale(100, 0, 2)).isEqualTo(1);
        assertThat(TrainingContext.rescale(1, 1, 3)).isEqualTo(1);
    }

    @Test
    @DisplayName("Point count must be positive")
    void testValidation() {
        assertThatThrownBy(() -> StochasticTraining.of(0)).isInstanceOf(IllegalArgumentException.class);
        assertThat(StochasticTraining.defaults().getPointCount()).isEqualTo(StochasticTraining.DEFAULT_POINT_COUNT);
    }
}
