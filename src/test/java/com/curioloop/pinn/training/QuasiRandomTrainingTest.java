/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.training;

import com.curioloop.pinn.PdeFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for quasi-random sampling and training.
 */
public class QuasiRandomTrainingTest {

    private static final DomainBounds BOX = new DomainBounds(new double[]{-1, 2}, new double[]{1, 5});

    @ParameterizedTest
    @EnumSource(SamplingMethod.class)
    @DisplayName("Design matrices have the requested shape and stay in bounds")
    void testShape(SamplingMethod method) {
        double[][][] batches = QuasiRandomSampler.designMatrices(method, 16, BOX, 3, TrainingFixtures.random());

        assertThat(batches).hasNumberOfRows(3);
        for (double[][] batch : batches) {
            assertThat(batch).hasDimensions(16, 2);
            for (double[] p : batch) {
                assertThat(p[0]).isBetween(-1.0, 1.0);
                assertThat(p[1]).isBetween(2.0, 5.0);
            }
        }
    }

    @Test
    @DisplayName("Low-discrepancy minibatches are consecutive chunks of one sequence")
    void testSequenceChunks() {
        double[][][] split = QuasiRandomSampler.designMatrices(SamplingMethod.SOBOL, 8, BOX, 2, TrainingFixtures.random());
        double[][][] whole = QuasiRandomSampler.designMatrices(SamplingMethod.SOBOL, 16, BOX, 1, TrainingFixtures.random());

        assertThat(split[0]).isDeepEqualTo(Arrays.copyOfRange(whole[0], 0, 8));
        assertThat(split[1]).isDeepEqualTo(Arrays.copyOfRange(whole[0], 8, 16));
        assertThat(SamplingMethod.HALTON.isDeterministic()).isTrue();
        assertThat(SamplingMethod.UNIFORM.isDeterministic()).isFalse();
    }

    @Test
    @DisplayName("Latin hypercube puts one point in every stratum of every axis")
    void testLatinHypercube() {
        int n = 10;
        double[][][] batches = QuasiRandomSampler.designMatrices(SamplingMethod.LATIN_HYPERCUBE, n,
                new DomainBounds(new double[]{0, 0}, new double[]{1, 1}), 1, TrainingFixtures.random());

        for (int axis = 0; axis < 2; axis++) {
            boolean[] hit = new boolean[n];
            for (double[] p : batches[0]) {
                hit[(int) Math.floor(p[axis] * n)] = true;
            }
            assertThat(hit).doesNotContain(false);
        }
    }

    @Test
    @DisplayName("Zero-dimensional regions yield empty points")
    void testPointRegion() {
        double[][][] batches = QuasiRandomSampler.designMatrices(SamplingMethod.SOBOL, 4,
                new DomainBounds(new double[0], new double[0]), 2, TrainingFixtures.random());

        assertThat(batches).hasNumberOfRows(2);
        assertThat(batches[1]).hasDimensions(4, 0);
    }

    @Test
    @DisplayName("Training draws one minibatch per term and rescales the boundary count")
    void testDiscretize() {
        CountingResidual pde = new CountingResidual(2, 1.0);
        List<CountingResidual> boundaries = new ArrayList<>();
        QuasiRandomTraining strategy = QuasiRandomTraining.builder()
                .pointCount(100).sampling(SamplingMethod.HALTON).minibatchCount(4).build();

        TrainingLosses losses = strategy.discretize(TrainingFixtures.context(PdeFixtures.poisson(), pde, boundaries));

        assertThat(losses.getPdeLoss().evaluate(new double[0])).isCloseTo(1.0, within(1e-12));
        assertThat(pde.calls()).isEqualTo(100);
        assertThat(losses.getBoundaryLoss().evaluate(new double[0])).isCloseTo(4.0, within(1e-12));
        assertThat(boundaries).allSatisfy(bc -> assertThat(bc.calls()).isEqualTo(10));

        SampledLoss bc = (SampledLoss) losses.getBoundaryLoss();
        assertThat(bc.getSamplers()).allSatisfy(s -> assertThat(((MinibatchSampler) s).minibatchCount()).isEqualTo(4));
    }

    @Test
    @DisplayName("Rescaled copies keep sampling method and minibatch count")
    void testWithPointCount() {
        QuasiRandomTraining strategy = QuasiRandomTraining.builder()
                .sampling(SamplingMethod.SOBOL).minibatchCount(7).build();

        QuasiRandomTraining rescaled = strategy.withPointCount(12);

        assertThat(rescaled.getPointCount()).isEqualTo(12);
        assertThat(rescaled.getSampling()).isEqualTo(SamplingMethod.SOBOL);
        assertThat(rescaled.getMinibatchCount()).isEqualTo(7);
        assertThat(QuasiRandomTraining.defaults().getSampling()).isEqualTo(SamplingMethod.UNIFORM);
        assertThatThrownBy(() -> QuasiRandomTraining.builder().minibatchCount(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
