/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.training;

import com.curioloop.pinn.Interval;
import com.curioloop.pinn.PdeFixtures;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for grid sets and domain bounds.
 */
public class TrainingSetGeneratorTest {

    @Property(tries = 3)
    @Label("Full grid over the unit cube has 11^D points")
    void gridCardinality(@ForAll @IntRange(min = 1, max = 3) int dimension) {
        TrainingSets sets = TrainingFixtures.generator(PdeFixtures.cube(dimension)).generate(new double[]{0.1});
        int full = (int) Math.pow(11, dimension);

        assertThat(sets.getDomainPoints()).hasSize(full);
        // the boundary condition fixes x1 = 0
        assertThat(sets.getPdePoints()).hasSize(full / 11 * 10);
        assertThat(sets.getBoundaryPoints()).hasSize(1);
        assertThat(sets.getBoundaryPoints().get(0)).hasSize(full / 11);
        assertThat(sets.getPdePoints()).noneMatch(p -> p[0] == 0.0);
    }

    @Example
    @Label("Interior removes every fixed literal per argument position")
    void interiorRemoval() {
        TrainingSets sets = TrainingFixtures.generator(PdeFixtures.poisson()).generate(new double[]{0.5, 0.25});

        assertThat(sets.getDomainPoints()).hasSize(15);
        assertThat(sets.getPdePoints()).hasSize(3);
        assertThat(sets.getPdePoints()).allSatisfy(p -> assertThat(p[0]).isEqualTo(0.5));
        assertThat(sets.getBoundaryPoints().get(0)).hasSize(5);
        assertThat(sets.getBoundaryPoints().get(2)).hasSize(3);
    }

    @Example
    @Label("Spans hit decimal grid values exactly")
    void decimalSpans() {
        TrainingSets sets = TrainingFixtures.generator(PdeFixtures.firstOrderSystem()).generate(new double[]{0.1});

        assertThat(sets.getDomainPoints()).extracting(p -> p[0]).contains(0.3, 0.7, 1.0);
        assertThat(sets.getPdePoints()).hasSize(10);
        // fully fixed boundary conditions are single empty points
        assertThat(sets.getBoundaryPoints().get(0)).hasSize(1);
        assertThat(sets.getBoundaryPoints().get(0).get(0)).isEmpty();
    }

    @Example
    @Label("Non-decimal steps still end on the upper limit")
    void thirdSteps() {
        assertThat(Interval.between(0, 1).span(1.0 / 3)).containsExactly(0.0, 1.0 / 3, 2.0 / 3, 1.0);
        assertThat(Interval.between(0, 1).span(0.3)).containsExactly(0.0, 0.3, 0.6, 0.9);

        TrainingSets sets = TrainingFixtures.generator(PdeFixtures.poisson()).generate(new double[]{1.0 / 3});

        assertThat(sets.getDomainPoints()).hasSize(16);
        assertThat(sets.getPdePoints()).hasSize(4)
                .allSatisfy(p -> assertThat(p).doesNotContain(0.0, 1.0));
        assertThat(sets.getBoundaryPoints().get(1)).extracting(p -> p[0]).last().isEqualTo(1.0);
    }

    @Example
    @Label("Cartesian product varies the first axis fastest")
    void productOrder() {
        List<double[]> product = TrainingSetGenerator.cartesianProduct(
                Arrays.asList(new double[]{0, 1}, new double[]{10, 20}));

        assertThat(product).containsExactly(
                new double[]{0, 10}, new double[]{1, 10}, new double[]{0, 20}, new double[]{1, 20});
        assertThat(TrainingSetGenerator.cartesianProduct(Collections.<double[]>emptyList()))
                .containsExactly(new double[0]);
    }

    @Example
    @Label("Bounds cover the domain and each boundary's free variables")
    void bounds() {
        TrainingSetGenerator generator = TrainingFixtures.generator(PdeFixtures.poisson());

        assertThat(generator.pdeBounds().getLower()).containsExactly(0, 0);
        assertThat(generator.pdeBounds().getUpper()).containsExactly(1, 1);
        assertThat(generator.boundaryBounds()).hasSize(4)
                .allSatisfy(b -> assertThat(b.dimension()).isEqualTo(1));
        assertThat(TrainingFixtures.generator(PdeFixtures.firstOrderSystem()).boundaryBounds().get(0).dimension())
                .isZero();
    }

    @Example
    @Label("Step count must be one or one per axis")
    void invalidSteps() {
        TrainingSetGenerator generator = TrainingFixtures.generator(PdeFixtures.poisson());

        assertThatThrownBy(() -> generator.generate(new double[]{0.1, 0.1, 0.1}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GridTraining.of(-0.1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
