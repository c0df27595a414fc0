/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.training;

import com.curioloop.pinn.DimensionalityException;
import com.curioloop.pinn.Interval;
import com.curioloop.pinn.PdeFixtures;
import com.curioloop.pinn.PdeSystem;
import com.curioloop.pinn.expr.Equation;
import com.curioloop.pinn.quadrature.QuadratureAlgorithm;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;

import static com.curioloop.pinn.expr.Expressions.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for quadrature training.
 */
public class QuadratureTrainingTest {

    @ParameterizedTest
    @EnumSource(QuadratureAlgorithm.class)
    @DisplayName("One-dimensional domains are rejected by every algorithm")
    void testOneDimensionalGuard(QuadratureAlgorithm algorithm) {
        QuadratureTraining strategy = QuadratureTraining.builder().algorithm(algorithm).build();

        assertThatThrownBy(() -> strategy.validate(1)).isInstanceOf(DimensionalityException.class);
        assertThatCode(() -> strategy.validate(3)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Genz-Malik rejects two-dimensional domains")
    void testGenzMalikGuard() {
        QuadratureTraining strategy = QuadratureTraining.builder().algorithm(QuadratureAlgorithm.GENZ_MALIK).build();

        assertThatThrownBy(() -> strategy.validate(2)).isInstanceOf(DimensionalityException.class);
        assertThatCode(() -> QuadratureTraining.defaults().validate(2)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Genz-Malik rejects one-dimensional boundary regions")
    void testGenzMalikBoundaryRegion() {
        PdeSystem system = PdeSystem.builder()
                .independentVariable("x", Interval.between(0, 1))
                .independentVariable("y", Interval.between(0, 1))
                .independentVariable("z", Interval.between(0, 1))
                .dependentVariable("u")
                .equation(Equation.of(apply("u", "x", "y", "z"), 0))
                .boundaryCondition(Equation.of(apply("u", constant(0), constant(0), variable("z")), 0))
                .build();
        List<CountingResidual> boundaries = new ArrayList<>();
        TrainingContext context = TrainingFixtures.context(system, new CountingResidual(3, 0.0), boundaries);

        QuadratureTraining strategy = QuadratureTraining.builder().algorithm(QuadratureAlgorithm.GENZ_MALIK).build();

        assertThatThrownBy(() -> strategy.discretize(context)).isInstanceOf(DimensionalityException.class);
        assertThatCode(() -> QuadratureTraining.defaults().discretize(context)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Losses are scaled by 1/10^D and 1/(10^D1 * K)")
    void testNormalization() {
        List<CountingResidual> boundaries = new ArrayList<>();
        TrainingContext context = TrainingFixtures.context(PdeFixtures.poisson(), new CountingResidual(2, 1.0), boundaries);

        TrainingLosses losses = QuadratureTraining.defaults().discretize(context);

        assertThat(((QuadratureLoss) losses.getPdeLoss()).getTau()).isCloseTo(0.01, within(1e-15));
        assertThat(((QuadratureLoss) losses.getBoundaryLoss()).getTau()).isCloseTo(1.0 / 40, within(1e-15));
        assertThat(losses.getPdeLoss().evaluate(new double[0])).isCloseTo(0.01, within(1e-10));
        assertThat(losses.getBoundaryLoss().evaluate(new double[0])).isCloseTo(0.1, within(1e-10));
    }

    @Test
    @DisplayName("Configuration is validated and defaulted")
    void testBuilder() {
        QuadratureTraining defaults = QuadratureTraining.defaults();

        assertThat(defaults.getAlgorithm()).isEqualTo(QuadratureAlgorithm.H_CUBATURE);
        assertThat(defaults.getRelativeTolerance()).isEqualTo(1e-8);
        assertThat(defaults.getAbsoluteTolerance()).isEqualTo(1e-8);
        assertThat(defaults.getMaxIterations()).isEqualTo(1000);
        assertThat(defaults.getBatchSize()).isZero();
        assertThatThrownBy(() -> QuadratureTraining.builder().relativeTolerance(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> QuadratureTraining.builder().batchSize(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
