/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.expr;

import com.curioloop.pinn.TrialSolutionAdapter;

/**
 * Recursive central finite differences.
 * <p>
 * D(1) = (u(x + e1) - u(x - e1)) / 2h
 * </p>
 * <p>
 * D(n) = (D(n-1)(x + en) - D(n-1)(x - en)) / 2h
 * </p>
 * where {@code en = perturbations[n - 1]} and {@code h} is the perturbation
 * magnitude. Mixed and higher partials are therefore central differences of
 * central differences, each level stepping along its own direction, with an
 * {@code O(h²)} truncation error per level.
 */
public final class NumericDerivative implements DerivativeOperator {

    /** Perturbation magnitude: cube root of single-precision machine epsilon */
    public static final double STEP = Math.cbrt(Math.ulp(1.0f));

    /** Shared instance using {@link #STEP} */
    public static final NumericDerivative INSTANCE = new NumericDerivative(STEP);

    private final double denominator;

    /**
     * Creates an operator whose perturbation vectors were built with the given step.
     * @param step Perturbation magnitude
     */
    public NumericDerivative(double step) {
        if (!(step > 0)) {
            throw new IllegalArgumentException("Step must be positive");
        }
        this.denominator = 2.0 * step;
    }

    @Override
    public double evaluate(TrialSolutionAdapter trial, double[] coordinates, double[][] perturbations,
                           int order, double[] parameters) {
        if (order < 1 || order > perturbations.length) {
            throw new IllegalArgumentException("Order must be between 1 and " + perturbations.length);
        }
        double[] eps = perturbations[order - 1];
        double[] plus = shift(coordinates, eps, 1.0);
        double[] minus = shift(coordinates, eps, -1.0);
        if (order == 1) {
            return (trial.value(plus, parameters) - trial.value(minus, parameters)) / denominator;
        }
        return (evaluate(trial, plus, perturbations, order - 1, parameters)
                - evaluate(trial, minus, perturbations, order - 1, parameters)) / denominator;
    }

    private static double[] shift(double[] x, double[] eps, double sign) {
        double[] shifted = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            shifted[i] = x[i] + sign * eps[i];
        }
        return shifted;
    }
}
