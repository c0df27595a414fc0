/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.training;

import com.curioloop.pinn.LossFunction;
import com.curioloop.pinn.ResidualFunction;

import java.util.List;

/**
 * Mean squared residual over a fixed point set.
 * <p>
 * Single equation: {@code τ Σ_x (Σ_k R_k(x))²}. System:
 * {@code τ/2 (Σ_x (Σ_k R_k(x))² + Σ_x Σ_k R_k(x)²)}. {@code τ = 1/N}.
 * </p>
 */
final class GridLoss implements LossFunction {

    private final ResidualFunction residual;
    private final List<double[]> points;
    private final boolean system;

    GridLoss(ResidualFunction residual, List<double[]> points, boolean system) {
        this.residual = residual;
        this.points = points;
        this.system = system;
    }

    @Override
    public double evaluate(double[] parameters) {
        return aggregate(residual, points, points.size(), system, parameters);
    }

    /**
     * Aggregates over the first {@code count} points, normalized by the full set size.
     * An empty set contributes nothing.
     */
    static double aggregate(ResidualFunction residual, List<double[]> points, int count,
                            boolean system, double[] parameters) {
        if (points.isEmpty()) {
            return 0.0;
        }
        double squaredSums = 0;
        double sumOfSquares = 0;
        for (int i = 0; i < count; i++) {
            double[] r = residual.evaluate(points.get(i), parameters);
            double s = 0;
            for (double v : r) {
                s += v;
                sumOfSquares += v * v;
            }
            squaredSums += s * s;
        }
        double tau = 1.0 / points.size();
        return system ? tau / 2 * (squaredSums + sumOfSquares) : tau * squaredSums;
    }
}
