/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.training;

import com.curioloop.pinn.LossFunction;
import com.curioloop.pinn.ResidualFunction;

import java.util.List;

/**
 * Boundary loss over fixed point sets: {@code τ Σ_bc Σ_x R_bc(x)²} with
 * {@code τ = 1/|first boundary set|}.
 */
final class GridBoundaryLoss implements LossFunction {

    private final List<ResidualFunction> residuals;
    private final List<List<double[]>> sets;

    GridBoundaryLoss(List<ResidualFunction> residuals, List<List<double[]>> sets) {
        if (residuals.size() != sets.size()) {
            throw new IllegalArgumentException("Expected one point set per boundary residual");
        }
        this.residuals = residuals;
        this.sets = sets;
    }

    @Override
    public double evaluate(double[] parameters) {
        if (residuals.isEmpty() || sets.get(0).isEmpty()) {
            return 0.0;
        }
        double total = 0;
        for (int i = 0; i < residuals.size(); i++) {
            ResidualFunction residual = residuals.get(i);
            for (double[] x : sets.get(i)) {
                total += residual.sumOfSquares(x, parameters);
            }
        }
        return total / sets.get(0).size();
    }
}
