/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.training;

import com.curioloop.pinn.LossFunction;
import com.curioloop.pinn.ResidualFunction;

import java.util.List;

/**
 * Normalized squared residual over sampled points.
 * <p>
 * Every evaluation draws one point batch per residual from its sampler. With
 * {@code squareOfSum} the residual components are summed before squaring
 * ({@code τ Σ_x (Σ_k R_k(x))²}); otherwise each component is squared
 * ({@code τ Σ_i Σ_x Σ_k R_ik(x)²}).
 * </p>
 */
final class SampledLoss implements LossFunction {

    private final List<ResidualFunction> residuals;
    private final List<PointSampler> samplers;
    private final double tau;
    private final boolean squareOfSum;

    SampledLoss(List<ResidualFunction> residuals, List<PointSampler> samplers, double tau, boolean squareOfSum) {
        if (residuals.size() != samplers.size()) {
            throw new IllegalArgumentException("Expected one sampler per residual");
        }
        this.residuals = residuals;
        this.samplers = samplers;
        this.tau = tau;
        this.squareOfSum = squareOfSum;
    }

    @Override
    public double evaluate(double[] parameters) {
        double total = 0;
        for (int i = 0; i < residuals.size(); i++) {
            ResidualFunction residual = residuals.get(i);
            for (double[] x : samplers.get(i).draw()) {
                if (squareOfSum) {
                    double s = residual.sum(x, parameters);
                    total += s * s;
                } else {
                    total += residual.sumOfSquares(x, parameters);
                }
            }
        }
        return tau * total;
    }

    List<PointSampler> getSamplers() {
        return samplers;
    }
}
