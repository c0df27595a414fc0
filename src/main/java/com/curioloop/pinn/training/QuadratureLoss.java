/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.training;

import com.curioloop.pinn.LossFunction;
import com.curioloop.pinn.ResidualFunction;
import com.curioloop.pinn.quadrature.CubatureIntegrator;
import com.curioloop.pinn.quadrature.QuadratureResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Integral of the squared residual over each region, scaled by {@code τ}.
 */
final class QuadratureLoss implements LossFunction {

    private static final Logger log = LoggerFactory.getLogger(QuadratureLoss.class);

    private final List<ResidualFunction> residuals;
    private final List<DomainBounds> regions;
    private final CubatureIntegrator integrator;
    private final QuadratureTraining config;
    private final double tau;
    private final boolean squareOfSum;

    QuadratureLoss(List<ResidualFunction> residuals, List<DomainBounds> regions, CubatureIntegrator integrator,
                   QuadratureTraining config, double tau, boolean squareOfSum) {
        if (residuals.size() != regions.size()) {
            throw new IllegalArgumentException("Expected one region per residual");
        }
        this.residuals = residuals;
        this.regions = regions;
        this.integrator = integrator;
        this.config = config;
        this.tau = tau;
        this.squareOfSum = squareOfSum;
    }

    @Override
    public double evaluate(double[] parameters) {
        double total = 0;
        for (int i = 0; i < residuals.size(); i++) {
            ResidualFunction residual = residuals.get(i);
            DomainBounds region = regions.get(i);
            QuadratureResult result = integrator.integrate(x -> {
                if (squareOfSum) {
                    double s = residual.sum(x, parameters);
                    return s * s;
                }
                return residual.sumOfSquares(x, parameters);
            }, region.getLower(), region.getUpper(),
                    config.getRelativeTolerance(), config.getAbsoluteTolerance(), config.getMaxIterations());
            if (!result.isConverged() && log.isDebugEnabled()) {
                log.debug("Quadrature over {} did not reach tolerance: {}", region, result);
            }
            total += result.getValue();
        }
        return tau * total;
    }

    double getTau() {
        return tau;
    }
}
