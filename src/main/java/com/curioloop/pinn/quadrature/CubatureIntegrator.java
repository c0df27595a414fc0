/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.quadrature;

/**
 * Numerical integration over an axis-aligned box.
 * <p>
 * Integration stops once the error estimate satisfies
 * {@code error <= max(absTol, relTol * |value|)} or after {@code maxIterations}
 * refinement steps, whichever comes first. A zero-dimensional box is a single
 * point and integrates to the integrand value there.
 * </p>
 */
public interface CubatureIntegrator {

    /**
     * Integrates over {@code [lower, upper]}.
     * @param integrand Function to integrate
     * @param lower Lower corner
     * @param upper Upper corner
     * @param relTol Relative tolerance
     * @param absTol Absolute tolerance
     * @param maxIterations Maximum refinement steps
     * @return Integral estimate
     * @throws com.curioloop.pinn.QuadratureException if no estimate can be produced
     */
    QuadratureResult integrate(Integrand integrand, double[] lower, double[] upper,
                               double relTol, double absTol, int maxIterations);
}
