/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.expr;

import com.curioloop.pinn.TrialSolutionAdapter;

/**
 * Differentiates a trial solution with respect to its coordinates.
 * <p>
 * The default implementation is {@link NumericDerivative}; hosts may plug in
 * their own operator through the discretizer builder.
 * </p>
 */
@FunctionalInterface
public interface DerivativeOperator {

    /**
     * Evaluates a partial derivative of the trial value.
     * @param trial Trial solution
     * @param coordinates Point at which to differentiate
     * @param perturbations Perturbation vectors, outermost derivative first
     * @param order Derivative order (number of perturbation vectors in use)
     * @param parameters Parameter sub-vector of the trial solution
     * @return Derivative value
     */
    double evaluate(TrialSolutionAdapter trial, double[] coordinates, double[][] perturbations,
                    int order, double[] parameters);
}
