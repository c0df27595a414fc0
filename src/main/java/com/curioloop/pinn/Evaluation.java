/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn;

/**
 * Objective callback in the shape gradient-based optimizers consume:
 * a scalar value and, on request, its gradient.
 *
 * <pre>{@code
 * OptimizationProblem problem = discretizer.discretize(system);
 * Evaluation objective = problem.toEvaluation(ParameterGradient.CENTRAL);
 * }</pre>
 *
 * @see ParameterGradient
 */
@FunctionalInterface
public interface Evaluation {

    /**
     * Evaluates the objective and optionally its gradient.
     * <p>
     * When gradient is not null, the implementation stores the partial
     * derivatives with respect to each parameter in it.
     * </p>
     *
     * @param parameters Current parameters (read-only)
     * @param gradient Output array for the gradient (may be null)
     * @return Objective value
     */
    double evaluate(double[] parameters, double[] gradient);
}
