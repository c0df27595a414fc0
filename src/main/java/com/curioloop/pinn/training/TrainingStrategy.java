/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.training;

/**
 * Turns residual functions into PDE and boundary losses.
 * <p>
 * Implementations differ in how they choose collocation points and how they
 * normalize the summed squared residuals:
 * </p>
 * <ul>
 *   <li>{@link GridTraining}: fixed grid, all points every call</li>
 *   <li>{@link WindowedGridTraining}: fixed grid, growing prefix of the PDE points</li>
 *   <li>{@link StochasticTraining}: fresh uniform draws every call</li>
 *   <li>{@link QuasiRandomTraining}: pre-generated low-discrepancy minibatches</li>
 *   <li>{@link QuadratureTraining}: adaptive numerical integration</li>
 * </ul>
 */
public interface TrainingStrategy {

    /**
     * Checks that the strategy can discretize a domain of the given dimension.
     * Called before any point source is built.
     * @param domainDimension Number of independent variables
     * @throws com.curioloop.pinn.DimensionalityException if the domain is unsupported
     */
    default void validate(int domainDimension) {
    }

    /**
     * Builds the PDE and boundary losses.
     * @param context Residual functions, point-source generator and random source
     * @return Losses
     */
    TrainingLosses discretize(TrainingContext context);
}
