/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn;

import java.util.Arrays;

/**
 * Output of a discretization: the training objective and the flattened
 * initial parameters, ready for a generic optimizer.
 */
public final class OptimizationProblem {

    private final LossFunction objective;
    private final LossFunction pdeLoss;
    private final LossFunction boundaryLoss;
    private final double[] initialParameters;
    private final ParameterLayout layout;

    OptimizationProblem(LossFunction pdeLoss, LossFunction boundaryLoss,
                        double[] initialParameters, ParameterLayout layout) {
        this.pdeLoss = pdeLoss;
        this.boundaryLoss = boundaryLoss;
        this.objective = pdeLoss.plus(boundaryLoss);
        this.initialParameters = initialParameters.clone();
        this.layout = layout;
    }

    /**
     * Gets the objective {@code pdeLoss + boundaryLoss}.
     * @return Objective over the flat parameter vector
     */
    public LossFunction getObjective() {
        return objective;
    }

    public LossFunction getPdeLoss() {
        return pdeLoss;
    }

    public LossFunction getBoundaryLoss() {
        return boundaryLoss;
    }

    /**
     * Gets the flattened initial parameters.
     * @return Copy of the initial parameters
     */
    public double[] getInitialParameters() {
        return initialParameters.clone();
    }

    /**
     * Gets the layout that splits a flat vector into per-trial-solution blocks.
     * @return Parameter layout
     */
    public ParameterLayout getLayout() {
        return layout;
    }

    /**
     * Adapts the objective to the value-and-gradient callback of gradient-based optimizers.
     * @param gradient Finite-difference scheme over the parameters
     * @return Objective callback
     */
    public Evaluation toEvaluation(ParameterGradient gradient) {
        return gradient.wrap(objective);
    }

    @Override
    public String toString() {
        return "OptimizationProblem{" +
                "layout=" + layout +
                ", initialParameters=" + Arrays.toString(initialParameters) +
                '}';
    }
}
