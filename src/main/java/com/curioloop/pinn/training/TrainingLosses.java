/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.training;

import com.curioloop.pinn.LossFunction;

/**
 * PDE and boundary losses produced by a strategy.
 */
public final class TrainingLosses {

    private final LossFunction pdeLoss;
    private final LossFunction boundaryLoss;

    public TrainingLosses(LossFunction pdeLoss, LossFunction boundaryLoss) {
        if (pdeLoss == null || boundaryLoss == null) {
            throw new IllegalArgumentException("Losses cannot be null");
        }
        this.pdeLoss = pdeLoss;
        this.boundaryLoss = boundaryLoss;
    }

    public LossFunction getPdeLoss() {
        return pdeLoss;
    }

    public LossFunction getBoundaryLoss() {
        return boundaryLoss;
    }

    /**
     * Composes the training objective {@code pdeLoss + boundaryLoss}, PDE loss first.
     * @return Objective
     */
    public LossFunction objective() {
        return pdeLoss.plus(boundaryLoss);
    }
}
