/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.training;

import com.curioloop.pinn.LossFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Training on a fixed Cartesian grid.
 * <p>
 * The PDE loss covers the interior grid, the boundary loss covers each
 * boundary condition's grid over its free variables. Both are deterministic.
 * </p>
 */
public final class GridTraining implements TrainingStrategy {

    private static final Logger log = LoggerFactory.getLogger(GridTraining.class);

    /** Default grid step */
    public static final double DEFAULT_STEP = 0.1;

    private final double[] steps;

    private GridTraining(double[] steps) {
        this.steps = checkSteps(steps);
    }

    /**
     * Creates a grid strategy.
     * @param steps A single step for all axes, or one step per independent variable
     * @return Strategy
     */
    public static GridTraining of(double... steps) {
        return new GridTraining(steps);
    }

    /**
     * Creates a grid strategy with step {@value #DEFAULT_STEP}.
     * @return Strategy
     */
    public static GridTraining defaults() {
        return of(DEFAULT_STEP);
    }

    public double[] getSteps() {
        return steps.clone();
    }

    @Override
    public TrainingLosses discretize(TrainingContext context) {
        TrainingSets sets = context.getGenerator().generate(steps);
        if (log.isDebugEnabled()) {
            log.debug("Grid training: {} interior points, boundary sets {}", sets.getPdePoints().size(), Arrays.toString(sizes(sets)));
        }
        LossFunction pde = new GridLoss(context.getPdeResidual(), sets.getPdePoints(), context.isSystem());
        LossFunction bc = new GridBoundaryLoss(context.getBoundaryResiduals(), sets.getBoundaryPoints());
        return new TrainingLosses(pde, bc);
    }

    @Override
    public String toString() {
        return "GridTraining{steps=" + Arrays.toString(steps) + "}";
    }

    static double[] checkSteps(double[] steps) {
        if (steps == null || steps.length == 0) {
            throw new IllegalArgumentException("At least one grid step is required");
        }
        for (double step : steps) {
            if (!(step > 0) || Double.isInfinite(step)) {
                throw new IllegalArgumentException("Grid steps must be positive and finite");
            }
        }
        return steps.clone();
    }

    static int[] sizes(TrainingSets sets) {
        int[] sizes = new int[sets.getBoundaryPoints().size()];
        for (int i = 0; i < sizes.length; i++) {
            sizes[i] = sets.getBoundaryPoints().get(i).size();
        }
        return sizes;
    }
}
