/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.training;

import com.curioloop.pinn.LossFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Grid training whose PDE loss starts on a small prefix of the interior grid
 * and widens it on every evaluation.
 * <p>
 * With {@code N} interior points the window after {@code c} evaluations is
 * {@code rint((1 + c/2) * N / totalIterations)}, clamped to {@code [1, N]}.
 * Each discretization gets its own counter. Boundary losses use the full
 * boundary grids.
 * </p>
 */
public final class WindowedGridTraining implements TrainingStrategy {

    private static final Logger log = LoggerFactory.getLogger(WindowedGridTraining.class);

    /** Default number of evaluations over which the window reaches the full grid */
    public static final int DEFAULT_TOTAL_ITERATIONS = 1;

    private final double[] steps;
    private final int totalIterations;

    private WindowedGridTraining(double[] steps, int totalIterations) {
        if (totalIterations <= 0) {
            throw new IllegalArgumentException("Total iterations must be positive");
        }
        this.steps = GridTraining.checkSteps(steps);
        this.totalIterations = totalIterations;
    }

    /**
     * Creates a windowed grid strategy.
     * @param step Grid step for all axes
     * @param totalIterations Evaluations over which the window grows
     * @return Strategy
     */
    public static WindowedGridTraining of(double step, int totalIterations) {
        return new WindowedGridTraining(new double[]{step}, totalIterations);
    }

    /**
     * Creates a windowed grid strategy with per-axis steps.
     * @param steps One step per independent variable
     * @param totalIterations Evaluations over which the window grows
     * @return Strategy
     */
    public static WindowedGridTraining of(double[] steps, int totalIterations) {
        return new WindowedGridTraining(steps, totalIterations);
    }

    /**
     * Creates a windowed grid strategy with step {@value GridTraining#DEFAULT_STEP}.
     * @param totalIterations Evaluations over which the window grows
     * @return Strategy
     */
    public static WindowedGridTraining of(int totalIterations) {
        return of(GridTraining.DEFAULT_STEP, totalIterations);
    }

    public double[] getSteps() {
        return steps.clone();
    }

    public int getTotalIterations() {
        return totalIterations;
    }

    @Override
    public TrainingLosses discretize(TrainingContext context) {
        TrainingSets sets = context.getGenerator().generate(steps);
        if (log.isDebugEnabled()) {
            log.debug("Windowed grid training: {} interior points over {} iterations, boundary sets {}",
                    sets.getPdePoints().size(), totalIterations, Arrays.toString(GridTraining.sizes(sets)));
        }
        LossFunction pde = new WindowedGridLoss(context.getPdeResidual(), sets.getPdePoints(),
                context.isSystem(), totalIterations);
        LossFunction bc = new GridBoundaryLoss(context.getBoundaryResiduals(), sets.getBoundaryPoints());
        return new TrainingLosses(pde, bc);
    }

    @Override
    public String toString() {
        return "WindowedGridTraining{steps=" + Arrays.toString(steps) + ", totalIterations=" + totalIterations + "}";
    }
}
