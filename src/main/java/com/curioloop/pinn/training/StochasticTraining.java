/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.training;

import com.curioloop.pinn.ResidualFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Training on fresh uniform random points drawn at every evaluation.
 * <p>
 * The PDE loss draws {@code pointCount} points in the domain; each boundary
 * condition draws the rescaled count from {@link TrainingContext#boundaryPointCount(int)}
 * in its own bounds.
 * </p>
 */
public final class StochasticTraining implements TrainingStrategy {

    private static final Logger log = LoggerFactory.getLogger(StochasticTraining.class);

    /** Default number of points per evaluation */
    public static final int DEFAULT_POINT_COUNT = 100;

    private final int pointCount;

    private StochasticTraining(int pointCount) {
        if (pointCount <= 0) {
            throw new IllegalArgumentException("Point count must be positive");
        }
        this.pointCount = pointCount;
    }

    /**
     * Creates a stochastic strategy.
     * @param pointCount Points drawn per evaluation
     * @return Strategy
     */
    public static StochasticTraining of(int pointCount) {
        return new StochasticTraining(pointCount);
    }

    /**
     * Creates a stochastic strategy drawing {@value #DEFAULT_POINT_COUNT} points.
     * @return Strategy
     */
    public static StochasticTraining defaults() {
        return of(DEFAULT_POINT_COUNT);
    }

    public int getPointCount() {
        return pointCount;
    }

    @Override
    public TrainingLosses discretize(TrainingContext context) {
        TrainingSetGenerator generator = context.getGenerator();
        SampledLoss pde = new SampledLoss(
                Collections.singletonList(context.getPdeResidual()),
                Collections.<PointSampler>singletonList(
                        new UniformSampler(generator.pdeBounds(), pointCount, context.getRandom())),
                1.0 / pointCount, true);

        int boundaryCount = context.boundaryPointCount(pointCount);
        List<ResidualFunction> residuals = context.getBoundaryResiduals();
        List<DomainBounds> bounds = generator.boundaryBounds();
        List<PointSampler> samplers = new ArrayList<>(residuals.size());
        for (int i = 0; i < residuals.size(); i++) {
            samplers.add(new UniformSampler(bounds.get(i), boundaryCount, context.getRandom()));
        }
        log.debug("Stochastic training: {} domain points, {} points per boundary condition", pointCount, boundaryCount);
        SampledLoss bc = new SampledLoss(residuals, samplers, 1.0 / boundaryCount, false);
        return new TrainingLosses(pde, bc);
    }

    @Override
    public String toString() {
        return "StochasticTraining{pointCount=" + pointCount + "}";
    }
}
