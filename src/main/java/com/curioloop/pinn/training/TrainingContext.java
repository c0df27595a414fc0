/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.training;

import com.curioloop.pinn.ResidualFunction;
import org.apache.commons.math3.random.RandomGenerator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Inputs shared by all training strategies.
 */
public final class TrainingContext {

    private final ResidualFunction pdeResidual;
    private final boolean system;
    private final List<ResidualFunction> boundaryResiduals;
    private final TrainingSetGenerator generator;
    private final RandomGenerator random;

    /**
     * Creates a context.
     * @param pdeResidual Residual over all independent variables
     * @param system Whether the PDE is a system of equations
     * @param boundaryResiduals One residual per boundary condition, over its free variables
     * @param generator Point-source generator
     * @param random Random source for sampling strategies
     */
    public TrainingContext(ResidualFunction pdeResidual, boolean system,
                           List<ResidualFunction> boundaryResiduals,
                           TrainingSetGenerator generator, RandomGenerator random) {
        this.pdeResidual = pdeResidual;
        this.system = system;
        this.boundaryResiduals = Collections.unmodifiableList(new ArrayList<>(boundaryResiduals));
        this.generator = generator;
        this.random = random;
    }

    public ResidualFunction getPdeResidual() {
        return pdeResidual;
    }

    public boolean isSystem() {
        return system;
    }

    public List<ResidualFunction> getBoundaryResiduals() {
        return boundaryResiduals;
    }

    public TrainingSetGenerator getGenerator() {
        return generator;
    }

    public RandomGenerator getRandom() {
        return random;
    }

    /**
     * Rescales a point count from the domain to the boundary.
     * <p>
     * Returns {@code round(pointCount^(boundaryDim / domainDim))} with the
     * dimensionality of the first boundary condition, so the point density per
     * unit measure stays comparable. The result is at least 1, and exactly 1
     * when the first boundary condition has no free variable.
     * </p>
     * @param pointCount Domain point count
     * @return Boundary point count
     */
    public int boundaryPointCount(int pointCount) {
        return rescale(pointCount, boundaryResiduals.isEmpty() ? 0 : boundaryResiduals.get(0).dimension(),
                pdeResidual.dimension());
    }

    /**
     * Rescales a point count between manifolds of different dimension.
     * @param pointCount Point count on the {@code domainDim}-dimensional domain
     * @param boundaryDim Boundary dimension
     * @param domainDim Domain dimension
     * @return {@code max(1, round(pointCount^(boundaryDim / domainDim)))}
     */
    public static int rescale(int pointCount, int boundaryDim, int domainDim) {
        if (boundaryDim == 0 || domainDim == 0) {
            return 1;
        }
        long rounded = Math.round(Math.pow(pointCount, (double) boundaryDim / domainDim));
        return (int) Math.max(1, Math.min(rounded, Integer.MAX_VALUE));
    }
}
