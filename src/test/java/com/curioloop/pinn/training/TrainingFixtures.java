/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.training;

import com.curioloop.pinn.BoundaryArguments;
import com.curioloop.pinn.BoundaryConditionAnalyzer;
import com.curioloop.pinn.PdeSystem;
import com.curioloop.pinn.ResidualFunction;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.util.ArrayList;
import java.util.List;

/**
 * Training contexts over constant residuals.
 */
final class TrainingFixtures {

    private TrainingFixtures() {}

    static TrainingSetGenerator generator(PdeSystem system) {
        List<BoundaryArguments> boundaries = new BoundaryConditionAnalyzer(system.getIndependentVariables())
                .analyze(system.getBoundaryConditions());
        return new TrainingSetGenerator(system, boundaries);
    }

    /**
     * Context over the given PDE residual; one constant boundary residual per condition is added to {@code boundaries}.
     */
    static TrainingContext context(PdeSystem system, CountingResidual pde, List<CountingResidual> boundaries) {
        TrainingSetGenerator generator = generator(system);
        for (BoundaryArguments bc : generator.getBoundaries()) {
            boundaries.add(new CountingResidual(bc.dimension(), 1.0));
        }
        List<ResidualFunction> residuals = new ArrayList<ResidualFunction>(boundaries);
        return new TrainingContext(pde, false, residuals, generator, random());
    }

    static RandomGenerator random() {
        return new Well19937c(20250101L);
    }
}
