/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn;

import com.curioloop.pinn.expr.Equation;
import com.curioloop.pinn.expr.EquationSet;
import com.curioloop.pinn.expr.Expression;

import static com.curioloop.pinn.expr.Expressions.*;

/**
 * PDE systems and trial solutions shared by tests.
 */
public final class PdeFixtures {

    private PdeFixtures() {}

    /**
     * Poisson problem {@code u_xx + u_yy = 4} on the unit square with exact
     * solution {@code x² + y²}, boundary values given on all four sides.
     */
    public static PdeSystem poisson() {
        Expression u = apply("u", "x", "y");
        Expression x = variable("x");
        Expression y = variable("y");
        return PdeSystem.builder()
                .independentVariable("x", Interval.between(0, 1))
                .independentVariable("y", Interval.between(0, 1))
                .dependentVariable("u")
                .equation(Equation.of(add(derivative(u, "x", "x"), derivative(u, "y", "y")), 4))
                .boundaryCondition(Equation.of(apply("u", constant(0), y), y.pow(2)))
                .boundaryCondition(Equation.of(apply("u", constant(1), y), y.pow(2).plus(1)))
                .boundaryCondition(Equation.of(apply("u", x, constant(0)), x.pow(2)))
                .boundaryCondition(Equation.of(apply("u", x, constant(1)), x.pow(2).plus(1)))
                .build();
    }

    /**
     * Trial solution {@code p0 x² + p1 y²}; exact for {@link #poisson()} at {@code p = (1, 1)}.
     */
    public static TrialSolution quadratic() {
        return (c, p) -> new double[]{p[0] * c[0] * c[0] + p[1] * c[1] * c[1]};
    }

    /**
     * First-order system {@code u' = v, v' = 2} on [0, 1] with {@code u(0) = v(0) = 0};
     * exact solution {@code u = x², v = 2x}.
     */
    public static PdeSystem firstOrderSystem() {
        return PdeSystem.builder()
                .independentVariable("x", Interval.between(0, 1))
                .dependentVariables("u", "v")
                .equations(EquationSet.system(
                        Equation.of(derivative(apply("u", "x"), "x"), apply("v", "x")),
                        Equation.of(derivative(apply("v", "x"), "x"), 2)))
                .boundaryCondition(Equation.of(apply("u", constant(0)), 0))
                .boundaryCondition(Equation.of(apply("v", constant(0)), 0))
                .build();
    }

    /**
     * Heat-like problem over {@code dimension} variables {@code x1..xD} on the
     * unit cube with one boundary condition fixing {@code x1 = 0}.
     */
    public static PdeSystem cube(int dimension) {
        PdeSystem.Builder builder = PdeSystem.builder();
        Expression[] vars = new Expression[dimension];
        Expression[] boundary = new Expression[dimension];
        for (int i = 0; i < dimension; i++) {
            builder.independentVariable("x" + (i + 1), Interval.between(0, 1));
            vars[i] = variable("x" + (i + 1));
            boundary[i] = i == 0 ? constant(0) : vars[i];
        }
        return builder
                .dependentVariable("u")
                .equation(Equation.of(derivative(apply("u", vars), "x1"), 0))
                .boundaryCondition(Equation.of(apply("u", boundary), 0))
                .build();
    }
}
