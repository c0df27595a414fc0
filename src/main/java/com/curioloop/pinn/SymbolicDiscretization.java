/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn;

import com.curioloop.pinn.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Canonical residual trees of a PDE system, for inspection.
 */
public final class SymbolicDiscretization {

    private final List<Expression> equations;
    private final List<Expression> boundaryConditions;
    private final List<BoundaryArguments> boundaryArguments;

    SymbolicDiscretization(List<Expression> equations, List<Expression> boundaryConditions,
                           List<BoundaryArguments> boundaryArguments) {
        this.equations = Collections.unmodifiableList(new ArrayList<>(equations));
        this.boundaryConditions = Collections.unmodifiableList(new ArrayList<>(boundaryConditions));
        this.boundaryArguments = Collections.unmodifiableList(new ArrayList<>(boundaryArguments));
    }

    /**
     * Gets the canonical residual of each governing equation.
     * @return Residual trees, in equation order
     */
    public List<Expression> getEquations() {
        return equations;
    }

    /**
     * Gets the canonical residual of each boundary condition.
     * @return Residual trees, in declaration order
     */
    public List<Expression> getBoundaryConditions() {
        return boundaryConditions;
    }

    public List<BoundaryArguments> getBoundaryArguments() {
        return boundaryArguments;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Expression e : equations) {
            sb.append("pde: ").append(e).append('\n');
        }
        for (Expression e : boundaryConditions) {
            sb.append("bc:  ").append(e).append('\n');
        }
        return sb.toString();
    }
}
