/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn;

import com.curioloop.pinn.expr.EquationSet;
import com.curioloop.pinn.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Call arguments of a boundary condition split into fixed and free axes.
 */
public final class BoundaryArguments {

    private final EquationSet condition;
    private final List<Expression> arguments;
    private final List<String> freeVariables;
    private final Map<Integer, Double> fixedValues;

    BoundaryArguments(EquationSet condition, List<Expression> arguments,
                      List<String> freeVariables, Map<Integer, Double> fixedValues) {
        this.condition = condition;
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
        this.freeVariables = Collections.unmodifiableList(new ArrayList<>(freeVariables));
        this.fixedValues = Collections.unmodifiableMap(new LinkedHashMap<>(fixedValues));
    }

    public EquationSet getCondition() {
        return condition;
    }

    /**
     * Gets the raw call arguments, in position order.
     * @return Arguments
     */
    public List<Expression> getArguments() {
        return arguments;
    }

    /**
     * Gets the free variable names in the order the condition declares them.
     * @return Free variables
     */
    public List<String> getFreeVariables() {
        return freeVariables;
    }

    /**
     * Gets the literal coordinate per fixed argument position (0-based).
     * @return Fixed values by position
     */
    public Map<Integer, Double> getFixedValues() {
        return fixedValues;
    }

    /**
     * Gets the dimensionality of the boundary sub-domain.
     * @return Number of free variables
     */
    public int dimension() {
        return freeVariables.size();
    }

    @Override
    public String toString() {
        return "BoundaryArguments{free=" + freeVariables + ", fixed=" + fixedValues + "}";
    }
}
