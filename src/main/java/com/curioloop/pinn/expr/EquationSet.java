/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.expr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Either a single equation or a system of equations.
 * <p>
 * The distinction matters beyond the equation count: a system always yields a
 * vector residual and uses the system aggregation formulas, even when it holds
 * only one equation.
 * </p>
 */
public final class EquationSet {

    private final List<Equation> equations;
    private final boolean system;

    private EquationSet(List<Equation> equations, boolean system) {
        if (equations == null || equations.isEmpty()) {
            throw new IllegalArgumentException("At least one equation is required");
        }
        for (Equation eq : equations) {
            if (eq == null) {
                throw new IllegalArgumentException("Equations cannot contain null");
            }
        }
        this.equations = Collections.unmodifiableList(new ArrayList<>(equations));
        this.system = system;
    }

    public static EquationSet single(Equation equation) {
        return new EquationSet(Collections.singletonList(equation), false);
    }

    public static EquationSet system(Equation... equations) {
        return new EquationSet(Arrays.asList(equations), true);
    }

    public static EquationSet system(List<Equation> equations) {
        return new EquationSet(equations, true);
    }

    public List<Equation> equations() {
        return equations;
    }

    public Equation get(int index) {
        return equations.get(index);
    }

    public int size() {
        return equations.size();
    }

    public boolean isSystem() {
        return system;
    }

    @Override
    public String toString() {
        return system ? equations.toString() : equations.get(0).toString();
    }
}
