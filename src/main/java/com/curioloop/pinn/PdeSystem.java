/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn;

import com.curioloop.pinn.expr.Equation;
import com.curioloop.pinn.expr.EquationSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Symbolic PDE system: equations, boundary conditions and a rectangular domain.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * PdeSystem poisson = PdeSystem.builder()
 *     .independentVariable("x", Interval.between(0, 1))
 *     .independentVariable("y", Interval.between(0, 1))
 *     .dependentVariable("u")
 *     .equation(Equation.of(add(derivative(u, "x", "x"), derivative(u, "y", "y")), rhs))
 *     .boundaryCondition(Equation.of(apply("u", constant(0), variable("y")), 0))
 *     .build();
 * }</pre>
 */
public final class PdeSystem {

    private final VariableRegistry independentVariables;
    private final VariableRegistry dependentVariables;
    private final List<Interval> domain;
    private final EquationSet equations;
    private final List<EquationSet> boundaryConditions;

    private PdeSystem(Builder builder) {
        this.independentVariables = VariableRegistry.of(new ArrayList<>(builder.domain.keySet()));
        this.dependentVariables = VariableRegistry.of(builder.dependentVariables);
        this.domain = Collections.unmodifiableList(new ArrayList<>(builder.domain.values()));
        this.equations = builder.equations;
        this.boundaryConditions = Collections.unmodifiableList(new ArrayList<>(builder.boundaryConditions));
    }

    /**
     * Creates a new builder.
     * @return New builder
     */
    public static Builder builder() {
        return new Builder();
    }

    public VariableRegistry getIndependentVariables() {
        return independentVariables;
    }

    public VariableRegistry getDependentVariables() {
        return dependentVariables;
    }

    /**
     * Gets the domain interval per independent variable, in registry order.
     * @return Domain intervals
     */
    public List<Interval> getDomain() {
        return domain;
    }

    /**
     * Gets the domain interval of one independent variable.
     * @param variable Variable name
     * @return Interval
     */
    public Interval getInterval(String variable) {
        return domain.get(independentVariables.indexOf(variable) - 1);
    }

    public EquationSet getEquations() {
        return equations;
    }

    public List<EquationSet> getBoundaryConditions() {
        return boundaryConditions;
    }

    /**
     * Gets the domain dimensionality.
     * @return Number of independent variables
     */
    public int dimension() {
        return independentVariables.size();
    }

    @Override
    public String toString() {
        return "PdeSystem{" +
                "independent=" + independentVariables.names() +
                ", dependent=" + dependentVariables.names() +
                ", domain=" + domain +
                ", equations=" + equations +
                ", boundaryConditions=" + boundaryConditions +
                '}';
    }

    /**
     * Builder for PDE systems.
     */
    public static final class Builder {
        private final Map<String, Interval> domain = new LinkedHashMap<>();
        private final List<String> dependentVariables = new ArrayList<>();
        private final List<EquationSet> boundaryConditions = new ArrayList<>();
        private EquationSet equations;

        private Builder() {}

        /**
         * Declares the next independent variable and its domain.
         * @param name Variable name
         * @param interval Domain interval
         * @return This builder
         * @throws DuplicateVariableException if the variable is already declared
         */
        public Builder independentVariable(String name, Interval interval) {
            if (interval == null) {
                throw new IllegalArgumentException("Domain interval cannot be null");
            }
            String key = VariableRegistry.normalize(name);
            if (domain.containsKey(key)) {
                throw new DuplicateVariableException("Independent variable '" + key + "' is declared more than once");
            }
            domain.put(key, interval);
            return this;
        }

        /**
         * Declares the next dependent variable.
         * @param name Variable name
         * @return This builder
         */
        public Builder dependentVariable(String name) {
            dependentVariables.add(name);
            return this;
        }

        /**
         * Declares dependent variables in order.
         * @param names Variable names
         * @return This builder
         */
        public Builder dependentVariables(String... names) {
            for (String name : names) {
                dependentVariable(name);
            }
            return this;
        }

        /**
         * Sets a single governing equation (scalar residual).
         * @param equation Equation
         * @return This builder
         */
        public Builder equation(Equation equation) {
            this.equations = EquationSet.single(equation);
            return this;
        }

        /**
         * Sets the governing equations.
         * @param equations Single equation or system
         * @return This builder
         */
        public Builder equations(EquationSet equations) {
            this.equations = equations;
            return this;
        }

        /**
         * Adds a boundary condition.
         * @param condition Boundary equation
         * @return This builder
         */
        public Builder boundaryCondition(Equation condition) {
            boundaryConditions.add(EquationSet.single(condition));
            return this;
        }

        /**
         * Adds a boundary condition given as an equation set.
         * <p>
         * Only single equations are valid boundary conditions; a system is
         * rejected at discretization time.
         * </p>
         * @param condition Boundary equation set
         * @return This builder
         */
        public Builder boundaryCondition(EquationSet condition) {
            if (condition == null) {
                throw new IllegalArgumentException("Boundary condition cannot be null");
            }
            boundaryConditions.add(condition);
            return this;
        }

        /**
         * Builds the PDE system.
         * @return PDE system
         * @throws IllegalStateException if variables or equations are missing
         * @throws DuplicateVariableException if dependent variable names collide
         */
        public PdeSystem build() {
            if (domain.isEmpty()) {
                throw new IllegalStateException("At least one independent variable is required");
            }
            if (dependentVariables.isEmpty()) {
                throw new IllegalStateException("At least one dependent variable is required");
            }
            if (equations == null) {
                throw new IllegalStateException("Equations are required");
            }
            return new PdeSystem(this);
        }
    }
}
