/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.expr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Factory methods for building symbolic expression trees.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * // Poisson equation: u_xx + u_yy = -sin(pi x) sin(pi y)
 * Expression u = apply("u", variable("x"), variable("y"));
 * Equation poisson = Equation.of(
 *     add(derivative(u, "x", "x"), derivative(u, "y", "y")),
 *     negate(multiply(sin(variable("x").times(Math.PI)), sin(variable("y").times(Math.PI)))));
 *
 * // Boundary condition: u(0, y) = 0
 * Equation left = Equation.of(apply("u", constant(0), variable("y")), constant(0));
 * }</pre>
 */
public final class Expressions {

    private Expressions() {}

    public static Literal constant(double value) {
        return new Literal(value);
    }

    public static VariableRef variable(String name) {
        return new VariableRef(name);
    }

    /**
     * Applies a dependent variable to its arguments.
     * @param dependentVariable Dependent variable name
     * @param arguments Variable references or literals, one per independent variable
     * @return Application node
     */
    public static DependentApply apply(String dependentVariable, Expression... arguments) {
        return new DependentApply(dependentVariable, Arrays.asList(arguments));
    }

    /**
     * Applies a dependent variable to independent variables given by name.
     * @param dependentVariable Dependent variable name
     * @param variables Independent variable names
     * @return Application node
     */
    public static DependentApply apply(String dependentVariable, String... variables) {
        List<Expression> args = new ArrayList<>(variables.length);
        for (String v : variables) {
            args.add(new VariableRef(v));
        }
        return new DependentApply(dependentVariable, args);
    }

    /**
     * Differentiates an operand successively with respect to each variable.
     * <p>
     * {@code derivative(u, "x", "y")} differentiates by x first and then by y,
     * i.e. it builds {@code Dy(Dx(u))}.
     * </p>
     * @param operand Expression to differentiate
     * @param variables Differentiation variables, innermost first
     * @return Outermost derivative node
     */
    public static Expression derivative(Expression operand, String... variables) {
        if (variables.length == 0) {
            throw new IllegalArgumentException("At least one differentiation variable is required");
        }
        Expression result = operand;
        for (String v : variables) {
            result = new DerivativeApply(result, v);
        }
        return result;
    }

    public static Operation add(Expression... terms) {
        return new Operation(Operator.ADD, Arrays.asList(terms));
    }

    public static Operation subtract(Expression left, Expression right) {
        return new Operation(Operator.SUBTRACT, Arrays.asList(left, right));
    }

    public static Operation multiply(Expression... factors) {
        return new Operation(Operator.MULTIPLY, Arrays.asList(factors));
    }

    public static Operation divide(Expression numerator, Expression denominator) {
        return new Operation(Operator.DIVIDE, Arrays.asList(numerator, denominator));
    }

    public static Operation pow(Expression base, Expression exponent) {
        return new Operation(Operator.POWER, Arrays.asList(base, exponent));
    }

    public static Operation negate(Expression operand) {
        return unary(Operator.NEGATE, operand);
    }

    public static Operation sin(Expression operand) {
        return unary(Operator.SIN, operand);
    }

    public static Operation cos(Expression operand) {
        return unary(Operator.COS, operand);
    }

    public static Operation tan(Expression operand) {
        return unary(Operator.TAN, operand);
    }

    public static Operation exp(Expression operand) {
        return unary(Operator.EXP, operand);
    }

    public static Operation log(Expression operand) {
        return unary(Operator.LOG, operand);
    }

    public static Operation sqrt(Expression operand) {
        return unary(Operator.SQRT, operand);
    }

    public static Operation tanh(Expression operand) {
        return unary(Operator.TANH, operand);
    }

    public static Operation abs(Expression operand) {
        return unary(Operator.ABS, operand);
    }

    private static Operation unary(Operator operator, Expression operand) {
        return new Operation(operator, Arrays.asList(operand));
    }

    static String joinArguments(List<Expression> arguments) {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(arguments.get(i));
        }
        return sb.append(')').toString();
    }
}
