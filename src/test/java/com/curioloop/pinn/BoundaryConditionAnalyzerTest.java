/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn;

import com.curioloop.pinn.expr.Equation;
import com.curioloop.pinn.expr.EquationSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static com.curioloop.pinn.expr.Expressions.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for BoundaryConditionAnalyzer.
 */
public class BoundaryConditionAnalyzerTest {

    private final BoundaryConditionAnalyzer analyzer = new BoundaryConditionAnalyzer(VariableRegistry.of("x", "y"));

    @Test
    @DisplayName("Literal arguments are fixed, variables are free")
    void testFixedAndFree() {
        BoundaryArguments bc = analyzer.analyze(EquationSet.single(
                Equation.of(apply("u", constant(0), variable("y")), 0)));

        assertThat(bc.getFreeVariables()).containsExactly("y");
        assertThat(bc.getFixedValues()).containsExactly(entry(0, 0.0));
        assertThat(bc.dimension()).isEqualTo(1);
    }

    @Test
    @DisplayName("Derivatives are looked through")
    void testDerivativeCondition() {
        BoundaryArguments bc = analyzer.analyze(EquationSet.single(
                Equation.of(derivative(apply("u", variable("x"), constant(1)), "y"), 0)));

        assertThat(bc.getFreeVariables()).containsExactly("x");
        assertThat(bc.getFixedValues()).containsExactly(entry(1, 1.0));
    }

    @Test
    @DisplayName("First application met depth-first decides the arguments")
    void testFirstApplication() {
        BoundaryArguments bc = analyzer.analyze(EquationSet.single(Equation.of(
                add(multiply(constant(2), apply("u", constant(0.5), variable("y"))),
                        apply("u", variable("x"), variable("y"))), 0)));

        assertThat(bc.getFreeVariables()).containsExactly("y");
        assertThat(bc.getFixedValues()).containsExactly(entry(0, 0.5));
    }

    @Test
    @DisplayName("Fully fixed conditions have no free variable")
    void testCorner() {
        List<BoundaryArguments> bcs = analyzer.analyze(Collections.singletonList(EquationSet.single(
                Equation.of(apply("u", constant(0), constant(1)), 0))));

        assertThat(bcs).hasSize(1);
        assertThat(bcs.get(0).dimension()).isZero();
    }

    @Test
    @DisplayName("Systems and conditions without a dependent variable are malformed")
    void testMalformed() {
        EquationSet system = EquationSet.system(
                Equation.of(apply("u", constant(0), variable("y")), 0),
                Equation.of(apply("u", constant(1), variable("y")), 0));
        assertThatThrownBy(() -> analyzer.analyze(system))
                .isInstanceOf(MalformedBoundaryConditionException.class);

        assertThatThrownBy(() -> analyzer.analyze(EquationSet.single(Equation.of(variable("x"), 0))))
                .isInstanceOf(MalformedBoundaryConditionException.class)
                .satisfies(e -> assertThat(((DiscretizationException) e).getError())
                        .isEqualTo(DiscretizationError.MALFORMED_BOUNDARY_CONDITION));
    }

    @Test
    @DisplayName("Unknown argument variables are rejected")
    void testUnknownArgument() {
        assertThatThrownBy(() -> analyzer.analyze(EquationSet.single(
                Equation.of(apply("u", constant(0), variable("z")), 0))))
                .isInstanceOf(UnrecognizedExpressionPatternException.class);
    }
}
