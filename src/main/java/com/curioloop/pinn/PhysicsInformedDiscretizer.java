/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn;

import com.curioloop.pinn.expr.DerivativeOperator;
import com.curioloop.pinn.expr.EquationSet;
import com.curioloop.pinn.expr.Expression;
import com.curioloop.pinn.expr.ExpressionTransformer;
import com.curioloop.pinn.expr.NumericDerivative;
import com.curioloop.pinn.training.GridTraining;
import com.curioloop.pinn.training.TrainingContext;
import com.curioloop.pinn.training.TrainingLosses;
import com.curioloop.pinn.training.TrainingSetGenerator;
import com.curioloop.pinn.training.TrainingStrategy;
import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles a symbolic PDE system into a training objective for trial solutions.
 * <p>
 * Discretization runs one linear pipeline: the strategy checks the domain
 * dimension, boundary conditions are analyzed, every equation is rewritten
 * into canonical form and compiled into a residual function, the strategy
 * builds its point sources and losses, and the PDE and boundary losses are
 * summed into the objective.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * A discretizer may be reused for several systems. The losses it produces
 * share its random generator, so losses of sampling strategies should be
 * evaluated by one thread at a time.
 * </p>
 *
 * <h2>Example usage</h2>
 * <pre>{@code
 * PhysicsInformedDiscretizer discretizer = PhysicsInformedDiscretizer.builder()
 *     .trialSolution(network, initialWeights)
 *     .strategy(GridTraining.of(0.1))
 *     .build();
 *
 * OptimizationProblem problem = discretizer.discretize(poisson);
 * double loss = problem.getObjective().evaluate(problem.getInitialParameters());
 * }</pre>
 */
public final class PhysicsInformedDiscretizer {

    private static final Logger log = LoggerFactory.getLogger(PhysicsInformedDiscretizer.class);

    private final List<TrialSolutionAdapter> trials;
    private final List<double[]> initialParameters;
    private final TrainingStrategy strategy;
    private final DerivativeOperator derivative;
    private final double step;
    private final RandomGenerator random;

    private PhysicsInformedDiscretizer(Builder builder) {
        this.trials = new ArrayList<>(builder.trials);
        this.initialParameters = new ArrayList<>(builder.initialParameters);
        this.strategy = builder.strategy;
        this.step = builder.step;
        this.derivative = builder.derivative != null ? builder.derivative : new NumericDerivative(builder.step);
        this.random = builder.random != null ? builder.random : RandomSources.defaultGenerator();
    }

    /**
     * Creates a new builder.
     * @return New builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Discretizes a PDE system into an optimization problem.
     * @param system PDE system
     * @return Objective and flattened initial parameters
     * @throws DimensionalityException if the strategy does not support the domain dimension
     * @throws MalformedBoundaryConditionException if a boundary condition is not a single
     *         equation applying a dependent variable
     * @throws UnrecognizedExpressionPatternException if an equation uses an unsupported pattern
     * @throws IllegalArgumentException if the number of trial solutions does not match the
     *         number of dependent variables
     */
    public OptimizationProblem discretize(PdeSystem system) {
        strategy.validate(system.dimension());
        VariableRegistry independent = system.getIndependentVariables();
        VariableRegistry dependent = system.getDependentVariables();
        checkTrialCount(dependent);

        ParameterLayout layout = ParameterLayout.of(initialParameters);
        double[] flat = layout.concat(initialParameters.toArray(new double[0][]));
        LossFunctionBuilder builder = new LossFunctionBuilder(independent, dependent, trials, layout, derivative, step);

        List<BoundaryArguments> boundaries = new BoundaryConditionAnalyzer(independent)
                .analyze(system.getBoundaryConditions());
        ResidualFunction pde = builder.build(system.getEquations());
        List<ResidualFunction> boundaryResiduals = new ArrayList<>(boundaries.size());
        for (BoundaryArguments bc : boundaries) {
            boundaryResiduals.add(builder.build(bc.getCondition(), bc.getFreeVariables()));
        }

        TrainingContext context = new TrainingContext(pde, system.getEquations().isSystem(), boundaryResiduals,
                new TrainingSetGenerator(system, boundaries), random);
        TrainingLosses losses = strategy.discretize(context);

        log.info("Discretized {} equation(s) and {} boundary condition(s) over {} with {}: {} parameter(s)",
                system.getEquations().size(), boundaries.size(), independent.names(), strategy, layout.total());
        if (log.isDebugEnabled()) {
            log.debug("Boundary free variables: {}", boundaries);
        }
        return new OptimizationProblem(losses.getPdeLoss(), losses.getBoundaryLoss(), flat, layout);
    }

    /**
     * Rewrites the equations and boundary conditions into canonical residual
     * trees without building point sources or losses.
     * @param system PDE system
     * @return Canonical trees
     */
    public SymbolicDiscretization symbolicDiscretize(PdeSystem system) {
        VariableRegistry independent = system.getIndependentVariables();
        ExpressionTransformer transformer = new ExpressionTransformer(independent, system.getDependentVariables(), step);
        List<BoundaryArguments> boundaries = new BoundaryConditionAnalyzer(independent)
                .analyze(system.getBoundaryConditions());
        List<Expression> equations = transformer.transform(system.getEquations());
        List<Expression> conditions = new ArrayList<>(boundaries.size());
        for (BoundaryArguments bc : boundaries) {
            conditions.addAll(transformer.transform(bc.getCondition()));
        }
        return new SymbolicDiscretization(equations, conditions, boundaries);
    }

    public TrainingStrategy getStrategy() {
        return strategy;
    }

    private void checkTrialCount(VariableRegistry dependent) {
        if (trials.size() != dependent.size()) {
            throw new IllegalArgumentException("Expected " + dependent.size()
                    + " trial solution(s), one per dependent variable " + dependent.names() + ", got " + trials.size());
        }
    }

    /**
     * Builder for discretizers.
     */
    public static final class Builder {
        private final List<TrialSolutionAdapter> trials = new ArrayList<>();
        private final List<double[]> initialParameters = new ArrayList<>();
        private TrainingStrategy strategy = GridTraining.defaults();
        private DerivativeOperator derivative;
        private double step = NumericDerivative.STEP;
        private RandomGenerator random;

        private Builder() {}

        /**
         * Adds the trial solution of the next dependent variable.
         * @param solution Trial solution
         * @param initialParameters Its initial parameter vector (copied)
         * @return This builder
         */
        public Builder trialSolution(TrialSolution solution, double[] initialParameters) {
            if (initialParameters == null) {
                throw new IllegalArgumentException("Initial parameters cannot be null");
            }
            this.trials.add(new TrialSolutionAdapter(solution));
            this.initialParameters.add(initialParameters.clone());
            return this;
        }

        /**
         * Sets the training strategy.
         * @param value Strategy (default: grid with step 0.1)
         * @return This builder
         */
        public Builder strategy(TrainingStrategy value) {
            if (value == null) {
                throw new IllegalArgumentException("Training strategy cannot be null");
            }
            this.strategy = value;
            return this;
        }

        /**
         * Sets the coordinate derivative operator.
         * @param value Derivative operator (default: central differences)
         * @return This builder
         */
        public Builder derivative(DerivativeOperator value) {
            if (value == null) {
                throw new IllegalArgumentException("Derivative operator cannot be null");
            }
            this.derivative = value;
            return this;
        }

        /**
         * Sets the perturbation magnitude of coordinate derivatives.
         * @param value Step (must be positive)
         * @return This builder
         */
        public Builder step(double value) {
            if (!(value > 0) || Double.isInfinite(value)) {
                throw new IllegalArgumentException("Step must be positive and finite");
            }
            this.step = value;
            return this;
        }

        /**
         * Sets the random source of sampling strategies.
         * @param value Random generator (default: {@link RandomSources#defaultGenerator()})
         * @return This builder
         */
        public Builder random(RandomGenerator value) {
            if (value == null) {
                throw new IllegalArgumentException("Random generator cannot be null");
            }
            this.random = value;
            return this;
        }

        /**
         * Builds the discretizer.
         * @return Discretizer
         * @throws IllegalStateException if no trial solution was added
         */
        public PhysicsInformedDiscretizer build() {
            if (trials.isEmpty()) {
                throw new IllegalStateException("At least one trial solution is required");
            }
            return new PhysicsInformedDiscretizer(this);
        }
    }
}
