/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.training;

import com.curioloop.pinn.BoundaryArguments;
import com.curioloop.pinn.Interval;
import com.curioloop.pinn.PdeSystem;
import com.curioloop.pinn.VariableRegistry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Produces point sources for the sampling strategies: materialized grids for
 * grid-based training and box bounds for random, quasi-random and quadrature
 * training.
 *
 * <h2>Grid sets</h2>
 * <p>
 * Each axis {@code i} is spanned as {@code lower_i + k*step_i}. A boundary
 * condition uses the spans of its free variables. The interior set drops, per
 * argument position, every span value equal to a literal that some boundary
 * condition fixes at that position, then takes the Cartesian product. Products
 * vary the first axis fastest.
 * </p>
 */
public final class TrainingSetGenerator {

    private final PdeSystem system;
    private final List<BoundaryArguments> boundaries;

    /**
     * Creates a generator.
     * @param system PDE system
     * @param boundaries Analyzed boundary conditions, in declaration order
     */
    public TrainingSetGenerator(PdeSystem system, List<BoundaryArguments> boundaries) {
        this.system = system;
        this.boundaries = Collections.unmodifiableList(new ArrayList<>(boundaries));
    }

    /**
     * Materializes grid sets.
     * @param steps One step per independent variable, or a single step for all axes
     * @return Interior, boundary and full-domain points
     */
    public TrainingSets generate(double[] steps) {
        double[] perAxis = expandSteps(steps);
        List<Interval> domain = system.getDomain();
        List<double[]> spans = new ArrayList<>(domain.size());
        for (int i = 0; i < domain.size(); i++) {
            spans.add(domain.get(i).span(perAxis[i]));
        }

        VariableRegistry independent = system.getIndependentVariables();
        List<List<double[]>> boundarySets = new ArrayList<>(boundaries.size());
        for (BoundaryArguments bc : boundaries) {
            List<double[]> free = new ArrayList<>(bc.dimension());
            for (String v : bc.getFreeVariables()) {
                free.add(spans.get(independent.indexOf(v) - 1));
            }
            boundarySets.add(cartesianProduct(free));
        }

        List<double[]> interior = new ArrayList<>(spans.size());
        for (int axis = 0; axis < spans.size(); axis++) {
            interior.add(removeFixed(spans.get(axis), axis));
        }
        return new TrainingSets(cartesianProduct(interior), boundarySets, cartesianProduct(spans));
    }

    /**
     * Gets the bounds of the whole domain.
     * @return Domain bounds over all independent variables
     */
    public DomainBounds pdeBounds() {
        List<Interval> domain = system.getDomain();
        double[] lower = new double[domain.size()];
        double[] upper = new double[domain.size()];
        for (int i = 0; i < lower.length; i++) {
            lower[i] = domain.get(i).getLower();
            upper[i] = domain.get(i).getUpper();
        }
        return new DomainBounds(lower, upper);
    }

    /**
     * Gets the bounds of each boundary condition over its free variables.
     * @return Boundary bounds, in declaration order
     */
    public List<DomainBounds> boundaryBounds() {
        List<DomainBounds> result = new ArrayList<>(boundaries.size());
        for (BoundaryArguments bc : boundaries) {
            List<String> free = bc.getFreeVariables();
            double[] lower = new double[free.size()];
            double[] upper = new double[free.size()];
            for (int i = 0; i < lower.length; i++) {
                Interval interval = system.getInterval(free.get(i));
                lower[i] = interval.getLower();
                upper[i] = interval.getUpper();
            }
            result.add(new DomainBounds(lower, upper));
        }
        return result;
    }

    public List<BoundaryArguments> getBoundaries() {
        return boundaries;
    }

    /**
     * Builds the Cartesian product of value lists, first axis varying fastest.
     * <p>
     * The product of zero lists is a single empty point.
     * </p>
     * @param axes Values per axis
     * @return Product points
     */
    public static List<double[]> cartesianProduct(List<double[]> axes) {
        int total = 1;
        for (double[] axis : axes) {
            total = Math.multiplyExact(total, axis.length);
        }
        List<double[]> points = new ArrayList<>(total);
        int[] index = new int[axes.size()];
        for (int n = 0; n < total; n++) {
            double[] point = new double[axes.size()];
            for (int i = 0; i < point.length; i++) {
                point[i] = axes.get(i)[index[i]];
            }
            points.add(point);
            for (int i = 0; i < index.length; i++) {
                if (++index[i] < axes.get(i).length) break;
                index[i] = 0;
            }
        }
        return points;
    }

    private double[] expandSteps(double[] steps) {
        int dim = system.dimension();
        if (steps == null || steps.length == 0) {
            throw new IllegalArgumentException("At least one grid step is required");
        }
        double[] perAxis = new double[dim];
        if (steps.length == 1) {
            Arrays.fill(perAxis, steps[0]);
        } else if (steps.length == dim) {
            System.arraycopy(steps, 0, perAxis, 0, dim);
        } else {
            throw new IllegalArgumentException("Expected 1 or " + dim + " grid steps, got " + steps.length);
        }
        return perAxis;
    }

    private double[] removeFixed(double[] span, int position) {
        double[] kept = new double[span.length];
        int count = 0;
        for (double value : span) {
            if (!isFixed(value, position)) {
                kept[count++] = value;
            }
        }
        return Arrays.copyOf(kept, count);
    }

    private boolean isFixed(double value, int position) {
        for (BoundaryArguments bc : boundaries) {
            Map<Integer, Double> fixed = bc.getFixedValues();
            Double literal = fixed.get(position);
            if (literal != null && literal == value) {
                return true;
            }
        }
        return false;
    }
}
