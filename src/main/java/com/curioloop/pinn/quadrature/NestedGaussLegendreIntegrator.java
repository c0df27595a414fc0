/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.quadrature;

import com.curioloop.pinn.QuadratureException;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.integration.BaseAbstractUnivariateIntegrator;
import org.apache.commons.math3.analysis.integration.IterativeLegendreGaussIntegrator;
import org.apache.commons.math3.analysis.integration.gauss.GaussIntegratorFactory;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.MaxCountExceededException;

/**
 * Tensor-product integration with nested iterative Gauss–Legendre rules.
 * <p>
 * Axis 0 is integrated outermost; each of its nodes integrates the remaining
 * axes recursively. Every level uses commons-math's
 * {@link IterativeLegendreGaussIntegrator}, which refines until two successive
 * stages agree within the tolerance. The reported error is the tolerance bound
 * the estimate met, since the univariate integrators do not expose one.
 * </p>
 * <p>
 * An axis that does not settle within the stage limit is integrated once more
 * with a fixed composite rule of one {@value #POINTS}-point panel per stage.
 * The result is then marked as not converged and its error is unknown
 * ({@link Double#POSITIVE_INFINITY}).
 * </p>
 */
final class NestedGaussLegendreIntegrator implements CubatureIntegrator {

    private static final int POINTS = 5;
    private static final int MAX_STAGES = 64;

    private final GaussIntegratorFactory rules = new GaussIntegratorFactory();

    @Override
    public QuadratureResult integrate(Integrand integrand, double[] lower, double[] upper,
                                      double relTol, double absTol, int maxIterations) {
        Regions.checkBox(lower, upper);
        if (lower.length == 0) {
            return QuadratureResult.point(integrand.evaluate(new double[0]));
        }
        int minStages = BaseAbstractUnivariateIntegrator.DEFAULT_MIN_ITERATIONS_COUNT;
        int maxStages = Math.max(minStages + 1, Math.min(maxIterations, MAX_STAGES));
        double[] point = new double[lower.length];
        int[] evaluations = new int[1];
        int[] stages = new int[1];
        boolean[] capped = new boolean[1];
        try {
            double value = integrateAxis(0, integrand, point, lower, upper,
                    relTol, absTol, minStages, maxStages, evaluations, stages, capped);
            if (capped[0]) {
                return new QuadratureResult(value, Double.POSITIVE_INFINITY, stages[0], evaluations[0], false);
            }
            double error = Math.max(absTol, relTol * Math.abs(value));
            return new QuadratureResult(value, error, stages[0], evaluations[0], true);
        } catch (MathIllegalStateException e) {
            throw new QuadratureException("Gauss-Legendre integration failed: " + e.getMessage(), e);
        }
    }

    private double integrateAxis(int axis, Integrand integrand, double[] point,
                                 double[] lower, double[] upper, double relTol, double absTol,
                                 int minStages, int maxStages, int[] evaluations, int[] stages,
                                 boolean[] capped) {
        if (lower[axis] == upper[axis]) {
            return 0.0;
        }
        UnivariateFunction slice;
        if (axis == point.length - 1) {
            slice = t -> {
                point[axis] = t;
                evaluations[0]++;
                return integrand.evaluate(point.clone());
            };
        } else {
            slice = t -> {
                point[axis] = t;
                return integrateAxis(axis + 1, integrand, point, lower, upper,
                        relTol, absTol, minStages, maxStages, evaluations, stages, capped);
            };
        }
        IterativeLegendreGaussIntegrator integrator =
                new IterativeLegendreGaussIntegrator(POINTS, relTol, absTol, minStages, maxStages);
        try {
            double value = integrator.integrate(Integer.MAX_VALUE, slice, lower[axis], upper[axis]);
            stages[0] = Math.max(stages[0], integrator.getIterations());
            return value;
        } catch (MaxCountExceededException e) {
            capped[0] = true;
            stages[0] = maxStages;
            return composite(slice, lower[axis], upper[axis], maxStages);
        }
    }

    private double composite(UnivariateFunction slice, double a, double b, int panels) {
        double width = (b - a) / panels;
        double sum = 0;
        for (int i = 0; i < panels; i++) {
            double left = a + i * width;
            double right = i == panels - 1 ? b : left + width;
            sum += rules.legendre(POINTS, left, right).integrate(slice);
        }
        return sum;
    }
}
