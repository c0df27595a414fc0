/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.quadrature;

import com.curioloop.pinn.DimensionalityException;

import java.util.PriorityQueue;

/**
 * h-adaptive cubature.
 * <p>
 * The region with the largest error estimate is bisected until the total error
 * meets the tolerance. Boxes of two or more dimensions are estimated with the
 * Genz–Malik degree 7/5 embedded rule and split along the axis with the largest
 * fourth difference; intervals are estimated with the Gauss–Kronrod 7/15 pair.
 * Every rule evaluates its nodes in one {@link Integrand#evaluateBatch} call.
 * </p>
 *
 * <p>
 * Reference: A.C. Genz and A.A. Malik, "An adaptive algorithm for numerical
 * integration over an n-dimensional rectangular region", J. Comput. Appl. Math.
 * 6 (1980) 295-302.
 * </p>
 */
final class HCubatureIntegrator implements CubatureIntegrator {

    private final boolean genzMalikOnly;

    /**
     * Creates an integrator.
     * @param genzMalikOnly if true, intervals are rejected instead of falling back to Gauss–Kronrod
     */
    HCubatureIntegrator(boolean genzMalikOnly) {
        this.genzMalikOnly = genzMalikOnly;
    }

    @Override
    public QuadratureResult integrate(Integrand integrand, double[] lower, double[] upper,
                                      double relTol, double absTol, int maxIterations) {
        Regions.checkBox(lower, upper);
        int dim = lower.length;
        if (dim == 0) {
            return QuadratureResult.point(integrand.evaluate(new double[0]));
        }
        if (dim == 1 && genzMalikOnly) {
            throw new DimensionalityException("Genz-Malik cubature needs at least 2 dimensions, got 1");
        }
        Rule rule = dim == 1 ? new GaussKronrodRule() : new GenzMalikRule(dim);

        PriorityQueue<Region> queue = new PriorityQueue<>();
        Region whole = rule.estimate(integrand, lower, upper);
        queue.add(whole);
        int evaluations = rule.size();
        double value = whole.value;
        double error = whole.error;
        int iterations = 0;

        while (iterations < maxIterations && !Double.isNaN(value)
                && !Regions.withinTolerance(error, value, relTol, absTol)) {
            Region worst = queue.poll();
            int axis = worst.splitAxis;
            double mid = 0.5 * (worst.lower[axis] + worst.upper[axis]);
            double[] leftUpper = worst.upper.clone();
            leftUpper[axis] = mid;
            double[] rightLower = worst.lower.clone();
            rightLower[axis] = mid;

            Region left = rule.estimate(integrand, worst.lower, leftUpper);
            Region right = rule.estimate(integrand, rightLower, worst.upper);
            queue.add(left);
            queue.add(right);
            evaluations += 2 * rule.size();
            value += left.value + right.value - worst.value;
            error += left.error + right.error - worst.error;
            iterations++;
        }

        // re-sum to drop the drift of the incremental updates
        value = 0;
        error = 0;
        for (Region r : queue) {
            value += r.value;
            error += r.error;
        }
        boolean converged = Regions.withinTolerance(error, value, relTol, absTol);
        return new QuadratureResult(value, error, iterations, evaluations, converged);
    }

    /** Embedded rule pair producing an estimate and its error over one box. */
    private interface Rule {

        Region estimate(Integrand f, double[] lower, double[] upper);

        /** Number of nodes per estimate. */
        int size();
    }

    private static final class Region implements Comparable<Region> {
        final double[] lower;
        final double[] upper;
        final double value;
        final double error;
        final int splitAxis;

        Region(double[] lower, double[] upper, double value, double error, int splitAxis) {
            this.lower = lower;
            this.upper = upper;
            this.value = value;
            this.error = error;
            this.splitAxis = splitAxis;
        }

        @Override
        public int compareTo(Region other) {
            // largest error first
            return Double.compare(other.error, error);
        }
    }

    private static final class GenzMalikRule implements Rule {

        private static final double LAMBDA2 = Math.sqrt(9.0 / 70.0);
        private static final double LAMBDA4 = Math.sqrt(9.0 / 10.0);
        private static final double LAMBDA5 = Math.sqrt(9.0 / 19.0);
        private static final double RATIO = (LAMBDA2 * LAMBDA2) / (LAMBDA4 * LAMBDA4);

        private final int n;
        private final int size;
        private final double[] w7;
        private final double[] w5;

        GenzMalikRule(int n) {
            if (n >= 31) {
                throw new DimensionalityException("Genz-Malik cubature supports at most 30 dimensions, got " + n);
            }
            this.n = n;
            this.size = 1 + 4 * n + 2 * n * (n - 1) + (1 << n);
            this.w7 = new double[]{
                    (12824.0 - 9120.0 * n + 400.0 * n * n) / 19683.0,
                    980.0 / 6561.0,
                    (1820.0 - 400.0 * n) / 19683.0,
                    200.0 / 19683.0,
                    6859.0 / 19683.0 / (1 << n)
            };
            this.w5 = new double[]{
                    (729.0 - 950.0 * n + 50.0 * n * n) / 729.0,
                    245.0 / 486.0,
                    (265.0 - 100.0 * n) / 1458.0,
                    25.0 / 729.0
            };
        }

        @Override
        public int size() {
            return size;
        }

        @Override
        public Region estimate(Integrand f, double[] lower, double[] upper) {
            double[] c = new double[n];
            double[] h = new double[n];
            double volume = 1;
            for (int i = 0; i < n; i++) {
                c[i] = 0.5 * (lower[i] + upper[i]);
                h[i] = 0.5 * (upper[i] - lower[i]);
                volume *= upper[i] - lower[i];
            }

            double[][] nodes = new double[size][];
            int k = 0;
            nodes[k++] = c.clone();
            for (int i = 0; i < n; i++) {
                nodes[k++] = shift(c, i, LAMBDA2 * h[i]);
                nodes[k++] = shift(c, i, -LAMBDA2 * h[i]);
                nodes[k++] = shift(c, i, LAMBDA4 * h[i]);
                nodes[k++] = shift(c, i, -LAMBDA4 * h[i]);
            }
            for (int i = 0; i < n; i++) {
                for (int j = i + 1; j < n; j++) {
                    for (int s = 0; s < 4; s++) {
                        double[] p = c.clone();
                        p[i] += ((s & 1) == 0 ? LAMBDA4 : -LAMBDA4) * h[i];
                        p[j] += ((s & 2) == 0 ? LAMBDA4 : -LAMBDA4) * h[j];
                        nodes[k++] = p;
                    }
                }
            }
            for (int mask = 0; mask < (1 << n); mask++) {
                double[] p = new double[n];
                for (int i = 0; i < n; i++) {
                    p[i] = c[i] + (((mask >> i) & 1) == 0 ? LAMBDA5 : -LAMBDA5) * h[i];
                }
                nodes[k++] = p;
            }

            double[] values = f.evaluateBatch(nodes);
            double f1 = values[0];
            double f2 = 0;
            double f3 = 0;
            int axis = 0;
            double maxDiff = -1;
            for (int i = 0; i < n; i++) {
                double a2 = values[1 + 4 * i] + values[2 + 4 * i];
                double a4 = values[3 + 4 * i] + values[4 + 4 * i];
                f2 += a2;
                f3 += a4;
                double diff = Math.abs(a2 - 2 * f1 - RATIO * (a4 - 2 * f1));
                if (diff > maxDiff * (1 + 1e-10) || (diff >= maxDiff * (1 - 1e-10) && h[i] > h[axis])) {
                    if (diff > maxDiff) maxDiff = diff;
                    axis = i;
                }
            }
            double f4 = 0;
            int offset = 1 + 4 * n;
            int pairNodes = 2 * n * (n - 1);
            for (int i = 0; i < pairNodes; i++) {
                f4 += values[offset + i];
            }
            double f5 = 0;
            for (int i = offset + pairNodes; i < size; i++) {
                f5 += values[i];
            }

            double i7 = volume * (w7[0] * f1 + w7[1] * f2 + w7[2] * f3 + w7[3] * f4 + w7[4] * f5);
            double i5 = volume * (w5[0] * f1 + w5[1] * f2 + w5[2] * f3 + w5[3] * f4);
            return new Region(lower, upper, i7, Math.abs(i7 - i5), axis);
        }

        private static double[] shift(double[] c, int axis, double delta) {
            double[] p = c.clone();
            p[axis] += delta;
            return p;
        }
    }

    private static final class GaussKronrodRule implements Rule {

        private static final double[] XGK = {
                0.991455371120812639206854697526329,
                0.949107912342758524526189684047851,
                0.864864423359769072789712788640926,
                0.741531185599394439863864773280788,
                0.586087235467691130294144845693013,
                0.405845151377397166906606412076961,
                0.207784955007898467600689403773245
        };
        private static final double[] WGK = {
                0.022935322010529224963732008058970,
                0.063092092629978553290700663189204,
                0.104790010322250183839876322541518,
                0.140653259715525918745189590510238,
                0.169004726639267902826583426598550,
                0.190350578064785409913256402421014,
                0.204432940075298892414161999234649
        };
        private static final double WGK_CENTER = 0.209482141084727828012999174891714;
        // Gauss weights for XGK[1], XGK[3], XGK[5]
        private static final double[] WG = {
                0.129484966168869693270611432679082,
                0.279705391489276667901467771423780,
                0.381830050505118944950369775488975
        };
        private static final double WG_CENTER = 0.417959183673469387755102040816327;

        @Override
        public int size() {
            return 15;
        }

        @Override
        public Region estimate(Integrand f, double[] lower, double[] upper) {
            double c = 0.5 * (lower[0] + upper[0]);
            double h = 0.5 * (upper[0] - lower[0]);
            double[][] nodes = new double[15][];
            nodes[0] = new double[]{c};
            for (int k = 0; k < XGK.length; k++) {
                nodes[1 + 2 * k] = new double[]{c + h * XGK[k]};
                nodes[2 + 2 * k] = new double[]{c - h * XGK[k]};
            }
            double[] values = f.evaluateBatch(nodes);

            double kronrod = WGK_CENTER * values[0];
            double gauss = WG_CENTER * values[0];
            for (int k = 0; k < XGK.length; k++) {
                double pair = values[1 + 2 * k] + values[2 + 2 * k];
                kronrod += WGK[k] * pair;
                if ((k & 1) == 1) {
                    gauss += WG[k / 2] * pair;
                }
            }
            kronrod *= h;
            gauss *= h;
            return new Region(lower, upper, kronrod, Math.abs(kronrod - gauss), 0);
        }
    }
}
