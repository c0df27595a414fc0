/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.training;

import com.curioloop.pinn.LossFunction;
import com.curioloop.pinn.ResidualFunction;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Grid loss over a prefix of the point set that grows with every evaluation.
 * <p>
 * On call {@code c} (0-based) the cursor is {@code 1 + c/2} and the window
 * holds {@code rint(cursor * N / totalIterations)} points, clamped to
 * {@code [1, N]}. The normalization stays {@code 1/N}. The call counter belongs
 * to this loss instance.
 * </p>
 */
final class WindowedGridLoss implements LossFunction {

    private final ResidualFunction residual;
    private final List<double[]> points;
    private final boolean system;
    private final int totalIterations;
    private final AtomicInteger calls = new AtomicInteger();

    WindowedGridLoss(ResidualFunction residual, List<double[]> points, boolean system, int totalIterations) {
        this.residual = residual;
        this.points = points;
        this.system = system;
        this.totalIterations = totalIterations;
    }

    @Override
    public double evaluate(double[] parameters) {
        int window = windowAt(calls.getAndIncrement());
        return GridLoss.aggregate(residual, points, window, system, parameters);
    }

    /**
     * Gets the window the next evaluation will use.
     * @return Number of points
     */
    int nextWindow() {
        return windowAt(calls.get());
    }

    int windowAt(int call) {
        int n = points.size();
        if (n == 0) {
            return 0;
        }
        double cursor = 1 + 0.5 * call;
        double length = (double) n / totalIterations;
        long window = (long) Math.rint(cursor * length);
        return (int) Math.max(1, Math.min(window, n));
    }
}
