/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.training;

import com.curioloop.pinn.ResidualFunction;

import java.util.ArrayList;
import java.util.List;

/**
 * Constant residual that records the points it is evaluated at.
 */
final class CountingResidual implements ResidualFunction {

    private final int dimension;
    private final double[] values;
    private final List<double[]> points = new ArrayList<>();

    CountingResidual(int dimension, double... values) {
        this.dimension = dimension;
        this.values = values;
    }

    @Override
    public double[] evaluate(double[] coordinates, double[] parameters) {
        points.add(coordinates.clone());
        return values.clone();
    }

    @Override
    public int dimension() {
        return dimension;
    }

    int calls() {
        return points.size();
    }

    List<double[]> points() {
        return points;
    }

    void clear() {
        points.clear();
    }
}
