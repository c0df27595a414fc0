/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.training;

/**
 * Source of collocation points for one loss evaluation.
 */
interface PointSampler {

    /**
     * Draws the points for the next evaluation.
     * @return One coordinate vector per row
     */
    double[][] draw();
}
