/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.training;

import java.util.Collections;
import java.util.List;

/**
 * Materialized grid collocation points.
 */
public final class TrainingSets {

    private final List<double[]> pdePoints;
    private final List<List<double[]>> boundaryPoints;
    private final List<double[]> domainPoints;

    TrainingSets(List<double[]> pdePoints, List<List<double[]>> boundaryPoints, List<double[]> domainPoints) {
        this.pdePoints = Collections.unmodifiableList(pdePoints);
        this.boundaryPoints = Collections.unmodifiableList(boundaryPoints);
        this.domainPoints = Collections.unmodifiableList(domainPoints);
    }

    /**
     * Gets the interior points, with boundary-coincident literal values removed per axis.
     * @return PDE collocation points
     */
    public List<double[]> getPdePoints() {
        return pdePoints;
    }

    /**
     * Gets the points of each boundary condition over its free variables.
     * @return Boundary collocation points, one list per condition
     */
    public List<List<double[]>> getBoundaryPoints() {
        return boundaryPoints;
    }

    /**
     * Gets the full Cartesian grid over the whole domain.
     * @return Domain points
     */
    public List<double[]> getDomainPoints() {
        return domainPoints;
    }
}
