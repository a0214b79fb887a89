/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.dem.gmrf.variance;

import com.hellblazer.dem.gmrf.GmrfException.ConfigurationException;
import com.hellblazer.dem.gmrf.InformationSystem;
import org.ejml.data.DMatrixRMaj;
import org.ejml.sparse.FillReducing;
import org.ejml.sparse.csc.factory.LinearSolverFactory_DSCC;

/**
 * Exact marginal variances: factor {@code Λ} once with a sparse Cholesky decomposition, then solve against every
 * unit vector and keep the matching entry. The cost grows with the square of the cell count, so grids above
 * {@code maxCells} are refused. Meant for small grids and as a reference for the approximate estimators.
 */
public class CholeskyVarianceEstimator implements VarianceEstimator {
    public static final int DEFAULT_MAX_CELLS = 10_000;

    private final int maxCells;

    public CholeskyVarianceEstimator() {
        this(DEFAULT_MAX_CELLS);
    }

    public CholeskyVarianceEstimator(int maxCells) {
        if (maxCells < 1) {
            throw new IllegalArgumentException("Max cells must be positive: " + maxCells);
        }
        this.maxCells = maxCells;
    }

    /**
     * @throws ConfigurationException if the grid exceeds the cell cap
     * @throws IllegalStateException  if the information matrix is not positive definite, as when no cell received an
     *                                observation
     */
    @Override
    public double[] estimateVariance(InformationSystem system) {
        var n = system.size();
        checkCapacity(n);
        var solver = LinearSolverFactory_DSCC.cholesky(FillReducing.IDENTITY);
        if (!solver.setA(system.information().copy())) {
            throw new IllegalStateException("Information matrix is not positive definite");
        }
        var unit = new DMatrixRMaj(n, 1);
        var column = new DMatrixRMaj(n, 1);
        var variances = new double[n];
        for (int i = 0; i < n; i++) {
            unit.zero();
            unit.set(i, 0, 1.0);
            solver.solve(unit, column);
            variances[i] = column.get(i, 0);
        }
        return variances;
    }

    @Override
    public void checkCapacity(int cells) {
        if (cells > maxCells) {
            throw new ConfigurationException(
            "Exact variance limited to %d cells, grid has %d; use an approximate estimator".formatted(maxCells,
                                                                                                     cells));
        }
    }

    public int getMaxCells() {
        return maxCells;
    }

    @Override
    public boolean isExact() {
        return true;
    }

    @Override
    public String name() {
        return "cholesky";
    }
}
