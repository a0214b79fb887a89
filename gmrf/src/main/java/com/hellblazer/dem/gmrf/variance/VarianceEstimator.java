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

import com.hellblazer.dem.gmrf.InformationSystem;

/**
 * Strategy computing the marginal posterior variance of every cell, the diagonal of {@code Λ^-1}.
 * <p>
 * Exact marginals need the inverse of the information matrix, which is out of reach for realistic grids, so most
 * implementations are approximations. Each implementation states which one it is. A cell whose variance is not
 * determined by the system (no information reaches it) gets {@link Double#POSITIVE_INFINITY}.
 */
public interface VarianceEstimator {

    /**
     * @param system the assembled information system of the current solve
     * @return one variance per cell, in the system's row major order
     */
    double[] estimateVariance(InformationSystem system);

    /**
     * Refuse a grid this estimator cannot handle, before any solve is attempted. Accepts every size by default.
     *
     * @param cells unknowns of the grid
     * @throws com.hellblazer.dem.gmrf.GmrfException.ConfigurationException if the grid is too large
     */
    default void checkCapacity(int cells) {
    }

    /**
     * @return true if the returned variances are the exact marginals
     */
    boolean isExact();

    String name();
}
