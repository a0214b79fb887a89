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
 * Approximates each marginal variance by the inverse of the cell's own precision, {@code 1 / Λii}. This is the
 * variance conditioned on the neighbours, a lower bound on the true marginal. It ignores the uncertainty propagated
 * through the prior coupling, so cells far from any observation are reported as too confident. Costs one pass over
 * the diagonal.
 */
public class DiagonalVarianceEstimator implements VarianceEstimator {

    @Override
    public double[] estimateVariance(InformationSystem system) {
        var variances = new double[system.size()];
        for (int i = 0; i < variances.length; i++) {
            var precision = system.diagonal(i);
            variances[i] = precision > 0.0 ? 1.0 / precision : Double.POSITIVE_INFINITY;
        }
        return variances;
    }

    @Override
    public boolean isExact() {
        return false;
    }

    @Override
    public String name() {
        return "diagonal";
    }
}
