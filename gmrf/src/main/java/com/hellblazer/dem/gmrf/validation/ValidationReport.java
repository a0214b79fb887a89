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
package com.hellblazer.dem.gmrf.validation;

/**
 * Checkpoint residuals against the fitted surface for both interpolation modes.
 *
 * @param nearestResiduals  observed minus nearest cell prediction, one per evaluated checkpoint
 * @param bilinearResiduals observed minus bilinear prediction, same order
 * @param nearestStats      summary of the nearest cell residuals
 * @param bilinearStats     summary of the bilinear residuals
 * @param outOfBounds       checkpoints skipped because they fell outside the grid
 */
public record ValidationReport(double[] nearestResiduals, double[] bilinearResiduals, ResidualStats nearestStats,
                               ResidualStats bilinearStats, int outOfBounds) {

    public int evaluated() {
        return nearestResiduals.length;
    }

    public boolean isEmpty() {
        return nearestResiduals.length == 0;
    }
}
