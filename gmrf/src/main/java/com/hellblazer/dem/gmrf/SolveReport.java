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
package com.hellblazer.dem.gmrf;

import java.time.Duration;
import java.util.Optional;

/**
 * Summary of one estimator update.
 *
 * @param unknowns          number of cells solved for
 * @param iterations        conjugate gradient iterations of the mean solve
 * @param relativeResidual  achieved relative residual of the mean solve
 * @param tolerance         requested relative residual
 * @param varianceEstimated whether cell variances were recomputed
 * @param elapsed           wall time of the update
 */
public record SolveReport(int unknowns, int iterations, double relativeResidual, double tolerance,
                          boolean varianceEstimated, Duration elapsed) {

    public boolean converged() {
        return relativeResidual <= tolerance;
    }

    public Optional<ConvergenceWarning> warning() {
        return converged() ? Optional.empty()
                           : Optional.of(new ConvergenceWarning(iterations, relativeResidual, tolerance));
    }
}
