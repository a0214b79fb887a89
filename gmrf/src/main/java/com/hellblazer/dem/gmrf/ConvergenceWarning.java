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

/**
 * The mean solve stopped at its iteration cap before reaching the tolerance. The best iterate was still written to
 * the grid.
 */
public record ConvergenceWarning(int iterations, double relativeResidual, double tolerance) {

    public String message() {
        return String.format("GMRF solve did not converge after %d iterations: relative residual %.3e > %.3e",
                             iterations, relativeResidual, tolerance);
    }
}
