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

import javax.vecmath.Tuple3d;

/**
 * One noisy height sample.
 *
 * @param x             easting of the sample
 * @param y             northing of the sample
 * @param z             measured height
 * @param stddev        standard deviation of the height measurement, must be positive to be fused
 * @param timeInvariant true for readings that keep their full information across updates
 */
public record Observation(double x, double y, double z, double stddev, boolean timeInvariant) {

    public static Observation of(double x, double y, double z, double stddev) {
        return new Observation(x, y, z, stddev, true);
    }

    public static Observation of(Tuple3d point, double stddev) {
        return new Observation(point.x, point.y, point.z, stddev, true);
    }
}
