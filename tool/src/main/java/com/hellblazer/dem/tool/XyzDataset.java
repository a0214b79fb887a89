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
package com.hellblazer.dem.tool;

import javax.vecmath.Point3d;
import java.util.List;

/**
 * Points loaded from an XYZ text file.
 *
 * @param points   the readings, in file order
 * @param stddevs  per point standard deviation from the fourth column, or null for three column files
 * @param columns  columns per row in the file
 * @param minZ     lowest height below the no-data threshold, NaN if there is none
 * @param maxZ     highest height below the no-data threshold, NaN if there is none
 * @author hal.hildebrand
 */
public record XyzDataset(List<Point3d> points, double[] stddevs, int columns, double minZ, double maxZ) {

    public boolean hasPerPointStddev() {
        return stddevs != null;
    }

    public int size() {
        return points.size();
    }

    /**
     * @param index        row of the reading
     * @param defaultValue used when the file carries no stddev column
     */
    public double stddev(int index, double defaultValue) {
        return stddevs == null ? defaultValue : stddevs[index];
    }
}
