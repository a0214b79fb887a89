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
 * Partition of dataset row indices into readings to fit and checkpoints to withhold.
 *
 * @param inserted    indices of the rows inserted into the map
 * @param checkpoints indices of the rows withheld as checkpoints
 */
public record DatasetSplit(int[] inserted, int[] checkpoints) {

    public int checkpointCount() {
        return checkpoints.length;
    }

    public int insertedCount() {
        return inserted.length;
    }
}
