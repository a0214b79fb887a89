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

import com.hellblazer.dem.gmrf.GmrfException.ConfigurationException;

import java.util.Arrays;
import java.util.Objects;
import java.util.Random;

/**
 * Random selection of checkpoints. All row indices are shuffled uniformly; the first {@code N - round(ratio * N)} are
 * fitted, the remainder withheld. The random source is injected so a seeded generator reproduces a split exactly.
 *
 * @author hal.hildebrand
 */
public class CheckpointSplitter {
    private final Random random;

    public CheckpointSplitter(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    public static int checkpointCount(int n, double ratio) {
        validateRatio(ratio);
        return (int) Math.min(n, Math.round(ratio * n));
    }

    private static void validateRatio(double ratio) {
        if (!(ratio >= 0.0 && ratio <= 1.0)) {
            throw new ConfigurationException("Checkpoint ratio must be in [0, 1]: " + ratio);
        }
    }

    /**
     * @param n     number of dataset rows
     * @param ratio fraction of rows to withhold, in [0, 1]
     * @return the split
     */
    public DatasetSplit split(int n, double ratio) {
        if (n < 0) {
            throw new IllegalArgumentException("Row count must be non negative: " + n);
        }
        var checkpoints = checkpointCount(n, ratio);
        var indices = new int[n];
        for (int i = 0; i < n; i++) {
            indices[i] = i;
        }
        for (int i = n - 1; i > 0; i--) {
            var j = random.nextInt(i + 1);
            var swap = indices[i];
            indices[i] = indices[j];
            indices[j] = swap;
        }
        var insertCount = n - checkpoints;
        return new DatasetSplit(Arrays.copyOfRange(indices, 0, insertCount),
                                Arrays.copyOfRange(indices, insertCount, n));
    }
}
