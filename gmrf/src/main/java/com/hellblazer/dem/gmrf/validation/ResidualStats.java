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

import java.util.Arrays;

/**
 * Summary of a residual vector, in the column order of the statistics file.
 * <p>
 * {@code maxAbs} and {@code minAbs} are the largest and smallest <em>signed</em> residuals. The names follow the
 * established {@code MAX_ABS_ERR}/{@code MIN_ABS_ERR} output header even though no absolute value is taken; consumers
 * of existing result files rely on the signed values.
 *
 * @param maxAbs largest signed residual
 * @param minAbs smallest signed residual
 * @param mean   sample mean
 * @param stdDev sample standard deviation, N - 1 denominator, 0 for a single residual
 * @param rmse   root of the mean squared residual
 * @param median lower median of the sorted residuals
 * @param count  number of residuals, 0 for the empty summary
 */
public record ResidualStats(double maxAbs, double minAbs, double mean, double stdDev, double rmse, double median,
                            int count) {

    public static final String        HEADER = "% MAX_ABS_ERR   MIN_ABS_ERR   AVERAGE_ERR   STD_DEV   RMSE    MEDIAN";
    /**
     * No residuals: every statistic zero, {@link #isEmpty()} true
     */
    public static final ResidualStats EMPTY  = new ResidualStats(0, 0, 0, 0, 0, 0, 0);

    public static ResidualStats compute(double[] residuals) {
        var n = residuals.length;
        if (n == 0) {
            return EMPTY;
        }
        var sorted = residuals.clone();
        Arrays.sort(sorted);

        var sum = 0.0;
        var sumSquares = 0.0;
        for (var r : residuals) {
            sum += r;
            sumSquares += r * r;
        }
        var mean = sum / n;
        var deviation = 0.0;
        for (var r : residuals) {
            deviation += (r - mean) * (r - mean);
        }
        var stdDev = n > 1 ? Math.sqrt(deviation / (n - 1)) : 0.0;
        var rmse = Math.sqrt(sumSquares / n);
        return new ResidualStats(sorted[n - 1], sorted[0], mean, stdDev, rmse, sorted[(n - 1) / 2], n);
    }

    public boolean isEmpty() {
        return count == 0;
    }

    /**
     * @return the six statistics in file column order
     */
    public double[] toArray() {
        return new double[] { maxAbs, minAbs, mean, stdDev, rmse, median };
    }
}
