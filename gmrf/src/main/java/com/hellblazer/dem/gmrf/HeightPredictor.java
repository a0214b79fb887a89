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

import com.hellblazer.dem.gmrf.GmrfException.OutOfBoundsException;

/**
 * Point queries against a solved grid. Read only, so any number of threads may query concurrently once the update has
 * completed.
 *
 * @author hal.hildebrand
 */
public class HeightPredictor {
    private final HeightGrid grid;

    public HeightPredictor(HeightGrid grid) {
        this.grid = grid;
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    public HeightGrid getGrid() {
        return grid;
    }

    /**
     * Predict the height at a point.
     *
     * @throws OutOfBoundsException if the point is outside the grid extent
     */
    public Prediction predict(double x, double y, InterpolationMode mode) {
        return switch (mode) {
            case NEAREST -> nearest(x, y);
            case BILINEAR -> bilinear(x, y);
        };
    }

    /**
     * Blend the four cell centres around the point. The stencil is clamped to the grid, so a point within half a cell
     * of the border is interpolated along the border rather than rejected. The variance assumes independent cells:
     * {@code Σ w² σ²}.
     */
    private Prediction bilinear(double x, double y) {
        if (!grid.contains(x, y)) {
            throw new OutOfBoundsException(x, y, grid.getExtent().toString());
        }
        var extent = grid.getExtent();
        var resolution = grid.getResolution();
        var fx = (x - extent.minX()) / resolution - 0.5;
        var fy = (y - extent.minY()) / resolution - 0.5;

        var col0 = clamp((int) Math.floor(fx), 0, Math.max(0, grid.getCols() - 2));
        var row0 = clamp((int) Math.floor(fy), 0, Math.max(0, grid.getRows() - 2));
        var col1 = Math.min(col0 + 1, grid.getCols() - 1);
        var row1 = Math.min(row0 + 1, grid.getRows() - 1);
        var tx = col1 == col0 ? 0.0 : Math.max(0.0, Math.min(1.0, fx - col0));
        var ty = row1 == row0 ? 0.0 : Math.max(0.0, Math.min(1.0, fy - row0));

        var mean = 0.0;
        var variance = 0.0;
        var weights = new double[] { (1 - tx) * (1 - ty), tx * (1 - ty), (1 - tx) * ty, tx * ty };
        var cells = new GridCell[] { grid.cellAt(row0, col0), grid.cellAt(row0, col1), grid.cellAt(row1, col0),
                                     grid.cellAt(row1, col1) };
        for (int i = 0; i < 4; i++) {
            var w = weights[i];
            if (w == 0.0) {
                continue;
            }
            mean += w * cells[i].getMean();
            variance += w * w * cells[i].getVariance();
        }
        return new Prediction(mean, Math.sqrt(variance));
    }

    private Prediction nearest(double x, double y) {
        var index = grid.cellIndexOf(x, y);
        var cell = grid.cellAt(index.row(), index.col());
        return new Prediction(cell.getMean(), cell.getStdDev());
    }
}
