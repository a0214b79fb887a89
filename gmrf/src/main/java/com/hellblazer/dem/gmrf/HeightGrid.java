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

import com.hellblazer.dem.gmrf.GmrfException.ConfigurationException;
import com.hellblazer.dem.gmrf.GmrfException.OutOfBoundsException;
import com.hellblazer.dem.geometry.BoundingBox;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Fixed size, row major grid of elevation cells laid over a rectangle of the XY plane.
 * <p>
 * The grid covers the requested rectangle with {@code cols = ceil(width / resolution)} by
 * {@code rows = ceil(height / resolution)} cells anchored at the rectangle's minimum corner, so its effective extent
 * may reach slightly past the requested maximum. The dimensions never change once created.
 *
 * @author hal.hildebrand
 */
public class HeightGrid {
    private final BoundingBox extent;
    private final double      resolution;
    private final int         rows;
    private final int         cols;
    private final GridCell[]  cells;

    private HeightGrid(BoundingBox requested, double resolution, int rows, int cols, GridCell defaultCell) {
        this.resolution = resolution;
        this.rows = rows;
        this.cols = cols;
        // never smaller than requested, even when cols * resolution rounds down
        this.extent = new BoundingBox(requested.minX(), Math.max(requested.maxX(), requested.minX() + cols * resolution),
                                      requested.minY(), Math.max(requested.maxY(), requested.minY() + rows * resolution));
        this.cells = new GridCell[rows * cols];
        for (int i = 0; i < cells.length; i++) {
            cells[i] = new GridCell(defaultCell);
        }
    }

    /**
     * Allocate a grid covering the bounding box.
     *
     * @param bbox        the area to cover, usually the data extent grown by a margin
     * @param resolution  cell side length, in the units of the coordinates
     * @param defaultCell every cell starts as a copy of this one
     * @return the new grid
     * @throws ConfigurationException if the resolution is not positive or the grid would be too large to index
     */
    public static HeightGrid create(BoundingBox bbox, double resolution, GridCell defaultCell) {
        Objects.requireNonNull(bbox, "bbox");
        Objects.requireNonNull(defaultCell, "defaultCell");
        if (!(resolution > 0) || !Double.isFinite(resolution)) {
            throw new ConfigurationException("Resolution must be positive: " + resolution);
        }
        var cols = Math.max(1L, (long) Math.ceil(bbox.width() / resolution));
        var rows = Math.max(1L, (long) Math.ceil(bbox.height() / resolution));
        if (rows * cols > Integer.MAX_VALUE - 8) {
            throw new ConfigurationException(
            "Grid of %d x %d cells is too large, increase the resolution".formatted(rows, cols));
        }
        return new HeightGrid(bbox, resolution, (int) rows, (int) cols, defaultCell);
    }

    public static HeightGrid create(BoundingBox bbox, double resolution) {
        return create(bbox, resolution, new GridCell());
    }

    public GridCell cell(int index) {
        return cells[Objects.checkIndex(index, cells.length)];
    }

    /**
     * @return the mutable cell at the row and column
     * @throws IndexOutOfBoundsException if either index is out of range
     */
    public GridCell cellAt(int row, int col) {
        return cells[indexOf(row, col)];
    }

    public double cellCenterX(int col) {
        return extent.minX() + (col + 0.5) * resolution;
    }

    public double cellCenterY(int row) {
        return extent.minY() + (row + 0.5) * resolution;
    }

    /**
     * Map a coordinate to the cell containing it. Coordinates on the maximum edges belong to the last row or column.
     *
     * @throws OutOfBoundsException if the coordinate is outside the grid extent
     */
    public CellIndex cellIndexOf(double x, double y) {
        if (!contains(x, y)) {
            throw new OutOfBoundsException(x, y, extent.toString());
        }
        var col = Math.min(cols - 1, (int) Math.floor((x - extent.minX()) / resolution));
        var row = Math.min(rows - 1, (int) Math.floor((y - extent.minY()) / resolution));
        return new CellIndex(row, col);
    }

    public boolean contains(double x, double y) {
        return extent.contains(x, y);
    }

    public void forEach(Consumer<GridCell> action) {
        for (var cell : cells) {
            action.accept(cell);
        }
    }

    public int getCols() {
        return cols;
    }

    /**
     * @return the area actually covered by the cells
     */
    public BoundingBox getExtent() {
        return extent;
    }

    public double getResolution() {
        return resolution;
    }

    public int getRows() {
        return rows;
    }

    /**
     * Row major linear index of a cell, the index of its unknown in the information system.
     */
    public int indexOf(int row, int col) {
        Objects.checkIndex(row, rows);
        Objects.checkIndex(col, cols);
        return row * cols + col;
    }

    public int size() {
        return cells.length;
    }

    @Override
    public String toString() {
        return String.format("HeightGrid[%d x %d cells, resolution=%s, %s]", rows, cols, resolution, extent);
    }
}
