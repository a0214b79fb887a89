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

import org.ejml.data.DMatrixSparseTriplet;

/**
 * Smoothness prior between 4-connected neighbouring cells.
 * <p>
 * Every edge (a, b) carries the penalty {@code lambdaPrior * (h(a) - h(b))^2}. In the information matrix that is
 * {@code +lambdaPrior} on both diagonal entries and {@code -lambdaPrior} on both off diagonal couplings. The prior is
 * zero mean in the height difference, so it adds nothing to the information vector. Edges are never materialized;
 * they are enumerated from the grid shape on demand.
 *
 * @author hal.hildebrand
 */
public final class PriorBuilder {

    /**
     * Receives each unordered edge once, as row major cell indices with {@code a < b}
     */
    @FunctionalInterface
    public interface EdgeConsumer {
        void accept(int a, int b);
    }

    private PriorBuilder() {
    }

    /**
     * Add the prior terms of every edge of the grid.
     *
     * @param grid        the grid whose lattice defines the edges
     * @param lambdaPrior precision of each edge
     * @param diagonal    diagonal accumulator, one entry per cell
     * @param offDiagonal receives both symmetric coupling entries of each edge
     */
    public static void buildPriorTerms(HeightGrid grid, double lambdaPrior, double[] diagonal,
                                       DMatrixSparseTriplet offDiagonal) {
        if (diagonal.length != grid.size()) {
            throw new IllegalArgumentException(
            "Diagonal length %d does not match the grid size %d".formatted(diagonal.length, grid.size()));
        }
        if (lambdaPrior == 0.0) {
            return;
        }
        forEachEdge(grid, (a, b) -> {
            diagonal[a] += lambdaPrior;
            diagonal[b] += lambdaPrior;
            offDiagonal.addItem(a, b, -lambdaPrior);
            offDiagonal.addItem(b, a, -lambdaPrior);
        });
    }

    public static int edgeCount(HeightGrid grid) {
        var rows = grid.getRows();
        var cols = grid.getCols();
        return rows * (cols - 1) + cols * (rows - 1);
    }

    /**
     * Enumerate the right and upper neighbour of every cell. Border cells simply have fewer edges, there is no
     * wraparound.
     */
    public static void forEachEdge(HeightGrid grid, EdgeConsumer consumer) {
        var rows = grid.getRows();
        var cols = grid.getCols();
        for (int row = 0; row < rows; row++) {
            for (int col = 0; col < cols; col++) {
                var index = row * cols + col;
                if (col + 1 < cols) {
                    consumer.accept(index, index + 1);
                }
                if (row + 1 < rows) {
                    consumer.accept(index, index + cols);
                }
            }
        }
    }
}
