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

import org.ejml.data.DMatrixSparseCSC;

/**
 * The GMRF in information form: sparse symmetric precision matrix over all cells and the information vector. Built
 * fresh for every solve and discarded afterwards.
 *
 * @param information       precision matrix, {@code rows * cols} square, row major cell order
 * @param informationVector precision weighted observation sums
 * @param rows              grid rows
 * @param cols              grid columns
 */
public record InformationSystem(DMatrixSparseCSC information, double[] informationVector, int rows, int cols) {

    public double diagonal(int index) {
        return information.get(index, index);
    }

    public int size() {
        return informationVector.length;
    }
}
