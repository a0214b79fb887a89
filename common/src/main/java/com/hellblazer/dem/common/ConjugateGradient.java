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
package com.hellblazer.dem.common;

import org.ejml.data.DMatrixSparseCSC;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Jacobi preconditioned conjugate gradient for sparse symmetric positive (semi) definite systems stored in EJML's
 * compressed sparse column format.
 * <p>
 * The solver never throws on non-convergence: it stops at the iteration cap and hands back the last iterate together
 * with the achieved relative residual, leaving it to the caller to decide whether that is acceptable.
 *
 * @author hal.hildebrand
 */
public class ConjugateGradient {

    /**
     * Outcome of a solve.
     *
     * @param iterations       number of CG iterations performed
     * @param relativeResidual ||b - Ax|| / ||b|| of the returned solution (0 for a zero right hand side)
     * @param converged        true if the relative residual reached the tolerance
     */
    public record Result(int iterations, double relativeResidual, boolean converged) {
    }

    private static final Logger log = LoggerFactory.getLogger(ConjugateGradient.class);

    private final double tolerance;
    private final int    maxIterations;

    public ConjugateGradient(double tolerance, int maxIterations) {
        if (!(tolerance > 0)) {
            throw new IllegalArgumentException("Tolerance must be positive: " + tolerance);
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("Max iterations must be positive: " + maxIterations);
        }
        this.tolerance = tolerance;
        this.maxIterations = maxIterations;
    }

    /**
     * y = A x, for a CSC matrix. y is overwritten.
     */
    public static void multiply(DMatrixSparseCSC a, double[] x, double[] y) {
        Arrays.fill(y, 0, a.numRows, 0.0);
        for (int col = 0; col < a.numCols; col++) {
            var xc = x[col];
            if (xc == 0.0) {
                continue;
            }
            for (int idx = a.col_idx[col], end = a.col_idx[col + 1]; idx < end; idx++) {
                y[a.nz_rows[idx]] += a.nz_values[idx] * xc;
            }
        }
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public double getTolerance() {
        return tolerance;
    }

    /**
     * Solve A x = b in place.
     *
     * @param a symmetric matrix, square
     * @param b right hand side
     * @param x initial guess on entry, solution on exit
     * @return the solve outcome
     */
    public Result solve(DMatrixSparseCSC a, double[] b, double[] x) {
        var n = a.numRows;
        if (a.numCols != n) {
            throw new IllegalArgumentException("Matrix must be square: %d x %d".formatted(a.numRows, a.numCols));
        }
        if (b.length != n || x.length != n) {
            throw new IllegalArgumentException(
            "Dimension mismatch: matrix %d, rhs %d, solution %d".formatted(n, b.length, x.length));
        }

        var bNorm = Math.sqrt(dot(b, b));
        if (bNorm == 0.0) {
            Arrays.fill(x, 0.0);
            return new Result(0, 0.0, true);
        }

        var inverseDiagonal = new double[n];
        for (int i = 0; i < n; i++) {
            var d = a.get(i, i);
            inverseDiagonal[i] = d > 0.0 ? 1.0 / d : 1.0;
        }

        var r = new double[n];
        var z = new double[n];
        var p = new double[n];
        var q = new double[n];

        multiply(a, x, q);
        for (int i = 0; i < n; i++) {
            r[i] = b[i] - q[i];
            z[i] = inverseDiagonal[i] * r[i];
            p[i] = z[i];
        }
        var rz = dot(r, z);
        var residual = Math.sqrt(dot(r, r)) / bNorm;

        int iteration = 0;
        while (residual > tolerance && iteration < maxIterations) {
            multiply(a, p, q);
            var pq = dot(p, q);
            if (!(pq > 0.0)) {
                // search direction in the null space of a semi definite system, nothing left to reduce
                log.debug("CG breakdown at iteration {}: p'Ap = {}", iteration, pq);
                break;
            }
            var alpha = rz / pq;
            for (int i = 0; i < n; i++) {
                x[i] += alpha * p[i];
                r[i] -= alpha * q[i];
                z[i] = inverseDiagonal[i] * r[i];
            }
            var rzNext = dot(r, z);
            var beta = rzNext / rz;
            for (int i = 0; i < n; i++) {
                p[i] = z[i] + beta * p[i];
            }
            rz = rzNext;
            residual = Math.sqrt(dot(r, r)) / bNorm;
            iteration++;
            if (log.isTraceEnabled() && iteration % 100 == 0) {
                log.trace("CG iteration {} relative residual {}", iteration, residual);
            }
        }
        return new Result(iteration, residual, residual <= tolerance);
    }
}
