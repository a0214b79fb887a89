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

import com.hellblazer.dem.common.ConjugateGradient;
import org.ejml.data.DMatrixSparseCSC;
import org.ejml.data.DMatrixSparseTriplet;
import org.ejml.ops.DConvertMatrixStruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Maximum a posteriori estimate of the elevation grid.
 * <p>
 * Each update assembles the information system from the cells' accumulated observations and the smoothness prior,
 * solves {@code Λ μ = η} with a Jacobi preconditioned conjugate gradient, warm started from the current means, and
 * writes the means back. Cells without observations are filled through the prior coupling. When variances are
 * requested the configured {@link com.hellblazer.dem.gmrf.variance.VarianceEstimator} writes them as well.
 *
 * @author hal.hildebrand
 */
public class GmrfSolver {
    private static final Logger log = LoggerFactory.getLogger(GmrfSolver.class);

    private final GmrfOptions options;

    public GmrfSolver(GmrfOptions options) {
        this.options = options;
    }

    /**
     * Build the information matrix and vector for the grid's current accumulated state.
     */
    public InformationSystem assemble(HeightGrid grid) {
        var n = grid.size();
        var diagonal = new double[n];
        var eta = new double[n];
        for (int i = 0; i < n; i++) {
            var cell = grid.cell(i);
            diagonal[i] = cell.totalInformation();
            eta[i] = cell.totalWeightedMean();
        }

        var triplet = new DMatrixSparseTriplet(n, n, n + 2 * PriorBuilder.edgeCount(grid));
        PriorBuilder.buildPriorTerms(grid, options.getLambdaPrior(), diagonal, triplet);
        for (int i = 0; i < n; i++) {
            triplet.addItem(i, i, diagonal[i]);
        }

        var information = DConvertMatrixStruct.convert(triplet, (DMatrixSparseCSC) null);
        information.sortIndices(null);
        return new InformationSystem(information, eta, grid.getRows(), grid.getCols());
    }

    public GmrfOptions getOptions() {
        return options;
    }

    /**
     * Recompute every cell's mean and, unless skipped, its variance.
     *
     * @return the solve summary; a report that did not converge still carries a usable solution
     */
    public SolveReport solve(HeightGrid grid) {
        var start = System.nanoTime();
        var system = assemble(grid);
        var n = system.size();
        log.debug("Assembled information system: {} unknowns, {} non zeros", n, system.information().nz_length);

        var means = new double[n];
        for (int i = 0; i < n; i++) {
            var mean = grid.cell(i).getMean();
            means[i] = Double.isFinite(mean) ? mean : 0.0;
        }
        var cg = new ConjugateGradient(options.getTolerance(), options.getMaxIterations());
        var result = cg.solve(system.information(), system.informationVector(), means);
        for (int i = 0; i < n; i++) {
            grid.cell(i).setMean(means[i]);
        }
        log.debug("Mean solve: {} iterations, relative residual {}", result.iterations(), result.relativeResidual());

        var estimateVariance = !options.isSkipVariance();
        if (estimateVariance) {
            var estimator = options.getVarianceEstimator();
            var variances = estimator.estimateVariance(system);
            for (int i = 0; i < n; i++) {
                grid.cell(i).setVariance(variances[i]);
            }
            log.debug("Variances estimated with {}", estimator.name());
        }

        var loss = options.getTransientInformationLoss();
        if (loss > 0.0) {
            grid.forEach(cell -> cell.decayTransient(1.0 - loss));
        }

        var report = new SolveReport(n, result.iterations(), result.relativeResidual(), options.getTolerance(),
                                     estimateVariance, Duration.ofNanos(System.nanoTime() - start));
        report.warning().ifPresent(warning -> log.warn(warning.message()));
        return report;
    }
}
