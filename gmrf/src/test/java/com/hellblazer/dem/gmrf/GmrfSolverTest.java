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

import com.hellblazer.dem.geometry.BoundingBox;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class GmrfSolverTest {

    private static HeightGrid grid(int cols, int rows) {
        return HeightGrid.create(new BoundingBox(0, cols, 0, rows), 1.0);
    }

    private static void observe(HeightGrid grid, double lambdaObs, Observation... observations) {
        var accumulator = new ObservationAccumulator(grid, lambdaObs);
        for (var o : observations) {
            accumulator.insert(o);
        }
    }

    @Nested
    @DisplayName("Assembly")
    class Assembly {

        @Test
        public void informationMatrixIsSymmetric() {
            var grid = grid(5, 4);
            var random = new Random(42);
            for (int i = 0; i < 12; i++) {
                observe(grid, 1.0, Observation.of(random.nextDouble() * 5, random.nextDouble() * 4,
                                                  random.nextGaussian(), 0.1 + random.nextDouble()));
            }
            var system = new GmrfSolver(GmrfOptions.builder().withLambdaPrior(3.0).build()).assemble(grid);
            var lambda = system.information();

            for (int i = 0; i < system.size(); i++) {
                for (int j = 0; j < system.size(); j++) {
                    assertEquals(lambda.get(i, j), lambda.get(j, i), 0.0);
                }
            }
        }

        @Test
        public void rowsSumToTheObservedInformation() {
            var grid = grid(4, 3);
            observe(grid, 1.0, Observation.of(0.5, 0.5, 2.0, 0.5), Observation.of(2.5, 1.5, -1.0, 0.25));
            var system = new GmrfSolver(GmrfOptions.builder().withLambdaPrior(7.0).build()).assemble(grid);

            for (int i = 0; i < system.size(); i++) {
                var sum = 0.0;
                for (int j = 0; j < system.size(); j++) {
                    sum += system.information().get(i, j);
                }
                assertEquals(grid.cell(i).totalInformation(), sum, 1e-12);
                assertEquals(grid.cell(i).totalWeightedMean(), system.informationVector()[i], 1e-12);
            }
            assertEquals(4.0 + 14.0, system.diagonal(grid.indexOf(0, 0)), 1e-12);
            assertEquals(3, system.rows());
            assertEquals(4, system.cols());
        }
    }

    @Test
    public void unitSquare() {
        var grid = HeightGrid.create(new BoundingBox(-0.5, 1.5, -0.5, 1.5), 1.0);
        var options = GmrfOptions.builder().withStdPrior(1.0).build();
        var sigma = 0.2;
        observe(grid, options.getLambdaObs(), Observation.of(0, 0, 0, sigma), Observation.of(1, 0, 0, sigma),
                Observation.of(0, 1, 2, sigma), Observation.of(1, 1, 2, sigma));

        var report = new GmrfSolver(options).solve(grid);

        assertTrue(report.converged());
        // w = 1/σ², unit prior: (w + 1) a = b and (w + 1) b - a = 2w, so a = 2 / (w + 2)
        var w = 1.0 / (sigma * sigma);
        var low = 2.0 / (w + 2.0);
        var high = (w + 1.0) * low;
        assertEquals(w, grid.cellAt(0, 0).getInformationSum(), 1e-9);
        assertEquals(low, grid.cellAt(0, 0).getMean(), 1e-6);
        assertEquals(low, grid.cellAt(0, 1).getMean(), 1e-6);
        assertEquals(high, grid.cellAt(1, 0).getMean(), 1e-6);
        assertEquals(high, grid.cellAt(1, 1).getMean(), 1e-6);
    }

    @Test
    public void noObservationsIsFlat() {
        var grid = grid(6, 6);

        var report = new GmrfSolver(GmrfOptions.defaultOptions()).solve(grid);

        assertTrue(report.converged());
        grid.forEach(cell -> assertEquals(0.0, cell.getMean()));
    }

    @Test
    public void strongPriorFlattensTheSurface() {
        var grid = grid(5, 5);
        var options = GmrfOptions.builder().withStdPrior(0.01).build();
        observe(grid, 1.0, Observation.of(0.5, 0.5, 0.0, 1.0), Observation.of(4.5, 4.5, 10.0, 1.0));

        new GmrfSolver(options).solve(grid);

        var min = Double.POSITIVE_INFINITY;
        var max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < grid.size(); i++) {
            min = Math.min(min, grid.cell(i).getMean());
            max = Math.max(max, grid.cell(i).getMean());
        }
        assertTrue(max - min < 0.01, "spread " + (max - min));
        assertEquals(5.0, grid.cellAt(2, 2).getMean(), 0.01);
    }

    @Test
    public void vanishingPriorReturnsTheFusedMeans() {
        var grid = grid(3, 3);
        var random = new Random(7);
        for (int row = 0; row < 3; row++) {
            for (int col = 0; col < 3; col++) {
                observe(grid, 1.0, Observation.of(col + 0.5, row + 0.5, random.nextGaussian() * 10, 0.2),
                        Observation.of(col + 0.25, row + 0.75, random.nextGaussian() * 10, 0.5));
            }
        }

        new GmrfSolver(GmrfOptions.builder().withLambdaPrior(1e-9).build()).solve(grid);

        grid.forEach(cell -> assertEquals(cell.fusedMean(), cell.getMean(), 1e-6));
    }

    @Test
    public void unobservedCellsAreFilledBetweenNeighbours() {
        var grid = grid(3, 1);
        observe(grid, 1.0, Observation.of(0.5, 0.5, 0.0, 0.1), Observation.of(2.5, 0.5, 4.0, 0.1));

        new GmrfSolver(GmrfOptions.defaultOptions()).solve(grid);

        assertEquals(2.0, grid.cellAt(0, 1).getMean(), 1e-5);
        assertFalse(grid.cellAt(0, 1).hasObservations());
    }

    @Test
    public void iterationCapReportsAWarning() {
        var grid = grid(10, 10);
        var random = new Random(3);
        for (int i = 0; i < 30; i++) {
            observe(grid, 1.0, Observation.of(random.nextDouble() * 10, random.nextDouble() * 10,
                                              random.nextGaussian() * 100, 0.5));
        }

        var report = new GmrfSolver(GmrfOptions.builder().withMaxIterations(1).build()).solve(grid);

        assertFalse(report.converged());
        assertEquals(1, report.iterations());
        var warning = report.warning().orElseThrow();
        assertEquals(1, warning.iterations());
        assertTrue(warning.relativeResidual() > warning.tolerance());
        var moved = 0;
        for (int i = 0; i < grid.size(); i++) {
            if (grid.cell(i).getMean() != 0.0) {
                moved++;
            }
        }
        assertTrue(moved > 0, "the partial solution is still written");
    }

    @Test
    public void skippingVarianceKeepsTheDefault() {
        var grid = HeightGrid.create(new BoundingBox(0, 4, 0, 4), 1.0, new GridCell(0.0, 42.0));
        observe(grid, 1.0, Observation.of(1, 1, 3.0, 0.5));

        var report = new GmrfSolver(GmrfOptions.builder().withSkipVariance(true).build()).solve(grid);

        assertFalse(report.varianceEstimated());
        grid.forEach(cell -> assertEquals(42.0, cell.getVariance()));
        assertNotEquals(0.0, grid.cellAt(1, 1).getMean());
    }

    @Test
    public void observationsReduceVariance() {
        var grid = grid(5, 5);
        observe(grid, 1.0, Observation.of(2.5, 2.5, 1.0, 0.1));

        var report = new GmrfSolver(GmrfOptions.defaultOptions()).solve(grid);

        assertTrue(report.varianceEstimated());
        assertTrue(grid.cellAt(2, 2).getVariance() < grid.cellAt(0, 0).getVariance());
        grid.forEach(cell -> assertTrue(cell.getVariance() > 0.0));
    }

    @Test
    public void repeatedUpdateIsStable() {
        var grid = grid(8, 8);
        var random = new Random(11);
        for (int i = 0; i < 40; i++) {
            observe(grid, 1.0, Observation.of(random.nextDouble() * 8, random.nextDouble() * 8, random.nextGaussian(),
                                              0.3));
        }
        var solver = new GmrfSolver(GmrfOptions.defaultOptions());
        var first = solver.solve(grid);
        var means = new double[grid.size()];
        for (int i = 0; i < means.length; i++) {
            means[i] = grid.cell(i).getMean();
        }

        var second = solver.solve(grid);

        assertTrue(second.iterations() <= first.iterations());
        for (int i = 0; i < means.length; i++) {
            assertEquals(means[i], grid.cell(i).getMean(), 1e-6);
        }
    }

    @Test
    public void transientInformationDecaysAfterAnUpdate() {
        var grid = grid(3, 3);
        observe(grid, 1.0, new Observation(1.5, 1.5, 5.0, 1.0, false), new Observation(0.5, 0.5, 1.0, 1.0, true));

        new GmrfSolver(GmrfOptions.builder().withTransientInformationLoss(0.25).build()).solve(grid);

        assertEquals(0.75, grid.cellAt(1, 1).getTransientInformation(), 1e-12);
        assertEquals(1.0, grid.cellAt(0, 0).getInformationSum(), 1e-12);
    }
}
