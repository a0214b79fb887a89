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

import com.hellblazer.dem.gmrf.GmrfException.InvalidObservationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Fuses point readings into the information accumulated by the grid cells.
 * <p>
 * A reading of standard deviation {@code σ} contributes the precision {@code w = lambdaObs / σ^2} and the weighted
 * height {@code w * z} to the cell containing it. Contributions add up, which is Bayesian fusion of independent
 * Gaussian readings. Insertion never touches a cell's mean or variance; those change only when the estimator is
 * updated.
 *
 * @author hal.hildebrand
 */
public class ObservationAccumulator {
    private static final Logger log = LoggerFactory.getLogger(ObservationAccumulator.class);

    private final HeightGrid grid;
    private final double     lambdaObs;

    public ObservationAccumulator(HeightGrid grid, double lambdaObs) {
        if (!(lambdaObs > 0) || !Double.isFinite(lambdaObs)) {
            throw new GmrfException.ConfigurationException("Observation precision must be positive: " + lambdaObs);
        }
        this.grid = grid;
        this.lambdaObs = lambdaObs;
    }

    public double getLambdaObs() {
        return lambdaObs;
    }

    /**
     * Fuse one reading into its cell.
     *
     * @throws InvalidObservationException if the reading has no usable standard deviation or height, or lies outside
     *                                     the grid
     */
    public void insert(Observation observation) {
        var information = informationOf(observation);
        var index = grid.cellIndexOf(observation.x(), observation.y());
        grid.cellAt(index.row(), index.col()).accumulate(information, observation.z(), observation.timeInvariant());
    }

    /**
     * Insert every reading, skipping the invalid ones.
     */
    public InsertionReport insertAll(List<Observation> observations) {
        var inserted = 0;
        var rejected = 0;
        var rejections = new ArrayList<InvalidObservationException>();
        for (var observation : observations) {
            try {
                insert(observation);
                inserted++;
            } catch (InvalidObservationException e) {
                rejected++;
                if (rejections.size() < InsertionReport.MAX_REPORTED_REJECTIONS) {
                    rejections.add(e);
                }
                log.trace("Skipping reading", e);
            }
        }
        if (rejected > 0) {
            log.debug("Inserted {} readings, rejected {}", inserted, rejected);
        }
        return new InsertionReport(inserted, rejected, rejections);
    }

    /**
     * Insert every reading using a pool of workers. The batch is split into contiguous chunks, each chunk accumulates
     * private partial sums per cell, and the partial sums are merged into the grid in chunk order, so a given batch
     * and parallelism always produce the same result.
     *
     * @param observations the readings
     * @param parallelism  number of workers; 1 or less inserts sequentially
     */
    public InsertionReport insertAll(List<Observation> observations, int parallelism) {
        if (parallelism <= 1 || observations.size() < 2 * parallelism) {
            return insertAll(observations);
        }
        var chunkSize = (observations.size() + parallelism - 1) / parallelism;
        var pool = new ForkJoinPool(parallelism);
        try {
            var partials = pool.submit(() -> IntStream.range(0, parallelism)
                                                      .parallel()
                                                      .mapToObj(chunk -> accumulate(observations, chunk * chunkSize,
                                                                                    Math.min(observations.size(),
                                                                                             (chunk + 1) * chunkSize)))
                                                      .collect(Collectors.toList())).get();
            var report = new InsertionReport(0, 0, List.of());
            for (var partial : partials) {
                partial.mergeInto(grid);
                report = report.merge(partial.report);
            }
            log.debug("Inserted {} readings with {} workers, rejected {}", report.inserted(), parallelism,
                      report.rejected());
            return report;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during parallel insertion", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Parallel insertion failed", e.getCause());
        } finally {
            pool.shutdown();
        }
    }

    /**
     * The precision a reading contributes.
     *
     * @throws InvalidObservationException if the reading cannot be fused
     */
    public double informationOf(Observation observation) {
        var stddev = observation.stddev();
        if (!(stddev > 0) || !Double.isFinite(stddev)) {
            throw new InvalidObservationException(observation, "Standard deviation must be positive");
        }
        if (!Double.isFinite(observation.z())) {
            throw new InvalidObservationException(observation, "Height must be finite");
        }
        if (!grid.contains(observation.x(), observation.y())) {
            throw new InvalidObservationException(observation, "Outside the grid extent " + grid.getExtent());
        }
        return lambdaObs / (stddev * stddev);
    }

    private Partial accumulate(List<Observation> observations, int from, int to) {
        var partial = new Partial();
        var inserted = 0;
        var rejected = 0;
        var rejections = new ArrayList<InvalidObservationException>();
        for (int i = from; i < to; i++) {
            var observation = observations.get(i);
            try {
                var information = informationOf(observation);
                var index = grid.cellIndexOf(observation.x(), observation.y());
                var sums = partial.sums.computeIfAbsent(grid.indexOf(index.row(), index.col()), k -> new double[4]);
                var offset = observation.timeInvariant() ? 0 : 2;
                sums[offset] += information;
                sums[offset + 1] += information * observation.z();
                inserted++;
            } catch (InvalidObservationException e) {
                rejected++;
                if (rejections.size() < InsertionReport.MAX_REPORTED_REJECTIONS) {
                    rejections.add(e);
                }
            }
        }
        partial.report = new InsertionReport(inserted, rejected, rejections);
        return partial;
    }

    private static class Partial {
        private final Map<Integer, double[]> sums = new HashMap<>();
        private InsertionReport              report;

        private void mergeInto(HeightGrid grid) {
            for (var entry : sums.entrySet()) {
                var cell = grid.cell(entry.getKey());
                var s = entry.getValue();
                cell.addInformation(s[0], s[1], true);
                cell.addInformation(s[2], s[3], false);
            }
        }
    }
}
