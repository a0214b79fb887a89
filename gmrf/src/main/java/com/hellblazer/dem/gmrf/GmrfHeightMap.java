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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Digital elevation model estimated as a Gaussian Markov Random Field over a regular grid.
 * <p>
 * Usage is accumulate then solve: insert any number of readings, call {@link #update()} to recompute the mean (and
 * optionally variance) surface, then query it. Insertion is cheap and only touches per cell accumulators; the update
 * is the expensive batch step and is only ever run when asked for. Updating twice without new readings yields the
 * same surface.
 *
 * <pre>
 * var map = new GmrfHeightMap(bbox, 1.0, GmrfOptions.builder().withStdPrior(1.0).build());
 * map.insertAll(observations);
 * map.update();
 * var height = map.predict(x, y, InterpolationMode.BILINEAR);
 * </pre>
 *
 * @author hal.hildebrand
 */
public class GmrfHeightMap {
    private static final Logger log = LoggerFactory.getLogger(GmrfHeightMap.class);

    private final HeightGrid             grid;
    private final GmrfOptions            options;
    private final ObservationAccumulator accumulator;
    private final GmrfSolver             solver;
    private final HeightPredictor        predictor;

    public GmrfHeightMap(BoundingBox bbox, double resolution, GmrfOptions options) {
        this(HeightGrid.create(bbox, resolution, new GridCell()), options);
    }

    /**
     * @throws GmrfException.ConfigurationException if the variance estimator cannot handle a grid of this size
     */
    public GmrfHeightMap(HeightGrid grid, GmrfOptions options) {
        if (!options.isSkipVariance()) {
            options.getVarianceEstimator().checkCapacity(grid.size());
        }
        this.grid = grid;
        this.options = options;
        this.accumulator = new ObservationAccumulator(grid, options.getLambdaObs());
        this.solver = new GmrfSolver(options);
        this.predictor = new HeightPredictor(grid);
        log.debug("Created {} with {}", grid, options);
    }

    public HeightGrid getGrid() {
        return grid;
    }

    public GmrfOptions getOptions() {
        return options;
    }

    public HeightPredictor getPredictor() {
        return predictor;
    }

    public void insert(Observation observation) {
        accumulator.insert(observation);
    }

    public InsertionReport insertAll(List<Observation> observations) {
        return accumulator.insertAll(observations);
    }

    public InsertionReport insertAll(List<Observation> observations, int parallelism) {
        return accumulator.insertAll(observations, parallelism);
    }

    public Prediction predict(double x, double y, InterpolationMode mode) {
        return predictor.predict(x, y, mode);
    }

    /**
     * Rebuild the prior, solve and write the estimate into every cell.
     */
    public SolveReport update() {
        var report = solver.solve(grid);
        log.info("GMRF update of {} cells: {} iterations, residual {}, {} ms", report.unknowns(), report.iterations(),
                 String.format("%.3e", report.relativeResidual()), report.elapsed().toMillis());
        return report;
    }
}
