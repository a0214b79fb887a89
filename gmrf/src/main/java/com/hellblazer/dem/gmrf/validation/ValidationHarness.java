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

import com.hellblazer.dem.gmrf.GmrfException.OutOfBoundsException;
import com.hellblazer.dem.gmrf.HeightPredictor;
import com.hellblazer.dem.gmrf.InterpolationMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Measures the fitted surface against withheld checkpoints.
 *
 * @author hal.hildebrand
 */
public class ValidationHarness {
    private static final Logger log = LoggerFactory.getLogger(ValidationHarness.class);

    private final HeightPredictor predictor;

    public ValidationHarness(HeightPredictor predictor) {
        this.predictor = predictor;
    }

    /**
     * Compute nearest cell and bilinear residuals of every checkpoint. A checkpoint outside the grid is skipped and
     * counted; the rest are still evaluated. An empty checkpoint list yields empty residuals and
     * {@link ResidualStats#EMPTY}.
     */
    public ValidationReport evaluate(List<Checkpoint> checkpoints) {
        var nearest = new double[checkpoints.size()];
        var bilinear = new double[checkpoints.size()];
        var evaluated = 0;
        var outOfBounds = 0;
        for (var checkpoint : checkpoints) {
            try {
                var nn = predictor.predict(checkpoint.x(), checkpoint.y(), InterpolationMode.NEAREST);
                var bi = predictor.predict(checkpoint.x(), checkpoint.y(), InterpolationMode.BILINEAR);
                nearest[evaluated] = checkpoint.zTrue() - nn.mean();
                bilinear[evaluated] = checkpoint.zTrue() - bi.mean();
                evaluated++;
            } catch (OutOfBoundsException e) {
                outOfBounds++;
                log.debug("Skipping checkpoint: {}", e.getMessage());
            }
        }
        if (outOfBounds > 0) {
            log.warn("{} of {} checkpoints are outside the grid and were not evaluated", outOfBounds,
                     checkpoints.size());
        }
        var nearestResiduals = Arrays.copyOf(nearest, evaluated);
        var bilinearResiduals = Arrays.copyOf(bilinear, evaluated);
        return new ValidationReport(nearestResiduals, bilinearResiduals, ResidualStats.compute(nearestResiduals),
                                    ResidualStats.compute(bilinearResiduals), outOfBounds);
    }
}
