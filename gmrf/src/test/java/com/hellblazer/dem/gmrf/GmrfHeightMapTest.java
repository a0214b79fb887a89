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
import com.hellblazer.dem.gmrf.variance.CholeskyVarianceEstimator;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class GmrfHeightMapTest {

    private static double plane(double x, double y) {
        return 0.5 * x - 0.2 * y + 3.0;
    }

    @Test
    public void recoversAPlaneFromDenseReadings() {
        var map = new GmrfHeightMap(new BoundingBox(0, 20, 0, 20), 1.0, GmrfOptions.defaultOptions());
        var readings = new ArrayList<Observation>();
        for (int i = 0; i < 40; i++) {
            for (int j = 0; j < 40; j++) {
                var x = i * 0.5 + 0.25;
                var y = j * 0.5 + 0.25;
                readings.add(Observation.of(x, y, plane(x, y), 0.1));
            }
        }
        readings.add(Observation.of(25, 5, 0, 0.1));

        var insertion = map.insertAll(readings);
        var report = map.update();

        assertEquals(1600, insertion.inserted());
        assertEquals(1, insertion.rejected());
        assertTrue(report.converged());
        assertEquals(400, report.unknowns());
        assertEquals(plane(7.3, 11.8), map.predict(7.3, 11.8, InterpolationMode.BILINEAR).mean(), 1e-3);
        assertEquals(plane(10.5, 4.5), map.predict(10.2, 4.9, InterpolationMode.NEAREST).mean(), 1e-3);
        var p = map.predict(5.5, 5.5, InterpolationMode.NEAREST);
        assertTrue(p.stdDev() > 0 && p.stdDev() < 0.1);
    }

    @Test
    public void parallelInsertionGivesTheSameSurface() {
        var sequential = new GmrfHeightMap(new BoundingBox(0, 10, 0, 10), 0.5, GmrfOptions.defaultOptions());
        var parallel = new GmrfHeightMap(new BoundingBox(0, 10, 0, 10), 0.5, GmrfOptions.defaultOptions());
        var readings = new ArrayList<Observation>();
        var random = new Random(99);
        for (int i = 0; i < 2_000; i++) {
            var x = random.nextDouble() * 10;
            var y = random.nextDouble() * 10;
            readings.add(Observation.of(x, y, Math.sin(x) * Math.cos(y), 0.05 + random.nextDouble() * 0.2));
        }

        sequential.insertAll(readings);
        parallel.insertAll(readings, 3);
        sequential.update();
        parallel.update();

        for (int i = 0; i < sequential.getGrid().size(); i++) {
            assertEquals(sequential.getGrid().cell(i).getMean(), parallel.getGrid().cell(i).getMean(), 1e-6);
        }
    }

    @Test
    public void exactVarianceRefusesAnOversizedGridAtConstruction() {
        var bbox = new BoundingBox(0, 4, 0, 4);
        var exact = GmrfOptions.builder().withVarianceEstimator(new CholeskyVarianceEstimator(10)).build();

        var e = assertThrows(GmrfException.ConfigurationException.class, () -> new GmrfHeightMap(bbox, 1.0, exact));
        assertTrue(e.getMessage().contains("16"), e.getMessage());

        var skipped = GmrfOptions.builder()
                                 .withVarianceEstimator(new CholeskyVarianceEstimator(10))
                                 .withSkipVariance(true)
                                 .build();
        assertEquals(16, new GmrfHeightMap(bbox, 1.0, skipped).getGrid().size());
    }
}
