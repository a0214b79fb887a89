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
package com.hellblazer.dem.gmrf.variance;

import com.hellblazer.dem.common.ConjugateGradient;
import com.hellblazer.dem.gmrf.InformationSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;
import java.util.Random;

/**
 * Stochastic estimate of {@code diag(Λ^-1)} from random probe vectors.
 * <p>
 * For Rademacher probes {@code v} (entries ±1) the expectation of {@code v ∘ Λ^-1 v} is the diagonal of the inverse.
 * Each probe costs one conjugate gradient solve; the average over {@code probes} samples has an error shrinking as
 * {@code 1 / sqrt(probes)}. Estimates are clamped from below by {@code 1 / Λii}, which the true marginal can never
 * undercut. The result is approximate and depends on the random source, which is injected so runs can be repeated.
 *
 * @author hal.hildebrand
 */
public class ProbingVarianceEstimator implements VarianceEstimator {
    public static final int    DEFAULT_PROBES         = 16;
    public static final double DEFAULT_TOLERANCE      = 1e-6;
    public static final int    DEFAULT_MAX_ITERATIONS = 10_000;

    private static final Logger log = LoggerFactory.getLogger(ProbingVarianceEstimator.class);

    private final int               probes;
    private final Random            random;
    private final ConjugateGradient solver;

    public ProbingVarianceEstimator(int probes, Random random) {
        this(probes, random, DEFAULT_TOLERANCE, DEFAULT_MAX_ITERATIONS);
    }

    public ProbingVarianceEstimator(int probes, Random random, double tolerance, int maxIterations) {
        if (probes < 1) {
            throw new IllegalArgumentException("Probe count must be positive: " + probes);
        }
        this.probes = probes;
        this.random = Objects.requireNonNull(random, "random");
        this.solver = new ConjugateGradient(tolerance, maxIterations);
    }

    @Override
    public double[] estimateVariance(InformationSystem system) {
        var n = system.size();
        var a = system.information();
        var sum = new double[n];
        var probe = new double[n];
        var response = new double[n];
        var unconverged = 0;

        for (int k = 0; k < probes; k++) {
            for (int i = 0; i < n; i++) {
                probe[i] = random.nextBoolean() ? 1.0 : -1.0;
            }
            Arrays.fill(response, 0.0);
            var result = solver.solve(a, probe, response);
            if (!result.converged()) {
                unconverged++;
            }
            for (int i = 0; i < n; i++) {
                sum[i] += probe[i] * response[i];
            }
        }
        if (unconverged > 0) {
            log.warn("{} of {} variance probes stopped at the iteration cap", unconverged, probes);
        }

        var variances = new double[n];
        for (int i = 0; i < n; i++) {
            var precision = system.diagonal(i);
            if (precision <= 0.0) {
                variances[i] = Double.POSITIVE_INFINITY;
                continue;
            }
            variances[i] = Math.max(sum[i] / probes, 1.0 / precision);
        }
        return variances;
    }

    public int getProbes() {
        return probes;
    }

    @Override
    public boolean isExact() {
        return false;
    }

    @Override
    public String name() {
        return "probing(" + probes + ")";
    }
}
