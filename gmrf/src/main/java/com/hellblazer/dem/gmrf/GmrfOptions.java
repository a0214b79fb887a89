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

import com.hellblazer.dem.gmrf.GmrfException.ConfigurationException;
import com.hellblazer.dem.gmrf.variance.DiagonalVarianceEstimator;
import com.hellblazer.dem.gmrf.variance.VarianceEstimator;

/**
 * Parameters of the GMRF estimator.
 *
 * @author hal.hildebrand
 */
public class GmrfOptions {

    public static final double DEFAULT_TOLERANCE      = 1e-9;
    public static final int    DEFAULT_MAX_ITERATIONS = 10_000;

    private final double            lambdaPrior;
    private final double            lambdaObs;
    private final boolean           skipVariance;
    private final double            tolerance;
    private final int               maxIterations;
    private final double            transientInformationLoss;
    private final VarianceEstimator varianceEstimator;

    private GmrfOptions(Builder builder) {
        this.lambdaPrior = builder.lambdaPrior;
        this.lambdaObs = builder.lambdaObs;
        this.skipVariance = builder.skipVariance;
        this.tolerance = builder.tolerance;
        this.maxIterations = builder.maxIterations;
        this.transientInformationLoss = builder.transientInformationLoss;
        this.varianceEstimator = builder.varianceEstimator;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Unit prior and observation precision, variance by the diagonal approximation
     */
    public static GmrfOptions defaultOptions() {
        return builder().build();
    }

    private static double precisionOf(String name, double stddev) {
        if (!(stddev > 0) || !Double.isFinite(stddev)) {
            throw new ConfigurationException(name + " standard deviation must be positive: " + stddev);
        }
        return 1.0 / (stddev * stddev);
    }

    /**
     * Precision of every prior edge between 4-connected neighbours, {@code 1 / stdPrior^2}
     */
    public double getLambdaPrior() {
        return lambdaPrior;
    }

    /**
     * Global scale applied to the precision {@code 1 / stddev^2} of every observation
     */
    public double getLambdaObs() {
        return lambdaObs;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    /**
     * Relative residual at which the mean solve stops
     */
    public double getTolerance() {
        return tolerance;
    }

    /**
     * Fraction of the time variant information lost after every update
     */
    public double getTransientInformationLoss() {
        return transientInformationLoss;
    }

    public VarianceEstimator getVarianceEstimator() {
        return varianceEstimator;
    }

    public boolean isSkipVariance() {
        return skipVariance;
    }

    @Override
    public String toString() {
        return String.format(
        "GmrfOptions[lambdaPrior=%s, lambdaObs=%s, skipVariance=%s, tolerance=%s, maxIterations=%d, variance=%s]",
        lambdaPrior, lambdaObs, skipVariance, tolerance, maxIterations, varianceEstimator.name());
    }

    public static class Builder {
        private double            lambdaPrior              = 1.0;
        private double            lambdaObs                = 1.0;
        private boolean           skipVariance             = false;
        private double            tolerance                = DEFAULT_TOLERANCE;
        private int               maxIterations            = DEFAULT_MAX_ITERATIONS;
        private double            transientInformationLoss = 0.0;
        private VarianceEstimator varianceEstimator        = new DiagonalVarianceEstimator();

        private Builder() {
        }

        public GmrfOptions build() {
            return new GmrfOptions(this);
        }

        public Builder withLambdaObs(double lambdaObs) {
            if (!(lambdaObs > 0) || !Double.isFinite(lambdaObs)) {
                throw new ConfigurationException("Observation precision must be positive: " + lambdaObs);
            }
            this.lambdaObs = lambdaObs;
            return this;
        }

        public Builder withLambdaPrior(double lambdaPrior) {
            if (!(lambdaPrior >= 0) || !Double.isFinite(lambdaPrior)) {
                throw new ConfigurationException("Prior precision must be non negative: " + lambdaPrior);
            }
            this.lambdaPrior = lambdaPrior;
            return this;
        }

        public Builder withMaxIterations(int maxIterations) {
            if (maxIterations < 1) {
                throw new ConfigurationException("Max iterations must be positive: " + maxIterations);
            }
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder withSkipVariance(boolean skipVariance) {
            this.skipVariance = skipVariance;
            return this;
        }

        /**
         * Sets the observation precision scale from a standard deviation, {@code 1 / stdObs^2}
         */
        public Builder withStdObs(double stdObs) {
            this.lambdaObs = precisionOf("Observation", stdObs);
            return this;
        }

        /**
         * Sets the prior precision from the terrain smoothness tolerance, {@code 1 / stdPrior^2}
         */
        public Builder withStdPrior(double stdPrior) {
            this.lambdaPrior = precisionOf("Prior", stdPrior);
            return this;
        }

        public Builder withTolerance(double tolerance) {
            if (!(tolerance > 0) || !(tolerance < 1)) {
                throw new ConfigurationException("Tolerance must be in (0, 1): " + tolerance);
            }
            this.tolerance = tolerance;
            return this;
        }

        public Builder withTransientInformationLoss(double loss) {
            if (!(loss >= 0 && loss <= 1)) {
                throw new ConfigurationException("Transient information loss must be in [0, 1]: " + loss);
            }
            this.transientInformationLoss = loss;
            return this;
        }

        public Builder withVarianceEstimator(VarianceEstimator varianceEstimator) {
            if (varianceEstimator == null) {
                throw new ConfigurationException("Variance estimator cannot be null");
            }
            this.varianceEstimator = varianceEstimator;
            return this;
        }
    }
}
