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

/**
 * A single elevation cell. Holds the current estimate (mean and variance) written by the solver and the information
 * accumulated from the observations that landed in the cell.
 * <p>
 * Time invariant and time variant readings are accumulated separately; only the latter decay between updates.
 *
 * @author hal.hildebrand
 */
public class GridCell {
    private double mean;
    private double variance;
    private double informationSum;
    private double informationWeightedMean;
    private double transientInformation;
    private double transientWeightedMean;

    public GridCell() {
        this(0.0, 0.0);
    }

    public GridCell(double mean, double variance) {
        if (variance < 0 || Double.isNaN(variance)) {
            throw new IllegalArgumentException("Variance must be non negative: " + variance);
        }
        this.mean = mean;
        this.variance = variance;
    }

    public GridCell(GridCell other) {
        this.mean = other.mean;
        this.variance = other.variance;
        this.informationSum = other.informationSum;
        this.informationWeightedMean = other.informationWeightedMean;
        this.transientInformation = other.transientInformation;
        this.transientWeightedMean = other.transientWeightedMean;
    }

    /**
     * Fuse a reading already converted to information form.
     *
     * @param information   precision of the reading
     * @param z             the measured height
     * @param timeInvariant whether the reading is permanent
     */
    public void accumulate(double information, double z, boolean timeInvariant) {
        addInformation(information, information * z, timeInvariant);
    }

    /**
     * Add already weighted sums, as produced by a partial accumulation elsewhere.
     *
     * @param information   precision to add
     * @param weightedMean  precision weighted height sum to add
     * @param timeInvariant whether the sums come from permanent readings
     */
    public void addInformation(double information, double weightedMean, boolean timeInvariant) {
        if (timeInvariant) {
            informationSum += information;
            informationWeightedMean += weightedMean;
        } else {
            transientInformation += information;
            transientWeightedMean += weightedMean;
        }
    }

    /**
     * Scale the time variant information by the retained fraction. The fused transient mean is unchanged.
     */
    public void decayTransient(double retained) {
        transientInformation *= retained;
        transientWeightedMean *= retained;
    }

    /**
     * @return the precision weighted mean of every reading fused into this cell, NaN when the cell has none
     */
    public double fusedMean() {
        var information = totalInformation();
        return information > 0.0 ? totalWeightedMean() / information : Double.NaN;
    }

    public double getInformationSum() {
        return informationSum;
    }

    public double getInformationWeightedMean() {
        return informationWeightedMean;
    }

    public double getMean() {
        return mean;
    }

    public double getStdDev() {
        return Math.sqrt(variance);
    }

    public double getTransientInformation() {
        return transientInformation;
    }

    public double getTransientWeightedMean() {
        return transientWeightedMean;
    }

    public double getVariance() {
        return variance;
    }

    public boolean hasObservations() {
        return totalInformation() > 0.0;
    }

    public void resetInformation() {
        informationSum = 0;
        informationWeightedMean = 0;
        transientInformation = 0;
        transientWeightedMean = 0;
    }

    public void setMean(double mean) {
        this.mean = mean;
    }

    public void setVariance(double variance) {
        this.variance = variance;
    }

    @Override
    public String toString() {
        return String.format("GridCell[mean=%.4f, var=%.4f, info=%.4f]", mean, variance, totalInformation());
    }

    public double totalInformation() {
        return informationSum + transientInformation;
    }

    public double totalWeightedMean() {
        return informationWeightedMean + transientWeightedMean;
    }
}
