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
 * Sealed exception hierarchy for elevation model estimation.
 * <p>
 * Exception types:
 * <ul>
 * <li>{@link InputException} - the point dataset is missing or malformed. Fatal, raised before any grid work</li>
 * <li>{@link ConfigurationException} - an estimator or tool parameter is out of range. Fatal at startup</li>
 * <li>{@link InvalidObservationException} - a single reading cannot be fused. The reading is skipped</li>
 * <li>{@link OutOfBoundsException} - a coordinate falls outside the grid extent. Fails one query only</li>
 * </ul>
 * A solver that stops at its iteration cap does not throw; see {@link ConvergenceWarning}.
 */
public sealed class GmrfException extends RuntimeException
permits GmrfException.InputException, GmrfException.ConfigurationException,
        GmrfException.InvalidObservationException, GmrfException.OutOfBoundsException {

    public GmrfException(String message) {
        super(message);
    }

    public GmrfException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Missing file, malformed row or too few columns in the input dataset.
     */
    public static final class InputException extends GmrfException {

        public InputException(String message) {
            super(message);
        }

        public InputException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * A parameter outside its valid range: non positive resolution or standard deviation, a checkpoint ratio outside
     * [0, 1] and the like.
     */
    public static final class ConfigurationException extends GmrfException {

        public ConfigurationException(String message) {
            super(message);
        }
    }

    /**
     * A reading that cannot be fused into the grid.
     */
    public static final class InvalidObservationException extends GmrfException {
        private final Observation observation;

        public InvalidObservationException(Observation observation, String reason) {
            super(reason + ": " + observation);
            this.observation = observation;
        }

        /**
         * @return the rejected reading
         */
        public Observation getObservation() {
            return observation;
        }
    }

    /**
     * A coordinate outside the extent covered by the grid.
     */
    public static final class OutOfBoundsException extends GmrfException {
        private final double x;
        private final double y;

        public OutOfBoundsException(double x, double y, String extent) {
            super(String.format("Point (%s, %s) is outside the grid extent %s", x, y, extent));
            this.x = x;
            this.y = y;
        }

        public double getX() {
            return x;
        }

        public double getY() {
            return y;
        }
    }
}
