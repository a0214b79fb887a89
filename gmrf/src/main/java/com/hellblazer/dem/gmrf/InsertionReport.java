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

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a batch insertion.
 *
 * @param inserted   readings fused into the grid
 * @param rejected   readings skipped as invalid
 * @param rejections the first rejections, at most {@link #MAX_REPORTED_REJECTIONS}
 */
public record InsertionReport(int inserted, int rejected, List<InvalidObservationException> rejections) {
    public static final int MAX_REPORTED_REJECTIONS = 20;

    public InsertionReport {
        rejections = List.copyOf(rejections);
    }

    public InsertionReport merge(InsertionReport other) {
        var combined = new ArrayList<>(rejections);
        for (var rejection : other.rejections) {
            if (combined.size() >= MAX_REPORTED_REJECTIONS) {
                break;
            }
            combined.add(rejection);
        }
        return new InsertionReport(inserted + other.inserted, rejected + other.rejected, combined);
    }
}
