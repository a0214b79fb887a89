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
package com.hellblazer.dem.geometry;

import javax.vecmath.Tuple3d;

/**
 * Axis-aligned rectangle in the XY plane. Heights are not part of the box; the elevation grid is laid over this
 * rectangle.
 *
 * @author hal.hildebrand
 */
public record BoundingBox(double minX, double maxX, double minY, double maxY) {

    /**
     * Creates a bounding box with validation.
     *
     * @throws IllegalArgumentException if any bound is not finite or min > max on an axis
     */
    public BoundingBox {
        if (!Double.isFinite(minX) || !Double.isFinite(maxX) || !Double.isFinite(minY) || !Double.isFinite(maxY)) {
            throw new IllegalArgumentException("Bounding box limits must be finite");
        }
        if (minX > maxX || minY > maxY) {
            throw new IllegalArgumentException(
            "Min cannot be greater than max: x=[%s, %s] y=[%s, %s]".formatted(minX, maxX, minY, maxY));
        }
    }

    /**
     * Creates the smallest bounding box that encloses the XY projection of all points.
     *
     * @param points the points to bound
     * @return bounding box containing all points
     * @throws IllegalArgumentException if there are no points
     */
    public static BoundingBox enclosing(Iterable<? extends Tuple3d> points) {
        var iterator = points.iterator();
        if (!iterator.hasNext()) {
            throw new IllegalArgumentException("Cannot create bounding box from empty points");
        }
        var first = iterator.next();
        double minX = first.x, maxX = first.x;
        double minY = first.y, maxY = first.y;
        while (iterator.hasNext()) {
            var p = iterator.next();
            minX = Math.min(minX, p.x);
            maxX = Math.max(maxX, p.x);
            minY = Math.min(minY, p.y);
            maxY = Math.max(maxY, p.y);
        }
        return new BoundingBox(minX, maxX, minY, maxY);
    }

    public boolean contains(double x, double y) {
        return x >= minX && x <= maxX && y >= minY && y <= maxY;
    }

    /**
     * Grow the box by the margin on every side.
     *
     * @param margin non negative distance added on each side
     * @return the expanded box
     */
    public BoundingBox expand(double margin) {
        if (margin < 0 || !Double.isFinite(margin)) {
            throw new IllegalArgumentException("Margin must be a finite, non negative value: " + margin);
        }
        return new BoundingBox(minX - margin, maxX + margin, minY - margin, maxY + margin);
    }

    public double height() {
        return maxY - minY;
    }

    public double width() {
        return maxX - minX;
    }

    @Override
    public String toString() {
        return String.format("BoundingBox[x=%.2f <-> %.2f (D=%.2f), y=%.2f <-> %.2f (D=%.2f)]", minX, maxX, width(),
                             minY, maxY, height());
    }
}
