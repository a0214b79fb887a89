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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3d;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BoundingBox Tests")
class BoundingBoxTest {

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        @DisplayName("Create valid bounding box")
        void createValidBoundingBox() {
            var box = new BoundingBox(0.0, 2.0, -1.0, 1.0);

            assertEquals(2.0, box.width());
            assertEquals(2.0, box.height());
        }

        @Test
        @DisplayName("Reject invalid ordering")
        void rejectInvalidOrdering() {
            assertThrows(IllegalArgumentException.class, () -> new BoundingBox(2.0, 1.0, 0.0, 1.0));
            assertThrows(IllegalArgumentException.class, () -> new BoundingBox(0.0, 1.0, 1.0, 0.0));
        }

        @Test
        @DisplayName("Reject non finite limits")
        void rejectNonFinite() {
            assertThrows(IllegalArgumentException.class, () -> new BoundingBox(Double.NaN, 1.0, 0.0, 1.0));
            assertThrows(IllegalArgumentException.class,
                         () -> new BoundingBox(0.0, Double.POSITIVE_INFINITY, 0.0, 1.0));
        }

        @Test
        @DisplayName("Allow degenerate box")
        void allowDegenerate() {
            assertDoesNotThrow(() -> new BoundingBox(1.0, 1.0, 1.0, 1.0));
        }
    }

    @Nested
    @DisplayName("Enclosing points")
    class EnclosingTests {

        @Test
        @DisplayName("Encloses the XY projection of all points")
        void enclosesPoints() {
            var box = BoundingBox.enclosing(
            List.of(new Point3d(1, 5, 100), new Point3d(-3, 2, -7), new Point3d(4, -1, 0)));

            assertEquals(-3.0, box.minX());
            assertEquals(4.0, box.maxX());
            assertEquals(-1.0, box.minY());
            assertEquals(5.0, box.maxY());
        }

        @Test
        @DisplayName("Reject empty point set")
        void rejectEmpty() {
            assertThrows(IllegalArgumentException.class, () -> BoundingBox.enclosing(List.<Point3d>of()));
        }
    }

    @Nested
    @DisplayName("Operations")
    class OperationTests {

        @Test
        @DisplayName("Expand grows every side by the margin")
        void expand() {
            var box = new BoundingBox(0, 1, 0, 2).expand(10);

            assertEquals(-10.0, box.minX());
            assertEquals(11.0, box.maxX());
            assertEquals(-10.0, box.minY());
            assertEquals(12.0, box.maxY());
        }

        @Test
        @DisplayName("Expand rejects negative margin")
        void expandRejectsNegative() {
            assertThrows(IllegalArgumentException.class, () -> new BoundingBox(0, 1, 0, 1).expand(-0.5));
        }

        @Test
        @DisplayName("Contains is inclusive of the edges")
        void containsInclusive() {
            var box = new BoundingBox(0, 1, 0, 1);

            assertTrue(box.contains(0, 0));
            assertTrue(box.contains(1, 1));
            assertTrue(box.contains(0.5, 0.25));
            assertFalse(box.contains(1.0001, 0.5));
            assertFalse(box.contains(0.5, -0.0001));
        }
    }
}
