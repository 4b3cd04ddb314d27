/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Asterism.
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
package com.hellblazer.asterism.geometry;

import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import java.util.HashSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Point3i as a grid cell key.
 *
 * @author hal.hildebrand
 */
public class Point3iTest {

    @Test
    public void testConstruction() {
        var point = new Point3i(1, 2, 3);
        assertEquals(1, point.x);
        assertEquals(2, point.y);
        assertEquals(3, point.z);
    }

    @Test
    public void testCellOfFloorsTowardNegativeInfinity() {
        assertEquals(new Point3i(0, 0, 0), Point3i.cellOf(new Point3f(0, 10, 49.9f), 50));
        assertEquals(new Point3i(2, 2, 0), Point3i.cellOf(new Point3f(100, 100, 0), 50));
        // -0.5 / 50 floors to -1, not 0
        assertEquals(new Point3i(-1, -1, 0), Point3i.cellOf(new Point3f(-0.5f, -50f, 0), 50));
        assertEquals(-2, Point3i.cellCoordinate(-50.01f, 50));
    }

    @Test
    public void testCellOfSaturatesHugeCoordinates() {
        var cell = Point3i.cellOf(new Point3f(Float.MAX_VALUE, -Float.MAX_VALUE, 0), 1e-3f);
        assertEquals(Integer.MAX_VALUE, cell.x);
        assertEquals(Integer.MIN_VALUE, cell.y);
    }

    @Test
    public void testChebyshevDistance() {
        var p1 = new Point3i(0, 0, 0);
        assertEquals(3, p1.chebyshevDistance(new Point3i(1, -3, 2)));
        assertEquals(0, p1.chebyshevDistance(p1));
        assertEquals((long) Integer.MAX_VALUE - Integer.MIN_VALUE,
                     new Point3i(Integer.MIN_VALUE, 0, 0).chebyshevDistance(new Point3i(Integer.MAX_VALUE, 0, 0)));
    }

    @Test
    public void testEqualsAndHashCode() {
        var p1 = new Point3i(1, 2, 3);
        var p2 = new Point3i(1, 2, 3);
        var p3 = new Point3i(1, 2, 4);

        assertEquals(p1, p2);
        assertNotEquals(p1, p3);
        assertEquals(p1.hashCode(), p2.hashCode());

        var set = new HashSet<Point3i>();
        set.add(p1);
        set.add(p2);
        set.add(p3);
        assertEquals(2, set.size());
    }

    @Test
    public void testToString() {
        assertEquals("Point3i(1, -2, 3)", new Point3i(1, -2, 3).toString());
    }
}
