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
import java.util.LinkedHashMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class PositionsTest {

    @Test
    void testFiniteChecks() {
        assertTrue(Positions.isFinite(new Point3f(1, -2, 3)));
        assertFalse(Positions.isFinite(new Point3f(Float.NaN, 0, 0)));
        assertFalse(Positions.isFinite(new Point3f(0, Float.POSITIVE_INFINITY, 0)));

        var p = new Point3f(1, 2, 3);
        assertSame(p, Positions.requireFinite(p, "p"));
        assertThrows(IllegalArgumentException.class,
                     () -> Positions.requireFinite(new Point3f(0, 0, Float.NEGATIVE_INFINITY), "p"));
        assertThrows(NullPointerException.class, () -> Positions.requireFinite((Point3f) null, "p"));
        assertThrows(IllegalArgumentException.class, () -> Positions.requireFinite(Float.NaN, "radius"));
    }

    @Test
    void testRequireAllFiniteNamesOffendingKey() {
        var positions = new LinkedHashMap<String, Point3f>();
        positions.put("a", new Point3f(0, 0, 0));
        positions.put("b", new Point3f(Float.NaN, 0, 0));
        var e = assertThrows(IllegalArgumentException.class, () -> Positions.requireAllFinite(positions));
        assertTrue(e.getMessage().contains("b"));

        positions.remove("b");
        assertSame(positions, Positions.requireAllFinite(positions));
    }
}
