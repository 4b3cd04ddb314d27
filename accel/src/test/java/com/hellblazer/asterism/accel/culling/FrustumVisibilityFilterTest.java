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
package com.hellblazer.asterism.accel.culling;

import com.hellblazer.asterism.accel.InvalidConfigurationException;
import com.hellblazer.asterism.accel.LongNodeId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class FrustumVisibilityFilterTest {

    private static final ViewFrustum FRUSTUM = ViewFrustum.from(
    new CameraState(new Point3f(), new Vector3f(0, 0, -1), new Vector3f(0, 1, 0), (float) (Math.PI / 2), 1.0f, 1.0f,
                    1000.0f));

    private static LongNodeId id(long value) {
        return LongNodeId.of(value);
    }

    @Test
    @DisplayName("Snapshot is split into visible and culled nodes with matching counts")
    void testFilter() {
        var positions = new LinkedHashMap<LongNodeId, Point3f>();
        positions.put(id(1), new Point3f(0, 0, -100));
        positions.put(id(2), new Point3f(50, 50, -200));
        positions.put(id(3), new Point3f(0, 0, 100));
        positions.put(id(4), new Point3f(500, 0, -100));

        var result = new FrustumVisibilityFilter().filter(FRUSTUM, positions);
        assertEquals(Set.of(id(1), id(2)), result.visibleNodes());
        assertEquals(Set.of(id(3), id(4)), result.culledNodes());
        assertTrue(result.isVisible(id(1)));
        assertFalse(result.isVisible(id(3)));
        assertFalse(result.isVisible(id(99)), "untested nodes are not visible");

        var stats = result.stats();
        assertEquals(new FrustumCullingStats(4, 2, 2), stats);
        assertEquals(0.5f, stats.cullRatio(), 1e-6f);
    }

    @Test
    @DisplayName("Node radius keeps nodes straddling the boundary visible")
    void testNodeRadius() {
        // 5 units right of the right plane, measured along its normal: about 3.5
        var positions = Map.of(id(1), new Point3f(105, 0, -100));
        assertTrue(new FrustumVisibilityFilter().filter(FRUSTUM, positions).isVisible(id(1)));
        assertFalse(new FrustumVisibilityFilter(1.0f).filter(FRUSTUM, positions).isVisible(id(1)));
        assertEquals(FrustumVisibilityFilter.DEFAULT_NODE_RADIUS, new FrustumVisibilityFilter().nodeRadius());
    }

    @Test
    @DisplayName("Empty snapshot and invalid input")
    void testEdgeCases() {
        var empty = new FrustumVisibilityFilter().filter(FRUSTUM, Map.<LongNodeId, Point3f>of());
        assertEquals(new FrustumCullingStats(0, 0, 0), empty.stats());
        assertEquals(0.0f, empty.stats().cullRatio());

        assertThrows(InvalidConfigurationException.class, () -> new FrustumVisibilityFilter(-1.0f));
        assertThrows(IllegalArgumentException.class, () -> new FrustumVisibilityFilter().filter(FRUSTUM,
                                                                                               Map.of(id(1),
                                                                                                      new Point3f(
                                                                                                      Float.NaN, 0,
                                                                                                      0))));
    }
}
