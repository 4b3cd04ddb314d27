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
import com.hellblazer.asterism.accel.NodeId;
import com.hellblazer.asterism.geometry.Positions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Tuple3f;
import java.util.HashMap;
import java.util.Map;

/**
 * Annotates a position snapshot with visibility against a view frustum. Each node is treated as a sphere of a fixed
 * radius, so a node straddling a plane still counts as visible.
 *
 * @author hal.hildebrand
 */
public class FrustumVisibilityFilter {

    public static final float DEFAULT_NODE_RADIUS = 10.0f;

    private static final Logger log = LoggerFactory.getLogger(FrustumVisibilityFilter.class);

    private final float nodeRadius;

    public FrustumVisibilityFilter() {
        this(DEFAULT_NODE_RADIUS);
    }

    /**
     * @param nodeRadius bounding radius of a rendered node
     * @throws InvalidConfigurationException if the radius is negative or not finite
     */
    public FrustumVisibilityFilter(float nodeRadius) {
        if (!Float.isFinite(nodeRadius) || nodeRadius < 0) {
            throw new InvalidConfigurationException("nodeRadius must be non-negative and finite: " + nodeRadius);
        }
        this.nodeRadius = nodeRadius;
    }

    /**
     * Test every node of a snapshot against the frustum
     *
     * @throws IllegalArgumentException if any position is not finite
     */
    public <ID extends NodeId> VisibilityResult<ID> filter(ViewFrustum frustum, Map<ID, ? extends Tuple3f> positions) {
        Positions.requireAllFinite(positions);
        var visibility = new HashMap<ID, Boolean>(positions.size() * 2);
        int culled = 0;
        for (var entry : positions.entrySet()) {
            boolean visible = frustum.containsSphere(entry.getValue(), nodeRadius);
            if (!visible) {
                culled++;
            }
            visibility.put(entry.getKey(), visible);
        }
        var stats = new FrustumCullingStats(positions.size(), culled, positions.size() - culled);
        log.debug("Frustum culling: {} of {} nodes culled", culled, positions.size());
        return new VisibilityResult<>(visibility, stats);
    }

    public float nodeRadius() {
        return nodeRadius;
    }
}
