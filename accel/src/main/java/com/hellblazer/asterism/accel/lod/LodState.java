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
package com.hellblazer.asterism.accel.lod;

import com.hellblazer.asterism.accel.NodeId;
import com.hellblazer.asterism.geometry.Positions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Tuple3f;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The per node detail level carried from frame to frame. Owned by the host; not thread-safe.
 *
 * @param <ID> the node ID type
 * @author hal.hildebrand
 */
public class LodState<ID extends NodeId> {

    private static final Logger log = LoggerFactory.getLogger(LodState.class);

    private final Map<ID, LodLevel> levels = new HashMap<>();

    /**
     * @return the node's level, {@link LodLevel#HIGH} for nodes not yet seen
     */
    public LodLevel levelOf(ID id) {
        return levels.getOrDefault(id, LodLevel.HIGH);
    }

    public Map<ID, LodLevel> levels() {
        return Collections.unmodifiableMap(levels);
    }

    public boolean remove(ID id) {
        return levels.remove(id) != null;
    }

    public int size() {
        return levels.size();
    }

    public LodStats stats() {
        return LodStats.of(levels.values());
    }

    /**
     * Advance every node of the snapshot by one frame. Nodes not in the snapshot are forgotten; nodes seen for the
     * first time start at {@link LodLevel#HIGH}.
     *
     * @param selector  the selector for this frame's camera
     * @param positions the current node positions
     * @return the distribution after the update
     * @throws IllegalArgumentException if any position is not finite
     */
    public LodStats updateAll(LevelOfDetailSelector selector, Map<ID, ? extends Tuple3f> positions) {
        Objects.requireNonNull(selector, "selector cannot be null");
        Positions.requireAllFinite(positions);

        int departed = levels.size();
        levels.keySet().retainAll(positions.keySet());
        departed -= levels.size();

        int changed = 0;
        for (var entry : positions.entrySet()) {
            var current = levelOf(entry.getKey());
            var next = selector.update(entry.getValue(), current);
            if (next != current) {
                changed++;
            }
            levels.put(entry.getKey(), next);
        }
        log.debug("LOD update: {} nodes, {} changed, {} departed", positions.size(), changed, departed);
        return stats();
    }
}
