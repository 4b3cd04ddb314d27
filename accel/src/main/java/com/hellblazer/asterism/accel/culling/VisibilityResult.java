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

import com.hellblazer.asterism.accel.NodeId;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Per node visibility flags from one culling pass.
 *
 * @author hal.hildebrand
 */
public record VisibilityResult<ID extends NodeId>(Map<ID, Boolean> visibility, FrustumCullingStats stats) {

    public VisibilityResult {
        visibility = Map.copyOf(visibility);
    }

    public static <ID extends NodeId> VisibilityResult<ID> allVisible(Iterable<ID> nodes) {
        var visibility = new LinkedHashMap<ID, Boolean>();
        for (var id : nodes) {
            visibility.put(id, Boolean.TRUE);
        }
        return new VisibilityResult<>(visibility, new FrustumCullingStats(visibility.size(), 0, visibility.size()));
    }

    /**
     * @return true if the node was tested and found visible
     */
    public boolean isVisible(ID id) {
        return Boolean.TRUE.equals(visibility.get(id));
    }

    public Set<ID> visibleNodes() {
        return visibility.entrySet()
                         .stream()
                         .filter(Map.Entry::getValue)
                         .map(Map.Entry::getKey)
                         .collect(Collectors.toSet());
    }

    public Set<ID> culledNodes() {
        return visibility.entrySet()
                         .stream()
                         .filter(e -> !e.getValue())
                         .map(Map.Entry::getKey)
                         .collect(Collectors.toSet());
    }
}
