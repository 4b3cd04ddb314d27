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
package com.hellblazer.asterism.accel;

import com.hellblazer.asterism.accel.force.BarnesHutTree;
import com.hellblazer.asterism.accel.grid.SpatialHashGrid;

import java.util.Objects;
import java.util.Optional;

/**
 * The spatial structures built from one position snapshot. Published atomically by the engine and never mutated
 * afterwards, so readers holding an older snapshot finish undisturbed by a rebuild.
 *
 * @param tree    the force approximation tree, absent when spatial acceleration is disabled
 * @param grid    the neighbor grid
 * @param version monotonically increasing build number
 * @author hal.hildebrand
 */
public record SpatialSnapshot<ID extends NodeId>(Optional<BarnesHutTree<ID>> tree, SpatialHashGrid<ID> grid,
                                                 long version) {

    public SpatialSnapshot {
        Objects.requireNonNull(tree, "tree cannot be null");
        Objects.requireNonNull(grid, "grid cannot be null");
    }

    public int size() {
        return grid.size();
    }
}
