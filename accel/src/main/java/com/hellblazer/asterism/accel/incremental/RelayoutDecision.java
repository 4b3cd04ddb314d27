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
package com.hellblazer.asterism.accel.incremental;

import com.hellblazer.asterism.accel.NodeId;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * The outcome of consulting a {@link GraphChangeTracker}: rebuild everything, rerun the layout over a region, or do
 * nothing.
 *
 * @param mode   the kind of relayout
 * @param region nodes to lay out for {@link Mode#PARTIAL}, empty otherwise
 * @author hal.hildebrand
 */
public record RelayoutDecision<ID extends NodeId>(Mode mode, Set<ID> region) {

    public enum Mode {
        FULL, PARTIAL, NONE
    }

    public RelayoutDecision {
        Objects.requireNonNull(mode, "mode cannot be null");
        region = Collections.unmodifiableSet(new LinkedHashSet<>(region));
    }

    public static <ID extends NodeId> RelayoutDecision<ID> full() {
        return new RelayoutDecision<>(Mode.FULL, Set.of());
    }

    public static <ID extends NodeId> RelayoutDecision<ID> none() {
        return new RelayoutDecision<>(Mode.NONE, Set.of());
    }

    public static <ID extends NodeId> RelayoutDecision<ID> partial(Set<ID> region) {
        return new RelayoutDecision<>(Mode.PARTIAL, region);
    }

    public boolean isFull() {
        return mode == Mode.FULL;
    }
}
