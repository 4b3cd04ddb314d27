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
package com.hellblazer.asterism.accel.partition;

import com.hellblazer.asterism.accel.NodeId;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One partition of a {@link PartitionResult}.
 *
 * @param index         partition index in {@code [0, k)}
 * @param members       member nodes in input order
 * @param internalEdges edges with both endpoints in this partition, self-loops included
 * @param cutEdges      edges with exactly one endpoint in this partition
 * @param neighbors     indices of partitions sharing a cut edge with this one
 * @author hal.hildebrand
 */
public record GraphPartition<ID extends NodeId>(int index, List<ID> members, int internalEdges, int cutEdges,
                                                SortedSet<Integer> neighbors) {

    public GraphPartition {
        members = List.copyOf(members);
        neighbors = Collections.unmodifiableSortedSet(new TreeSet<>(neighbors));
    }

    /**
     * @return fraction of this partition's edges that stay inside it, 0 when it has none
     */
    public float cohesion() {
        int total = internalEdges + cutEdges;
        return total == 0 ? 0.0f : internalEdges / (float) total;
    }

    public int size() {
        return members.size();
    }
}
