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
import java.util.Map;

/**
 * An immutable partitioning: every input node assigned to exactly one partition in {@code [0, k)}.
 *
 * @param assignment node to partition index, in input order
 * @param partitions the partitions, by index
 * @param metrics    quality measures
 * @author hal.hildebrand
 */
public record PartitionResult<ID extends NodeId>(Map<ID, Integer> assignment, List<GraphPartition<ID>> partitions,
                                                 PartitionMetrics metrics) {

    public PartitionResult {
        assignment = Collections.unmodifiableMap(assignment);
        partitions = List.copyOf(partitions);
    }

    public static <ID extends NodeId> PartitionResult<ID> empty() {
        return new PartitionResult<>(Map.of(), List.of(), PartitionMetrics.EMPTY);
    }

    public GraphPartition<ID> partition(int index) {
        return partitions.get(index);
    }

    public int partitionCount() {
        return partitions.size();
    }

    /**
     * @return the partition index of a node, or -1 if it was not part of the input
     */
    public int partitionOf(ID id) {
        var p = assignment.get(id);
        return p == null ? -1 : p;
    }
}
