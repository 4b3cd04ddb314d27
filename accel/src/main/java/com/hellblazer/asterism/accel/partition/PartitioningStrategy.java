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

/**
 * Assigns every node of an indexed graph to one of {@code partitionCount} partitions.
 *
 * <p>Implementations must be deterministic: identical graphs and configuration yield identical assignments.
 *
 * @author hal.hildebrand
 */
public interface PartitioningStrategy {

    /**
     * @param graph          the graph to split
     * @param partitionCount the number of partitions, {@code 1 <= partitionCount <= nodeCount} for a non-empty graph
     * @param config         size bounds
     * @return the partition index of each node, indexed by node index
     */
    int[] assign(IndexedGraph<?> graph, int partitionCount, PartitioningConfig config);
}
