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
 * Quality measures of a partitioning.
 *
 * @param partitionCount number of partitions
 * @param averageSize    mean partition size
 * @param sizeStdDev     population standard deviation of partition sizes
 * @param totalEdgeCut   edges whose endpoints lie in different partitions
 * @param modularity     {@code Σ_c (L_c/m - (d_c/2m)²)}, 0 for a graph without edges
 * @param balanceFactor  largest size divided by mean size, 1 is perfect balance
 * @author hal.hildebrand
 */
public record PartitionMetrics(int partitionCount, double averageSize, double sizeStdDev, int totalEdgeCut,
                               double modularity, double balanceFactor) {

    public static final PartitionMetrics EMPTY = new PartitionMetrics(0, 0.0, 0.0, 0, 0.0, 1.0);

    /**
     * Measure an assignment
     *
     * @param graph          the partitioned graph
     * @param assignment     partition index per node index
     * @param partitionCount number of partitions
     */
    public static PartitionMetrics measure(IndexedGraph<?> graph, int[] assignment, int partitionCount) {
        if (graph.nodeCount() == 0 || partitionCount == 0) {
            return EMPTY;
        }
        var sizes = new int[partitionCount];
        var degreeSums = new long[partitionCount];
        for (int i = 0; i < assignment.length; i++) {
            sizes[assignment[i]]++;
            degreeSums[assignment[i]] += graph.degree(i);
        }

        var internal = new long[partitionCount];
        int cut = 0;
        for (int e = 0; e < graph.edgeCount(); e++) {
            var edge = graph.edge(e);
            int a = assignment[edge[0]];
            if (a == assignment[edge[1]]) {
                internal[a]++;
            } else {
                cut++;
            }
        }

        double mean = graph.nodeCount() / (double) partitionCount;
        double variance = 0.0;
        int largest = 0;
        for (int size : sizes) {
            variance += (size - mean) * (size - mean);
            largest = Math.max(largest, size);
        }
        variance /= partitionCount;

        double modularity = 0.0;
        double m = graph.edgeCount();
        if (m > 0) {
            for (int p = 0; p < partitionCount; p++) {
                double expected = degreeSums[p] / (2.0 * m);
                modularity += internal[p] / m - expected * expected;
            }
        }

        return new PartitionMetrics(partitionCount, mean, Math.sqrt(variance), cut, modularity, largest / mean);
    }
}
