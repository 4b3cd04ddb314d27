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
 * Greedy boundary refinement. Each pass visits nodes in input order and moves a node to the neighboring partition
 * holding the most of its neighbors when that strictly reduces the edge cut and both partitions stay within
 * {@code [max(minSize, 1), maxSize]}. Stops after a pass without moves or after {@link #MAX_PASSES}.
 *
 * @author hal.hildebrand
 */
public class EdgeCutRefinement {

    static final int MAX_PASSES = 10;

    /**
     * Refine in place
     *
     * @return the number of nodes moved
     */
    public int refine(IndexedGraph<?> graph, int[] assignment, int partitionCount, PartitioningConfig config) {
        int n = graph.nodeCount();
        if (n == 0 || partitionCount < 2) {
            return 0;
        }
        int floor = Math.max(config.minPartitionSize(), 1);
        int max = config.maxPartitionSize();

        var sizes = new int[partitionCount];
        for (int p : assignment) {
            sizes[p]++;
        }

        var links = new int[partitionCount];
        int moved = 0;
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            int movedThisPass = 0;
            for (int u = 0; u < n; u++) {
                int own = assignment[u];
                if (sizes[own] <= floor) {
                    continue;
                }
                var neighbors = graph.neighbors(u);
                for (int v : neighbors) {
                    links[assignment[v]]++;
                }
                int best = own;
                int bestGain = 0;
                for (int v : neighbors) {
                    int p = assignment[v];
                    int gain = links[p] - links[own];
                    if (p != own && sizes[p] < max && (gain > bestGain || (gain == bestGain && gain > 0 && p < best))) {
                        best = p;
                        bestGain = gain;
                    }
                }
                for (int v : neighbors) {
                    links[assignment[v]] = 0;
                }
                if (best != own) {
                    assignment[u] = best;
                    sizes[own]--;
                    sizes[best]++;
                    movedThisPass++;
                }
            }
            moved += movedThisPass;
            if (movedThisPass == 0) {
                break;
            }
        }
        return moved;
    }
}
