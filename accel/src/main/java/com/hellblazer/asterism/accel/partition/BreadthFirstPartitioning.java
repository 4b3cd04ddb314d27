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

import java.util.ArrayDeque;
import java.util.Arrays;

/**
 * Seeded breadth-first growth.
 *
 * <p>The first seed is the first node in input order; each further seed is the node farthest, in hops, from every
 * seed chosen so far (unreachable nodes are farthest, ties go to input order). Partitions then grow round-robin, one
 * node per turn, each along its own breadth-first frontier over unassigned neighbors and never beyond the maximum
 * size. Nodes still unassigned when growth stalls are given, in input order, to the currently smallest partition.
 *
 * @author hal.hildebrand
 */
public class BreadthFirstPartitioning implements PartitioningStrategy {

    static final int UNASSIGNED = -1;

    private static final int UNREACHABLE = Integer.MAX_VALUE;

    /**
     * Pick {@code k} seeds by farthest-point sampling on hop distance
     */
    static int[] chooseSeeds(IndexedGraph<?> graph, int k) {
        int n = graph.nodeCount();
        var seeds = new int[k];
        var isSeed = new boolean[n];
        var hops = new int[n];
        Arrays.fill(hops, UNREACHABLE);

        int next = 0;
        for (int s = 0; s < k; s++) {
            seeds[s] = next;
            isSeed[next] = true;
            relax(graph, next, hops);

            next = -1;
            int farthest = -1;
            for (int i = 0; i < n; i++) {
                if (!isSeed[i] && hops[i] > farthest) {
                    farthest = hops[i];
                    next = i;
                }
            }
        }
        return seeds;
    }

    /**
     * Lower {@code hops} to the breadth-first distance from {@code source} wherever that is nearer
     */
    private static void relax(IndexedGraph<?> graph, int source, int[] hops) {
        var queue = new ArrayDeque<Integer>();
        hops[source] = 0;
        queue.add(source);
        while (!queue.isEmpty()) {
            int u = queue.poll();
            for (int v : graph.neighbors(u)) {
                if (hops[u] + 1 < hops[v]) {
                    hops[v] = hops[u] + 1;
                    queue.add(v);
                }
            }
        }
    }

    /**
     * @return index of the smallest partition, lowest index on ties
     */
    static int smallest(int[] sizes) {
        int best = 0;
        for (int p = 1; p < sizes.length; p++) {
            if (sizes[p] < sizes[best]) {
                best = p;
            }
        }
        return best;
    }

    @Override
    public int[] assign(IndexedGraph<?> graph, int partitionCount, PartitioningConfig config) {
        int n = graph.nodeCount();
        var assignment = new int[n];
        Arrays.fill(assignment, UNASSIGNED);
        if (n == 0) {
            return assignment;
        }
        int k = Math.min(partitionCount, n);
        int max = config.maxPartitionSize();

        var sizes = new int[k];
        var cursors = new int[n];
        @SuppressWarnings("unchecked")
        ArrayDeque<Integer>[] frontiers = new ArrayDeque[k];
        var seeds = chooseSeeds(graph, k);
        for (int p = 0; p < k; p++) {
            assignment[seeds[p]] = p;
            sizes[p] = 1;
            frontiers[p] = new ArrayDeque<>();
            frontiers[p].add(seeds[p]);
        }

        boolean progress = true;
        while (progress) {
            progress = false;
            for (int p = 0; p < k; p++) {
                if (sizes[p] < max && growOne(graph, p, frontiers[p], cursors, assignment)) {
                    sizes[p]++;
                    progress = true;
                }
            }
        }

        for (int i = 0; i < n; i++) {
            if (assignment[i] == UNASSIGNED) {
                int p = smallest(sizes);
                assignment[i] = p;
                sizes[p]++;
            }
        }
        return assignment;
    }

    /**
     * Claim the next unassigned neighbor along the partition's frontier
     *
     * @return true if a node was claimed
     */
    private boolean growOne(IndexedGraph<?> graph, int partition, ArrayDeque<Integer> frontier, int[] cursors,
                            int[] assignment) {
        while (!frontier.isEmpty()) {
            int u = frontier.peek();
            var neighbors = graph.neighbors(u);
            while (cursors[u] < neighbors.length) {
                int v = neighbors[cursors[u]++];
                if (assignment[v] == UNASSIGNED) {
                    assignment[v] = partition;
                    frontier.add(v);
                    return true;
                }
            }
            frontier.poll();
        }
        return false;
    }
}
