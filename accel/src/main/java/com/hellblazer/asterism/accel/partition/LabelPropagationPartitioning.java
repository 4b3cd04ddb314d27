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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;

import static com.hellblazer.asterism.accel.partition.BreadthFirstPartitioning.UNASSIGNED;
import static com.hellblazer.asterism.accel.partition.BreadthFirstPartitioning.smallest;

/**
 * Community detection by label propagation, then packing of communities into partitions.
 *
 * <p>Every node starts with its own label. Passes visit nodes in input order and adopt the label most common among
 * their neighbors (ties to the current label, then the lowest label), updating in place so later nodes of the same
 * pass see the change. A label whose community already holds the maximum partition size is not adopted. Passes stop
 * when a pass changes nothing or after {@link #MAX_PASSES}.
 *
 * <p>Communities are packed largest first, each onto the currently smallest partition, spilling into the next
 * smallest once a partition is full. While fewer than {@code k} partitions are non-empty the largest is split in
 * two along a breadth-first ordering of its members.
 *
 * @author hal.hildebrand
 */
public class LabelPropagationPartitioning implements PartitioningStrategy {

    static final int MAX_PASSES = 20;

    /**
     * Run size-bounded label propagation
     *
     * @return the community label of every node
     */
    static int[] propagate(IndexedGraph<?> graph, int maxCommunitySize) {
        int n = graph.nodeCount();
        var labels = new int[n];
        var communitySizes = new int[n];
        for (int i = 0; i < n; i++) {
            labels[i] = i;
            communitySizes[i] = 1;
        }

        var counts = new HashMap<Integer, Integer>();
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            boolean changed = false;
            for (int u = 0; u < n; u++) {
                counts.clear();
                for (int v : graph.neighbors(u)) {
                    counts.merge(labels[v], 1, Integer::sum);
                }
                int current = labels[u];
                int best = current;
                int bestCount = counts.getOrDefault(current, 0);
                for (var entry : counts.entrySet()) {
                    int label = entry.getKey();
                    int count = entry.getValue();
                    if (label == current || communitySizes[label] >= maxCommunitySize) {
                        continue;
                    }
                    if (count > bestCount || (count == bestCount && best != current && label < best)) {
                        best = label;
                        bestCount = count;
                    }
                }
                if (best != current) {
                    communitySizes[current]--;
                    communitySizes[best]++;
                    labels[u] = best;
                    changed = true;
                }
            }
            if (!changed) {
                break;
            }
        }
        return labels;
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

        var labels = propagate(graph, max);
        var byLabel = new LinkedHashMap<Integer, List<Integer>>();
        for (int i = 0; i < n; i++) {
            byLabel.computeIfAbsent(labels[i], l -> new ArrayList<>()).add(i);
        }
        var communities = new ArrayList<>(byLabel.values());
        // Stable sort keeps first-appearance order among equal sizes
        communities.sort(Comparator.comparingInt((List<Integer> c) -> c.size()).reversed());

        var sizes = new int[k];
        for (var community : communities) {
            int target = smallest(sizes);
            for (int node : community) {
                if (sizes[target] >= max) {
                    target = smallest(sizes);
                }
                assignment[node] = target;
                sizes[target]++;
            }
        }

        fillEmpty(graph, assignment, sizes);
        return assignment;
    }

    /**
     * Split the largest partition into each empty one
     */
    private void fillEmpty(IndexedGraph<?> graph, int[] assignment, int[] sizes) {
        for (int empty = 0; empty < sizes.length; empty++) {
            if (sizes[empty] != 0) {
                continue;
            }
            int largest = 0;
            for (int p = 1; p < sizes.length; p++) {
                if (sizes[p] > sizes[largest]) {
                    largest = p;
                }
            }
            if (sizes[largest] < 2) {
                return;
            }
            var order = breadthFirstOrder(graph, assignment, largest);
            int move = sizes[largest] / 2;
            for (int i = order.size() - move; i < order.size(); i++) {
                assignment[order.get(i)] = empty;
            }
            sizes[largest] -= move;
            sizes[empty] = move;
        }
    }

    /**
     * Members of a partition in breadth-first order within the partition, components in input order
     */
    private List<Integer> breadthFirstOrder(IndexedGraph<?> graph, int[] assignment, int partition) {
        var order = new ArrayList<Integer>();
        var visited = new boolean[assignment.length];
        var queue = new ArrayDeque<Integer>();
        for (int start = 0; start < assignment.length; start++) {
            if (assignment[start] != partition || visited[start]) {
                continue;
            }
            visited[start] = true;
            queue.add(start);
            while (!queue.isEmpty()) {
                int u = queue.poll();
                order.add(u);
                for (int v : graph.neighbors(u)) {
                    if (!visited[v] && assignment[v] == partition) {
                        visited[v] = true;
                        queue.add(v);
                    }
                }
            }
        }
        return order;
    }
}
