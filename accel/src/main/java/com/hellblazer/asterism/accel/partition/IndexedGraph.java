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

import com.hellblazer.asterism.accel.Edge;
import com.hellblazer.asterism.accel.NodeId;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A graph renumbered to dense indices in input order, the form the partitioning strategies work on. Duplicate nodes
 * keep their first position; edges naming an unknown node are dropped; parallel edges are kept.
 *
 * @param <ID> the node ID type
 * @author hal.hildebrand
 */
public final class IndexedGraph<ID extends NodeId> {

    private final List<ID>         nodes;
    private final Map<ID, Integer> index;
    private final int[][]          adjacency;
    private final int[]            degrees;
    private final int[][]          edges;

    private IndexedGraph(List<ID> nodes, Map<ID, Integer> index, int[][] adjacency, int[] degrees, int[][] edges) {
        this.nodes = nodes;
        this.index = index;
        this.adjacency = adjacency;
        this.degrees = degrees;
        this.edges = edges;
    }

    public static <ID extends NodeId> IndexedGraph<ID> of(Collection<ID> nodes, Collection<Edge<ID>> edges) {
        Objects.requireNonNull(nodes, "nodes cannot be null");
        Objects.requireNonNull(edges, "edges cannot be null");

        var ordered = new ArrayList<ID>(nodes.size());
        var index = new HashMap<ID, Integer>(nodes.size() * 2);
        for (var id : nodes) {
            if (index.putIfAbsent(Objects.requireNonNull(id, "node cannot be null"), ordered.size()) == null) {
                ordered.add(id);
            }
        }

        int n = ordered.size();
        var neighborLists = new ArrayList<List<Integer>>(n);
        for (int i = 0; i < n; i++) {
            neighborLists.add(new ArrayList<>());
        }
        var degrees = new int[n];
        var known = new ArrayList<int[]>(edges.size());
        for (var edge : edges) {
            var s = index.get(edge.source());
            var t = index.get(edge.target());
            if (s == null || t == null) {
                continue;
            }
            known.add(new int[] { s, t });
            degrees[s]++;
            degrees[t]++;
            if (!s.equals(t)) {
                neighborLists.get(s).add(t);
                neighborLists.get(t).add(s);
            }
        }

        var adjacency = new int[n][];
        for (int i = 0; i < n; i++) {
            adjacency[i] = neighborLists.get(i).stream().mapToInt(Integer::intValue).toArray();
        }
        return new IndexedGraph<>(Collections.unmodifiableList(ordered), index, adjacency, degrees,
                                  known.toArray(new int[0][]));
    }

    /**
     * @return the degree of a node, a self-loop counting twice
     */
    public int degree(int node) {
        return degrees[node];
    }

    /**
     * @return the endpoint indices of edge {@code i}
     */
    public int[] edge(int i) {
        return edges[i];
    }

    /**
     * @return the number of edges whose endpoints are both known, self-loops included
     */
    public int edgeCount() {
        return edges.length;
    }

    public ID idOf(int node) {
        return nodes.get(node);
    }

    /**
     * @return the index of a node, or -1 if the graph does not contain it
     */
    public int indexOf(ID id) {
        var i = index.get(id);
        return i == null ? -1 : i;
    }

    /**
     * @return neighbor indices of a node in edge order, excluding self-loops; parallel edges repeat the neighbor
     */
    public int[] neighbors(int node) {
        return adjacency[node];
    }

    public int nodeCount() {
        return nodes.size();
    }

    public List<ID> nodes() {
        return nodes;
    }
}
