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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Splits a graph into a bounded number of size-balanced partitions for parallel layout or sharded storage.
 *
 * <p>The partitioner:
 * <ul>
 *   <li>Renumbers the graph, dropping edges that name unknown nodes</li>
 *   <li>Resolves the partition count from the configuration</li>
 *   <li>Assigns nodes with the configured {@link PartitioningStrategy}</li>
 *   <li>Optionally refines the boundary to reduce the edge cut</li>
 *   <li>Measures cut, modularity and balance</li>
 * </ul>
 *
 * <p>Output is deterministic for identical input order and configuration.
 *
 * @param <ID> the node ID type
 * @author hal.hildebrand
 */
public class GraphPartitioner<ID extends NodeId> {

    private static final Logger log = LoggerFactory.getLogger(GraphPartitioner.class);

    private final PartitioningConfig   config;
    private final PartitioningStrategy strategy;
    private final EdgeCutRefinement    refinement = new EdgeCutRefinement();

    public GraphPartitioner() {
        this(PartitioningConfig.defaultConfig());
    }

    public GraphPartitioner(PartitioningConfig config) {
        this(config, Objects.requireNonNull(config, "config cannot be null").algorithm().strategy());
    }

    /**
     * Partition with a caller supplied strategy; the configured algorithm is ignored
     */
    public GraphPartitioner(PartitioningConfig config, PartitioningStrategy strategy) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.strategy = Objects.requireNonNull(strategy, "strategy cannot be null");
        log.debug("Created GraphPartitioner with {}", config);
    }

    public PartitioningConfig config() {
        return config;
    }

    /**
     * Partition a graph.
     *
     * @param nodes the nodes, in the order that breaks ties
     * @param edges undirected edges; edges naming nodes outside {@code nodes} are ignored
     * @return the partitioning, empty for an empty node set
     */
    public PartitionResult<ID> partition(Collection<ID> nodes, Collection<Edge<ID>> edges) {
        var graph = IndexedGraph.of(nodes, edges);
        int n = graph.nodeCount();
        if (n == 0) {
            log.debug("Partitioning empty graph");
            return PartitionResult.empty();
        }

        int k = config.resolvePartitionCount(n);
        if ((long) k * config.maxPartitionSize() < n) {
            log.warn("{} partitions of at most {} cannot hold {} nodes; some partitions will exceed the maximum", k,
                     config.maxPartitionSize(), n);
        }
        log.debug("Partitioning {} nodes, {} edges into {} partitions using {}", n, graph.edgeCount(), k,
                  strategy.getClass().getSimpleName());

        var assignment = strategy.assign(graph, k, config);
        if (config.minimizeEdgeCut()) {
            int moved = refinement.refine(graph, assignment, k, config);
            log.debug("Edge cut refinement moved {} nodes", moved);
        }

        var result = assemble(graph, assignment, k);
        var metrics = result.metrics();
        log.info("Partitioned {} nodes: partitions={}, edgeCut={}, modularity={}, balance={}", n,
                 metrics.partitionCount(), metrics.totalEdgeCut(), String.format("%.3f", metrics.modularity()),
                 String.format("%.2f", metrics.balanceFactor()));
        return result;
    }

    private PartitionResult<ID> assemble(IndexedGraph<ID> graph, int[] assignment, int k) {
        var members = new ArrayList<List<ID>>(k);
        var neighbors = new ArrayList<TreeSet<Integer>>(k);
        for (int p = 0; p < k; p++) {
            members.add(new ArrayList<>());
            neighbors.add(new TreeSet<>());
        }
        var byNode = new LinkedHashMap<ID, Integer>(graph.nodeCount() * 2);
        for (int i = 0; i < graph.nodeCount(); i++) {
            var id = graph.idOf(i);
            members.get(assignment[i]).add(id);
            byNode.put(id, assignment[i]);
        }

        var internal = new int[k];
        var cut = new int[k];
        for (int e = 0; e < graph.edgeCount(); e++) {
            var edge = graph.edge(e);
            int a = assignment[edge[0]];
            int b = assignment[edge[1]];
            if (a == b) {
                internal[a]++;
            } else {
                cut[a]++;
                cut[b]++;
                neighbors.get(a).add(b);
                neighbors.get(b).add(a);
            }
        }

        var partitions = new ArrayList<GraphPartition<ID>>(k);
        for (int p = 0; p < k; p++) {
            partitions.add(new GraphPartition<>(p, members.get(p), internal[p], cut[p], neighbors.get(p)));
        }
        return new PartitionResult<>(byNode, partitions, PartitionMetrics.measure(graph, assignment, k));
    }
}
