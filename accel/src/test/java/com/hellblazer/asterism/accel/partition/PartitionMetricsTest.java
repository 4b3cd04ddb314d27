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
import com.hellblazer.asterism.accel.LongNodeId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hellblazer.asterism.accel.partition.GraphPartitionerTest.id;
import static com.hellblazer.asterism.accel.partition.GraphPartitionerTest.nodes;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class PartitionMetricsTest {

    private static final List<Edge<LongNodeId>> BRIDGED_TRIANGLES = List.of(Edge.of(id(0), id(1)),
                                                                            Edge.of(id(1), id(2)),
                                                                            Edge.of(id(0), id(2)),
                                                                            Edge.of(id(3), id(4)),
                                                                            Edge.of(id(4), id(5)),
                                                                            Edge.of(id(3), id(5)),
                                                                            Edge.of(id(2), id(3)));

    @Test
    @DisplayName("Modularity of two bridged triangles split at the bridge")
    void testModularity() {
        var graph = IndexedGraph.of(nodes(6), BRIDGED_TRIANGLES);
        var metrics = PartitionMetrics.measure(graph, new int[] { 0, 0, 0, 1, 1, 1 }, 2);
        assertEquals(6.0 / 7.0 - 0.5, metrics.modularity(), 1e-9);
        assertEquals(1, metrics.totalEdgeCut());
        assertEquals(1.0, metrics.balanceFactor(), 1e-9);

        var single = PartitionMetrics.measure(graph, new int[6], 1);
        assertEquals(0.0, single.modularity(), 1e-9, "one community has no modularity");
        assertEquals(0, single.totalEdgeCut());
    }

    @Test
    @DisplayName("Balance and spread of uneven partitions")
    void testBalance() {
        var graph = IndexedGraph.of(nodes(8), List.<Edge<LongNodeId>>of());
        var metrics = PartitionMetrics.measure(graph, new int[] { 0, 0, 0, 0, 0, 0, 1, 1 }, 2);
        assertEquals(4.0, metrics.averageSize(), 1e-9);
        assertEquals(2.0, metrics.sizeStdDev(), 1e-9);
        assertEquals(1.5, metrics.balanceFactor(), 1e-9);
        assertEquals(0.0, metrics.modularity());
    }

    @Test
    @DisplayName("Self-loops count as internal edges and twice toward degree")
    void testSelfLoops() {
        var graph = IndexedGraph.of(nodes(2), List.of(Edge.of(id(0), id(0)), Edge.of(id(0), id(1))));
        assertEquals(2, graph.edgeCount());
        assertEquals(3, graph.degree(0));
        assertArrayEquals(new int[] { 1 }, graph.neighbors(0));

        var metrics = PartitionMetrics.measure(graph, new int[] { 0, 1 }, 2);
        assertEquals(1, metrics.totalEdgeCut());
        // L = {1, 0}, d = {3, 1}, m = 2
        assertEquals(0.5 - (0.75 * 0.75 + 0.25 * 0.25), metrics.modularity(), 1e-9);
    }

    @Test
    @DisplayName("Renumbering drops duplicates and unknown endpoints")
    void testIndexedGraph() {
        var graph = IndexedGraph.of(List.of(id(5), id(3), id(5)),
                                    List.of(Edge.of(id(5), id(3)), Edge.of(id(3), id(5)), Edge.of(id(3), id(7))));
        assertEquals(2, graph.nodeCount());
        assertEquals(0, graph.indexOf(id(5)));
        assertEquals(1, graph.indexOf(id(3)));
        assertEquals(-1, graph.indexOf(id(7)));
        assertEquals(id(3), graph.idOf(1));
        assertEquals(2, graph.edgeCount(), "parallel edges are kept");
        assertArrayEquals(new int[] { 1, 1 }, graph.neighbors(0));
    }
}
