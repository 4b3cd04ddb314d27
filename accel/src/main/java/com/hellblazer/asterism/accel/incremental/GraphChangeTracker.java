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
package com.hellblazer.asterism.accel.incremental;

import com.hellblazer.asterism.accel.Edge;
import com.hellblazer.asterism.accel.NodeId;
import com.hellblazer.asterism.geometry.Positions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Accumulates structural and positional changes between relayouts and decides whether the next pass should rebuild
 * everything or only a region around the changes.
 *
 * <p>A changed node pulls its direct neighbors into the affected set at the moment the change is recorded, so the
 * adjacency should be current ({@link #updateAdjacency}) before changes are recorded.
 *
 * <p>{@link #reset()} consumes the changes; the adjacency, the previous positions and the pinned nodes survive it.
 * Not thread-safe.
 *
 * @param <ID> the node ID type
 * @author hal.hildebrand
 */
public class GraphChangeTracker<ID extends NodeId> {

    private static final Logger log = LoggerFactory.getLogger(GraphChangeTracker.class);

    private final IncrementalLayoutConfig config;
    private final Map<ID, Set<ID>>        adjacency         = new LinkedHashMap<>();
    private final Map<ID, Point3f>        previousPositions = new HashMap<>();
    private final Set<ID>                 pinned            = new HashSet<>();
    private final Set<ID>                 added             = new LinkedHashSet<>();
    private final Set<ID>                 removed           = new LinkedHashSet<>();
    private final Set<ID>                 moved             = new LinkedHashSet<>();
    private final Set<ID>                 affected          = new LinkedHashSet<>();
    private       int                     addedEdges;
    private       int                     removedEdges;
    private       boolean                 fullRelayoutRequested;

    public GraphChangeTracker() {
        this(IncrementalLayoutConfig.defaultConfig());
    }

    public GraphChangeTracker(IncrementalLayoutConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    public int addedEdgeCount() {
        return addedEdges;
    }

    public Set<ID> addedNodes() {
        return Collections.unmodifiableSet(added);
    }

    public int affectedCount() {
        return affected.size();
    }

    /**
     * @return changed nodes and their direct neighbors
     */
    public Set<ID> affectedNodes() {
        return Collections.unmodifiableSet(affected);
    }

    public IncrementalLayoutConfig config() {
        return config;
    }

    /**
     * Decide the next relayout
     *
     * @param totalNodes the current node count
     */
    public RelayoutDecision<ID> decide(int totalNodes) {
        if (shouldFullRelayout(totalNodes)) {
            log.debug("Full relayout: {} of {} nodes affected, requested={}", liveAffectedCount(), totalNodes,
                      fullRelayoutRequested);
            return RelayoutDecision.full();
        }
        if (!hasChanges()) {
            return RelayoutDecision.none();
        }
        var region = relayoutRegion();
        log.debug("Partial relayout: {} affected, region of {}", affected.size(), region.size());
        return RelayoutDecision.partial(region);
    }

    public boolean hasChanges() {
        return !added.isEmpty() || !removed.isEmpty() || !moved.isEmpty() || addedEdges > 0 || removedEdges > 0;
    }

    public boolean isPinned(ID id) {
        return pinned.contains(id);
    }

    public Set<ID> movedNodes() {
        return Collections.unmodifiableSet(moved);
    }

    /**
     * @return the direct neighbors of a node in the tracked adjacency
     */
    public Set<ID> neighbors(ID id) {
        return Collections.unmodifiableSet(adjacency.getOrDefault(id, Set.of()));
    }

    /**
     * Pin a node: it keeps its position and partial relayout regions do not extend through it
     */
    public void pin(ID id) {
        pinned.add(Objects.requireNonNull(id, "id cannot be null"));
    }

    public void recordEdgeAdded(Edge<ID> edge) {
        link(edge.source(), edge.target());
        addedEdges++;
        markAffected(edge.source());
        markAffected(edge.target());
    }

    public void recordEdgeRemoved(Edge<ID> edge) {
        markAffected(edge.source());
        markAffected(edge.target());
        unlink(edge.source(), edge.target());
        removedEdges++;
    }

    public void recordNodeAdded(ID id) {
        removed.remove(id);
        added.add(id);
        markAffected(id);
    }

    public void recordNodeMoved(ID id) {
        if (!added.contains(id)) {
            moved.add(id);
        }
        markAffected(id);
    }

    public void recordNodeRemoved(ID id) {
        markAffected(id);
        added.remove(id);
        moved.remove(id);
        removed.add(id);
        previousPositions.remove(id);
        var neighbors = adjacency.remove(id);
        if (neighbors != null) {
            for (var neighbor : neighbors) {
                var back = adjacency.get(neighbor);
                if (back != null) {
                    back.remove(id);
                }
            }
        }
    }

    /**
     * Compare a position snapshot with the previous one: new ids are added, missing ids removed, and ids displaced by
     * more than the movement threshold moved. The snapshot then becomes the previous one.
     *
     * @return the number of changes detected
     * @throws IllegalArgumentException if any position is not finite
     */
    public int recordPositions(Map<ID, ? extends Tuple3f> positions) {
        Positions.requireAllFinite(positions);
        float threshold = config.movementThreshold();
        int changes = 0;

        var departed = new HashSet<>(previousPositions.keySet());
        departed.removeAll(positions.keySet());
        for (var id : departed) {
            recordNodeRemoved(id);
            changes++;
        }

        for (var entry : positions.entrySet()) {
            var id = entry.getKey();
            var previous = previousPositions.get(id);
            if (previous == null) {
                recordNodeAdded(id);
                changes++;
            } else if (previous.distance(new Point3f(entry.getValue())) > threshold) {
                recordNodeMoved(id);
                changes++;
            }
            previousPositions.put(id, new Point3f(entry.getValue()));
        }
        log.debug("Recorded {} positions: {} changes, {} affected", positions.size(), changes, affected.size());
        return changes;
    }

    /**
     * The affected nodes, minus pinned and removed ones, expanded by up to {@code propagationDistance} hops. The
     * expansion does not enter pinned nodes.
     */
    public Set<ID> relayoutRegion() {
        var region = new LinkedHashSet<ID>();
        var frontier = new ArrayDeque<ID>();
        for (var id : affected) {
            if (!pinned.contains(id) && !removed.contains(id) && region.add(id)) {
                frontier.add(id);
            }
        }
        for (int hop = 0; hop < config.propagationDistance() && !frontier.isEmpty(); hop++) {
            int levelSize = frontier.size();
            for (int i = 0; i < levelSize; i++) {
                var id = frontier.poll();
                for (var neighbor : adjacency.getOrDefault(id, Set.of())) {
                    if (!pinned.contains(neighbor) && region.add(neighbor)) {
                        frontier.add(neighbor);
                    }
                }
            }
        }
        return region;
    }

    public int removedEdgeCount() {
        return removedEdges;
    }

    public Set<ID> removedNodes() {
        return Collections.unmodifiableSet(removed);
    }

    /**
     * Force the next decision to be a full relayout
     */
    public void requestFullRelayout() {
        fullRelayoutRequested = true;
    }

    /**
     * Consume the recorded changes
     */
    public void reset() {
        added.clear();
        removed.clear();
        moved.clear();
        affected.clear();
        addedEdges = 0;
        removedEdges = 0;
        fullRelayoutRequested = false;
    }

    /**
     * @param totalNodes the current node count
     * @return true if a full relayout was requested or the fraction of live affected nodes exceeds the configured
     *         fraction
     */
    public boolean shouldFullRelayout(int totalNodes) {
        if (fullRelayoutRequested) {
            return true;
        }
        return liveAffectedCount() / (double) Math.max(1, totalNodes) > config.relayoutFraction();
    }

    /**
     * @return affected nodes that have not been removed, the numerator of the full relayout fraction
     */
    public int liveAffectedCount() {
        int count = 0;
        for (var id : affected) {
            if (!removed.contains(id)) {
                count++;
            }
        }
        return count;
    }

    public void unpin(ID id) {
        pinned.remove(id);
    }

    /**
     * Replace the tracked adjacency wholesale. Records no changes; edges are undirected and self-loops ignored.
     */
    public void updateAdjacency(Collection<Edge<ID>> edges) {
        adjacency.clear();
        for (var edge : edges) {
            link(edge.source(), edge.target());
        }
    }

    private void link(ID a, ID b) {
        if (a.equals(b)) {
            return;
        }
        adjacency.computeIfAbsent(a, k -> new LinkedHashSet<>()).add(b);
        adjacency.computeIfAbsent(b, k -> new LinkedHashSet<>()).add(a);
    }

    private void markAffected(ID id) {
        affected.add(id);
        affected.addAll(adjacency.getOrDefault(id, Set.of()));
    }

    private void unlink(ID a, ID b) {
        var fromA = adjacency.get(a);
        if (fromA != null) {
            fromA.remove(b);
        }
        var fromB = adjacency.get(b);
        if (fromB != null) {
            fromB.remove(a);
        }
    }
}
