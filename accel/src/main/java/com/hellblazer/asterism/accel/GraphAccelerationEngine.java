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
package com.hellblazer.asterism.accel;

import com.hellblazer.asterism.accel.config.AccelerationConfiguration;
import com.hellblazer.asterism.accel.culling.CameraState;
import com.hellblazer.asterism.accel.culling.FrustumVisibilityFilter;
import com.hellblazer.asterism.accel.culling.ViewFrustum;
import com.hellblazer.asterism.accel.culling.VisibilityResult;
import com.hellblazer.asterism.accel.force.BarnesHutTree;
import com.hellblazer.asterism.accel.grid.SpatialHashGrid;
import com.hellblazer.asterism.accel.incremental.GraphChangeTracker;
import com.hellblazer.asterism.accel.incremental.RelayoutDecision;
import com.hellblazer.asterism.accel.lod.LevelOfDetailSelector;
import com.hellblazer.asterism.accel.lod.LodState;
import com.hellblazer.asterism.accel.lod.LodStats;
import com.hellblazer.asterism.accel.partition.GraphPartitioner;
import com.hellblazer.asterism.accel.partition.PartitionResult;
import com.hellblazer.asterism.geometry.Positions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Tuple3f;
import javax.vecmath.Vector3f;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Facade tying the acceleration structures to a host's frame loop.
 *
 * <p>Per layout tick the engine records the position snapshot with its change tracker, decides between a full and a
 * partial relayout, rebuilds and publishes the spatial snapshot on a full relayout, and returns the repulsion acting
 * on each node laid out. Per camera update it culls against the view frustum and advances the host's level of detail
 * state. Partitioning runs out of band on request.
 *
 * <p>Layout ticks and camera updates are expected from one thread at a time. Neighbor queries may run concurrently
 * with a tick: they read whichever snapshot was last published.
 *
 * @param <ID> the node ID type
 * @author hal.hildebrand
 */
public class GraphAccelerationEngine<ID extends NodeId> {

    private static final Logger log = LoggerFactory.getLogger(GraphAccelerationEngine.class);

    private final AccelerationConfiguration              config;
    private final GraphChangeTracker<ID>                 tracker;
    private final GraphPartitioner<ID>                   partitioner;
    private final FrustumVisibilityFilter                visibilityFilter;
    private final AtomicReference<SpatialSnapshot<ID>>   snapshot = new AtomicReference<>();
    private final AtomicReference<GraphPerformanceStats> stats;
    private final AtomicLong                             versions = new AtomicLong();

    public GraphAccelerationEngine() {
        this(AccelerationConfiguration.defaultConfig());
    }

    public GraphAccelerationEngine(AccelerationConfiguration config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.tracker = new GraphChangeTracker<>(config.incremental());
        this.partitioner = new GraphPartitioner<>(config.partitioning());
        this.visibilityFilter = new FrustumVisibilityFilter(config.nodeRadius());
        this.stats = new AtomicReference<>(GraphPerformanceStats.EMPTY);
        log.debug("Created GraphAccelerationEngine with {}", config);
    }

    /**
     * Annotate a snapshot with visibility and level of detail for a camera. Either stage may be disabled by
     * configuration: disabled culling reports every node visible, disabled level of detail leaves {@code lodState}
     * untouched.
     *
     * @param camera    the current camera
     * @param positions the current node positions
     * @param lodState  the host's per node detail state, advanced in place
     * @return the view annotation
     */
    public ViewAnnotation<ID> cameraUpdate(CameraState camera, Map<ID, ? extends Tuple3f> positions,
                                           LodState<ID> lodState) {
        Objects.requireNonNull(camera, "camera cannot be null");
        Objects.requireNonNull(lodState, "lodState cannot be null");
        Positions.requireAllFinite(positions);

        VisibilityResult<ID> visibility;
        if (config.frustumCulling()) {
            visibility = visibilityFilter.filter(ViewFrustum.from(camera), positions);
        } else {
            visibility = VisibilityResult.allVisible(positions.keySet());
        }

        LodStats lodStats;
        if (config.levelOfDetail()) {
            var selector = new LevelOfDetailSelector(config.lod().withCameraPosition(camera.position()));
            lodStats = lodState.updateAll(selector, positions);
        } else {
            lodStats = lodState.stats();
        }

        var cullingStats = visibility.stats();
        stats.updateAndGet(s -> s.withView(positions.size(), cullingStats.visibleNodes(), lodStats));
        log.debug("Camera update: {} visible of {}, lod {}", cullingStats.visibleNodes(), positions.size(), lodStats);
        return new ViewAnnotation<>(visibility, lodState, lodStats);
    }

    /**
     * The change tracker, for hosts that record structural changes or pin nodes between ticks
     */
    public GraphChangeTracker<ID> changeTracker() {
        return tracker;
    }

    public AccelerationConfiguration config() {
        return config;
    }

    /**
     * Run one layout tick.
     *
     * @param positions the current node positions
     * @param edges     the current edges
     * @return the executed relayout mode and the repulsion per node laid out
     * @throws IllegalArgumentException if any position is not finite
     */
    public LayoutTickResult<ID> layoutTick(Map<ID, ? extends Tuple3f> positions, Collection<Edge<ID>> edges) {
        Objects.requireNonNull(edges, "edges cannot be null");
        Positions.requireAllFinite(positions);
        long startTime = System.nanoTime();

        RelayoutDecision<ID> decision;
        if (config.incrementalLayout()) {
            tracker.updateAdjacency(edges);
            tracker.recordPositions(positions);
            decision = tracker.decide(positions.size());
            tracker.reset();
        } else {
            decision = RelayoutDecision.full();
        }

        var current = snapshot.get();
        boolean rebuilt = false;
        if (decision.isFull() || current == null) {
            current = rebuild(positions);
            snapshot.set(current);
            rebuilt = true;
            decision = RelayoutDecision.full();
        }

        Map<ID, Vector3f> forces;
        switch (decision.mode()) {
            case FULL:
                forces = forces(current, positions, positions);
                break;
            case PARTIAL:
                var region = new LinkedHashMap<ID, Tuple3f>();
                for (var id : decision.region()) {
                    var position = positions.get(id);
                    if (position != null) {
                        region.put(id, position);
                    }
                }
                forces = forces(current, positions, region);
                break;
            default:
                forces = Map.of();
        }

        double elapsedMillis = (System.nanoTime() - startTime) / 1_000_000.0;
        stats.updateAndGet(s -> s.withLayout(positions.size(), elapsedMillis, versions.get()));
        log.debug("Layout tick: mode={}, nodes={}, forces={}, rebuilt={}, {} ms", decision.mode(), positions.size(),
                  forces.size(), rebuilt, String.format("%.3f", elapsedMillis));
        return new LayoutTickResult<>(decision.mode(), forces, rebuilt, elapsedMillis);
    }

    /**
     * Candidate neighbors of a point from the last published snapshot; may include nodes somewhat beyond the radius
     *
     * @return the candidates, empty before the first layout tick
     */
    public List<ID> neighbors(Tuple3f point, float radius) {
        var current = snapshot.get();
        return current == null ? List.of() : current.grid().findNeighbors(point, radius);
    }

    /**
     * Neighbors of a point from the last published snapshot, filtered by exact distance
     *
     * @return the neighbors, empty before the first layout tick
     */
    public List<ID> neighborsWithin(Tuple3f point, float radius) {
        var current = snapshot.get();
        return current == null ? List.of() : current.grid().findNeighborsWithin(point, radius);
    }

    /**
     * Partition a graph with the configured partitioner
     */
    public PartitionResult<ID> partition(Collection<ID> nodes, Collection<Edge<ID>> edges) {
        return partitioner.partition(nodes, edges);
    }

    /**
     * @return the last published spatial snapshot, empty before the first layout tick
     */
    public Optional<SpatialSnapshot<ID>> snapshot() {
        return Optional.ofNullable(snapshot.get());
    }

    public GraphPerformanceStats stats() {
        return stats.get();
    }

    private Map<ID, Vector3f> forces(SpatialSnapshot<ID> current, Map<ID, ? extends Tuple3f> all,
                                     Map<ID, ? extends Tuple3f> targets) {
        float strength = config.repulsionStrength();
        if (current.tree().isPresent()) {
            return current.tree().get().calculateForces(targets, strength);
        }
        return BarnesHutTree.bruteForce(targets, all, strength);
    }

    private SpatialSnapshot<ID> rebuild(Map<ID, ? extends Tuple3f> positions) {
        var grid = new SpatialHashGrid<ID>(config.gridCellSize());
        grid.build(positions);
        Optional<BarnesHutTree<ID>> tree = config.spatialAcceleration()
                                           ? Optional.of(BarnesHutTree.build(positions, config.theta()))
                                           : Optional.empty();
        var built = new SpatialSnapshot<>(tree, grid, versions.incrementAndGet());
        log.info("Published spatial snapshot {}: {} nodes, {} grid cells, tree {}", built.version(), positions.size(),
                 grid.cellCount(), tree.map(Object::toString).orElse("disabled"));
        return built;
    }
}
