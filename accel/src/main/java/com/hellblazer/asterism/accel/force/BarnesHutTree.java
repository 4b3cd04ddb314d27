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
package com.hellblazer.asterism.accel.force;

import com.hellblazer.asterism.accel.InvalidConfigurationException;
import com.hellblazer.asterism.accel.NodeId;
import com.hellblazer.asterism.geometry.Bounds3f;
import com.hellblazer.asterism.geometry.Positions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;
import javax.vecmath.Vector3f;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Barnes-Hut octree approximating the long-range repulsion acting on every node of a graph layout in O(log n) per
 * node instead of O(n).
 *
 * <p>The tree is an immutable snapshot of one set of positions: it is built wholesale by {@link #build} and
 * discarded when positions change. There is no incremental insert or delete. Any number of threads may query a
 * built tree concurrently.
 *
 * <p>Construction:
 * <ol>
 *   <li>Bound all positions, padding the box by 1% of its diagonal (never less than {@link #MIN_PADDING})</li>
 *   <li>Insert each body by octant descent; a body landing on an occupied leaf splits that leaf into an internal
 *   node, the dislodged body is re-inserted first</li>
 *   <li>Aggregate total mass and center of mass bottom-up</li>
 * </ol>
 *
 * <p>Querying: a subtree whose {@code size / distance} ratio is below the accuracy {@code theta} is treated as a
 * single point mass at its center of mass. Smaller theta is more accurate and slower; theta approaching zero
 * degenerates into the exact pairwise sum.
 *
 * @param <ID> the node id type
 * @author hal.hildebrand
 */
public final class BarnesHutTree<ID extends NodeId> {

    /** Distances are clamped to at least this value, avoiding the singularity at zero separation */
    public static final float MIN_DISTANCE = 0.01f;

    /** Fraction of the bounding box diagonal added on every side of the root box */
    public static final float PADDING_FRACTION = 0.01f;

    /** Padding floor, so coincident points never produce a zero-size root box */
    public static final float MIN_PADDING = 0.01f;

    /** Bodies that still share a leaf at this depth stay together in one leaf */
    public static final int MAX_DEPTH = 32;

    private static final Logger log = LoggerFactory.getLogger(BarnesHutTree.class);

    private final Internal<ID> root;
    private final float        theta;
    private final int          size;
    private final int          internalNodes;
    private final int          depth;

    private BarnesHutTree(Internal<ID> root, float theta, int size) {
        this.root = root;
        this.theta = theta;
        this.size = size;
        var counts = new int[2];
        count(root, counts);
        this.internalNodes = counts[0];
        this.depth = counts[1];
    }

    /**
     * Build a tree of unit-mass bodies.
     *
     * @param positions node positions, all finite
     * @param theta     accuracy, must be positive
     * @return the built tree
     * @throws InvalidConfigurationException if theta is not positive and finite
     * @throws IllegalArgumentException      if any position is not finite
     */
    public static <ID extends NodeId> BarnesHutTree<ID> build(Map<ID, ? extends Tuple3f> positions, float theta) {
        return build(positions, Collections.emptyMap(), theta);
    }

    /**
     * Build a tree of weighted bodies. Nodes without an entry in {@code masses} have unit mass.
     *
     * @param positions node positions, all finite
     * @param masses    per node mass, finite and positive
     * @param theta     accuracy, must be positive
     * @return the built tree
     * @throws InvalidConfigurationException if theta is not positive and finite
     * @throws IllegalArgumentException      if any position is not finite or any mass is not positive
     */
    public static <ID extends NodeId> BarnesHutTree<ID> build(Map<ID, ? extends Tuple3f> positions,
                                                              Map<ID, Float> masses, float theta) {
        InvalidConfigurationException.requirePositive(theta, "theta");
        Positions.requireAllFinite(positions);
        Objects.requireNonNull(masses, "masses cannot be null");

        if (positions.isEmpty()) {
            log.debug("Built empty Barnes-Hut tree");
            return new BarnesHutTree<>(new Internal<>(Bounds3f.UNIT, 0), theta, 0);
        }

        var tight = Bounds3f.enclosing(positions.values());
        var bounds = tight.padded(Math.max(tight.diagonal() * PADDING_FRACTION, MIN_PADDING));
        var root = new Internal<ID>(bounds, 0);

        for (var entry : positions.entrySet()) {
            var mass = masses.get(entry.getKey());
            float m = mass == null ? 1.0f : mass;
            if (!Float.isFinite(m) || m <= 0) {
                throw new IllegalArgumentException("Mass of " + entry.getKey() + " must be positive: " + m);
            }
            insert(root, new Body<>(entry.getKey(), new Point3f(entry.getValue()), m));
        }
        aggregate(root);

        var tree = new BarnesHutTree<>(root, theta, positions.size());
        log.debug("Built Barnes-Hut tree: {} bodies, {} internal nodes, depth {}, bounds {}", tree.size,
                  tree.internalNodes, tree.depth, bounds);
        return tree;
    }

    /**
     * Exact pairwise repulsion on every node, O(n²). Same force law as the tree with unit masses.
     *
     * @param positions node positions, all finite
     * @param strength  the repulsion constant
     * @return the net force per node, in the iteration order of {@code positions}
     */
    public static <ID extends NodeId> Map<ID, Vector3f> bruteForce(Map<ID, ? extends Tuple3f> positions,
                                                                   float strength) {
        return bruteForce(positions, positions, strength);
    }

    /**
     * Exact repulsion on a subset of targets from every source, O(targets · sources). A source whose id equals the
     * target's is excluded.
     *
     * @param targets the nodes the forces act on, all finite
     * @param sources the repelling nodes, all finite
     * @param strength the repulsion constant
     * @return the net force per target, in the iteration order of {@code targets}
     */
    public static <ID extends NodeId> Map<ID, Vector3f> bruteForce(Map<ID, ? extends Tuple3f> targets,
                                                                   Map<ID, ? extends Tuple3f> sources,
                                                                   float strength) {
        Positions.requireAllFinite(targets);
        if (sources != targets) {
            Positions.requireAllFinite(sources);
        }
        Positions.requireFinite(strength, "strength");
        var forces = new LinkedHashMap<ID, Vector3f>(targets.size() * 2);
        for (var target : targets.entrySet()) {
            var acc = new double[3];
            for (var source : sources.entrySet()) {
                if (!source.getKey().equals(target.getKey())) {
                    accumulateRepulsion(acc, target.getValue(), source.getValue(), 1.0, strength);
                }
            }
            forces.put(target.getKey(), toVector(acc));
        }
        return forces;
    }

    private static void accumulateRepulsion(double[] acc, Tuple3f target, Tuple3f source, double mass,
                                            float strength) {
        double dx = target.x - source.x;
        double dy = target.y - source.y;
        double dz = target.z - source.z;
        double length = Math.sqrt(dx * dx + dy * dy + dz * dz);
        if (length == 0) {
            // coincident: no direction to push along
            return;
        }
        double clamped = Math.max(length, MIN_DISTANCE);
        double magnitude = strength * mass / (clamped * clamped);
        acc[0] += dx / length * magnitude;
        acc[1] += dy / length * magnitude;
        acc[2] += dz / length * magnitude;
    }

    private static <ID extends NodeId> void aggregate(Internal<ID> node) {
        double mass = 0, x = 0, y = 0, z = 0;
        for (var child : node.children) {
            if (child == null) {
                continue;
            }
            if (child instanceof Internal<ID> internal) {
                aggregate(internal);
                mass += internal.totalMass;
                x += internal.centerOfMass.x * (double) internal.totalMass;
                y += internal.centerOfMass.y * (double) internal.totalMass;
                z += internal.centerOfMass.z * (double) internal.totalMass;
            } else {
                for (var body : ((Leaf<ID>) child).bodies) {
                    mass += body.mass();
                    x += body.position().x * (double) body.mass();
                    y += body.position().y * (double) body.mass();
                    z += body.position().z * (double) body.mass();
                }
            }
        }
        node.totalMass = (float) mass;
        if (mass > 0) {
            node.centerOfMass.set((float) (x / mass), (float) (y / mass), (float) (z / mass));
        } else {
            node.centerOfMass.set(0, 0, 0);
        }
    }

    private static <ID extends NodeId> void count(Internal<ID> node, int[] counts) {
        counts[0]++;
        counts[1] = Math.max(counts[1], node.depth + 1);
        for (var child : node.children) {
            if (child instanceof Internal<ID> internal) {
                count(internal, counts);
            }
        }
    }

    private static <ID extends NodeId> void insert(Internal<ID> node, Body<ID> body) {
        int octant = node.bounds.octant(body.position());
        var child = node.children[octant];
        if (child == null) {
            node.children[octant] = new Leaf<>(body);
        } else if (child instanceof Internal<ID> internal) {
            insert(internal, body);
        } else {
            var leaf = (Leaf<ID>) child;
            if (node.depth + 1 >= MAX_DEPTH || leaf.bodies.get(0).position().equals(body.position())) {
                leaf.bodies.add(body);
                return;
            }
            var split = new Internal<ID>(node.bounds.child(octant), node.depth + 1);
            node.children[octant] = split;
            for (var dislodged : leaf.bodies) {
                insert(split, dislodged);
            }
            insert(split, body);
        }
    }

    private static Vector3f toVector(double[] acc) {
        return new Vector3f((float) acc[0], (float) acc[1], (float) acc[2]);
    }

    /**
     * Net approximate repulsion acting on a target. A body whose id equals {@code targetId} is excluded; an id that
     * was never inserted excludes nothing.
     *
     * @param targetId       the id of the node the force acts on
     * @param targetPosition the position of the node, finite
     * @param strength       the repulsion constant, the force between two unit masses at distance d is
     *                       {@code strength / d²}
     * @return the net force vector
     */
    public Vector3f calculateForce(ID targetId, Tuple3f targetPosition, float strength) {
        Positions.requireFinite(targetPosition, "targetPosition");
        Positions.requireFinite(strength, "strength");
        var acc = new double[3];
        accumulate(root, targetId, targetPosition, strength, acc);
        return toVector(acc);
    }

    /**
     * Net approximate repulsion on every node of a snapshot. The snapshot may be a subset of (or differ from) the
     * positions the tree was built from, as in a localized relayout against the previous tree.
     *
     * @return the net force per node, in the iteration order of {@code positions}
     */
    public Map<ID, Vector3f> calculateForces(Map<ID, ? extends Tuple3f> positions, float strength) {
        var forces = new LinkedHashMap<ID, Vector3f>(positions.size() * 2);
        for (var entry : positions.entrySet()) {
            forces.put(entry.getKey(), calculateForce(entry.getKey(), entry.getValue(), strength));
        }
        return forces;
    }

    public Bounds3f bounds() {
        return root.bounds;
    }

    public Point3f centerOfMass() {
        return new Point3f(root.centerOfMass);
    }

    /**
     * @return the number of levels of internal nodes, 1 for a tree that never split
     */
    public int depth() {
        return depth;
    }

    public int internalNodeCount() {
        return internalNodes;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * @return the number of bodies in the tree
     */
    public int size() {
        return size;
    }

    public float theta() {
        return theta;
    }

    public float totalMass() {
        return root.totalMass;
    }

    @Override
    public String toString() {
        return String.format("BarnesHutTree[size=%d, internal=%d, depth=%d, theta=%.2f]", size, internalNodes, depth,
                             theta);
    }

    private void accumulate(Cell<ID> cell, ID targetId, Tuple3f target, float strength, double[] acc) {
        if (cell instanceof Leaf<ID> leaf) {
            for (var body : leaf.bodies) {
                if (!body.id().equals(targetId)) {
                    accumulateRepulsion(acc, target, body.position(), body.mass(), strength);
                }
            }
            return;
        }
        var node = (Internal<ID>) cell;
        if (node.totalMass == 0) {
            return;
        }
        // A box holding the target may hold the target itself, so it is always opened
        if (!node.bounds.contains(target)) {
            double distance = node.centerOfMass.distance(new Point3f(target));
            if (distance > 0 && node.bounds.maxExtent() / distance < theta) {
                accumulateRepulsion(acc, target, node.centerOfMass, node.totalMass, strength);
                return;
            }
        }
        for (var child : node.children) {
            if (child != null) {
                accumulate(child, targetId, target, strength, acc);
            }
        }
    }

    /**
     * A point mass stored in a leaf
     */
    public record Body<ID extends NodeId>(ID id, Point3f position, float mass) {
    }

    private abstract static class Cell<ID extends NodeId> {
    }

    private static final class Leaf<ID extends NodeId> extends Cell<ID> {
        // Usually a single body; more only for coincident points
        private final List<Body<ID>> bodies = new ArrayList<>(1);

        private Leaf(Body<ID> body) {
            bodies.add(body);
        }
    }

    private static final class Internal<ID extends NodeId> extends Cell<ID> {
        private final Bounds3f   bounds;
        private final int        depth;
        private final Point3f    centerOfMass = new Point3f();
        @SuppressWarnings("unchecked")
        private final Cell<ID>[] children     = new Cell[8];
        private       float      totalMass;

        private Internal(Bounds3f bounds, int depth) {
            this.bounds = bounds;
            this.depth = depth;
        }
    }
}
