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
import com.hellblazer.asterism.accel.LongNodeId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class BarnesHutTreeTest {

    private static final float STRENGTH = 1.0f;

    private static LongNodeId id(long value) {
        return LongNodeId.of(value);
    }

    private static Map<LongNodeId, Point3f> randomCloud(int count, long seed, float extent) {
        var random = new Random(seed);
        var positions = new LinkedHashMap<LongNodeId, Point3f>();
        for (int i = 0; i < count; i++) {
            positions.put(id(i), new Point3f(random.nextFloat() * extent, random.nextFloat() * extent,
                                             random.nextFloat() * extent));
        }
        return positions;
    }

    private static void assertVectorEquals(Vector3f expected, Vector3f actual, float relativeTolerance) {
        var diff = new Vector3f(actual);
        diff.sub(expected);
        float scale = Math.max(expected.length(), 1e-6f);
        assertTrue(diff.length() / scale <= relativeTolerance,
                   () -> "expected " + expected + " but was " + actual);
    }

    @Test
    @DisplayName("Unit cube corners: forces point away from the other corners with the analytic magnitude")
    void testUnitCubeCorners() {
        var positions = new LinkedHashMap<LongNodeId, Point3f>();
        positions.put(id(0), new Point3f(0, 0, 0));
        positions.put(id(1), new Point3f(1, 0, 0));
        positions.put(id(2), new Point3f(0, 1, 0));
        positions.put(id(3), new Point3f(0, 0, 1));

        var tree = BarnesHutTree.build(positions, 0.5f);
        assertEquals(4, tree.size());

        // Origin: three unit-distance neighbors along +x, +y, +z push it along -x, -y, -z
        var origin = tree.calculateForce(id(0), positions.get(id(0)), STRENGTH);
        assertVectorEquals(new Vector3f(-1, -1, -1), origin, 0.05f);
        assertEquals(Math.sqrt(3), origin.length(), Math.sqrt(3) * 0.05);

        // Corner (1,0,0): origin at distance 1, the other two at distance sqrt(2)
        var corner = tree.calculateForce(id(1), positions.get(id(1)), STRENGTH);
        double diagonal = 1.0 / 2.0; // 1/d² at d = sqrt(2)
        double component = diagonal / Math.sqrt(2);
        var expected = new Vector3f((float) (1 + 2 * component), (float) -component, (float) -component);
        assertVectorEquals(expected, corner, 0.05f);
        assertTrue(corner.x > 0, "pushed away from the origin");
    }

    @Test
    @DisplayName("As theta approaches zero the tree equals the brute force sum")
    void testSmallThetaMatchesBruteForce() {
        var positions = randomCloud(200, 0x5eed, 100.0f);
        var tree = BarnesHutTree.build(positions, 1e-6f);
        var exact = BarnesHutTree.bruteForce(positions, STRENGTH);
        var approx = tree.calculateForces(positions, STRENGTH);

        assertEquals(exact.keySet(), approx.keySet());
        for (var id : positions.keySet()) {
            assertVectorEquals(exact.get(id), approx.get(id), 1e-3f);
        }
    }

    @Test
    @DisplayName("Moderate theta stays close to the exact forces")
    void testApproximationError() {
        var positions = randomCloud(500, 42, 1000.0f);
        var tree = BarnesHutTree.build(positions, 0.5f);
        var exact = BarnesHutTree.bruteForce(positions, STRENGTH);

        double errorSum = 0;
        double magnitudeSum = 0;
        for (var entry : positions.entrySet()) {
            var approx = tree.calculateForce(entry.getKey(), entry.getValue(), STRENGTH);
            var diff = new Vector3f(approx);
            diff.sub(exact.get(entry.getKey()));
            errorSum += diff.length();
            magnitudeSum += exact.get(entry.getKey()).length();
        }
        assertTrue(errorSum / magnitudeSum < 0.05, "relative error " + errorSum / magnitudeSum);
    }

    @Test
    @DisplayName("Exact forces on a subset of targets match the full pairwise sum")
    void testBruteForceOnTargets() {
        var positions = randomCloud(60, 11L, 500.0f);
        var full = BarnesHutTree.bruteForce(positions, STRENGTH);

        var targets = new LinkedHashMap<LongNodeId, Point3f>();
        for (long i = 10; i < 15; i++) {
            targets.put(id(i), positions.get(id(i)));
        }
        var subset = BarnesHutTree.bruteForce(targets, positions, STRENGTH);
        assertEquals(targets.keySet(), subset.keySet());
        for (var entry : subset.entrySet()) {
            assertVectorEquals(full.get(entry.getKey()), entry.getValue(), 1e-5f);
        }

        // A target missing from the sources is pushed by every source
        var stranger = Map.of(id(1000), new Point3f(250, 250, 250));
        var pushed = BarnesHutTree.bruteForce(stranger, positions, STRENGTH).get(id(1000));
        assertTrue(pushed.length() > 0);

        assertThrows(IllegalArgumentException.class,
                     () -> BarnesHutTree.bruteForce(targets, Map.of(id(1), new Point3f(Float.NaN, 0, 0)),
                                                    STRENGTH));
    }

    @Test
    @DisplayName("Aggregates: total mass and center of mass")
    void testAggregates() {
        var positions = new LinkedHashMap<LongNodeId, Point3f>();
        positions.put(id(0), new Point3f(0, 0, 0));
        positions.put(id(1), new Point3f(4, 0, 0));
        positions.put(id(2), new Point3f(0, 8, 0));
        var masses = new HashMap<LongNodeId, Float>();
        masses.put(id(2), 2.0f);

        var tree = BarnesHutTree.build(positions, masses, 0.5f);
        assertEquals(4.0f, tree.totalMass(), 1e-6f);
        assertEquals(new Point3f(1, 4, 0), tree.centerOfMass());
        assertTrue(tree.bounds().contains(new Point3f(4, 8, 0)));
        assertTrue(tree.internalNodeCount() >= 1);
    }

    @Test
    @DisplayName("Empty input yields an empty tree with zero force everywhere")
    void testEmpty() {
        var tree = BarnesHutTree.<LongNodeId>build(Map.of(), 0.5f);
        assertTrue(tree.isEmpty());
        assertEquals(0, tree.size());
        assertEquals(0.0f, tree.totalMass());
        assertEquals(new Vector3f(), tree.calculateForce(id(1), new Point3f(3, 4, 5), STRENGTH));
    }

    @Test
    @DisplayName("A body never repels itself; an unknown id is pushed by every body")
    void testSelfExclusion() {
        var positions = new LinkedHashMap<LongNodeId, Point3f>();
        positions.put(id(0), new Point3f(0, 0, 0));
        positions.put(id(1), new Point3f(2, 0, 0));
        var tree = BarnesHutTree.build(positions, 0.5f);

        var own = tree.calculateForce(id(0), new Point3f(0, 0, 0), STRENGTH);
        assertEquals(-0.25f, own.x, 1e-6f);

        // Unknown id at (1,0,0): pushed equally by both, net zero
        var probe = tree.calculateForce(id(99), new Point3f(1, 0, 0), STRENGTH);
        assertEquals(0.0f, probe.length(), 1e-6f);

        // Unknown id beside body 0: body 0 counts, it is not excluded
        var near = tree.calculateForce(id(99), new Point3f(-1, 0, 0), STRENGTH);
        assertEquals(-1.0f - 1.0f / 9.0f, near.x, 1e-5f);
    }

    @Test
    @DisplayName("Coincident bodies share a leaf and exert no force on each other")
    void testCoincidentBodies() {
        var positions = new LinkedHashMap<LongNodeId, Point3f>();
        for (int i = 0; i < 10; i++) {
            positions.put(id(i), new Point3f(5, 5, 5));
        }
        var tree = BarnesHutTree.build(positions, 0.5f);
        assertEquals(10, tree.size());
        assertEquals(10.0f, tree.totalMass(), 1e-6f);
        assertEquals(new Vector3f(), tree.calculateForce(id(0), new Point3f(5, 5, 5), STRENGTH));

        var outside = tree.calculateForce(id(99), new Point3f(6, 5, 5), STRENGTH);
        assertEquals(10.0f, outside.x, 1e-3f);
    }

    @Test
    @DisplayName("Nearly coincident bodies do not recurse without bound")
    void testNearlyCoincident() {
        var positions = new LinkedHashMap<LongNodeId, Point3f>();
        positions.put(id(0), new Point3f(1, 1, 1));
        positions.put(id(1), new Point3f(Math.nextUp(1.0f), 1, 1));
        positions.put(id(2), new Point3f(100, 100, 100));
        var tree = BarnesHutTree.build(positions, 0.5f);
        assertEquals(3, tree.size());
        assertTrue(tree.depth() <= BarnesHutTree.MAX_DEPTH);
    }

    @Test
    @DisplayName("Invalid theta and non-finite positions are rejected")
    void testValidation() {
        var positions = Map.of(id(0), new Point3f(0, 0, 0));
        assertThrows(InvalidConfigurationException.class, () -> BarnesHutTree.build(positions, 0.0f));
        assertThrows(InvalidConfigurationException.class, () -> BarnesHutTree.build(positions, -1.0f));
        assertThrows(InvalidConfigurationException.class, () -> BarnesHutTree.build(positions, Float.NaN));

        var bad = Map.of(id(0), new Point3f(Float.NaN, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> BarnesHutTree.build(bad, 0.5f));
        var infinite = Map.of(id(0), new Point3f(0, Float.POSITIVE_INFINITY, 0));
        assertThrows(IllegalArgumentException.class, () -> BarnesHutTree.build(infinite, 0.5f));

        var masses = Map.of(id(0), 0.0f);
        assertThrows(IllegalArgumentException.class, () -> BarnesHutTree.build(positions, masses, 0.5f));
    }

    @Test
    @DisplayName("Very close bodies are clamped to the minimum distance")
    void testDistanceClamp() {
        var positions = new LinkedHashMap<LongNodeId, Point3f>();
        positions.put(id(0), new Point3f(0, 0, 0));
        positions.put(id(1), new Point3f(0.001f, 0, 0));
        var forces = BarnesHutTree.bruteForce(positions, STRENGTH);
        float bound = STRENGTH / (BarnesHutTree.MIN_DISTANCE * BarnesHutTree.MIN_DISTANCE);
        assertEquals(bound, forces.get(id(1)).x, bound * 1e-4f);
        assertEquals(-bound, forces.get(id(0)).x, bound * 1e-4f);
    }
}
