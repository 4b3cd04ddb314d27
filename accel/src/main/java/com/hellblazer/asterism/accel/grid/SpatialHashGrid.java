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
package com.hellblazer.asterism.accel.grid;

import com.hellblazer.asterism.accel.InvalidConfigurationException;
import com.hellblazer.asterism.accel.NodeId;
import com.hellblazer.asterism.geometry.Point3i;
import com.hellblazer.asterism.geometry.Positions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Uniform spatial hash grid for radius-neighbor queries. A node lives in the cell
 * {@code floor(position / cellSize)}; a query gathers every cell within {@code ceil(radius / cellSize)} cells of the
 * query point's cell on each axis.
 *
 * <p>Results are conservative: every node within the radius is returned, and nodes up to {@code √3 · cellSize}
 * beyond the radius may be returned as well. Use {@link #findNeighborsWithin} when the exact radius matters.
 *
 * <p>The grid is rebuilt wholesale by {@link #build}; cells are never patched incrementally. Between builds it may be
 * queried from any number of threads. Building while queries are in flight is the caller's responsibility to
 * prevent.
 *
 * @param <ID> the node id type
 * @author hal.hildebrand
 */
public class SpatialHashGrid<ID extends NodeId> {

    private static final Logger log = LoggerFactory.getLogger(SpatialHashGrid.class);

    // Beyond this many rings the window is never cheaper than scanning occupied cells
    private static final long MAX_WINDOW_RADIUS = 512;

    private final float                 cellSize;
    private final Map<Point3i, List<ID>> cells     = new HashMap<>();
    private final Map<ID, Point3f>       positions = new HashMap<>();

    /**
     * @param cellSize edge length of a cell
     * @throws InvalidConfigurationException if the cell size is not positive and finite
     */
    public SpatialHashGrid(float cellSize) {
        this.cellSize = InvalidConfigurationException.requirePositive(cellSize, "cellSize");
    }

    /**
     * Clear the grid and repopulate it from a position snapshot. Cell membership follows the iteration order of the
     * snapshot.
     *
     * @throws IllegalArgumentException if any position is not finite; the grid is left empty
     */
    public void build(Map<ID, ? extends Tuple3f> snapshot) {
        cells.clear();
        positions.clear();
        Positions.requireAllFinite(snapshot);
        for (var entry : snapshot.entrySet()) {
            var position = new Point3f(entry.getValue());
            cellFor(cellOf(position)).add(entry.getKey());
            positions.put(entry.getKey(), position);
        }
        log.debug("Built spatial hash grid: {} nodes in {} cells, cell size {}", positions.size(), cells.size(),
                  cellSize);
    }

    /**
     * @return the cell coordinates of a position
     */
    public Point3i cellOf(Tuple3f position) {
        return Point3i.cellOf(position, cellSize);
    }

    public float cellSize() {
        return cellSize;
    }

    public int cellCount() {
        return cells.size();
    }

    /**
     * @return the nodes occupying a cell, empty if the cell is unoccupied
     */
    public List<ID> cellContents(Point3i cell) {
        var members = cells.get(cell);
        return members == null ? Collections.emptyList() : Collections.unmodifiableList(members);
    }

    /**
     * Conservative radius query: no node within {@code radius} of {@code point} is missed, nodes somewhat beyond the
     * radius may be included. A negative radius finds nothing.
     *
     * @throws IllegalArgumentException if the point or radius is not finite
     */
    public List<ID> findNeighbors(Tuple3f point, float radius) {
        Positions.requireFinite(point, "point");
        Positions.requireFinite(radius, "radius");
        if (radius < 0 || cells.isEmpty()) {
            return new ArrayList<>();
        }
        var center = cellOf(point);
        long cellRadius = (long) Math.ceil((double) radius / cellSize);

        var neighbors = new ArrayList<ID>();
        if (cellRadius > MAX_WINDOW_RADIUS || cube(2 * cellRadius + 1) > cells.size()) {
            // Fewer occupied cells than cells in the window: scan what exists
            for (var entry : cells.entrySet()) {
                if (center.chebyshevDistance(entry.getKey()) <= cellRadius) {
                    neighbors.addAll(entry.getValue());
                }
            }
            return neighbors;
        }
        for (long dx = -cellRadius; dx <= cellRadius; dx++) {
            for (long dy = -cellRadius; dy <= cellRadius; dy++) {
                for (long dz = -cellRadius; dz <= cellRadius; dz++) {
                    var key = offset(center, dx, dy, dz);
                    if (key == null) {
                        continue;
                    }
                    var members = cells.get(key);
                    if (members != null) {
                        neighbors.addAll(members);
                    }
                }
            }
        }
        return neighbors;
    }

    /**
     * Exact radius query: the conservative result filtered by true distance.
     */
    public List<ID> findNeighborsWithin(Tuple3f point, float radius) {
        var candidates = findNeighbors(point, radius);
        var p = new Point3f(point);
        double radiusSquared = (double) radius * radius;
        candidates.removeIf(id -> positions.get(id).distanceSquared(p) > radiusSquared);
        return candidates;
    }

    /**
     * @return the position a node was built with, or null if the node is not in the grid
     */
    public Point3f positionOf(ID id) {
        var p = positions.get(id);
        return p == null ? null : new Point3f(p);
    }

    /**
     * @return the number of nodes in the grid
     */
    public int size() {
        return positions.size();
    }

    @Override
    public String toString() {
        return String.format("SpatialHashGrid[cellSize=%.2f, nodes=%d, cells=%d]", cellSize, positions.size(),
                             cells.size());
    }

    private List<ID> cellFor(Point3i cell) {
        return cells.computeIfAbsent(cell, k -> new ArrayList<>());
    }

    private static long cube(long n) {
        return n * n * n;
    }

    // Cells past the int range cannot be occupied
    private static Point3i offset(Point3i center, long dx, long dy, long dz) {
        long x = center.x + dx;
        long y = center.y + dy;
        long z = center.z + dz;
        if (x != (int) x || y != (int) y || z != (int) z) {
            return null;
        }
        return new Point3i((int) x, (int) y, (int) z);
    }
}
