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
package com.hellblazer.asterism.geometry;

import javax.vecmath.Tuple3f;

/**
 * Immutable 3D point with integer coordinates. Used as the key of a uniform grid cell: the cell of a position is
 * {@code floor(position / cellSize)} on every axis.
 *
 * @author hal.hildebrand
 */
public final class Point3i {

    /** X coordinate */
    public final int x;

    /** Y coordinate */
    public final int y;

    /** Z coordinate */
    public final int z;

    /**
     * Create a new 3D integer point.
     *
     * @param x X coordinate
     * @param y Y coordinate
     * @param z Z coordinate
     */
    public Point3i(int x, int y, int z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    /**
     * The cell containing a position for the given cell size. Coordinates beyond the int range saturate.
     *
     * @param position the position, must be finite
     * @param cellSize the edge length of a cell, must be positive
     * @return the cell coordinates
     */
    public static Point3i cellOf(Tuple3f position, float cellSize) {
        return new Point3i(cellCoordinate(position.x, cellSize), cellCoordinate(position.y, cellSize),
                           cellCoordinate(position.z, cellSize));
    }

    /**
     * The cell index of a single coordinate.
     */
    public static int cellCoordinate(float value, float cellSize) {
        return (int) Math.floor((double) value / cellSize);
    }

    /**
     * Calculate the Chebyshev (chessboard) distance to another point, i.e. the number of cell rings separating two
     * cells.
     *
     * @param other Other point
     * @return max(|dx|, |dy|, |dz|)
     */
    public long chebyshevDistance(Point3i other) {
        long dx = Math.abs((long) x - other.x);
        long dy = Math.abs((long) y - other.y);
        long dz = Math.abs((long) z - other.z);
        return Math.max(dx, Math.max(dy, dz));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Point3i other)) return false;
        return x == other.x && y == other.y && z == other.z;
    }

    @Override
    public int hashCode() {
        // Spread neighbouring cells across buckets
        int h = x * 73856093;
        h ^= y * 19349663;
        h ^= z * 83492791;
        return h;
    }

    @Override
    public String toString() {
        return String.format("Point3i(%d, %d, %d)", x, y, z);
    }
}
