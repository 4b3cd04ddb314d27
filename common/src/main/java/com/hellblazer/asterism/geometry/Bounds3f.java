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

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;

/**
 * Axis-aligned bounding box. Octants are numbered with bit 0 selecting the upper X half, bit 1 the upper Y half and
 * bit 2 the upper Z half; a coordinate strictly greater than the center selects the upper half.
 *
 * @author hal.hildebrand
 */
public record Bounds3f(float minX, float minY, float minZ, float maxX, float maxY, float maxZ) {

    /**
     * The unit box at the origin, used where no positions exist to bound.
     */
    public static final Bounds3f UNIT = new Bounds3f(0, 0, 0, 1, 1, 1);

    public Bounds3f {
        if (minX > maxX || minY > maxY || minZ > maxZ) {
            throw new IllegalArgumentException(
            "Inverted bounds: [" + minX + ", " + minY + ", " + minZ + "] -> [" + maxX + ", " + maxY + ", " + maxZ
            + "]");
        }
    }

    /**
     * The tightest box containing every point, or {@link #UNIT} when there are none
     */
    public static Bounds3f enclosing(Iterable<? extends Tuple3f> points) {
        float minX = Float.POSITIVE_INFINITY, minY = Float.POSITIVE_INFINITY, minZ = Float.POSITIVE_INFINITY;
        float maxX = Float.NEGATIVE_INFINITY, maxY = Float.NEGATIVE_INFINITY, maxZ = Float.NEGATIVE_INFINITY;
        boolean any = false;
        for (var p : points) {
            any = true;
            minX = Math.min(minX, p.x);
            minY = Math.min(minY, p.y);
            minZ = Math.min(minZ, p.z);
            maxX = Math.max(maxX, p.x);
            maxY = Math.max(maxY, p.y);
            maxZ = Math.max(maxZ, p.z);
        }
        if (!any) {
            return UNIT;
        }
        return new Bounds3f(minX, minY, minZ, maxX, maxY, maxZ);
    }

    /**
     * Grow the box by the given amount on every side
     */
    public Bounds3f padded(float padding) {
        return new Bounds3f(minX - padding, minY - padding, minZ - padding, maxX + padding, maxY + padding,
                            maxZ + padding);
    }

    public Point3f center() {
        return new Point3f(centerX(), centerY(), centerZ());
    }

    public float centerX() {
        return (minX + maxX) * 0.5f;
    }

    public float centerY() {
        return (minY + maxY) * 0.5f;
    }

    public float centerZ() {
        return (minZ + maxZ) * 0.5f;
    }

    /**
     * Length of the main diagonal
     */
    public float diagonal() {
        float dx = maxX - minX;
        float dy = maxY - minY;
        float dz = maxZ - minZ;
        return (float) Math.sqrt(dx * dx + dy * dy + dz * dz);
    }

    /**
     * The largest extent across all dimensions
     */
    public float maxExtent() {
        return Math.max(Math.max(maxX - minX, maxY - minY), maxZ - minZ);
    }

    public boolean contains(Tuple3f p) {
        return contains(p.x, p.y, p.z);
    }

    public boolean contains(float x, float y, float z) {
        return x >= minX && x <= maxX && y >= minY && y <= maxY && z >= minZ && z <= maxZ;
    }

    /**
     * @return the octant index [0, 8) of the point relative to the center of this box
     */
    public int octant(Tuple3f p) {
        int octant = 0;
        if (p.x > centerX()) {
            octant |= 1;
        }
        if (p.y > centerY()) {
            octant |= 2;
        }
        if (p.z > centerZ()) {
            octant |= 4;
        }
        return octant;
    }

    /**
     * @return the bounds of the given octant of this box
     */
    public Bounds3f child(int octant) {
        if (octant < 0 || octant > 7) {
            throw new IllegalArgumentException("Octant must be in [0, 8): " + octant);
        }
        float cx = centerX(), cy = centerY(), cz = centerZ();
        return new Bounds3f((octant & 1) == 0 ? minX : cx, (octant & 2) == 0 ? minY : cy,
                            (octant & 4) == 0 ? minZ : cz, (octant & 1) == 0 ? cx : maxX,
                            (octant & 2) == 0 ? cy : maxY, (octant & 4) == 0 ? cz : maxZ);
    }
}
