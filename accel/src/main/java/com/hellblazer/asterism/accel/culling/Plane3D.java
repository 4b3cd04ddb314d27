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
package com.hellblazer.asterism.accel.culling;

import javax.vecmath.Tuple3f;
import javax.vecmath.Vector3f;

/**
 * A half-space boundary {@code ax + by + cz + d = 0} with a unit normal {@code (a, b, c)} and signed offset
 * {@code d}. Points with a non-negative signed distance lie in the half-space the normal points into.
 *
 * @author hal.hildebrand
 */
public record Plane3D(float a, float b, float c, float d) {

    /**
     * Create a plane from a point and a normal vector
     *
     * @param point  point on the plane
     * @param normal normal vector to the plane (will be normalized)
     * @return the plane
     * @throws IllegalArgumentException if the normal is zero
     */
    public static Plane3D fromPointAndNormal(Tuple3f point, Vector3f normal) {
        if (normal.length() < 1e-6f) {
            throw new IllegalArgumentException("Normal vector cannot be zero");
        }
        var n = new Vector3f(normal);
        n.normalize();
        return new Plane3D(n.x, n.y, n.z, -(n.x * point.x + n.y * point.y + n.z * point.z));
    }

    /**
     * Signed distance from a point to this plane, positive on the side the normal points to
     */
    public float distanceToPoint(Tuple3f point) {
        return distanceToPoint(point.x, point.y, point.z);
    }

    public float distanceToPoint(float x, float y, float z) {
        return a * x + b * y + c * z + d;
    }

    /**
     * Signed distance of the box corner furthest along the normal. Negative means the whole box is behind the plane.
     */
    public float distanceToPositiveVertex(Tuple3f min, Tuple3f max) {
        return distanceToPoint(a >= 0 ? max.x : min.x, b >= 0 ? max.y : min.y, c >= 0 ? max.z : min.z);
    }

    /**
     * Signed distance of the box corner least far along the normal. Non-negative means the whole box is in front of
     * the plane.
     */
    public float distanceToNegativeVertex(Tuple3f min, Tuple3f max) {
        return distanceToPoint(a >= 0 ? min.x : max.x, b >= 0 ? min.y : max.y, c >= 0 ? min.z : max.z);
    }

    /**
     * Get the normal vector of this plane
     *
     * @return normalized normal vector
     */
    public Vector3f getNormal() {
        return new Vector3f(a, b, c);
    }

    @Override
    public String toString() {
        return String.format("Plane3D[%.3fx + %.3fy + %.3fz + %.3f = 0]", a, b, c, d);
    }
}
