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

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;
import javax.vecmath.Vector3f;
import java.util.Objects;

/**
 * Perspective view frustum derived from a {@link CameraState}: six planes whose normals point into the visible
 * region. A point is visible when its signed distance to every plane is non-negative.
 *
 * <p>Immutable. The planes reflect the camera at construction only; when the camera moves the host builds a new
 * frustum, nothing here tracks staleness.
 *
 * @author hal.hildebrand
 */
public final class ViewFrustum {

    public final Plane3D nearPlane;
    public final Plane3D farPlane;
    public final Plane3D leftPlane;
    public final Plane3D rightPlane;
    public final Plane3D topPlane;
    public final Plane3D bottomPlane;

    private final CameraState camera;
    private final Plane3D[]   planes;

    private ViewFrustum(CameraState camera, Plane3D nearPlane, Plane3D farPlane, Plane3D leftPlane,
                        Plane3D rightPlane, Plane3D topPlane, Plane3D bottomPlane) {
        this.camera = camera;
        this.nearPlane = nearPlane;
        this.farPlane = farPlane;
        this.leftPlane = leftPlane;
        this.rightPlane = rightPlane;
        this.topPlane = topPlane;
        this.bottomPlane = bottomPlane;
        this.planes = new Plane3D[] { nearPlane, farPlane, leftPlane, rightPlane, topPlane, bottomPlane };
    }

    /**
     * Derive the frustum of a camera
     *
     * @param camera validated camera parameters
     * @return the frustum
     */
    public static ViewFrustum from(CameraState camera) {
        Objects.requireNonNull(camera, "camera cannot be null");
        var eye = camera.position();

        var forward = new Vector3f(camera.forward());
        forward.normalize();

        var right = new Vector3f();
        right.cross(forward, camera.up());
        right.normalize();

        // Recalculate up to ensure orthogonality
        var up = new Vector3f();
        up.cross(right, forward);
        up.normalize();

        float tanV = (float) Math.tan(camera.fov() / 2.0f);
        float tanH = tanV * camera.aspect();

        var nearCenter = new Point3f(eye);
        nearCenter.scaleAdd(camera.near(), forward, eye);
        var farCenter = new Point3f(eye);
        farCenter.scaleAdd(camera.far(), forward, eye);

        var backward = new Vector3f(forward);
        backward.negate();

        var nearPlane = Plane3D.fromPointAndNormal(nearCenter, forward);
        var farPlane = Plane3D.fromPointAndNormal(farCenter, backward);

        // Side planes pass through the eye; each normal is the cross of the up/right axis with an edge direction
        var rightPlane = Plane3D.fromPointAndNormal(eye, cross(up, edge(forward, right, tanH)));
        var leftPlane = Plane3D.fromPointAndNormal(eye, cross(edge(forward, right, -tanH), up));
        var topPlane = Plane3D.fromPointAndNormal(eye, cross(edge(forward, up, tanV), right));
        var bottomPlane = Plane3D.fromPointAndNormal(eye, cross(right, edge(forward, up, -tanV)));

        return new ViewFrustum(camera, nearPlane, farPlane, leftPlane, rightPlane, topPlane, bottomPlane);
    }

    private static Vector3f cross(Vector3f a, Vector3f b) {
        var result = new Vector3f();
        result.cross(a, b);
        return result;
    }

    private static Vector3f edge(Vector3f forward, Vector3f axis, float slope) {
        var result = new Vector3f(forward);
        result.scaleAdd(slope, axis, forward);
        return result;
    }

    public CameraState camera() {
        return camera;
    }

    /**
     * Test if an axis-aligned box lies entirely inside the frustum
     */
    public boolean containsAABB(Tuple3f min, Tuple3f max) {
        for (var plane : planes) {
            if (plane.distanceToNegativeVertex(min, max) < 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Test if a point is inside the frustum: non-negative signed distance to all six planes
     */
    public boolean containsPoint(Tuple3f point) {
        for (var plane : planes) {
            if (plane.distanceToPoint(point) < 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Test if a sphere is inside or partially overlaps the frustum
     */
    public boolean containsSphere(Tuple3f center, float radius) {
        for (var plane : planes) {
            if (plane.distanceToPoint(center) < -radius) {
                return false;
            }
        }
        return true;
    }

    /**
     * Classify a sphere against the frustum
     */
    public VisibilityType classifySphere(Tuple3f center, float radius) {
        var result = VisibilityType.INSIDE;
        for (var plane : planes) {
            float distance = plane.distanceToPoint(center);
            if (distance < -radius) {
                return VisibilityType.OUTSIDE;
            }
            if (distance < radius) {
                result = VisibilityType.INTERSECTING;
            }
        }
        return result;
    }

    /**
     * Get all six planes of the frustum
     *
     * @return near, far, left, right, top, bottom
     */
    public Plane3D[] getPlanes() {
        return planes.clone();
    }

    /**
     * Conservative box test: per plane only the corner furthest along the normal is checked, the box is reported
     * visible when no plane has that corner behind it. Boxes near frustum corners may be reported visible though
     * they are not.
     */
    public boolean intersectsAABB(Tuple3f min, Tuple3f max) {
        for (var plane : planes) {
            if (plane.distanceToPositiveVertex(min, max) < 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return String.format("ViewFrustum[near=%s, far=%s, left=%s, right=%s, top=%s, bottom=%s]", nearPlane, farPlane,
                             leftPlane, rightPlane, topPlane, bottomPlane);
    }
}
