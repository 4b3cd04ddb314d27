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

import com.hellblazer.asterism.accel.InvalidConfigurationException;
import com.hellblazer.asterism.geometry.Positions;

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;
import java.util.Objects;

/**
 * Camera parameters supplied by the host whenever the viewpoint changes.
 *
 * @param position    the eye position
 * @param forward     viewing direction, need not be unit length
 * @param up          approximate up direction, must not be parallel to forward
 * @param fov         vertical field of view in radians, in (0, π)
 * @param aspect      width / height, positive
 * @param near        distance to the near clipping plane, positive
 * @param far         distance to the far clipping plane, greater than near
 * @author hal.hildebrand
 */
public record CameraState(Point3f position, Vector3f forward, Vector3f up, float fov, float aspect, float near,
                          float far) {

    public CameraState {
        Objects.requireNonNull(position, "position cannot be null");
        Objects.requireNonNull(forward, "forward cannot be null");
        Objects.requireNonNull(up, "up cannot be null");
        if (!Positions.isFinite(position) || !Positions.isFinite(forward) || !Positions.isFinite(up)) {
            throw new InvalidConfigurationException("Camera vectors must be finite");
        }
        if (forward.length() < 1e-6f) {
            throw new InvalidConfigurationException("Forward vector cannot be zero");
        }
        if (up.length() < 1e-6f) {
            throw new InvalidConfigurationException("Up vector cannot be zero");
        }
        var cross = new Vector3f();
        cross.cross(forward, up);
        if (cross.length() < 1e-6f * forward.length() * up.length()) {
            throw new InvalidConfigurationException("Up vector cannot be parallel to forward: " + forward + ", " + up);
        }
        if (!(fov > 0) || fov >= Math.PI) {
            throw new InvalidConfigurationException("Field of view must be between 0 and π radians: " + fov);
        }
        InvalidConfigurationException.requirePositive(aspect, "aspect");
        InvalidConfigurationException.requirePositive(near, "near");
        InvalidConfigurationException.requirePositive(far, "far");
        if (far <= near) {
            throw new InvalidConfigurationException("Far distance must be greater than near distance: " + near
                                                    + " >= " + far);
        }
        position = new Point3f(position);
        forward = new Vector3f(forward);
        up = new Vector3f(up);
    }

    /**
     * A camera at {@code position} looking at {@code target}
     */
    public static CameraState lookAt(Point3f position, Point3f target, Vector3f up, float fov, float aspect,
                                     float near, float far) {
        var forward = new Vector3f();
        forward.sub(target, position);
        return new CameraState(position, forward, up, fov, aspect, near, far);
    }

    /**
     * The same camera moved to a new position
     */
    public CameraState withPosition(Point3f newPosition) {
        return new CameraState(newPosition, forward, up, fov, aspect, near, far);
    }
}
