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
import java.util.Map;
import java.util.Objects;

/**
 * Ingestion guards for positions. A NaN or infinite coordinate would corrupt bounding boxes and mass aggregates
 * beyond repair, so it is rejected where positions enter a structure rather than propagated.
 *
 * @author hal.hildebrand
 */
public final class Positions {

    private Positions() {
    }

    public static boolean isFinite(Tuple3f p) {
        return Float.isFinite(p.x) && Float.isFinite(p.y) && Float.isFinite(p.z);
    }

    /**
     * @throws IllegalArgumentException if any coordinate is NaN or infinite
     */
    public static <T extends Tuple3f> T requireFinite(T p, String paramName) {
        Objects.requireNonNull(p, paramName + " cannot be null");
        if (!isFinite(p)) {
            throw new IllegalArgumentException(paramName + " must have finite coordinates, got: " + p);
        }
        return p;
    }

    /**
     * @throws IllegalArgumentException if the value is NaN or infinite
     */
    public static float requireFinite(float value, String paramName) {
        if (!Float.isFinite(value)) {
            throw new IllegalArgumentException(paramName + " must be finite, got: " + value);
        }
        return value;
    }

    /**
     * Validate every position of a snapshot
     *
     * @throws IllegalArgumentException naming the first key with a non-finite position
     */
    public static <K, T extends Tuple3f> Map<K, T> requireAllFinite(Map<K, T> positions) {
        Objects.requireNonNull(positions, "positions cannot be null");
        for (var entry : positions.entrySet()) {
            var p = entry.getValue();
            if (p == null || !isFinite(p)) {
                throw new IllegalArgumentException("Position of " + entry.getKey() + " must be finite, got: " + p);
            }
        }
        return positions;
    }
}
