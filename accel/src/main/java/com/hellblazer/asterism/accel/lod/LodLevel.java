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
package com.hellblazer.asterism.accel.lod;

/**
 * Detail bands ordered from nearest to farthest. The ordinal is the band index used by the selector's threshold
 * table.
 *
 * @author hal.hildebrand
 */
public enum LodLevel {
    /** Full detail, close to the camera */
    HIGH(1.0f, 1.0f),
    MEDIUM(0.5f, 0.3f),
    LOW(0.25f, 0.1f),
    /** Very far; a point or impostor */
    MINIMAL(0.1f, 0.05f),
    /** Beyond the last threshold, not rendered */
    CULLED(0.0f, 0.0f);

    private final float complexityFactor;
    private final float vertexMultiplier;

    LodLevel(float complexityFactor, float vertexMultiplier) {
        this.complexityFactor = complexityFactor;
        this.vertexMultiplier = vertexMultiplier;
    }

    /**
     * @return the level for a band index in [0, 4]
     */
    public static LodLevel fromIndex(int index) {
        var values = values();
        if (index < 0 || index >= values.length) {
            throw new IllegalArgumentException("No LOD level with index: " + index);
        }
        return values[index];
    }

    /**
     * @return the rendering complexity relative to full detail, in [0, 1]
     */
    public float complexityFactor() {
        return complexityFactor;
    }

    public int index() {
        return ordinal();
    }

    public boolean rendersEdges() {
        return this == HIGH || this == MEDIUM;
    }

    public boolean rendersLabels() {
        return this == HIGH;
    }

    /**
     * @return the mesh simplification multiplier applied to vertex counts
     */
    public float vertexMultiplier() {
        return vertexMultiplier;
    }
}
