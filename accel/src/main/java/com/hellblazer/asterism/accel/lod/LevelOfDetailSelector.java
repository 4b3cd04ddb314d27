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

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;
import java.util.Objects;

/**
 * Assigns detail bands by distance from the camera. Moving to a farther band takes effect immediately; moving to a
 * nearer band requires the node to be closer than the current band's inner boundary divided by the hysteresis factor,
 * which keeps nodes hovering at a boundary from flickering between bands.
 *
 * <p>In squared mode the node's squared distance is compared against squared boundaries and against
 * {@code (boundary / hysteresis)²}, so the decisions are the same as in linear mode.
 *
 * <p>Immutable and thread-safe; {@link #update} is a pure function, so distinct nodes may be updated in parallel.
 *
 * @author hal.hildebrand
 */
public final class LevelOfDetailSelector {

    private final LodConfiguration configuration;
    private final Point3f          camera;
    private final float[]          bandLimits;
    private final float[]          returnLimits;
    private final boolean          squared;

    public LevelOfDetailSelector(LodConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration cannot be null");
        this.camera = configuration.cameraPosition();
        this.squared = configuration.useSquaredDistances();

        var thresholds = configuration.thresholds();
        float h = configuration.hysteresis();
        bandLimits = new float[thresholds.length];
        returnLimits = new float[thresholds.length];
        for (int i = 0; i < thresholds.length; i++) {
            float back = thresholds[i] / h;
            bandLimits[i] = squared ? thresholds[i] * thresholds[i] : thresholds[i];
            returnLimits[i] = squared ? back * back : back;
        }
    }

    public LodConfiguration configuration() {
        return configuration;
    }

    /**
     * The band of a linear distance, ignoring hysteresis
     */
    public LodLevel select(float distance) {
        return band(squared ? distance * distance : distance);
    }

    /**
     * The band of a position, ignoring hysteresis
     */
    public LodLevel selectFor(Tuple3f position) {
        return band(metric(position));
    }

    /**
     * Compute the level a node should hold this frame
     *
     * @param position the node position
     * @param current  the level the node held last frame
     * @return the new level, which may equal {@code current}
     */
    public LodLevel update(Tuple3f position, LodLevel current) {
        return decide(metric(position), current);
    }

    /**
     * Compute the level for a linear distance given last frame's level
     */
    public LodLevel update(float distance, LodLevel current) {
        return decide(squared ? distance * distance : distance, current);
    }

    private LodLevel band(float metric) {
        for (int i = 0; i < bandLimits.length; i++) {
            if (metric < bandLimits[i]) {
                return LodLevel.fromIndex(i);
            }
        }
        return LodLevel.CULLED;
    }

    private LodLevel decide(float metric, LodLevel current) {
        Objects.requireNonNull(current, "current cannot be null");
        var candidate = band(metric);
        if (candidate == current || candidate.index() > current.index()) {
            return candidate;
        }
        // Closer: only once past the current band's inner boundary shrunk by hysteresis
        return metric < returnLimits[current.index() - 1] ? candidate : current;
    }

    private float metric(Tuple3f position) {
        float dx = position.x - camera.x;
        float dy = position.y - camera.y;
        float dz = position.z - camera.z;
        float d2 = dx * dx + dy * dy + dz * dz;
        return squared ? d2 : (float) Math.sqrt(d2);
    }
}
