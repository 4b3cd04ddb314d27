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

import com.hellblazer.asterism.accel.InvalidConfigurationException;
import com.hellblazer.asterism.geometry.Positions;

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;
import java.util.Arrays;
import java.util.Objects;

/**
 * Distance bands for level of detail selection.
 *
 * <p>Four strictly ascending thresholds split distance from the camera into the five {@link LodLevel} bands. The
 * hysteresis factor widens the way back to a nearer band: a node only returns once it is closer than the boundary
 * divided by the factor.
 *
 * <p>Thread-safe and immutable after construction.
 *
 * @author hal.hildebrand
 */
public final class LodConfiguration {

    /** Default band boundaries, in world units */
    private static final float[] DEFAULT_THRESHOLDS = { 100.0f, 500.0f, 1000.0f, 2000.0f };

    public static final boolean DEFAULT_USE_SQUARED_DISTANCES = true;

    /** Default hysteresis (10% margin on the way back to a nearer band) */
    public static final float DEFAULT_HYSTERESIS = 1.1f;

    public static final int THRESHOLD_COUNT = 4;

    private final Point3f cameraPosition;
    private final float[] thresholds;
    private final boolean useSquaredDistances;
    private final float   hysteresis;

    /**
     * Create a new LOD configuration.
     *
     * @param cameraPosition      the point distances are measured from
     * @param thresholds          four strictly ascending positive boundaries
     * @param useSquaredDistances compare squared distances, avoiding the square root per node
     * @param hysteresis          factor greater than 1
     * @throws InvalidConfigurationException if parameters are invalid
     */
    public LodConfiguration(Tuple3f cameraPosition, float[] thresholds, boolean useSquaredDistances,
                            float hysteresis) {
        Objects.requireNonNull(cameraPosition, "cameraPosition cannot be null");
        Objects.requireNonNull(thresholds, "thresholds cannot be null");

        if (!Positions.isFinite(cameraPosition)) {
            throw new InvalidConfigurationException("cameraPosition must be finite: " + cameraPosition);
        }
        if (thresholds.length != THRESHOLD_COUNT) {
            throw new InvalidConfigurationException(
            "Exactly " + THRESHOLD_COUNT + " thresholds required: " + Arrays.toString(thresholds));
        }
        for (int i = 0; i < thresholds.length; i++) {
            InvalidConfigurationException.requirePositive(thresholds[i], "threshold[" + i + "]");
            if (i > 0 && thresholds[i] <= thresholds[i - 1]) {
                throw new InvalidConfigurationException(
                "thresholds must be strictly ascending: " + Arrays.toString(thresholds));
            }
        }
        if (!Float.isFinite(hysteresis) || hysteresis <= 1.0f) {
            throw new InvalidConfigurationException("hysteresis must be greater than 1: " + hysteresis);
        }

        this.cameraPosition = new Point3f(cameraPosition);
        this.thresholds = thresholds.clone();
        this.useSquaredDistances = useSquaredDistances;
        this.hysteresis = hysteresis;
    }

    /**
     * Create a configuration with default values and the camera at the origin.
     *
     * @return a default configuration
     */
    public static LodConfiguration defaultConfig() {
        return new LodConfiguration(new Point3f(), DEFAULT_THRESHOLDS, DEFAULT_USE_SQUARED_DISTANCES,
                                    DEFAULT_HYSTERESIS);
    }

    public Point3f cameraPosition() {
        return new Point3f(cameraPosition);
    }

    public float hysteresis() {
        return hysteresis;
    }

    /**
     * @return a copy of the four band boundaries
     */
    public float[] thresholds() {
        return thresholds.clone();
    }

    public boolean useSquaredDistances() {
        return useSquaredDistances;
    }

    public LodConfiguration withCameraPosition(Tuple3f newCameraPosition) {
        return new LodConfiguration(newCameraPosition, thresholds, useSquaredDistances, hysteresis);
    }

    public LodConfiguration withHysteresis(float newHysteresis) {
        return new LodConfiguration(cameraPosition, thresholds, useSquaredDistances, newHysteresis);
    }

    public LodConfiguration withSquaredDistances(boolean squared) {
        return new LodConfiguration(cameraPosition, thresholds, squared, hysteresis);
    }

    public LodConfiguration withThresholds(float... newThresholds) {
        return new LodConfiguration(cameraPosition, newThresholds, useSquaredDistances, hysteresis);
    }

    @Override
    public String toString() {
        return String.format("LodConfiguration[camera=%s, thresholds=%s, squared=%s, hysteresis=%.2f]",
                             cameraPosition, Arrays.toString(thresholds), useSquaredDistances, hysteresis);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        var other = (LodConfiguration) obj;
        return useSquaredDistances == other.useSquaredDistances &&
               Float.compare(hysteresis, other.hysteresis) == 0 &&
               cameraPosition.equals(other.cameraPosition) &&
               Arrays.equals(thresholds, other.thresholds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cameraPosition, Arrays.hashCode(thresholds), useSquaredDistances, hysteresis);
    }
}
