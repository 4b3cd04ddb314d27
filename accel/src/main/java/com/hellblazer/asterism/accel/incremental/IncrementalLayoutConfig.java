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
package com.hellblazer.asterism.accel.incremental;

import com.hellblazer.asterism.accel.InvalidConfigurationException;

import java.util.Objects;

/**
 * Configuration for incremental relayout decisions.
 *
 * <p>Thread-safe and immutable after construction.
 *
 * @author hal.hildebrand
 */
public final class IncrementalLayoutConfig {

    /** Default fraction of affected nodes above which a full relayout is preferred */
    public static final double DEFAULT_RELAYOUT_FRACTION = 0.10;

    /** Default displacement a node must exceed between snapshots to count as moved */
    public static final float DEFAULT_MOVEMENT_THRESHOLD = 10.0f;

    /** Default hop count a partial relayout region extends beyond the affected nodes */
    public static final int DEFAULT_PROPAGATION_DISTANCE = 3;

    private final double relayoutFraction;
    private final float  movementThreshold;
    private final int    propagationDistance;

    /**
     * @param relayoutFraction    fraction of live (not removed) affected nodes, in (0, 1], above which a full relayout
     *                            is chosen
     * @param movementThreshold   non-negative displacement threshold
     * @param propagationDistance non-negative hop count
     * @throws InvalidConfigurationException if parameters are invalid
     */
    public IncrementalLayoutConfig(double relayoutFraction, float movementThreshold, int propagationDistance) {
        if (!Double.isFinite(relayoutFraction) || relayoutFraction <= 0.0 || relayoutFraction > 1.0) {
            throw new InvalidConfigurationException("relayoutFraction must be in (0, 1]: " + relayoutFraction);
        }
        if (!Float.isFinite(movementThreshold) || movementThreshold < 0) {
            throw new InvalidConfigurationException(
            "movementThreshold must be non-negative and finite: " + movementThreshold);
        }
        InvalidConfigurationException.requireNonNegative(propagationDistance, "propagationDistance");

        this.relayoutFraction = relayoutFraction;
        this.movementThreshold = movementThreshold;
        this.propagationDistance = propagationDistance;
    }

    public static IncrementalLayoutConfig defaultConfig() {
        return new IncrementalLayoutConfig(DEFAULT_RELAYOUT_FRACTION, DEFAULT_MOVEMENT_THRESHOLD,
                                           DEFAULT_PROPAGATION_DISTANCE);
    }

    public float movementThreshold() {
        return movementThreshold;
    }

    public int propagationDistance() {
        return propagationDistance;
    }

    public double relayoutFraction() {
        return relayoutFraction;
    }

    public IncrementalLayoutConfig withMovementThreshold(float newThreshold) {
        return new IncrementalLayoutConfig(relayoutFraction, newThreshold, propagationDistance);
    }

    public IncrementalLayoutConfig withPropagationDistance(int newDistance) {
        return new IncrementalLayoutConfig(relayoutFraction, movementThreshold, newDistance);
    }

    public IncrementalLayoutConfig withRelayoutFraction(double newFraction) {
        return new IncrementalLayoutConfig(newFraction, movementThreshold, propagationDistance);
    }

    @Override
    public String toString() {
        return String.format("IncrementalLayoutConfig[relayoutFraction=%.2f, movementThreshold=%.1f, propagation=%d]",
                             relayoutFraction, movementThreshold, propagationDistance);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        var other = (IncrementalLayoutConfig) obj;
        return Double.compare(relayoutFraction, other.relayoutFraction) == 0 &&
               Float.compare(movementThreshold, other.movementThreshold) == 0 &&
               propagationDistance == other.propagationDistance;
    }

    @Override
    public int hashCode() {
        return Objects.hash(relayoutFraction, movementThreshold, propagationDistance);
    }
}
