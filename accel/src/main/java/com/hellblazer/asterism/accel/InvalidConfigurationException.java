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
package com.hellblazer.asterism.accel;

/**
 * Thrown when a structure is constructed with parameters it cannot honor: a non-positive cell size, a Barnes-Hut
 * accuracy at or below zero, a partition minimum above its maximum, and the like. Configuration is validated once,
 * at construction, and never silently clamped.
 *
 * @author hal.hildebrand
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Reject unless the value is finite and strictly positive
     */
    public static float requirePositive(float value, String name) {
        if (!Float.isFinite(value) || value <= 0) {
            throw new InvalidConfigurationException(name + " must be positive and finite: " + value);
        }
        return value;
    }

    /**
     * Reject unless the value is finite and strictly positive
     */
    public static double requirePositive(double value, String name) {
        if (!Double.isFinite(value) || value <= 0) {
            throw new InvalidConfigurationException(name + " must be positive and finite: " + value);
        }
        return value;
    }

    /**
     * Reject negative values
     */
    public static int requireNonNegative(int value, String name) {
        if (value < 0) {
            throw new InvalidConfigurationException(name + " must not be negative: " + value);
        }
        return value;
    }
}
