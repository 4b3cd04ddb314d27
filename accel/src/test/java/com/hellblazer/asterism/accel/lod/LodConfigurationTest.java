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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class LodConfigurationTest {

    @Test
    @DisplayName("Defaults")
    void testDefaults() {
        var config = LodConfiguration.defaultConfig();
        assertArrayEquals(new float[] { 100.0f, 500.0f, 1000.0f, 2000.0f }, config.thresholds());
        assertTrue(config.useSquaredDistances());
        assertEquals(1.1f, config.hysteresis());
        assertEquals(new Point3f(), config.cameraPosition());
    }

    @Test
    @DisplayName("Thresholds are copied in and out")
    void testDefensiveCopies() {
        var thresholds = new float[] { 10.0f, 20.0f, 30.0f, 40.0f };
        var config = LodConfiguration.defaultConfig().withThresholds(thresholds);
        thresholds[0] = 15.0f;
        config.thresholds()[1] = 0.0f;
        assertArrayEquals(new float[] { 10.0f, 20.0f, 30.0f, 40.0f }, config.thresholds());

        var camera = config.cameraPosition();
        camera.x = 99.0f;
        assertEquals(new Point3f(), config.cameraPosition());
    }

    @Test
    @DisplayName("Invalid thresholds and hysteresis are rejected")
    void testValidation() {
        var base = LodConfiguration.defaultConfig();
        assertThrows(InvalidConfigurationException.class, () -> base.withThresholds(100.0f, 500.0f, 1000.0f));
        assertThrows(InvalidConfigurationException.class, () -> base.withThresholds(100.0f, 100.0f, 1000.0f, 2000.0f));
        assertThrows(InvalidConfigurationException.class, () -> base.withThresholds(500.0f, 100.0f, 1000.0f, 2000.0f));
        assertThrows(InvalidConfigurationException.class, () -> base.withThresholds(0.0f, 100.0f, 1000.0f, 2000.0f));
        assertThrows(InvalidConfigurationException.class, () -> base.withHysteresis(1.0f));
        assertThrows(InvalidConfigurationException.class, () -> base.withHysteresis(0.5f));
        assertThrows(InvalidConfigurationException.class, () -> base.withHysteresis(Float.NaN));
        assertThrows(InvalidConfigurationException.class,
                     () -> base.withCameraPosition(new Point3f(Float.POSITIVE_INFINITY, 0, 0)));
    }

    @Test
    @DisplayName("Value equality")
    void testEquality() {
        var a = LodConfiguration.defaultConfig().withHysteresis(1.3f);
        var b = LodConfiguration.defaultConfig().withHysteresis(1.3f);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, b.withSquaredDistances(false));
        assertNotEquals(a, b.withCameraPosition(new Point3f(1, 0, 0)));
        assertTrue(a.toString().contains("hysteresis=1.30"));
    }
}
