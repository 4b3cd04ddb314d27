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
package com.hellblazer.asterism.accel.partition;

import com.hellblazer.asterism.accel.InvalidConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class PartitioningConfigTest {

    @Test
    @DisplayName("Defaults")
    void testDefaults() {
        var config = PartitioningConfig.defaultConfig();
        assertEquals(0, config.targetPartitions());
        assertEquals(10, config.minPartitionSize());
        assertEquals(1000, config.maxPartitionSize());
        assertEquals(PartitioningAlgorithm.BREADTH_FIRST, config.algorithm());
        assertFalse(config.minimizeEdgeCut());
    }

    @Test
    @DisplayName("Partition count resolution")
    void testResolvePartitionCount() {
        var auto = PartitioningConfig.defaultConfig().withMinPartitionSize(0).withMaxPartitionSize(10);
        assertEquals(0, auto.resolvePartitionCount(0));
        assertEquals(1, auto.resolvePartitionCount(1));
        assertEquals(1, auto.resolvePartitionCount(10));
        assertEquals(2, auto.resolvePartitionCount(11));
        assertEquals(100, auto.resolvePartitionCount(1000));

        var fixed = auto.withTargetPartitions(8);
        assertEquals(8, fixed.resolvePartitionCount(1000));
        assertEquals(5, fixed.resolvePartitionCount(5));
    }

    @Test
    @DisplayName("Invalid sizes are rejected")
    void testValidation() {
        var base = PartitioningConfig.defaultConfig();
        assertThrows(InvalidConfigurationException.class, () -> base.withMaxPartitionSize(0));
        assertThrows(InvalidConfigurationException.class, () -> base.withMaxPartitionSize(5));
        assertThrows(InvalidConfigurationException.class, () -> base.withMinPartitionSize(-1));
        assertThrows(InvalidConfigurationException.class, () -> base.withTargetPartitions(-2));
        assertThrows(NullPointerException.class, () -> base.withAlgorithm(null));
    }

    @Test
    @DisplayName("Value equality")
    void testEquality() {
        var a = PartitioningConfig.defaultConfig().withTargetPartitions(4);
        var b = PartitioningConfig.defaultConfig().withTargetPartitions(4);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, b.withAlgorithm(PartitioningAlgorithm.LABEL_PROPAGATION));
        assertTrue(a.toString().contains("target=4"));
    }
}
