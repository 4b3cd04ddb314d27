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
 * Distribution of nodes over the detail bands.
 *
 * @author hal.hildebrand
 */
public record LodStats(int high, int medium, int low, int minimal, int culled) {

    public static final LodStats EMPTY = new LodStats(0, 0, 0, 0, 0);

    public static LodStats of(Iterable<LodLevel> levels) {
        var counts = new int[LodLevel.values().length];
        for (var level : levels) {
            counts[level.index()]++;
        }
        return new LodStats(counts[0], counts[1], counts[2], counts[3], counts[4]);
    }

    public int count(LodLevel level) {
        switch (level) {
            case HIGH:
                return high;
            case MEDIUM:
                return medium;
            case LOW:
                return low;
            case MINIMAL:
                return minimal;
            default:
                return culled;
        }
    }

    public int total() {
        return high + medium + low + minimal + culled;
    }

    /**
     * @return nodes in a band that is drawn at all
     */
    public int rendered() {
        return total() - culled;
    }
}
