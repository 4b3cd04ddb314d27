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

import com.hellblazer.asterism.accel.lod.LodStats;

/**
 * Engine counters for monitoring.
 *
 * @param totalNodes       nodes in the last layout tick or camera update
 * @param visibleNodes     nodes visible after the last camera update
 * @param lodDistribution  nodes per detail band after the last camera update
 * @param layoutTimeMillis wall time of the last layout tick
 * @param rebuilds         spatial snapshots published so far
 * @author hal.hildebrand
 */
public record GraphPerformanceStats(int totalNodes, int visibleNodes, LodStats lodDistribution,
                                    double layoutTimeMillis, long rebuilds) {

    public static final GraphPerformanceStats EMPTY = new GraphPerformanceStats(0, 0, LodStats.EMPTY, 0.0, 0);

    public GraphPerformanceStats withLayout(int total, double millis, long rebuildCount) {
        return new GraphPerformanceStats(total, visibleNodes, lodDistribution, millis, rebuildCount);
    }

    public GraphPerformanceStats withView(int total, int visible, LodStats distribution) {
        return new GraphPerformanceStats(total, visible, distribution, layoutTimeMillis, rebuilds);
    }
}
