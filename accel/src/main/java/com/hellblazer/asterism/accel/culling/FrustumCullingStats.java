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
package com.hellblazer.asterism.accel.culling;

/**
 * Counts from one culling pass.
 *
 * @param totalNodes   nodes tested
 * @param culledNodes  nodes outside the frustum
 * @param visibleNodes nodes inside or overlapping the frustum
 * @author hal.hildebrand
 */
public record FrustumCullingStats(int totalNodes, int culledNodes, int visibleNodes) {

    public static final FrustumCullingStats EMPTY = new FrustumCullingStats(0, 0, 0);

    /**
     * @return the fraction of nodes culled, 0 when nothing was tested
     */
    public float cullRatio() {
        return totalNodes == 0 ? 0.0f : culledNodes / (float) totalNodes;
    }
}
