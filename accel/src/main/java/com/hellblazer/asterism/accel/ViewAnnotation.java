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

import com.hellblazer.asterism.accel.culling.FrustumCullingStats;
import com.hellblazer.asterism.accel.culling.VisibilityResult;
import com.hellblazer.asterism.accel.lod.LodLevel;
import com.hellblazer.asterism.accel.lod.LodState;
import com.hellblazer.asterism.accel.lod.LodStats;

/**
 * Per node view state produced by a camera update, for the rendering collaborator.
 *
 * @param visibility visibility flags and culling counts
 * @param lodState   the host's level of detail state after the update
 * @param lodStats   distribution of nodes over the detail bands
 * @author hal.hildebrand
 */
public record ViewAnnotation<ID extends NodeId>(VisibilityResult<ID> visibility, LodState<ID> lodState,
                                                LodStats lodStats) {

    public FrustumCullingStats cullingStats() {
        return visibility.stats();
    }

    public boolean isVisible(ID id) {
        return visibility.isVisible(id);
    }

    public LodLevel levelOf(ID id) {
        return lodState.levelOf(id);
    }

    /**
     * @return true if the node is visible and its band draws anything
     */
    public boolean shouldRender(ID id) {
        return isVisible(id) && levelOf(id) != LodLevel.CULLED;
    }
}
