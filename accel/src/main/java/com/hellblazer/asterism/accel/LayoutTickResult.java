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

import com.hellblazer.asterism.accel.incremental.RelayoutDecision;

import javax.vecmath.Vector3f;
import java.util.Collections;
import java.util.Map;

/**
 * What one layout tick did.
 *
 * @param mode          the relayout mode that was executed
 * @param forces        net repulsion per node that was laid out; all nodes for FULL, the region for PARTIAL, none for
 *                      NONE
 * @param rebuilt       whether a new spatial snapshot was published
 * @param elapsedMillis wall time of the tick
 * @author hal.hildebrand
 */
public record LayoutTickResult<ID extends NodeId>(RelayoutDecision.Mode mode, Map<ID, Vector3f> forces,
                                                  boolean rebuilt, double elapsedMillis) {

    public LayoutTickResult {
        forces = Collections.unmodifiableMap(forces);
    }
}
