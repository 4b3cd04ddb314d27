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

/**
 * Available partitioning strategies.
 *
 * @author hal.hildebrand
 */
public enum PartitioningAlgorithm {
    /** Seeded breadth-first growth, round-robin across partitions */
    BREADTH_FIRST,
    /** Size-bounded label propagation, communities packed into partitions */
    LABEL_PROPAGATION;

    PartitioningStrategy strategy() {
        switch (this) {
            case LABEL_PROPAGATION:
                return new LabelPropagationPartitioning();
            default:
                return new BreadthFirstPartitioning();
        }
    }
}
