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

import java.util.Objects;

/**
 * An undirected graph edge between two nodes. Self-loops are permitted.
 *
 * @param <ID> the node ID type
 * @author hal.hildebrand
 */
public record Edge<ID extends NodeId>(ID source, ID target) {

    public Edge {
        Objects.requireNonNull(source, "source cannot be null");
        Objects.requireNonNull(target, "target cannot be null");
    }

    public static <ID extends NodeId> Edge<ID> of(ID source, ID target) {
        return new Edge<>(source, target);
    }

    public boolean isSelfLoop() {
        return source.equals(target);
    }

    /**
     * @return the endpoint opposite {@code node}, or null if the edge does not touch it
     */
    public ID opposite(ID node) {
        if (source.equals(node)) {
            return target;
        }
        if (target.equals(node)) {
            return source;
        }
        return null;
    }
}
