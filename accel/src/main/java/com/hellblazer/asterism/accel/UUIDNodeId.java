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
import java.util.UUID;

/**
 * UUID-based node identifier, for hosts whose domain model already assigns globally unique ids to nodes.
 *
 * @author hal.hildebrand
 */
public final class UUIDNodeId implements NodeId {
    private final UUID id;

    public UUIDNodeId() {
        this(UUID.randomUUID());
    }

    public UUIDNodeId(UUID id) {
        this.id = Objects.requireNonNull(id, "UUID cannot be null");
    }

    public UUIDNodeId(String uuid) {
        this(UUID.fromString(uuid));
    }

    public UUID getValue() {
        return id;
    }

    @Override
    public String toDebugString() {
        return "Node[" + id + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UUIDNodeId that)) return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return id.toString();
    }
}
