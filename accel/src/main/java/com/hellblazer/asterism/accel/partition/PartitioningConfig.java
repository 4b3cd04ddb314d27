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

import java.util.Objects;

/**
 * Configuration options for graph partitioning.
 *
 * <p>A target partition count of zero selects the count automatically as {@code ceil(n / maxPartitionSize)}.
 *
 * <p>Thread-safe and immutable after construction.
 *
 * @author hal.hildebrand
 */
public final class PartitioningConfig {

    /** Default target partition count (automatic) */
    public static final int DEFAULT_TARGET_PARTITIONS = 0;

    public static final int DEFAULT_MIN_PARTITION_SIZE = 10;

    public static final int DEFAULT_MAX_PARTITION_SIZE = 1000;

    public static final PartitioningAlgorithm DEFAULT_ALGORITHM = PartitioningAlgorithm.BREADTH_FIRST;

    public static final boolean DEFAULT_MINIMIZE_EDGE_CUT = false;

    private final int                   targetPartitions;
    private final int                   minPartitionSize;
    private final int                   maxPartitionSize;
    private final PartitioningAlgorithm algorithm;
    private final boolean               minimizeEdgeCut;

    /**
     * Create a new partitioning configuration.
     *
     * @param targetPartitions the number of partitions, 0 for automatic
     * @param minPartitionSize the smallest size refinement may shrink a partition to
     * @param maxPartitionSize the largest size a partition may grow to
     * @param algorithm        the strategy to use
     * @param minimizeEdgeCut  run boundary refinement after the initial assignment
     * @throws InvalidConfigurationException if parameters are invalid
     */
    public PartitioningConfig(int targetPartitions, int minPartitionSize, int maxPartitionSize,
                              PartitioningAlgorithm algorithm, boolean minimizeEdgeCut) {
        Objects.requireNonNull(algorithm, "algorithm cannot be null");

        InvalidConfigurationException.requireNonNegative(targetPartitions, "targetPartitions");
        InvalidConfigurationException.requireNonNegative(minPartitionSize, "minPartitionSize");
        if (maxPartitionSize <= 0) {
            throw new InvalidConfigurationException("maxPartitionSize must be positive: " + maxPartitionSize);
        }
        if (minPartitionSize > maxPartitionSize) {
            throw new InvalidConfigurationException(
            "minPartitionSize " + minPartitionSize + " exceeds maxPartitionSize " + maxPartitionSize);
        }

        this.targetPartitions = targetPartitions;
        this.minPartitionSize = minPartitionSize;
        this.maxPartitionSize = maxPartitionSize;
        this.algorithm = algorithm;
        this.minimizeEdgeCut = minimizeEdgeCut;
    }

    /**
     * Create a configuration with default values.
     *
     * @return a default configuration
     */
    public static PartitioningConfig defaultConfig() {
        return new PartitioningConfig(DEFAULT_TARGET_PARTITIONS, DEFAULT_MIN_PARTITION_SIZE,
                                      DEFAULT_MAX_PARTITION_SIZE, DEFAULT_ALGORITHM, DEFAULT_MINIMIZE_EDGE_CUT);
    }

    public PartitioningAlgorithm algorithm() {
        return algorithm;
    }

    public int maxPartitionSize() {
        return maxPartitionSize;
    }

    public boolean minimizeEdgeCut() {
        return minimizeEdgeCut;
    }

    public int minPartitionSize() {
        return minPartitionSize;
    }

    /**
     * Resolve the partition count for a graph of {@code nodeCount} nodes: the target, or {@code ceil(n / max)} when
     * automatic, never more than the node count and at least one for a non-empty graph.
     */
    public int resolvePartitionCount(int nodeCount) {
        if (nodeCount == 0) {
            return 0;
        }
        int k = targetPartitions > 0 ? targetPartitions
                                     : (int) ((nodeCount + (long) maxPartitionSize - 1) / maxPartitionSize);
        return Math.max(1, Math.min(k, nodeCount));
    }

    public int targetPartitions() {
        return targetPartitions;
    }

    public PartitioningConfig withAlgorithm(PartitioningAlgorithm newAlgorithm) {
        return new PartitioningConfig(targetPartitions, minPartitionSize, maxPartitionSize, newAlgorithm,
                                      minimizeEdgeCut);
    }

    public PartitioningConfig withMaxPartitionSize(int newMax) {
        return new PartitioningConfig(targetPartitions, minPartitionSize, newMax, algorithm, minimizeEdgeCut);
    }

    public PartitioningConfig withMinimizeEdgeCut(boolean minimize) {
        return new PartitioningConfig(targetPartitions, minPartitionSize, maxPartitionSize, algorithm, minimize);
    }

    public PartitioningConfig withMinPartitionSize(int newMin) {
        return new PartitioningConfig(targetPartitions, newMin, maxPartitionSize, algorithm, minimizeEdgeCut);
    }

    public PartitioningConfig withTargetPartitions(int newTarget) {
        return new PartitioningConfig(newTarget, minPartitionSize, maxPartitionSize, algorithm, minimizeEdgeCut);
    }

    @Override
    public String toString() {
        return String.format("PartitioningConfig[target=%d, min=%d, max=%d, algorithm=%s, minimizeEdgeCut=%s]",
                             targetPartitions, minPartitionSize, maxPartitionSize, algorithm, minimizeEdgeCut);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        var other = (PartitioningConfig) obj;
        return targetPartitions == other.targetPartitions &&
               minPartitionSize == other.minPartitionSize &&
               maxPartitionSize == other.maxPartitionSize &&
               algorithm == other.algorithm &&
               minimizeEdgeCut == other.minimizeEdgeCut;
    }

    @Override
    public int hashCode() {
        return Objects.hash(targetPartitions, minPartitionSize, maxPartitionSize, algorithm, minimizeEdgeCut);
    }
}
