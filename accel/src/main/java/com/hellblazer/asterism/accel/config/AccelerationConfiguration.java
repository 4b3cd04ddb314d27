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
package com.hellblazer.asterism.accel.config;

import com.hellblazer.asterism.accel.InvalidConfigurationException;
import com.hellblazer.asterism.accel.incremental.IncrementalLayoutConfig;
import com.hellblazer.asterism.accel.lod.LodConfiguration;
import com.hellblazer.asterism.accel.partition.PartitioningConfig;

import java.util.Objects;

/**
 * Configuration of the whole acceleration engine: force approximation, neighbor grid, culling, level of detail,
 * partitioning and incremental relayout, each of the optional stages with its own toggle.
 *
 * <p>Thread-safe and immutable after construction.
 *
 * @author hal.hildebrand
 */
public final class AccelerationConfiguration {

    /** Default Barnes-Hut accuracy */
    public static final float DEFAULT_THETA = 0.5f;

    /** Default repulsion constant: the square of an ideal spring length of 100 */
    public static final float DEFAULT_REPULSION_STRENGTH = 10_000.0f;

    public static final float DEFAULT_GRID_CELL_SIZE = 50.0f;

    public static final float DEFAULT_NODE_RADIUS = 10.0f;

    private final float                   theta;
    private final float                   repulsionStrength;
    private final float                   gridCellSize;
    private final float                   nodeRadius;
    private final LodConfiguration        lod;
    private final PartitioningConfig      partitioning;
    private final IncrementalLayoutConfig incremental;
    private final boolean                 spatialAcceleration;
    private final boolean                 frustumCulling;
    private final boolean                 levelOfDetail;
    private final boolean                 incrementalLayout;

    /**
     * @throws InvalidConfigurationException if any scalar is out of range
     */
    public AccelerationConfiguration(float theta, float repulsionStrength, float gridCellSize, float nodeRadius,
                                     LodConfiguration lod, PartitioningConfig partitioning,
                                     IncrementalLayoutConfig incremental, boolean spatialAcceleration,
                                     boolean frustumCulling, boolean levelOfDetail, boolean incrementalLayout) {
        Objects.requireNonNull(lod, "lod cannot be null");
        Objects.requireNonNull(partitioning, "partitioning cannot be null");
        Objects.requireNonNull(incremental, "incremental cannot be null");

        InvalidConfigurationException.requirePositive(theta, "theta");
        InvalidConfigurationException.requirePositive(gridCellSize, "gridCellSize");
        if (!Float.isFinite(repulsionStrength) || repulsionStrength < 0) {
            throw new InvalidConfigurationException(
            "repulsionStrength must be non-negative and finite: " + repulsionStrength);
        }
        if (!Float.isFinite(nodeRadius) || nodeRadius < 0) {
            throw new InvalidConfigurationException("nodeRadius must be non-negative and finite: " + nodeRadius);
        }

        this.theta = theta;
        this.repulsionStrength = repulsionStrength;
        this.gridCellSize = gridCellSize;
        this.nodeRadius = nodeRadius;
        this.lod = lod;
        this.partitioning = partitioning;
        this.incremental = incremental;
        this.spatialAcceleration = spatialAcceleration;
        this.frustumCulling = frustumCulling;
        this.levelOfDetail = levelOfDetail;
        this.incrementalLayout = incrementalLayout;
    }

    /**
     * Create a configuration with default values and every stage enabled.
     *
     * @return a default configuration
     */
    public static AccelerationConfiguration defaultConfig() {
        return new AccelerationConfiguration(DEFAULT_THETA, DEFAULT_REPULSION_STRENGTH, DEFAULT_GRID_CELL_SIZE,
                                             DEFAULT_NODE_RADIUS, LodConfiguration.defaultConfig(),
                                             PartitioningConfig.defaultConfig(),
                                             IncrementalLayoutConfig.defaultConfig(), true, true, true, true);
    }

    public boolean frustumCulling() {
        return frustumCulling;
    }

    public float gridCellSize() {
        return gridCellSize;
    }

    public IncrementalLayoutConfig incremental() {
        return incremental;
    }

    public boolean incrementalLayout() {
        return incrementalLayout;
    }

    public boolean levelOfDetail() {
        return levelOfDetail;
    }

    public LodConfiguration lod() {
        return lod;
    }

    public float nodeRadius() {
        return nodeRadius;
    }

    public PartitioningConfig partitioning() {
        return partitioning;
    }

    public float repulsionStrength() {
        return repulsionStrength;
    }

    public boolean spatialAcceleration() {
        return spatialAcceleration;
    }

    public float theta() {
        return theta;
    }

    public AccelerationConfiguration withFrustumCulling(boolean enabled) {
        return new AccelerationConfiguration(theta, repulsionStrength, gridCellSize, nodeRadius, lod, partitioning,
                                             incremental, spatialAcceleration, enabled, levelOfDetail,
                                             incrementalLayout);
    }

    public AccelerationConfiguration withGridCellSize(float newCellSize) {
        return new AccelerationConfiguration(theta, repulsionStrength, newCellSize, nodeRadius, lod, partitioning,
                                             incremental, spatialAcceleration, frustumCulling, levelOfDetail,
                                             incrementalLayout);
    }

    public AccelerationConfiguration withIncremental(IncrementalLayoutConfig newIncremental) {
        return new AccelerationConfiguration(theta, repulsionStrength, gridCellSize, nodeRadius, lod, partitioning,
                                             newIncremental, spatialAcceleration, frustumCulling, levelOfDetail,
                                             incrementalLayout);
    }

    public AccelerationConfiguration withIncrementalLayout(boolean enabled) {
        return new AccelerationConfiguration(theta, repulsionStrength, gridCellSize, nodeRadius, lod, partitioning,
                                             incremental, spatialAcceleration, frustumCulling, levelOfDetail,
                                             enabled);
    }

    public AccelerationConfiguration withLevelOfDetail(boolean enabled) {
        return new AccelerationConfiguration(theta, repulsionStrength, gridCellSize, nodeRadius, lod, partitioning,
                                             incremental, spatialAcceleration, frustumCulling, enabled,
                                             incrementalLayout);
    }

    public AccelerationConfiguration withLod(LodConfiguration newLod) {
        return new AccelerationConfiguration(theta, repulsionStrength, gridCellSize, nodeRadius, newLod, partitioning,
                                             incremental, spatialAcceleration, frustumCulling, levelOfDetail,
                                             incrementalLayout);
    }

    public AccelerationConfiguration withNodeRadius(float newRadius) {
        return new AccelerationConfiguration(theta, repulsionStrength, gridCellSize, newRadius, lod, partitioning,
                                             incremental, spatialAcceleration, frustumCulling, levelOfDetail,
                                             incrementalLayout);
    }

    public AccelerationConfiguration withPartitioning(PartitioningConfig newPartitioning) {
        return new AccelerationConfiguration(theta, repulsionStrength, gridCellSize, nodeRadius, lod, newPartitioning,
                                             incremental, spatialAcceleration, frustumCulling, levelOfDetail,
                                             incrementalLayout);
    }

    public AccelerationConfiguration withRepulsionStrength(float newStrength) {
        return new AccelerationConfiguration(theta, newStrength, gridCellSize, nodeRadius, lod, partitioning,
                                             incremental, spatialAcceleration, frustumCulling, levelOfDetail,
                                             incrementalLayout);
    }

    public AccelerationConfiguration withSpatialAcceleration(boolean enabled) {
        return new AccelerationConfiguration(theta, repulsionStrength, gridCellSize, nodeRadius, lod, partitioning,
                                             incremental, enabled, frustumCulling, levelOfDetail, incrementalLayout);
    }

    public AccelerationConfiguration withTheta(float newTheta) {
        return new AccelerationConfiguration(newTheta, repulsionStrength, gridCellSize, nodeRadius, lod, partitioning,
                                             incremental, spatialAcceleration, frustumCulling, levelOfDetail,
                                             incrementalLayout);
    }

    @Override
    public String toString() {
        return String.format(
        "AccelerationConfiguration[theta=%.2f, repulsion=%.1f, cellSize=%.1f, nodeRadius=%.1f, spatial=%s, culling=%s, lod=%s, incremental=%s]",
        theta, repulsionStrength, gridCellSize, nodeRadius, spatialAcceleration, frustumCulling, levelOfDetail,
        incrementalLayout);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        var other = (AccelerationConfiguration) obj;
        return Float.compare(theta, other.theta) == 0 &&
               Float.compare(repulsionStrength, other.repulsionStrength) == 0 &&
               Float.compare(gridCellSize, other.gridCellSize) == 0 &&
               Float.compare(nodeRadius, other.nodeRadius) == 0 &&
               spatialAcceleration == other.spatialAcceleration &&
               frustumCulling == other.frustumCulling &&
               levelOfDetail == other.levelOfDetail &&
               incrementalLayout == other.incrementalLayout &&
               lod.equals(other.lod) &&
               partitioning.equals(other.partitioning) &&
               incremental.equals(other.incremental);
    }

    @Override
    public int hashCode() {
        return Objects.hash(theta, repulsionStrength, gridCellSize, nodeRadius, lod, partitioning, incremental,
                            spatialAcceleration, frustumCulling, levelOfDetail, incrementalLayout);
    }
}
