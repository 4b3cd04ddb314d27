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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.asterism.accel.InvalidConfigurationException;
import com.hellblazer.asterism.accel.incremental.IncrementalLayoutConfig;
import com.hellblazer.asterism.accel.lod.LodConfiguration;
import com.hellblazer.asterism.accel.partition.PartitioningAlgorithm;
import com.hellblazer.asterism.accel.partition.PartitioningConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3f;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Objects;

/**
 * Reads {@link AccelerationConfiguration} from JSON documents.
 *
 * <p>Every section and field is optional; a document is laid over the built-in defaults, so
 * <pre>{"force": {"theta": 0.8}}</pre>
 * changes only the accuracy. Sections: {@code force} (theta, repulsionStrength, spatialAcceleration), {@code grid}
 * (cellSize), {@code culling} (enabled, nodeRadius), {@code lod} (enabled, cameraPosition, thresholds,
 * useSquaredDistances, hysteresis), {@code partitioning} (targetPartitions, minPartitionSize, maxPartitionSize,
 * algorithm, minimizeEdgeCut) and {@code incremental} (enabled, relayoutFraction, movementThreshold,
 * propagationDistance).
 *
 * @author hal.hildebrand
 */
public class ConfigurationLoader {
    public static final String DEFAULTS_RESOURCE = "/asterism-defaults.json";

    private static final Logger log = LoggerFactory.getLogger(ConfigurationLoader.class);

    private final ObjectMapper objectMapper;

    public ConfigurationLoader() {
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Load a document from a stream, laid over the built-in defaults
     *
     * @throws UncheckedIOException          if the document cannot be read or parsed
     * @throws InvalidConfigurationException if a value is of the wrong type or out of range
     */
    public AccelerationConfiguration load(InputStream in) {
        Objects.requireNonNull(in, "in cannot be null");
        JsonNode root;
        try {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read acceleration configuration", e);
        }
        if (root == null || root.isMissingNode()) {
            return AccelerationConfiguration.defaultConfig();
        }
        if (!root.isObject()) {
            throw new InvalidConfigurationException("Configuration document must be a JSON object");
        }
        var config = parse(root, AccelerationConfiguration.defaultConfig());
        log.debug("Loaded {}", config);
        return config;
    }

    /**
     * Load the bundled {@value #DEFAULTS_RESOURCE}, falling back to the built-in defaults when it is absent
     */
    public AccelerationConfiguration loadDefaults() {
        return loadResource(DEFAULTS_RESOURCE);
    }

    /**
     * Load a classpath resource, falling back to the built-in defaults when it is absent
     *
     * @throws UncheckedIOException if the resource exists but cannot be read or parsed
     */
    public AccelerationConfiguration loadResource(String resource) {
        try (InputStream is = getClass().getResourceAsStream(resource)) {
            if (is == null) {
                log.warn("Configuration resource not found: {}, using built-in defaults", resource);
                return AccelerationConfiguration.defaultConfig();
            }
            var config = load(is);
            log.info("Loaded acceleration configuration from {}", resource);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close configuration resource " + resource, e);
        }
    }

    /**
     * Lay a parsed document over a base configuration
     */
    public AccelerationConfiguration parse(JsonNode root, AccelerationConfiguration base) {
        var force = section(root, "force");
        var grid = section(root, "grid");
        var culling = section(root, "culling");
        var lodNode = section(root, "lod");
        var incrementalNode = section(root, "incremental");

        return new AccelerationConfiguration(floatValue(force, "theta", base.theta()),
                                             floatValue(force, "repulsionStrength", base.repulsionStrength()),
                                             floatValue(grid, "cellSize", base.gridCellSize()),
                                             floatValue(culling, "nodeRadius", base.nodeRadius()),
                                             parseLod(lodNode, base.lod()),
                                             parsePartitioning(section(root, "partitioning"), base.partitioning()),
                                             parseIncremental(incrementalNode, base.incremental()),
                                             booleanValue(force, "spatialAcceleration", base.spatialAcceleration()),
                                             booleanValue(culling, "enabled", base.frustumCulling()),
                                             booleanValue(lodNode, "enabled", base.levelOfDetail()),
                                             booleanValue(incrementalNode, "enabled", base.incrementalLayout()));
    }

    private boolean booleanValue(JsonNode section, String field, boolean fallback) {
        var node = section.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isBoolean()) {
            throw new InvalidConfigurationException(field + " must be a boolean: " + node);
        }
        return node.booleanValue();
    }

    private double doubleValue(JsonNode section, String field, double fallback) {
        var node = section.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isNumber()) {
            throw new InvalidConfigurationException(field + " must be a number: " + node);
        }
        return node.doubleValue();
    }

    private float floatValue(JsonNode section, String field, float fallback) {
        return (float) doubleValue(section, field, fallback);
    }

    private int intValue(JsonNode section, String field, int fallback) {
        var node = section.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new InvalidConfigurationException(field + " must be an integer: " + node);
        }
        return node.intValue();
    }

    private float[] floatArray(JsonNode section, String field, float[] fallback) {
        var node = section.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isArray()) {
            throw new InvalidConfigurationException(field + " must be an array: " + node);
        }
        var values = new float[node.size()];
        for (int i = 0; i < values.length; i++) {
            var element = node.get(i);
            if (!element.isNumber()) {
                throw new InvalidConfigurationException(field + "[" + i + "] must be a number: " + element);
            }
            values[i] = (float) element.doubleValue();
        }
        return values;
    }

    private IncrementalLayoutConfig parseIncremental(JsonNode section, IncrementalLayoutConfig base) {
        return new IncrementalLayoutConfig(doubleValue(section, "relayoutFraction", base.relayoutFraction()),
                                           floatValue(section, "movementThreshold", base.movementThreshold()),
                                           intValue(section, "propagationDistance", base.propagationDistance()));
    }

    private LodConfiguration parseLod(JsonNode section, LodConfiguration base) {
        var camera = base.cameraPosition();
        var cameraNode = section.get("cameraPosition");
        if (cameraNode != null && !cameraNode.isNull()) {
            var xyz = floatArray(section, "cameraPosition", null);
            if (xyz.length != 3) {
                throw new InvalidConfigurationException("cameraPosition must have 3 components: " + cameraNode);
            }
            camera = new Point3f(xyz[0], xyz[1], xyz[2]);
        }
        return new LodConfiguration(camera, floatArray(section, "thresholds", base.thresholds()),
                                    booleanValue(section, "useSquaredDistances", base.useSquaredDistances()),
                                    floatValue(section, "hysteresis", base.hysteresis()));
    }

    private PartitioningConfig parsePartitioning(JsonNode section, PartitioningConfig base) {
        var algorithm = base.algorithm();
        var algorithmNode = section.get("algorithm");
        if (algorithmNode != null && !algorithmNode.isNull()) {
            var name = algorithmNode.asText().trim().toUpperCase(Locale.ROOT);
            try {
                algorithm = PartitioningAlgorithm.valueOf(name);
            } catch (IllegalArgumentException e) {
                throw new InvalidConfigurationException(
                "Unknown partitioning algorithm: " + algorithmNode.asText(), e);
            }
        }
        return new PartitioningConfig(intValue(section, "targetPartitions", base.targetPartitions()),
                                      intValue(section, "minPartitionSize", base.minPartitionSize()),
                                      intValue(section, "maxPartitionSize", base.maxPartitionSize()), algorithm,
                                      booleanValue(section, "minimizeEdgeCut", base.minimizeEdgeCut()));
    }

    private JsonNode section(JsonNode root, String name) {
        var node = root.path(name);
        if (node.isMissingNode() || node.isNull()) {
            return objectMapper.createObjectNode();
        }
        if (!node.isObject()) {
            throw new InvalidConfigurationException(name + " must be a JSON object: " + node);
        }
        return node;
    }
}
