/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.tkmaterial.budget.scan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.tkmaterial.budget.model.Material;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parameters of an eta scan. Values are validated when set, so a scan never starts from an invalid configuration.
 * <p>
 * The defaults are read from the classpath resource {@value #DEFAULTS_RESOURCE}:
 *
 * <pre>
 * {
 *   "etaSteps": 50, "etaMax": 2.4, "momenta": [1.0, 10.0, 100.0],
 *   "shadowIntegration": true, "threads": 1,
 *   "beamPipe": { "radius": 23.0, "radiationLength": 0.0023, "interactionLength": 0.0019 }
 * }
 * </pre>
 * <p>
 * Every key is optional; missing keys keep the built in value.
 *
 * @author hal.hildebrand
 */
public class ScanConfiguration {
    public static final String DEFAULTS_RESOURCE = "/tkmaterial/scan-defaults.json";

    private static final Logger       log          = LoggerFactory.getLogger(ScanConfiguration.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private int          etaSteps          = 50;
    private double       etaMax            = 2.4;
    private List<Double> momenta           = List.of(1.0, 10.0, 100.0);
    private boolean      shadowIntegration = true;
    private double       beamPipeRadius    = 23.0;
    private Material     beamPipeMaterial  = new Material(0.0023, 0.0019);
    private int          threads           = 1;

    /**
     * Configuration from {@value #DEFAULTS_RESOURCE}
     *
     * @throws UncheckedIOException if the resource is missing or malformed
     */
    public static ScanConfiguration defaults() {
        return fromResource(DEFAULTS_RESOURCE);
    }

    /**
     * @param resourcePath absolute classpath resource
     * @throws UncheckedIOException if the resource is missing or malformed
     */
    public static ScanConfiguration fromResource(String resourcePath) {
        try (var is = ScanConfiguration.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new FileNotFoundException("Scan configuration not found: " + resourcePath);
            }
            var config = parse(is);
            log.debug("Loaded scan configuration from {}: {}", resourcePath, config);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to load scan configuration " + resourcePath, e);
        }
    }

    /**
     * @throws UncheckedIOException if the stream does not hold a JSON object
     */
    public static ScanConfiguration fromStream(InputStream is) {
        try {
            return parse(is);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read scan configuration", e);
        }
    }

    private static ScanConfiguration parse(InputStream is) throws IOException {
        var root = objectMapper.readTree(is);
        if (root == null || !root.isObject()) {
            throw new IOException("Scan configuration must be a JSON object");
        }
        var config = new ScanConfiguration();
        if (root.has("etaSteps")) {
            config.withEtaSteps(requireNumber(root, "etaSteps").asInt());
        }
        if (root.has("etaMax")) {
            config.withEtaMax(requireNumber(root, "etaMax").asDouble());
        }
        if (root.has("momenta")) {
            var node = root.get("momenta");
            if (!node.isArray()) {
                throw new IOException("momenta must be an array");
            }
            var momenta = new ArrayList<Double>();
            for (var p : node) {
                if (!p.isNumber()) {
                    throw new IOException("momenta must hold numbers: " + p);
                }
                momenta.add(p.asDouble());
            }
            config.withMomenta(momenta);
        }
        if (root.has("shadowIntegration")) {
            config.withShadowIntegration(root.get("shadowIntegration").asBoolean());
        }
        if (root.has("threads")) {
            config.withThreads(requireNumber(root, "threads").asInt());
        }
        if (root.has("beamPipe")) {
            var pipe = root.get("beamPipe");
            var radius = pipe.has("radius") ? requireNumber(pipe, "radius").asDouble() : config.beamPipeRadius;
            var radiation = pipe.has("radiationLength") ? requireNumber(pipe, "radiationLength").asDouble()
                                                        : config.beamPipeMaterial.radiation();
            var interaction = pipe.has("interactionLength") ? requireNumber(pipe, "interactionLength").asDouble()
                                                            : config.beamPipeMaterial.interaction();
            config.withBeamPipe(radius, new Material(radiation, interaction));
        }
        return config;
    }

    private static JsonNode requireNumber(JsonNode parent, String field) throws IOException {
        var node = parent.get(field);
        if (!node.isNumber()) {
            throw new IOException(field + " must be a number: " + node);
        }
        return node;
    }

    public double getBeamPipeRadius() {
        return beamPipeRadius;
    }

    public Material getBeamPipeMaterial() {
        return beamPipeMaterial;
    }

    public double getEtaMax() {
        return etaMax;
    }

    public int getEtaSteps() {
        return etaSteps;
    }

    public List<Double> getMomenta() {
        return momenta;
    }

    public int getThreads() {
        return threads;
    }

    public boolean isShadowIntegration() {
        return shadowIntegration;
    }

    public ScanConfiguration withBeamPipe(double radius, Material material) {
        if (radius <= 0) {
            throw new IllegalArgumentException("Beam pipe radius must be positive: " + radius);
        }
        this.beamPipeRadius = radius;
        this.beamPipeMaterial = Objects.requireNonNull(material, "material");
        return this;
    }

    public ScanConfiguration withEtaMax(double etaMax) {
        if (!(etaMax >= 0) || Double.isInfinite(etaMax)) {
            throw new IllegalArgumentException("etaMax must be finite and non negative: " + etaMax);
        }
        this.etaMax = etaMax;
        return this;
    }

    /**
     * @param steps number of trajectories in the fan, at least 1
     */
    public ScanConfiguration withEtaSteps(int steps) {
        if (steps < 1) {
            throw new IllegalArgumentException("At least one eta step is required: " + steps);
        }
        this.etaSteps = steps;
        return this;
    }

    public ScanConfiguration withMomenta(List<Double> momenta) {
        this.momenta = List.copyOf(momenta);
        return this;
    }

    public ScanConfiguration withShadowIntegration(boolean enable) {
        this.shadowIntegration = enable;
        return this;
    }

    /**
     * @param threads worker threads; 1 runs the scan on the calling thread
     */
    public ScanConfiguration withThreads(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("At least one thread is required: " + threads);
        }
        this.threads = threads;
        return this;
    }

    @Override
    public String toString() {
        return "ScanConfiguration[etaSteps=" + etaSteps + ", etaMax=" + etaMax + ", momenta=" + momenta
        + ", shadowIntegration=" + shadowIntegration + ", beamPipe=" + beamPipeRadius + "/" + beamPipeMaterial
        + ", threads=" + threads + "]";
    }
}
