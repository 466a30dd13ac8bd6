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
package com.hellblazer.tkmaterial.budget.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The material view of a detector layout as handed over by the geometry model: active layers, passive volumes and the
 * envelope of the tracking volume. Bounding windows of all modules are computed on construction.
 *
 * @author hal.hildebrand
 */
public final class DetectorGeometry {
    private static final Logger log = LoggerFactory.getLogger(DetectorGeometry.class);

    private final String            name;
    private final List<ActiveLayer> barrelLayers;
    private final List<ActiveLayer> endcapLayers;
    private final InactiveInventory inactive;
    private final double            maxRadius;
    private final double            maxLength;
    private final double            zError;

    /**
     * @param name         layout name
     * @param barrelLayers barrel layers
     * @param endcapLayers endcap disks
     * @param inactive     passive volumes
     * @param maxRadius    outer radius of the tracking volume (including the service volume width)
     * @param maxLength    half length of the tracking volume
     * @param zError       spread of the luminous region along z
     */
    public DetectorGeometry(String name, List<ActiveLayer> barrelLayers, List<ActiveLayer> endcapLayers,
                            InactiveInventory inactive, double maxRadius, double maxLength, double zError) {
        this.name = Objects.requireNonNull(name, "name");
        this.barrelLayers = List.copyOf(barrelLayers);
        this.endcapLayers = List.copyOf(endcapLayers);
        this.inactive = Objects.requireNonNull(inactive, "inactive");
        if (maxRadius <= 0 || maxLength <= 0) {
            throw new IllegalArgumentException(
            "Tracking volume must have positive radius and length: " + maxRadius + ", " + maxLength);
        }
        if (zError < 0) {
            throw new IllegalArgumentException("zError must be non negative: " + zError);
        }
        this.maxRadius = maxRadius;
        this.maxLength = maxLength;
        this.zError = zError;

        var modules = allModules();
        for (var module : modules) {
            module.computeBoundaries(zError);
        }
        log.debug("Layout {}: {} modules in {} barrel and {} endcap layers, {} inactive elements", name,
                  modules.size(), this.barrelLayers.size(), this.endcapLayers.size(), inactive.size());
    }

    /**
     * @return all modules, barrel layers first
     */
    public List<ActiveElement> allModules() {
        var modules = new ArrayList<ActiveElement>();
        for (var layer : barrelLayers) {
            modules.addAll(layer.elements());
        }
        for (var layer : endcapLayers) {
            modules.addAll(layer.elements());
        }
        return modules;
    }

    /**
     * @return {min, max} pseudorapidity covered by the module windows, {0, 0} without modules
     */
    public double[] etaRange() {
        var min = Double.POSITIVE_INFINITY;
        var max = Double.NEGATIVE_INFINITY;
        for (var module : allModules()) {
            var window = module.window();
            min = Math.min(min, window.minEta());
            max = Math.max(max, window.maxEta());
        }
        if (min > max) {
            return new double[] { 0, 0 };
        }
        return new double[] { min, max };
    }

    public void resetHitCounters() {
        for (var module : allModules()) {
            module.resetHits();
        }
    }

    public String name() {
        return name;
    }

    public List<ActiveLayer> barrelLayers() {
        return barrelLayers;
    }

    public List<ActiveLayer> endcapLayers() {
        return endcapLayers;
    }

    public InactiveInventory inactive() {
        return inactive;
    }

    public double maxRadius() {
        return maxRadius;
    }

    public double maxLength() {
        return maxLength;
    }

    public double zError() {
        return zError;
    }
}
