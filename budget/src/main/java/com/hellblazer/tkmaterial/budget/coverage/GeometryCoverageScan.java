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
package com.hellblazer.tkmaterial.budget.coverage;

import com.hellblazer.tkmaterial.budget.grid.Axis;
import com.hellblazer.tkmaterial.budget.grid.EtaProfile;
import com.hellblazer.tkmaterial.budget.grid.Grid2D;
import com.hellblazer.tkmaterial.budget.model.ActiveElement;
import com.hellblazer.tkmaterial.budget.model.DetectorGeometry;
import com.hellblazer.tkmaterial.geometry.Pseudorapidity;
import com.hellblazer.tkmaterial.geometry.Ray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

/**
 * Hermeticity survey of the active modules: straight tracks in random directions from a vertex smeared along the beam
 * line, counting the modules each track crosses. Runs with a fixed seed, so repeated surveys of one geometry agree.
 * <p>
 * The module hit counters are reset at the start of a survey and hold its counts afterwards.
 *
 * @author hal.hildebrand
 */
public class GeometryCoverageScan {
    public static final long   DEFAULT_SEED  = 0x5EEDL;
    /** Extra eta range shot beyond the geometry, as a fraction of its span */
    public static final double ETA_MARGIN    = 0.1;
    public static final int    PROFILE_BINS  = 100;
    public static final double PHI_ETA_RANGE = 3.0;

    private static final Logger log = LoggerFactory.getLogger(GeometryCoverageScan.class);

    private final long seed;

    public GeometryCoverageScan() {
        this(DEFAULT_SEED);
    }

    public GeometryCoverageScan(long seed) {
        this.seed = seed;
    }

    /**
     * @param geometry the detector
     * @param nTracks  requested number of tracks; the survey shoots the largest square not above it
     */
    public CoverageResult analyze(DetectorGeometry geometry, int nTracks) {
        if (nTracks < 1) {
            throw new IllegalArgumentException("At least one track is required: " + nTracks);
        }
        var random = new Random(seed);
        var perSide = (int) Math.sqrt(nTracks);
        var tracks = perSide * perSide;
        var blocks = perSide / 2;

        var modules = geometry.allModules();
        geometry.resetHitCounters();
        var range = geometry.etaRange();
        var maxAbsEta = Math.max(Math.abs(range[0]), Math.abs(range[1]));
        var span = (range[1] - range[0]) * (1 + ETA_MARGIN);
        var base = range[0] - (range[1] - range[0]) * ETA_MARGIN / 2;

        var types = new TreeMap<String, EtaProfile>();
        for (var module : modules) {
            types.computeIfAbsent(module.type(),
                                  type -> new EtaProfile(type, new Axis(PROFILE_BINS, 0, maxAbsEta * 1.1)));
        }
        var total = new EtaProfile("etaProfileTotal", new Axis(PROFILE_BINS, 0, maxAbsEta * 1.2));
        var phiAxis = new Axis(blocks, -Math.PI, Math.PI);
        var etaAxis = new Axis(blocks, -PHI_ETA_RANGE, PHI_ETA_RANGE);
        var phiEta = new Grid2D("mapPhiEta", phiAxis, etaAxis);
        var phiEtaCount = new Grid2D("mapPhiEtaCount", phiAxis, etaAxis);

        log.info("Shooting {} tracks through {}, eta [{}, {}]", tracks, geometry.name(), base, base + span);
        var typeCounts = new TreeMap<String, Integer>();
        for (int n = 0; n < tracks; n++) {
            var eta = base + span * random.nextDouble();
            var phi = 2 * Math.PI * random.nextDouble();
            var vertexZ = random.nextGaussian() * geometry.zError();
            var hit = trackHit(Ray.fromVertex(vertexZ, eta, phi), eta, phi, modules);

            typeCounts.clear();
            for (var module : hit) {
                typeCounts.merge(module.type(), 1, Integer::sum);
            }
            for (var entry : types.entrySet()) {
                entry.getValue().fill(Math.abs(eta), typeCounts.getOrDefault(entry.getKey(), 0));
            }
            total.fill(Math.abs(eta), hit.size());
            var directionPhi = Pseudorapidity.phiOf(Pseudorapidity.direction(eta, phi));
            phiEta.fill(directionPhi, eta, hit.size());
            phiEtaCount.fill(directionPhi, eta, 1);
        }

        for (int i = 0; i < blocks; i++) {
            for (int j = 0; j < blocks; j++) {
                var count = phiEtaCount.get(i, j);
                if (count > 0) {
                    phiEta.set(i, j, phiEta.get(i, j) / count);
                }
            }
        }

        var fractions = new IdentityHashMap<ActiveElement, Double>();
        for (var module : modules) {
            fractions.put(module, module.hitCount() / (double) tracks);
        }
        log.debug("Coverage of {}: {} modules, {} module types", geometry.name(), modules.size(), types.size());
        return new CoverageResult(tracks, total, types, phiEta, fractions);
    }

    /**
     * @return the modules crossed by the ray, their hit counters incremented
     */
    private static List<ActiveElement> trackHit(Ray ray, double eta, double phi, List<ActiveElement> modules) {
        var hit = new ArrayList<ActiveElement>();
        for (var module : modules) {
            if (!module.couldHit(eta, phi)) {
                continue;
            }
            if (module.crossDistance(ray) > 0) {
                module.registerHit();
                hit.add(module);
            }
        }
        return hit;
    }
}
