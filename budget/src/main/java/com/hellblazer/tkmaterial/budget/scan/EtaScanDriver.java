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

import com.hellblazer.tkmaterial.budget.grid.Axis;
import com.hellblazer.tkmaterial.budget.grid.BudgetSummary;
import com.hellblazer.tkmaterial.budget.grid.Grid2D;
import com.hellblazer.tkmaterial.budget.model.Category;
import com.hellblazer.tkmaterial.budget.model.DetectorGeometry;
import com.hellblazer.tkmaterial.budget.model.Orientation;
import com.hellblazer.tkmaterial.budget.track.Hit;
import com.hellblazer.tkmaterial.budget.track.ResolutionEstimator;
import com.hellblazer.tkmaterial.budget.track.Track;
import com.hellblazer.tkmaterial.geometry.Pseudorapidity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.hellblazer.tkmaterial.budget.grid.BudgetSummary.*;

/**
 * Shoots a fan of straight tracks from the origin through a detector, at fixed azimuth and evenly spaced
 * pseudorapidity in [0, etaMax], and books the material they cross.
 * <p>
 * With more than one thread the fan is cut into contiguous chunks, each traced with its own {@link ScanContext}; the
 * contexts are merged in chunk order. Tracks are handed to the {@link ResolutionEstimator} on the calling thread, in eta
 * order, whatever the number of threads.
 *
 * @author hal.hildebrand
 */
public class EtaScanDriver {
    /** Azimuth of all scan tracks */
    public static final double PHI = Math.PI / 2.0;

    private static final Logger log = LoggerFactory.getLogger(EtaScanDriver.class);

    private static final Category[] SUPPORTS = { Category.BARREL_SUPPORT, Category.ENDCAP_SUPPORT,
                                                 Category.SUPPORT_TUBE, Category.BARREL_SUPPORT_TUBE,
                                                 Category.USER_DEFINED_SUPPORT };

    private final ScanConfiguration     config;
    private final ResolutionEstimator   estimator;

    public EtaScanDriver(ScanConfiguration config, ResolutionEstimator estimator) {
        this.config = Objects.requireNonNull(config, "config");
        this.estimator = Objects.requireNonNull(estimator, "estimator");
    }

    /**
     * @return the eta distance between consecutive tracks of the fan
     */
    public static double etaStep(int steps, double etaMax) {
        return steps > 1 ? etaMax / (steps - 1) : etaMax;
    }

    /**
     * Composite summaries filled together with a support category
     */
    private static BudgetSummary[] supportSummaries(Category category) {
        return switch (category) {
            case BARREL_SUPPORT -> new BudgetSummary[] { SUPPORTS_BARREL, BARREL_ALL, SUPPORTS_ALL, GLOBAL };
            case ENDCAP_SUPPORT -> new BudgetSummary[] { SUPPORTS_ENDCAP, ENDCAP_ALL, SUPPORTS_ALL, GLOBAL };
            default -> new BudgetSummary[] { BudgetSummary.ofSupport(category), SUPPORTS_ALL, GLOBAL };
        };
    }

    public ScanResult scan(DetectorGeometry geometry) {
        return scan(geometry, null);
    }

    /**
     * @param geometry the detector
     * @param pixels   optional secondary detector crossed by the same tracks; its material goes into the tracks and the
     *                 position map only
     */
    public ScanResult scan(DetectorGeometry geometry, DetectorGeometry pixels) {
        Objects.requireNonNull(geometry, "geometry");
        var steps = config.getEtaSteps();
        var etaMax = config.getEtaMax();
        var step = etaStep(steps, etaMax);
        var start = System.nanoTime();
        log.info("Scanning {} with {} tracks, eta [0, {}], {} thread(s)", geometry.name(), steps, etaMax,
                 config.getThreads());

        var template = ScanContext.forScan(geometry, steps, etaMax);
        var accumulator = new TrajectoryAccumulator();
        var chunks = config.getThreads() == 1
                     ? List.of(trace(accumulator, geometry, pixels, 0, steps, etaMax, step, template))
                     : traceParallel(accumulator, geometry, pixels, steps, etaMax, step, template);

        var context = template;
        var tracks = new ArrayList<Track>();
        var idealTracks = new ArrayList<Track>();
        for (var chunk : chunks) {
            if (chunk.context != template) {
                context.merge(chunk.context);
            }
            for (var track : chunk.tracks) {
                estimator.estimate(track, config.getMomenta());
                var ideal = track.withoutMaterial();
                estimator.estimate(ideal, config.getMomenta());
                tracks.add(track);
                idealTracks.add(ideal);
            }
        }

        var cells = context.cellGrid();
        if (config.isShadowIntegration()) {
            cells.integrateRadially();
        }
        var zAxis = new Axis(steps, 0, geometry.maxLength());
        var rAxis = new Axis(cells.columns(), 0, geometry.maxRadius());
        var isoRadiation = new Grid2D("isoRadiation", zAxis, rAxis);
        var isoInteraction = new Grid2D("isoInteraction", zAxis, rAxis);
        cells.remapToZR(isoRadiation, isoInteraction);
        context.positionMap().calibrate();

        log.info("Scanned {}: {} tracks in {} ms", geometry.name(), tracks.size(),
                 (System.nanoTime() - start) / 1_000_000);
        log.debug("Overall radiation length integral {}, interaction length integral {}",
                  context.histograms().radiation(GLOBAL).integral(),
                  context.histograms().interaction(GLOBAL).integral());
        return new ScanResult(tracks, idealTracks, context.histograms(), cells, isoRadiation, isoInteraction,
                              context.positionMap());
    }

    private List<Chunk> traceParallel(TrajectoryAccumulator accumulator, DetectorGeometry geometry,
                                      DetectorGeometry pixels, int steps, double etaMax, double step,
                                      ScanContext template) {
        var threads = Math.min(config.getThreads(), steps);
        var executor = Executors.newFixedThreadPool(threads);
        try {
            var futures = new ArrayList<Future<Chunk>>();
            var size = (steps + threads - 1) / threads;
            for (int from = 0; from < steps; from += size) {
                var first = from;
                var last = Math.min(steps, from + size);
                Callable<Chunk> task = () -> trace(accumulator, geometry, pixels, first, last, etaMax, step,
                                                   template.emptyCopy());
                futures.add(executor.submit(task));
            }
            log.debug("Tracing {} chunks of {} tracks on {} threads", futures.size(), size, threads);
            var chunks = new ArrayList<Chunk>();
            for (var future : futures) {
                chunks.add(future.get());
            }
            return chunks;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Eta scan interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Eta scan failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Trace the tracks first (inclusive) to last (exclusive) of the fan
     */
    private Chunk trace(TrajectoryAccumulator accumulator, DetectorGeometry geometry, DetectorGeometry pixels,
                        int first, int last, double etaMax, double step, ScanContext context) {
        var tracks = new ArrayList<Track>(last - first);
        var histograms = context.histograms();
        var inactive = geometry.inactive();
        for (int i = first; i < last; i++) {
            // i * step may round past etaMax, which the histograms and cells would drop
            var eta = Math.min(etaMax, i * step);
            var theta = Pseudorapidity.theta(eta);
            var track = new Track(theta);

            var m = accumulator.analyzeModules(geometry.barrelLayers(), eta, theta, PHI, track, context, false);
            histograms.fill(eta, m, ACTIVE_BARREL, BARREL_ALL, ACTIVE_ALL, GLOBAL);
            m = accumulator.analyzeModules(geometry.endcapLayers(), eta, theta, PHI, track, context, false);
            histograms.fill(eta, m, ACTIVE_ENDCAP, ENDCAP_ALL, ACTIVE_ALL, GLOBAL);
            m = accumulator.analyzeInactive(inactive.barrelServices(), eta, theta, track, Category.NONE, context,
                                            false);
            histograms.fill(eta, m, SERVICES_BARREL, BARREL_ALL, SERVICES_ALL, GLOBAL);
            m = accumulator.analyzeInactive(inactive.endcapServices(), eta, theta, track, Category.NONE, context,
                                            false);
            histograms.fill(eta, m, SERVICES_ENDCAP, ENDCAP_ALL, SERVICES_ALL, GLOBAL);
            for (var category : SUPPORTS) {
                m = accumulator.analyzeInactive(inactive.supports(), eta, theta, track, category, context, false);
                histograms.fill(eta, m, supportSummaries(category));
            }

            if (pixels != null) {
                var pixelInactive = pixels.inactive();
                accumulator.analyzeModules(pixels.barrelLayers(), eta, theta, PHI, track, context, true);
                accumulator.analyzeModules(pixels.endcapLayers(), eta, theta, PHI, track, context, true);
                accumulator.analyzeInactive(pixelInactive.barrelServices(), eta, theta, track, Category.NONE, context,
                                            true);
                accumulator.analyzeInactive(pixelInactive.endcapServices(), eta, theta, track, Category.NONE, context,
                                            true);
                accumulator.analyzeInactive(pixelInactive.supports(), eta, theta, track, Category.NONE, context, true);
            }

            track.addHit(Hit.inactive(config.getBeamPipeRadius() / Math.sin(theta), Orientation.HORIZONTAL,
                                      config.getBeamPipeMaterial()));
            if (track.hasHits()) {
                track.sort();
                tracks.add(track);
            }
            log.trace("eta {}: {} hits", eta, track.size());
        }
        return new Chunk(tracks, context);
    }

    private record Chunk(List<Track> tracks, ScanContext context) {
    }
}
