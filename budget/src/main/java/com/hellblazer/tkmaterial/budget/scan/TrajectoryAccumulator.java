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

import com.hellblazer.tkmaterial.budget.grid.BudgetSummary;
import com.hellblazer.tkmaterial.budget.model.ActiveElement;
import com.hellblazer.tkmaterial.budget.model.ActiveLayer;
import com.hellblazer.tkmaterial.budget.model.Category;
import com.hellblazer.tkmaterial.budget.model.InactiveElement;
import com.hellblazer.tkmaterial.budget.model.Material;
import com.hellblazer.tkmaterial.budget.track.Hit;
import com.hellblazer.tkmaterial.budget.track.Track;
import com.hellblazer.tkmaterial.geometry.Ray;
import com.hellblazer.tkmaterial.geometry.TubeIntersection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Collects the material along one straight trajectory from the origin. Every crossed element adds its material,
 * corrected for the crossing angle, to the returned total, appends a {@link Hit} to the track and fills the
 * accumulators of the {@link ScanContext}.
 * <p>
 * In the secondary (pixel) pass the cell grid and the histograms are left alone; the track and the position map are
 * still filled.
 * <p>
 * Instances are thread safe; the context passed in must be confined to the calling thread.
 * <p>
 * Modules of an unscanned subdetector are warned about once per instance; {@link EtaScanDriver} uses one instance
 * per scan.
 *
 * @author hal.hildebrand
 */
public class TrajectoryAccumulator {
    private static final Logger log = LoggerFactory.getLogger(TrajectoryAccumulator.class);

    private final Set<ActiveElement> warned = ConcurrentHashMap.newKeySet();

    /**
     * Material of an inactive element seen by a track of polar angle theta. User defined supports are crossed along
     * the shorter of the two paths through their (r, z) cross section.
     */
    public static Material correctedMaterial(InactiveElement element, double theta) {
        if (element.category() != Category.USER_DEFINED_SUPPORT) {
            return element.orientation().scale(element.material(), theta);
        }
        var throughZ = element.zLength() / Math.cos(theta);
        var throughR = element.rWidth() / Math.sin(theta);
        var path = Math.min(throughZ, throughR);
        var thickness = element.isVertical() ? element.zLength() : element.rWidth();
        return element.material().scale(path / thickness);
    }

    /**
     * Cross the trajectory with all modules of the layers
     *
     * @param layers  barrel layers or endcap disks
     * @param eta     pseudorapidity of the trajectory
     * @param theta   polar angle of the trajectory
     * @param phi     azimuth of the trajectory
     * @param track   receives a hit per crossed module
     * @param context accumulators of the scan
     * @param isPixel true for the secondary pass
     * @return the angle corrected material of the crossed modules
     */
    public Material analyzeModules(List<ActiveLayer> layers, double eta, double theta, double phi, Track track,
                                   ScanContext context, boolean isPixel) {
        var ray = Ray.fromOrigin(eta, phi);
        var radiation = 0.0;
        var interaction = 0.0;
        for (var layer : layers) {
            var m = analyzeLayer(layer, ray, eta, theta, phi, track, context, isPixel);
            radiation += m.radiation();
            interaction += m.interaction();
        }
        return new Material(radiation, interaction);
    }

    /**
     * Cross the trajectory with the modules of one layer
     *
     * @return the angle corrected material of the crossed modules
     */
    public Material analyzeLayer(ActiveLayer layer, double eta, double theta, double phi, Track track,
                                 ScanContext context, boolean isPixel) {
        return analyzeLayer(layer, Ray.fromOrigin(eta, phi), eta, theta, phi, track, context, isPixel);
    }

    private Material analyzeLayer(ActiveLayer layer, Ray ray, double eta, double theta, double phi, Track track,
                                  ScanContext context, boolean isPixel) {
        var radiation = 0.0;
        var interaction = 0.0;
        for (var module : layer.elements()) {
            if (module.maxZ() <= 0) {
                continue;
            }
            var orientation = module.subdetector().orientation();
            if (orientation == null) {
                if (warned.add(module)) {
                    log.warn("Skipping {} in layer {}: subdetector {} is not scanned", module, layer.name(),
                             module.subdetector());
                }
                continue;
            }
            if (!module.couldHit(eta, phi)) {
                continue;
            }
            var distance = module.crossDistance(ray);
            if (distance <= 0) {
                continue;
            }
            module.registerHit();
            var r = distance * Math.sin(theta);
            context.positionMap().fillRTheta(r, theta, module.material());
            var corrected = orientation.scale(module.material(), theta);
            radiation += corrected.radiation();
            interaction += corrected.interaction();
            if (!isPixel) {
                context.cellGrid().fill(r, eta, corrected);
            }
            track.addHit(Hit.active(distance, module, corrected));
            log.trace("eta {} crossed {} at {}: {}", eta, module, distance, corrected);
        }
        return new Material(radiation, interaction);
    }

    /**
     * Cross the trajectory with the inactive elements passing the category filter
     *
     * @param elements services or supports
     * @param eta      pseudorapidity of the trajectory
     * @param theta    polar angle of the trajectory
     * @param track    receives a hit per crossed element
     * @param filter   category to analyze, {@link Category#NONE} for all
     * @param context  accumulators of the scan
     * @param isPixel  true for the secondary pass
     * @return the angle corrected material of the crossed elements inside the tracking volume
     */
    public Material analyzeInactive(List<InactiveElement> elements, double eta, double theta, Track track,
                                    Category filter, ScanContext context, boolean isPixel) {
        var radiation = 0.0;
        var interaction = 0.0;
        for (var element : elements) {
            if (!element.reachesPositiveZ() || !filter.accepts(element.category())) {
                continue;
            }
            if (!element.covers(eta)) {
                continue;
            }
            TubeIntersection.Crossing crossing;
            if (element.isVertical()) {
                crossing = TubeIntersection.atPlane(element.zOffset() + element.zLength() / 2.0, theta);
            } else {
                crossing = TubeIntersection.atCylinder(element.innerRadius() + element.rWidth() / 2.0, theta);
            }
            context.positionMap().fillRZ(crossing.r(), crossing.z(), element.material());
            var corrected = correctedMaterial(element, theta);
            if (element.isInTrackingVolume()) {
                radiation += corrected.radiation();
                interaction += corrected.interaction();
                if (!isPixel) {
                    context.cellGrid().fill(crossing.r(), eta, corrected);
                }
                track.addHit(Hit.inactive(crossing.distance(), element.orientation(), corrected));
            } else {
                if (!isPixel) {
                    bookOutside(element.category(), eta, corrected, context);
                }
                track.addHit(Hit.inactive(crossing.distance(), element.orientation(), Material.ZERO));
            }
            log.trace("eta {} crossed {} at {}: {}", eta, element, crossing.distance(), corrected);
        }
        return new Material(radiation, interaction);
    }

    private static void bookOutside(Category category, double eta, Material corrected, ScanContext context) {
        if (category.isService()) {
            context.histograms().fill(BudgetSummary.EXTRA_SERVICES, eta, corrected);
        } else if (category.isSupport() || category == Category.USER_DEFINED_SUPPORT) {
            context.histograms().fill(BudgetSummary.EXTRA_SUPPORTS, eta, corrected);
        }
    }
}
