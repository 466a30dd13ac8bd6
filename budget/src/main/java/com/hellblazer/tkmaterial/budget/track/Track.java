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
package com.hellblazer.tkmaterial.budget.track;

import com.hellblazer.tkmaterial.budget.model.Material;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * The hits of one straight trajectory. Hits are appended in scan order and sorted by distance from the origin before
 * the track is handed to a {@link ResolutionEstimator}.
 *
 * @author hal.hildebrand
 */
public final class Track {

    private final double    theta;
    private final List<Hit> hits = new ArrayList<>();

    public Track(double theta) {
        this.theta = theta;
    }

    public void addHit(Hit hit) {
        hits.add(hit);
    }

    /**
     * Order hits by increasing distance from the origin. Stable for equal distances.
     */
    public void sort() {
        hits.sort(Comparator.comparingDouble(Hit::distance));
    }

    public boolean hasHits() {
        return !hits.isEmpty();
    }

    public int size() {
        return hits.size();
    }

    public List<Hit> hits() {
        return Collections.unmodifiableList(hits);
    }

    public double theta() {
        return theta;
    }

    /**
     * @return sum of the material of all hits
     */
    public Material totalMaterial() {
        var radiation = 0.0;
        var interaction = 0.0;
        for (var hit : hits) {
            radiation += hit.material().radiation();
            interaction += hit.material().interaction();
        }
        return new Material(radiation, interaction);
    }

    /**
     * @return a copy with the same hits and no material, the reference for material free resolution
     */
    public Track withoutMaterial() {
        var ideal = new Track(theta);
        for (var hit : hits) {
            ideal.addHit(hit.withoutMaterial());
        }
        return ideal;
    }

    @Override
    public String toString() {
        return "Track[theta=" + theta + ", hits=" + hits.size() + "]";
    }
}
