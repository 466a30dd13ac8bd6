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

import com.hellblazer.tkmaterial.budget.model.ActiveElement;
import com.hellblazer.tkmaterial.budget.model.ActiveLayer;
import com.hellblazer.tkmaterial.budget.model.Category;
import com.hellblazer.tkmaterial.budget.model.InactiveElement;
import com.hellblazer.tkmaterial.budget.model.Material;
import com.hellblazer.tkmaterial.budget.track.Track;
import com.hellblazer.tkmaterial.geometry.Pseudorapidity;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.DoubleRange;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Property tests: material collected along any trajectory is non negative and equals the material of the hits left
 * in the track.
 *
 * @author hal.hildebrand
 */
class AccumulatorAdditivityPropertyTest {

    private static final List<ActiveLayer> LAYERS = List.of(new ActiveLayer("L1", List.of(
    ActiveElement.barrel("pt", 100, Math.PI / 2, 20, -400, 400, new Material(0.02, 0.01)))));

    private static final List<InactiveElement> INACTIVE = List.of(
    InactiveElement.builder().radius(150, 5).z(-600, 1200).category(Category.BARREL_SERVICE).material(0.01, 0.005)
                   .build(),
    InactiveElement.builder()
                   .radius(20, 300)
                   .z(500, 10)
                   .vertical(true)
                   .category(Category.ENDCAP_SERVICE)
                   .material(0.03, 0.01)
                   .build(),
    InactiveElement.builder()
                   .radius(40, 10)
                   .z(0, 40)
                   .category(Category.USER_DEFINED_SUPPORT)
                   .material(0.05, 0.02)
                   .build());

    @Property(tries = 200)
    void collectedMaterialEqualsTrackMaterial(@ForAll @DoubleRange(min = 0, max = 2.5) double eta) {
        var theta = Pseudorapidity.theta(eta);
        var track = new Track(theta);
        var context = TrajectoryAccumulatorTest.testContext();
        var accumulator = new TrajectoryAccumulator();

        var active = accumulator.analyzeModules(LAYERS, eta, theta, Math.PI / 2, track, context, false);
        var inactive = accumulator.analyzeInactive(INACTIVE, eta, theta, track, Category.NONE, context, false);

        var total = active.plus(inactive);
        assertTrue(total.radiation() >= 0);
        assertTrue(total.interaction() >= 0);
        assertEquals(total.radiation(), track.totalMaterial().radiation(), 1e-12);
        assertEquals(total.interaction(), track.totalMaterial().interaction(), 1e-12);
    }
}
