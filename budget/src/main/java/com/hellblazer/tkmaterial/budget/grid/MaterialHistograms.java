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
package com.hellblazer.tkmaterial.budget.grid;

import com.hellblazer.tkmaterial.budget.model.Material;

import java.util.EnumMap;
import java.util.Map;

/**
 * Radiation and interaction length versus pseudorapidity for every {@link BudgetSummary}.
 *
 * @author hal.hildebrand
 */
public final class MaterialHistograms {

    private final Axis                             axis;
    private final Map<BudgetSummary, EtaHistogram> radiation   = new EnumMap<>(BudgetSummary.class);
    private final Map<BudgetSummary, EtaHistogram> interaction = new EnumMap<>(BudgetSummary.class);

    public MaterialHistograms(Axis axis) {
        this.axis = axis;
        for (var summary : BudgetSummary.values()) {
            radiation.put(summary, new EtaHistogram("r" + summary.key(), "Radiation Length " + summary.label(), axis));
            interaction.put(summary,
                            new EtaHistogram("i" + summary.key(), "Interaction Length " + summary.label(), axis));
        }
    }

    public void fill(BudgetSummary summary, double eta, Material material) {
        radiation.get(summary).fill(eta, material.radiation());
        interaction.get(summary).fill(eta, material.interaction());
    }

    /**
     * Fill several summaries with the same material
     */
    public void fill(double eta, Material material, BudgetSummary... summaries) {
        for (var summary : summaries) {
            fill(summary, eta, material);
        }
    }

    public EtaHistogram radiation(BudgetSummary summary) {
        return radiation.get(summary);
    }

    public EtaHistogram interaction(BudgetSummary summary) {
        return interaction.get(summary);
    }

    public void add(MaterialHistograms other) {
        for (var summary : BudgetSummary.values()) {
            radiation.get(summary).add(other.radiation.get(summary));
            interaction.get(summary).add(other.interaction.get(summary));
        }
    }

    public MaterialHistograms emptyCopy() {
        return new MaterialHistograms(axis);
    }

    public Axis axis() {
        return axis;
    }
}
