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

/**
 * One (eta, r) bin of the {@link CellGrid} with its accumulated radiation and interaction length.
 *
 * @author hal.hildebrand
 */
public final class Cell {
    private final double etaMin;
    private final double etaMax;
    private final double rMin;
    private final double rMax;
    private       double rlength;
    private       double ilength;

    public Cell(double etaMin, double etaMax, double rMin, double rMax) {
        this.etaMin = etaMin;
        this.etaMax = etaMax;
        this.rMin = rMin;
        this.rMax = rMax;
    }

    void add(double radiation, double interaction) {
        rlength += radiation;
        ilength += interaction;
    }

    public double rlength() {
        return rlength;
    }

    public double ilength() {
        return ilength;
    }

    public double etaMin() {
        return etaMin;
    }

    public double etaMax() {
        return etaMax;
    }

    public double rMin() {
        return rMin;
    }

    public double rMax() {
        return rMax;
    }

    @Override
    public String toString() {
        return "Cell[eta " + etaMin + ".." + etaMax + ", r " + rMin + ".." + rMax + ", rl=" + rlength + ", il="
        + ilength + "]";
    }
}
