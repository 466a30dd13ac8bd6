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
 * Mean of a quantity in bins of a uniform axis.
 *
 * @author hal.hildebrand
 */
public final class EtaProfile {

    private final String   name;
    private final Axis     axis;
    private final double[] sums;
    private final long[]   entries;

    public EtaProfile(String name, Axis axis) {
        this.name = name;
        this.axis = axis;
        sums = new double[axis.bins()];
        entries = new long[axis.bins()];
    }

    public void fill(double x, double value) {
        var bin = axis.indexOf(x);
        if (bin != Axis.NO_BIN) {
            sums[bin] += value;
            entries[bin]++;
        }
    }

    /**
     * @return the mean of the bin, 0 for an empty bin
     */
    public double mean(int bin) {
        return entries[bin] == 0 ? 0 : sums[bin] / entries[bin];
    }

    public double meanAt(double x) {
        var bin = axis.indexOf(x);
        return bin == Axis.NO_BIN ? 0 : mean(bin);
    }

    public long entries(int bin) {
        return entries[bin];
    }

    public long totalEntries() {
        var total = 0L;
        for (var e : entries) {
            total += e;
        }
        return total;
    }

    public Axis axis() {
        return axis;
    }

    public String name() {
        return name;
    }
}
