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

import java.util.Arrays;

/**
 * Weighted 1D histogram. Fills outside the axis range are dropped.
 *
 * @author hal.hildebrand
 */
public final class EtaHistogram {

    private final String   name;
    private final String   title;
    private final Axis     axis;
    private final double[] contents;

    public EtaHistogram(String name, String title, Axis axis) {
        this.name = name;
        this.title = title;
        this.axis = axis;
        this.contents = new double[axis.bins()];
    }

    public void fill(double x, double weight) {
        var bin = axis.indexOf(x);
        if (bin != Axis.NO_BIN) {
            contents[bin] += weight;
        }
    }

    public double content(int bin) {
        return contents[bin];
    }

    /**
     * @return the content of the bin holding x, 0 outside the range
     */
    public double contentAt(double x) {
        var bin = axis.indexOf(x);
        return bin == Axis.NO_BIN ? 0 : contents[bin];
    }

    public double[] contents() {
        return contents.clone();
    }

    public double integral() {
        var sum = 0.0;
        for (var c : contents) {
            sum += c;
        }
        return sum;
    }

    public void reset() {
        Arrays.fill(contents, 0);
    }

    /**
     * Bin-wise sum; both histograms must share the axis
     */
    public void add(EtaHistogram other) {
        if (!axis.equals(other.axis)) {
            throw new IllegalArgumentException("Incompatible axes: " + axis + " and " + other.axis);
        }
        for (int i = 0; i < contents.length; i++) {
            contents[i] += other.contents[i];
        }
    }

    public EtaHistogram emptyCopy() {
        return new EtaHistogram(name, title, axis);
    }

    public Axis axis() {
        return axis;
    }

    public String name() {
        return name;
    }

    public String title() {
        return title;
    }
}
