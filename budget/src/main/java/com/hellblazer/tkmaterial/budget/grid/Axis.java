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
 * Uniform binning of the interval [min, max]. Bins are half open except the last one, which also takes the upper
 * edge. Values outside the interval have no bin.
 *
 * @author hal.hildebrand
 */
public record Axis(int bins, double min, double max) {

    public static final int NO_BIN = -1;

    public Axis {
        if (bins < 0) {
            throw new IllegalArgumentException("Negative bin count: " + bins);
        }
        if (max < min) {
            throw new IllegalArgumentException("Axis max " + max + " below min " + min);
        }
    }

    public double width() {
        return bins == 0 ? 0 : (max - min) / bins;
    }

    /**
     * @return the bin holding x, or {@link #NO_BIN}
     */
    public int indexOf(double x) {
        if (bins == 0 || Double.isNaN(x) || x < min || x > max) {
            return NO_BIN;
        }
        if (max == min) {
            return 0;
        }
        var index = (int) ((x - min) / width());
        return Math.min(index, bins - 1);
    }

    public double lowEdge(int bin) {
        return min + bin * width();
    }

    public double center(int bin) {
        return min + (bin + 0.5) * width();
    }
}
