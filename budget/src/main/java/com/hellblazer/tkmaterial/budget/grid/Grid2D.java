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
 * Weighted 2D histogram over uniform x and y axes. Fills outside the axis ranges are dropped.
 *
 * @author hal.hildebrand
 */
public final class Grid2D {

    private final String     name;
    private final Axis       xAxis;
    private final Axis       yAxis;
    private final double[][] values;

    public Grid2D(String name, Axis xAxis, Axis yAxis) {
        this.name = name;
        this.xAxis = xAxis;
        this.yAxis = yAxis;
        this.values = new double[xAxis.bins()][yAxis.bins()];
    }

    /**
     * Add the weight to the bin holding (x, y)
     *
     * @return true if the point fell inside the grid
     */
    public boolean fill(double x, double y, double weight) {
        var i = xAxis.indexOf(x);
        var j = yAxis.indexOf(y);
        if (i == Axis.NO_BIN || j == Axis.NO_BIN) {
            return false;
        }
        values[i][j] += weight;
        return true;
    }

    public double get(int i, int j) {
        return values[i][j];
    }

    public void set(int i, int j, double value) {
        values[i][j] = value;
    }

    /**
     * @return the content of the bin holding (x, y), 0 outside the grid
     */
    public double contentAt(double x, double y) {
        var i = xAxis.indexOf(x);
        var j = yAxis.indexOf(y);
        if (i == Axis.NO_BIN || j == Axis.NO_BIN) {
            return 0;
        }
        return values[i][j];
    }

    public void add(Grid2D other) {
        if (!xAxis.equals(other.xAxis) || !yAxis.equals(other.yAxis)) {
            throw new IllegalArgumentException("Incompatible grids " + name + " and " + other.name);
        }
        for (int i = 0; i < values.length; i++) {
            for (int j = 0; j < values[i].length; j++) {
                values[i][j] += other.values[i][j];
            }
        }
    }

    public double sum() {
        var sum = 0.0;
        for (var row : values) {
            for (var v : row) {
                sum += v;
            }
        }
        return sum;
    }

    public void reset() {
        for (var row : values) {
            Arrays.fill(row, 0);
        }
    }

    public Grid2D emptyCopy() {
        return new Grid2D(name, xAxis, yAxis);
    }

    public Axis xAxis() {
        return xAxis;
    }

    public Axis yAxis() {
        return yAxis;
    }

    public String name() {
        return name;
    }
}
