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

/**
 * Material deposited at (z, r) positions of the crossings, with the number of crossings per bin. Calibration turns the
 * raw sums into the mean material of one crossing in each bin.
 * <p>
 * Radiation and interaction keep their own counts: a fill is counted only for the component it actually adds to.
 *
 * @author hal.hildebrand
 */
public final class PositionMap {
    /** Bin width of the maps built for a detector, in mm */
    public static final double BIN_WIDTH = 5.0;
    /** Fraction of the tracking volume added beyond its edge */
    public static final double OVERSIZE  = 1.1;

    private final Axis       zAxis;
    private final Axis       rAxis;
    private final double[][] radiationSum;
    private final double[][] interactionSum;
    private final int[][]    radiationCount;
    private final int[][]    interactionCount;
    private final Grid2D     radiation;
    private final Grid2D     interaction;

    public PositionMap(Axis zAxis, Axis rAxis) {
        this.zAxis = zAxis;
        this.rAxis = rAxis;
        radiationSum = new double[zAxis.bins()][rAxis.bins()];
        interactionSum = new double[zAxis.bins()][rAxis.bins()];
        radiationCount = new int[zAxis.bins()][rAxis.bins()];
        interactionCount = new int[zAxis.bins()][rAxis.bins()];
        radiation = new Grid2D("mapRadiation", zAxis, rAxis);
        interaction = new Grid2D("mapInteraction", zAxis, rAxis);
    }

    /**
     * Map covering the tracking volume plus ten percent, in bins of {@link #BIN_WIDTH}
     *
     * @param maxLength half length of the tracking volume
     * @param maxRadius radius of the tracking volume
     */
    public static PositionMap forVolume(double maxLength, double maxRadius) {
        var zMax = maxLength * OVERSIZE;
        var rMax = maxRadius * OVERSIZE;
        return new PositionMap(new Axis((int) (zMax / BIN_WIDTH), 0, zMax), new Axis((int) (rMax / BIN_WIDTH), 0, rMax));
    }

    /**
     * Record the material of a crossing at (z, r)
     *
     * @return false if the point lies outside the map
     */
    public boolean fillRZ(double r, double z, Material material) {
        var i = zAxis.indexOf(z);
        var j = rAxis.indexOf(r);
        if (i == Axis.NO_BIN || j == Axis.NO_BIN) {
            return false;
        }
        radiationSum[i][j] += material.radiation();
        interactionSum[i][j] += material.interaction();
        if (material.radiation() > 0) {
            radiationCount[i][j]++;
        }
        if (material.interaction() > 0) {
            interactionCount[i][j]++;
        }
        return true;
    }

    /**
     * Record the material of a crossing at radius r on a track of polar angle theta
     */
    public boolean fillRTheta(double r, double theta, Material material) {
        return fillRZ(r, r / Math.tan(theta), material);
    }

    /**
     * Derive the calibrated maps: bins crossed once keep the raw sum, bins crossed more often take the mean, bins never
     * crossed keep their previous value. Calling it again gives the same maps.
     */
    public void calibrate() {
        calibrate(radiation, radiationSum, radiationCount);
        calibrate(interaction, interactionSum, interactionCount);
    }

    private static void calibrate(Grid2D target, double[][] sums, int[][] counts) {
        for (int i = 0; i < sums.length; i++) {
            for (int j = 0; j < sums[i].length; j++) {
                var count = counts[i][j];
                if (count == 1) {
                    target.set(i, j, sums[i][j]);
                } else if (count > 1) {
                    target.set(i, j, sums[i][j] / count);
                }
            }
        }
    }

    /**
     * Add the raw sums and counts of another map with the same binning
     */
    public void add(PositionMap other) {
        if (!zAxis.equals(other.zAxis) || !rAxis.equals(other.rAxis)) {
            throw new IllegalArgumentException("Incompatible position maps");
        }
        for (int i = 0; i < radiationSum.length; i++) {
            for (int j = 0; j < radiationSum[i].length; j++) {
                radiationSum[i][j] += other.radiationSum[i][j];
                interactionSum[i][j] += other.interactionSum[i][j];
                radiationCount[i][j] += other.radiationCount[i][j];
                interactionCount[i][j] += other.interactionCount[i][j];
            }
        }
    }

    public PositionMap emptyCopy() {
        return new PositionMap(zAxis, rAxis);
    }

    public double radiationSum(int i, int j) {
        return radiationSum[i][j];
    }

    public double interactionSum(int i, int j) {
        return interactionSum[i][j];
    }

    public int radiationCount(int i, int j) {
        return radiationCount[i][j];
    }

    public int interactionCount(int i, int j) {
        return interactionCount[i][j];
    }

    /**
     * @return total number of counted radiation crossings
     */
    public long radiationEntries() {
        var total = 0L;
        for (var row : radiationCount) {
            for (var c : row) {
                total += c;
            }
        }
        return total;
    }

    /**
     * @return the calibrated radiation map, valid after {@link #calibrate()}
     */
    public Grid2D radiation() {
        return radiation;
    }

    /**
     * @return the calibrated interaction map, valid after {@link #calibrate()}
     */
    public Grid2D interaction() {
        return interaction;
    }

    public Axis zAxis() {
        return zAxis;
    }

    public Axis rAxis() {
        return rAxis;
    }
}
