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
package com.hellblazer.tkmaterial.budget.model;

/**
 * Subdetector family of an active module.
 *
 * @author hal.hildebrand
 */
public enum Subdetector {
    BARREL(Orientation.HORIZONTAL), ENDCAP(Orientation.VERTICAL), OTHER(null);

    private final Orientation orientation;

    Subdetector(Orientation orientation) {
        this.orientation = orientation;
    }

    /**
     * @return the surface orientation, null for {@link #OTHER}
     */
    public Orientation orientation() {
        return orientation;
    }

    /**
     * @return true if modules of this family take part in the material scan
     */
    public boolean isScanned() {
        return orientation != null;
    }
}
