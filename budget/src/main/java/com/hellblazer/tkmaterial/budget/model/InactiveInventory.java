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

import java.util.List;

/**
 * The passive volumes of a detector, grouped the way the material scan books them.
 *
 * @author hal.hildebrand
 */
public record InactiveInventory(List<InactiveElement> barrelServices, List<InactiveElement> endcapServices,
                                List<InactiveElement> supports) {

    public static final InactiveInventory EMPTY = new InactiveInventory(List.of(), List.of(), List.of());

    public InactiveInventory {
        barrelServices = List.copyOf(barrelServices);
        endcapServices = List.copyOf(endcapServices);
        supports = List.copyOf(supports);
    }

    public int size() {
        return barrelServices.size() + endcapServices.size() + supports.size();
    }
}
