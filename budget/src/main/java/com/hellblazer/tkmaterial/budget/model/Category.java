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
 * Logical categories of the detector volumes; every element belongs to exactly one. {@link #NONE} doubles as the
 * "any category" filter.
 *
 * @author hal.hildebrand
 */
public enum Category {
    NONE, BARREL_MODULE, ENDCAP_MODULE, BARREL_SERVICE, ENDCAP_SERVICE, BARREL_SUPPORT, ENDCAP_SUPPORT, SUPPORT_TUBE,
    BARREL_SUPPORT_TUBE, USER_DEFINED_SUPPORT;

    public boolean isService() {
        return this == BARREL_SERVICE || this == ENDCAP_SERVICE;
    }

    /**
     * User defined supports are not counted here: outside the tracking volume they are booked as supports by their own
     * rule.
     */
    public boolean isSupport() {
        return this == BARREL_SUPPORT || this == ENDCAP_SUPPORT || this == SUPPORT_TUBE || this == BARREL_SUPPORT_TUBE;
    }

    /**
     * @return true if an element of category {@code category} passes this filter
     */
    public boolean accepts(Category category) {
        return this == NONE || this == category;
    }
}
