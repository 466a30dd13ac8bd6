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

import com.hellblazer.tkmaterial.budget.model.Category;

/**
 * The material summaries booked versus pseudorapidity. Single category summaries are filled by one group of elements,
 * the composite ones collect several groups.
 *
 * @author hal.hildebrand
 */
public enum BudgetSummary {
    ACTIVE_BARREL("activebarrel", "Active Barrel"),
    ACTIVE_ENDCAP("activeendcap", "Active Endcap"),
    SERVICES_BARREL("serfbarrel", "Services Barrel"),
    SERVICES_ENDCAP("serfendcap", "Services Endcap"),
    SUPPORTS_BARREL("lazybarrel", "Supports Barrel"),
    SUPPORTS_ENDCAP("lazyendcap", "Supports Endcap"),
    SUPPORTS_TUBE("lazytube", "Supports Tubes"),
    SUPPORTS_BARREL_TUBE("lazybtube", "Supports Barrel Tubes"),
    SUPPORTS_USER_DEFINED("lazyuserdef", "Supports User Defined"),
    BARREL_ALL("barrelall", "Barrel Modules"),
    ENDCAP_ALL("endcapall", "Endcap Modules"),
    ACTIVE_ALL("activeall", "Modules"),
    SERVICES_ALL("serfall", "Services"),
    SUPPORTS_ALL("lazyall", "Supports"),
    GLOBAL("global", "Overall"),
    EXTRA_SERVICES("extraservices", "Services Outside Tracking Volume"),
    EXTRA_SUPPORTS("extrasupports", "Supports Outside Tracking Volume");

    private final String key;
    private final String label;

    BudgetSummary(String key, String label) {
        this.key = key;
        this.label = label;
    }

    /**
     * @return the single category summary of a support category, or null if the category is not a support
     */
    public static BudgetSummary ofSupport(Category category) {
        return switch (category) {
            case BARREL_SUPPORT -> SUPPORTS_BARREL;
            case ENDCAP_SUPPORT -> SUPPORTS_ENDCAP;
            case SUPPORT_TUBE -> SUPPORTS_TUBE;
            case BARREL_SUPPORT_TUBE -> SUPPORTS_BARREL_TUBE;
            case USER_DEFINED_SUPPORT -> SUPPORTS_USER_DEFINED;
            default -> null;
        };
    }

    /**
     * @return short name, prefixed with "r" or "i" for the radiation and interaction histograms
     */
    public String key() {
        return key;
    }

    public String label() {
        return label;
    }
}
