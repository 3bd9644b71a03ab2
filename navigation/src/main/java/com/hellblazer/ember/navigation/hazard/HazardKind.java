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

package com.hellblazer.ember.navigation.hazard;

import com.hellblazer.ember.common.ConfigurationException;

/**
 * The two hazard variants. Each kind doubles as a scenario name.
 *
 * @author hal.hildebrand
 */
public enum HazardKind {
    /** Spreading hazard: grows outward from its origins, hotter on higher levels */
    FIRE("fire"),
    /** Patrolling hazard: moves along a fixed route across two levels */
    ATTACKER("attacker");

    private final String scenario;

    HazardKind(String scenario) {
        this.scenario = scenario;
    }

    public String scenario() {
        return scenario;
    }

    public static HazardKind fromScenario(String name) {
        for (var kind : values()) {
            if (kind.scenario.equalsIgnoreCase(name)) {
                return kind;
            }
        }
        throw new ConfigurationException("Unknown scenario: " + name + " (expected fire or attacker)");
    }
}
