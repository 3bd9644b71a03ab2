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

package com.hellblazer.ember.navigation.planning;

import com.hellblazer.ember.navigation.Node;
import com.hellblazer.ember.navigation.hazard.HazardSnapshot;

import java.util.Objects;

/**
 * One planning call.
 *
 * @param start         node to plan from
 * @param target        node to reach
 * @param hazard        hazard intensities at planning time
 * @param riskTolerance in [0, 1]; 1 ignores hazard entirely, 0 applies the full danger weight
 * @param penalty       extra per-node cost term
 */
public record PlanRequest(Node start, Node target, HazardSnapshot hazard, double riskTolerance,
                          NodePenalty penalty) {

    public PlanRequest {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(hazard, "hazard");
        if (riskTolerance < 0.0 || riskTolerance > 1.0 || Double.isNaN(riskTolerance)) {
            throw new IllegalArgumentException("Risk tolerance must lie in [0, 1]: " + riskTolerance);
        }
        penalty = penalty == null ? NodePenalty.NONE : penalty;
    }

    public PlanRequest(Node start, Node target, HazardSnapshot hazard, double riskTolerance) {
        this(start, target, hazard, riskTolerance, NodePenalty.NONE);
    }
}
