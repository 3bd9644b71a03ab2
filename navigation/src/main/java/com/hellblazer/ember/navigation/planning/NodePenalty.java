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

/**
 * Extra, non-negative cost term per node, added to the hazard intensity before danger weighting.
 * Combines the persistent penalty learned from past missions with the transient penalty from
 * observations shared by other agents of the current mission.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface NodePenalty {

    NodePenalty NONE = node -> 0.0;

    double penaltyAt(Node node);

    default NodePenalty plus(NodePenalty other) {
        if (other == NONE) {
            return this;
        }
        if (this == NONE) {
            return other;
        }
        return node -> penaltyAt(node) + other.penaltyAt(node);
    }
}
