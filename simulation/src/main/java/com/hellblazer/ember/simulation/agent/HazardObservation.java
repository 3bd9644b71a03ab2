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

package com.hellblazer.ember.simulation.agent;

import com.hellblazer.ember.navigation.Node;

/**
 * A hazard reading above the replanning threshold, shared with the other agents of a mission.
 *
 * @param sourceAgent id of the agent that observed it
 * @param node        where
 * @param intensity   live intensity observed
 * @param tick        when
 */
public record HazardObservation(int sourceAgent, Node node, double intensity, int tick) {
}
