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

import com.hellblazer.ember.navigation.hazard.HazardField;
import com.hellblazer.ember.navigation.hazard.HazardSnapshot;

import java.util.function.Supplier;

/**
 * What an agent sees during one global tick.
 *
 * @param number   tick index, starting at 0
 * @param hazard   live hazard field, already advanced for this tick
 * @param snapshot planning snapshot of the live field, captured at most once per tick
 * @param channel  mission-wide observation channel
 */
public record Tick(int number, HazardField hazard, Supplier<HazardSnapshot> snapshot, KnowledgeChannel channel) {
}
