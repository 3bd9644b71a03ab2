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

package com.hellblazer.ember.simulation.mission;

import com.hellblazer.ember.simulation.knowledge.KnowledgeSummary;

/**
 * Everything a mission knows about the run it belongs to.
 *
 * @param summary   knowledge accumulated before this attempt
 * @param iteration 1-based attempt number, also the mission id suffix
 * @param seed      seed of every random choice the mission makes
 * @author hal.hildebrand
 */
public record RunContext(KnowledgeSummary summary, int iteration, long seed) {

    public RunContext {
        if (summary == null) {
            throw new IllegalArgumentException("summary is required");
        }
        if (iteration <= 0) {
            throw new IllegalArgumentException("iteration must be positive: " + iteration);
        }
    }
}
