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

package com.hellblazer.ember.simulation.knowledge;

import com.hellblazer.ember.simulation.agent.AgentStatus;

import java.util.List;

/**
 * What one agent did during a mission.
 *
 * @param agentId          agent index within the mission
 * @param riskTolerance    tolerance the agent planned with
 * @param status           final state
 * @param finalHealth      health when the mission ended
 * @param cumulativeDanger sum of live intensities over the cells entered
 * @param replans          number of replanning calls
 * @param trajectory       cells visited, start first
 * @param deathPosition    where the agent died, null if it did not
 * @param cause            cause of death or stall, null otherwise
 * @param decisions        planning and state decisions in order
 */
public record AgentRecord(int agentId, double riskTolerance, AgentStatus status, double finalHealth,
                          double cumulativeDanger, int replans, List<GridCell> trajectory, GridCell deathPosition,
                          String cause, List<String> decisions) {

    public AgentRecord {
        trajectory = List.copyOf(trajectory);
        decisions = List.copyOf(decisions);
    }

    public boolean reachedTarget() {
        return status == AgentStatus.REACHED_TARGET;
    }
}
