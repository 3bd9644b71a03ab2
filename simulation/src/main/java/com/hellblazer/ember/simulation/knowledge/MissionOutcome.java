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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.hellblazer.ember.navigation.hazard.HazardKind;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Immutable record of one attempt. Contains no wall-clock values, so two runs of a seeded mission
 * serialize to identical bytes.
 *
 * @param missionId     "mission-NNNN", numbered by attempt
 * @param hazardKind    scenario
 * @param success       whether any agent reached the target
 * @param elapsedTime   simulated seconds
 * @param ticks         ticks executed
 * @param failureReason {@link #ALL_AGENTS_FAILED}, {@link #TIMEOUT} or {@link #ABORTED}; null on success
 * @param agents        per-agent records in agent order
 * @author hal.hildebrand
 */
public record MissionOutcome(String missionId, HazardKind hazardKind, boolean success, double elapsedTime, int ticks,
                             String failureReason, List<AgentRecord> agents) {

    public static final String ALL_AGENTS_FAILED = "all_agents_failed";
    public static final String TIMEOUT           = "timeout";
    public static final String ABORTED           = "aborted";

    public MissionOutcome {
        agents = List.copyOf(agents);
    }

    public static String missionId(int attempt) {
        return String.format("mission-%04d", attempt);
    }

    @JsonIgnore
    public int agentCount() {
        return agents.size();
    }

    /**
     * The successful agent that collected the least danger on the way.
     */
    @JsonIgnore
    public Optional<AgentRecord> bestTrajectory() {
        return agents.stream()
                     .filter(AgentRecord::reachedTarget)
                     .min(Comparator.comparingDouble(AgentRecord::cumulativeDanger)
                                    .thenComparingInt(AgentRecord::agentId));
    }
}
