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

package com.hellblazer.ember.simulation;

import com.hellblazer.ember.navigation.hazard.HazardKind;
import com.hellblazer.ember.simulation.agent.AgentStatus;
import com.hellblazer.ember.simulation.knowledge.MissionOutcome;

import java.util.List;

/**
 * Progress notifications of a run.
 * <p>
 * Events are immutable records delivered in the order they happen within a mission. Events of
 * missions running in parallel may interleave, but every event names its mission.
 *
 * @author hal.hildebrand
 */
public sealed interface SimulationEvent permits SimulationEvent.IterationStarted, SimulationEvent.PlanComputed,
                                                SimulationEvent.AgentStatusChanged, SimulationEvent.MissionEnded,
                                                SimulationEvent.PersistenceWarning {

    /**
     * Mission that generated this event.
     */
    String missionId();

    /**
     * A mission is about to start.
     *
     * @param missionId     mission identifier
     * @param iteration     attempt number
     * @param scenario      hazard scenario
     * @param teamTolerance risk tolerance before the per-agent spread
     * @param priorAttempts attempts already folded into the mission's knowledge
     */
    record IterationStarted(String missionId, int iteration, HazardKind scenario, double teamTolerance,
                            int priorAttempts) implements SimulationEvent {
    }

    /**
     * An agent planned or replanned.
     *
     * @param missionId mission identifier
     * @param tick      tick of the plan
     * @param agentId   planning agent
     * @param replan    whether this replaced an earlier plan
     * @param path      planned node ids, start first
     * @param cost      weighted cost of the plan
     */
    record PlanComputed(String missionId, int tick, int agentId, boolean replan, List<Integer> path, double cost)
    implements SimulationEvent {

        public PlanComputed {
            path = List.copyOf(path);
        }
    }

    /**
     * An agent moved to a new state.
     *
     * @param missionId mission identifier
     * @param tick      tick of the change
     * @param agentId   agent
     * @param from      previous state
     * @param to        new state
     * @param health    health after the change
     */
    record AgentStatusChanged(String missionId, int tick, int agentId, AgentStatus from, AgentStatus to,
                              double health) implements SimulationEvent {
    }

    /**
     * A mission produced its outcome.
     *
     * @param missionId mission identifier
     * @param outcome   the outcome
     * @param persisted whether the knowledge store accepted it
     */
    record MissionEnded(String missionId, MissionOutcome outcome, boolean persisted) implements SimulationEvent {
    }

    /**
     * The knowledge store rejected an outcome; the run continues on in-memory knowledge.
     *
     * @param missionId mission identifier
     * @param message   store failure
     */
    record PersistenceWarning(String missionId, String message) implements SimulationEvent {
    }
}
