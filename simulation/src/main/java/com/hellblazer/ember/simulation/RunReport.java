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
import com.hellblazer.ember.simulation.knowledge.KnowledgeSummary;
import com.hellblazer.ember.simulation.knowledge.MissionOutcome;

import java.util.List;
import java.util.Optional;

/**
 * Result of a run: its missions in attempt order and the knowledge they left behind.
 *
 * @param scenario            hazard scenario
 * @param outcomes            mission outcomes in attempt order
 * @param summary             knowledge after the last mission
 * @param persistenceFailures outcomes the store did not accept
 * @param cancelled           whether the run was cancelled
 * @author hal.hildebrand
 */
public record RunReport(HazardKind scenario, List<MissionOutcome> outcomes, KnowledgeSummary summary,
                        int persistenceFailures, boolean cancelled) {

    public RunReport {
        outcomes = List.copyOf(outcomes);
    }

    public int missions() {
        return outcomes.size();
    }

    public int successes() {
        return (int) outcomes.stream().filter(MissionOutcome::success).count();
    }

    public double successRate() {
        return outcomes.isEmpty() ? 0.0 : (double) successes() / outcomes.size();
    }

    public Optional<MissionOutcome> firstSuccess() {
        return outcomes.stream().filter(MissionOutcome::success).findFirst();
    }

    @Override
    public String toString() {
        return String.format("RunReport{%s, missions=%d, successes=%d, persistenceFailures=%d%s}", scenario,
                             missions(), successes(), persistenceFailures, cancelled ? ", cancelled" : "");
    }
}
