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

import com.hellblazer.ember.common.ConfigurationException;
import com.hellblazer.ember.navigation.GraphConfig;
import com.hellblazer.ember.navigation.hazard.PatrolConfig;
import com.hellblazer.ember.navigation.hazard.SpreadingConfig;
import com.hellblazer.ember.navigation.planning.PlannerConfig;
import com.hellblazer.ember.simulation.agent.AgentConfig;
import com.hellblazer.ember.simulation.mission.MissionConfig;

import java.util.ArrayList;

/**
 * Every tunable of a run in one place. Sections are validated on their own when built; this class
 * checks that they fit together, so a mismatch is rejected before any mission starts.
 *
 * @author hal.hildebrand
 */
public class SimulationConfig {
    private final GraphConfig     graph;
    private final SpreadingConfig fire;
    private final PatrolConfig    attacker;
    private final PlannerConfig   planner;
    private final AgentConfig     agent;
    private final MissionConfig   mission;

    private SimulationConfig(Builder builder) {
        this.graph = builder.graph;
        this.fire = builder.fire;
        this.attacker = builder.attacker;
        this.planner = builder.planner;
        this.agent = builder.agent;
        this.mission = builder.mission;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SimulationConfig defaults() {
        return builder().build();
    }

    public Builder toBuilder() {
        return new Builder().graph(graph).fire(fire).attacker(attacker).planner(planner).agent(agent).mission(mission);
    }

    public GraphConfig getGraph() {
        return graph;
    }

    public SpreadingConfig getFire() {
        return fire;
    }

    public PatrolConfig getAttacker() {
        return attacker;
    }

    public PlannerConfig getPlanner() {
        return planner;
    }

    public AgentConfig getAgent() {
        return agent;
    }

    public MissionConfig getMission() {
        return mission;
    }

    private void validate() {
        var errors = new ArrayList<String>();
        if (attacker.getUpperLevel() >= graph.getLevels()) {
            errors.add(String.format("patrol level %d outside the %d-level graph", attacker.getUpperLevel(),
                                     graph.getLevels()));
        }
        double extent = graph.getGridResolution() * graph.getCellSize();
        for (var waypoint : attacker.getWaypoints()) {
            if (waypoint.x() < 0.0 || waypoint.x() > extent || waypoint.y() < 0.0 || waypoint.y() > extent) {
                errors.add("patrol waypoint outside the grid: " + waypoint);
            }
        }
        ConfigurationException.throwIfAny("simulation configuration", errors);
    }

    @Override
    public String toString() {
        return "SimulationConfig{" + graph + ", " + fire + ", " + attacker + ", " + planner + ", " + agent + ", "
        + mission + "}";
    }

    public static class Builder {
        private GraphConfig     graph    = GraphConfig.defaults();
        private SpreadingConfig fire     = SpreadingConfig.defaults();
        private PatrolConfig    attacker = PatrolConfig.defaults();
        private PlannerConfig   planner  = PlannerConfig.defaults();
        private AgentConfig     agent    = AgentConfig.defaults();
        private MissionConfig   mission  = MissionConfig.defaults();

        public Builder graph(GraphConfig graph) {
            this.graph = graph;
            return this;
        }

        public Builder fire(SpreadingConfig fire) {
            this.fire = fire;
            return this;
        }

        public Builder attacker(PatrolConfig attacker) {
            this.attacker = attacker;
            return this;
        }

        public Builder planner(PlannerConfig planner) {
            this.planner = planner;
            return this;
        }

        public Builder agent(AgentConfig agent) {
            this.agent = agent;
            return this;
        }

        public Builder mission(MissionConfig mission) {
            this.mission = mission;
            return this;
        }

        public SimulationConfig build() {
            var config = new SimulationConfig(this);
            config.validate();
            return config;
        }
    }
}
