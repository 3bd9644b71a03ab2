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

import com.hellblazer.ember.navigation.Node;
import com.hellblazer.ember.navigation.SpatialGraph;
import com.hellblazer.ember.navigation.hazard.HazardField;
import com.hellblazer.ember.navigation.hazard.HazardKind;
import com.hellblazer.ember.navigation.hazard.HazardSnapshot;
import com.hellblazer.ember.navigation.hazard.PatrollingHazard;
import com.hellblazer.ember.navigation.hazard.SpreadingHazard;
import com.hellblazer.ember.navigation.planning.PlannedPath;
import com.hellblazer.ember.navigation.planning.RiskAwarePlanner;
import com.hellblazer.ember.simulation.SimulationConfig;
import com.hellblazer.ember.simulation.SimulationEvent;
import com.hellblazer.ember.simulation.agent.AgentStatus;
import com.hellblazer.ember.simulation.agent.KnowledgeChannel;
import com.hellblazer.ember.simulation.agent.RescueAgent;
import com.hellblazer.ember.simulation.agent.Tick;
import com.hellblazer.ember.simulation.knowledge.AgentRecord;
import com.hellblazer.ember.simulation.knowledge.DeathPenaltyMap;
import com.hellblazer.ember.simulation.knowledge.GridCell;
import com.hellblazer.ember.simulation.knowledge.MissionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Runs one rescue attempt from start to outcome.
 * <p>
 * The coordinator owns the hazard and the agents of the attempt; the graph and planner are shared and
 * immutable. Each tick advances the hazard, delivers the observations agents shared during the
 * previous tick, then steps every agent in id order. The attempt ends when an agent reaches the
 * target, every agent is terminal, the tick or wall-clock budget is spent, or the caller cancels.
 * Exactly one {@link MissionOutcome} results either way.
 * <p>
 * Given the same graph, configuration, context and hints the outcome is identical: all randomness
 * comes from the context seed and nothing time-dependent is recorded.
 *
 * @author hal.hildebrand
 */
public class MissionCoordinator {
    private static final Logger log = LoggerFactory.getLogger(MissionCoordinator.class);

    private final SimulationConfig          config;
    private final SpatialGraph              graph;
    private final RiskAwarePlanner          planner;
    private final Consumer<SimulationEvent> listener;

    public MissionCoordinator(SimulationConfig config, SpatialGraph graph, Consumer<SimulationEvent> listener) {
        this.config = config;
        this.graph = graph;
        this.planner = new RiskAwarePlanner(graph, config.getPlanner());
        this.listener = listener == null ? event -> {
        } : listener;
    }

    public MissionCoordinator(SimulationConfig config, SpatialGraph graph) {
        this(config, graph, null);
    }

    /**
     * Run one attempt of the scenario of {@code context.summary()}.
     */
    public MissionOutcome run(RunContext context, HazardHintProvider hints, BooleanSupplier cancelled) {
        var mission = config.getMission();
        var summary = context.summary();
        var kind = summary.kind();
        var missionId = MissionOutcome.missionId(context.iteration());
        var random = new Random(context.seed());

        var hazard = buildHazard(kind, hints == null ? HazardHintProvider.none() : hints, random);
        double teamTolerance = mission.teamTolerance(summary.successRate(), !summary.isEmpty());
        log.info("Starting {} ({}): tolerance {} from {}", missionId, kind, String.format("%.3f", teamTolerance),
                 summary);
        listener.accept(new SimulationEvent.IterationStarted(missionId, context.iteration(), kind, teamTolerance,
                                                             summary.attempts()));

        var penalty = DeathPenaltyMap.build(graph, summary, mission.getPenaltyScale(), mission.getPenaltyDecay(),
                                            mission.getPenaltyRadius());
        if (penalty.contributing() > 0) {
            log.debug("{} avoids {} recorded deaths, max penalty {}", missionId, penalty.contributing(),
                      penalty.maxPenalty());
        }
        var observer = new Relay(missionId);
        var agents = new ArrayList<RescueAgent>();
        for (int i = 0; i < mission.getAgents(); i++) {
            agents.add(new RescueAgent(i, graph, planner, config.getAgent(), mission.agentTolerance(teamTolerance, i),
                                       penalty, observer));
        }

        var channel = new KnowledgeChannel();
        long deadline = mission.getWallClockBudget().map(budget -> System.nanoTime() + budget.toNanos()).orElse(0L);
        boolean timed = mission.getWallClockBudget().isPresent();
        int tick = 0;
        boolean success = false;
        String failureReason;
        while (true) {
            if (cancelled != null && cancelled.getAsBoolean()) {
                failureReason = MissionOutcome.ABORTED;
                break;
            }
            if (tick >= mission.getMaxTicks() || (timed && System.nanoTime() - deadline >= 0)) {
                failureReason = MissionOutcome.TIMEOUT;
                break;
            }
            tick++;
            hazard.advance(mission.getTickSeconds());
            channel.flushTo(agents);
            var current = new Tick(tick, hazard, new LazySnapshot(hazard, graph), channel);
            // the first rescuer to arrive ends the mission; later agents keep their state from the previous tick
            for (var agent : agents) {
                agent.step(current);
                if (agent.status() == AgentStatus.REACHED_TARGET) {
                    success = true;
                    break;
                }
            }
            if (success) {
                failureReason = null;
                break;
            }
            if (agents.stream().allMatch(agent -> agent.status().isTerminal())) {
                failureReason = MissionOutcome.ALL_AGENTS_FAILED;
                break;
            }
        }

        var records = new ArrayList<AgentRecord>();
        for (var agent : agents) {
            records.add(record(agent));
        }
        var outcome = new MissionOutcome(missionId, kind, success, hazard.elapsed(), tick, failureReason, records);
        log.info("{} {} after {} ticks ({}s){}", missionId, success ? "succeeded" : "failed", tick, hazard.elapsed(),
                 success ? "" : ": " + failureReason);
        return outcome;
    }

    public SpatialGraph graph() {
        return graph;
    }

    private HazardField buildHazard(HazardKind kind, HazardHintProvider hints, Random random) {
        var hint = hints.best(config.getMission().getHintConfidenceThreshold());
        if (hint.isEmpty() && !hints.hints().isEmpty()) {
            log.debug("No hazard hint reaches confidence {}, using default placement",
                      config.getMission().getHintConfidenceThreshold());
        }
        return switch (kind) {
            case FIRE -> hint.map(h -> (HazardField) SpreadingHazard.fromHint(config.getFire(), graph, h.position(),
                                                                               h.level(), random))
                             .orElseGet(() -> SpreadingHazard.withDefaultPlacement(config.getFire(), graph, random));
            case ATTACKER -> hint.map(
            h -> (HazardField) PatrollingHazard.fromHint(config.getAttacker(), graph, h.position(), h.level()))
                                 .orElseGet(() -> PatrollingHazard.create(config.getAttacker(), graph));
        };
    }

    private static AgentRecord record(RescueAgent agent) {
        var trajectory = agent.trajectory().stream().map(GridCell::of).toList();
        var death = agent.deathPosition().map(GridCell::of).orElse(null);
        return new AgentRecord(agent.id(), agent.riskTolerance(), agent.status(), agent.health(),
                               agent.cumulativeDanger(), agent.replans(), trajectory, death, agent.cause(),
                               agent.decisions());
    }

    /**
     * Captures the hazard snapshot on first use within a tick, so agents that do not plan cost nothing.
     */
    private static final class LazySnapshot implements Supplier<HazardSnapshot> {
        private final HazardField    hazard;
        private final SpatialGraph   graph;
        private       HazardSnapshot snapshot;

        private LazySnapshot(HazardField hazard, SpatialGraph graph) {
            this.hazard = hazard;
            this.graph = graph;
        }

        @Override
        public HazardSnapshot get() {
            if (snapshot == null) {
                snapshot = hazard.snapshot(graph);
            }
            return snapshot;
        }
    }

    /**
     * Turns agent callbacks into mission events.
     */
    private final class Relay implements RescueAgent.Observer {
        private final String missionId;

        private Relay(String missionId) {
            this.missionId = missionId;
        }

        @Override
        public void planned(RescueAgent agent, PlannedPath path, boolean replan, int tick) {
            var ids = path.nodes().stream().map(Node::id).toList();
            listener.accept(new SimulationEvent.PlanComputed(missionId, tick, agent.id(), replan, ids,
                                                             path.weightedCost()));
        }

        @Override
        public void statusChanged(RescueAgent agent, AgentStatus from, AgentStatus to, int tick) {
            listener.accept(new SimulationEvent.AgentStatusChanged(missionId, tick, agent.id(), from, to,
                                                                   agent.health()));
        }
    }
}
