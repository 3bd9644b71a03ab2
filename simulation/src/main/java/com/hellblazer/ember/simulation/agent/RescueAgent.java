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
import com.hellblazer.ember.navigation.SpatialGraph;
import com.hellblazer.ember.navigation.planning.NoPathFoundException;
import com.hellblazer.ember.navigation.planning.NodePenalty;
import com.hellblazer.ember.navigation.planning.PlanRequest;
import com.hellblazer.ember.navigation.planning.PlannedPath;
import com.hellblazer.ember.navigation.planning.RiskAwarePlanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * One rescuer.
 * <p>
 * Each tick the agent first plans if it is PLANNING or REPLANNING, then moves one edge along its plan.
 * After moving it takes damage proportional to the live intensity at its new node, shares readings
 * above the replanning threshold (including the one that kills it), and schedules a replan for the next tick when the live hazard on
 * its current or upcoming waypoints is above the threshold and hotter than the plan assumed.
 * <p>
 * Health never increases. Status only changes along the state machine of {@link AgentStatus}.
 * An agent belongs to one mission and is not thread-safe.
 *
 * @author hal.hildebrand
 */
public class RescueAgent {
    public static final String CAUSE_HAZARD      = "hazard exposure";
    public static final String CAUSE_NO_PATH     = "no path";
    public static final String CAUSE_STEP_BUDGET = "step budget exhausted";

    /** Residue left by repeated subtraction; anything at or below counts as dead */
    private static final double HEALTH_EPSILON = 1e-9;

    private static final Logger log = LoggerFactory.getLogger(RescueAgent.class);

    private final int                  id;
    private final SpatialGraph         graph;
    private final RiskAwarePlanner     planner;
    private final AgentConfig          config;
    private final double               riskTolerance;
    private final NodePenalty          persistentPenalty;
    private final Node                 target;
    private final Observer             observer;
    private final Map<Integer, Double> sharedPenalty = new TreeMap<>();
    private final List<Node>           trajectory    = new ArrayList<>();
    private final List<String>         decisions     = new ArrayList<>();

    private Node        position;
    private double      health = 1.0;
    private AgentStatus status = AgentStatus.PLANNING;
    private PlannedPath plan;
    private int         planIndex;
    private int         steps;
    private int         replans;
    private double      cumulativeDanger;
    private double      triggerIntensity;
    private Node        deathPosition;
    private String      cause;

    public RescueAgent(int id, SpatialGraph graph, RiskAwarePlanner planner, AgentConfig config, double riskTolerance,
                       NodePenalty persistentPenalty, Observer observer) {
        if (riskTolerance < 0.0 || riskTolerance > 1.0) {
            throw new IllegalArgumentException("Risk tolerance must lie in [0, 1]: " + riskTolerance);
        }
        this.id = id;
        this.graph = graph;
        this.planner = planner;
        this.config = config;
        this.riskTolerance = riskTolerance;
        this.persistentPenalty = persistentPenalty == null ? NodePenalty.NONE : persistentPenalty;
        this.observer = observer == null ? Observer.NONE : observer;
        this.target = graph.target();
        this.position = graph.start();
        this.trajectory.add(position);
    }

    /**
     * Advance the agent by one tick. Terminal agents ignore the call.
     */
    public void step(Tick tick) {
        if (status.isTerminal()) {
            return;
        }
        if (status == AgentStatus.PLANNING || status == AgentStatus.REPLANNING) {
            if (!plan(tick)) {
                return;
            }
            if (position.equals(target)) {
                reach(tick);
                return;
            }
        }
        move(tick);
    }

    /**
     * Fold an observation shared by another agent into the transient penalty.
     */
    public void receive(HazardObservation observation) {
        if (status.isTerminal()) {
            return;
        }
        double penalty = observation.intensity() * config.getSharedPenaltyWeight();
        sharedPenalty.merge(observation.node().id(), penalty, Math::max);
    }

    private boolean plan(Tick tick) {
        boolean replan = status == AgentStatus.REPLANNING;
        var request = new PlanRequest(position, target, tick.snapshot().get(), riskTolerance,
                                      persistentPenalty.plus(sharedPenalty()));
        try {
            plan = planner.plan(request);
        } catch (NoPathFoundException e) {
            log.debug("Agent {} cannot plan at tick {}: {}", id, tick.number(), e.getMessage());
            decisions.add("stalled:" + CAUSE_NO_PATH);
            cause = CAUSE_NO_PATH;
            transition(AgentStatus.STALLED, tick);
            return false;
        }
        planIndex = 0;
        if (replan) {
            replans++;
            decisions.add(String.format("replanned:%.3f", triggerIntensity));
        } else {
            decisions.add("planned");
        }
        log.debug("Agent {} {} at tick {}: {}", id, replan ? "replanned" : "planned", tick.number(), plan);
        observer.planned(this, plan, replan, tick.number());
        transition(AgentStatus.MOVING, tick);
        return true;
    }

    private void move(Tick tick) {
        if (steps >= config.getStepBudget()) {
            decisions.add("stalled:" + CAUSE_STEP_BUDGET);
            cause = CAUSE_STEP_BUDGET;
            transition(AgentStatus.STALLED, tick);
            return;
        }
        planIndex++;
        position = plan.node(planIndex);
        steps++;
        trajectory.add(position);

        double intensity = liveIntensity(tick, position);
        cumulativeDanger += intensity;
        health -= intensity * config.getDamagePerTick();
        if (health <= HEALTH_EPSILON) {
            health = 0.0;
        }
        if (intensity > config.getReplanThreshold()) {
            tick.channel().publish(new HazardObservation(id, position, intensity, tick.number()));
        }
        if (health == 0.0) {
            deathPosition = position;
            cause = CAUSE_HAZARD;
            decisions.add("died");
            transition(AgentStatus.DEAD, tick);
            return;
        }
        if (position.equals(target)) {
            reach(tick);
            return;
        }
        int last = Math.min(plan.nodes().size() - 1, planIndex + config.getLookahead());
        for (int i = planIndex; i <= last; i++) {
            double live = i == planIndex ? intensity : liveIntensity(tick, plan.node(i));
            if (live > config.getReplanThreshold() && live > plan.assumedIntensity(i)) {
                triggerIntensity = live;
                transition(AgentStatus.REPLANNING, tick);
                return;
            }
        }
    }

    private void reach(Tick tick) {
        decisions.add("reached target");
        transition(AgentStatus.REACHED_TARGET, tick);
    }

    private double liveIntensity(Tick tick, Node node) {
        return tick.hazard().intensityAt(graph.position(node), node.level());
    }

    private NodePenalty sharedPenalty() {
        if (sharedPenalty.isEmpty()) {
            return NodePenalty.NONE;
        }
        var copy = new TreeMap<>(sharedPenalty);
        return node -> copy.getOrDefault(node.id(), 0.0);
    }

    private void transition(AgentStatus next, Tick tick) {
        var previous = status;
        status = next;
        if (next.isTerminal()) {
            log.debug("Agent {} {} at tick {} on {} (health {})", id, next, tick.number(), position, health);
        }
        observer.statusChanged(this, previous, next, tick.number());
    }

    public int id() {
        return id;
    }

    public AgentStatus status() {
        return status;
    }

    public double health() {
        return health;
    }

    public Node position() {
        return position;
    }

    public double riskTolerance() {
        return riskTolerance;
    }

    public Optional<PlannedPath> plan() {
        return Optional.ofNullable(plan);
    }

    public List<Node> trajectory() {
        return Collections.unmodifiableList(trajectory);
    }

    public List<String> decisions() {
        return Collections.unmodifiableList(decisions);
    }

    public double cumulativeDanger() {
        return cumulativeDanger;
    }

    public int replans() {
        return replans;
    }

    public int steps() {
        return steps;
    }

    public Optional<Node> deathPosition() {
        return Optional.ofNullable(deathPosition);
    }

    /**
     * @return cause of a DEAD or STALLED agent, null otherwise
     */
    public String cause() {
        return cause;
    }

    public double sharedPenaltyAt(Node node) {
        return sharedPenalty.getOrDefault(node.id(), 0.0);
    }

    @Override
    public String toString() {
        return String.format("RescueAgent{id=%d, %s, at=%s, health=%.3f, tolerance=%.2f}", id, status, position, health,
                             riskTolerance);
    }

    /**
     * Receives plan and status notifications. Called synchronously from {@link #step(Tick)}.
     */
    public interface Observer {
        Observer NONE = new Observer() {
        };

        default void planned(RescueAgent agent, PlannedPath path, boolean replan, int tick) {
        }

        default void statusChanged(RescueAgent agent, AgentStatus from, AgentStatus to, int tick) {
        }
    }
}
