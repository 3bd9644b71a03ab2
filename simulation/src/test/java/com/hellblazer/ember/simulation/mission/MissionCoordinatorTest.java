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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.ember.navigation.GraphConfig;
import com.hellblazer.ember.navigation.SpatialGraph;
import com.hellblazer.ember.navigation.hazard.HazardKind;
import com.hellblazer.ember.navigation.hazard.PatrolConfig;
import com.hellblazer.ember.simulation.SimulationConfig;
import com.hellblazer.ember.simulation.SimulationEvent;
import com.hellblazer.ember.simulation.agent.AgentConfig;
import com.hellblazer.ember.simulation.agent.AgentStatus;
import com.hellblazer.ember.simulation.knowledge.AgentRecord;
import com.hellblazer.ember.simulation.knowledge.GridCell;
import com.hellblazer.ember.simulation.knowledge.JsonKnowledgeStore;
import com.hellblazer.ember.simulation.knowledge.KnowledgeSummary;
import com.hellblazer.ember.simulation.knowledge.MissionOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MissionCoordinator Tests")
class MissionCoordinatorTest {

    private static final ObjectMapper MAPPER = JsonKnowledgeStore.mapper();

    private static SimulationConfig fireScenario() {
        return SimulationConfig.builder()
                               .mission(MissionConfig.builder().agents(3).baseRiskTolerance(0.5).toleranceSpread(0.0)
                                                     .build())
                               .build();
    }

    private static MissionOutcome run(SimulationConfig config, RunContext context, HazardHintProvider hints) {
        var coordinator = new MissionCoordinator(config, SpatialGraph.build(config.getGraph()));
        return coordinator.run(context, hints, () -> false);
    }

    private static RunContext firstFire(long seed) {
        return new RunContext(KnowledgeSummary.empty(HazardKind.FIRE), 1, seed);
    }

    @Nested
    @DisplayName("Fire scenario")
    class Fire {

        @Test
        @DisplayName("Four levels, 20x20, three agents at tolerance 0.5 yield one outcome for three agents")
        void scenario() {
            var config = fireScenario();
            var outcome = run(config, firstFire(42L), HazardHintProvider.none());

            assertEquals("mission-0001", outcome.missionId());
            assertEquals(HazardKind.FIRE, outcome.hazardKind());
            assertEquals(3, outcome.agentCount());
            assertTrue(outcome.ticks() >= 1 && outcome.ticks() <= config.getMission().getMaxTicks());
            assertEquals(outcome.ticks() * 0.5, outcome.elapsedTime());
            if (outcome.success()) {
                assertNull(outcome.failureReason());
                assertTrue(outcome.agents().stream().anyMatch(AgentRecord::reachedTarget));
                int winner = 0;
                while (!outcome.agents().get(winner).reachedTarget()) {
                    winner++;
                }
                for (var later : outcome.agents().subList(winner + 1, outcome.agentCount())) {
                    assertFalse(later.reachedTarget(), "agents after the first arrival do not act");
                    assertTrue(later.trajectory().size() <= outcome.ticks(),
                               "agents after the first arrival skip the final tick");
                }
            } else {
                assertTrue(Set.of(MissionOutcome.ALL_AGENTS_FAILED, MissionOutcome.TIMEOUT)
                              .contains(outcome.failureReason()));
            }
            for (var agent : outcome.agents()) {
                assertEquals(0.5, agent.riskTolerance());
                assertEquals(new GridCell(2, 2, 0), agent.trajectory().get(0));
                assertTrue(agent.finalHealth() >= 0.0 && agent.finalHealth() <= 1.0);
                assertEquals(agent.status() == AgentStatus.DEAD, agent.deathPosition() != null);
            }
        }

        @Test
        @DisplayName("Identical inputs produce byte-identical outcomes")
        void deterministic() throws Exception {
            var config = fireScenario();
            var first = run(config, firstFire(1234L), HazardHintProvider.none());
            var second = run(config, firstFire(1234L), HazardHintProvider.none());

            assertEquals(first, second);
            assertEquals(MAPPER.writeValueAsString(first), MAPPER.writeValueAsString(second));
        }

        @Test
        @DisplayName("A confident hint places the fire")
        void acceptedHint() {
            var config = fireScenario();
            var hints = HazardHintProvider.of(List.of(new HazardHint(new Point3f(2, 2, 0), 0, 0.9)));
            var outcome = run(config, firstFire(5L), hints);

            for (var agent : outcome.agents()) {
                assertTrue(agent.cumulativeDanger() > 0.0, "agents start inside the hinted fire");
            }
        }

        @Test
        @DisplayName("A weak hint falls back to default placement")
        void rejectedHint() throws Exception {
            var config = fireScenario();
            var weak = HazardHintProvider.of(List.of(new HazardHint(new Point3f(2, 2, 0), 0, 0.3)));

            var hinted = run(config, firstFire(9L), weak);
            var plain = run(config, firstFire(9L), HazardHintProvider.none());

            assertEquals(MAPPER.writeValueAsString(plain), MAPPER.writeValueAsString(hinted));
        }
    }

    @Nested
    @DisplayName("Attacker scenario")
    class Attacker {

        @Test
        @DisplayName("Crossing levels 2 and 3 far from the patrol costs no health")
        void transitWithoutDamage() {
            var config = SimulationConfig.builder()
                                         .graph(GraphConfig.builder().start(9, 9, 2).target(10, 10, 3).build())
                                         .attacker(PatrolConfig.builder()
                                                               .waypoint(1, 1, 2)
                                                               .waypoint(3, 1, 2)
                                                               .waypoint(3, 3, 2)
                                                               .waypoint(1, 3, 2)
                                                               .build())
                                         .mission(MissionConfig.builder().agents(1).build())
                                         .build();
            var context = new RunContext(KnowledgeSummary.empty(HazardKind.ATTACKER), 1, 3L);

            var outcome = run(config, context, HazardHintProvider.none());

            assertTrue(outcome.success());
            assertEquals(HazardKind.ATTACKER, outcome.hazardKind());
            var agent = outcome.agents().get(0);
            assertEquals(AgentStatus.REACHED_TARGET, agent.status());
            assertEquals(1.0, agent.finalHealth());
            assertEquals(0.0, agent.cumulativeDanger());
            assertTrue(agent.trajectory().stream().anyMatch(cell -> cell.level() == 2));
            assertTrue(agent.trajectory().stream().anyMatch(cell -> cell.level() == 3));
        }

        @Test
        @DisplayName("The first arrival ends the mission and freezes the other agents")
        void firstArrivalFreezesOthers() {
            var config = SimulationConfig.builder()
                                         .graph(GraphConfig.builder().start(9, 9, 2).target(10, 10, 3).build())
                                         .attacker(PatrolConfig.builder()
                                                               .waypoint(1, 1, 2)
                                                               .waypoint(3, 1, 2)
                                                               .waypoint(3, 3, 2)
                                                               .waypoint(1, 3, 2)
                                                               .build())
                                         .mission(MissionConfig.builder().agents(2).toleranceSpread(0.0).build())
                                         .build();
            var events = new ArrayList<SimulationEvent>();
            var coordinator = new MissionCoordinator(config, SpatialGraph.build(config.getGraph()), events::add);

            var outcome = coordinator.run(new RunContext(KnowledgeSummary.empty(HazardKind.ATTACKER), 1, 3L),
                                          HazardHintProvider.none(), () -> false);

            assertTrue(outcome.success());
            var first = outcome.agents().get(0);
            var second = outcome.agents().get(1);
            assertEquals(AgentStatus.REACHED_TARGET, first.status());
            assertEquals(AgentStatus.MOVING, second.status());
            assertEquals(first.trajectory().size() - 1, second.trajectory().size());
            assertEquals(first.trajectory().subList(0, second.trajectory().size()), second.trajectory());
            assertEquals(1.0, second.finalHealth());
            assertTrue(events.stream()
                             .filter(SimulationEvent.AgentStatusChanged.class::isInstance)
                             .map(SimulationEvent.AgentStatusChanged.class::cast)
                             .noneMatch(e -> e.agentId() == 1 && e.tick() == outcome.ticks()));
        }
    }

    @Nested
    @DisplayName("Termination")
    class Termination {

        @Test
        @DisplayName("Stops at the tick budget")
        void timeout() {
            var config = fireScenario().toBuilder().mission(MissionConfig.builder().maxTicks(3).build()).build();
            var outcome = run(config, firstFire(42L), HazardHintProvider.none());

            assertFalse(outcome.success());
            assertEquals(MissionOutcome.TIMEOUT, outcome.failureReason());
            assertEquals(3, outcome.ticks());
            assertEquals(1.5, outcome.elapsedTime());
        }

        @Test
        @DisplayName("Stops between ticks when cancelled")
        void aborted() {
            var config = fireScenario();
            var checks = new AtomicInteger();
            var coordinator = new MissionCoordinator(config, SpatialGraph.build(config.getGraph()));
            var outcome = coordinator.run(firstFire(42L), HazardHintProvider.none(), () -> checks.incrementAndGet() > 2);

            assertFalse(outcome.success());
            assertEquals(MissionOutcome.ABORTED, outcome.failureReason());
            assertEquals(2, outcome.ticks());
            assertEquals(3, outcome.agentCount());
        }

        @Test
        @DisplayName("Fails when every agent is terminal without reaching the target")
        void allAgentsFailed() {
            var config = fireScenario().toBuilder()
                                       .graph(GraphConfig.builder()
                                                         .wall(14, 15, 3)
                                                         .wall(16, 15, 3)
                                                         .wall(15, 14, 3)
                                                         .wall(15, 16, 3)
                                                         .build())
                                       .build();
            var outcome = run(config, firstFire(42L), HazardHintProvider.none());

            assertFalse(outcome.success());
            assertEquals(MissionOutcome.ALL_AGENTS_FAILED, outcome.failureReason());
            assertEquals(1, outcome.ticks());
            for (var agent : outcome.agents()) {
                assertEquals(AgentStatus.STALLED, agent.status());
                assertEquals("no path", agent.cause());
            }
        }

        @Test
        @DisplayName("Every agent dies in an overwhelming hazard")
        void overwhelmed() {
            var config = fireScenario().toBuilder()
                                       .agent(AgentConfig.builder().damagePerTick(50.0).build())
                                       .build();
            var hints = HazardHintProvider.of(List.of(new HazardHint(new Point3f(2, 2, 0), 0, 1.0)));
            var outcome = run(config, firstFire(42L), hints);

            assertEquals(MissionOutcome.ALL_AGENTS_FAILED, outcome.failureReason());
            for (var agent : outcome.agents()) {
                assertEquals(AgentStatus.DEAD, agent.status());
                assertEquals(0.0, agent.finalHealth());
                assertNotNull(agent.deathPosition());
                assertEquals("hazard exposure", agent.cause());
            }
        }
    }

    @Nested
    @DisplayName("Knowledge and events")
    class Knowledge {

        @Test
        @DisplayName("A poor record makes the team more cautious")
        void toleranceFollowsRecord() {
            var config = SimulationConfig.builder().mission(MissionConfig.builder().maxTicks(1).build()).build();
            var summary = KnowledgeSummary.empty(HazardKind.FIRE);
            summary = summary.withOutcome(run(config, new RunContext(summary, 1, 1L), HazardHintProvider.none()));
            summary = summary.withOutcome(run(config, new RunContext(summary, 2, 2L), HazardHintProvider.none()));
            assertEquals(0.0, summary.successRate());

            var events = new ArrayList<SimulationEvent>();
            var coordinator = new MissionCoordinator(config, SpatialGraph.build(config.getGraph()), events::add);
            var outcome = coordinator.run(new RunContext(summary, 3, 3L), HazardHintProvider.none(), () -> false);

            var started = (SimulationEvent.IterationStarted) events.get(0);
            assertEquals(0.25, started.teamTolerance(), 1e-12);
            assertEquals(2, started.priorAttempts());
            assertEquals(0.15, outcome.agents().get(0).riskTolerance(), 1e-12);
            assertEquals(0.25, outcome.agents().get(1).riskTolerance(), 1e-12);
            assertEquals(0.35, outcome.agents().get(2).riskTolerance(), 1e-12);
        }

        @Test
        @DisplayName("Plans and status changes are reported as events")
        void events() {
            var config = fireScenario();
            var graph = SpatialGraph.build(config.getGraph());
            var events = new ArrayList<SimulationEvent>();
            var outcome = new MissionCoordinator(config, graph, events::add).run(firstFire(42L),
                                                                                  HazardHintProvider.none(),
                                                                                  () -> false);

            assertInstanceOf(SimulationEvent.IterationStarted.class, events.get(0));
            var plans = events.stream()
                              .filter(SimulationEvent.PlanComputed.class::isInstance)
                              .map(SimulationEvent.PlanComputed.class::cast)
                              .filter(plan -> plan.tick() == 1)
                              .toList();
            assertEquals(3, plans.size());
            for (int i = 0; i < plans.size(); i++) {
                assertEquals(i, plans.get(i).agentId());
                assertFalse(plans.get(i).replan());
                assertEquals(graph.start().id(), plans.get(i).path().get(0));
                assertEquals(graph.target().id(), plans.get(i).path().get(plans.get(i).path().size() - 1));
            }
            var changes = events.stream()
                                .filter(SimulationEvent.AgentStatusChanged.class::isInstance)
                                .map(SimulationEvent.AgentStatusChanged.class::cast)
                                .toList();
            assertEquals(AgentStatus.PLANNING, changes.get(0).from());
            assertEquals(AgentStatus.MOVING, changes.get(0).to());
            assertTrue(events.stream().allMatch(event -> event.missionId().equals(outcome.missionId())));
        }
    }
}
