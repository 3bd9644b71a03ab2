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

package com.hellblazer.ember.navigation.planning;

import com.hellblazer.ember.common.ConfigurationException;
import com.hellblazer.ember.navigation.GraphConfig;
import com.hellblazer.ember.navigation.Node;
import com.hellblazer.ember.navigation.SpatialGraph;
import com.hellblazer.ember.navigation.hazard.HazardSnapshot;
import com.hellblazer.ember.navigation.hazard.SpreadingConfig;
import com.hellblazer.ember.navigation.hazard.SpreadingHazard;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import javax.vecmath.Point3f;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RiskAwarePlanner Tests")
class RiskAwarePlannerTest {

    private SpatialGraph     graph;
    private RiskAwarePlanner planner;
    private HazardSnapshot   calm;

    @BeforeEach
    void setUp() {
        graph = SpatialGraph.build(GraphConfig.defaults());
        planner = new RiskAwarePlanner(graph, PlannerConfig.defaults());
        calm = HazardSnapshot.empty(graph);
    }

    private HazardSnapshot fireAt(float x, float y, int level, double seconds) {
        var fire = SpreadingHazard.fromHint(SpreadingConfig.builder().noIgnition().build(), graph,
                                            new Point3f(x, y, 0), level, new Random(11));
        fire.advance(seconds);
        return fire.snapshot(graph);
    }

    private double costOf(List<Node> path, PlanRequest request) {
        double total = 0.0;
        for (int i = 0; i + 1 < path.size(); i++) {
            var to = path.get(i + 1);
            var edge = graph.neighbors(path.get(i)).stream().filter(e -> e.to().equals(to)).findFirst().orElseThrow();
            total += planner.edgeCost(edge, request);
        }
        return total;
    }

    private double exposure(PlannedPath path, HazardSnapshot hazard) {
        double total = 0.0;
        for (int i = 0; i + 1 < path.nodes().size(); i++) {
            var to = path.nodes().get(i + 1);
            var edge = graph.neighbors(path.nodes().get(i)).stream().filter(e -> e.to().equals(to)).findFirst()
                            .orElseThrow();
            total += edge.baseCost() * hazard.intensityAt(to);
        }
        return total;
    }

    @Nested
    @DisplayName("Without hazard")
    class CalmTests {

        @Test
        @DisplayName("Shortest route climbs the stairway once per level")
        void shortest() throws NoPathFoundException {
            var path = planner.plan(new PlanRequest(graph.start(), graph.target(), calm, 0.5));
            assertEquals(graph.start(), path.start());
            assertEquals(graph.target(), path.destination());
            assertEquals(26.0 + 3 * 6.0, path.unweightedCost(), 1e-9);
            assertEquals(path.unweightedCost(), path.weightedCost(), 1e-9);
            assertEquals(3, path.verticalTransitions());
            assertEquals(26 + 3, path.steps());
        }

        @Test
        @DisplayName("Consecutive path nodes are adjacent")
        void connected() throws NoPathFoundException {
            var path = planner.plan(new PlanRequest(graph.start(), graph.target(), calm, 0.0));
            for (int i = 0; i + 1 < path.nodes().size(); i++) {
                var from = path.node(i);
                var to = path.node(i + 1);
                assertTrue(graph.neighbors(from).stream().anyMatch(e -> e.to().equals(to)));
            }
        }

        @Test
        @DisplayName("Start equal to target yields a single-node path")
        void trivial() throws NoPathFoundException {
            var path = planner.plan(new PlanRequest(graph.target(), graph.target(), calm, 0.5));
            assertEquals(List.of(graph.target()), path.nodes());
            assertEquals(0.0, path.weightedCost());
            assertEquals(0, path.steps());
        }

        @Test
        @DisplayName("Equal-cost routes prefer the lower predecessor id")
        void lowerPredecessor() throws NoPathFoundException {
            var from = graph.nodeAt(0, 0, 1).orElseThrow();
            var to = graph.nodeAt(1, 1, 1).orElseThrow();
            var path = planner.plan(new PlanRequest(from, to, calm, 0.5));
            assertEquals(graph.nodeAt(1, 0, 1).orElseThrow(), path.node(1));
        }

        @Test
        @DisplayName("Equal-cost routes prefer fewer vertical transitions")
        void fewerVertical() throws NoPathFoundException {
            var flat = SpatialGraph.build(GraphConfig.builder()
                                                     .levels(2)
                                                     .gridResolution(5)
                                                     .stairway(0, 0, 4, 4)
                                                     .verticalCostFactor(0.0)
                                                     .start(0, 0, 0)
                                                     .target(4, 4, 0)
                                                     .build());
            var flatPlanner = new RiskAwarePlanner(flat, PlannerConfig.defaults());
            var path = flatPlanner.plan(new PlanRequest(flat.start(), flat.target(), HazardSnapshot.empty(flat), 0.5));
            assertEquals(0, path.verticalTransitions());
            assertTrue(path.nodes().stream().allMatch(n -> n.level() == 0));
            assertEquals(8.0, path.weightedCost(), 1e-9);
        }

        @Test
        @DisplayName("Same request, same path")
        void deterministic() throws NoPathFoundException {
            var hazard = fireAt(9, 9, 0, 10.0);
            var a = planner.plan(new PlanRequest(graph.start(), graph.target(), hazard, 0.2));
            var b = planner.plan(new PlanRequest(graph.start(), graph.target(), hazard, 0.2));
            assertEquals(a, b);
        }
    }

    @Nested
    @DisplayName("With hazard")
    class HazardTests {

        @ParameterizedTest
        @ValueSource(doubles = { 0.0, 0.25, 0.5, 0.75, 1.0 })
        @DisplayName("Weighting never produces a route shorter than the shortest")
        void neverShorterThanShortest(double tolerance) throws NoPathFoundException {
            var shortest = planner.plan(new PlanRequest(graph.start(), graph.target(), calm, 1.0)).unweightedCost();
            var path = planner.plan(new PlanRequest(graph.start(), graph.target(), fireAt(9, 9, 1, 20.0), tolerance));
            assertTrue(path.unweightedCost() >= shortest - 1e-9);
        }

        @Test
        @DisplayName("Full tolerance ignores the hazard")
        void fullTolerance() throws NoPathFoundException {
            var path = planner.plan(new PlanRequest(graph.start(), graph.target(), fireAt(9, 9, 0, 20.0), 1.0));
            assertEquals(44.0, path.weightedCost(), 1e-9);
        }

        @Test
        @DisplayName("Cautious agents route around the hazard")
        void cautiousAvoids() throws NoPathFoundException {
            var hazard = fireAt(9, 9, 0, 20.0);
            var bold = planner.plan(new PlanRequest(graph.start(), graph.target(), hazard, 1.0));
            var cautious = planner.plan(new PlanRequest(graph.start(), graph.target(), hazard, 0.0));
            assertTrue(exposure(cautious, hazard) <= exposure(bold, hazard) + 1e-6);
            assertTrue(cautious.unweightedCost() >= bold.unweightedCost());
        }

        @Test
        @DisplayName("Returned cost is minimal against the alternative route")
        void optimal() throws NoPathFoundException {
            var hazard = fireAt(9, 9, 0, 20.0);
            var request = new PlanRequest(graph.start(), graph.target(), hazard, 0.0);
            var cautious = planner.plan(request);
            var bold = planner.plan(new PlanRequest(graph.start(), graph.target(), hazard, 1.0));
            assertEquals(cautious.weightedCost(), costOf(cautious.nodes(), request), 1e-6);
            assertTrue(cautious.weightedCost() <= costOf(bold.nodes(), request) + 1e-6);
        }

        @Test
        @DisplayName("Assumed intensities record the snapshot along the path")
        void assumed() throws NoPathFoundException {
            var hazard = fireAt(9, 9, 0, 20.0);
            var path = planner.plan(new PlanRequest(graph.start(), graph.target(), hazard, 0.5));
            for (int i = 0; i < path.nodes().size(); i++) {
                assertEquals(hazard.intensityAt(path.node(i)), path.assumedIntensity(i));
            }
        }

        @Test
        @DisplayName("Node penalties steer the route like hazard")
        void penalties() throws NoPathFoundException {
            var baseline = planner.plan(new PlanRequest(graph.start(), graph.target(), calm, 0.0));
            var avoided = baseline.node(5);
            NodePenalty penalty = node -> node.equals(avoided) ? 5.0 : 0.0;
            var path = planner.plan(new PlanRequest(graph.start(), graph.target(), calm, 0.0, penalty));
            assertFalse(path.nodes().contains(avoided));
            assertEquals(baseline.unweightedCost(), path.unweightedCost(), 1e-9);
        }
    }

    @Nested
    @DisplayName("Failure")
    class FailureTests {

        @Test
        @DisplayName("Walled-off target has no path")
        void walledTarget() {
            var walled = SpatialGraph.build(GraphConfig.builder()
                                                       .wall(14, 15, 3)
                                                       .wall(16, 15, 3)
                                                       .wall(15, 14, 3)
                                                       .wall(15, 16, 3)
                                                       .build());
            var walledPlanner = new RiskAwarePlanner(walled, PlannerConfig.defaults());
            var e = assertThrows(NoPathFoundException.class, () -> walledPlanner.plan(
            new PlanRequest(walled.start(), walled.target(), HazardSnapshot.empty(walled), 0.5)));
            assertEquals(walled.target(), e.getTarget());
            assertEquals(walled.nodeCount() - 1, e.getExpanded());
        }

        @Test
        @DisplayName("Expansion limit reports no path")
        void expansionLimit() {
            var limited = new RiskAwarePlanner(graph, PlannerConfig.builder().maxExpansions(5).build());
            assertThrows(NoPathFoundException.class,
                         () -> limited.plan(new PlanRequest(graph.start(), graph.target(), calm, 0.5)));
        }

        @Test
        @DisplayName("Invalid parameters are rejected")
        void invalid() {
            assertThrows(IllegalArgumentException.class,
                         () -> new PlanRequest(graph.start(), graph.target(), calm, 1.5));
            assertThrows(ConfigurationException.class, () -> PlannerConfig.builder().heuristicScale(0.0).build());
            assertThrows(ConfigurationException.class, () -> PlannerConfig.builder().heuristicScale(1.5).build());
        }
    }
}
