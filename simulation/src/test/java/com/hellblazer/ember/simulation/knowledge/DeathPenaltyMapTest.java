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

import com.hellblazer.ember.navigation.GraphConfig;
import com.hellblazer.ember.navigation.SpatialGraph;
import com.hellblazer.ember.navigation.hazard.HazardKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.hellblazer.ember.simulation.knowledge.Outcomes.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DeathPenaltyMap Tests")
class DeathPenaltyMapTest {

    private SpatialGraph graph;

    @BeforeEach
    void setUp() {
        graph = SpatialGraph.build(GraphConfig.defaults());
    }

    private double penalty(DeathPenaltyMap map, int x, int y, int level) {
        return map.penaltyAt(graph.nodeAt(x, y, level).orElseThrow());
    }

    @Test
    @DisplayName("No recorded deaths means no penalty")
    void emptySummary() {
        var map = DeathPenaltyMap.build(graph, KnowledgeSummary.empty(HazardKind.FIRE), 0.5, 0.8, 1);
        assertEquals(0, map.contributing());
        assertEquals(0.0, map.maxPenalty());
        assertEquals(0.0, penalty(map, 5, 5, 0));
    }

    @Test
    @DisplayName("A death penalizes its neighborhood on its own level")
    void neighborhood() {
        var summary = KnowledgeSummary.empty(HazardKind.FIRE)
                                      .withOutcome(failure(HazardKind.FIRE, 1, MissionOutcome.ALL_AGENTS_FAILED,
                                                           died(0, new GridCell(5, 5, 0))));
        var map = DeathPenaltyMap.build(graph, summary, 0.5, 0.8, 1);

        assertEquals(1, map.contributing());
        assertEquals(0.5, penalty(map, 5, 5, 0), 1e-12);
        assertEquals(0.5, penalty(map, 6, 6, 0), 1e-12);
        assertEquals(0.5, penalty(map, 4, 5, 0), 1e-12);
        assertEquals(0.0, penalty(map, 7, 5, 0));
        assertEquals(0.0, penalty(map, 5, 5, 1), "other levels are unaffected");
        assertEquals(0.5, map.maxPenalty(), 1e-12);
    }

    @Test
    @DisplayName("Older deaths weigh less and overlapping deaths add up")
    void decayAndAccumulation() {
        var summary = KnowledgeSummary.empty(HazardKind.FIRE)
                                      .withOutcome(failure(HazardKind.FIRE, 1, MissionOutcome.ALL_AGENTS_FAILED,
                                                           died(0, new GridCell(5, 5, 0))))
                                      .withOutcome(failure(HazardKind.FIRE, 2, MissionOutcome.ALL_AGENTS_FAILED,
                                                           died(0, new GridCell(6, 5, 0))))
                                      .withOutcome(failure(HazardKind.FIRE, 3, MissionOutcome.TIMEOUT, stalled(0)));
        var map = DeathPenaltyMap.build(graph, summary, 0.5, 0.8, 1);

        // ages 2 and 1
        assertEquals(0.5 * (0.64 + 0.8), penalty(map, 5, 5, 0), 1e-12);
        assertEquals(0.5 * 0.64, penalty(map, 4, 5, 0), 1e-12);
        assertEquals(0.5 * 0.8, penalty(map, 7, 5, 0), 1e-12);
    }

    @Test
    @DisplayName("Radius zero confines the penalty to the death cell")
    void radiusZero() {
        var summary = KnowledgeSummary.empty(HazardKind.FIRE)
                                      .withOutcome(failure(HazardKind.FIRE, 1, MissionOutcome.ALL_AGENTS_FAILED,
                                                           died(0, new GridCell(5, 5, 2))));
        var map = DeathPenaltyMap.build(graph, summary, 2.0, 0.8, 0);

        assertEquals(2.0, penalty(map, 5, 5, 2), 1e-12);
        assertEquals(0.0, penalty(map, 5, 6, 2));
    }
}
