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

package com.hellblazer.ember.navigation.hazard;

import com.hellblazer.ember.common.ConfigurationException;
import com.hellblazer.ember.navigation.GraphConfig;
import com.hellblazer.ember.navigation.SpatialGraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PatrollingHazard Tests")
class PatrollingHazardTest {

    private static final SpatialGraph GRAPH = SpatialGraph.build(GraphConfig.defaults());

    private static void assertPoint(float x, float y, float z, Point3f actual) {
        assertEquals(x, actual.x, 1e-4f);
        assertEquals(y, actual.y, 1e-4f);
        assertEquals(z, actual.z, 1e-4f);
    }

    @Test
    @DisplayName("Default route: square on level 2, stairway, square on level 3, stairway")
    void defaultRoute() {
        var patrol = PatrollingHazard.create(PatrolConfig.defaults(), GRAPH);
        var route = patrol.route();
        assertEquals(10, route.size());
        assertPoint(5, 5, 6, route.get(0));
        assertPoint(15, 5, 6, route.get(1));
        assertPoint(10, 10, 9, route.get(4));
        assertPoint(5, 15, 9, route.get(8));
        assertPoint(10, 10, 6, route.get(9));
        double expected = 60.0 + 2.0 * Math.sqrt(59.0) + 2.0 * Math.sqrt(50.0);
        assertEquals(expected, patrol.routeLength(), 1e-4);
    }

    @Test
    @DisplayName("Present at its first waypoint before any advance")
    void failsClosed() {
        var patrol = PatrollingHazard.create(PatrolConfig.defaults(), GRAPH);
        assertEquals(1.0, patrol.intensityAt(new Point3f(5, 5, 6), 2));
        assertEquals(1.0, patrol.intensityAt(new Point3f(5, 8, 6), 2));
        assertEquals(0.0, patrol.intensityAt(new Point3f(5, 9, 6), 2));
    }

    @Test
    @DisplayName("Moves at constant speed along the route")
    void constantSpeed() {
        var patrol = PatrollingHazard.create(PatrolConfig.defaults(), GRAPH);
        patrol.advance(2.0);
        assertPoint(8, 5, 6, patrol.positionAt(patrol.elapsed()));
        assertPoint(15, 5, 6, patrol.positionAt(10.0 / 1.5));
        assertPoint(15, 10, 6, patrol.positionAt(15.0 / 1.5));
        assertEquals(2, patrol.levelAt(2.0));
    }

    @Test
    @DisplayName("Wraps at the end of the route")
    void wraps() {
        var patrol = PatrollingHazard.create(PatrolConfig.defaults(), GRAPH);
        double lap = patrol.routeLength() / 1.5;
        assertPoint(5, 5, 6, patrol.positionAt(lap));
        var a = patrol.positionAt(3.0);
        var b = patrol.positionAt(3.0 + lap);
        assertPoint(a.x, a.y, a.z, b);
    }

    @Test
    @DisplayName("Position is a pure function of time")
    void pure() {
        var a = PatrollingHazard.create(PatrolConfig.defaults(), GRAPH);
        var b = PatrollingHazard.create(PatrolConfig.defaults(), GRAPH);
        for (int i = 0; i < 37; i++) {
            a.advance(0.5);
        }
        b.advance(18.5);
        assertPoint(a.state().centers().get(0).position().x, a.state().centers().get(0).position().y,
                    a.state().centers().get(0).position().z, b.state().centers().get(0).position());
    }

    @Test
    @DisplayName("A hint starts the patrol at the nearest waypoint")
    void hint() {
        var patrol = PatrollingHazard.fromHint(PatrolConfig.defaults(), GRAPH, new Point3f(14, 14, 0), 3);
        assertPoint(15, 15, 9, patrol.positionAt(0.0));
        assertEquals(3, patrol.levelAt(0.0));
    }

    @Test
    @DisplayName("Stair transit out of range takes no damage")
    void stairTransitOutOfRange() {
        var patrol = PatrollingHazard.create(PatrolConfig.defaults(), GRAPH);
        // patrol at (5, 5) on level 2, the stair cell (9, 9) is more than 3 units away on both levels
        assertEquals(0.0, patrol.intensityAt(GRAPH.position(GRAPH.nodeAt(9, 9, 2).orElseThrow()), 2, 0.0));
        assertEquals(0.0, patrol.intensityAt(GRAPH.position(GRAPH.nodeAt(9, 9, 3).orElseThrow()), 3, 0.0));
    }

    @Test
    @DisplayName("Reject patrol levels missing from the graph")
    void rejectLevels() {
        var config = PatrolConfig.builder().levels(2, 5).build();
        assertThrows(ConfigurationException.class, () -> PatrollingHazard.create(config, GRAPH));
        assertThrows(ConfigurationException.class, () -> PatrolConfig.builder().waypoint(1, 1, 0).build());
    }

    @Test
    @DisplayName("Explicit waypoints replace the derived route")
    void explicitRoute() {
        var config = PatrolConfig.builder().waypoint(0, 0, 2).waypoint(4, 0, 2).speed(2.0).build();
        var patrol = PatrollingHazard.create(config, GRAPH);
        assertEquals(8.0, patrol.routeLength(), 1e-9);
        assertPoint(4, 0, 6, patrol.positionAt(2.0));
        assertPoint(2, 0, 6, patrol.positionAt(3.0));
    }
}
