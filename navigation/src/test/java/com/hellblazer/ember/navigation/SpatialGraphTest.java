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

package com.hellblazer.ember.navigation;

import com.hellblazer.ember.common.ConfigurationException;
import com.hellblazer.ember.geometry.Point3i;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SpatialGraph Tests")
class SpatialGraphTest {

    private SpatialGraph graph;

    @BeforeEach
    void setUp() {
        graph = SpatialGraph.build(GraphConfig.defaults());
    }

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        @DisplayName("Default building has four 20x20 levels")
        void defaultDimensions() {
            assertEquals(4, graph.levels());
            assertEquals(20, graph.resolution());
            assertEquals(1600, graph.nodeCount());
            assertEquals(1600, graph.idSpace());
        }

        @Test
        @DisplayName("Edge count covers grid edges plus stair links")
        void edgeCount() {
            int horizontal = 4 * 2 * 20 * 19;
            int vertical = 16 * 3;
            assertEquals(horizontal + vertical, graph.edgeCount());
        }

        @Test
        @DisplayName("Start and target are the configured cells")
        void startAndTarget() {
            assertEquals(new Point3i(2, 2, 0), graph.start().cell());
            assertEquals(42, graph.start().id());
            assertEquals(new Point3i(15, 15, 3), graph.target().cell());
            assertEquals(1515, graph.target().id());
        }

        @Test
        @DisplayName("Node kinds: stairway, ground-floor exits, floor cells")
        void nodeKinds() {
            assertEquals(NodeKind.STAIR_CELL, graph.nodeAt(8, 8, 2).orElseThrow().kind());
            assertEquals(NodeKind.STAIR_CELL, graph.nodeAt(11, 11, 0).orElseThrow().kind());
            assertEquals(NodeKind.EXIT, graph.nodeAt(0, 5, 0).orElseThrow().kind());
            assertEquals(NodeKind.EXIT, graph.nodeAt(19, 19, 0).orElseThrow().kind());
            assertEquals(NodeKind.FLOOR_CELL, graph.nodeAt(0, 5, 1).orElseThrow().kind());
            assertEquals(NodeKind.FLOOR_CELL, graph.nodeAt(12, 12, 3).orElseThrow().kind());
        }

        @Test
        @DisplayName("Walls leave holes in the id space")
        void walls() {
            var walled = SpatialGraph.build(GraphConfig.builder().wall(5, 5, 0).wall(6, 5, 0).build());
            assertEquals(1598, walled.nodeCount());
            assertEquals(1600, walled.idSpace());
            assertTrue(walled.nodeAt(5, 5, 0).isEmpty());
            assertNull(walled.node(5 * 20 + 5));
            var neighbor = walled.nodeAt(4, 5, 0).orElseThrow();
            assertTrue(walled.neighbors(neighbor).stream().noneMatch(e -> e.to().x() == 5 && e.to().y() == 5));
        }
    }

    @Nested
    @DisplayName("Configuration errors")
    class ConfigurationTests {

        @Test
        @DisplayName("Reject non-positive dimensions")
        void rejectNonPositive() {
            assertThrows(ConfigurationException.class, () -> GraphConfig.builder().levels(0).build());
            assertThrows(ConfigurationException.class, () -> GraphConfig.builder().gridResolution(-1).build());
            assertThrows(ConfigurationException.class, () -> GraphConfig.builder().cellSize(0.0).build());
        }

        @Test
        @DisplayName("Reject stairway outside the grid")
        void rejectStairwayOutside() {
            var e = assertThrows(ConfigurationException.class,
                                 () -> GraphConfig.builder().stairway(18, 18, 21, 21).build());
            assertTrue(e.getMessage().contains("stairway"));
        }

        @Test
        @DisplayName("Reject empty stairway")
        void rejectEmptyStairway() {
            assertThrows(ConfigurationException.class, () -> GraphConfig.builder().stairway(10, 10, 9, 9).build());
        }

        @Test
        @DisplayName("Reject start or target outside the grid or on a wall")
        void rejectBadEndpoints() {
            assertThrows(ConfigurationException.class, () -> GraphConfig.builder().target(15, 15, 4).build());
            assertThrows(ConfigurationException.class, () -> GraphConfig.builder().start(-1, 0, 0).build());
            assertThrows(ConfigurationException.class, () -> GraphConfig.builder().wall(2, 2, 0).build());
        }
    }

    @Nested
    @DisplayName("Adjacency")
    class AdjacencyTests {

        @Test
        @DisplayName("Corner cell has two neighbours")
        void corner() {
            var corner = graph.nodeAt(0, 0, 0).orElseThrow();
            var neighbors = graph.neighbors(corner);
            assertEquals(2, neighbors.size());
            assertEquals(new Point3i(1, 0, 0), neighbors.get(0).to().cell());
            assertEquals(new Point3i(0, 1, 0), neighbors.get(1).to().cell());
        }

        @Test
        @DisplayName("Stair cell links to the levels above and below")
        void stairCell() {
            var stair = graph.nodeAt(9, 9, 1).orElseThrow();
            var neighbors = graph.neighbors(stair);
            assertEquals(6, neighbors.size());
            var down = neighbors.get(4);
            var up = neighbors.get(5);
            assertTrue(down.vertical());
            assertEquals(new Point3i(9, 9, 0), down.to().cell());
            assertEquals(new Point3i(9, 9, 2), up.to().cell());
            assertEquals(6.0, up.baseCost(), 1e-12);
        }

        @Test
        @DisplayName("Top-level stair cell only links down")
        void topStair() {
            var stair = graph.nodeAt(8, 8, 3).orElseThrow();
            var vertical = graph.neighbors(stair).stream().filter(Edge::vertical).collect(Collectors.toList());
            assertEquals(1, vertical.size());
            assertEquals(2, vertical.get(0).to().level());
        }

        @Test
        @DisplayName("Floor cells have no vertical edges")
        void floorCellIsPlanar() {
            var cell = graph.nodeAt(3, 3, 2).orElseThrow();
            assertTrue(graph.neighbors(cell).stream().noneMatch(Edge::vertical));
        }

        @Test
        @DisplayName("Traversability is symmetric")
        void symmetric() {
            for (var node : graph.nodes()) {
                for (var edge : graph.neighbors(node)) {
                    assertTrue(graph.neighbors(edge.to()).stream().anyMatch(back -> back.to().equals(node)),
                               () -> "missing reverse edge of " + edge);
                }
            }
        }

        @Test
        @DisplayName("Neighbour queries are repeatable")
        void deterministic() {
            var node = graph.nodeAt(10, 10, 1).orElseThrow();
            assertEquals(graph.neighbors(node), graph.neighbors(node));
        }
    }

    @Nested
    @DisplayName("Positions")
    class PositionTests {

        @Test
        @DisplayName("World position scales by cell size and level height")
        void position() {
            var p = graph.position(graph.target());
            assertEquals(15.0f, p.x, 1e-6f);
            assertEquals(15.0f, p.y, 1e-6f);
            assertEquals(9.0f, p.z, 1e-6f);
        }

        @Test
        @DisplayName("Nearest node snaps on the containing level")
        void nearest() {
            var node = graph.nearestNode(new Point3f(2.4f, 2.6f, 3.1f)).orElseThrow();
            assertEquals(new Point3i(2, 3, 1), node.cell());
        }

        @Test
        @DisplayName("Nearest node ties go to the lower id")
        void nearestTie() {
            var node = graph.nearestNode(new Point3f(2.5f, 2.5f, 0.0f)).orElseThrow();
            assertEquals(new Point3i(2, 2, 0), node.cell());
        }

        @Test
        @DisplayName("Unweighted distance is planar length plus stair cost")
        void unweightedDistance() {
            double d = graph.unweightedDistance(graph.start(), graph.target());
            assertEquals(Math.sqrt(13 * 13 * 2) + 3 * 6.0, d, 1e-9);
        }
    }
}
