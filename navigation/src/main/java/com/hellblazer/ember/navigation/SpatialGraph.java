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

import com.hellblazer.ember.common.DeterministicMath;
import com.hellblazer.ember.geometry.Point3i;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3f;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Navigable-space graph of a multi-level structure.
 * <p>
 * Every level is a regular grid of cells. Cells on a level are joined by horizontal edges to their four
 * neighbours; consecutive levels are joined only through the stairway region. The graph is immutable
 * once built and is shared read-only by every agent of a mission and by every mission of a run, so no
 * locking is needed.
 * <p>
 * Node ids are dense: {@code id = level * res² + y * res + x}. Wall cells keep their id slot but have
 * no node.
 * <p>
 * Usage:
 * <pre>
 * var graph = SpatialGraph.build(GraphConfig.defaults());
 * for (var edge : graph.neighbors(graph.start())) {
 *     ...
 * }
 * </pre>
 *
 * @author hal.hildebrand
 */
public final class SpatialGraph {
    private static final Logger log = LoggerFactory.getLogger(SpatialGraph.class);

    private final GraphConfig config;
    private final Node[]      nodes;
    private final Edge[][]    adjacency;
    private final List<Node>  nodeList;
    private final Node        start;
    private final Node        target;
    private final int         edgeCount;

    private SpatialGraph(GraphConfig config) {
        this.config = config;
        int res = config.getGridResolution();
        int levels = config.getLevels();
        this.nodes = new Node[levels * res * res];
        var list = new ArrayList<Node>();
        for (int level = 0; level < levels; level++) {
            for (int y = 0; y < res; y++) {
                for (int x = 0; x < res; x++) {
                    var cell = new Point3i(x, y, level);
                    if (config.getWalls().contains(cell)) {
                        continue;
                    }
                    var node = new Node(idOf(x, y, level), cell, kindOf(x, y, level));
                    nodes[node.id()] = node;
                    list.add(node);
                }
            }
        }
        this.nodeList = Collections.unmodifiableList(list);
        this.adjacency = new Edge[nodes.length][];
        int directed = 0;
        for (var node : list) {
            var edges = connect(node);
            adjacency[node.id()] = edges;
            directed += edges.length;
        }
        this.edgeCount = directed / 2;
        this.start = nodes[idOf(config.getStart())];
        this.target = nodes[idOf(config.getTarget())];
    }

    /**
     * Build the graph.
     *
     * @param config validated build parameters
     * @return immutable graph
     */
    public static SpatialGraph build(GraphConfig config) {
        var graph = new SpatialGraph(config);
        log.info("Built navigation graph: {} nodes, {} edges, {} levels", graph.nodeCount(), graph.edgeCount(),
                 config.getLevels());
        return graph;
    }

    public GraphConfig config() {
        return config;
    }

    public Node start() {
        return start;
    }

    public Node target() {
        return target;
    }

    public int levels() {
        return config.getLevels();
    }

    public int resolution() {
        return config.getGridResolution();
    }

    /**
     * Size of the id space, including wall slots. Suitable for sizing per-node arrays.
     */
    public int idSpace() {
        return nodes.length;
    }

    public int nodeCount() {
        return nodeList.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    /**
     * All navigable nodes in id order.
     */
    public List<Node> nodes() {
        return nodeList;
    }

    /**
     * @return node with the given id, or null for a wall slot
     */
    public Node node(int id) {
        return nodes[id];
    }

    public Optional<Node> nodeAt(int x, int y, int level) {
        int res = config.getGridResolution();
        if (x < 0 || y < 0 || x >= res || y >= res || level < 0 || level >= config.getLevels()) {
            return Optional.empty();
        }
        return Optional.ofNullable(nodes[idOf(x, y, level)]);
    }

    public Optional<Node> nodeAt(Point3i cell) {
        return nodeAt(cell.x, cell.y, cell.z);
    }

    /**
     * Edges leaving the node, in a fixed order: +x, −x, +y, −y, down, up. Pure and deterministic.
     */
    public List<Edge> neighbors(Node node) {
        return List.of(adjacency[node.id()]);
    }

    /**
     * World position of a node's centre: x and y scaled by the cell size, z by the level height.
     */
    public Point3f position(Node node) {
        return new Point3f((float) (node.x() * config.getCellSize()), (float) (node.y() * config.getCellSize()),
                           (float) (node.level() * config.getLevelHeight()));
    }

    /**
     * Level containing a world height.
     */
    public int levelOf(Point3f position) {
        int level = (int) Math.round(position.z / config.getLevelHeight());
        return Math.max(0, Math.min(config.getLevels() - 1, level));
    }

    /**
     * Closest navigable node on the level containing the position. Ties go to the lower id.
     */
    public Optional<Node> nearestNode(Point3f position) {
        int level = levelOf(position);
        Node best = null;
        double bestDistance = Double.MAX_VALUE;
        for (var node : nodeList) {
            if (node.level() != level) {
                continue;
            }
            double d = DeterministicMath.distance(position(node), position);
            if (d < bestDistance) {
                bestDistance = d;
                best = node;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Lower bound of the unweighted travel cost between two nodes: straight-line planar distance plus
     * one stair edge per level of difference. Admissible and consistent for this graph.
     */
    public double unweightedDistance(Node a, Node b) {
        double planar = DeterministicMath.hypot(a.x() - b.x(), a.y() - b.y()) * config.getCellSize();
        return planar + Math.abs(a.level() - b.level()) * config.verticalEdgeCost();
    }

    private Edge[] connect(Node node) {
        var edges = new ArrayList<Edge>(6);
        double horizontal = config.getCellSize();
        addHorizontal(edges, node, 1, 0, horizontal);
        addHorizontal(edges, node, -1, 0, horizontal);
        addHorizontal(edges, node, 0, 1, horizontal);
        addHorizontal(edges, node, 0, -1, horizontal);
        if (node.isStair()) {
            addVertical(edges, node, -1);
            addVertical(edges, node, 1);
        }
        return edges.toArray(new Edge[0]);
    }

    private void addHorizontal(List<Edge> edges, Node node, int dx, int dy, double cost) {
        nodeAt(node.x() + dx, node.y() + dy, node.level()).ifPresent(n -> edges.add(new Edge(node, n, cost, false)));
    }

    private void addVertical(List<Edge> edges, Node node, int dz) {
        nodeAt(node.x(), node.y(), node.level() + dz).filter(Node::isStair)
                                                    .ifPresent(n -> edges.add(
                                                    new Edge(node, n, config.verticalEdgeCost(), true)));
    }

    private NodeKind kindOf(int x, int y, int level) {
        if (config.isStairCell(x, y)) {
            return NodeKind.STAIR_CELL;
        }
        int last = config.getGridResolution() - 1;
        if (level == 0 && (x == 0 || y == 0 || x == last || y == last)) {
            return NodeKind.EXIT;
        }
        return NodeKind.FLOOR_CELL;
    }

    private int idOf(Point3i cell) {
        return idOf(cell.x, cell.y, cell.z);
    }

    private int idOf(int x, int y, int level) {
        int res = config.getGridResolution();
        return (level * res + y) * res + x;
    }

    @Override
    public String toString() {
        return String.format("SpatialGraph{nodes=%d, edges=%d, start=%s, target=%s}", nodeCount(), edgeCount, start,
                             target);
    }
}
