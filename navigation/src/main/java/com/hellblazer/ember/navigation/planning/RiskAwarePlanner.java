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

import com.hellblazer.ember.navigation.Edge;
import com.hellblazer.ember.navigation.Node;
import com.hellblazer.ember.navigation.SpatialGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Best-first (A*) search with danger-sensitive edge weights.
 * <p>
 * Traversing an edge costs {@code base * (1 + lambda * (intensity(dest) + penalty(dest)))} with
 * {@code lambda = (1 - riskTolerance) * dangerWeight} and the intensity taken from the request's
 * hazard snapshot. The heuristic is the graph's unweighted distance scaled by the configured safety
 * factor. Hazard weighting only raises costs, so the heuristic stays a consistent lower bound and the
 * first time the target is popped its cost is minimal.
 * <p>
 * Equal-cost alternatives are resolved deterministically: fewer vertical transitions first, then the
 * lower predecessor id. Queue ties are broken by node id.
 * <p>
 * A planner is stateless between calls and may be shared by every agent of a mission.
 *
 * @author hal.hildebrand
 */
public class RiskAwarePlanner {
    private static final Logger log = LoggerFactory.getLogger(RiskAwarePlanner.class);
    private static final double EPSILON = 1e-9;

    private final SpatialGraph  graph;
    private final PlannerConfig config;

    public RiskAwarePlanner(SpatialGraph graph, PlannerConfig config) {
        this.graph = graph;
        this.config = config;
    }

    public SpatialGraph graph() {
        return graph;
    }

    public PlannerConfig config() {
        return config;
    }

    /**
     * Effective cost of traversing an edge under a request's hazard snapshot, tolerance and penalty.
     */
    public double edgeCost(Edge edge, PlanRequest request) {
        double danger = request.hazard().intensityAt(edge.to()) + request.penalty().penaltyAt(edge.to());
        return edge.baseCost() * (1.0 + config.lambda(request.riskTolerance()) * danger);
    }

    /**
     * Plan a minimum-cost path.
     *
     * @param request start, target, snapshot, tolerance and penalty
     * @return the path, start and target inclusive
     * @throws NoPathFoundException when no route exists or the expansion limit is reached
     */
    public PlannedPath plan(PlanRequest request) throws NoPathFoundException {
        var start = request.start();
        var target = request.target();
        int size = graph.idSpace();
        var g = new double[size];
        var vertical = new int[size];
        var parent = new int[size];
        var parentEdgeVertical = new boolean[size];
        var closed = new boolean[size];
        Arrays.fill(g, Double.POSITIVE_INFINITY);
        Arrays.fill(parent, -1);

        var open = new PriorityQueue<SearchNode>();
        g[start.id()] = 0.0;
        open.add(new SearchNode(start.id(), heuristic(start, target), 0.0, 0));

        int expanded = 0;
        while (!open.isEmpty()) {
            var current = open.poll();
            int id = current.id;
            if (closed[id] || current.g > g[id] + EPSILON || current.vertical != vertical[id]) {
                continue;
            }
            if (id == target.id()) {
                var path = reconstruct(request, g, parent, parentEdgeVertical, expanded);
                log.debug("Planned {} (tolerance {})", path, request.riskTolerance());
                return path;
            }
            closed[id] = true;
            if (++expanded > config.getMaxExpansions()) {
                throw new NoPathFoundException(start, target, expanded, "expansion limit reached");
            }
            for (var edge : graph.neighbors(graph.node(id))) {
                int next = edge.to().id();
                if (closed[next]) {
                    continue;
                }
                double candidate = g[id] + edgeCost(edge, request);
                int candidateVertical = vertical[id] + (edge.vertical() ? 1 : 0);
                if (improves(candidate, candidateVertical, id, g[next], vertical[next], parent[next])) {
                    g[next] = candidate;
                    vertical[next] = candidateVertical;
                    parent[next] = id;
                    parentEdgeVertical[next] = edge.vertical();
                    open.add(new SearchNode(next, candidate + heuristic(edge.to(), target), candidate,
                                            candidateVertical));
                }
            }
        }
        log.debug("No path from {} to {} after {} expansions", start, target, expanded);
        throw new NoPathFoundException(start, target, expanded);
    }

    /**
     * Scaled unweighted lower bound from a node to the target.
     */
    double heuristic(Node from, Node target) {
        return graph.unweightedDistance(from, target) * config.getHeuristicScale();
    }

    private static boolean improves(double cost, int verticalCount, int predecessor, double bestCost,
                                    int bestVertical, int bestPredecessor) {
        if (cost < bestCost - EPSILON) {
            return true;
        }
        if (cost > bestCost + EPSILON) {
            return false;
        }
        if (verticalCount != bestVertical) {
            return verticalCount < bestVertical;
        }
        return bestPredecessor >= 0 && predecessor < bestPredecessor;
    }

    private PlannedPath reconstruct(PlanRequest request, double[] g, int[] parent, boolean[] parentEdgeVertical,
                                    int expanded) {
        var nodes = new ArrayList<Node>();
        double base = 0.0;
        int transitions = 0;
        double verticalCost = graph.config().verticalEdgeCost();
        double horizontalCost = graph.config().getCellSize();
        for (int id = request.target().id(); id >= 0; id = parent[id]) {
            nodes.add(graph.node(id));
            if (parent[id] >= 0) {
                if (parentEdgeVertical[id]) {
                    transitions++;
                    base += verticalCost;
                } else {
                    base += horizontalCost;
                }
            }
        }
        Collections.reverse(nodes);
        List<Double> assumed = new ArrayList<>(nodes.size());
        for (var node : nodes) {
            assumed.add(request.hazard().intensityAt(node));
        }
        return new PlannedPath(nodes, g[request.target().id()], base, transitions, expanded, assumed,
                               request.riskTolerance());
    }

    private static final class SearchNode implements Comparable<SearchNode> {
        final int    id;
        final double f;
        final double g;
        final int    vertical;

        SearchNode(int id, double f, double g, int vertical) {
            this.id = id;
            this.f = f;
            this.g = g;
            this.vertical = vertical;
        }

        @Override
        public int compareTo(SearchNode o) {
            int c = Double.compare(f, o.f);
            if (c != 0) {
                return c;
            }
            c = Integer.compare(vertical, o.vertical);
            return c != 0 ? c : Integer.compare(id, o.id);
        }
    }
}
