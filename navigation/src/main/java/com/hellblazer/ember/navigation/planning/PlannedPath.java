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

import com.hellblazer.ember.navigation.Node;

import java.util.List;

/**
 * Result of a successful planning call: the node sequence from start to target, inclusive.
 *
 * @param nodes               path, first element is the start, last the target
 * @param weightedCost        total hazard-weighted cost the search minimised
 * @param unweightedCost      sum of base edge costs along the path
 * @param verticalTransitions number of stair edges taken
 * @param expanded            nodes expanded by the search
 * @param assumedIntensities  snapshot intensity of each path node, parallel to {@code nodes}
 * @param riskTolerance       tolerance the path was planned with
 * @author hal.hildebrand
 */
public record PlannedPath(List<Node> nodes, double weightedCost, double unweightedCost, int verticalTransitions,
                          int expanded, List<Double> assumedIntensities, double riskTolerance) {

    public PlannedPath {
        nodes = List.copyOf(nodes);
        assumedIntensities = List.copyOf(assumedIntensities);
        if (nodes.isEmpty() || nodes.size() != assumedIntensities.size()) {
            throw new IllegalArgumentException("Path nodes and intensities must be non-empty and parallel");
        }
    }

    public Node start() {
        return nodes.get(0);
    }

    public Node destination() {
        return nodes.get(nodes.size() - 1);
    }

    /**
     * Number of edges along the path.
     */
    public int steps() {
        return nodes.size() - 1;
    }

    public Node node(int index) {
        return nodes.get(index);
    }

    public double assumedIntensity(int index) {
        return assumedIntensities.get(index);
    }

    public double maxAssumedIntensity() {
        double max = 0.0;
        for (double v : assumedIntensities) {
            max = Math.max(max, v);
        }
        return max;
    }

    @Override
    public String toString() {
        return String.format("PlannedPath{%s -> %s, steps=%d, cost=%.3f, base=%.3f, vertical=%d}", start(),
                             destination(), steps(), weightedCost, unweightedCost, verticalTransitions);
    }
}
