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

/**
 * Traversable adjacency between two nodes. Only the base cost is stored; the effective,
 * hazard-weighted cost is computed by the planner for every query.
 *
 * @param from     origin node
 * @param to       destination node
 * @param baseCost distance cost, never negative
 * @param vertical true when the edge moves between levels
 * @author hal.hildebrand
 */
public record Edge(Node from, Node to, double baseCost, boolean vertical) {

    public Edge {
        if (baseCost < 0.0) {
            throw new IllegalArgumentException("Edge cost must be >= 0: " + baseCost);
        }
    }
}
