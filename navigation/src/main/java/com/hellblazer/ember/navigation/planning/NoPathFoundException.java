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

/**
 * Thrown when the search exhausts its frontier, or its expansion limit, without reaching the target.
 * Recovered by the caller; an agent that cannot plan stalls.
 *
 * @author hal.hildebrand
 */
public class NoPathFoundException extends Exception {
    private final Node start;
    private final Node target;
    private final int  expanded;

    public NoPathFoundException(Node start, Node target, int expanded) {
        this(start, target, expanded, "frontier exhausted");
    }

    public NoPathFoundException(Node start, Node target, int expanded, String reason) {
        super(String.format("No path from %s to %s: %s after %d expansions", start, target, reason, expanded));
        this.start = start;
        this.target = target;
        this.expanded = expanded;
    }

    public Node getStart() {
        return start;
    }

    public Node getTarget() {
        return target;
    }

    public int getExpanded() {
        return expanded;
    }
}
