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

import com.hellblazer.ember.geometry.Point3i;

/**
 * One navigable cell of the structure. Immutable; created once when the graph is built.
 *
 * @param id   dense identifier, level-major then row then column
 * @param cell grid cell, z is the level index
 * @param kind cell classification
 * @author hal.hildebrand
 */
public record Node(int id, Point3i cell, NodeKind kind) implements Comparable<Node> {

    public int x() {
        return cell.x;
    }

    public int y() {
        return cell.y;
    }

    public int level() {
        return cell.z;
    }

    public boolean isStair() {
        return kind == NodeKind.STAIR_CELL;
    }

    @Override
    public int compareTo(Node o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public String toString() {
        return String.format("Node[%d (%d, %d) L%d %s]", id, cell.x, cell.y, cell.z, kind);
    }
}
