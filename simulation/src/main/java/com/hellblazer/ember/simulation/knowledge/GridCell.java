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

import com.hellblazer.ember.geometry.Point3i;
import com.hellblazer.ember.navigation.Node;

/**
 * Recorded grid position: column, row and level. The persisted form of a node.
 */
public record GridCell(int x, int y, int level) {

    public static GridCell of(Node node) {
        return new GridCell(node.x(), node.y(), node.level());
    }

    public Point3i toCell() {
        return new Point3i(x, y, level);
    }
}
