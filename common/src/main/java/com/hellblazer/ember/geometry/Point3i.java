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

package com.hellblazer.ember.geometry;

import java.util.Objects;

/**
 * Immutable integer grid cell. x and y index the cell within a level, z is the level index.
 * Used for graph node coordinates and for recorded positions in mission outcomes.
 *
 * @author hal.hildebrand
 */
public final class Point3i implements Comparable<Point3i> {

    /** Column within the level */
    public final int x;

    /** Row within the level */
    public final int y;

    /** Level index */
    public final int z;

    /**
     * Create a new grid cell.
     *
     * @param x column
     * @param y row
     * @param z level
     */
    public Point3i(int x, int y, int z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    /**
     * The level index of this cell.
     *
     * @return z
     */
    public int level() {
        return z;
    }

    /**
     * Chebyshev distance within the level, ignoring z.
     *
     * @param other other cell
     * @return max(|dx|, |dy|)
     */
    public int planarChebyshevDistance(Point3i other) {
        return Math.max(Math.abs(x - other.x), Math.abs(y - other.y));
    }

    /**
     * Order by level, then row, then column. Matches node id order in the navigation graph.
     */
    @Override
    public int compareTo(Point3i o) {
        int c = Integer.compare(z, o.z);
        if (c != 0) {
            return c;
        }
        c = Integer.compare(y, o.y);
        return c != 0 ? c : Integer.compare(x, o.x);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Point3i other)) return false;
        return x == other.x && y == other.y && z == other.z;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, z);
    }

    @Override
    public String toString() {
        return String.format("Point3i(%d, %d, %d)", x, y, z);
    }
}
