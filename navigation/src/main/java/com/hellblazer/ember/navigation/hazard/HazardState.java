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

import javax.vecmath.Point3f;
import java.util.List;

/**
 * Point-in-time description of a hazard's footprint.
 *
 * @param kind      hazard variant
 * @param elapsed   simulated seconds since the hazard appeared
 * @param centers   active origins (spreading) or the single current patrol position (patrolling)
 * @param radius    current radius of the largest origin, or the patrol danger radius
 * @param intensity current peak intensity before level modulation
 */
public record HazardState(HazardKind kind, double elapsed, List<Center> centers, double radius, double intensity) {

    public HazardState {
        centers = List.copyOf(centers);
    }

    /**
     * A hazard center in world coordinates.
     *
     * @param position world position
     * @param level    level index
     */
    public record Center(Point3f position, int level) {
        public Center {
            position = new Point3f(position);
        }

        @Override
        public Point3f position() {
            return new Point3f(position);
        }
    }
}
