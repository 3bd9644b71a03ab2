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

package com.hellblazer.ember.simulation.mission;

import javax.vecmath.Point3f;

/**
 * A candidate hazard origin reported by an external detector.
 *
 * @param position   world position
 * @param level      level of the origin
 * @param confidence detector confidence in [0, 1]
 * @author hal.hildebrand
 */
public record HazardHint(Point3f position, int level, double confidence) {

    public HazardHint {
        if (position == null) {
            throw new IllegalArgumentException("position is required");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must lie in [0, 1]: " + confidence);
        }
        position = new Point3f(position);
    }

    @Override
    public Point3f position() {
        return new Point3f(position);
    }
}
