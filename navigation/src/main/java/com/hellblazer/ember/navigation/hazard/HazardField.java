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

import com.hellblazer.ember.navigation.SpatialGraph;

import javax.vecmath.Point3f;

/**
 * Time-evolving danger model of one mission.
 * <p>
 * A hazard exists from t = 0: querying before the first {@link #advance(double)} answers from the
 * initial state, never "no hazard yet". Intensities are always in [0, 1].
 * <p>
 * Implementations are owned by a single mission coordinator and are not thread-safe.
 *
 * @author hal.hildebrand
 */
public interface HazardField {

    HazardKind kind();

    /**
     * @return simulated seconds elapsed since the hazard appeared
     */
    double elapsed();

    /**
     * Advance simulated time.
     *
     * @param dt seconds, must be non-negative
     */
    void advance(double dt);

    /**
     * Intensity at a world position on a level, evaluated at an arbitrary time. Only the spreading
     * variant's ignition history makes the result depend on how far the field has been advanced.
     *
     * @param point world position
     * @param level level index
     * @param time  simulated seconds
     * @return intensity in [0, 1]
     */
    double intensityAt(Point3f point, int level, double time);

    /**
     * Intensity at the current elapsed time.
     */
    default double intensityAt(Point3f point, int level) {
        return intensityAt(point, level, elapsed());
    }

    HazardState state();

    /**
     * Capture the intensity of every graph node at the current elapsed time.
     */
    default HazardSnapshot snapshot(SpatialGraph graph) {
        return HazardSnapshot.capture(this, graph);
    }
}
