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

import com.hellblazer.ember.navigation.Node;
import com.hellblazer.ember.navigation.SpatialGraph;

/**
 * Immutable per-node hazard intensities captured at one moment. The planner costs edges against a
 * snapshot, never against the live field.
 *
 * @author hal.hildebrand
 */
public final class HazardSnapshot {
    private final double   time;
    private final double[] intensities;
    private final double   max;

    private HazardSnapshot(double time, double[] intensities) {
        this.time = time;
        this.intensities = intensities;
        double m = 0.0;
        for (double v : intensities) {
            m = Math.max(m, v);
        }
        this.max = m;
    }

    public static HazardSnapshot capture(HazardField field, SpatialGraph graph) {
        double t = field.elapsed();
        var values = new double[graph.idSpace()];
        for (var node : graph.nodes()) {
            values[node.id()] = field.intensityAt(graph.position(node), node.level(), t);
        }
        return new HazardSnapshot(t, values);
    }

    /**
     * A snapshot with no hazard anywhere.
     */
    public static HazardSnapshot empty(SpatialGraph graph) {
        return new HazardSnapshot(0.0, new double[graph.idSpace()]);
    }

    public double time() {
        return time;
    }

    public double intensityAt(Node node) {
        return intensities[node.id()];
    }

    public double maxIntensity() {
        return max;
    }

    @Override
    public String toString() {
        return String.format("HazardSnapshot{t=%.2f, max=%.3f}", time, max);
    }
}
