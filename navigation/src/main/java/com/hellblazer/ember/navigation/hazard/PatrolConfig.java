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

import com.hellblazer.ember.common.ConfigurationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Parameters of the patrolling (attacker) hazard. Without explicit waypoints the route is derived
 * from the graph: a square on the lower level, up through the stairway centre, the same square on
 * the upper level, and back down.
 *
 * @author hal.hildebrand
 */
public class PatrolConfig {
    private final int            lowerLevel;
    private final int            upperLevel;
    private final double         speed;
    private final double         dangerRadius;
    private final double         intensity;
    private final List<Waypoint> waypoints;

    private PatrolConfig(Builder builder) {
        this.lowerLevel = builder.lowerLevel;
        this.upperLevel = builder.upperLevel;
        this.speed = builder.speed;
        this.dangerRadius = builder.dangerRadius;
        this.intensity = builder.intensity;
        this.waypoints = List.copyOf(builder.waypoints);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PatrolConfig defaults() {
        return builder().build();
    }

    public int getLowerLevel() {
        return lowerLevel;
    }

    public int getUpperLevel() {
        return upperLevel;
    }

    public double getSpeed() {
        return speed;
    }

    public double getDangerRadius() {
        return dangerRadius;
    }

    public double getIntensity() {
        return intensity;
    }

    /**
     * @return explicit route, empty when the route is derived from the graph
     */
    public List<Waypoint> getWaypoints() {
        return waypoints;
    }

    private void validate() {
        var errors = new ArrayList<String>();
        if (lowerLevel < 0 || upperLevel < lowerLevel) {
            errors.add(String.format("patrol levels must satisfy 0 <= lower <= upper: %d, %d", lowerLevel,
                                     upperLevel));
        }
        if (speed < 0.0) {
            errors.add("speed must be >= 0: " + speed);
        }
        if (dangerRadius <= 0.0) {
            errors.add("danger radius must be positive: " + dangerRadius);
        }
        if (intensity < 0.0 || intensity > 1.0) {
            errors.add("intensity must lie in [0, 1]: " + intensity);
        }
        for (var waypoint : waypoints) {
            if (waypoint.level() != lowerLevel && waypoint.level() != upperLevel) {
                errors.add("waypoint off the patrol levels: " + waypoint);
            }
        }
        ConfigurationException.throwIfAny("patrol configuration", errors);
    }

    @Override
    public String toString() {
        return String.format("PatrolConfig{levels=%d..%d, speed=%.2f, radius=%.2f, waypoints=%s}", lowerLevel,
                             upperLevel, speed, dangerRadius, waypoints.isEmpty() ? "derived" : waypoints.size());
    }

    /**
     * A route point in world x/y on a level.
     */
    public record Waypoint(double x, double y, int level) {
    }

    public static class Builder {
        private final List<Waypoint> waypoints    = new ArrayList<>();
        private       int            lowerLevel   = 2;
        private       int            upperLevel   = 3;
        private       double         speed        = 1.5;
        private       double         dangerRadius = 3.0;
        private       double         intensity    = 1.0;

        public Builder levels(int lower, int upper) {
            this.lowerLevel = lower;
            this.upperLevel = upper;
            return this;
        }

        public Builder speed(double unitsPerSecond) {
            this.speed = unitsPerSecond;
            return this;
        }

        public Builder dangerRadius(double radius) {
            this.dangerRadius = radius;
            return this;
        }

        public Builder intensity(double intensity) {
            this.intensity = intensity;
            return this;
        }

        public Builder waypoint(double x, double y, int level) {
            this.waypoints.add(new Waypoint(x, y, level));
            return this;
        }

        public PatrolConfig build() {
            var config = new PatrolConfig(this);
            config.validate();
            return config;
        }
    }
}
