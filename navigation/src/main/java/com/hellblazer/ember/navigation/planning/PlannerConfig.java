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

import com.hellblazer.ember.common.ConfigurationException;

import java.util.ArrayList;

/**
 * Cost-model parameters of the planner.
 *
 * @author hal.hildebrand
 */
public class PlannerConfig {
    private final double dangerWeight;
    private final double heuristicScale;
    private final int    maxExpansions;

    private PlannerConfig(Builder builder) {
        this.dangerWeight = builder.dangerWeight;
        this.heuristicScale = builder.heuristicScale;
        this.maxExpansions = builder.maxExpansions;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PlannerConfig defaults() {
        return builder().build();
    }

    public double getDangerWeight() {
        return dangerWeight;
    }

    /**
     * Safety factor applied to the unweighted heuristic, in (0, 1].
     */
    public double getHeuristicScale() {
        return heuristicScale;
    }

    public int getMaxExpansions() {
        return maxExpansions;
    }

    /**
     * Danger multiplier for a given risk tolerance: {@code (1 - tolerance) * dangerWeight}.
     */
    public double lambda(double riskTolerance) {
        return (1.0 - riskTolerance) * dangerWeight;
    }

    @Override
    public String toString() {
        return String.format("PlannerConfig{dangerWeight=%.2f, heuristicScale=%.2f, maxExpansions=%d}", dangerWeight,
                             heuristicScale, maxExpansions);
    }

    public static class Builder {
        private double dangerWeight   = 10.0;
        private double heuristicScale = 1.0;
        private int    maxExpansions  = Integer.MAX_VALUE;

        public Builder dangerWeight(double weight) {
            this.dangerWeight = weight;
            return this;
        }

        public Builder heuristicScale(double scale) {
            this.heuristicScale = scale;
            return this;
        }

        public Builder maxExpansions(int max) {
            this.maxExpansions = max;
            return this;
        }

        public PlannerConfig build() {
            var errors = new ArrayList<String>();
            if (dangerWeight < 0.0) {
                errors.add("danger weight must be >= 0: " + dangerWeight);
            }
            if (!(heuristicScale > 0.0 && heuristicScale <= 1.0)) {
                errors.add("heuristic scale must lie in (0, 1]: " + heuristicScale);
            }
            if (maxExpansions <= 0) {
                errors.add("max expansions must be positive: " + maxExpansions);
            }
            ConfigurationException.throwIfAny("planner configuration", errors);
            return new PlannerConfig(this);
        }
    }
}
