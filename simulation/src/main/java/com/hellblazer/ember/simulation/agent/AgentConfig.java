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

package com.hellblazer.ember.simulation.agent;

import com.hellblazer.ember.common.ConfigurationException;

import java.util.ArrayList;

/**
 * Per-agent execution parameters. The numeric defaults are tunable; only their monotonic effect on
 * health and replanning matters.
 *
 * @author hal.hildebrand
 */
public class AgentConfig {
    private final double damagePerTick;
    private final double replanThreshold;
    private final int    lookahead;
    private final int    stepBudget;
    private final double sharedPenaltyWeight;

    private AgentConfig(Builder builder) {
        this.damagePerTick = builder.damagePerTick;
        this.replanThreshold = builder.replanThreshold;
        this.lookahead = builder.lookahead;
        this.stepBudget = builder.stepBudget;
        this.sharedPenaltyWeight = builder.sharedPenaltyWeight;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AgentConfig defaults() {
        return builder().build();
    }

    /**
     * Health lost per tick spent at intensity 1.0.
     */
    public double getDamagePerTick() {
        return damagePerTick;
    }

    public double getReplanThreshold() {
        return replanThreshold;
    }

    /**
     * Number of upcoming waypoints checked for the replanning trigger.
     */
    public int getLookahead() {
        return lookahead;
    }

    public int getStepBudget() {
        return stepBudget;
    }

    /**
     * Scale of the transient penalty an observation shared by another agent adds at its node.
     */
    public double getSharedPenaltyWeight() {
        return sharedPenaltyWeight;
    }

    @Override
    public String toString() {
        return String.format("AgentConfig{damage=%.3f, threshold=%.2f, lookahead=%d, steps=%d, shared=%.2f}",
                             damagePerTick, replanThreshold, lookahead, stepBudget, sharedPenaltyWeight);
    }

    public static class Builder {
        private double damagePerTick       = 0.1;
        private double replanThreshold     = 0.6;
        private int    lookahead           = 2;
        private int    stepBudget          = 200;
        private double sharedPenaltyWeight = 1.0;

        public Builder damagePerTick(double damage) {
            this.damagePerTick = damage;
            return this;
        }

        public Builder replanThreshold(double threshold) {
            this.replanThreshold = threshold;
            return this;
        }

        public Builder lookahead(int waypoints) {
            this.lookahead = waypoints;
            return this;
        }

        public Builder stepBudget(int steps) {
            this.stepBudget = steps;
            return this;
        }

        public Builder sharedPenaltyWeight(double weight) {
            this.sharedPenaltyWeight = weight;
            return this;
        }

        public AgentConfig build() {
            var errors = new ArrayList<String>();
            if (damagePerTick < 0.0) {
                errors.add("damage per tick must be >= 0: " + damagePerTick);
            }
            if (replanThreshold < 0.0 || replanThreshold > 1.0) {
                errors.add("replan threshold must lie in [0, 1]: " + replanThreshold);
            }
            if (lookahead < 0) {
                errors.add("lookahead must be >= 0: " + lookahead);
            }
            if (stepBudget <= 0) {
                errors.add("step budget must be positive: " + stepBudget);
            }
            if (sharedPenaltyWeight < 0.0) {
                errors.add("shared penalty weight must be >= 0: " + sharedPenaltyWeight);
            }
            ConfigurationException.throwIfAny("agent configuration", errors);
            return new AgentConfig(this);
        }
    }
}
