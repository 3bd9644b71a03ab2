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

import com.hellblazer.ember.common.ConfigurationException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Optional;

/**
 * Parameters of one mission: team size, risk-tolerance derivation, tick budget and the weight given
 * to recorded deaths.
 *
 * @author hal.hildebrand
 */
public class MissionConfig {
    private final int      agents;
    private final double   baseRiskTolerance;
    private final double   learningRate;
    private final double   toleranceSpread;
    private final double   tickSeconds;
    private final int      maxTicks;
    private final Duration wallClockBudget;
    private final double   hintConfidenceThreshold;
    private final double   penaltyScale;
    private final double   penaltyDecay;
    private final int      penaltyRadius;

    private MissionConfig(Builder builder) {
        this.agents = builder.agents;
        this.baseRiskTolerance = builder.baseRiskTolerance;
        this.learningRate = builder.learningRate;
        this.toleranceSpread = builder.toleranceSpread;
        this.tickSeconds = builder.tickSeconds;
        this.maxTicks = builder.maxTicks;
        this.wallClockBudget = builder.wallClockBudget;
        this.hintConfidenceThreshold = builder.hintConfidenceThreshold;
        this.penaltyScale = builder.penaltyScale;
        this.penaltyDecay = builder.penaltyDecay;
        this.penaltyRadius = builder.penaltyRadius;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static MissionConfig defaults() {
        return builder().build();
    }

    /**
     * A builder seeded with this configuration's values.
     */
    public Builder toBuilder() {
        return new Builder().agents(agents)
                            .baseRiskTolerance(baseRiskTolerance)
                            .learningRate(learningRate)
                            .toleranceSpread(toleranceSpread)
                            .tickSeconds(tickSeconds)
                            .maxTicks(maxTicks)
                            .wallClockBudget(wallClockBudget)
                            .hintConfidenceThreshold(hintConfidenceThreshold)
                            .penaltyScale(penaltyScale)
                            .penaltyDecay(penaltyDecay)
                            .penaltyRadius(penaltyRadius);
    }

    public int getAgents() {
        return agents;
    }

    public double getBaseRiskTolerance() {
        return baseRiskTolerance;
    }

    public double getLearningRate() {
        return learningRate;
    }

    public double getToleranceSpread() {
        return toleranceSpread;
    }

    public double getTickSeconds() {
        return tickSeconds;
    }

    public int getMaxTicks() {
        return maxTicks;
    }

    public Optional<Duration> getWallClockBudget() {
        return Optional.ofNullable(wallClockBudget);
    }

    public double getHintConfidenceThreshold() {
        return hintConfidenceThreshold;
    }

    public double getPenaltyScale() {
        return penaltyScale;
    }

    public double getPenaltyDecay() {
        return penaltyDecay;
    }

    public int getPenaltyRadius() {
        return penaltyRadius;
    }

    /**
     * Team tolerance for a mission starting from the given success rate. Neutral when nothing has
     * been attempted yet; otherwise lowered after poor records and raised after good ones.
     */
    public double teamTolerance(double successRate, boolean anyAttempts) {
        if (!anyAttempts) {
            return baseRiskTolerance;
        }
        return clampUnit(baseRiskTolerance - learningRate * (0.5 - successRate));
    }

    /**
     * Tolerance of one agent, spread evenly around the team tolerance.
     */
    public double agentTolerance(double teamTolerance, int agentIndex) {
        double offset = agentIndex - (agents - 1) / 2.0;
        return clampUnit(teamTolerance + toleranceSpread * offset);
    }

    private static double clampUnit(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    @Override
    public String toString() {
        return String.format("MissionConfig{agents=%d, tolerance=%.2f, learning=%.2f, spread=%.2f, tick=%.2fs, "
                             + "maxTicks=%d}", agents, baseRiskTolerance, learningRate, toleranceSpread, tickSeconds,
                             maxTicks);
    }

    public static class Builder {
        private int      agents                  = 3;
        private double   baseRiskTolerance       = 0.5;
        private double   learningRate            = 0.5;
        private double   toleranceSpread         = 0.1;
        private double   tickSeconds             = 0.5;
        private int      maxTicks                = 240;
        private Duration wallClockBudget;
        private double   hintConfidenceThreshold = 0.5;
        private double   penaltyScale            = 0.5;
        private double   penaltyDecay            = 0.8;
        private int      penaltyRadius           = 1;

        public Builder agents(int count) {
            this.agents = count;
            return this;
        }

        public Builder baseRiskTolerance(double tolerance) {
            this.baseRiskTolerance = tolerance;
            return this;
        }

        public Builder learningRate(double rate) {
            this.learningRate = rate;
            return this;
        }

        public Builder toleranceSpread(double spread) {
            this.toleranceSpread = spread;
            return this;
        }

        public Builder tickSeconds(double seconds) {
            this.tickSeconds = seconds;
            return this;
        }

        public Builder maxTicks(int ticks) {
            this.maxTicks = ticks;
            return this;
        }

        /**
         * @param budget wall-clock limit of one mission, null for none
         */
        public Builder wallClockBudget(Duration budget) {
            this.wallClockBudget = budget;
            return this;
        }

        public Builder hintConfidenceThreshold(double threshold) {
            this.hintConfidenceThreshold = threshold;
            return this;
        }

        public Builder penaltyScale(double scale) {
            this.penaltyScale = scale;
            return this;
        }

        public Builder penaltyDecay(double decay) {
            this.penaltyDecay = decay;
            return this;
        }

        public Builder penaltyRadius(int cells) {
            this.penaltyRadius = cells;
            return this;
        }

        public MissionConfig build() {
            var errors = new ArrayList<String>();
            if (agents <= 0) {
                errors.add("agent count must be positive: " + agents);
            }
            if (baseRiskTolerance < 0.0 || baseRiskTolerance > 1.0) {
                errors.add("base risk tolerance must lie in [0, 1]: " + baseRiskTolerance);
            }
            if (learningRate < 0.0) {
                errors.add("learning rate must be >= 0: " + learningRate);
            }
            if (toleranceSpread < 0.0) {
                errors.add("tolerance spread must be >= 0: " + toleranceSpread);
            }
            if (tickSeconds <= 0.0) {
                errors.add("tick length must be positive: " + tickSeconds);
            }
            if (maxTicks <= 0) {
                errors.add("tick budget must be positive: " + maxTicks);
            }
            if (wallClockBudget != null && (wallClockBudget.isNegative() || wallClockBudget.isZero())) {
                errors.add("wall-clock budget must be positive: " + wallClockBudget);
            }
            if (hintConfidenceThreshold < 0.0 || hintConfidenceThreshold > 1.0) {
                errors.add("hint confidence threshold must lie in [0, 1]: " + hintConfidenceThreshold);
            }
            if (penaltyScale < 0.0) {
                errors.add("penalty scale must be >= 0: " + penaltyScale);
            }
            if (penaltyDecay <= 0.0 || penaltyDecay > 1.0) {
                errors.add("penalty decay must lie in (0, 1]: " + penaltyDecay);
            }
            if (penaltyRadius < 0) {
                errors.add("penalty radius must be >= 0: " + penaltyRadius);
            }
            ConfigurationException.throwIfAny("mission configuration", errors);
            return new MissionConfig(this);
        }
    }
}
