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

/**
 * Parameters of the spreading (fire) hazard.
 *
 * @author hal.hildebrand
 */
public class SpreadingConfig {
    private final double initialRadius;
    private final double spreadRate;
    private final double maxRadius;
    private final double initialIntensity;
    private final double intensityGrowth;
    private final double intensityCap;
    private final double heatRise;
    private final int    lowerLevels;
    private final double placementMargin;
    private final double ignitionThreshold;
    private final double ignitionProbability;
    private final double ignitionRange;
    private final double upwardProbability;
    private final double secondaryIntensity;
    private final double secondaryRadius;
    private final double minOriginSeparation;
    private final int    maxOrigins;

    private SpreadingConfig(Builder builder) {
        this.initialRadius = builder.initialRadius;
        this.spreadRate = builder.spreadRate;
        this.maxRadius = builder.maxRadius;
        this.initialIntensity = builder.initialIntensity;
        this.intensityGrowth = builder.intensityGrowth;
        this.intensityCap = builder.intensityCap;
        this.heatRise = builder.heatRise;
        this.lowerLevels = builder.lowerLevels;
        this.placementMargin = builder.placementMargin;
        this.ignitionThreshold = builder.ignitionThreshold;
        this.ignitionProbability = builder.ignitionProbability;
        this.ignitionRange = builder.ignitionRange;
        this.upwardProbability = builder.upwardProbability;
        this.secondaryIntensity = builder.secondaryIntensity;
        this.secondaryRadius = builder.secondaryRadius;
        this.minOriginSeparation = builder.minOriginSeparation;
        this.maxOrigins = builder.maxOrigins;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SpreadingConfig defaults() {
        return builder().build();
    }

    public double getInitialRadius() {
        return initialRadius;
    }

    public double getSpreadRate() {
        return spreadRate;
    }

    public double getMaxRadius() {
        return maxRadius;
    }

    public double getInitialIntensity() {
        return initialIntensity;
    }

    public double getIntensityGrowth() {
        return intensityGrowth;
    }

    public double getIntensityCap() {
        return intensityCap;
    }

    public double getHeatRise() {
        return heatRise;
    }

    public int getLowerLevels() {
        return lowerLevels;
    }

    public double getPlacementMargin() {
        return placementMargin;
    }

    public double getIgnitionThreshold() {
        return ignitionThreshold;
    }

    public double getIgnitionProbability() {
        return ignitionProbability;
    }

    public double getIgnitionRange() {
        return ignitionRange;
    }

    public double getUpwardProbability() {
        return upwardProbability;
    }

    public double getSecondaryIntensity() {
        return secondaryIntensity;
    }

    public double getSecondaryRadius() {
        return secondaryRadius;
    }

    public double getMinOriginSeparation() {
        return minOriginSeparation;
    }

    public int getMaxOrigins() {
        return maxOrigins;
    }

    private void validate() {
        var errors = new ArrayList<String>();
        if (initialRadius <= 0.0) {
            errors.add("initial radius must be positive: " + initialRadius);
        }
        if (maxRadius < initialRadius) {
            errors.add("max radius " + maxRadius + " below initial radius " + initialRadius);
        }
        if (spreadRate < 0.0 || intensityGrowth < 0.0 || heatRise < 0.0) {
            errors.add("spread rate, intensity growth and heat rise must be >= 0");
        }
        if (!unit(initialIntensity) || !unit(intensityCap) || !unit(secondaryIntensity)) {
            errors.add("intensities must lie in [0, 1]");
        }
        if (!unit(ignitionProbability) || !unit(upwardProbability)) {
            errors.add("probabilities must lie in [0, 1]");
        }
        if (placementMargin < 0.0 || placementMargin >= 0.5) {
            errors.add("placement margin must lie in [0, 0.5): " + placementMargin);
        }
        if (lowerLevels <= 0) {
            errors.add("lower levels must be positive: " + lowerLevels);
        }
        if (secondaryRadius <= 0.0 || ignitionRange < 0.0 || minOriginSeparation < 0.0) {
            errors.add("secondary radius must be positive, ranges non-negative");
        }
        if (maxOrigins <= 0) {
            errors.add("max origins must be positive: " + maxOrigins);
        }
        ConfigurationException.throwIfAny("spreading hazard configuration", errors);
    }

    private static boolean unit(double v) {
        return v >= 0.0 && v <= 1.0;
    }

    @Override
    public String toString() {
        return String.format("SpreadingConfig{r0=%.2f, rate=%.3f, rMax=%.2f, i0=%.2f, growth=%.3f, heatRise=%.2f}",
                             initialRadius, spreadRate, maxRadius, initialIntensity, intensityGrowth, heatRise);
    }

    public static class Builder {
        private double initialRadius       = 2.0;
        private double spreadRate          = 0.1;
        private double maxRadius           = 5.0;
        private double initialIntensity    = 0.5;
        private double intensityGrowth     = 0.05;
        private double intensityCap        = 1.0;
        private double heatRise            = 0.15;
        private int    lowerLevels         = 3;
        private double placementMargin     = 0.25;
        private double ignitionThreshold   = 0.7;
        private double ignitionProbability = 0.3;
        private double ignitionRange       = 3.0;
        private double upwardProbability   = 0.4;
        private double secondaryIntensity  = 0.4;
        private double secondaryRadius     = 1.5;
        private double minOriginSeparation = 2.0;
        private int    maxOrigins          = 32;

        public Builder initialRadius(double radius) {
            this.initialRadius = radius;
            return this;
        }

        public Builder spreadRate(double rate) {
            this.spreadRate = rate;
            return this;
        }

        public Builder maxRadius(double radius) {
            this.maxRadius = radius;
            return this;
        }

        public Builder initialIntensity(double intensity) {
            this.initialIntensity = intensity;
            return this;
        }

        public Builder intensityGrowth(double growth) {
            this.intensityGrowth = growth;
            return this;
        }

        public Builder intensityCap(double cap) {
            this.intensityCap = cap;
            return this;
        }

        public Builder heatRise(double perLevel) {
            this.heatRise = perLevel;
            return this;
        }

        /**
         * Number of lowest levels eligible for default origin placement.
         */
        public Builder lowerLevels(int count) {
            this.lowerLevels = count;
            return this;
        }

        /**
         * Fraction of the grid excluded on each side when placing default origins.
         */
        public Builder placementMargin(double margin) {
            this.placementMargin = margin;
            return this;
        }

        public Builder ignitionThreshold(double threshold) {
            this.ignitionThreshold = threshold;
            return this;
        }

        public Builder ignitionProbability(double probability) {
            this.ignitionProbability = probability;
            return this;
        }

        public Builder ignitionRange(double range) {
            this.ignitionRange = range;
            return this;
        }

        public Builder upwardProbability(double probability) {
            this.upwardProbability = probability;
            return this;
        }

        public Builder secondaryIntensity(double intensity) {
            this.secondaryIntensity = intensity;
            return this;
        }

        public Builder secondaryRadius(double radius) {
            this.secondaryRadius = radius;
            return this;
        }

        public Builder minOriginSeparation(double separation) {
            this.minOriginSeparation = separation;
            return this;
        }

        public Builder maxOrigins(int max) {
            this.maxOrigins = max;
            return this;
        }

        /**
         * Disable secondary ignitions.
         */
        public Builder noIgnition() {
            this.ignitionProbability = 0.0;
            return this;
        }

        public SpreadingConfig build() {
            var config = new SpreadingConfig(this);
            config.validate();
            return config;
        }
    }
}
