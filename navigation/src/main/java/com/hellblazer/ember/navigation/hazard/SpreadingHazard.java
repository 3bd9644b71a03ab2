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

import com.hellblazer.ember.common.DeterministicMath;
import com.hellblazer.ember.navigation.SpatialGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3f;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Spreading hazard (fire).
 * <p>
 * Each origin grows linearly: its radius is {@code min(maxRadius, r0 + spreadRate * age)} and its
 * intensity {@code min(cap, i0 + growth * age)}. The intensity at a point is the maximum over origins
 * of {@code intensity * (1 - d / radius)}, multiplied by {@code 1 + heatRise * level} and clipped to
 * [0, 1], where d is the world distance to the origin.
 * <p>
 * Hot origins may ignite secondary origins nearby, sometimes one level up. Ignitions only ever add
 * origins, so the intensity at a fixed point never decreases over time. All randomness comes from
 * the {@link Random} handed in by the mission, so a seeded mission replays exactly.
 *
 * @author hal.hildebrand
 */
public class SpreadingHazard implements HazardField {
    private static final Logger log = LoggerFactory.getLogger(SpreadingHazard.class);

    private final SpreadingConfig config;
    private final int             levels;
    private final double          levelHeight;
    private final double          extent;
    private final Random          random;
    private final List<Origin>    origins = new ArrayList<>();
    private       double          elapsed;

    SpreadingHazard(SpreadingConfig config, SpatialGraph graph, List<Origin> initial, Random random) {
        this.config = config;
        this.levels = graph.levels();
        this.levelHeight = graph.config().getLevelHeight();
        this.extent = graph.resolution() * graph.config().getCellSize();
        this.random = random;
        this.origins.addAll(initial);
    }

    /**
     * Default placement: one origin on each of the lower levels (never the top level), at a uniformly
     * random position inside the placement margin.
     */
    public static SpreadingHazard withDefaultPlacement(SpreadingConfig config, SpatialGraph graph, Random random) {
        int top = Math.max(0, Math.min(graph.levels() - 2, config.getLowerLevels() - 1));
        double low = graph.resolution() * config.getPlacementMargin() * graph.config().getCellSize();
        double high = graph.resolution() * (1.0 - config.getPlacementMargin()) * graph.config().getCellSize();
        var initial = new ArrayList<Origin>();
        for (int level = 0; level <= top; level++) {
            double x = low + random.nextDouble() * (high - low);
            double y = low + random.nextDouble() * (high - low);
            initial.add(new Origin(new Point3f((float) x, (float) y, (float) (level * graph.config().getLevelHeight())),
                                   level, 0.0, config.getInitialIntensity(), config.getInitialRadius()));
        }
        var hazard = new SpreadingHazard(config, graph, initial, random);
        log.debug("Default fire placement: {}", initial);
        return hazard;
    }

    /**
     * A single origin at a hinted position.
     */
    public static SpreadingHazard fromHint(SpreadingConfig config, SpatialGraph graph, Point3f position, int level,
                                           Random random) {
        int clamped = Math.max(0, Math.min(graph.levels() - 1, level));
        var origin = new Origin(new Point3f(position.x, position.y, (float) (clamped * graph.config().getLevelHeight())),
                                clamped, 0.0, config.getInitialIntensity(), config.getInitialRadius());
        log.debug("Hinted fire origin: {}", origin);
        return new SpreadingHazard(config, graph, List.of(origin), random);
    }

    @Override
    public HazardKind kind() {
        return HazardKind.FIRE;
    }

    @Override
    public double elapsed() {
        return elapsed;
    }

    @Override
    public void advance(double dt) {
        if (dt < 0.0) {
            throw new IllegalArgumentException("Cannot advance by negative time: " + dt);
        }
        elapsed += dt;
        ignite();
    }

    @Override
    public double intensityAt(Point3f point, int level, double time) {
        double peak = 0.0;
        for (var origin : origins) {
            if (origin.ignitedAt() > time) {
                continue;
            }
            double age = time - origin.ignitedAt();
            double radius = radius(origin, age);
            double d = DeterministicMath.distance(origin.position(), point);
            if (d >= radius) {
                continue;
            }
            peak = Math.max(peak, intensity(origin, age) * (1.0 - d / radius));
        }
        return DeterministicMath.unit(peak * (1.0 + config.getHeatRise() * level));
    }

    @Override
    public HazardState state() {
        var centers = new ArrayList<HazardState.Center>();
        double radius = 0.0;
        double intensity = 0.0;
        for (var origin : origins) {
            if (origin.ignitedAt() > elapsed) {
                continue;
            }
            double age = elapsed - origin.ignitedAt();
            centers.add(new HazardState.Center(origin.position(), origin.level()));
            radius = Math.max(radius, radius(origin, age));
            intensity = Math.max(intensity, intensity(origin, age));
        }
        return new HazardState(HazardKind.FIRE, elapsed, centers, radius, intensity);
    }

    /**
     * All origins ignited so far, primary ones first.
     */
    public List<Origin> origins() {
        return Collections.unmodifiableList(origins);
    }

    private double radius(Origin origin, double age) {
        return Math.min(config.getMaxRadius(), origin.initialRadius() + config.getSpreadRate() * age);
    }

    private double intensity(Origin origin, double age) {
        return Math.min(config.getIntensityCap(), origin.initialIntensity() + config.getIntensityGrowth() * age);
    }

    private void ignite() {
        if (config.getIgnitionProbability() <= 0.0) {
            return;
        }
        int count = origins.size();
        for (int i = 0; i < count && origins.size() < config.getMaxOrigins(); i++) {
            var origin = origins.get(i);
            if (intensity(origin, elapsed - origin.ignitedAt()) <= config.getIgnitionThreshold()
            || random.nextDouble() >= config.getIgnitionProbability()) {
                continue;
            }
            double range = config.getIgnitionRange();
            double x = origin.position().x + (random.nextDouble() * 2.0 - 1.0) * range;
            double y = origin.position().y + (random.nextDouble() * 2.0 - 1.0) * range;
            int level = origin.level();
            if (random.nextDouble() < config.getUpwardProbability() && level < levels - 1) {
                level++;
            }
            if (x < 0.0 || y < 0.0 || x >= extent || y >= extent) {
                continue;
            }
            var position = new Point3f((float) x, (float) y, (float) (level * levelHeight));
            if (tooClose(position)) {
                continue;
            }
            var secondary = new Origin(position, level, elapsed, config.getSecondaryIntensity(),
                                       config.getSecondaryRadius());
            origins.add(secondary);
            log.debug("Fire spread at t={}: {}", elapsed, secondary);
        }
    }

    private boolean tooClose(Point3f position) {
        for (var origin : origins) {
            if (DeterministicMath.distance(origin.position(), position) < config.getMinOriginSeparation()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return String.format("SpreadingHazard{t=%.2f, origins=%d}", elapsed, origins.size());
    }

    /**
     * One ignition point.
     *
     * @param position         world position
     * @param level            level index
     * @param ignitedAt        simulated time of ignition
     * @param initialIntensity intensity at ignition
     * @param initialRadius    radius at ignition
     */
    public record Origin(Point3f position, int level, double ignitedAt, double initialIntensity,
                         double initialRadius) {
        public Origin {
            position = new Point3f(position);
        }

        @Override
        public Point3f position() {
            return new Point3f(position);
        }
    }
}
