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
import com.hellblazer.ember.common.DeterministicMath;
import com.hellblazer.ember.navigation.SpatialGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3f;
import java.util.ArrayList;
import java.util.List;

/**
 * Patrolling hazard (attacker).
 * <p>
 * The patrol walks a closed route at constant speed, wrapping at the end. Its position is a pure
 * function of time: {@code s = (phase + speed * t) mod routeLength}, so the field carries no state
 * beyond the elapsed time. Intensity is the configured patrol intensity within the danger radius of
 * the current position and zero elsewhere.
 *
 * @author hal.hildebrand
 */
public class PatrollingHazard implements HazardField {
    private static final Logger log = LoggerFactory.getLogger(PatrollingHazard.class);

    private final PatrolConfig  config;
    private final List<Point3f> route;
    private final int[]         routeLevels;
    private final double[]      cumulative;
    private final double        length;
    private final double        phase;
    private       double        elapsed;

    private PatrollingHazard(PatrolConfig config, List<Point3f> route, int[] routeLevels, double phase) {
        this.config = config;
        this.route = route;
        this.routeLevels = routeLevels;
        this.cumulative = new double[route.size() + 1];
        for (int i = 0; i < route.size(); i++) {
            var next = route.get((i + 1) % route.size());
            cumulative[i + 1] = cumulative[i] + DeterministicMath.distance(route.get(i), next);
        }
        this.length = cumulative[route.size()];
        this.phase = length > 0.0 ? phase % length : 0.0;
    }

    /**
     * Patrol starting at the first waypoint of its route.
     *
     * @throws ConfigurationException if the patrol levels do not exist in the graph
     */
    public static PatrollingHazard create(PatrolConfig config, SpatialGraph graph) {
        return create(config, graph, 0.0);
    }

    private static PatrollingHazard create(PatrolConfig config, SpatialGraph graph, double phase) {
        if (config.getUpperLevel() >= graph.levels()) {
            throw new ConfigurationException(
            String.format("Invalid patrol configuration: level %d outside %d-level graph", config.getUpperLevel(),
                          graph.levels()));
        }
        var waypoints = config.getWaypoints().isEmpty() ? defaultRoute(config, graph) : config.getWaypoints();
        var route = new ArrayList<Point3f>(waypoints.size());
        var levels = new int[waypoints.size()];
        double height = graph.config().getLevelHeight();
        for (int i = 0; i < waypoints.size(); i++) {
            var w = waypoints.get(i);
            route.add(new Point3f((float) w.x(), (float) w.y(), (float) (w.level() * height)));
            levels[i] = w.level();
        }
        var hazard = new PatrollingHazard(config, List.copyOf(route), levels, phase);
        log.debug("Patrol route of {} waypoints, length {}", route.size(), hazard.length);
        return hazard;
    }

    /**
     * Patrol whose starting point is the route waypoint closest to a hinted position.
     */
    public static PatrollingHazard fromHint(PatrolConfig config, SpatialGraph graph, Point3f position, int level) {
        var base = create(config, graph, 0.0);
        var hint = new Point3f(position.x, position.y, (float) (level * graph.config().getLevelHeight()));
        int nearest = 0;
        double best = Double.MAX_VALUE;
        for (int i = 0; i < base.route.size(); i++) {
            double d = DeterministicMath.distance(base.route.get(i), hint);
            if (d < best) {
                best = d;
                nearest = i;
            }
        }
        return create(config, graph, base.cumulative[nearest]);
    }

    /**
     * Square at a quarter and three quarters of the grid on each patrol level, crossing between levels
     * through the stairway centre.
     */
    static List<PatrolConfig.Waypoint> defaultRoute(PatrolConfig config, SpatialGraph graph) {
        var g = graph.config();
        double extent = graph.resolution() * g.getCellSize();
        double near = extent * 0.25;
        double far = extent * 0.75;
        double stairX = (g.getStairMinX() + g.getStairMaxX() + 1) / 2.0 * g.getCellSize();
        double stairY = (g.getStairMinY() + g.getStairMaxY() + 1) / 2.0 * g.getCellSize();
        int lower = config.getLowerLevel();
        int upper = config.getUpperLevel();
        var route = new ArrayList<PatrolConfig.Waypoint>();
        square(route, near, far, lower);
        route.add(new PatrolConfig.Waypoint(stairX, stairY, upper));
        square(route, near, far, upper);
        route.add(new PatrolConfig.Waypoint(stairX, stairY, lower));
        return route;
    }

    private static void square(List<PatrolConfig.Waypoint> route, double near, double far, int level) {
        route.add(new PatrolConfig.Waypoint(near, near, level));
        route.add(new PatrolConfig.Waypoint(far, near, level));
        route.add(new PatrolConfig.Waypoint(far, far, level));
        route.add(new PatrolConfig.Waypoint(near, far, level));
    }

    @Override
    public HazardKind kind() {
        return HazardKind.ATTACKER;
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
    }

    /**
     * Patrol position at a given time.
     */
    public Point3f positionAt(double time) {
        if (length <= 0.0) {
            return new Point3f(route.get(0));
        }
        double s = (phase + config.getSpeed() * time) % length;
        int segment = segmentOf(s);
        var from = route.get(segment);
        var to = route.get((segment + 1) % route.size());
        double span = cumulative[segment + 1] - cumulative[segment];
        double t = span > 0.0 ? (s - cumulative[segment]) / span : 0.0;
        return DeterministicMath.interpolate(from, to, t);
    }

    /**
     * Level the patrol is on at a given time: the level of the waypoint it last passed.
     */
    public int levelAt(double time) {
        if (length <= 0.0) {
            return routeLevels[0];
        }
        return routeLevels[segmentOf((phase + config.getSpeed() * time) % length)];
    }

    public List<Point3f> route() {
        return route;
    }

    public double routeLength() {
        return length;
    }

    @Override
    public double intensityAt(Point3f point, int level, double time) {
        double d = DeterministicMath.distance(positionAt(time), point);
        return d <= config.getDangerRadius() ? config.getIntensity() : 0.0;
    }

    @Override
    public HazardState state() {
        var center = new HazardState.Center(positionAt(elapsed), levelAt(elapsed));
        return new HazardState(HazardKind.ATTACKER, elapsed, List.of(center), config.getDangerRadius(),
                               config.getIntensity());
    }

    private int segmentOf(double s) {
        int lo = 0;
        int hi = route.size() - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (cumulative[mid] <= s) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo;
    }

    @Override
    public String toString() {
        return String.format("PatrollingHazard{t=%.2f, at=%s}", elapsed, positionAt(elapsed));
    }
}
