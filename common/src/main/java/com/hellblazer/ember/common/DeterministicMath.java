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

package com.hellblazer.ember.common;

import javax.vecmath.Point3f;

/**
 * Deterministic math for the mission simulation.
 * <p>
 * Two runs of one mission must produce byte-identical outcomes, so every distance, falloff and
 * accumulation in the hazard and planning code goes through here:
 * - StrictMath (IEEE 754 compliance) instead of Math
 * - Binary reduction tree for stable floating-point accumulation
 * <p>
 * Usage:
 * <pre>
 * double d = DeterministicMath.distance(patrolPosition, point);
 * double falloff = DeterministicMath.clamp(1.0 - d / radius, 0.0, 1.0);
 * double total = DeterministicMath.stableSum(penalties);
 * </pre>
 *
 * @author hal.hildebrand
 */
public final class DeterministicMath {

    private DeterministicMath() {
    }

    /**
     * Deterministic power function.
     *
     * @param base     Base value
     * @param exponent Exponent
     * @return base^exponent
     */
    public static double pow(double base, double exponent) {
        return StrictMath.pow(base, exponent);
    }

    /**
     * Clamp value between min and max.
     *
     * @param value Value to clamp
     * @param min   Minimum value
     * @param max   Maximum value
     * @return Clamped value
     */
    public static double clamp(double value, double min, double max) {
        return StrictMath.max(min, StrictMath.min(max, value));
    }

    /**
     * Clamp to the unit interval.
     *
     * @param value Value to clamp
     * @return value in [0, 1]
     */
    public static double unit(double value) {
        return clamp(value, 0.0, 1.0);
    }

    /**
     * Euclidean distance between two world positions, computed in double precision.
     *
     * @param a first point
     * @param b second point
     * @return distance
     */
    public static double distance(Point3f a, Point3f b) {
        double dx = (double) a.x - b.x;
        double dy = (double) a.y - b.y;
        double dz = (double) a.z - b.z;
        return StrictMath.sqrt(dx * dx + dy * dy + dz * dz);
    }

    /**
     * Euclidean length of a planar offset.
     *
     * @param dx x offset
     * @param dy y offset
     * @return sqrt(dx² + dy²)
     */
    public static double hypot(double dx, double dy) {
        return StrictMath.sqrt(dx * dx + dy * dy);
    }

    /**
     * Interpolate between two world positions.
     *
     * @param a start
     * @param b end
     * @param t parameter in [0, 1]
     * @return new point on the segment
     */
    public static Point3f interpolate(Point3f a, Point3f b, double t) {
        return new Point3f((float) lerp(a.x, b.x, t), (float) lerp(a.y, b.y, t), (float) lerp(a.z, b.z, t));
    }

    private static double lerp(double a, double b, double t) {
        return a + (b - a) * t;
    }

    /**
     * Stable summation using binary reduction tree.
     * <p>
     * Yields identical results for identical input regardless of array size.
     *
     * @param values Array of values to sum
     * @return Sum of all values
     */
    public static double stableSum(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        return stableSumRecursive(values, 0, values.length);
    }

    private static double stableSumRecursive(double[] values, int start, int end) {
        int length = end - start;

        if (length == 0) {
            return 0.0;
        } else if (length == 1) {
            return values[start];
        } else {
            int mid = start + length / 2;
            return stableSumRecursive(values, start, mid) + stableSumRecursive(values, mid, end);
        }
    }
}
