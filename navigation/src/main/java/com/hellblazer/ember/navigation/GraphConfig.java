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

package com.hellblazer.ember.navigation;

import com.hellblazer.ember.common.ConfigurationException;
import com.hellblazer.ember.geometry.Point3i;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Build parameters of the navigation graph.
 * <p>
 * Defaults describe the four-level, 20×20 building: a 4×4 stairway in the centre of every level,
 * the start cell near the ground-floor corner and the target on the top level.
 *
 * @author hal.hildebrand
 */
public class GraphConfig {
    private final int        levels;
    private final int        gridResolution;
    private final int        stairMinX;
    private final int        stairMinY;
    private final int        stairMaxX;
    private final int        stairMaxY;
    private final double     cellSize;
    private final double     levelHeight;
    private final double     verticalCostFactor;
    private final Point3i    start;
    private final Point3i    target;
    private final Set<Point3i> walls;

    private GraphConfig(Builder builder) {
        this.levels = builder.levels;
        this.gridResolution = builder.gridResolution;
        int centre = builder.gridResolution / 2;
        this.stairMinX = builder.stairMinX != null ? builder.stairMinX : centre - 2;
        this.stairMinY = builder.stairMinY != null ? builder.stairMinY : centre - 2;
        this.stairMaxX = builder.stairMaxX != null ? builder.stairMaxX : centre + 1;
        this.stairMaxY = builder.stairMaxY != null ? builder.stairMaxY : centre + 1;
        this.cellSize = builder.cellSize;
        this.levelHeight = builder.levelHeight;
        this.verticalCostFactor = builder.verticalCostFactor;
        int near = builder.gridResolution / 10;
        int far = builder.gridResolution * 3 / 4;
        this.start = builder.start != null ? builder.start : new Point3i(near, near, 0);
        this.target = builder.target != null ? builder.target : new Point3i(far, far, builder.levels - 1);
        this.walls = Collections.unmodifiableSet(new TreeSet<>(builder.walls));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The default building.
     */
    public static GraphConfig defaults() {
        return builder().build();
    }

    public int getLevels() {
        return levels;
    }

    public int getGridResolution() {
        return gridResolution;
    }

    public int getStairMinX() {
        return stairMinX;
    }

    public int getStairMinY() {
        return stairMinY;
    }

    public int getStairMaxX() {
        return stairMaxX;
    }

    public int getStairMaxY() {
        return stairMaxY;
    }

    public double getCellSize() {
        return cellSize;
    }

    public double getLevelHeight() {
        return levelHeight;
    }

    public double getVerticalCostFactor() {
        return verticalCostFactor;
    }

    /**
     * Cost of one vertical (stair) edge.
     */
    public double verticalEdgeCost() {
        return levelHeight * verticalCostFactor;
    }

    public Point3i getStart() {
        return start;
    }

    public Point3i getTarget() {
        return target;
    }

    public Set<Point3i> getWalls() {
        return walls;
    }

    public boolean isStairCell(int x, int y) {
        return x >= stairMinX && x <= stairMaxX && y >= stairMinY && y <= stairMaxY;
    }

    public boolean inBounds(Point3i cell) {
        return cell.x >= 0 && cell.x < gridResolution && cell.y >= 0 && cell.y < gridResolution && cell.z >= 0
        && cell.z < levels;
    }

    private void validate() {
        var errors = new ArrayList<String>();
        if (levels <= 0) {
            errors.add("levels must be positive: " + levels);
        }
        if (gridResolution <= 0) {
            errors.add("grid resolution must be positive: " + gridResolution);
        }
        if (cellSize <= 0.0) {
            errors.add("cell size must be positive: " + cellSize);
        }
        if (levelHeight <= 0.0) {
            errors.add("level height must be positive: " + levelHeight);
        }
        if (verticalCostFactor < 0.0) {
            errors.add("vertical cost factor must be >= 0: " + verticalCostFactor);
        }
        if (!errors.isEmpty()) {
            ConfigurationException.throwIfAny("graph configuration", errors);
        }
        if (stairMinX > stairMaxX || stairMinY > stairMaxY) {
            errors.add(String.format("stairway region is empty: [%d..%d] x [%d..%d]", stairMinX, stairMaxX, stairMinY,
                                     stairMaxY));
        }
        if (stairMinX < 0 || stairMinY < 0 || stairMaxX >= gridResolution || stairMaxY >= gridResolution) {
            errors.add(String.format("stairway region [%d..%d] x [%d..%d] outside %dx%d grid", stairMinX, stairMaxX,
                                     stairMinY, stairMaxY, gridResolution, gridResolution));
        }
        if (!inBounds(start)) {
            errors.add("start cell outside grid: " + start);
        } else if (walls.contains(start)) {
            errors.add("start cell is a wall: " + start);
        }
        if (!inBounds(target)) {
            errors.add("target cell outside grid: " + target);
        } else if (walls.contains(target)) {
            errors.add("target cell is a wall: " + target);
        }
        ConfigurationException.throwIfAny("graph configuration", errors);
    }

    @Override
    public String toString() {
        return String.format("GraphConfig{levels=%d, grid=%d, stairs=[%d..%d]x[%d..%d], start=%s, target=%s, walls=%d}",
                             levels, gridResolution, stairMinX, stairMaxX, stairMinY, stairMaxY, start, target,
                             walls.size());
    }

    public static class Builder {
        private int           levels             = 4;
        private int           gridResolution     = 20;
        private Integer       stairMinX;
        private Integer       stairMinY;
        private Integer       stairMaxX;
        private Integer       stairMaxY;
        private double        cellSize           = 1.0;
        private double        levelHeight        = 3.0;
        private double        verticalCostFactor = 2.0; // stairs are slower than corridors
        private Point3i       start;
        private Point3i       target;
        private final Set<Point3i> walls = new TreeSet<>();

        public Builder levels(int levels) {
            this.levels = levels;
            return this;
        }

        public Builder gridResolution(int resolution) {
            this.gridResolution = resolution;
            return this;
        }

        /**
         * Inclusive cell rectangle of the stairway, identical on every level.
         */
        public Builder stairway(int minX, int minY, int maxX, int maxY) {
            this.stairMinX = minX;
            this.stairMinY = minY;
            this.stairMaxX = maxX;
            this.stairMaxY = maxY;
            return this;
        }

        public Builder cellSize(double cellSize) {
            this.cellSize = cellSize;
            return this;
        }

        public Builder levelHeight(double levelHeight) {
            this.levelHeight = levelHeight;
            return this;
        }

        public Builder verticalCostFactor(double factor) {
            this.verticalCostFactor = factor;
            return this;
        }

        public Builder start(int x, int y, int level) {
            this.start = new Point3i(x, y, level);
            return this;
        }

        public Builder target(int x, int y, int level) {
            this.target = new Point3i(x, y, level);
            return this;
        }

        public Builder wall(int x, int y, int level) {
            this.walls.add(new Point3i(x, y, level));
            return this;
        }

        public Builder walls(Set<Point3i> cells) {
            this.walls.addAll(cells);
            return this;
        }

        /**
         * @throws ConfigurationException on non-positive dimensions, a stairway outside the grid, or an
         *                                invalid start or target cell
         */
        public GraphConfig build() {
            var config = new GraphConfig(this);
            config.validate();
            return config;
        }
    }
}
