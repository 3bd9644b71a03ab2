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

package com.hellblazer.ember.simulation.knowledge;

import java.util.List;

/**
 * A route that reached the target.
 *
 * @param attempt          1-based attempt number of the mission within its scenario
 * @param missionId        mission identifier
 * @param elapsedTime      simulated seconds until success
 * @param cumulativeDanger danger collected by the agent on the way
 * @param path             visited cells, start first
 */
public record SuccessfulPath(int attempt, String missionId, double elapsedTime, double cumulativeDanger,
                             List<GridCell> path) {

    public SuccessfulPath {
        path = List.copyOf(path);
    }
}
