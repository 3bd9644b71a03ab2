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

package com.hellblazer.ember.simulation;

import com.hellblazer.ember.common.ConfigurationException;
import com.hellblazer.ember.navigation.hazard.HazardKind;

import java.util.ArrayList;

/**
 * What to run.
 *
 * @param scenario      hazard scenario
 * @param iterations    missions to run when not running until success
 * @param agents        agents per mission
 * @param untilSuccess  stop at the first successful mission
 * @param maxIterations mission limit when running until success
 * @param parallelism   missions run concurrently
 * @param seed          base seed; mission n uses seed + n
 * @author hal.hildebrand
 */
public record RunRequest(HazardKind scenario, int iterations, int agents, boolean untilSuccess, int maxIterations,
                         int parallelism, long seed) {

    public static final int  DEFAULT_AGENTS         = 3;
    public static final int  DEFAULT_MAX_ITERATIONS = 20;
    public static final long DEFAULT_SEED           = 42L;

    public RunRequest {
        var errors = new ArrayList<String>();
        if (scenario == null) {
            errors.add("scenario is required");
        }
        if (iterations <= 0) {
            errors.add("iterations must be positive: " + iterations);
        }
        if (agents <= 0) {
            errors.add("agents must be positive: " + agents);
        }
        if (untilSuccess && maxIterations <= 0) {
            errors.add("max iterations must be positive: " + maxIterations);
        }
        if (parallelism <= 0) {
            errors.add("parallelism must be positive: " + parallelism);
        }
        ConfigurationException.throwIfAny("run request", errors);
    }

    /**
     * A sequential run of a fixed number of missions with the default team.
     */
    public static RunRequest of(HazardKind scenario, int iterations) {
        return new RunRequest(scenario, iterations, DEFAULT_AGENTS, false, DEFAULT_MAX_ITERATIONS, 1, DEFAULT_SEED);
    }

    /**
     * Upper bound on the missions this request may run.
     */
    public int missionLimit() {
        return untilSuccess ? maxIterations : iterations;
    }
}
