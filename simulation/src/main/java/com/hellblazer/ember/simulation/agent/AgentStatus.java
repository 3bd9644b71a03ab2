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

/**
 * Agent state machine.
 * <pre>
 * PLANNING -> MOVING -> (REPLANNING <-> MOVING) -> {REACHED_TARGET, DEAD, STALLED}
 * </pre>
 *
 * @author hal.hildebrand
 */
public enum AgentStatus {
    PLANNING, MOVING, REPLANNING, REACHED_TARGET, DEAD, STALLED;

    public boolean isTerminal() {
        return this == REACHED_TARGET || this == DEAD || this == STALLED;
    }
}
