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

import com.hellblazer.ember.navigation.hazard.HazardKind;

/**
 * Durable home of mission outcomes.
 *
 * @author hal.hildebrand
 */
public interface KnowledgeStore {

    /**
     * Summary of every stored outcome of a scenario. Never fails: an unreadable store yields the
     * empty summary.
     */
    KnowledgeSummary loadSummary(HazardKind kind);

    /**
     * Durably record one outcome.
     *
     * @throws PersistenceUnavailableException if the outcome could not be written
     */
    void appendOutcome(MissionOutcome outcome) throws PersistenceUnavailableException;
}
