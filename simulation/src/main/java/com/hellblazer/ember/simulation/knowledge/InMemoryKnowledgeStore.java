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

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local store. Outcomes live as long as the instance.
 *
 * @author hal.hildebrand
 */
public class InMemoryKnowledgeStore implements KnowledgeStore {
    private final List<MissionOutcome> outcomes = new CopyOnWriteArrayList<>();

    @Override
    public KnowledgeSummary loadSummary(HazardKind kind) {
        return KnowledgeSummary.fold(kind, outcomes);
    }

    @Override
    public void appendOutcome(MissionOutcome outcome) {
        outcomes.add(outcome);
    }

    public List<MissionOutcome> outcomes() {
        return List.copyOf(outcomes);
    }
}
