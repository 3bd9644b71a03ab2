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

import java.util.ArrayList;
import java.util.List;

/**
 * Mission-scoped broadcast of hazard observations between agents.
 * <p>
 * Agents publish during their step; the coordinator flushes once per tick, before any agent acts,
 * and hands each observation to every agent except its source. Observations published in tick n are
 * therefore seen by everyone at the start of tick n + 1, independent of agent order.
 * <p>
 * Owned by a single mission and not thread-safe.
 *
 * @author hal.hildebrand
 */
public class KnowledgeChannel {
    private final List<HazardObservation> pending = new ArrayList<>();
    private       int                     published;

    public void publish(HazardObservation observation) {
        pending.add(observation);
        published++;
    }

    /**
     * Drain everything published since the last flush, in publication order.
     */
    public List<HazardObservation> flush() {
        var drained = List.copyOf(pending);
        pending.clear();
        return drained;
    }

    /**
     * Deliver pending observations to every agent but the source.
     */
    public void flushTo(List<RescueAgent> agents) {
        for (var observation : flush()) {
            for (var agent : agents) {
                if (agent.id() != observation.sourceAgent()) {
                    agent.receive(observation);
                }
            }
        }
    }

    public int pendingCount() {
        return pending.size();
    }

    public int publishedCount() {
        return published;
    }
}
