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

import com.hellblazer.ember.common.DeterministicMath;
import com.hellblazer.ember.navigation.Node;
import com.hellblazer.ember.navigation.SpatialGraph;
import com.hellblazer.ember.navigation.planning.NodePenalty;

/**
 * Persistent cross-mission cost penalty.
 * <p>
 * {@code penalty(node) = scale * sum(decay^age)} over the recorded death positions on the node's level
 * within {@code radius} cells (Chebyshev), where age is the number of attempts since the death was
 * recorded. Precomputed once per mission from the summary it starts with.
 *
 * @author hal.hildebrand
 */
public final class DeathPenaltyMap implements NodePenalty {
    private final double[] penalties;
    private final int      contributing;

    private DeathPenaltyMap(double[] penalties, int contributing) {
        this.penalties = penalties;
        this.contributing = contributing;
    }

    public static DeathPenaltyMap build(SpatialGraph graph, KnowledgeSummary summary, double scale, double decay,
                                        int radius) {
        var penalties = new double[graph.idSpace()];
        var records = summary.dangerRecords();
        if (records.isEmpty() || scale == 0.0) {
            return new DeathPenaltyMap(penalties, 0);
        }
        for (var node : graph.nodes()) {
            var terms = new double[records.size()];
            boolean any = false;
            for (int i = 0; i < records.size(); i++) {
                var record = records.get(i);
                var death = record.position().toCell();
                if (death.level() == node.level() && death.planarChebyshevDistance(node.cell()) <= radius) {
                    int age = summary.attempts() - record.attempt();
                    terms[i] = DeterministicMath.pow(decay, age);
                    any = true;
                }
            }
            if (any) {
                penalties[node.id()] = scale * DeterministicMath.stableSum(terms);
            }
        }
        return new DeathPenaltyMap(penalties, records.size());
    }

    @Override
    public double penaltyAt(Node node) {
        return penalties[node.id()];
    }

    /**
     * Number of death records folded into the map.
     */
    public int contributing() {
        return contributing;
    }

    public double maxPenalty() {
        double max = 0.0;
        for (double p : penalties) {
            max = Math.max(max, p);
        }
        return max;
    }
}
