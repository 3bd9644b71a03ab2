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

package com.hellblazer.ember.simulation.mission;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Source of candidate hazard origins, such as a video-frame detector.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface HazardHintProvider {

    static HazardHintProvider none() {
        return List::of;
    }

    static HazardHintProvider of(List<HazardHint> hints) {
        var copy = List.copyOf(hints);
        return () -> copy;
    }

    List<HazardHint> hints();

    /**
     * The most confident hint, provided it reaches the threshold. Ties keep the first reported.
     */
    default Optional<HazardHint> best(double threshold) {
        return hints().stream()
                      .max(Comparator.comparingDouble(HazardHint::confidence))
                      .filter(hint -> hint.confidence() >= threshold);
    }
}
