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

package com.hellblazer.ember.simulation.app;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.ember.common.ConfigurationException;
import com.hellblazer.ember.simulation.mission.HazardHint;
import com.hellblazer.ember.simulation.mission.HazardHintProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3f;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads hazard hints, as a detector would report them, from a JSON array:
 *
 * <pre>
 * [ { "x": 6.5, "y": 4.0, "level": 1, "confidence": 0.8 } ]
 * </pre>
 *
 * @author hal.hildebrand
 */
public class HintFileLoader {
    private static final Logger log = LoggerFactory.getLogger(HintFileLoader.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * @throws ConfigurationException if the file is unreadable or a hint is invalid
     */
    public HazardHintProvider load(Path file) {
        try {
            var hints = toHints(objectMapper.readValue(file.toFile(), new TypeReference<List<Entry>>() {
            }));
            log.info("Loaded {} hazard hints from {}", hints.size(), file);
            return HazardHintProvider.of(hints);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read hints " + file + ": " + e.getMessage(), e);
        }
    }

    public HazardHintProvider parse(String json) {
        try {
            return HazardHintProvider.of(toHints(objectMapper.readValue(json, new TypeReference<List<Entry>>() {
            })));
        } catch (IOException e) {
            throw new ConfigurationException("Malformed hints: " + e.getMessage(), e);
        }
    }

    private static List<HazardHint> toHints(List<Entry> entries) {
        var hints = new ArrayList<HazardHint>();
        for (var entry : entries) {
            try {
                hints.add(new HazardHint(new Point3f((float) entry.x(), (float) entry.y(), 0f), entry.level(),
                                         entry.confidence()));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid hint " + entry + ": " + e.getMessage(), e);
            }
        }
        return hints;
    }

    /**
     * One hint as written in the file.
     */
    public record Entry(double x, double y, int level, double confidence) {
    }
}
