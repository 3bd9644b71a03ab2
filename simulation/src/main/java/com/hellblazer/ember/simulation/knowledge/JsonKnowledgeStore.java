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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.ember.navigation.hazard.HazardKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcomes kept as JSON Lines, one {@link MissionOutcome} per line, appended in attempt order.
 * <p>
 * Reads are lenient: a missing file is an empty history and malformed lines are skipped with a
 * warning. Writes are strict: any I/O failure surfaces as {@link PersistenceUnavailableException}.
 *
 * @author hal.hildebrand
 */
public class JsonKnowledgeStore implements KnowledgeStore {
    private static final Logger log = LoggerFactory.getLogger(JsonKnowledgeStore.class);

    private final Path         file;
    private final ObjectMapper objectMapper;

    public JsonKnowledgeStore(Path file) {
        this.file = file;
        this.objectMapper = mapper();
    }

    /**
     * Mapper used for outcome lines. Field order follows record component order, so equal outcomes
     * serialize to equal bytes.
     */
    public static ObjectMapper mapper() {
        return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public Path file() {
        return file;
    }

    @Override
    public KnowledgeSummary loadSummary(HazardKind kind) {
        return KnowledgeSummary.fold(kind, loadOutcomes());
    }

    /**
     * Every readable outcome in file order.
     */
    public List<MissionOutcome> loadOutcomes() {
        var outcomes = new ArrayList<MissionOutcome>();
        if (!Files.exists(file)) {
            log.debug("No knowledge file at {}", file);
            return outcomes;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Cannot read knowledge file {}, starting without prior knowledge: {}", file, e.getMessage());
            return outcomes;
        }
        int lineNumber = 0;
        for (var line : lines) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                outcomes.add(objectMapper.readValue(line, MissionOutcome.class));
            } catch (JsonProcessingException | RuntimeException e) {
                log.warn("Skipping malformed outcome at {}:{}: {}", file, lineNumber, e.getMessage());
            }
        }
        log.debug("Loaded {} outcomes from {}", outcomes.size(), file);
        return outcomes;
    }

    @Override
    public void appendOutcome(MissionOutcome outcome) throws PersistenceUnavailableException {
        String line;
        try {
            line = objectMapper.writeValueAsString(outcome);
        } catch (JsonProcessingException e) {
            throw new PersistenceUnavailableException("Cannot serialize " + outcome.missionId(), e);
        }
        try {
            var parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, line + System.lineSeparator(), StandardCharsets.UTF_8, StandardOpenOption.CREATE,
                              StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new PersistenceUnavailableException("Cannot append " + outcome.missionId() + " to " + file, e);
        }
    }

    @Override
    public String toString() {
        return "JsonKnowledgeStore{" + file + "}";
    }
}
