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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process view of the knowledge store.
 * <p>
 * Summaries are loaded from the store once per scenario and then extended in memory as outcomes are
 * recorded. Recording is serialized so concurrent missions each see a consistent summary, and every
 * outcome is counted exactly once. A store that refuses a write does not lose the outcome for the
 * rest of the run: the in-memory summary is still updated and the failure is reported to the caller.
 *
 * @author hal.hildebrand
 */
public class KnowledgeLedger {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeLedger.class);

    private final KnowledgeStore                     store;
    private final Map<HazardKind, KnowledgeSummary> summaries = new EnumMap<>(HazardKind.class);
    private final Map<HazardKind, Integer>          reserved  = new EnumMap<>(HazardKind.class);
    private final ReentrantLock                      lock      = new ReentrantLock();

    public KnowledgeLedger(KnowledgeStore store) {
        this.store = store;
    }

    /**
     * Current summary of a scenario, loading it from the store on first use.
     */
    public KnowledgeSummary summary(HazardKind kind) {
        lock.lock();
        try {
            return summaries.computeIfAbsent(kind, this::load);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reserve the next attempt number of a scenario and return the summary that attempt starts from.
     * Attempts reserved while others are still running start from the same summary but never share a
     * number.
     */
    public Reservation reserve(HazardKind kind) {
        lock.lock();
        try {
            var summary = summaries.computeIfAbsent(kind, this::load);
            int attempt = Math.max(reserved.getOrDefault(kind, 0), summary.attempts()) + 1;
            reserved.put(kind, attempt);
            return new Reservation(summary, attempt);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Append the outcome to the store and fold it into the summary.
     */
    public Recorded record(MissionOutcome outcome) {
        lock.lock();
        try {
            var kind = outcome.hazardKind();
            var updated = summaries.computeIfAbsent(kind, this::load).withOutcome(outcome);
            summaries.put(kind, updated);
            try {
                store.appendOutcome(outcome);
                return new Recorded(updated, true, null);
            } catch (PersistenceUnavailableException e) {
                log.warn("Outcome {} kept in memory only: {}", outcome.missionId(), e.getMessage());
                return new Recorded(updated, false, e.getMessage());
            }
        } finally {
            lock.unlock();
        }
    }

    public KnowledgeStore store() {
        return store;
    }

    private KnowledgeSummary load(HazardKind kind) {
        var summary = store.loadSummary(kind);
        log.info("Loaded {}", summary);
        return summary;
    }

    /**
     * @param summary summary the attempt starts from
     * @param attempt 1-based attempt number
     */
    public record Reservation(KnowledgeSummary summary, int attempt) {
    }

    /**
     * @param summary   summary including the recorded outcome
     * @param persisted whether the store accepted the outcome
     * @param warning   store failure message when not persisted
     */
    public record Recorded(KnowledgeSummary summary, boolean persisted, String warning) {

        public Optional<String> warningMessage() {
            return Optional.ofNullable(warning);
        }
    }
}
