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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Aggregate of every recorded attempt of one scenario.
 * <p>
 * Immutable: {@link #withOutcome(MissionOutcome)} returns a new summary and never touches this one.
 * After N outcomes the success rate is exactly successes / N.
 * <p>
 * Retention follows the statistics the planner actually consumes: the most recent
 * {@value #MAX_DANGER_RECORDS} death positions and the {@value #MAX_SUCCESSFUL_PATHS} fastest
 * successful routes. Counters and timing statistics cover every attempt.
 *
 * @author hal.hildebrand
 */
public final class KnowledgeSummary {
    public static final int MAX_DANGER_RECORDS   = 50;
    public static final int MAX_SUCCESSFUL_PATHS = 10;

    private static final Comparator<SuccessfulPath> FASTEST = Comparator.comparingDouble(SuccessfulPath::elapsedTime)
                                                                        .thenComparingDouble(
                                                                        SuccessfulPath::cumulativeDanger)
                                                                        .thenComparingInt(SuccessfulPath::attempt);

    private final HazardKind           kind;
    private final int                  attempts;
    private final int                  successes;
    private final List<DangerRecord>   dangerRecords;
    private final List<SuccessfulPath> successfulPaths;
    private final Map<String, Integer> failureReasons;
    private final double               totalSuccessTime;
    private final double               minSuccessTime;
    private final double               maxSuccessTime;

    private KnowledgeSummary(HazardKind kind, int attempts, int successes, List<DangerRecord> dangerRecords,
                             List<SuccessfulPath> successfulPaths, Map<String, Integer> failureReasons,
                             double totalSuccessTime, double minSuccessTime, double maxSuccessTime) {
        this.kind = kind;
        this.attempts = attempts;
        this.successes = successes;
        this.dangerRecords = Collections.unmodifiableList(dangerRecords);
        this.successfulPaths = Collections.unmodifiableList(successfulPaths);
        this.failureReasons = Collections.unmodifiableMap(failureReasons);
        this.totalSuccessTime = totalSuccessTime;
        this.minSuccessTime = minSuccessTime;
        this.maxSuccessTime = maxSuccessTime;
    }

    /**
     * The neutral summary: no attempts, no knowledge.
     */
    public static KnowledgeSummary empty(HazardKind kind) {
        return new KnowledgeSummary(kind, 0, 0, List.of(), List.of(), new TreeMap<>(), 0.0, 0.0, 0.0);
    }

    /**
     * Fold outcomes, in order, into an empty summary. Outcomes of other scenarios are skipped.
     */
    public static KnowledgeSummary fold(HazardKind kind, Iterable<MissionOutcome> outcomes) {
        var summary = empty(kind);
        for (var outcome : outcomes) {
            if (outcome.hazardKind() == kind) {
                summary = summary.withOutcome(outcome);
            }
        }
        return summary;
    }

    /**
     * Extend the summary with one more attempt.
     *
     * @throws IllegalArgumentException if the outcome belongs to another scenario
     */
    public KnowledgeSummary withOutcome(MissionOutcome outcome) {
        if (outcome.hazardKind() != kind) {
            throw new IllegalArgumentException(
            "Outcome " + outcome.missionId() + " is " + outcome.hazardKind() + ", summary is " + kind);
        }
        int attempt = attempts + 1;

        var dangers = new ArrayList<>(dangerRecords);
        for (var agent : outcome.agents()) {
            if (agent.deathPosition() != null) {
                dangers.add(new DangerRecord(attempt, outcome.missionId(), agent.deathPosition(), agent.cause()));
            }
        }
        if (dangers.size() > MAX_DANGER_RECORDS) {
            dangers = new ArrayList<>(dangers.subList(dangers.size() - MAX_DANGER_RECORDS, dangers.size()));
        }

        var paths = new ArrayList<>(successfulPaths);
        var reasons = new TreeMap<>(failureReasons);
        double total = totalSuccessTime;
        double min = minSuccessTime;
        double max = maxSuccessTime;
        int wins = successes;
        if (outcome.success()) {
            wins++;
            double t = outcome.elapsedTime();
            total += t;
            min = successes == 0 ? t : Math.min(min, t);
            max = successes == 0 ? t : Math.max(max, t);
            outcome.bestTrajectory().ifPresent(best -> {
                var cells = best.trajectory();
                paths.add(new SuccessfulPath(attempt, outcome.missionId(), t, best.cumulativeDanger(), cells));
            });
            paths.sort(FASTEST);
            while (paths.size() > MAX_SUCCESSFUL_PATHS) {
                paths.remove(paths.size() - 1);
            }
        } else {
            var reason = outcome.failureReason() == null ? MissionOutcome.ALL_AGENTS_FAILED : outcome.failureReason();
            reasons.merge(reason, 1, Integer::sum);
        }
        return new KnowledgeSummary(kind, attempt, wins, dangers, paths, reasons, total, min, max);
    }

    public HazardKind kind() {
        return kind;
    }

    public int attempts() {
        return attempts;
    }

    public int successes() {
        return successes;
    }

    public int failures() {
        return attempts - successes;
    }

    /**
     * successes / attempts, 0 when nothing has been attempted.
     */
    public double successRate() {
        return attempts == 0 ? 0.0 : (double) successes / attempts;
    }

    public boolean isEmpty() {
        return attempts == 0;
    }

    /**
     * Most recent death positions, oldest first.
     */
    public List<DangerRecord> dangerRecords() {
        return dangerRecords;
    }

    /**
     * Fastest successful routes, fastest first.
     */
    public List<SuccessfulPath> successfulPaths() {
        return successfulPaths;
    }

    public Optional<SuccessfulPath> bestPath() {
        return successfulPaths.isEmpty() ? Optional.empty() : Optional.of(successfulPaths.get(0));
    }

    public Map<String, Integer> failureReasons() {
        return failureReasons;
    }

    public Optional<Double> averageSuccessTime() {
        return successes == 0 ? Optional.empty() : Optional.of(totalSuccessTime / successes);
    }

    public Optional<Double> minSuccessTime() {
        return successes == 0 ? Optional.empty() : Optional.of(minSuccessTime);
    }

    public Optional<Double> maxSuccessTime() {
        return successes == 0 ? Optional.empty() : Optional.of(maxSuccessTime);
    }

    @Override
    public String toString() {
        return String.format("KnowledgeSummary{%s, attempts=%d, successes=%d, rate=%.3f, dangers=%d, paths=%d}", kind,
                             attempts, successes, successRate(), dangerRecords.size(), successfulPaths.size());
    }
}
