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

package com.hellblazer.ember.simulation;

import com.hellblazer.ember.navigation.SpatialGraph;
import com.hellblazer.ember.simulation.knowledge.KnowledgeLedger;
import com.hellblazer.ember.simulation.knowledge.KnowledgeStore;
import com.hellblazer.ember.simulation.knowledge.MissionOutcome;
import com.hellblazer.ember.simulation.mission.HazardHintProvider;
import com.hellblazer.ember.simulation.mission.MissionCoordinator;
import com.hellblazer.ember.simulation.mission.RunContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs a series of missions against shared knowledge.
 * <p>
 * The graph is built once per controller. Each mission starts from the knowledge recorded by every
 * mission that finished before it; with {@code parallelism > 1} missions run in waves, and the
 * missions of one wave share the summary the wave started from. Listener calls are serialized.
 * <p>
 * {@link #cancel()} is cooperative: running missions stop at their next tick and are recorded as
 * aborted, and no further missions start.
 *
 * @author hal.hildebrand
 */
public class RunController {
    private static final Logger log = LoggerFactory.getLogger(RunController.class);

    private final SimulationConfig          config;
    private final SpatialGraph              graph;
    private final KnowledgeLedger           ledger;
    private final HazardHintProvider        hints;
    private final Consumer<SimulationEvent> listener;
    private final AtomicBoolean             cancelled = new AtomicBoolean();

    public RunController(SimulationConfig config, KnowledgeStore store, HazardHintProvider hints,
                         Consumer<SimulationEvent> listener) {
        this.config = config;
        this.graph = SpatialGraph.build(config.getGraph());
        this.ledger = new KnowledgeLedger(store);
        this.hints = hints == null ? HazardHintProvider.none() : hints;
        var target = listener == null ? (Consumer<SimulationEvent>) event -> {
        } : listener;
        this.listener = event -> {
            synchronized (target) {
                target.accept(event);
            }
        };
    }

    public RunController(SimulationConfig config, KnowledgeStore store) {
        this(config, store, HazardHintProvider.none(), null);
    }

    public RunReport run(RunRequest request) {
        cancelled.set(false);
        var missionConfig = config.getMission().toBuilder().agents(request.agents()).build();
        var coordinator = new MissionCoordinator(config.toBuilder().mission(missionConfig).build(), graph, listener);
        var failures = new AtomicInteger();
        log.info("Run of {} missions of {} ({}, parallelism {})", request.missionLimit(), request.scenario(),
                 request.untilSuccess() ? "until success" : "fixed", request.parallelism());

        List<MissionOutcome> outcomes = request.parallelism() == 1 ? sequential(request, coordinator, failures)
                                                                   : parallel(request, coordinator, failures);
        var report = new RunReport(request.scenario(), outcomes, ledger.summary(request.scenario()), failures.get(),
                                   cancelled.get());
        log.info("Run finished: {}", report);
        return report;
    }

    /**
     * Stop the current run at the next tick boundary.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("Run cancelled");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public KnowledgeLedger ledger() {
        return ledger;
    }

    public SpatialGraph graph() {
        return graph;
    }

    private List<MissionOutcome> sequential(RunRequest request, MissionCoordinator coordinator,
                                            AtomicInteger failures) {
        var outcomes = new ArrayList<MissionOutcome>();
        for (int i = 0; i < request.missionLimit() && !cancelled.get(); i++) {
            var outcome = mission(request, coordinator, ledger.reserve(request.scenario()), failures);
            outcomes.add(outcome);
            if (request.untilSuccess() && outcome.success()) {
                break;
            }
        }
        return outcomes;
    }

    private List<MissionOutcome> parallel(RunRequest request, MissionCoordinator coordinator,
                                          AtomicInteger failures) {
        var outcomes = new ArrayList<MissionOutcome>();
        ExecutorService executor = Executors.newFixedThreadPool(request.parallelism());
        try {
            while (outcomes.size() < request.missionLimit() && !cancelled.get()) {
                int wave = Math.min(request.parallelism(), request.missionLimit() - outcomes.size());
                var futures = new ArrayList<Future<MissionOutcome>>();
                for (int i = 0; i < wave; i++) {
                    var reservation = ledger.reserve(request.scenario());
                    futures.add(executor.submit(() -> mission(request, coordinator, reservation, failures)));
                }
                boolean succeeded = false;
                for (var future : futures) {
                    var outcome = await(future);
                    outcomes.add(outcome);
                    succeeded |= outcome.success();
                }
                if (request.untilSuccess() && succeeded) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
        } finally {
            executor.shutdownNow();
        }
        return outcomes;
    }

    private static MissionOutcome await(Future<MissionOutcome> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Mission failed", e.getCause());
        }
    }

    private MissionOutcome mission(RunRequest request, MissionCoordinator coordinator,
                                   KnowledgeLedger.Reservation reservation, AtomicInteger failures) {
        var context = new RunContext(reservation.summary(), reservation.attempt(),
                                     request.seed() + reservation.attempt());
        var outcome = coordinator.run(context, hints, cancelled::get);
        var recorded = ledger.record(outcome);
        if (!recorded.persisted()) {
            failures.incrementAndGet();
            listener.accept(new SimulationEvent.PersistenceWarning(outcome.missionId(), recorded.warning()));
        }
        listener.accept(new SimulationEvent.MissionEnded(outcome.missionId(), outcome, recorded.persisted()));
        return outcome;
    }
}
