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

import com.hellblazer.ember.common.ConfigurationException;
import com.hellblazer.ember.navigation.hazard.HazardKind;
import com.hellblazer.ember.simulation.RunController;
import com.hellblazer.ember.simulation.RunReport;
import com.hellblazer.ember.simulation.RunRequest;
import com.hellblazer.ember.simulation.SimulationConfig;
import com.hellblazer.ember.simulation.SimulationEvent;
import com.hellblazer.ember.simulation.knowledge.JsonKnowledgeStore;
import com.hellblazer.ember.simulation.knowledge.KnowledgeSummary;
import com.hellblazer.ember.simulation.knowledge.MissionOutcome;
import com.hellblazer.ember.simulation.mission.HazardHintProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Command-line front end for rescue runs.
 *
 * <p>Modes of operation:
 * <ul>
 *   <li>RUN - Run missions of a scenario and record their outcomes</li>
 *   <li>STATS - Print the knowledge recorded for every scenario</li>
 *   <li>HELP - Show usage</li>
 * </ul>
 *
 * @author hal.hildebrand
 */
public class RescueCommandLine {
    private static final Logger log = LoggerFactory.getLogger(RescueCommandLine.class);

    public static final String DEFAULT_STORE = "ember-knowledge.jsonl";

    /**
     * Available operation modes.
     */
    public enum Mode {
        RUN("run", "Run rescue missions and record their outcomes"),
        STATS("stats", "Print recorded knowledge for every scenario"),
        HELP("help", "Show help information");

        private final String command;
        private final String description;

        Mode(String command, String description) {
            this.command = command;
            this.description = description;
        }

        public String getCommand() {
            return command;
        }

        public String getDescription() {
            return description;
        }

        public static Mode fromString(String s) {
            for (var mode : values()) {
                if (mode.command.equalsIgnoreCase(s)) {
                    return mode;
                }
            }
            return null;
        }
    }

    /**
     * Configuration holder for all command-line options.
     */
    public static class Config {
        public Mode mode = Mode.HELP;

        // Run options
        public String  scenario      = HazardKind.FIRE.scenario();
        public int     iterations    = 1;
        public int     agents        = RunRequest.DEFAULT_AGENTS;
        public boolean untilSuccess  = false;
        public int     maxIterations = RunRequest.DEFAULT_MAX_ITERATIONS;
        public int     parallelism   = 1;
        public long    seed          = RunRequest.DEFAULT_SEED;

        // Files
        public String storeFile = DEFAULT_STORE;
        public String hintsFile;
        public String configFile;

        // General options
        public boolean quiet = false;

        public final List<String> parseErrors = new ArrayList<>();

        public List<String> getValidationErrors() {
            var errors = new ArrayList<>(parseErrors);
            if (mode == Mode.RUN) {
                try {
                    HazardKind.fromScenario(scenario);
                } catch (ConfigurationException e) {
                    errors.add(e.getMessage());
                }
                if (iterations < 1) {
                    errors.add("Iterations must be positive");
                }
                if (agents < 1) {
                    errors.add("Agents must be positive");
                }
                if (maxIterations < 1) {
                    errors.add("Max iterations must be positive");
                }
                if (parallelism < 1) {
                    errors.add("Parallelism must be positive");
                }
                if (hintsFile != null && !Files.exists(Path.of(hintsFile))) {
                    errors.add("Hints file does not exist: " + hintsFile);
                }
            }
            if (configFile != null && !Files.exists(Path.of(configFile))) {
                errors.add("Configuration file does not exist: " + configFile);
            }
            return errors;
        }

        public RunRequest toRequest() {
            return new RunRequest(HazardKind.fromScenario(scenario), iterations, agents, untilSuccess, maxIterations,
                                  parallelism, seed);
        }

        @Override
        public String toString() {
            return String.format("Config{mode=%s, scenario=%s, iterations=%d, agents=%d, untilSuccess=%s, store=%s}",
                                 mode, scenario, iterations, agents, untilSuccess, storeFile);
        }
    }

    /**
     * Parse command-line arguments into configuration.
     */
    public static Config parse(String[] args) {
        var config = new Config();

        if (args.length == 0) {
            return config;
        }

        var modeArg = args[0];
        config.mode = Mode.fromString(modeArg);
        if (config.mode == null) {
            log.warn("Unknown mode: {}. Use 'help' for available modes.", modeArg);
            config.mode = Mode.HELP;
            return config;
        }

        for (int i = 1; i < args.length; i++) {
            var arg = args[i];
            try {
                switch (arg) {
                    case "-s", "--scenario" -> config.scenario = value(args, ++i, arg);
                    case "-n", "--iterations" -> config.iterations = Integer.parseInt(value(args, ++i, arg));
                    case "-a", "--agents" -> config.agents = Integer.parseInt(value(args, ++i, arg));
                    case "--until-success" -> config.untilSuccess = true;
                    case "--max-iterations" -> config.maxIterations = Integer.parseInt(value(args, ++i, arg));
                    case "-p", "--parallel" -> config.parallelism = Integer.parseInt(value(args, ++i, arg));
                    case "--seed" -> config.seed = Long.parseLong(value(args, ++i, arg));
                    case "--store" -> config.storeFile = value(args, ++i, arg);
                    case "--hints" -> config.hintsFile = value(args, ++i, arg);
                    case "-c", "--config" -> config.configFile = value(args, ++i, arg);
                    case "-q", "--quiet" -> config.quiet = true;
                    case "--help" -> config.mode = Mode.HELP;
                    default -> {
                        if (arg.startsWith("-")) {
                            log.warn("Unknown option: {}", arg);
                        }
                    }
                }
            } catch (NumberFormatException e) {
                config.parseErrors.add("Option " + arg + " expects a number: " + e.getMessage());
            } catch (IllegalArgumentException e) {
                config.parseErrors.add(e.getMessage());
            }
        }

        return config;
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Option " + option + " requires a value");
        }
        return args[index];
    }

    /**
     * Print usage information.
     */
    public static void printUsage(PrintStream out) {
        out.println("Ember - risk-aware multi-agent rescue planner");
        out.println();
        out.println("Usage: ember <mode> [options]");
        out.println();
        out.println("Modes:");
        for (var mode : Mode.values()) {
            out.printf("  %-12s  %s%n", mode.getCommand(), mode.getDescription());
        }
        out.println();
        out.println("Run Options:");
        out.println("  -s, --scenario <name>   Hazard scenario: fire or attacker (default: fire)");
        out.println("  -n, --iterations <n>    Missions to run (default: 1)");
        out.println("  -a, --agents <n>        Agents per mission (default: 3)");
        out.println("  --until-success         Run until a mission succeeds");
        out.println("  --max-iterations <n>    Mission limit with --until-success (default: 20)");
        out.println("  -p, --parallel <n>      Missions run concurrently (default: 1)");
        out.println("  --seed <n>              Base random seed (default: 42)");
        out.println("  --hints <file>          Hazard hints (JSON)");
        out.println();
        out.println("Common Options:");
        out.println("  --store <file>          Knowledge file (default: " + DEFAULT_STORE + ")");
        out.println("  -c, --config <file>     Configuration overrides (JSON)");
        out.println("  -q, --quiet             Suppress per-mission output");
        out.println("  --help                  Show this help message");
        out.println();
        out.println("Examples:");
        out.println("  ember run --scenario fire --iterations 5");
        out.println("  ember run --scenario attacker --until-success --max-iterations 10 --parallel 2");
        out.println("  ember stats --store missions.jsonl");
    }

    /**
     * Validate configuration and print any errors.
     */
    public static boolean validate(Config config, PrintStream out) {
        var errors = config.getValidationErrors();
        if (!errors.isEmpty()) {
            out.println("Configuration errors:");
            for (var error : errors) {
                out.println("  - " + error);
            }
            out.println();
            out.println("Use 'ember help' for usage information.");
            return false;
        }
        return true;
    }

    /**
     * Execute a parsed configuration.
     *
     * @return process exit code
     */
    public static int execute(Config config, PrintStream out) {
        try {
            return switch (config.mode) {
                case RUN -> run(config, out);
                case STATS -> stats(config, out);
                case HELP -> {
                    printUsage(out);
                    yield 0;
                }
            };
        } catch (ConfigurationException e) {
            out.println("Configuration error: " + e.getMessage());
            return 1;
        }
    }

    static int run(Config config, PrintStream out) {
        var simulation = config.configFile == null ? SimulationConfig.defaults()
                                                   : new ConfigLoader().load(Path.of(config.configFile));
        var hints = config.hintsFile == null ? HazardHintProvider.none()
                                             : new HintFileLoader().load(Path.of(config.hintsFile));
        var store = new JsonKnowledgeStore(Path.of(config.storeFile));
        Consumer<SimulationEvent> listener = event -> {
            if (config.quiet) {
                return;
            }
            if (event instanceof SimulationEvent.MissionEnded ended) {
                out.println(describe(ended.outcome()));
            } else if (event instanceof SimulationEvent.PersistenceWarning warning) {
                out.println("warning: " + warning.missionId() + " not persisted: " + warning.message());
            }
        };
        var controller = new RunController(simulation, store, hints, listener);
        var report = controller.run(config.toRequest());
        printReport(report, out);
        return 0;
    }

    static int stats(Config config, PrintStream out) {
        var store = new JsonKnowledgeStore(Path.of(config.storeFile));
        out.println("Knowledge in " + store.file());
        for (var kind : HazardKind.values()) {
            printSummary(store.loadSummary(kind), out);
        }
        return 0;
    }

    static String describe(MissionOutcome outcome) {
        var reached = outcome.agents().stream().filter(a -> a.reachedTarget()).count();
        return String.format("%s %-8s %s in %d ticks (%.1fs), %d/%d agents reached the target", outcome.missionId(),
                             outcome.hazardKind().scenario(), outcome.success() ? "succeeded" : "failed",
                             outcome.ticks(), outcome.elapsedTime(), reached, outcome.agentCount())
        + (outcome.success() ? "" : " [" + outcome.failureReason() + "]");
    }

    static void printReport(RunReport report, PrintStream out) {
        out.println();
        out.printf("Run of %s: %d missions, %d succeeded (%.0f%%)%s%n", report.scenario().scenario(),
                   report.missions(), report.successes(), report.successRate() * 100.0,
                   report.cancelled() ? ", cancelled" : "");
        if (report.persistenceFailures() > 0) {
            out.printf("  %d outcomes could not be persisted%n", report.persistenceFailures());
        }
        printSummary(report.summary(), out);
    }

    static void printSummary(KnowledgeSummary summary, PrintStream out) {
        out.printf("%s: %d attempts, %d successes, success rate %.2f%n", summary.kind().scenario(),
                   summary.attempts(), summary.successes(), summary.successRate());
        if (summary.isEmpty()) {
            return;
        }
        summary.averageSuccessTime()
               .ifPresent(avg -> out.printf("  success time avg %.1fs, min %.1fs, max %.1fs%n", avg,
                                            summary.minSuccessTime().orElse(0.0),
                                            summary.maxSuccessTime().orElse(0.0)));
        summary.failureReasons().forEach((reason, count) -> out.printf("  %-18s %d%n", reason, count));
        out.printf("  recorded deaths: %d%n", summary.dangerRecords().size());
        summary.bestPath()
               .ifPresent(best -> out.printf("  best path: %s, %d cells, danger %.2f%n", best.missionId(),
                                             best.path().size(), best.cumulativeDanger()));
    }

    /**
     * Main entry point for CLI.
     */
    public static void main(String[] args) {
        var config = parse(args);

        if (config.mode == Mode.HELP) {
            printUsage(System.out);
            return;
        }

        if (!validate(config, System.err)) {
            System.exit(1);
        }

        if (!config.quiet) {
            log.info("Ember mode: {}", config.mode);
            log.info("Configuration: {}", config);
        }

        try {
            System.exit(execute(config, System.out));
        } catch (Exception e) {
            log.error("Error executing {}: {}", config.mode, e.getMessage(), e);
            System.exit(1);
        }
    }
}
