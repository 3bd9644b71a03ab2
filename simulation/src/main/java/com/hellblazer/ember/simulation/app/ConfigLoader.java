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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.ember.common.ConfigurationException;
import com.hellblazer.ember.navigation.GraphConfig;
import com.hellblazer.ember.navigation.hazard.PatrolConfig;
import com.hellblazer.ember.navigation.hazard.SpreadingConfig;
import com.hellblazer.ember.navigation.planning.PlannerConfig;
import com.hellblazer.ember.simulation.SimulationConfig;
import com.hellblazer.ember.simulation.agent.AgentConfig;
import com.hellblazer.ember.simulation.mission.MissionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Reads configuration overrides from JSON.
 * <p>
 * The document has one optional object per section ({@code graph}, {@code fire}, {@code attacker},
 * {@code planner}, {@code agent}, {@code mission}); each key overrides the default of the builder
 * property of the same name. Cells are {@code [x, y, level]} arrays and the stairway is
 * {@code [minX, minY, maxX, maxY]}. Unknown sections or keys are rejected, so a misspelt override
 * never silently falls back to a default.
 *
 * <pre>
 * {
 *   "graph":   { "levels": 4, "gridResolution": 20, "walls": [[5, 5, 0]] },
 *   "fire":    { "spreadRate": 0.2, "ignitionProbability": 0.0 },
 *   "mission": { "agents": 5, "maxTicks": 300, "wallClockSeconds": 10 }
 * }
 * </pre>
 *
 * @author hal.hildebrand
 */
public class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * @throws ConfigurationException if the file cannot be read or holds an invalid override
     */
    public SimulationConfig load(Path file) {
        try (var in = Files.newInputStream(file)) {
            var config = load(in);
            log.info("Loaded configuration overrides from {}", file);
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration " + file + ": " + e.getMessage(), e);
        }
    }

    public SimulationConfig load(InputStream in) throws IOException {
        return parse(objectMapper.readTree(in));
    }

    public SimulationConfig parse(String json) {
        try {
            return parse(objectMapper.readTree(json));
        } catch (IOException e) {
            throw new ConfigurationException("Malformed configuration: " + e.getMessage(), e);
        }
    }

    public SimulationConfig parse(JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return SimulationConfig.defaults();
        }
        requireObject(root, "configuration");
        var builder = SimulationConfig.builder();
        var sections = root.fields();
        while (sections.hasNext()) {
            var section = sections.next();
            var node = section.getValue();
            requireObject(node, section.getKey());
            switch (section.getKey()) {
                case "graph" -> builder.graph(graph(node));
                case "fire" -> builder.fire(fire(node));
                case "attacker" -> builder.attacker(attacker(node));
                case "planner" -> builder.planner(planner(node));
                case "agent" -> builder.agent(agent(node));
                case "mission" -> builder.mission(mission(node));
                default -> throw new ConfigurationException("Unknown configuration section: " + section.getKey());
            }
        }
        return builder.build();
    }

    private GraphConfig graph(JsonNode node) {
        var builder = GraphConfig.builder();
        var fields = node.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            var key = field.getKey();
            var value = field.getValue();
            switch (key) {
                case "levels" -> builder.levels(integer(value, key));
                case "gridResolution" -> builder.gridResolution(integer(value, key));
                case "cellSize" -> builder.cellSize(number(value, key));
                case "levelHeight" -> builder.levelHeight(number(value, key));
                case "verticalCostFactor" -> builder.verticalCostFactor(number(value, key));
                case "stairway" -> {
                    var r = ints(value, key, 4);
                    builder.stairway(r[0], r[1], r[2], r[3]);
                }
                case "start" -> {
                    var c = ints(value, key, 3);
                    builder.start(c[0], c[1], c[2]);
                }
                case "target" -> {
                    var c = ints(value, key, 3);
                    builder.target(c[0], c[1], c[2]);
                }
                case "walls" -> {
                    if (!value.isArray()) {
                        throw new ConfigurationException("walls must be an array of [x, y, level] cells");
                    }
                    for (var wall : value) {
                        var c = ints(wall, "wall", 3);
                        builder.wall(c[0], c[1], c[2]);
                    }
                }
                default -> throw unknown("graph", key);
            }
        }
        return builder.build();
    }

    private SpreadingConfig fire(JsonNode node) {
        var builder = SpreadingConfig.builder();
        var fields = node.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            var key = field.getKey();
            var value = field.getValue();
            switch (key) {
                case "initialRadius" -> builder.initialRadius(number(value, key));
                case "spreadRate" -> builder.spreadRate(number(value, key));
                case "maxRadius" -> builder.maxRadius(number(value, key));
                case "initialIntensity" -> builder.initialIntensity(number(value, key));
                case "intensityGrowth" -> builder.intensityGrowth(number(value, key));
                case "intensityCap" -> builder.intensityCap(number(value, key));
                case "heatRise" -> builder.heatRise(number(value, key));
                case "lowerLevels" -> builder.lowerLevels(integer(value, key));
                case "placementMargin" -> builder.placementMargin(number(value, key));
                case "ignitionThreshold" -> builder.ignitionThreshold(number(value, key));
                case "ignitionProbability" -> builder.ignitionProbability(number(value, key));
                case "ignitionRange" -> builder.ignitionRange(number(value, key));
                case "upwardProbability" -> builder.upwardProbability(number(value, key));
                case "secondaryIntensity" -> builder.secondaryIntensity(number(value, key));
                case "secondaryRadius" -> builder.secondaryRadius(number(value, key));
                case "minOriginSeparation" -> builder.minOriginSeparation(number(value, key));
                case "maxOrigins" -> builder.maxOrigins(integer(value, key));
                default -> throw unknown("fire", key);
            }
        }
        return builder.build();
    }

    private PatrolConfig attacker(JsonNode node) {
        var builder = PatrolConfig.builder();
        int lower = 2;
        int upper = 3;
        var fields = node.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            var key = field.getKey();
            var value = field.getValue();
            switch (key) {
                case "lowerLevel" -> lower = integer(value, key);
                case "upperLevel" -> upper = integer(value, key);
                case "speed" -> builder.speed(number(value, key));
                case "dangerRadius" -> builder.dangerRadius(number(value, key));
                case "intensity" -> builder.intensity(number(value, key));
                case "waypoints" -> {
                    if (!value.isArray()) {
                        throw new ConfigurationException("waypoints must be an array of [x, y, level] points");
                    }
                    for (var waypoint : value) {
                        var p = numbers(waypoint, "waypoint", 3);
                        builder.waypoint(p[0], p[1], (int) p[2]);
                    }
                }
                default -> throw unknown("attacker", key);
            }
        }
        return builder.levels(lower, upper).build();
    }

    private PlannerConfig planner(JsonNode node) {
        var builder = PlannerConfig.builder();
        var fields = node.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            var key = field.getKey();
            var value = field.getValue();
            switch (key) {
                case "dangerWeight" -> builder.dangerWeight(number(value, key));
                case "heuristicScale" -> builder.heuristicScale(number(value, key));
                case "maxExpansions" -> builder.maxExpansions(integer(value, key));
                default -> throw unknown("planner", key);
            }
        }
        return builder.build();
    }

    private AgentConfig agent(JsonNode node) {
        var builder = AgentConfig.builder();
        var fields = node.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            var key = field.getKey();
            var value = field.getValue();
            switch (key) {
                case "damagePerTick" -> builder.damagePerTick(number(value, key));
                case "replanThreshold" -> builder.replanThreshold(number(value, key));
                case "lookahead" -> builder.lookahead(integer(value, key));
                case "stepBudget" -> builder.stepBudget(integer(value, key));
                case "sharedPenaltyWeight" -> builder.sharedPenaltyWeight(number(value, key));
                default -> throw unknown("agent", key);
            }
        }
        return builder.build();
    }

    private MissionConfig mission(JsonNode node) {
        var builder = MissionConfig.builder();
        var fields = node.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            var key = field.getKey();
            var value = field.getValue();
            switch (key) {
                case "agents" -> builder.agents(integer(value, key));
                case "baseRiskTolerance" -> builder.baseRiskTolerance(number(value, key));
                case "learningRate" -> builder.learningRate(number(value, key));
                case "toleranceSpread" -> builder.toleranceSpread(number(value, key));
                case "tickSeconds" -> builder.tickSeconds(number(value, key));
                case "maxTicks" -> builder.maxTicks(integer(value, key));
                case "wallClockSeconds" -> builder.wallClockBudget(
                Duration.ofMillis(Math.round(number(value, key) * 1000.0)));
                case "hintConfidenceThreshold" -> builder.hintConfidenceThreshold(number(value, key));
                case "penaltyScale" -> builder.penaltyScale(number(value, key));
                case "penaltyDecay" -> builder.penaltyDecay(number(value, key));
                case "penaltyRadius" -> builder.penaltyRadius(integer(value, key));
                default -> throw unknown("mission", key);
            }
        }
        return builder.build();
    }

    private static void requireObject(JsonNode node, String what) {
        if (!node.isObject()) {
            throw new ConfigurationException(what + " must be a JSON object");
        }
    }

    private static ConfigurationException unknown(String section, String key) {
        return new ConfigurationException("Unknown " + section + " setting: " + key);
    }

    private static double number(JsonNode value, String key) {
        if (!value.isNumber()) {
            throw new ConfigurationException(key + " must be a number: " + value);
        }
        return value.doubleValue();
    }

    private static int integer(JsonNode value, String key) {
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new ConfigurationException(key + " must be an integer: " + value);
        }
        return value.intValue();
    }

    private static int[] ints(JsonNode value, String key, int size) {
        if (!value.isArray() || value.size() != size) {
            throw new ConfigurationException(key + " must be an array of " + size + " integers: " + value);
        }
        var result = new int[size];
        for (int i = 0; i < size; i++) {
            result[i] = integer(value.get(i), key);
        }
        return result;
    }

    private static double[] numbers(JsonNode value, String key, int size) {
        if (!value.isArray() || value.size() != size) {
            throw new ConfigurationException(key + " must be an array of " + size + " numbers: " + value);
        }
        var result = new double[size];
        for (int i = 0; i < size; i++) {
            result[i] = number(value.get(i), key);
        }
        return result;
    }
}
