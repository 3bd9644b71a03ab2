package com.hellblazer.ember.navigation.hazard;

import com.hellblazer.ember.navigation.GraphConfig;
import com.hellblazer.ember.navigation.SpatialGraph;
import net.jqwik.api.*;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.DisplayName;

import javax.vecmath.Point3f;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Hazard Field Property-Based Tests")
class HazardPropertyTest {

    private static final SpatialGraph GRAPH = SpatialGraph.build(GraphConfig.defaults());

    @Property(tries = 50)
    @Label("Spreading intensity stays in [0, 1] and never decreases at a fixed point")
    void spreadingIsBoundedAndMonotone(@ForAll long seed, @ForAll @DoubleRange(min = 0.0, max = 19.0) double x,
                                       @ForAll @DoubleRange(min = 0.0, max = 19.0) double y,
                                       @ForAll @IntRange(min = 0, max = 3) int level) {
        var fire = SpreadingHazard.withDefaultPlacement(SpreadingConfig.defaults(), GRAPH, new Random(seed));
        var point = new Point3f((float) x, (float) y, level * 3.0f);
        double previous = fire.intensityAt(point, level);
        for (int tick = 0; tick < 120; tick++) {
            fire.advance(0.5);
            double current = fire.intensityAt(point, level);
            assertTrue(current >= 0.0 && current <= 1.0, () -> "out of range: " + current);
            double before = previous;
            assertTrue(current >= before, () -> "decreased from " + before + " to " + current);
            previous = current;
        }
    }

    @Property(tries = 50)
    @Label("Earlier times never read hotter than later times")
    void spreadingMonotoneInQueryTime(@ForAll long seed, @ForAll @DoubleRange(min = 0.0, max = 60.0) double t1,
                                      @ForAll @DoubleRange(min = 0.0, max = 60.0) double t2) {
        var fire = SpreadingHazard.withDefaultPlacement(SpreadingConfig.defaults(), GRAPH, new Random(seed));
        for (int tick = 0; tick < 120; tick++) {
            fire.advance(0.5);
        }
        double early = Math.min(t1, t2);
        double late = Math.max(t1, t2);
        for (var node : GRAPH.nodes()) {
            if (node.id() % 37 != 0) {
                continue;
            }
            var p = GRAPH.position(node);
            assertTrue(fire.intensityAt(p, node.level(), early) <= fire.intensityAt(p, node.level(), late));
        }
    }

    @Property(tries = 100)
    @Label("Patrol intensity is either zero or the patrol intensity")
    void patrolIsBinary(@ForAll @DoubleRange(min = 0.0, max = 500.0) double time,
                        @ForAll @DoubleRange(min = 0.0, max = 19.0) double x,
                        @ForAll @DoubleRange(min = 0.0, max = 19.0) double y, @ForAll @IntRange(min = 0, max = 3) int level) {
        var patrol = PatrollingHazard.create(PatrolConfig.defaults(), GRAPH);
        double intensity = patrol.intensityAt(new Point3f((float) x, (float) y, level * 3.0f), level, time);
        assertTrue(intensity == 0.0 || intensity == 1.0);
    }

    @Property(tries = 100)
    @Label("Patrol stays within its square and between its two levels")
    void patrolStaysOnRoute(@ForAll @DoubleRange(min = 0.0, max = 1000.0) double time) {
        var patrol = PatrollingHazard.create(PatrolConfig.defaults(), GRAPH);
        var p = patrol.positionAt(time);
        assertTrue(p.x >= 5.0f - 1e-4f && p.x <= 15.0f + 1e-4f);
        assertTrue(p.y >= 5.0f - 1e-4f && p.y <= 15.0f + 1e-4f);
        assertTrue(p.z >= 6.0f - 1e-4f && p.z <= 9.0f + 1e-4f);
        int level = patrol.levelAt(time);
        assertTrue(level == 2 || level == 3);
    }
}
