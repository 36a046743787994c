/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.cartograph.atlas;

import com.hellblazer.cartograph.atlas.index.IntervalIndex;
import com.hellblazer.cartograph.common.Interval;
import com.hellblazer.cartograph.common.Intervals;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static com.hellblazer.cartograph.atlas.Category.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * @author hal.hildebrand
 */
@DisplayName("Pipeline Tests")
public class PipelineTest {

    private static final Category ALTITUDE = Category.of("altitude");

    @Test
    @DisplayName("Values follow the chain hop by hop")
    void testMapChain() {
        var pipeline = Pipeline.builder()
                               .add(SEED, SOIL, List.of(new RangeRule(Interval.of(1, 2), Interval.of(4, 5)),
                                                        new RangeRule(Interval.of(5, 7), Interval.of(7, 9))))
                               .add(SOIL, HUMIDITY, List.of(new RangeRule(Interval.of(4, 6), Interval.of(9, 11))))
                               .build();
        assertEquals(Value.of(HUMIDITY, 9), pipeline.map(Value.of(SEED, 1), HUMIDITY).orElseThrow());
        assertEquals(Value.of(SOIL, 7), pipeline.map(Value.of(SEED, 5), SOIL).orElseThrow());
        assertEquals(Value.of(HUMIDITY, 3), pipeline.map(Value.of(SEED, 3), HUMIDITY).orElseThrow());
        assertEquals(Value.of(SOIL, 5), pipeline.map(Value.of(SOIL, 5), SOIL).orElseThrow());
    }

    @Test
    @DisplayName("Seeds map to their locations")
    void testMapExample() {
        var pipeline = ExamplePipeline.build(WalkConfiguration.defaultConfig());
        var locations = Arrays.stream(ExamplePipeline.SEEDS)
                              .mapToObj(s -> pipeline.map(Value.of(SEED, s), LOCATION).orElseThrow().number())
                              .collect(Collectors.toList());
        assertEquals(List.of(82L, 43L, 86L, 35L), locations);
        assertEquals(Value.of(LOCATION, 82), pipeline.map(Value.of(SOIL, 81), LOCATION).orElseThrow());
        assertEquals(7, pipeline.size());
    }

    @Test
    @DisplayName("Seed ranges map to location ranges")
    void testMapRangeExample() {
        var configs = List.of(WalkConfiguration.defaultConfig(), WalkConfiguration.compatibleConfig());
        for (var config : configs) {
            var pipeline = ExamplePipeline.build(config);
            var seeds = List.of(Interval.ofLength(79, 14), Interval.ofLength(55, 13));
            var locations = pipeline.mapRangeAll(seeds, SEED, LOCATION);

            assertEquals(27, Intervals.totalLength(locations), config.toString());
            assertEquals(46, Pipeline.lowestValue(locations).getAsLong(), config.toString());

            var single = pipeline.mapRange(Interval.ofLength(79, 14), SEED, LOCATION);
            assertEquals(14, Intervals.totalLength(single));
            assertEquals(46, Pipeline.lowestValue(single).getAsLong());
        }
    }

    @Test
    @DisplayName("Range walks agree with scalar walks")
    void testRangeAgreesWithScalar() {
        var pipeline = ExamplePipeline.build(WalkConfiguration.defaultConfig());
        var query = Interval.of(0, 120);
        var expected = LongStream.range(query.start(), query.end())
                                 .map(s -> pipeline.map(Value.of(SEED, s), LOCATION).orElseThrow().number())
                                 .sorted()
                                 .boxed()
                                 .collect(Collectors.toList());
        var actual = pipeline.mapRange(query, SEED, LOCATION)
                             .stream()
                             .flatMapToLong(i -> LongStream.range(i.start(), i.end()))
                             .sorted()
                             .boxed()
                             .collect(Collectors.toList());
        assertEquals(expected, actual);
    }

    @Test
    @DisplayName("Missing map before the target fails both walks")
    void testDeadEnd() {
        var pipeline = ExamplePipeline.build(WalkConfiguration.defaultConfig());
        assertTrue(pipeline.map(Value.of(SEED, 79), ALTITUDE).isEmpty());
        assertTrue(pipeline.map(Value.of(ALTITUDE, 79), LOCATION).isEmpty());
        assertTrue(pipeline.mapRange(Interval.of(79, 93), SEED, ALTITUDE).isEmpty());
        assertTrue(pipeline.mapRangeAll(List.of(Interval.of(79, 93)), SEED, ALTITUDE).isEmpty());
        assertTrue(pipeline.route(LOCATION, SEED).isEmpty());
    }

    @Test
    @DisplayName("Route lists the maps of the walk")
    void testRoute() {
        var pipeline = ExamplePipeline.build(WalkConfiguration.defaultConfig());
        var route = pipeline.route(LIGHT, LOCATION).orElseThrow();
        assertEquals(List.of(LIGHT, TEMPERATURE, HUMIDITY),
                     route.stream().map(CategoryMap::getSourceCategory).collect(Collectors.toList()));
        assertTrue(pipeline.route(SEED, SEED).orElseThrow().isEmpty());
        assertEquals(pipeline.getMap(SEED).orElseThrow(), pipeline.route(SEED, SOIL).orElseThrow().get(0));
        assertTrue(pipeline.getMap(LOCATION).isEmpty());
        assertEquals(List.of(SEED, SOIL, FERTILIZER, WATER, LIGHT, TEMPERATURE, HUMIDITY),
                     List.copyOf(pipeline.categories()));
    }

    @Test
    @DisplayName("Cycles never reach the target")
    void testCycle() {
        var guarded = Pipeline.builder()
                              .add(SEED, SOIL, List.of(RangeRule.fromTriple(10, 0, 5)))
                              .add(SOIL, SEED, List.of())
                              .build();
        assertTrue(guarded.map(Value.of(SEED, 1), LOCATION).isEmpty());
        assertTrue(guarded.mapRange(Interval.of(0, 10), SEED, LOCATION).isEmpty());
        assertEquals(Value.of(SOIL, 11), guarded.map(Value.of(SEED, 1), SOIL).orElseThrow());
        assertEquals(Value.of(SEED, 1), guarded.map(Value.of(SEED, 1), SEED).orElseThrow());

        var unguarded = Pipeline.builder(new WalkConfiguration.Builder().withCycleDetection(false).build())
                                .add(SEED, SOIL, List.of(RangeRule.fromTriple(10, 0, 5)))
                                .add(SOIL, SEED, List.of())
                                .build();
        assertTrue(unguarded.map(Value.of(SEED, 1), LOCATION).isEmpty());
        assertTrue(unguarded.mapRange(Interval.of(0, 10), SEED, LOCATION).isEmpty());
    }

    @Test
    @DisplayName("Hop limit bounds walks")
    void testMaxHops() {
        var config = new WalkConfiguration.Builder().withMaxHops(3).build();
        var pipeline = ExamplePipeline.build(config);
        assertTrue(pipeline.map(Value.of(SEED, 79), LOCATION).isEmpty());
        assertEquals(Value.of(WATER, 81), pipeline.map(Value.of(SEED, 79), WATER).orElseThrow());
    }

    @Test
    @DisplayName("Duplicate source category is rejected")
    void testDuplicateSource() {
        var builder = Pipeline.builder().add(SEED, SOIL, List.of());
        assertThrows(IllegalArgumentException.class, () -> builder.add(SEED, WATER, List.of()));
    }

    @Test
    @DisplayName("Walk stops once nothing is left to map")
    void testEmptyWorkingSet() {
        var downstream = mock(CategoryMap.class);
        when(downstream.getSourceCategory()).thenReturn(SOIL);
        when(downstream.getTargetCategory()).thenReturn(LOCATION);
        when(downstream.getIndex()).thenReturn(new IntervalIndex());

        var pipeline = Pipeline.builder()
                               .add(SEED, SOIL, List.of(RangeRule.fromTriple(10, 0, 5)))
                               .add(downstream)
                               .build();
        assertTrue(pipeline.mapRange(Interval.of(3, 3), SEED, LOCATION).isEmpty());
        verify(downstream, never()).rangesFor(any());
    }

    @Test
    @DisplayName("Concurrent readers see the same answers")
    void testConcurrentReaders() {
        var pipeline = ExamplePipeline.build(WalkConfiguration.defaultConfig());
        var sequential = LongStream.range(0, 2000)
                                   .map(s -> pipeline.map(Value.of(SEED, s), LOCATION).orElseThrow().number())
                                   .boxed()
                                   .collect(Collectors.toList());
        var parallel = LongStream.range(0, 2000)
                                 .parallel()
                                 .map(s -> pipeline.map(Value.of(SEED, s), LOCATION).orElseThrow().number())
                                 .boxed()
                                 .collect(Collectors.toList());
        assertEquals(sequential, parallel);
    }
}
