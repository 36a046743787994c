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
package com.hellblazer.cartograph.almanac;

import com.hellblazer.cartograph.atlas.Category;
import com.hellblazer.cartograph.atlas.Pipeline;
import com.hellblazer.cartograph.atlas.Value;
import com.hellblazer.cartograph.atlas.WalkConfiguration;
import com.hellblazer.cartograph.common.Interval;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("LowestLocationSolver Tests")
class LowestLocationSolverTest extends AlmanacTestBase {

    private final LowestLocationSolver solver = new LowestLocationSolver();

    @Test
    @DisplayName("Individual seeds")
    void testIndividualSeeds() throws Exception {
        var almanac = new AlmanacParser().parse(exampleText(), SeedMode.INDIVIDUAL);
        assertEquals(35, solver.lowestLocation(almanac).getAsLong());
        assertEquals(35, solver.solve(almanac).getAsLong());
    }

    @Test
    @DisplayName("Seed ranges")
    void testSeedRanges() throws Exception {
        for (var config : List.of(WalkConfiguration.defaultConfig(), WalkConfiguration.compatibleConfig())) {
            var almanac = new AlmanacParser(config).parse(exampleText(), SeedMode.RANGES);
            assertEquals(46, solver.lowestLocationForRanges(almanac).getAsLong());
            assertEquals(46, solver.solve(almanac).getAsLong());
        }
    }

    @Test
    @DisplayName("Individual seeds are the degenerate seed ranges")
    void testPointsAgree() throws Exception {
        var almanac = new AlmanacParser().parse(exampleText(), SeedMode.INDIVIDUAL);
        assertEquals(solver.lowestLocation(almanac), solver.lowestLocationForRanges(almanac));
    }

    @Test
    @DisplayName("Seeds whose walk fails are skipped")
    void testFailedWalksSkipped() {
        var pipeline = mock(Pipeline.class);
        when(pipeline.map(any(), eq(Category.LOCATION))).thenReturn(Optional.empty());
        when(pipeline.map(eq(Value.of(Category.SEED, 14)), eq(Category.LOCATION))).thenReturn(
        Optional.of(Value.of(Category.LOCATION, 99)));
        var almanac = new Almanac(List.of(79L, 14L, 55L), SeedMode.INDIVIDUAL, pipeline);

        assertEquals(99, solver.lowestLocation(almanac).getAsLong());
        verify(pipeline, times(3)).map(any(), eq(Category.LOCATION));
    }

    @Test
    @DisplayName("No answer when nothing reaches the target")
    void testNoAnswer() throws Exception {
        var almanac = new AlmanacParser().parse("seeds: 1 5\nseed-to-soil map:\n10 0 3\n", SeedMode.RANGES);
        assertTrue(solver.solve(almanac).isEmpty());
        assertTrue(new LowestLocationSolver(Category.SEED, Category.SOIL).solve(almanac).isPresent());
        assertEquals(List.of(Interval.of(11, 13), Interval.of(3, 6)),
                     almanac.getPipeline().mapRange(Interval.of(1, 6), Category.SEED, Category.SOIL));
        assertEquals(3, new LowestLocationSolver(Category.SEED, Category.SOIL).solve(almanac).getAsLong());
    }
}
