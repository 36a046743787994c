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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Finds the lowest location any seed of an almanac maps to
 *
 * @author hal.hildebrand
 */
public class LowestLocationSolver {

    private static final Logger log = LoggerFactory.getLogger(LowestLocationSolver.class);

    private final Category source;
    private final Category target;

    public LowestLocationSolver() {
        this(Category.SEED, Category.LOCATION);
    }

    public LowestLocationSolver(Category source, Category target) {
        this.source = source;
        this.target = target;
    }

    /**
     * Map every seed number individually. Seeds whose walk fails are skipped.
     */
    public OptionalLong lowestLocation(Almanac almanac) {
        var pipeline = almanac.getPipeline();
        var lowest = almanac.getSeedNumbers()
                            .stream()
                            .map(n -> pipeline.map(Value.of(source, n), target))
                            .flatMap(Optional::stream)
                            .mapToLong(Value::number)
                            .min();
        log.debug("Lowest {} of {} individual seeds: {}", target, almanac.getSeedNumbers().size(), lowest);
        return lowest;
    }

    /**
     * Map the almanac's seed intervals as ranges, splitting them through every map
     */
    public OptionalLong lowestLocationForRanges(Almanac almanac) {
        var seeds = almanac.seedIntervals();
        var locations = almanac.getPipeline().mapRangeAll(seeds, source, target);
        log.debug("{} seed intervals became {} {} intervals", seeds.size(), locations.size(), target);
        return Pipeline.lowestValue(locations);
    }

    /**
     * Solve according to the almanac's seed mode
     */
    public OptionalLong solve(Almanac almanac) {
        return switch (almanac.getSeedMode()) {
            case INDIVIDUAL -> lowestLocation(almanac);
            case RANGES -> lowestLocationForRanges(almanac);
        };
    }
}
