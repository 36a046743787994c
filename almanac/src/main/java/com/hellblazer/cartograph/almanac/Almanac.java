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
import com.hellblazer.cartograph.common.Interval;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A parsed almanac: the seed numbers, how to read them, and the pipeline of category maps
 *
 * @author hal.hildebrand
 */
public final class Almanac {

    private final Pipeline   pipeline;
    private final SeedMode   seedMode;
    private final List<Long> seedNumbers;

    public Almanac(List<Long> seedNumbers, SeedMode seedMode, Pipeline pipeline) {
        this.seedNumbers = List.copyOf(Objects.requireNonNull(seedNumbers, "Seed numbers cannot be null"));
        this.seedMode = Objects.requireNonNull(seedMode, "Seed mode cannot be null");
        this.pipeline = Objects.requireNonNull(pipeline, "Pipeline cannot be null");
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public SeedMode getSeedMode() {
        return seedMode;
    }

    /**
     * @return the numbers of the seeds line, as written
     */
    public List<Long> getSeedNumbers() {
        return seedNumbers;
    }

    /**
     * @return the seeds as intervals of seed values, read according to the seed mode
     */
    public List<Interval> seedIntervals() {
        return seedMode.intervals(seedNumbers);
    }

    /**
     * @return every number of the seeds line as an individual seed value
     */
    public List<Value> seedValues() {
        var values = new ArrayList<Value>(seedNumbers.size());
        for (var n : seedNumbers) {
            values.add(Value.of(Category.SEED, n));
        }
        return values;
    }

    @Override
    public String toString() {
        return String.format("Almanac[%d seed numbers, %s, %d maps]", seedNumbers.size(), seedMode, pipeline.size());
    }
}
