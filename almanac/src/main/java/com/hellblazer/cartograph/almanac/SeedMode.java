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

import com.hellblazer.cartograph.common.Interval;

import java.util.ArrayList;
import java.util.List;

/**
 * How the numbers of the <code>seeds:</code> line are read
 *
 * @author hal.hildebrand
 */
public enum SeedMode {
    /**
     * Every number is a seed
     */
    INDIVIDUAL {
        @Override
        public List<Interval> intervals(List<Long> numbers) {
            var intervals = new ArrayList<Interval>(numbers.size());
            for (var n : numbers) {
                intervals.add(Interval.point(n));
            }
            return intervals;
        }
    },
    /**
     * Numbers pair up as <code>start length</code>, each pair a range of seeds
     */
    RANGES {
        @Override
        public List<Interval> intervals(List<Long> numbers) {
            if (numbers.size() % 2 != 0) {
                throw new IllegalArgumentException("Seed ranges need an even count of numbers: " + numbers.size());
            }
            var intervals = new ArrayList<Interval>(numbers.size() / 2);
            for (int i = 0; i < numbers.size(); i += 2) {
                intervals.add(Interval.ofLength(numbers.get(i), numbers.get(i + 1)));
            }
            return intervals;
        }
    };

    /**
     * @return the seeds the numbers denote, as intervals of seed values
     */
    public abstract List<Interval> intervals(List<Long> numbers);
}
