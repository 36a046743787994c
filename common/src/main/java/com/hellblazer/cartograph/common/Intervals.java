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
package com.hellblazer.cartograph.common;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.OptionalLong;

/**
 * Reductions over collections of intervals
 *
 * @author hal.hildebrand
 */
public final class Intervals {

    /**
     * Merge the intervals into a sorted list of disjoint, non-adjacent intervals covering the same values. Empty
     * intervals are dropped.
     */
    public static List<Interval> coalesce(Collection<Interval> intervals) {
        var sorted = new ArrayList<Interval>(intervals.size());
        for (var interval : intervals) {
            if (!interval.isEmpty()) {
                sorted.add(interval);
            }
        }
        sorted.sort(null);

        var merged = new ArrayList<Interval>(sorted.size());
        Interval current = null;
        for (var next : sorted) {
            if (current == null) {
                current = next;
            } else if (next.start() <= current.end()) {
                current = new Interval(current.start(), Math.max(current.end(), next.end()));
            } else {
                merged.add(current);
                current = next;
            }
        }
        if (current != null) {
            merged.add(current);
        }
        return merged;
    }

    /**
     * The smallest start of any non-empty interval in the collection
     */
    public static OptionalLong minimumStart(Collection<Interval> intervals) {
        return intervals.stream().filter(i -> !i.isEmpty()).mapToLong(Interval::start).min();
    }

    /**
     * Total count of values covered, counting values covered more than once repeatedly
     */
    public static long totalLength(Collection<Interval> intervals) {
        long total = 0;
        for (var interval : intervals) {
            total = Math.addExact(total, interval.length());
        }
        return total;
    }

    private Intervals() {
    }
}
