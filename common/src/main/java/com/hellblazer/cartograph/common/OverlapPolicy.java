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

/**
 * How two half-open intervals that share only a boundary are treated.
 *
 * @author hal.hildebrand
 */
public enum OverlapPolicy {
    /**
     * <code>[a, b)</code> and <code>[b, c)</code> do not overlap, and an empty interval overlaps nothing
     */
    STRICT {
        @Override
        public boolean overlaps(Interval a, Interval b) {
            return a.start() < b.end() && b.start() < a.end();
        }

        @Override
        public boolean reaches(long maxEnd, Interval query) {
            return maxEnd > query.start();
        }
    },
    /**
     * Shared boundaries count as overlapping, producing empty intersections at the seams
     */
    TOUCHING {
        @Override
        public boolean overlaps(Interval a, Interval b) {
            return a.start() <= b.end() && b.start() <= a.end();
        }

        @Override
        public boolean reaches(long maxEnd, Interval query) {
            return maxEnd >= query.start();
        }
    };

    public abstract boolean overlaps(Interval a, Interval b);

    /**
     * Answer whether an interval ending at <code>maxEnd</code> could overlap the query. Used to prune subtrees of an
     * interval index whose largest end falls short of the query.
     */
    public abstract boolean reaches(long maxEnd, Interval query);
}
