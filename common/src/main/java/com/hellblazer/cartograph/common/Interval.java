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

import java.util.Objects;
import java.util.Optional;

/**
 * A half-open range <code>[start, end)</code> of non-negative longs.
 *
 * The range contains <code>start</code> but not <code>end</code>, so an interval with <code>start == end</code> is
 * legal and empty. Values are limited to <code>[0, Long.MAX_VALUE]</code>.
 *
 * @author hal.hildebrand
 */
public record Interval(long start, long end) implements Comparable<Interval> {

    public Interval {
        if (start < 0) {
            throw new IllegalArgumentException("Start cannot be negative: " + start);
        }
        if (end < start) {
            throw new IllegalArgumentException(
            String.format("End %d cannot be less than start %d", end, start));
        }
    }

    public static Interval of(long start, long end) {
        return new Interval(start, end);
    }

    /**
     * Create the interval <code>[start, start + length)</code>.
     *
     * @throws IllegalArgumentException if the length is negative or the end overflows
     */
    public static Interval ofLength(long start, long length) {
        if (length < 0) {
            throw new IllegalArgumentException("Length cannot be negative: " + length);
        }
        try {
            return new Interval(start, Math.addExact(start, length));
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(
            String.format("Interval starting at %d with length %d overflows", start, length), e);
        }
    }

    /**
     * The interval containing only the given value
     */
    public static Interval point(long value) {
        return ofLength(value, 1);
    }

    @Override
    public int compareTo(Interval o) {
        int c = Long.compare(start, o.start);
        return c != 0 ? c : Long.compare(end, o.end);
    }

    public boolean contains(long value) {
        return start <= value && value < end;
    }

    /**
     * @return true if every value of the other interval lies within this one
     */
    public boolean contains(Interval other) {
        Objects.requireNonNull(other, "Other interval cannot be null");
        return start <= other.start && end >= other.end;
    }

    /**
     * Intersect with the other interval, if the two overlap under the given policy
     */
    public Optional<Interval> intersect(Interval other, OverlapPolicy policy) {
        if (!overlaps(other, policy)) {
            return Optional.empty();
        }
        return Optional.of(new Interval(Math.max(start, other.start), Math.min(end, other.end)));
    }

    public Optional<Interval> intersect(Interval other) {
        return intersect(other, OverlapPolicy.STRICT);
    }

    public boolean isEmpty() {
        return start == end;
    }

    public long length() {
        return end - start;
    }

    public boolean overlaps(Interval other) {
        return overlaps(other, OverlapPolicy.STRICT);
    }

    public boolean overlaps(Interval other, OverlapPolicy policy) {
        Objects.requireNonNull(other, "Other interval cannot be null");
        Objects.requireNonNull(policy, "Overlap policy cannot be null");
        return policy.overlaps(this, other);
    }

    /**
     * Translate both ends by the signed offset
     *
     * @throws IllegalArgumentException if the result would be negative or overflow
     */
    public Interval shift(long offset) {
        try {
            return new Interval(Math.addExact(start, offset), Math.addExact(end, offset));
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(String.format("Shifting %s by %d overflows", this, offset), e);
        }
    }

    @Override
    public String toString() {
        return "[" + start + ".." + end + ")";
    }
}
