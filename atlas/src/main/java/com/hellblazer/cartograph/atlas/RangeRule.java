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

import com.hellblazer.cartograph.common.Interval;

import java.util.Objects;
import java.util.Optional;

/**
 * A translation of one source interval onto a target interval of the same length. Every value in the source is moved
 * by the constant offset <code>target.start - source.start</code>.
 *
 * @author hal.hildebrand
 */
public record RangeRule(Interval source, Interval target) {

    public RangeRule {
        Objects.requireNonNull(source, "Source interval cannot be null");
        Objects.requireNonNull(target, "Target interval cannot be null");
        if (source.length() != target.length()) {
            throw new IllegalArgumentException(
            String.format("Source %s and target %s differ in length", source, target));
        }
    }

    /**
     * Build a rule from a <code>(targetStart, sourceStart, length)</code> triple, the order rule lines are written in
     */
    public static RangeRule fromTriple(long targetStart, long sourceStart, long length) {
        return new RangeRule(Interval.ofLength(sourceStart, length), Interval.ofLength(targetStart, length));
    }

    /**
     * Translate a value of the source interval
     *
     * @throws IllegalArgumentException if the value is not within the source
     */
    public long apply(long value) {
        if (!source.contains(value)) {
            throw new IllegalArgumentException(String.format("%d is not within %s", value, source));
        }
        return target.start() + (value - source.start());
    }

    public long offset() {
        return target.start() - source.start();
    }

    /**
     * Restrict this rule to a sub interval of its source.
     *
     * @param sub - the portion of the source to keep
     * @return the rule mapping <code>sub</code> onto its image in the target, or empty if <code>sub</code> is not
     *         contained in the source
     */
    public Optional<RangeRule> subrangeMap(Interval sub) {
        if (!source.contains(sub)) {
            return Optional.empty();
        }
        long start = target.start() + (sub.start() - source.start());
        return Optional.of(new RangeRule(sub, Interval.ofLength(start, sub.length())));
    }

    @Override
    public String toString() {
        return source + " -> " + target;
    }
}
