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
import com.hellblazer.cartograph.common.OverlapPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The translation table for one edge of a mapping chain, from a source category to a target category. Numbers not
 * covered by any rule pass through unchanged.
 * <p>
 * The rules are kept twice: as the ordered list they were given in, scanned for scalar lookups, and as an
 * {@link IntervalIndex} answering range queries. Both are built once and never modified.
 *
 * @author hal.hildebrand
 */
public final class CategoryMap {

    public static class Builder {
        private OverlapPolicy         policy = OverlapPolicy.STRICT;
        private final List<RangeRule> rules  = new ArrayList<>();
        private final Category        source;
        private final Category        target;

        private Builder(Category source, Category target) {
            this.source = source;
            this.target = target;
        }

        public Builder addRule(RangeRule rule) {
            rules.add(Objects.requireNonNull(rule, "Rule cannot be null"));
            return this;
        }

        /**
         * Add the rule described by a <code>(targetStart, sourceStart, length)</code> triple
         */
        public Builder addTriple(long targetStart, long sourceStart, long length) {
            return addRule(RangeRule.fromTriple(targetStart, sourceStart, length));
        }

        public CategoryMap build() {
            return new CategoryMap(source, target, rules, policy);
        }

        public Builder withOverlapPolicy(OverlapPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "Overlap policy cannot be null");
            return this;
        }
    }

    private static final Logger log = LoggerFactory.getLogger(CategoryMap.class);

    public static Builder builder(Category source, Category target) {
        return new Builder(source, target);
    }

    private final IntervalIndex   index;
    private final List<RangeRule> rules;
    private final Category        sourceCategory;
    private final Category        targetCategory;

    public CategoryMap(Category sourceCategory, Category targetCategory, List<RangeRule> rules) {
        this(sourceCategory, targetCategory, rules, OverlapPolicy.STRICT);
    }

    public CategoryMap(Category sourceCategory, Category targetCategory, List<RangeRule> rules,
                       OverlapPolicy policy) {
        this.sourceCategory = Objects.requireNonNull(sourceCategory, "Source category cannot be null");
        this.targetCategory = Objects.requireNonNull(targetCategory, "Target category cannot be null");
        this.rules = List.copyOf(Objects.requireNonNull(rules, "Rules cannot be null"));
        this.index = IntervalIndex.of(this.rules, policy);
        warnOnOverlappingRules();
    }

    public IntervalIndex getIndex() {
        return index;
    }

    public List<RangeRule> getRules() {
        return rules;
    }

    public Category getSourceCategory() {
        return sourceCategory;
    }

    public Category getTargetCategory() {
        return targetCategory;
    }

    /**
     * Translate a source category interval into the target category. The result covers exactly as many values as the
     * query: portions matched by a rule are shifted by that rule's offset, the gaps between them are carried over
     * unchanged.
     *
     * @param query - the interval, in source category values
     * @return the target category intervals, in ascending order of the source values they came from
     */
    public List<Interval> rangesFor(Interval query) {
        Objects.requireNonNull(query, "Query cannot be null");
        var ranges = new ArrayList<Interval>();
        if (query.isEmpty()) {
            return ranges;
        }
        var matches = index.findIntersections(query);
        matches.sort(Comparator.comparing(RangeRule::source));

        long cursor = query.start();
        for (var match : matches) {
            if (cursor < match.source().start()) {
                ranges.add(new Interval(cursor, match.source().start()));
            }
            ranges.add(match.target());
            cursor = Math.max(cursor, match.source().end());
        }
        if (cursor < query.end()) {
            ranges.add(new Interval(cursor, query.end()));
        }
        return ranges;
    }

    @Override
    public String toString() {
        return String.format("CategoryMap[%s -> %s, rules=%d]", sourceCategory, targetCategory, rules.size());
    }

    /**
     * Translate a single value into the target category. The first rule, in input order, containing the number
     * applies; a number no rule contains keeps its value.
     *
     * @return the translated value, or empty if the value is not in this map's source category
     */
    public Optional<Value> valueFor(Value value) {
        Objects.requireNonNull(value, "Value cannot be null");
        if (!value.category().equals(sourceCategory)) {
            return Optional.empty();
        }
        for (var rule : rules) {
            if (rule.source().contains(value.number())) {
                return Optional.of(new Value(targetCategory, rule.apply(value.number())));
            }
        }
        return Optional.of(new Value(targetCategory, value.number()));
    }

    private void warnOnOverlappingRules() {
        RangeRule previous = null;
        for (var rule : index.rules()) {
            if (previous != null && previous.source().overlaps(rule.source())) {
                log.warn("{} -> {} rules overlap: {} and {}", sourceCategory, targetCategory, previous, rule);
            }
            if (previous == null || rule.source().end() > previous.source().end()) {
                previous = rule;
            }
        }
    }
}
