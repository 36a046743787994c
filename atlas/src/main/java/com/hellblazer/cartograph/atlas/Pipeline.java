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
import com.hellblazer.cartograph.common.Intervals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * A chain of {@link CategoryMap}s, keyed by source category. Values and intervals are walked from map to map, each
 * hop translating them into the next category, until the requested target category is reached.
 * <p>
 * A walk fails, producing an empty result, when it reaches a category with no outgoing map before the target, or
 * when it returns to a category it has already passed through. A pipeline is immutable once built and may be queried
 * from any number of threads.
 *
 * @author hal.hildebrand
 */
public final class Pipeline {

    public static class Builder {
        private final WalkConfiguration      configuration;
        private final Map<Category, CategoryMap> maps = new LinkedHashMap<>();

        private Builder(WalkConfiguration configuration) {
            this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        }

        /**
         * Build and add the map for the edge, using the configured overlap policy
         */
        public Builder add(Category source, Category target, List<RangeRule> rules) {
            return add(new CategoryMap(source, target, rules, configuration.getOverlapPolicy()));
        }

        /**
         * @throws IllegalArgumentException if a map for the same source category has already been added
         */
        public Builder add(CategoryMap map) {
            Objects.requireNonNull(map, "Category map cannot be null");
            if (maps.containsKey(map.getSourceCategory())) {
                throw new IllegalArgumentException("Duplicate map for source category: " + map.getSourceCategory());
            }
            if (map.getIndex().getPolicy() != configuration.getOverlapPolicy()) {
                log.debug("{} uses overlap policy {}, pipeline default is {}", map, map.getIndex().getPolicy(),
                          configuration.getOverlapPolicy());
            }
            maps.put(map.getSourceCategory(), map);
            return this;
        }

        public Pipeline build() {
            return new Pipeline(maps, configuration);
        }

        public WalkConfiguration getConfiguration() {
            return configuration;
        }
    }

    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    public static Builder builder() {
        return builder(WalkConfiguration.defaultConfig());
    }

    public static Builder builder(WalkConfiguration configuration) {
        return new Builder(configuration);
    }

    /**
     * The smallest value covered by any of the intervals
     */
    public static OptionalLong lowestValue(Collection<Interval> intervals) {
        return Intervals.minimumStart(intervals);
    }

    private final WalkConfiguration          configuration;
    private final Map<Category, CategoryMap> maps;

    private Pipeline(Map<Category, CategoryMap> maps, WalkConfiguration configuration) {
        this.maps = Collections.unmodifiableMap(new LinkedHashMap<>(maps));
        this.configuration = configuration;
    }

    /**
     * @return the source categories with an outgoing map, in the order the maps were added
     */
    public Collection<Category> categories() {
        return maps.keySet();
    }

    public WalkConfiguration getConfiguration() {
        return configuration;
    }

    public Optional<CategoryMap> getMap(Category source) {
        return Optional.ofNullable(maps.get(source));
    }

    /**
     * Translate a value into the target category
     *
     * @return the translated value, or empty if the chain from the value's category does not reach the target
     */
    public Optional<Value> map(Value value, Category target) {
        Objects.requireNonNull(value, "Value cannot be null");
        var route = route(value.category(), target);
        if (route.isEmpty()) {
            return Optional.empty();
        }
        var mapped = Optional.of(value);
        for (var map : route.get()) {
            mapped = mapped.flatMap(map::valueFor);
        }
        return mapped;
    }

    /**
     * Translate an interval of source category values into the target category. The interval is split at every hop
     * wherever a map's rules only partially cover it, so the result may contain many intervals; together they cover
     * exactly as many values as the input.
     *
     * @return the target category intervals, or an empty list if the chain from the source does not reach the target
     */
    public List<Interval> mapRange(Interval interval, Category source, Category target) {
        Objects.requireNonNull(interval, "Interval cannot be null");
        return route(source, target).map(route -> walk(List.of(interval), route)).orElse(List.of());
    }

    /**
     * Translate each of the intervals into the target category, concatenating the results
     *
     * @return the target category intervals, or an empty list if the chain from the source does not reach the target
     */
    public List<Interval> mapRangeAll(Collection<Interval> intervals, Category source, Category target) {
        Objects.requireNonNull(intervals, "Intervals cannot be null");
        var route = route(source, target);
        if (route.isEmpty()) {
            return List.of();
        }
        var result = new ArrayList<Interval>();
        for (var interval : intervals) {
            result.addAll(walk(List.of(interval), route.get()));
        }
        return result;
    }

    /**
     * The maps traversed, in order, walking from the source category to the target category
     *
     * @return the maps of the walk, empty when the source is the target; or empty if the walk dead ends, cycles or
     *         exceeds the configured hop limit
     */
    public Optional<List<CategoryMap>> route(Category source, Category target) {
        Objects.requireNonNull(source, "Source category cannot be null");
        Objects.requireNonNull(target, "Target category cannot be null");
        var route = new ArrayList<CategoryMap>();
        var visited = new HashSet<Category>();
        visited.add(source);
        int maxHops = configuration.effectiveMaxHops(maps.size());
        var current = source;
        while (!current.equals(target)) {
            var map = maps.get(current);
            if (map == null) {
                log.debug("No map from {} while walking {} -> {}", current, source, target);
                return Optional.empty();
            }
            if (route.size() >= maxHops) {
                log.warn("Walk {} -> {} exceeded {} hops at {}", source, target, maxHops, current);
                return Optional.empty();
            }
            current = map.getTargetCategory();
            if (configuration.isDetectCycles() && !visited.add(current)) {
                log.warn("Walk {} -> {} revisits {}", source, target, current);
                return Optional.empty();
            }
            route.add(map);
        }
        return Optional.of(route);
    }

    public int size() {
        return maps.size();
    }

    @Override
    public String toString() {
        return "Pipeline" + maps.values();
    }

    private List<Interval> walk(List<Interval> start, List<CategoryMap> route) {
        var working = start;
        for (var map : route) {
            if (working.isEmpty()) {
                break;
            }
            var next = new ArrayList<Interval>();
            for (var interval : working) {
                next.addAll(map.rangesFor(interval));
            }
            if (log.isTraceEnabled()) {
                log.trace("{} -> {}: {} to {}", map.getSourceCategory(), map.getTargetCategory(), working, next);
            } else {
                log.debug("{} -> {}: {} intervals to {}", map.getSourceCategory(), map.getTargetCategory(),
                          working.size(), next.size());
            }
            working = next;
        }
        return working;
    }
}
