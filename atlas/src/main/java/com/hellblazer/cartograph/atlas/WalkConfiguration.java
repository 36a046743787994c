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

import com.hellblazer.cartograph.common.OverlapPolicy;

import java.util.Objects;

/**
 * Configuration for walks through a {@link Pipeline}.
 *
 * @author hal.hildebrand
 */
public final class WalkConfiguration {

    public static class Builder {
        private boolean       detectCycles  = true;
        private int           maxHops       = 0;
        private OverlapPolicy overlapPolicy = OverlapPolicy.STRICT;

        public WalkConfiguration build() {
            return new WalkConfiguration(this);
        }

        /**
         * Whether a walk that returns to a category it has already visited fails immediately
         */
        public Builder withCycleDetection(boolean detect) {
            this.detectCycles = detect;
            return this;
        }

        /**
         * Upper bound on the number of maps a single walk may traverse. Zero derives the bound from the number of
         * registered maps.
         */
        public Builder withMaxHops(int hops) {
            if (hops < 0) {
                throw new IllegalArgumentException("Max hops cannot be negative: " + hops);
            }
            this.maxHops = hops;
            return this;
        }

        public Builder withOverlapPolicy(OverlapPolicy policy) {
            this.overlapPolicy = Objects.requireNonNull(policy, "Overlap policy cannot be null");
            return this;
        }
    }

    /**
     * Shared boundaries count as overlaps, reproducing the boundary handling of earlier almanac solvers
     */
    public static WalkConfiguration compatibleConfig() {
        return new Builder().withOverlapPolicy(OverlapPolicy.TOUCHING).build();
    }

    public static WalkConfiguration defaultConfig() {
        return new Builder().build();
    }

    private final boolean       detectCycles;
    private final int           maxHops;
    private final OverlapPolicy overlapPolicy;

    private WalkConfiguration(Builder builder) {
        this.detectCycles = builder.detectCycles;
        this.maxHops = builder.maxHops;
        this.overlapPolicy = builder.overlapPolicy;
    }

    /**
     * @param registeredMaps - the number of maps in the pipeline being walked
     * @return the effective hop limit for a walk
     */
    public int effectiveMaxHops(int registeredMaps) {
        return maxHops > 0 ? maxHops : registeredMaps + 1;
    }

    public int getMaxHops() {
        return maxHops;
    }

    public OverlapPolicy getOverlapPolicy() {
        return overlapPolicy;
    }

    public boolean isDetectCycles() {
        return detectCycles;
    }

    @Override
    public String toString() {
        return String.format("WalkConfiguration[overlap=%s, detectCycles=%s, maxHops=%d]", overlapPolicy,
                             detectCycles, maxHops);
    }
}
