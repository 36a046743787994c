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

import java.util.Objects;

/**
 * A number tagged with the category it is expressed in
 *
 * @author hal.hildebrand
 */
public record Value(Category category, long number) {

    public Value {
        Objects.requireNonNull(category, "Category cannot be null");
        if (number < 0) {
            throw new IllegalArgumentException("Number cannot be negative: " + number);
        }
    }

    public static Value of(Category category, long number) {
        return new Value(category, number);
    }

    @Override
    public String toString() {
        return category + "=" + number;
    }
}
