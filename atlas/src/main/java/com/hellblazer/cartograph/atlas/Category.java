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
 * A named stage of a mapping chain. Names are case sensitive.
 *
 * @author hal.hildebrand
 */
public record Category(String name) {

    public static final Category SEED        = new Category("seed");
    public static final Category SOIL        = new Category("soil");
    public static final Category FERTILIZER  = new Category("fertilizer");
    public static final Category WATER       = new Category("water");
    public static final Category LIGHT       = new Category("light");
    public static final Category TEMPERATURE = new Category("temperature");
    public static final Category HUMIDITY    = new Category("humidity");
    public static final Category LOCATION    = new Category("location");

    public Category {
        Objects.requireNonNull(name, "Category name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Category name cannot be blank");
        }
    }

    public static Category of(String name) {
        return new Category(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
