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

import com.hellblazer.cartograph.almanac.AlmanacTokenizer.Kind;
import com.hellblazer.cartograph.almanac.AlmanacTokenizer.Token;
import com.hellblazer.cartograph.atlas.CategoryMap;
import com.hellblazer.cartograph.atlas.Pipeline;
import com.hellblazer.cartograph.atlas.WalkConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses almanac documents. A document has one <code>seeds:</code> line followed by map blocks, each a
 * <code>x-to-y map:</code> header and lines of <code>targetStart sourceStart length</code> rules:
 *
 * <pre>
 * seeds: 79 14 55 13
 *
 * seed-to-soil map:
 * 50 98 2
 * 52 50 48
 * </pre>
 *
 * @author hal.hildebrand
 */
public class AlmanacParser {

    private static final Logger log = LoggerFactory.getLogger(AlmanacParser.class);

    private final WalkConfiguration configuration;
    private final AlmanacTokenizer  tokenizer = new AlmanacTokenizer();

    public AlmanacParser() {
        this(WalkConfiguration.defaultConfig());
    }

    public AlmanacParser(WalkConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
    }

    public Almanac parse(String text, SeedMode mode) throws AlmanacParseException {
        Objects.requireNonNull(mode, "Seed mode cannot be null");
        var tokens = tokenizer.tokenize(text);
        var builder = Pipeline.builder(configuration);
        List<Long> seeds = null;
        int seedsLine = 0;
        int maps = 0;

        int i = 0;
        while (i < tokens.size()) {
            var token = tokens.get(i);
            switch (token.kind()) {
                case SEEDS -> {
                    if (seeds != null) {
                        throw new AlmanacParseException(token.line(), "duplicate seeds line");
                    }
                    seeds = new ArrayList<>();
                    seedsLine = token.line();
                    i++;
                    while (i < tokens.size() && tokens.get(i).kind() == Kind.NUMBER) {
                        seeds.add(tokens.get(i++).number());
                    }
                }
                case MAP -> {
                    i = parseMap(tokens, i, builder);
                    maps++;
                }
                case NEWLINE -> i++;
                case NUMBER -> throw new AlmanacParseException(token.line(),
                                                               "number outside of seeds line or map: " + token.number());
            }
        }

        if (seeds == null) {
            throw new AlmanacParseException(0, "missing seeds line");
        }
        if (maps == 0) {
            throw new AlmanacParseException(0, "no category maps");
        }
        if (mode == SeedMode.RANGES && seeds.size() % 2 != 0) {
            throw new AlmanacParseException(seedsLine,
                                            "seed ranges need an even count of numbers, found " + seeds.size());
        }
        try {
            mode.intervals(seeds);
        } catch (IllegalArgumentException e) {
            throw new AlmanacParseException(seedsLine, e.getMessage(), e);
        }
        var almanac = new Almanac(seeds, mode, builder.build());
        log.debug("Parsed {}", almanac);
        return almanac;
    }

    private int parseMap(List<Token> tokens, int i, Pipeline.Builder pipeline) throws AlmanacParseException {
        var header = tokens.get(i++);
        var numbers = new ArrayList<Token>();
        while (i < tokens.size()) {
            var token = tokens.get(i);
            if (token.kind() == Kind.NUMBER) {
                numbers.add(token);
            } else if (token.kind() != Kind.NEWLINE) {
                break;
            }
            i++;
        }
        if (numbers.size() % 3 != 0) {
            throw new AlmanacParseException(header.line(),
                                            String.format("%s-to-%s map has an incomplete rule", header.source(),
                                                          header.target()));
        }

        var map = CategoryMap.builder(header.source(), header.target())
                             .withOverlapPolicy(configuration.getOverlapPolicy());
        for (int r = 0; r < numbers.size(); r += 3) {
            try {
                map.addTriple(numbers.get(r).number(), numbers.get(r + 1).number(), numbers.get(r + 2).number());
            } catch (IllegalArgumentException e) {
                throw new AlmanacParseException(numbers.get(r).line(), e.getMessage(), e);
            }
        }
        try {
            pipeline.add(map.build());
        } catch (IllegalArgumentException e) {
            throw new AlmanacParseException(header.line(), e.getMessage(), e);
        }
        return i;
    }
}
