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

import com.hellblazer.cartograph.atlas.Category;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits an almanac document into tokens. Recognised are the <code>seeds:</code> label, <code>x-to-y map:</code>
 * headers, unsigned decimal numbers and line ends; every other character is skipped, as are words that are neither
 * label nor header.
 *
 * @author hal.hildebrand
 */
public class AlmanacTokenizer {

    public enum Kind {
        MAP, NEWLINE, NUMBER, SEEDS
    }

    public record Token(Kind kind, int line, long number, Category source, Category target) {

        static Token map(int line, Category source, Category target) {
            return new Token(Kind.MAP, line, 0, source, target);
        }

        static Token newline(int line) {
            return new Token(Kind.NEWLINE, line, 0, null, null);
        }

        static Token number(int line, long number) {
            return new Token(Kind.NUMBER, line, number, null, null);
        }

        static Token seeds(int line) {
            return new Token(Kind.SEEDS, line, 0, null, null);
        }

        @Override
        public String toString() {
            return switch (kind) {
                case MAP -> "MAP(" + source + " -> " + target + ")";
                case NUMBER -> "NUMBER(" + number + ")";
                default -> kind.name();
            };
        }
    }

    private static final String MAP_SEPARATOR = "-to-";

    private static boolean isWordPart(char c) {
        return Character.isLetter(c) || c == ' ' || c == '-';
    }

    public List<Token> tokenize(String text) throws AlmanacParseException {
        Objects.requireNonNull(text, "Text cannot be null");
        var tokens = new ArrayList<Token>();
        int line = 1;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c >= 'a' && c <= 'z') {
                int start = i;
                while (i < text.length() && isWordPart(text.charAt(i))) {
                    i++;
                }
                word(text.substring(start, i), line, tokens);
            } else if (c >= '0' && c <= '9') {
                long number = 0;
                while (i < text.length() && Character.isDigit(text.charAt(i))) {
                    try {
                        number = Math.addExact(Math.multiplyExact(number, 10), text.charAt(i) - '0');
                    } catch (ArithmeticException e) {
                        throw new AlmanacParseException(line, "number too large", e);
                    }
                    i++;
                }
                tokens.add(Token.number(line, number));
            } else if (c == '\n') {
                tokens.add(Token.newline(line));
                line++;
                i++;
            } else {
                i++;
            }
        }
        return tokens;
    }

    private void word(String word, int line, List<Token> tokens) throws AlmanacParseException {
        if (word.contains("seeds")) {
            tokens.add(Token.seeds(line));
        } else if (word.contains("map")) {
            var name = word.strip().split(" ")[0];
            int separator = name.indexOf(MAP_SEPARATOR);
            if (separator <= 0 || separator + MAP_SEPARATOR.length() >= name.length()) {
                throw new AlmanacParseException(line, "malformed map header: " + word.strip());
            }
            tokens.add(Token.map(line, Category.of(name.substring(0, separator)),
                                 Category.of(name.substring(separator + MAP_SEPARATOR.length()))));
        }
    }
}
