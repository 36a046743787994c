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

import com.hellblazer.cartograph.atlas.WalkConfiguration;
import com.hellblazer.cartograph.common.OverlapPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command line entry: <code>AlmanacMain &lt;input-file&gt; [--ranges] [--compatible]</code>
 * <p>
 * Prints the smallest location any seed of the input maps to. <code>--ranges</code> reads the seeds line as
 * <code>start length</code> pairs; <code>--compatible</code> treats intervals sharing only a boundary as overlapping.
 *
 * @author hal.hildebrand
 */
public class AlmanacMain {

    static final int EXIT_FAILURE = 1;
    static final int EXIT_OK      = 0;
    static final int EXIT_USAGE   = 2;

    private static final Logger log = LoggerFactory.getLogger(AlmanacMain.class);

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            usage(err);
            return EXIT_USAGE;
        }
        var mode = SeedMode.INDIVIDUAL;
        var config = new WalkConfiguration.Builder();
        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--ranges" -> mode = SeedMode.RANGES;
                case "--compatible" -> config.withOverlapPolicy(OverlapPolicy.TOUCHING);
                default -> {
                    err.println("Unknown option: " + args[i]);
                    usage(err);
                    return EXIT_USAGE;
                }
            }
        }

        var input = Path.of(args[0]);
        String text;
        try {
            text = Files.readString(input);
        } catch (IOException e) {
            log.error("Could not read {}", input, e);
            err.println("Could not read input file: " + input);
            return EXIT_FAILURE;
        }

        Almanac almanac;
        try {
            almanac = new AlmanacParser(config.build()).parse(text, mode);
        } catch (AlmanacParseException e) {
            err.println("Could not parse input: " + e.getMessage());
            return EXIT_FAILURE;
        }

        var lowest = new LowestLocationSolver().solve(almanac);
        if (lowest.isEmpty()) {
            err.println("Couldn't map any seeds to locations");
            return EXIT_FAILURE;
        }
        out.println("smallest location: " + lowest.getAsLong());
        return EXIT_OK;
    }

    private static void usage(PrintStream err) {
        err.println("usage: AlmanacMain <input-file> [--ranges] [--compatible]");
    }
}
