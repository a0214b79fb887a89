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
package com.hellblazer.dem.tool;

import com.hellblazer.dem.gmrf.GmrfException.ConfigurationException;
import com.hellblazer.dem.gmrf.GmrfOptions;
import com.hellblazer.dem.gmrf.variance.CholeskyVarianceEstimator;
import com.hellblazer.dem.gmrf.variance.DiagonalVarianceEstimator;
import com.hellblazer.dem.gmrf.variance.ProbingVarianceEstimator;
import com.hellblazer.dem.gmrf.variance.VarianceEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * Command-line argument parser for the elevation model tool.
 *
 * @author hal.hildebrand
 */
public class DemGmrfCommandLine {
    private static final Logger log = LoggerFactory.getLogger(DemGmrfCommandLine.class);

    /**
     * Marginal variance estimators selectable from the command line.
     */
    public enum VarianceMethod {
        DIAGONAL("diagonal", "1 / precision, fast lower bound"),
        PROBING("probing", "randomized diagonal estimate of the inverse"),
        CHOLESKY("cholesky", "exact, small grids only");

        private final String name;
        private final String description;

        VarianceMethod(String name, String description) {
            this.name = name;
            this.description = description;
        }

        public static VarianceMethod fromString(String s) {
            for (var method : values()) {
                if (method.name.equalsIgnoreCase(s)) {
                    return method;
                }
            }
            return null;
        }

        public String getDescription() {
            return description;
        }

        public String getName() {
            return name;
        }
    }

    /**
     * Configuration holder for all command-line options.
     */
    public static class Config {
        public static final String DEFAULT_OUTPUT_PREFIX = "demgmrf_out";

        // Input/Output
        public String inputFile;
        public String outputPrefix = DEFAULT_OUTPUT_PREFIX;

        // Grid
        public double resolution = 1.0;
        public double margin     = 10.0;

        // Model
        public double  stdPrior     = 1.0;
        public double  stdObs       = 0.20;
        public boolean skipVariance = false;

        // Solver
        public VarianceMethod variance      = VarianceMethod.PROBING;
        public int            probes        = ProbingVarianceEstimator.DEFAULT_PROBES;
        public int            maxIterations = GmrfOptions.DEFAULT_MAX_ITERATIONS;
        public double         tolerance     = GmrfOptions.DEFAULT_TOLERANCE;

        // Validation
        public double checkpointRatio = 0.01;
        public Long   seed;

        // General
        public boolean parallel = false;
        public boolean verbose  = false;
        public boolean help     = false;

        final List<String> parseErrors = new ArrayList<>();

        /**
         * Fail with every problem found.
         *
         * @throws ConfigurationException listing the validation errors
         */
        public void checkValid() {
            var errors = getValidationErrors();
            if (!errors.isEmpty()) {
                throw new ConfigurationException(String.join("; ", errors));
            }
        }

        public List<String> getValidationErrors() {
            var errors = new ArrayList<>(parseErrors);
            if (inputFile == null) {
                errors.add("An input dataset is required (--input)");
            }
            if (!(resolution > 0) || Double.isInfinite(resolution)) {
                errors.add("Resolution must be positive: " + resolution);
            }
            if (!(stdPrior > 0)) {
                errors.add("Prior standard deviation must be positive: " + stdPrior);
            }
            if (!(stdObs > 0)) {
                errors.add("Observation standard deviation must be positive: " + stdObs);
            }
            if (!(checkpointRatio >= 0 && checkpointRatio <= 1)) {
                errors.add("Checkpoint ratio must be in [0, 1]: " + checkpointRatio);
            }
            if (!(margin >= 0) || Double.isInfinite(margin)) {
                errors.add("Margin must be non negative: " + margin);
            }
            if (probes < 1) {
                errors.add("Probe count must be positive: " + probes);
            }
            if (maxIterations < 1) {
                errors.add("Max iterations must be positive: " + maxIterations);
            }
            if (!(tolerance > 0 && tolerance < 1)) {
                errors.add("Tolerance must be in (0, 1): " + tolerance);
            }
            return errors;
        }

        public boolean isValid() {
            return getValidationErrors().isEmpty();
        }

        /**
         * Estimator options for this configuration. The prior precision is {@code 1 / stdPrior^2}. The observation
         * scale stays at 1 because every reading carries its own standard deviation, {@link #stdObs} for three column
         * files.
         *
         * @param random source for the probing estimator
         */
        public GmrfOptions toOptions(Random random) {
            return GmrfOptions.builder()
                              .withStdPrior(stdPrior)
                              .withSkipVariance(skipVariance)
                              .withMaxIterations(maxIterations)
                              .withTolerance(tolerance)
                              .withVarianceEstimator(varianceEstimator(random))
                              .build();
        }

        @Override
        public String toString() {
            return String.format(Locale.ROOT,
                                 "Config{input=%s, prefix=%s, resolution=%s, margin=%s, stdPrior=%s, stdObs=%s, "
                                 + "checkpoints=%s, variance=%s, seed=%s}", inputFile, outputPrefix, resolution,
                                 margin, stdPrior, stdObs, checkpointRatio, skipVariance ? "skip" : variance.getName(),
                                 seed);
        }

        private VarianceEstimator varianceEstimator(Random random) {
            return switch (variance) {
                case DIAGONAL -> new DiagonalVarianceEstimator();
                case PROBING -> new ProbingVarianceEstimator(probes, random);
                case CHOLESKY -> new CholeskyVarianceEstimator();
            };
        }
    }

    /**
     * Parse command-line arguments into configuration. Malformed values are recorded as validation errors rather
     * than thrown.
     */
    public static Config parse(String[] args) {
        var config = new Config();
        if (args.length == 0) {
            config.help = true;
            return config;
        }

        for (int i = 0; i < args.length; i++) {
            var arg = args[i];
            switch (arg) {
                case "-i", "--input" -> config.inputFile = value(config, args, i++);
                case "-o", "--output-prefix" -> {
                    var prefix = value(config, args, i++);
                    if (prefix != null) {
                        config.outputPrefix = prefix;
                    }
                }
                case "-r", "--resolution" -> config.resolution = doubleValue(config, args, i++, config.resolution);
                case "-c", "--checkpoint-ratio" -> config.checkpointRatio = doubleValue(config, args, i++,
                                                                                         config.checkpointRatio);
                case "--std-prior" -> config.stdPrior = doubleValue(config, args, i++, config.stdPrior);
                case "--std-obs" -> config.stdObs = doubleValue(config, args, i++, config.stdObs);
                case "--margin" -> config.margin = doubleValue(config, args, i++, config.margin);
                case "--tolerance" -> config.tolerance = doubleValue(config, args, i++, config.tolerance);
                case "--probes" -> config.probes = intValue(config, args, i++, config.probes);
                case "--max-iterations" -> config.maxIterations = intValue(config, args, i++, config.maxIterations);
                case "--seed" -> {
                    var seed = value(config, args, i++);
                    if (seed != null) {
                        try {
                            config.seed = Long.parseLong(seed);
                        } catch (NumberFormatException e) {
                            config.parseErrors.add("Invalid value for --seed: " + seed);
                        }
                    }
                }
                case "--variance" -> {
                    var name = value(config, args, i++);
                    if (name != null) {
                        var method = VarianceMethod.fromString(name);
                        if (method == null) {
                            config.parseErrors.add("Unknown variance method: " + name);
                        } else {
                            config.variance = method;
                        }
                    }
                }
                case "--skip-variance" -> config.skipVariance = true;
                case "--parallel" -> config.parallel = true;
                case "-v", "--verbose" -> config.verbose = true;
                case "-h", "--help" -> config.help = true;
                default -> {
                    if (arg.startsWith("-")) {
                        log.warn("Unknown option: {}", arg);
                    } else {
                        log.warn("Ignoring argument: {}", arg);
                    }
                }
            }
        }
        return config;
    }

    /**
     * Print usage information.
     */
    public static void printUsage(PrintStream out) {
        out.println("dem-gmrf - Digital elevation model from scattered XYZ points");
        out.println();
        out.println("Usage: dem-gmrf -i <points.xyz> [options]");
        out.println();
        out.println("Input/Output:");
        out.println("  -i, --input <file>          Dataset: rows of x y z [stddev], '%' or '#' comments");
        out.println("  -o, --output-prefix <p>     Prefix of every output file (default: demgmrf_out)");
        out.println();
        out.println("Grid:");
        out.println("  -r, --resolution <m>        Cell side length (default: 1.0)");
        out.println("  --margin <m>                Margin added around the data (default: 10.0)");
        out.println();
        out.println("Model:");
        out.println("  --std-prior <m>             Stddev of neighbour height differences (default: 1.0)");
        out.println("  --std-obs <m>               Stddev of readings without their own (default: 0.20)");
        out.println("  --skip-variance             Only estimate the mean surface");
        out.println("  --variance <method>         Marginal variance estimator (default: probing)");
        for (var method : VarianceMethod.values()) {
            out.printf("      %-10s  %s%n", method.getName(), method.getDescription());
        }
        out.println("  --probes <n>                Samples of the probing estimator (default: 16)");
        out.println("  --max-iterations <n>        Conjugate gradient iteration cap (default: 10000)");
        out.println("  --tolerance <f>             Conjugate gradient relative tolerance (default: 1e-9)");
        out.println();
        out.println("Validation:");
        out.println("  -c, --checkpoint-ratio <f>  Fraction of points withheld as checkpoints (default: 0.01)");
        out.println("  --seed <n>                  Seed for the checkpoint shuffle and variance probes");
        out.println();
        out.println("General:");
        out.println("  --parallel                  Insert readings on all processors");
        out.println("  -v, --verbose               Enable verbose output");
        out.println("  -h, --help                  Show this help message");
        out.println();
        out.println("Examples:");
        out.println("  dem-gmrf -i survey.xyz -r 0.5 -o out/survey");
        out.println("  dem-gmrf -i lidar.txt -c 0.05 --seed 42 --variance diagonal");
    }

    /**
     * Validate configuration and print any errors.
     */
    public static boolean validate(Config config, PrintStream out) {
        var errors = config.getValidationErrors();
        if (!errors.isEmpty()) {
            out.println("Configuration errors:");
            for (var error : errors) {
                out.println("  - " + error);
            }
            out.println();
            out.println("Use 'dem-gmrf --help' for usage information.");
            return false;
        }
        return true;
    }

    private static double doubleValue(Config config, String[] args, int i, double current) {
        var value = value(config, args, i);
        if (value == null) {
            return current;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            config.parseErrors.add("Invalid value for %s: %s".formatted(args[i], value));
            return current;
        }
    }

    private static int intValue(Config config, String[] args, int i, int current) {
        var value = value(config, args, i);
        if (value == null) {
            return current;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            config.parseErrors.add("Invalid value for %s: %s".formatted(args[i], value));
            return current;
        }
    }

    /**
     * The argument following the option at {@code i}, or null (recorded as an error) if there is none.
     */
    private static String value(Config config, String[] args, int i) {
        if (i + 1 < args.length) {
            return args[i + 1];
        }
        config.parseErrors.add("Option " + args[i] + " requires a value");
        return null;
    }
}
