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
import com.hellblazer.dem.gmrf.variance.CholeskyVarianceEstimator;
import com.hellblazer.dem.gmrf.variance.ProbingVarianceEstimator;
import com.hellblazer.dem.tool.DemGmrfCommandLine.VarianceMethod;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DemGmrfCommandLine argument parsing.
 *
 * @author hal.hildebrand
 */
class DemGmrfCommandLineTest {

    @Test
    void testNoArgumentsShowsHelp() {
        var config = DemGmrfCommandLine.parse(new String[] {});
        assertTrue(config.help);
    }

    @Test
    void testDefaults() {
        var config = DemGmrfCommandLine.parse(new String[] { "-i", "points.xyz" });

        assertFalse(config.help);
        assertEquals("points.xyz", config.inputFile);
        assertEquals("demgmrf_out", config.outputPrefix);
        assertEquals(1.0, config.resolution);
        assertEquals(0.01, config.checkpointRatio);
        assertEquals(1.0, config.stdPrior);
        assertEquals(0.20, config.stdObs);
        assertEquals(10.0, config.margin);
        assertEquals(VarianceMethod.PROBING, config.variance);
        assertEquals(16, config.probes);
        assertEquals(10_000, config.maxIterations);
        assertEquals(1e-9, config.tolerance);
        assertNull(config.seed);
        assertFalse(config.skipVariance);
        assertFalse(config.parallel);
        assertTrue(config.isValid());
    }

    @Test
    void testAllOptions() {
        var config = DemGmrfCommandLine.parse(
        new String[] { "--input", "in.txt", "-r", "0.5", "-o", "out/run", "-c", "0.1", "--std-prior", "2",
                       "--std-obs", "0.05", "--skip-variance", "--margin", "0", "--seed", "42", "--variance",
                       "Cholesky", "--probes", "4", "--max-iterations", "50", "--tolerance", "1e-6", "--parallel",
                       "-v" });

        assertEquals("in.txt", config.inputFile);
        assertEquals(0.5, config.resolution);
        assertEquals("out/run", config.outputPrefix);
        assertEquals(0.1, config.checkpointRatio);
        assertEquals(2.0, config.stdPrior);
        assertEquals(0.05, config.stdObs);
        assertTrue(config.skipVariance);
        assertEquals(0.0, config.margin);
        assertEquals(42L, config.seed);
        assertEquals(VarianceMethod.CHOLESKY, config.variance);
        assertEquals(4, config.probes);
        assertEquals(50, config.maxIterations);
        assertEquals(1e-6, config.tolerance);
        assertTrue(config.parallel);
        assertTrue(config.verbose);
        assertTrue(config.isValid(), config.getValidationErrors().toString());
    }

    @Test
    void testHelpFlag() {
        assertTrue(DemGmrfCommandLine.parse(new String[] { "-i", "x", "--help" }).help);
        assertTrue(DemGmrfCommandLine.parse(new String[] { "-h" }).help);
    }

    @Test
    void testMissingInput() {
        var config = DemGmrfCommandLine.parse(new String[] { "-r", "2" });

        assertFalse(config.isValid());
        assertTrue(config.getValidationErrors().get(0).contains("--input"));
        assertThrows(ConfigurationException.class, config::checkValid);
    }

    @Test
    void testOutOfRangeValues() {
        var config = DemGmrfCommandLine.parse(
        new String[] { "-i", "x", "-r", "0", "--std-prior", "-1", "--std-obs", "0", "-c", "1.5", "--margin", "-2",
                       "--probes", "0", "--max-iterations", "0", "--tolerance", "0" });

        assertEquals(8, config.getValidationErrors().size(), config.getValidationErrors().toString());
        var e = assertThrows(ConfigurationException.class, config::checkValid);
        assertTrue(e.getMessage().contains("Resolution"));
    }

    @Test
    void testMalformedValues() {
        var config = DemGmrfCommandLine.parse(
        new String[] { "-i", "x", "-r", "fine", "--seed", "abc", "--variance", "exactish", "--probes" });

        var errors = config.getValidationErrors();
        assertEquals(4, errors.size(), errors.toString());
        assertEquals(1.0, config.resolution, "previous value kept");
        assertEquals(VarianceMethod.PROBING, config.variance);
    }

    @Test
    void testOptionsUseInverseSquaredPriorStddev() {
        var config = DemGmrfCommandLine.parse(new String[] { "-i", "x", "--std-prior", "0.5", "--std-obs", "0.2" });
        var options = config.toOptions(new Random(1));

        assertEquals(4.0, options.getLambdaPrior(), 1e-12);
        assertEquals(1.0, options.getLambdaObs(), "reading stddevs carry the observation noise");
        assertInstanceOf(ProbingVarianceEstimator.class, options.getVarianceEstimator());
        assertEquals(16, ((ProbingVarianceEstimator) options.getVarianceEstimator()).getProbes());

        config.variance = VarianceMethod.CHOLESKY;
        assertInstanceOf(CholeskyVarianceEstimator.class, config.toOptions(new Random(1)).getVarianceEstimator());
    }

    @Test
    void testValidatePrintsErrors() {
        var buffer = new ByteArrayOutputStream();
        var config = DemGmrfCommandLine.parse(new String[] { "-c", "-1" });

        assertFalse(DemGmrfCommandLine.validate(config, new PrintStream(buffer, true)));
        var printed = buffer.toString();
        assertTrue(printed.contains("Configuration errors"));
        assertTrue(printed.contains("Checkpoint ratio"));
    }

    @Test
    void testUsage() {
        var buffer = new ByteArrayOutputStream();
        DemGmrfCommandLine.printUsage(new PrintStream(buffer, true));

        var usage = buffer.toString();
        for (var option : new String[] { "--input", "--resolution", "--output-prefix", "--checkpoint-ratio",
                                         "--std-prior", "--std-obs", "--skip-variance", "--variance", "cholesky" }) {
            assertTrue(usage.contains(option), option);
        }
    }
}
