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

import com.hellblazer.dem.geometry.BoundingBox;
import com.hellblazer.dem.gmrf.GmrfException.ConfigurationException;
import com.hellblazer.dem.gmrf.GmrfException.InputException;
import com.hellblazer.dem.gmrf.GmrfHeightMap;
import com.hellblazer.dem.gmrf.GridCell;
import com.hellblazer.dem.gmrf.Observation;
import com.hellblazer.dem.gmrf.validation.Checkpoint;
import com.hellblazer.dem.gmrf.validation.CheckpointSplitter;
import com.hellblazer.dem.gmrf.validation.ResidualStats;
import com.hellblazer.dem.gmrf.validation.ValidationHarness;
import com.hellblazer.dem.gmrf.validation.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3d;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

/**
 * Runs the elevation model pipeline over a point file.
 *
 * <p>Phases:
 * <ol>
 *   <li>Load the dataset</li>
 *   <li>Bounding box and Z range</li>
 *   <li>Withhold checkpoints</li>
 *   <li>Initialize the grid</li>
 *   <li>Insert readings</li>
 *   <li>GMRF update</li>
 *   <li>Evaluate checkpoints</li>
 *   <li>Write outputs</li>
 * </ol>
 * Each phase is timed. Rejected readings are reported, never fatal.
 *
 * @author hal.hildebrand
 */
public class DemGmrfApplication {
    private static final Logger log = LoggerFactory.getLogger(DemGmrfApplication.class);

    private final DemGmrfCommandLine.Config config;
    private final PrintStream               out;
    private final Map<String, Duration>     timings = new LinkedHashMap<>();
    private       ValidationReport          validation;

    public DemGmrfApplication(DemGmrfCommandLine.Config config) {
        this(config, System.out);
    }

    public DemGmrfApplication(DemGmrfCommandLine.Config config, PrintStream out) {
        this.config = config;
        this.out = out;
    }

    public static void main(String[] args) {
        var config = DemGmrfCommandLine.parse(args);
        if (config.help) {
            DemGmrfCommandLine.printUsage(System.out);
            return;
        }
        if (!DemGmrfCommandLine.validate(config, System.err)) {
            System.exit(1);
        }
        System.exit(run(config));
    }

    public static int run(DemGmrfCommandLine.Config config) {
        return new DemGmrfApplication(config).execute();
    }

    private static String format(ResidualStats stats) {
        var row = new StringBuilder();
        for (var value : stats.toArray()) {
            row.append(String.format(Locale.ROOT, "%12.6f", value));
        }
        return row.toString();
    }

    /**
     * Readings of the selected rows. A reading's standard deviation is its fourth column, or {@code stdObs} when the
     * file has three columns; it alone sets the reading's precision.
     */
    static List<Observation> observationsOf(XyzDataset dataset, int[] indices, double stdObs) {
        var observations = new ArrayList<Observation>(indices.length);
        for (var index : indices) {
            observations.add(Observation.of(dataset.points().get(index), dataset.stddev(index, stdObs)));
        }
        return observations;
    }

    private static List<Point3d> select(List<Point3d> points, int[] indices) {
        var selected = new ArrayList<Point3d>(indices.length);
        for (var index : indices) {
            selected.add(points.get(index));
        }
        return selected;
    }

    /**
     * @return wall time of each completed phase, in execution order
     */
    public Map<String, Duration> getTimings() {
        return Collections.unmodifiableMap(timings);
    }

    /**
     * @return the checkpoint evaluation of the last run, null if no checkpoints were withheld
     */
    public ValidationReport getValidation() {
        return validation;
    }

    /**
     * Execute the pipeline.
     *
     * @return process exit code: 0 on success, 1 on invalid configuration, bad input or an output failure
     */
    public int execute() {
        try {
            config.checkValid();
            log.info("Configuration: {}", config);
            var random = config.seed == null ? new Random() : new Random(config.seed);
            printHeader();

            // Phase 1: load
            var start = phase(1, "Loading dataset");
            var dataset = XyzDatasetReader.read(Path.of(config.inputFile));
            progress("Points: " + dataset.size());
            progress(dataset.hasPerPointStddev() ? "Per point standard deviations from column 4"
                                                 : "Standard deviation of every reading: " + config.stdObs);
            done("load", start);

            // Phase 2: bounding box
            start = phase(2, "Bounding box");
            var bbox = BoundingBox.enclosing(dataset.points());
            progress("Data: " + bbox);
            progress(String.format(Locale.ROOT, "Z range: %.3f <-> %.3f", dataset.minZ(), dataset.maxZ()));
            done("bounding box", start);

            // Phase 3: checkpoints
            start = phase(3, "Withholding checkpoints");
            var split = new CheckpointSplitter(random).split(dataset.size(), config.checkpointRatio);
            var inserted = select(dataset.points(), split.inserted());
            var checkpoints = select(dataset.points(), split.checkpoints());
            progress("Map points: " + inserted.size());
            progress("Checkpoints: " + checkpoints.size());
            done("checkpoints", start);

            // Phase 4: grid
            start = phase(4, "Initializing grid");
            var options = config.toOptions(new Random(random.nextLong()));
            var map = new GmrfHeightMap(bbox.expand(config.margin), config.resolution, options);
            var grid = map.getGrid();
            progress(String.format("Grid: %d x %d cells (%d unknowns) at resolution %s", grid.getCols(),
                                   grid.getRows(), grid.size(), config.resolution));
            progress("Extent: " + grid.getExtent());
            if (config.verbose) {
                progress("Options: " + options);
            }
            done("grid", start);

            // Phase 5: insert
            start = phase(5, "Inserting readings");
            var observations = observationsOf(dataset, split.inserted(), config.stdObs);
            var insertion = config.parallel ? map.insertAll(observations, Runtime.getRuntime().availableProcessors())
                                            : map.insertAll(observations);
            progress("Inserted: " + insertion.inserted());
            if (insertion.rejected() > 0) {
                progress("Rejected: " + insertion.rejected());
                log.warn("{} readings rejected", insertion.rejected());
                if (config.verbose) {
                    insertion.rejections().forEach(e -> progress("  " + e.getMessage()));
                }
            }
            done("insert", start);

            // Phase 6: solve
            start = phase(6, "GMRF update");
            var report = map.update();
            progress(String.format(Locale.ROOT, "Iterations: %d, relative residual %.3e", report.iterations(),
                                   report.relativeResidual()));
            report.warning().ifPresent(warning -> progress("WARNING: " + warning.message()));
            progress(report.varianceEstimated() ? "Variance: " + options.getVarianceEstimator().name()
                                                : "Variance: skipped");
            done("update", start);

            // Phase 7: evaluate
            validation = null;
            if (!checkpoints.isEmpty()) {
                start = phase(7, "Evaluating checkpoints");
                validation = new ValidationHarness(map.getPredictor()).evaluate(
                checkpoints.stream().map(Checkpoint::of).toList());
                progress(ResidualStats.HEADER);
                progress("NN " + format(validation.nearestStats()));
                progress("Bi " + format(validation.bilinearStats()));
                if (validation.outOfBounds() > 0) {
                    progress("Outside the grid: " + validation.outOfBounds());
                }
                done("evaluate", start);
            }

            // Phase 9: outputs
            start = phase(9, "Writing outputs");
            var writer = new OutputWriter(config.outputPrefix);
            if (validation != null) {
                writer.writeResiduals(OutputWriter.RESIDUALS_NN, validation.nearestResiduals());
                writer.writeResiduals(OutputWriter.RESIDUALS_BI, validation.bilinearResiduals());
                writer.writeStats(OutputWriter.RESIDUALS_NN_STATS, validation.nearestStats());
                writer.writeStats(OutputWriter.RESIDUALS_BI_STATS, validation.bilinearStats());
            }
            writer.writePoints(OutputWriter.POINTS_MAP, inserted);
            writer.writePoints(OutputWriter.POINTS_CHECKPOINT, checkpoints);
            writer.writeGridMetadata(OutputWriter.GRID_METADATA, grid);
            writer.writeGrid(OutputWriter.GRID_MEAN, grid, GridCell::getMean);
            GeoTiffRasterWriter.write(writer.prepare(OutputWriter.GRID_MEAN_TIFF), grid, GridCell::getMean);
            writer.record(writer.path(OutputWriter.GRID_MEAN_TIFF));
            if (report.varianceEstimated()) {
                writer.writeGrid(OutputWriter.GRID_STDDEV, grid, GridCell::getStdDev);
                GeoTiffRasterWriter.write(writer.prepare(OutputWriter.GRID_STDDEV_TIFF), grid, GridCell::getStdDev);
                writer.record(writer.path(OutputWriter.GRID_STDDEV_TIFF));
            }
            writer.getWritten().forEach(file -> progress("Wrote " + file));
            done("outputs", start);

            printFooter(true);
            return 0;
        } catch (InputException | ConfigurationException e) {
            error(e.getMessage());
            log.error("Run failed: {}", e.getMessage());
            printFooter(false);
            return 1;
        } catch (RuntimeException e) {
            error(e.getMessage());
            log.error("Run failed", e);
            printFooter(false);
            return 1;
        } catch (IOException e) {
            error("Cannot write outputs: " + e.getMessage());
            log.error("Output failed", e);
            printFooter(false);
            return 1;
        }
    }

    private void done(String name, long start) {
        var elapsed = Duration.ofNanos(System.nanoTime() - start);
        timings.put(name, elapsed);
        log.info("Phase {} done in {} ms", name, elapsed.toMillis());
        if (config.verbose) {
            progress(String.format(Locale.ROOT, "Done in %.2f ms", elapsed.toNanos() / 1_000_000.0));
        }
    }

    private void error(String message) {
        out.println("  ERROR: " + message);
    }

    private long phase(int number, String name) {
        out.println();
        out.println("[" + number + "] " + name);
        out.println("-".repeat(62));
        return System.nanoTime();
    }

    private void printFooter(boolean success) {
        out.println();
        out.println(success ? "Done." : "Failed.");
    }

    private void printHeader() {
        out.println("dem-gmrf: " + config.inputFile + " -> " + config.outputPrefix + "*");
    }

    private void progress(String message) {
        out.println("  " + message);
    }
}
