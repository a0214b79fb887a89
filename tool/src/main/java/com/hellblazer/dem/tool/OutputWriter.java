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

import com.hellblazer.dem.gmrf.GridCell;
import com.hellblazer.dem.gmrf.HeightGrid;
import com.hellblazer.dem.gmrf.validation.ResidualStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3d;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.function.ToDoubleFunction;

/**
 * Writes the text products of a run. Every file name is the output prefix followed by a fixed suffix; the prefix may
 * contain directories, which are created on demand.
 *
 * @author hal.hildebrand
 */
public class OutputWriter {
    public static final String RESIDUALS_NN       = "_chkpt_residuals_NN.txt";
    public static final String RESIDUALS_BI       = "_chkpt_residuals_Bi.txt";
    public static final String RESIDUALS_NN_STATS = "_chkpt_residuals_NN_stats.txt";
    public static final String RESIDUALS_BI_STATS = "_chkpt_residuals_Bi_stats.txt";
    public static final String POINTS_MAP         = "_pts_map.txt";
    public static final String POINTS_CHECKPOINT  = "_pts_chk.txt";
    public static final String GRID_MEAN          = "_grmf_mean.txt";
    public static final String GRID_STDDEV        = "_grmf_stddev.txt";
    public static final String GRID_MEAN_TIFF     = "_grmf_mean.tif";
    public static final String GRID_STDDEV_TIFF   = "_grmf_stddev.tif";
    public static final String GRID_METADATA      = "_grmf_grid.txt";

    private static final Logger log = LoggerFactory.getLogger(OutputWriter.class);

    private final String     prefix;
    private final List<Path> written = new ArrayList<>();

    public OutputWriter(String prefix) {
        this.prefix = prefix;
    }

    /**
     * @return the files written so far, in order
     */
    public List<Path> getWritten() {
        return Collections.unmodifiableList(written);
    }

    public Path path(String suffix) {
        return Path.of(prefix + suffix);
    }

    /**
     * One residual per line.
     */
    public Path writeResiduals(String suffix, double[] residuals) throws IOException {
        return write(suffix, out -> {
            for (var r : residuals) {
                out.println(String.format(Locale.ROOT, "%e", r));
            }
        });
    }

    /**
     * The statistics header followed by a single row.
     */
    public Path writeStats(String suffix, ResidualStats stats) throws IOException {
        return write(suffix, out -> {
            out.println(ResidualStats.HEADER);
            var row = new StringBuilder();
            for (var value : stats.toArray()) {
                if (!row.isEmpty()) {
                    row.append(' ');
                }
                row.append(String.format(Locale.ROOT, "%e", value));
            }
            out.println(row);
        });
    }

    /**
     * {@code x, y, z} rows.
     */
    public Path writePoints(String suffix, List<Point3d> points) throws IOException {
        return write(suffix, out -> {
            for (var p : points) {
                out.println(String.format(Locale.ROOT, "%f, %f, %f", p.x, p.y, p.z));
            }
        });
    }

    /**
     * One grid row per line, starting with the row at minimum Y.
     */
    public Path writeGrid(String suffix, HeightGrid grid, ToDoubleFunction<GridCell> value) throws IOException {
        return write(suffix, out -> {
            for (int row = 0; row < grid.getRows(); row++) {
                var line = new StringBuilder();
                for (int col = 0; col < grid.getCols(); col++) {
                    if (col > 0) {
                        line.append(' ');
                    }
                    line.append(String.format(Locale.ROOT, "%e", value.applyAsDouble(grid.cellAt(row, col))));
                }
                out.println(line);
            }
        });
    }

    /**
     * Extent, resolution and shape of the grid, so the matrices can be georeferenced.
     */
    public Path writeGridMetadata(String suffix, HeightGrid grid) throws IOException {
        var extent = grid.getExtent();
        return write(suffix, out -> {
            out.println("% MIN_X   MAX_X   MIN_Y   MAX_Y   RESOLUTION   ROWS   COLS");
            out.println(String.format(Locale.ROOT, "%f %f %f %f %f %d %d", extent.minX(), extent.maxX(),
                                      extent.minY(), extent.maxY(), grid.getResolution(), grid.getRows(),
                                      grid.getCols()));
        });
    }

    /**
     * Register a file produced elsewhere under this prefix.
     */
    public Path record(Path file) {
        written.add(file);
        return file;
    }

    /**
     * The target of a suffix, with its parent directories created.
     */
    public Path prepare(String suffix) throws IOException {
        var file = path(suffix);
        var parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return file;
    }

    private Path write(String suffix, Content content) throws IOException {
        var file = prepare(suffix);
        try (var out = new PrintWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8))) {
            content.writeTo(out);
            if (out.checkError()) {
                throw new IOException("Error writing " + file);
            }
        }
        log.debug("Wrote {}", file);
        return record(file);
    }

    @FunctionalInterface
    private interface Content {
        void writeTo(PrintWriter out);
    }
}
