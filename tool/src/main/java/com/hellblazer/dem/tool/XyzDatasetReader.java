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

import com.hellblazer.dem.gmrf.GmrfException.InputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3d;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.regex.Pattern;

/**
 * Reads whitespace or comma separated point files.
 * <p>
 * Blank lines and lines starting with {@code %} or {@code #} are skipped. Every data row must have the same number of
 * columns, at least three: {@code x y z}. A fourth column is the reading's standard deviation; further columns are
 * ignored. Heights at or beyond {@link #NO_DATA_Z} in magnitude are kept as readings but excluded from the reported Z
 * range.
 *
 * @author hal.hildebrand
 */
public class XyzDatasetReader {
    public static final double NO_DATA_Z = 1e6;

    private static final Logger  log       = LoggerFactory.getLogger(XyzDatasetReader.class);
    private static final Pattern DELIMITER = Pattern.compile("[\\s,]+");

    private XyzDatasetReader() {
    }

    /**
     * @throws InputException if the file is missing, unreadable or malformed
     */
    public static XyzDataset read(Path path) {
        try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        } catch (NoSuchFileException e) {
            throw new InputException("Dataset not found: " + path, e);
        } catch (IOException e) {
            throw new InputException("Cannot read dataset " + path + ": " + e.getMessage(), e);
        }
    }

    static XyzDataset read(BufferedReader reader, String source) throws IOException {
        var points = new ArrayList<Point3d>();
        var stddevs = new ArrayList<Double>();
        var columns = -1;
        var minZ = Double.POSITIVE_INFINITY;
        var maxZ = Double.NEGATIVE_INFINITY;

        String line;
        var lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            var trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("%") || trimmed.startsWith("#")) {
                continue;
            }
            var tokens = DELIMITER.split(trimmed);
            if (columns < 0) {
                columns = tokens.length;
                if (columns < 3) {
                    throw new InputException(
                    "%s:%d: expected at least 3 columns (x y z), found %d".formatted(source, lineNumber, columns));
                }
            } else if (tokens.length != columns) {
                throw new InputException(
                "%s:%d: expected %d columns, found %d".formatted(source, lineNumber, columns, tokens.length));
            }

            var x = parse(tokens[0], source, lineNumber);
            var y = parse(tokens[1], source, lineNumber);
            var z = parse(tokens[2], source, lineNumber);
            if (!Double.isFinite(x) || !Double.isFinite(y)) {
                throw new InputException("%s:%d: coordinates must be finite".formatted(source, lineNumber));
            }
            points.add(new Point3d(x, y, z));
            if (columns > 3) {
                stddevs.add(parse(tokens[3], source, lineNumber));
            }
            if (Math.abs(z) < NO_DATA_Z) {
                minZ = Math.min(minZ, z);
                maxZ = Math.max(maxZ, z);
            }
        }
        if (points.isEmpty()) {
            throw new InputException("No points in dataset " + source);
        }

        double[] perPoint = null;
        if (columns > 3) {
            perPoint = stddevs.stream().mapToDouble(Double::doubleValue).toArray();
        }
        if (minZ > maxZ) {
            minZ = Double.NaN;
            maxZ = Double.NaN;
        }
        log.debug("Read {} points with {} columns from {}", points.size(), columns, source);
        return new XyzDataset(points, perPoint, columns, minZ, maxZ);
    }

    private static double parse(String token, String source, int lineNumber) {
        try {
            return Double.parseDouble(token);
        } catch (NumberFormatException e) {
            throw new InputException("%s:%d: not a number: '%s'".formatted(source, lineNumber, token), e);
        }
    }
}
