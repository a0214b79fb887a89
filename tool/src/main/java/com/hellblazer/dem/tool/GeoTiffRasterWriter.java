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
import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FieldType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffWriter;
import mil.nga.tiff.util.TiffConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Single band float32 raster of one grid quantity. Raster row 0 is the grid row at maximum Y, the usual north up
 * image layout. The model pixel scale and tie point tags place the upper left pixel corner at (min X, max Y).
 *
 * @author hal.hildebrand
 */
public class GeoTiffRasterWriter {
    public static final int MODEL_PIXEL_SCALE_TAG = 33550;
    public static final int MODEL_TIEPOINT_TAG    = 33922;

    private static final Logger log = LoggerFactory.getLogger(GeoTiffRasterWriter.class);

    private GeoTiffRasterWriter() {
    }

    public static void write(Path file, HeightGrid grid, ToDoubleFunction<GridCell> value) throws IOException {
        var width = grid.getCols();
        var height = grid.getRows();
        var fieldType = FieldType.FLOAT;

        var rasters = new Rasters(width, height, 1, fieldType);
        for (int row = 0; row < height; row++) {
            var y = height - 1 - row;
            for (int col = 0; col < width; col++) {
                rasters.setFirstPixelSample(col, y, (float) value.applyAsDouble(grid.cellAt(row, col)));
            }
        }

        var directory = new FileDirectory();
        directory.setImageWidth(width);
        directory.setImageHeight(height);
        directory.setBitsPerSample(fieldType.getBits());
        directory.setCompression(TiffConstants.COMPRESSION_NO);
        directory.setPhotometricInterpretation(TiffConstants.PHOTOMETRIC_INTERPRETATION_BLACK_IS_ZERO);
        directory.setSamplesPerPixel(1);
        directory.setRowsPerStrip(rasters.calculateRowsPerStrip(TiffConstants.PLANAR_CONFIGURATION_CHUNKY));
        directory.setPlanarConfiguration(TiffConstants.PLANAR_CONFIGURATION_CHUNKY);
        directory.setSampleFormat(TiffConstants.SAMPLE_FORMAT_FLOAT);

        var extent = grid.getExtent();
        var resolution = grid.getResolution();
        directory.addEntry(new FileDirectoryEntry(FieldTagType.getById(MODEL_PIXEL_SCALE_TAG), FieldType.DOUBLE, 3,
                                                  List.of(resolution, resolution, 0.0)));
        directory.addEntry(new FileDirectoryEntry(FieldTagType.getById(MODEL_TIEPOINT_TAG), FieldType.DOUBLE, 6,
                                                  List.of(0.0, 0.0, 0.0, extent.minX(),
                                                          extent.minY() + height * resolution, 0.0)));
        directory.setWriteRasters(rasters);

        var image = new TIFFImage();
        image.add(directory);
        TiffWriter.writeTiff(file.toFile(), image);
        log.debug("Wrote {}x{} raster {}", width, height, file);
    }
}
