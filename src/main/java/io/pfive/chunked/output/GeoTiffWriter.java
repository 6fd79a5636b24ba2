// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.output;

import io.pfive.chunked.geo.GridScheme;
import io.pfive.chunked.geo.Wgs84Bounds;
import io.pfive.chunked.raster.Raster;
import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FieldType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffWriter;
import mil.nga.tiff.util.TiffConstants;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/// Writes a raster as an uncompressed GeoTIFF with one 32-bit float sample per band, in geographic
/// WGS84 coordinates. Georeferencing is a single tie point at the north-west corner plus a pixel
/// scale, which is all a regular latitude/longitude grid needs. Band names go in the image
/// description. NaN pixels are written as they are.
public abstract class GeoTiffWriter {

    private static final int GEOGRAPHIC_MODEL = 2;
    private static final int PIXEL_IS_AREA = 1;
    private static final int EPSG_WGS84 = 4326;

    public static void write (Raster raster, Path path) {
        try {
            TiffWriter.writeTiff(path.toFile(), toTiff(raster));
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    static TIFFImage toTiff (Raster raster) {
        GridScheme grid = raster.grid;
        Wgs84Bounds bounds = grid.wgsBounds();
        int width = grid.nCellsWide();
        int height = grid.nCellsHigh();
        List<String> bandNames = raster.bandNames();
        int nBands = bandNames.size();

        // TIFF rows run from north to south, grid rows from south to north.
        Rasters rasters = new Rasters(width, height, nBands, FieldType.FLOAT);
        for (int b = 0; b < nBands; b++) {
            float[] band = raster.band(bandNames.get(b));
            for (int y = 0; y < height; y++) {
                int row = height - 1 - y;
                for (int x = 0; x < width; x++) {
                    rasters.setPixelSample(b, x, row, band[grid.flatIndex(x, y)]);
                }
            }
        }

        FileDirectory directory = new FileDirectory();
        directory.setImageWidth(width);
        directory.setImageHeight(height);
        directory.setSamplesPerPixel(nBands);
        directory.setBitsPerSample(Collections.nCopies(nBands, 32));
        directory.setSampleFormat(Collections.nCopies(nBands, TiffConstants.SAMPLE_FORMAT_FLOAT));
        directory.setCompression(TiffConstants.COMPRESSION_NO);
        directory.setPhotometricInterpretation(TiffConstants.PHOTOMETRIC_INTERPRETATION_BLACK_IS_ZERO);
        directory.setPlanarConfiguration(TiffConstants.PLANAR_CONFIGURATION_CHUNKY);
        directory.setRowsPerStrip(rasters.calculateRowsPerStrip(TiffConstants.PLANAR_CONFIGURATION_CHUNKY));
        String description = String.join(",", bandNames);
        directory.addEntry(new FileDirectoryEntry(FieldTagType.ImageDescription, FieldType.ASCII,
              description.length() + 1, List.of(description)));
        directory.addEntry(new FileDirectoryEntry(FieldTagType.ModelPixelScale, FieldType.DOUBLE, 3,
              List.of(grid.lonStep(), grid.latStep(), 0.0)));
        directory.addEntry(new FileDirectoryEntry(FieldTagType.ModelTiepoint, FieldType.DOUBLE, 6,
              List.of(0.0, 0.0, 0.0, bounds.minLon(), bounds.maxLat(), 0.0)));
        // Version 1.1.0 with three keys, then (key, location, count, value) for each key.
        List<Integer> geoKeys = List.of(
              1, 1, 0, 3,
              1024, 0, 1, GEOGRAPHIC_MODEL,
              1025, 0, 1, PIXEL_IS_AREA,
              2048, 0, 1, EPSG_WGS84);
        directory.addEntry(new FileDirectoryEntry(FieldTagType.GeoKeyDirectory, FieldType.SHORT,
              geoKeys.size(), geoKeys));
        directory.setWriteRasters(rasters);

        TIFFImage tiff = new TIFFImage();
        tiff.add(directory);
        return tiff;
    }

}
