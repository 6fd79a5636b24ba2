// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.output;

import io.pfive.chunked.geo.GridScheme;
import io.pfive.chunked.geo.Wgs84Bounds;
import io.pfive.chunked.raster.Raster;
import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffReader;
import mil.nga.tiff.util.TiffConstants;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GeoTiffWriterTest {

    @TempDir
    Path dir;

    @Test
    void readsBackWithGeoreferencing () throws Exception {
        // Three columns, two rows, each pixel of band "a" holds its own flat index.
        GridScheme grid = GridScheme.forBounds(Wgs84Bounds.fromMinMax(10, 40, 10.3, 40.2), 0.1);
        float[] a = new float[grid.nElements()];
        float[] b = new float[grid.nElements()];
        for (int i = 0; i < a.length; i++) {
            a[i] = i;
            b[i] = -i;
        }
        b[0] = Float.NaN;
        Raster raster = new Raster(grid);
        raster.putBand("a", a);
        raster.putBand("b", b);
        Path path = dir.resolve("data.tif");
        GeoTiffWriter.write(raster, path);

        TIFFImage tiff = TiffReader.readTiff(path.toFile());
        FileDirectory directory = tiff.getFileDirectory();
        assertEquals(3, directory.getImageWidth().intValue());
        assertEquals(2, directory.getImageHeight().intValue());
        assertEquals(2, directory.getSamplesPerPixel());
        assertEquals(List.of(TiffConstants.SAMPLE_FORMAT_FLOAT, TiffConstants.SAMPLE_FORMAT_FLOAT),
              directory.getSampleFormat());

        List<?> tiepoint = (List<?>) directory.get(FieldTagType.ModelTiepoint).getValues();
        assertEquals(6, tiepoint.size());
        assertEquals(10.0, ((Number) tiepoint.get(3)).doubleValue(), 1e-9);
        assertEquals(40.2, ((Number) tiepoint.get(4)).doubleValue(), 1e-9);
        List<?> scale = (List<?>) directory.get(FieldTagType.ModelPixelScale).getValues();
        assertEquals(0.1, ((Number) scale.get(0)).doubleValue(), 1e-9);
        assertEquals(0.1, ((Number) scale.get(1)).doubleValue(), 1e-9);
        List<?> geoKeys = (List<?>) directory.get(FieldTagType.GeoKeyDirectory).getValues();
        assertEquals(4326, ((Number) geoKeys.get(15)).intValue());

        Rasters rasters = directory.readRasters();
        // The first row of the file is the north edge, the last row of the grid.
        assertEquals(grid.flatIndex(0, 1), rasters.getPixelSample(0, 0, 0).floatValue(), 0);
        assertEquals(-grid.flatIndex(2, 1), rasters.getPixelSample(1, 2, 0).floatValue(), 0);
        // The south-west corner has NaN in band b.
        assertEquals(0, rasters.getPixelSample(0, 0, 1).floatValue(), 0);
        assertTrue(Float.isNaN(rasters.getPixelSample(1, 0, 1).floatValue()));
    }

}
