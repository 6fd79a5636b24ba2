// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.raster;

import io.pfive.chunked.geo.GridScheme;
import io.pfive.chunked.geo.Wgs84Bounds;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RasterMosaicTest {

    private static final float NaN = Float.NaN;

    private static Raster raster (double minLon, double minLat, int wide, int high, String band, float... values) {
        Wgs84Bounds bounds = Wgs84Bounds.fromMinMax(minLon, minLat, minLon + wide * 0.1, minLat + high * 0.1);
        Raster raster = new Raster(GridScheme.forBounds(bounds, 0.1));
        raster.putBand(band, values);
        return raster;
    }

    @Test
    void stitchPlacesChunksByPosition () {
        // Two by one chunks, south-west, south-east and north-west, with the north-east missing.
        Raster sw = raster(0, 0, 2, 1, "v", 1, 2);
        Raster se = raster(0.2, 0, 2, 1, "v", 3, 4);
        Raster nw = raster(0, 0.1, 2, 1, "v", 5, 6);
        Raster stitched = RasterMosaic.stitch(List.of(nw, se, sw));
        assertEquals(4, stitched.grid.nCellsWide());
        assertEquals(2, stitched.grid.nCellsHigh());
        float[] v = stitched.band("v");
        assertArrayEquals(new float[] {1, 2, 3, 4, 5, 6}, new float[] {v[0], v[1], v[2], v[3], v[4], v[5]});
        assertTrue(Float.isNaN(v[6]) && Float.isNaN(v[7]));
    }

    @Test
    void bandsMissingFromSomeChunksAreNaN () {
        Raster west = raster(0, 0, 1, 1, "a", 1);
        Raster east = raster(0.1, 0, 1, 1, "b", 2);
        Raster stitched = RasterMosaic.stitch(List.of(west, east));
        assertEquals(List.of("a", "b"), stitched.bandNames());
        assertEquals(1, stitched.band("a")[0]);
        assertTrue(Float.isNaN(stitched.band("a")[1]));
        assertEquals(2, stitched.band("b")[1]);
    }

    @Test
    void overlapKeepsLastValidValue () {
        Raster first = raster(0, 0, 2, 1, "v", 1, 1);
        Raster second = raster(0.1, 0, 2, 1, "v", NaN, 2);
        Raster stitched = RasterMosaic.stitch(List.of(first, second));
        assertArrayEquals(new float[] {1, 1, 2}, stitched.band("v"));
    }

    @Test
    void singleRasterIsReturnedAsIs () {
        Raster only = raster(0, 0, 1, 1, "v", 1);
        assertSame(only, RasterMosaic.stitch(List.of(only)));
    }

    @Test
    void addIntoTreatsMissingAsZero () {
        Raster target = Raster.empty(GridScheme.forBounds(Wgs84Bounds.fromMinMax(0, 0, 0.3, 0.1), 0.1),
              List.of("v"));
        target.band("v")[0] = 5;
        RasterMosaic.addInto(raster(0, 0, 2, 1, "v", 1, NaN), target, List.of("v"));
        float[] v = target.band("v");
        assertEquals(6, v[0]);
        assertTrue(Float.isNaN(v[1]));
        assertTrue(Float.isNaN(v[2]));
    }

}
