// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.analysis;

import io.pfive.chunked.geo.GridScheme;
import io.pfive.chunked.geo.Wgs84Bounds;
import io.pfive.chunked.raster.CleanMask;
import io.pfive.chunked.raster.RasterCube;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChunkMetadataTest {

    private static final LocalDate JAN = LocalDate.of(2010, 1, 5);
    private static final LocalDate FEB = LocalDate.of(2010, 2, 5);

    /// A two pixel cube where the given number of pixels are clean on every date.
    private static ChunkMetadata metadata (int nClean, LocalDate... dates) {
        GridScheme grid = GridScheme.forBounds(Wgs84Bounds.fromMinMax(0, 0, 0.2, 0.1), 0.1);
        RasterCube cube = new RasterCube(grid, List.of(dates));
        float[][] qa = new float[dates.length][2];
        for (float[] slice : qa) {
            for (int i = 0; i < nClean; i++) slice[i] = 2;
        }
        cube.putBand(CleanMask.PIXEL_QA_BAND, qa);
        return ChunkMetadata.forCube(cube, CleanMask.forCube(cube));
    }

    @Test
    void countsPerDate () {
        ChunkMetadata metadata = metadata(1, JAN, FEB);
        assertEquals(List.of(JAN.toString(), FEB.toString()), List.copyOf(metadata.scenes().keySet()));
        assertEquals(new SceneSummary(2, 1), metadata.scenes().get(JAN.toString()));
        assertEquals(0.5, metadata.scenes().get(JAN.toString()).cleanFraction(), 1e-9);
    }

    @Test
    void additiveCombinationIsCommutative () {
        ChunkMetadata a = metadata(1, JAN, FEB);
        ChunkMetadata b = metadata(2, FEB);
        ChunkMetadata ab = a.combineAdditive(b);
        assertEquals(ab, b.combineAdditive(a));
        assertEquals(new SceneSummary(4, 3), ab.scenes().get(FEB.toString()));
        assertEquals(new SceneSummary(2, 1), ab.scenes().get(JAN.toString()));
        assertEquals(a, a.combineAdditive(ChunkMetadata.empty()));
    }

    @Test
    void overwriteFavorsArgument () {
        ChunkMetadata earlier = metadata(1, JAN, FEB);
        ChunkMetadata later = metadata(2, FEB);
        ChunkMetadata combined = earlier.overwriteWith(later);
        assertEquals(new SceneSummary(2, 2), combined.scenes().get(FEB.toString()));
        assertEquals(new SceneSummary(2, 1), combined.scenes().get(JAN.toString()));
        assertEquals(new SceneSummary(2, 1), later.overwriteWith(earlier).scenes().get(FEB.toString()));
        assertTrue(ChunkMetadata.empty().isEmpty());
    }

}
