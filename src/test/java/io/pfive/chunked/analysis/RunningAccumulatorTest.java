// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.analysis;

import io.pfive.chunked.geo.GridScheme;
import io.pfive.chunked.geo.Wgs84Bounds;
import io.pfive.chunked.raster.Raster;
import org.junit.jupiter.api.Test;

import static io.pfive.chunked.analysis.RunningAccumulator.NORMALIZED_DATA;
import static io.pfive.chunked.analysis.RunningAccumulator.TOTAL_CLEAN;
import static io.pfive.chunked.analysis.RunningAccumulator.TOTAL_DATA;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunningAccumulatorTest {

    private static final float NaN = Float.NaN;

    private static Raster scene (GridScheme grid, float... values) {
        Raster raster = new Raster(grid);
        raster.putBand("water", values);
        return raster;
    }

    private static GridScheme grid (double minLon, int nWide) {
        return GridScheme.forBounds(Wgs84Bounds.fromMinMax(minLon, 0, minLon + nWide * 0.1, 0.1), 0.1);
    }

    @Test
    void foldCountsOnlyCleanObservations () {
        GridScheme grid = grid(0, 3);
        RunningAccumulator accumulator = new RunningAccumulator();
        assertTrue(accumulator.isEmpty());
        accumulator.fold(scene(grid, 1, 0, NaN), "water");
        accumulator.fold(scene(grid, 1, 1, NaN), "water");
        accumulator.fold(scene(grid, 0, NaN, NaN), "water");
        Raster snapshot = accumulator.snapshot();
        assertArrayEquals(new float[] {2, 1, 0}, snapshot.band(TOTAL_DATA));
        assertArrayEquals(new float[] {3, 2, 0}, snapshot.band(TOTAL_CLEAN));
        float[] normalized = snapshot.band(NORMALIZED_DATA);
        assertEquals(2f / 3, normalized[0], 1e-6);
        assertEquals(0.5f, normalized[1], 1e-6);
        assertTrue(Float.isNaN(normalized[2]));
    }

    @Test
    void snapshotIsDetached () {
        GridScheme grid = grid(0, 1);
        RunningAccumulator accumulator = new RunningAccumulator();
        accumulator.fold(scene(grid, 1), "water");
        Raster before = accumulator.snapshot();
        accumulator.fold(scene(grid, 1), "water");
        assertEquals(1, before.band(TOTAL_CLEAN)[0]);
        assertEquals(2, accumulator.snapshot().band(TOTAL_CLEAN)[0]);
    }

    @Test
    void restoredFromSnapshot () {
        GridScheme grid = grid(0, 2);
        RunningAccumulator accumulator = new RunningAccumulator();
        accumulator.fold(scene(grid, 1, 0), "water");
        accumulator.fold(scene(grid, 1, NaN), "water");
        RunningAccumulator restored = RunningAccumulator.fromRaster(accumulator.snapshot());
        Raster snapshot = restored.snapshot();
        assertArrayEquals(accumulator.snapshot().band(TOTAL_DATA), snapshot.band(TOTAL_DATA));
        assertArrayEquals(accumulator.snapshot().band(NORMALIZED_DATA), snapshot.band(NORMALIZED_DATA));
        Raster unrelated = scene(grid, 1, 1);
        assertThrows(IllegalArgumentException.class, () -> RunningAccumulator.fromRaster(unrelated));
    }

    @Test
    void addAlignsDifferentExtents () {
        RunningAccumulator west = new RunningAccumulator();
        west.fold(scene(grid(0, 2), 1, 0), "water");
        RunningAccumulator east = new RunningAccumulator();
        east.fold(scene(grid(0.1, 2), 1, 1), "water");

        RunningAccumulator total = new RunningAccumulator();
        total.add(west);
        total.add(east);
        total.add(new RunningAccumulator());
        Raster snapshot = total.snapshot();
        assertEquals(3, snapshot.grid.nCellsWide());
        assertArrayEquals(new float[] {1, 1, 1}, snapshot.band(TOTAL_DATA));
        assertArrayEquals(new float[] {1, 2, 1}, snapshot.band(TOTAL_CLEAN));
        assertArrayEquals(new float[] {1, 0.5f, 1}, snapshot.band(NORMALIZED_DATA));
    }

}
