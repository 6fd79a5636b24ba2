// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.analysis;

import io.pfive.chunked.geo.GridScheme;
import io.pfive.chunked.raster.Raster;
import io.pfive.chunked.raster.RasterMosaic;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/// Running totals of a per-scene classification over many acquisitions. For each pixel it tracks
/// the sum of classified values (e.g. the number of times water was observed) and the number of
/// clean observations, from which the normalized value (e.g. the fraction of clean observations
/// that were water) is derived.
///
/// Accumulators over the same area but different acquisitions are combined by adding their
/// totals, so they may be built in parallel and merged in any order. The normalized band is always
/// recomputed from the totals rather than combined.
public class RunningAccumulator {

    public static final String TOTAL_DATA = "total_data";
    public static final String TOTAL_CLEAN = "total_clean";
    public static final String NORMALIZED_DATA = "normalized_data";
    public static final List<String> TOTAL_BANDS = List.of(TOTAL_DATA, TOTAL_CLEAN);

    private Raster totals;

    public RunningAccumulator () {
        this.totals = null;
    }

    /// Wrap an accumulator previously written out with its snapshot method.
    public static RunningAccumulator fromRaster (Raster raster) {
        checkArgument(raster.hasBand(TOTAL_DATA) && raster.hasBand(TOTAL_CLEAN),
              "Raster does not contain accumulator bands: %s", raster);
        RunningAccumulator accumulator = new RunningAccumulator();
        accumulator.totals = raster.select(TOTAL_BANDS);
        return accumulator;
    }

    public boolean isEmpty () {
        return totals == null;
    }

    public GridScheme grid () {
        checkArgument(totals != null, "Accumulator is empty.");
        return totals.grid;
    }

    /// Fold one classified scene into the totals. NaN pixels in the named band are not clean
    /// observations and increment neither total.
    public void fold (Raster scene, String band) {
        float[] values = scene.band(band);
        float[] data = new float[values.length];
        float[] clean = new float[values.length];
        for (int i = 0; i < values.length; i++) {
            if (Float.isNaN(values[i])) continue;
            data[i] = values[i];
            clean[i] = 1;
        }
        Raster increment = new Raster(scene.grid);
        increment.putBand(TOTAL_DATA, data);
        increment.putBand(TOTAL_CLEAN, clean);
        addTotals(increment);
    }

    /// Add the other accumulator's totals into this one, aligning them geographically.
    public void add (RunningAccumulator other) {
        if (other.isEmpty()) return;
        addTotals(other.totals);
    }

    private void addTotals (Raster increment) {
        if (totals == null) {
            totals = increment.select(TOTAL_BANDS);
            return;
        }
        GridScheme union = totals.grid.encompass(increment.grid);
        if (!union.equals(totals.grid)) {
            Raster expanded = Raster.empty(union, TOTAL_BANDS);
            RasterMosaic.writeInto(totals, expanded);
            totals = expanded;
        }
        RasterMosaic.addInto(increment, totals, TOTAL_BANDS);
    }

    /// A copy of the current state including the derived normalized band, unaffected by later
    /// folds. Pixels never observed clean have a NaN normalized value.
    public Raster snapshot () {
        checkArgument(totals != null, "Accumulator is empty.");
        Raster snapshot = totals.copy();
        float[] data = snapshot.band(TOTAL_DATA);
        float[] clean = snapshot.band(TOTAL_CLEAN);
        float[] normalized = new float[data.length];
        for (int i = 0; i < normalized.length; i++) {
            normalized[i] = (clean[i] > 0) ? data[i] / clean[i] : Float.NaN;
        }
        snapshot.putBand(NORMALIZED_DATA, normalized);
        return snapshot;
    }

}
