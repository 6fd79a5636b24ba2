// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.raster;

import com.google.common.base.MoreObjects;
import io.pfive.chunked.geo.GridScheme;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/// A single-time, multi-band raster on a regular geographic grid. Each band is a flat float array
/// in the grid's flat index order. NaN marks pixels with no valid value. Bands keep their
/// insertion order, which is also the order they are serialized and written to files in.
///
/// Rasters are mutable: mosaics and accumulators are built up in place rather than creating a
/// new instance for every step, as the arrays can be large.
public class Raster {

    public final GridScheme grid;
    private final LinkedHashMap<String, float[]> bands;

    public Raster (GridScheme grid) {
        this.grid = checkNotNull(grid);
        this.bands = new LinkedHashMap<>();
    }

    public Raster (GridScheme grid, Map<String, float[]> bands) {
        this(grid);
        bands.forEach(this::putBand);
    }

    /// Create a raster with the given bands, every pixel of which is NaN.
    public static Raster empty (GridScheme grid, Iterable<String> bandNames) {
        Raster raster = new Raster(grid);
        for (String bandName : bandNames) {
            raster.putBand(bandName, nanArray(grid.nElements()));
        }
        return raster;
    }

    public static float[] nanArray (int length) {
        float[] values = new float[length];
        Arrays.fill(values, Float.NaN);
        return values;
    }

    public void putBand (String name, float[] values) {
        checkNotNull(name);
        checkArgument(values.length == grid.nElements(),
              "Band %s has %s values but grid has %s pixels.", name, values.length, grid.nElements());
        bands.put(name, values);
    }

    /// Returns the array backing the named band, not a copy.
    public float[] band (String name) {
        float[] values = bands.get(name);
        checkArgument(values != null, "Raster has no band named %s.", name);
        return values;
    }

    public boolean hasBand (String name) {
        return bands.containsKey(name);
    }

    public List<String> bandNames () {
        return new ArrayList<>(bands.keySet());
    }

    public int nBands () {
        return bands.size();
    }

    /// A deep copy, so the original can be mutated without affecting the copy.
    public Raster copy () {
        Raster copy = new Raster(grid);
        bands.forEach((name, values) -> copy.putBand(name, values.clone()));
        return copy;
    }

    /// A copy containing only the named bands, in the given order.
    public Raster select (List<String> bandNames) {
        Raster selected = new Raster(grid);
        for (String name : bandNames) {
            selected.putBand(name, band(name).clone());
        }
        return selected;
    }

    @Override
    public String toString () {
        return MoreObjects.toStringHelper(this)
              .add("wide", grid.nCellsWide())
              .add("high", grid.nCellsHigh())
              .add("bands", bands.keySet())
              .toString();
    }
}
