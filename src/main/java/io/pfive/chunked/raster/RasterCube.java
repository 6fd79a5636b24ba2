// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.raster;

import com.google.common.collect.ImmutableList;
import io.pfive.chunked.geo.GridScheme;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/// A stack of rasters on the same grid, one time slice per acquisition date in ascending order.
/// This is what the data source returns for an extent and a range of dates. Band values are
/// held in (time, pixel) axis order.
public class RasterCube {

    public final GridScheme grid;
    public final ImmutableList<LocalDate> dates;
    private final LinkedHashMap<String, float[][]> bands = new LinkedHashMap<>();

    public RasterCube (GridScheme grid, List<LocalDate> dates) {
        checkArgument(!dates.isEmpty(), "A raster cube must have at least one time slice.");
        this.grid = grid;
        this.dates = ImmutableList.copyOf(dates);
    }

    public void putBand (String name, float[][] values) {
        checkArgument(values.length == dates.size(), "Band %s must have one slice per date.", name);
        for (float[] slice : values) {
            checkArgument(slice.length == grid.nElements(), "Band %s slice does not match grid.", name);
        }
        bands.put(name, values);
    }

    public float[][] band (String name) {
        float[][] values = bands.get(name);
        checkArgument(values != null, "Cube has no band named %s.", name);
        return values;
    }

    public boolean hasBand (String name) {
        return bands.containsKey(name);
    }

    public List<String> bandNames () {
        return new ArrayList<>(bands.keySet());
    }

    public int nTimes () {
        return dates.size();
    }

}
