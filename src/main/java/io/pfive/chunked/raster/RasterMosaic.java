// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.raster;

import io.pfive.chunked.geo.GridScheme;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;

/// Combines rasters covering different parts of the same pixel grid into one larger raster. The
/// inputs come from a grid of geographic chunks, so they are expected not to overlap. Where they
/// do overlap on shared edges the last raster in the list wins, but only with valid (non-NaN)
/// values, so callers wanting a reproducible result should supply the rasters in a stable order.
public abstract class RasterMosaic {

    /// Return the smallest grid containing all the supplied grids.
    public static GridScheme unionGrid (List<GridScheme> grids) {
        checkArgument(!grids.isEmpty(), "Cannot combine an empty list of grids.");
        GridScheme union = grids.get(0);
        for (int i = 1; i < grids.size(); i++) {
            union = union.encompass(grids.get(i));
        }
        return union;
    }

    /// Stitch the rasters into a single raster covering all of them. Bands missing from some
    /// inputs are NaN in the parts those inputs cover.
    public static Raster stitch (List<Raster> rasters) {
        checkArgument(!rasters.isEmpty(), "Cannot stitch an empty list of rasters.");
        if (rasters.size() == 1) return rasters.get(0);
        GridScheme union = unionGrid(rasters.stream().map(r -> r.grid).toList());
        Set<String> bandNames = new LinkedHashSet<>();
        for (Raster raster : rasters) bandNames.addAll(raster.bandNames());
        Raster merged = Raster.empty(union, bandNames);
        for (Raster raster : rasters) {
            writeInto(raster, merged);
        }
        return merged;
    }

    /// Copy every valid pixel of the source into the corresponding pixel of the larger target.
    /// This iterates over the pixels of one chunk, translating its local (x, y) into the target's
    /// flat index.
    public static void writeInto (Raster source, Raster target) {
        GridScheme src = source.grid;
        GridScheme dst = target.grid;
        int xOffset = dst.xOffsetOf(src);
        int yOffset = dst.yOffsetOf(src);
        for (String bandName : source.bandNames()) {
            if (!target.hasBand(bandName)) continue;
            float[] in = source.band(bandName);
            float[] out = target.band(bandName);
            for (int y = 0; y < src.nCellsHigh(); y++) {
                int yt = y + yOffset;
                if (yt < 0 || yt >= dst.nCellsHigh()) continue;
                for (int x = 0; x < src.nCellsWide(); x++) {
                    int xt = x + xOffset;
                    if (xt < 0 || xt >= dst.nCellsWide()) continue;
                    float v = in[src.flatIndex(x, y)];
                    if (Float.isNaN(v)) continue;
                    out[dst.flatIndex(xt, yt)] = v;
                }
            }
        }
    }

    /// Element-wise add the named bands of the source into the target at their geographic
    /// position. NaN in the source contributes nothing, NaN in the target is treated as zero once
    /// a valid value arrives.
    public static void addInto (Raster source, Raster target, List<String> bandNames) {
        GridScheme src = source.grid;
        GridScheme dst = target.grid;
        int xOffset = dst.xOffsetOf(src);
        int yOffset = dst.yOffsetOf(src);
        for (String bandName : bandNames) {
            float[] in = source.band(bandName);
            float[] out = target.band(bandName);
            for (int y = 0; y < src.nCellsHigh(); y++) {
                int yt = y + yOffset;
                if (yt < 0 || yt >= dst.nCellsHigh()) continue;
                for (int x = 0; x < src.nCellsWide(); x++) {
                    int xt = x + xOffset;
                    if (xt < 0 || xt >= dst.nCellsWide()) continue;
                    float v = in[src.flatIndex(x, y)];
                    if (Float.isNaN(v)) continue;
                    int i = dst.flatIndex(xt, yt);
                    out[i] = Float.isNaN(out[i]) ? v : out[i] + v;
                }
            }
        }
    }

}
