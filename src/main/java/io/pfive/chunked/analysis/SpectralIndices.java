// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.analysis;

import io.pfive.chunked.geo.GridScheme;

/// Per-pixel band arithmetic shared by the reference analyses.
public abstract class SpectralIndices {

    /// Normalized difference water index. Positive values indicate open water.
    public static float ndwi (float green, float nir) {
        float sum = green + nir;
        if (Float.isNaN(sum) || sum == 0) return Float.NaN;
        return (green - nir) / sum;
    }

    /// 1 for water, 0 for land, NaN where either input is missing.
    public static float[] water (float[] green, float[] nir) {
        float[] water = new float[green.length];
        for (int i = 0; i < water.length; i++) {
            float index = ndwi(green[i], nir[i]);
            water[i] = Float.isNaN(index) ? Float.NaN : (index > 0 ? 1 : 0);
        }
        return water;
    }

    /// 1 for water pixels with at least one land pixel among their four neighbors, 0 for other
    /// valid pixels, NaN where the water classification is missing.
    public static float[] coastline (float[] water, GridScheme grid) {
        float[] coast = new float[water.length];
        for (int y = 0; y < grid.nCellsHigh(); y++) {
            for (int x = 0; x < grid.nCellsWide(); x++) {
                int i = grid.flatIndex(x, y);
                if (Float.isNaN(water[i])) {
                    coast[i] = Float.NaN;
                } else if (water[i] == 1 && (isLand(water, grid, x - 1, y) || isLand(water, grid, x + 1, y)
                      || isLand(water, grid, x, y - 1) || isLand(water, grid, x, y + 1))) {
                    coast[i] = 1;
                }
            }
        }
        return coast;
    }

    private static boolean isLand (float[] water, GridScheme grid, int x, int y) {
        if (x < 0 || y < 0 || x >= grid.nCellsWide() || y >= grid.nCellsHigh()) return false;
        return water[grid.flatIndex(x, y)] == 0;
    }

}
