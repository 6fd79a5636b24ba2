// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.raster;

import java.util.LinkedHashMap;
import java.util.Map;

/// Summary of the valid (non-NaN) values in one band of a raster.
public record BandStatistics (double min, double max, double mean, long validPixels) {

    public static BandStatistics of (float[] values) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double sum = 0;
        long n = 0;
        for (float v : values) {
            if (Float.isNaN(v)) continue;
            if (v < min) min = v;
            if (v > max) max = v;
            sum += v;
            n += 1;
        }
        if (n == 0) return new BandStatistics(Double.NaN, Double.NaN, Double.NaN, 0);
        return new BandStatistics(min, max, sum / n, n);
    }

    public static Map<String, BandStatistics> forRaster (Raster raster) {
        Map<String, BandStatistics> stats = new LinkedHashMap<>();
        for (String band : raster.bandNames()) {
            stats.put(band, of(raster.band(band)));
        }
        return stats;
    }
}
