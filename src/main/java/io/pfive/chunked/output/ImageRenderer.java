// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.output;

import io.pfive.chunked.analysis.ImageSpec;
import io.pfive.chunked.geo.GridScheme;
import io.pfive.chunked.raster.Raster;

/// Converts raster bands into packed ARGB pixels according to an ImageSpec.
public abstract class ImageRenderer {

    /// @return one ARGB int per pixel in image order: rows from north to south, each row from
    /// west to east. Pixels with no valid value are fully transparent.
    public static int[] render (ImageSpec spec, Raster raster) {
        GridScheme grid = raster.grid;
        int wide = grid.nCellsWide();
        int high = grid.nCellsHigh();
        int[] pixels = new int[grid.nElements()];
        float[] red = null, green = null, blue = null, single = null;
        if (spec.isRgb()) {
            red = raster.band(spec.rgbBands().get(0));
            green = raster.band(spec.rgbBands().get(1));
            blue = raster.band(spec.rgbBands().get(2));
        } else {
            single = raster.band(spec.band());
        }
        for (int row = 0; row < high; row++) {
            // Grid rows increase toward the north, image rows toward the south.
            int y = high - 1 - row;
            for (int x = 0; x < wide; x++) {
                int i = grid.flatIndex(x, y);
                int argb;
                if (spec.isRgb()) {
                    argb = rgb(red[i], green[i], blue[i], spec.scaleMin(), spec.scaleMax());
                } else {
                    argb = spec.colorScale().colorFor(single[i]);
                }
                for (ImageSpec.Overlay overlay : spec.overlays()) {
                    if (raster.band(overlay.band())[i] == overlay.value()) argb = overlay.argb();
                }
                pixels[row * wide + x] = argb;
            }
        }
        return pixels;
    }

    private static int rgb (float r, float g, float b, double min, double max) {
        if (Float.isNaN(r) || Float.isNaN(g) || Float.isNaN(b)) return 0;
        return 0xFF000000 | (scale(r, min, max) << 16) | (scale(g, min, max) << 8) | scale(b, min, max);
    }

    /// Linear stretch into the range 0-255, clamping values outside the range.
    static int scale (float value, double min, double max) {
        double scaled = (value - min) / (max - min) * 255;
        if (scaled < 0) return 0;
        if (scaled > 255) return 255;
        return (int) Math.round(scaled);
    }

}
