// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.output;

import io.pfive.chunked.analysis.ColorScale;
import io.pfive.chunked.analysis.ImageSpec;
import io.pfive.chunked.geo.GridScheme;
import io.pfive.chunked.geo.Wgs84Bounds;
import io.pfive.chunked.raster.Raster;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ImageRendererTest {

    /// One column, two rows: grid row 0 is the south pixel.
    private static Raster column (float south, float north) {
        Raster raster = new Raster(GridScheme.forBounds(Wgs84Bounds.fromMinMax(0, 0, 0.1, 0.2), 0.1));
        raster.putBand("v", new float[] {south, north});
        raster.putBand("flag", new float[] {0, 1});
        return raster;
    }

    @Test
    void singleBandRowsRunNorthToSouth () {
        ImageSpec spec = ImageSpec.singleBand("v", "v",
              ColorScale.ramp(0, 0xFF000000, 10, 0xFFFFFFFF, ColorScale.TRANSPARENT));
        int[] pixels = ImageRenderer.render(spec, column(0, Float.NaN));
        assertEquals(ColorScale.TRANSPARENT, pixels[0]);
        assertEquals(0xFF000000, pixels[1]);
        int[] mid = ImageRenderer.render(spec, column(5, 10));
        assertEquals(0xFFFFFFFF, mid[0]);
        assertEquals(0xFF808080, mid[1]);
    }

    @Test
    void rgbStretchAndOverlay () {
        ImageSpec spec = ImageSpec.rgb("mosaic", "v", "v", "v", 0, 10)
              .withOverlay("flag", 1, 0xFFFF0000);
        int[] pixels = ImageRenderer.render(spec, column(20, 0));
        assertEquals(0xFFFF0000, pixels[0]); // North pixel is flagged
        assertEquals(0xFFFFFFFF, pixels[1]); // Clamped at the top of the range
        assertEquals(0, ImageRenderer.scale(-3, 0, 10));
        assertEquals(128, ImageRenderer.scale(5, 0, 10));
    }

}
