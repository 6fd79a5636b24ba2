// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.analysis;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/// Describes how to turn a raster into one preview image: either three bands stretched linearly
/// into red, green and blue, or one band colorized through a color scale. Overlays then paint
/// solid colors over pixels where a classification band has a given value.
///
/// @param product the name of the deliverable, also used as its file name.
public record ImageSpec (
      String product,
      List<String> rgbBands,
      double scaleMin,
      double scaleMax,
      String band,
      ColorScale colorScale,
      List<Overlay> overlays
) {

    public record Overlay (String band, float value, int argb) { }

    public ImageSpec {
        checkArgument((rgbBands == null) != (band == null), "Image must be either RGB or single-band.");
        checkArgument(rgbBands == null || rgbBands.size() == 3, "RGB images need exactly three bands.");
        checkArgument(band == null || colorScale != null, "Single-band images need a color scale.");
        overlays = ImmutableList.copyOf(overlays);
    }

    public static ImageSpec rgb (String product, String red, String green, String blue,
                                 double scaleMin, double scaleMax) {
        return new ImageSpec(product, List.of(red, green, blue), scaleMin, scaleMax, null, null, List.of());
    }

    public static ImageSpec singleBand (String product, String band, ColorScale colorScale) {
        return new ImageSpec(product, null, 0, 0, band, colorScale, List.of());
    }

    public ImageSpec withOverlay (String overlayBand, float value, int argb) {
        List<Overlay> extended = new ArrayList<>(overlays);
        extended.add(new Overlay(overlayBand, value, argb));
        return new ImageSpec(product, rgbBands, scaleMin, scaleMax, band, colorScale, extended);
    }

    /// The same rendering under a different product name.
    public ImageSpec named (String name) {
        return new ImageSpec(name, rgbBands, scaleMin, scaleMax, band, colorScale, overlays);
    }

    public boolean isRgb () {
        return rgbBands != null;
    }

}
