// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.analysis;

import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/// Maps values of a single band onto colors, interpolating linearly between stops. Colors are
/// packed ARGB integers as used by java.awt.image.BufferedImage.
public record ColorScale (List<Stop> stops, int fillColor) {

    public static final int TRANSPARENT = 0x00000000;

    public record Stop (double value, int argb) { }

    public ColorScale {
        checkArgument(!stops.isEmpty(), "A color scale needs at least one stop.");
        for (int i = 1; i < stops.size(); i++) {
            checkArgument(stops.get(i).value > stops.get(i - 1).value, "Color stops must ascend.");
        }
        stops = ImmutableList.copyOf(stops);
    }

    /// A two-color ramp between the given values.
    public static ColorScale ramp (double min, int minColor, double max, int maxColor, int fillColor) {
        return new ColorScale(List.of(new Stop(min, minColor), new Stop(max, maxColor)), fillColor);
    }

    public int colorFor (float value) {
        if (Float.isNaN(value)) return fillColor;
        Stop first = stops.get(0);
        if (value <= first.value) return first.argb;
        for (int i = 1; i < stops.size(); i++) {
            Stop upper = stops.get(i);
            if (value <= upper.value) {
                Stop lower = stops.get(i - 1);
                double t = (value - lower.value) / (upper.value - lower.value);
                return interpolate(lower.argb, upper.argb, t);
            }
        }
        return stops.get(stops.size() - 1).argb;
    }

    private static int interpolate (int a, int b, double t) {
        int result = 0;
        for (int shift = 0; shift < 32; shift += 8) {
            int ca = (a >>> shift) & 0xFF;
            int cb = (b >>> shift) & 0xFF;
            int c = (int) Math.round(ca + (cb - ca) * t);
            result |= (c & 0xFF) << shift;
        }
        return result;
    }
}
