// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.geo;

import static com.google.common.base.Preconditions.checkArgument;

/// Converts geographic locations to (x, y) pixel coordinates of a raster. All pixels are the same
/// size, with a single latitude and longitude step value across the whole grid. Row y = 0 is the
/// southernmost row, so y increases toward the north, and x changes faster than y in flat indexes.
/// Image formats have y increasing downward, so writers must flip the rows.
public record GridScheme (Wgs84Bounds wgsBounds, int nCellsWide, int nCellsHigh) {

    /// Tolerance in pixels when snapping coordinates of adjacent grids onto one another.
    private static final double SNAP_TOLERANCE = 1e-6;

    public GridScheme {
        checkArgument(nCellsWide > 0 && nCellsHigh > 0, "Grid must contain at least one cell.");
    }

    /// Create a grid of square pixels of the given size in degrees covering the bounds.
    public static GridScheme forBounds (Wgs84Bounds bounds, double pixelSizeDegrees) {
        int wide = Math.max(1, (int) Math.round(bounds.widthLon() / pixelSizeDegrees));
        int high = Math.max(1, (int) Math.round(bounds.heightLat() / pixelSizeDegrees));
        return new GridScheme(bounds, wide, high);
    }

    public double lonStep () {
        return wgsBounds.widthLon() / nCellsWide;
    }

    public double latStep () {
        return wgsBounds.heightLat() / nCellsHigh;
    }

    public int nElements () {
        return nCellsHigh * nCellsWide;
    }

    public double centerLonForX (int x) {
        return wgsBounds.minLon() + ((x + 0.5) * lonStep());
    }

    /// Does not perform range checks, for use in constrained iteration over provably safe ranges.
    public int flatIndex (int x, int y) {
        return y * nCellsWide + x;
    }

    public int xForFlatIndex (int flatIndex) {
        return flatIndex % nCellsWide;
    }

    /// Whether the other grid has the same pixel size as this one, so its pixels can be copied
    /// into this grid at an integer offset.
    public boolean samePixelSize (GridScheme other) {
        return Math.abs(lonStep() - other.lonStep()) < lonStep() * SNAP_TOLERANCE
              && Math.abs(latStep() - other.latStep()) < latStep() * SNAP_TOLERANCE;
    }

    /// Return the x offset in this grid of the first column of a child grid with the same pixel
    /// size. Rounding absorbs floating point error accumulated in the child's bounds.
    public int xOffsetOf (GridScheme child) {
        return (int) Math.round((child.wgsBounds.minLon() - wgsBounds.minLon()) / lonStep());
    }

    public int yOffsetOf (GridScheme child) {
        return (int) Math.round((child.wgsBounds.minLat() - wgsBounds.minLat()) / latStep());
    }

    /// Returns the smallest grid with this grid's pixel size that contains both this grid and the
    /// other one. The other grid must be aligned to the same pixel size.
    public GridScheme encompass (GridScheme other) {
        checkArgument(samePixelSize(other), "Grids to combine must have the same pixel size.");
        Wgs84Bounds union = wgsBounds.encompass(other.wgsBounds);
        int wide = (int) Math.round(union.widthLon() / lonStep());
        int high = (int) Math.round(union.heightLat() / latStep());
        return new GridScheme(union, wide, high);
    }

}
