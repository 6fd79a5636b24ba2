// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.output;

import io.pfive.chunked.analysis.ImageSpec;
import io.pfive.chunked.raster.Raster;

import java.nio.file.Path;
import java.util.List;

/// Writers for the deliverable file formats, kept behind an interface so the finalizer does not
/// depend on any particular encoding library.
public interface RasterWriters {

    /// The raster with all bands in the native serialization, readable back without loss.
    void writeNative (Raster raster, Path path);

    /// A georeferenced raster readable by GIS software.
    void writeGeoRaster (Raster raster, Path path);

    /// Three bands stretched into red, green and blue.
    void writeImage (ImageSpec spec, Raster raster, Path path);

    /// One band colorized through a color scale.
    void writeSingleBandImage (ImageSpec spec, Raster raster, Path path);

    /// @return the number of frames in the assembled animation, which skips missing frames.
    int assembleAnimation (List<Path> framePaths, Path output, double frameDurationSec);

    default void render (ImageSpec spec, Raster raster, Path path) {
        if (spec.isRgb()) {
            writeImage(spec, raster, path);
        } else {
            writeSingleBandImage(spec, raster, path);
        }
    }

}
