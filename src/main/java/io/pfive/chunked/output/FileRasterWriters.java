// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.output;

import io.pfive.chunked.analysis.ImageSpec;
import io.pfive.chunked.raster.Raster;
import io.pfive.chunked.store.Serialization;

import java.nio.file.Path;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/// Kryo for native output, GeoTIFF for georeferenced output, PNG for previews and GIF for
/// animations.
public class FileRasterWriters implements RasterWriters {

    @Override
    public void writeNative (Raster raster, Path path) {
        Serialization.write(path.toFile(), raster);
    }

    @Override
    public void writeGeoRaster (Raster raster, Path path) {
        GeoTiffWriter.write(raster, path);
    }

    @Override
    public void writeImage (ImageSpec spec, Raster raster, Path path) {
        checkArgument(spec.isRgb(), "Image spec %s is not RGB.", spec.product());
        new GeoPngWriter(raster.grid, spec.product()).write(ImageRenderer.render(spec, raster), path);
    }

    @Override
    public void writeSingleBandImage (ImageSpec spec, Raster raster, Path path) {
        checkArgument(!spec.isRgb(), "Image spec %s is not single-band.", spec.product());
        new GeoPngWriter(raster.grid, spec.product()).write(ImageRenderer.render(spec, raster), path);
    }

    @Override
    public int assembleAnimation (List<Path> framePaths, Path output, double frameDurationSec) {
        return GifAnimationWriter.write(framePaths, output, frameDurationSec);
    }

}
