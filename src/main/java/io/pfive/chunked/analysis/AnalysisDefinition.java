// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.analysis;

import io.pfive.chunked.raster.CleanMask;
import io.pfive.chunked.raster.Raster;
import io.pfive.chunked.raster.RasterCube;
import io.pfive.chunked.task.AnimationMode;
import io.pfive.chunked.task.ProcessingMode;

import java.util.List;

/// The numerical part of an analysis, plugged into the chunked pipeline. A batch analysis
/// implements composite and diff, an iterative one classify and accumulate. Implementations must
/// be stateless and threadsafe, as many chunks are processed at once, and deterministic, so that
/// a redelivered chunk produces an identical result.
public interface AnalysisDefinition {

    String name ();

    ProcessingMode mode ();

    /// Reduce all the acquisitions of one calendar period to a single cloud-free raster.
    default Raster composite (RasterCube cube, CleanMask mask) {
        throw unsupported("composite");
    }

    /// Compare the composites of the anchor period and a later period.
    default Raster diff (Raster older, Raster newer) {
        throw unsupported("diff");
    }

    /// Classify time slice t of the cube, producing NaN for pixels that are not clean.
    default Raster classify (RasterCube cube, CleanMask mask, int t) {
        throw unsupported("classify");
    }

    /// Fold one classified scene into the running totals.
    default void accumulate (RunningAccumulator accumulator, Raster classified) {
        throw unsupported("accumulate");
    }

    /// Statistics carried alongside each chunk's result and combined during recombination.
    default ChunkMetadata metadata (RasterCube cube, CleanMask mask) {
        return ChunkMetadata.forCube(cube, mask);
    }

    /// The preview images written from the final combined raster.
    List<ImageSpec> products ();

    /// How each frame of the animation is rendered.
    ImageSpec animationFrame (AnimationMode animation);

    private UnsupportedOperationException unsupported (String operation) {
        String message = String.format("Analysis %s (%s) does not support %s.", name(), mode(), operation);
        return new UnsupportedOperationException(message);
    }

}
