// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.pipeline;

import io.pfive.chunked.chunk.GeographicChunk;
import io.pfive.chunked.chunk.TemporalChunk;
import io.pfive.chunked.raster.Raster;
import io.pfive.chunked.task.ProcessingMode;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Optional;

/// The parts of the pipeline that differ between processing modes. The fan-out, fan-in, ordering
/// and empty-chunk handling are shared and live in the processor and recombiner classes that call
/// these methods.
public interface ProcessingStrategy {

    /// Compute one unit of work, writing its artifact and any animation artifacts.
    /// @return empty if no data intersected this chunk.
    Optional<ChunkResult> processChunk (PipelineContext context, GeographicChunk geoChunk,
                                        TemporalChunk timeChunk);

    /// Merge the non-empty results for all geographic chunks of one temporal chunk, and produce
    /// that temporal chunk's animation artifacts.
    /// @param results at least one, sorted by geographic chunk index.
    @Nonnull Raster combineGeo (PipelineContext context, TemporalChunk timeChunk, List<ChunkResult> results);

    /// Merge the geographically recombined results across temporal chunks.
    /// @param results at least one, sorted by temporal chunk index.
    @Nonnull Raster combineTime (PipelineContext context, List<CombinedResult> results);

    static ProcessingStrategy forMode (ProcessingMode mode) {
        return switch (mode) {
            case BATCH -> new BatchDiffStrategy();
            case ITERATIVE -> new IterativeAccumulateStrategy();
        };
    }

}
