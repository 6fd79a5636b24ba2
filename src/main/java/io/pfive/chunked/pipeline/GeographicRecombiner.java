// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.pipeline;

import io.pfive.chunked.analysis.ChunkMetadata;
import io.pfive.chunked.chunk.TemporalChunk;
import io.pfive.chunked.raster.Raster;
import io.pfive.chunked.store.ArtifactStore;
import io.pfive.chunked.util.Ret;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/// Merges the results of all geographic chunks of one temporal chunk into a single mosaic. The
/// results are ordered by geographic chunk index before merging, so the outcome does not depend on
/// the order in which workers finished.
public class GeographicRecombiner {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static final String ALL_EMPTY_GROUP = "No geographic chunk of time chunk %d contained any data.";

    private final ProcessingStrategy strategy;

    public GeographicRecombiner (ProcessingStrategy strategy) {
        this.strategy = strategy;
    }

    /// @return an error if every chunk was empty, otherwise the stitched result persisted as
    /// recombined_geo_<time chunk index>.
    public Ret<CombinedResult> recombine (PipelineContext context, TemporalChunk timeChunk,
                                          List<Optional<ChunkResult>> results) {
        List<ChunkResult> present = results.stream()
              .flatMap(Optional::stream)
              .sorted(Comparator.comparingInt(ChunkResult::geoChunkId))
              .toList();
        if (present.isEmpty()) {
            LOG.info("Time chunk {} of task {} is empty in every geographic chunk.", timeChunk.index(),
                  context.taskId());
            return Ret.err(String.format(ALL_EMPTY_GROUP, timeChunk.index()));
        }
        ChunkMetadata metadata = ChunkMetadata.empty();
        for (ChunkResult result : present) {
            metadata = metadata.combineAdditive(result.metadata());
        }
        Raster mosaic = strategy.combineGeo(context, timeChunk, present);
        Path path = context.artifacts().write(ArtifactStore.recombinedGeoKey(timeChunk.index()), mosaic);
        LOG.info("Combined {} of {} geographic chunks for time chunk {}.", present.size(), results.size(),
              timeChunk.index());
        return Ret.ok(new CombinedResult(path, metadata, timeChunk.index()));
    }

}
