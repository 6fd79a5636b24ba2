// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.pipeline;

import io.pfive.chunked.analysis.ChunkMetadata;
import io.pfive.chunked.raster.Raster;
import io.pfive.chunked.store.ArtifactStore;
import io.pfive.chunked.util.Ret;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;

/// Merges the geographically recombined results of all temporal chunks. Results are always
/// processed in ascending temporal chunk index, whatever order they arrive in, since running
/// totals and animation frames depend on that order.
public class TemporalRecombiner {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static final String NO_DATA = "No data was found for any chunk of this task.";

    private final ProcessingStrategy strategy;

    public TemporalRecombiner (ProcessingStrategy strategy) {
        this.strategy = strategy;
    }

    /// @param results one per temporal chunk, errors for those that had no data.
    public Ret<CombinedResult> recombine (PipelineContext context, List<Ret<CombinedResult>> results) {
        List<CombinedResult> present = results.stream()
              .filter(Ret::isOk)
              .map(Ret::get)
              .sorted(Comparator.comparingInt(CombinedResult::timeChunkId))
              .toList();
        if (present.isEmpty()) return Ret.err(NO_DATA);
        // Later temporal chunks replace any metadata keys reported by earlier ones.
        ChunkMetadata metadata = ChunkMetadata.empty();
        for (CombinedResult result : present) {
            metadata = metadata.overwriteWith(result.metadata());
        }
        Raster combined = strategy.combineTime(context, present);
        Path path = context.artifacts().write(ArtifactStore.RECOMBINED_TIME, combined);
        int last = present.get(present.size() - 1).timeChunkId();
        LOG.info("Combined {} of {} time chunks for task {}.", present.size(), results.size(), context.taskId());
        return Ret.ok(new CombinedResult(path, metadata, last));
    }

}
