// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.pipeline;

import io.pfive.chunked.chunk.GeographicChunk;
import io.pfive.chunked.chunk.TemporalChunk;
import io.pfive.chunked.util.MilliTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.Optional;

/// Executes one (geographic chunk, temporal chunk) unit of work. Units may be delivered more than
/// once, so everything they write is addressed by the chunk indexes alone.
public class ChunkProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final ProcessingStrategy strategy;

    public ChunkProcessor (ProcessingStrategy strategy) {
        this.strategy = strategy;
    }

    /// @return empty if no data intersected the chunk, or if the task's temporary storage is gone
    /// because the task was already finalized or abandoned.
    public Optional<ChunkResult> process (PipelineContext context, GeographicChunk geoChunk,
                                          TemporalChunk timeChunk) {
        String chunkId = geoChunk.index() + "_" + timeChunk.index();
        if (!context.artifacts().exists()) {
            LOG.info("Task {} temporary storage no longer exists, skipping chunk {}.", context.taskId(), chunkId);
            return Optional.empty();
        }
        LOG.info("Starting chunk {} of task {}.", chunkId, context.taskId());
        MilliTimer timer = new MilliTimer();
        Optional<ChunkResult> result = strategy.processChunk(context, geoChunk, timeChunk);
        LOG.info("Done with chunk {} ({}) in {}.", chunkId, result.isPresent() ? "data" : "empty",
              timer.getElapsedString());
        return result;
    }

}
