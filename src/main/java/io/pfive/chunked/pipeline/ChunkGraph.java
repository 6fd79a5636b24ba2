// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.pipeline;

import gnu.trove.map.TIntObjectMap;
import gnu.trove.map.hash.TIntObjectHashMap;
import io.pfive.chunked.chunk.ChunkPlan;
import io.pfive.chunked.chunk.GeographicChunk;
import io.pfive.chunked.chunk.TemporalChunk;
import io.pfive.chunked.util.Ret;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/// The dependency graph of one task's work: every chunk unit of a temporal chunk must finish
/// before that temporal chunk's geographic recombination, and every geographic recombination
/// before the temporal recombination. Units with no dependencies between them run in parallel.
public class ChunkGraph {

    private final PipelineContext context;
    private final Redelivery redelivery;
    private final ChunkProcessor processor;
    private final GeographicRecombiner geoRecombiner;
    private final TemporalRecombiner timeRecombiner;

    public ChunkGraph (PipelineContext context, ProcessingStrategy strategy, Redelivery redelivery) {
        this.context = context;
        this.redelivery = redelivery;
        this.processor = new ChunkProcessor(strategy);
        this.geoRecombiner = new GeographicRecombiner(strategy);
        this.timeRecombiner = new TemporalRecombiner(strategy);
    }

    /// Submit every unit of work and return a future for the temporally recombined result.
    public CompletableFuture<Ret<CombinedResult>> execute () {
        ChunkPlan plan = context.requirePlan();
        TIntObjectMap<CompletableFuture<Ret<CombinedResult>>> geoStages = new TIntObjectHashMap<>();
        for (TemporalChunk timeChunk : plan.timeChunks()) {
            List<CompletableFuture<Optional<ChunkResult>>> units = new ArrayList<>();
            for (GeographicChunk geoChunk : plan.geoChunks()) {
                String name = "Chunk " + geoChunk.index() + "_" + timeChunk.index();
                units.add(redelivery.deliver(name, () -> processor.process(context, geoChunk, timeChunk),
                      Optional::empty));
            }
            CompletableFuture<Ret<CombinedResult>> geoStage = allOf(units).thenCompose(results ->
                  redelivery.deliver("Geographic recombination " + timeChunk.index(),
                        () -> geoRecombiner.recombine(context, timeChunk, results),
                        () -> Ret.err("Geographic recombination of time chunk " + timeChunk.index() + " failed.")));
            geoStages.put(timeChunk.index(), geoStage);
        }
        List<CompletableFuture<Ret<CombinedResult>>> stages = new ArrayList<>();
        for (TemporalChunk timeChunk : plan.timeChunks()) {
            stages.add(geoStages.get(timeChunk.index()));
        }
        return allOf(stages).thenCompose(results ->
              redelivery.deliver("Temporal recombination",
                    () -> timeRecombiner.recombine(context, results),
                    () -> Ret.err("Temporal recombination failed.")));
    }

    /// Completes with all the results in the original order once every future has completed.
    private static <T> CompletableFuture<List<T>> allOf (List<CompletableFuture<T>> futures) {
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
              .thenApply(v -> futures.stream().map(CompletableFuture::join).toList());
    }

}
