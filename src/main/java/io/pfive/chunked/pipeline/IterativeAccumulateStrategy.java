// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.pipeline;

import io.pfive.chunked.analysis.AnalysisDefinition;
import io.pfive.chunked.analysis.ChunkMetadata;
import io.pfive.chunked.analysis.RunningAccumulator;
import io.pfive.chunked.chunk.DateRange;
import io.pfive.chunked.chunk.GeographicChunk;
import io.pfive.chunked.chunk.TemporalChunk;
import io.pfive.chunked.raster.CleanMask;
import io.pfive.chunked.raster.Raster;
import io.pfive.chunked.raster.RasterCube;
import io.pfive.chunked.raster.RasterMosaic;
import io.pfive.chunked.store.ArtifactStore;
import io.pfive.chunked.task.AnimationMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/// Classifies each acquisition and folds it into running totals. Temporal chunks cover disjoint
/// acquisitions, so their totals are added together to get the totals over the whole task.
///
/// Animation frames need care because each temporal chunk only knows about its own acquisitions.
/// Per-scene frames are independent and are rendered as soon as the geographic chunks are
/// stitched. Running-state frames are stitched then, but only rendered once the totals of all
/// earlier temporal chunks are known, by adding those totals to each frame.
public class IterativeAccumulateStrategy implements ProcessingStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    @Override
    public Optional<ChunkResult> processChunk (PipelineContext context, GeographicChunk geoChunk,
                                               TemporalChunk timeChunk) {
        AnalysisDefinition analysis = context.analysis();
        AnimationMode animation = context.parameters().animation();
        RunningAccumulator accumulator = new RunningAccumulator();
        ChunkMetadata metadata = ChunkMetadata.empty();
        for (int step = 0; step < timeChunk.ranges().size(); step++) {
            DateRange range = timeChunk.ranges().get(step);
            Optional<RasterCube> fetched = context.dataSource().fetchDataset(
                  context.query(geoChunk.bounds(), range));
            if (fetched.isEmpty()) {
                LOG.info("No data in geographic chunk {} for {}, skipping.", geoChunk.index(), range);
                continue;
            }
            RasterCube cube = fetched.get();
            CleanMask mask = CleanMask.forCube(cube);
            Raster classified = null;
            for (int t = 0; t < cube.nTimes(); t++) {
                classified = analysis.classify(cube, mask, t);
                analysis.accumulate(accumulator, classified);
            }
            metadata = metadata.combineAdditive(analysis.metadata(cube, mask));
            context.progress().increment(1);
            if (animation.enabled()) {
                Raster frame = (animation == AnimationMode.PER_SCENE) ? classified : accumulator.snapshot();
                String key = ArtifactStore.animationKey(geoChunk.index(), timeChunk.globalStep(step));
                context.artifacts().write(key, frame);
            }
        }
        if (accumulator.isEmpty()) return Optional.empty();
        String key = ArtifactStore.chunkKey(geoChunk.index(), timeChunk.index());
        Path path = context.artifacts().write(key, accumulator.snapshot());
        return Optional.of(new ChunkResult(path, metadata, geoChunk.index(), timeChunk.index()));
    }

    @Override
    public Raster combineGeo (PipelineContext context, TemporalChunk timeChunk, List<ChunkResult> results) {
        List<Raster> rasters = results.stream().map(r -> ArtifactStore.read(r.artifactPath())).toList();
        Raster mosaic = RasterMosaic.stitch(rasters);
        AnimationMode animation = context.parameters().animation();
        if (animation.enabled()) {
            for (int step = 0; step < timeChunk.nSteps(); step++) {
                int globalStep = timeChunk.globalStep(step);
                Optional<Raster> frame = stitchFrame(context, results, globalStep);
                if (frame.isEmpty()) continue;
                if (animation == AnimationMode.PER_SCENE) {
                    context.writers().render(context.analysis().animationFrame(animation), frame.get(),
                          context.artifacts().framePath(globalStep));
                } else {
                    context.artifacts().write(ArtifactStore.frameKey(globalStep), frame.get());
                }
            }
        }
        return mosaic;
    }

    /// Stitch the per-chunk artifacts for one animation step. A geographic chunk may have no
    /// artifact for a step if it had no data for that acquisition.
    private Optional<Raster> stitchFrame (PipelineContext context, List<ChunkResult> results, int globalStep) {
        List<Raster> parts = new ArrayList<>();
        for (ChunkResult result : results) {
            context.artifacts().readIfExists(ArtifactStore.animationKey(result.geoChunkId(), globalStep))
                  .ifPresent(parts::add);
        }
        if (parts.isEmpty()) return Optional.empty();
        return Optional.of(RasterMosaic.stitch(parts));
    }

    /// Adds the totals in ascending temporal order. With running-state animation, each step's
    /// frame is offset by the totals of all strictly earlier temporal chunks before rendering.
    @Override
    public Raster combineTime (PipelineContext context, List<CombinedResult> results) {
        AnimationMode animation = context.parameters().animation();
        RunningAccumulator total = new RunningAccumulator();
        for (CombinedResult result : results) {
            if (animation == AnimationMode.RUNNING_STATE) {
                TemporalChunk timeChunk = context.requirePlan().timeChunks().get(result.timeChunkId());
                renderRunningFrames(context, timeChunk, total);
            }
            total.add(RunningAccumulator.fromRaster(ArtifactStore.read(result.artifactPath())));
        }
        return total.snapshot();
    }

    private void renderRunningFrames (PipelineContext context, TemporalChunk timeChunk,
                                      RunningAccumulator earlierTotals) {
        for (int step = 0; step < timeChunk.nSteps(); step++) {
            int globalStep = timeChunk.globalStep(step);
            Optional<Raster> chunkState = context.artifacts().readIfExists(ArtifactStore.frameKey(globalStep));
            if (chunkState.isEmpty()) continue;
            RunningAccumulator frame = new RunningAccumulator();
            frame.add(earlierTotals);
            frame.add(RunningAccumulator.fromRaster(chunkState.get()));
            context.writers().render(context.analysis().animationFrame(AnimationMode.RUNNING_STATE),
                  frame.snapshot(), context.artifacts().framePath(globalStep));
        }
    }

}
