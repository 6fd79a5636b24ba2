// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.pipeline;

import io.pfive.chunked.analysis.AnalysisDefinition;
import io.pfive.chunked.analysis.ChunkMetadata;
import io.pfive.chunked.chunk.DateRange;
import io.pfive.chunked.chunk.GeographicChunk;
import io.pfive.chunked.chunk.TemporalChunk;
import io.pfive.chunked.raster.CleanMask;
import io.pfive.chunked.raster.Raster;
import io.pfive.chunked.raster.RasterCube;
import io.pfive.chunked.raster.RasterMosaic;
import io.pfive.chunked.store.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/// Compares a composite of the anchor period against a composite of one later period. Every
/// temporal chunk is a complete answer on its own, one animation frame each, and the final result
/// is the comparison with the latest period.
public class BatchDiffStrategy implements ProcessingStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    /// A composite of one period along with the statistics of the acquisitions it was built from.
    private record Composite (Raster mosaic, ChunkMetadata metadata) { }

    @Override
    public Optional<ChunkResult> processChunk (PipelineContext context, GeographicChunk geoChunk,
                                               TemporalChunk timeChunk) {
        Optional<Composite> older = composite(context, geoChunk, timeChunk.anchor());
        if (older.isEmpty()) return Optional.empty();
        Optional<Composite> newer = composite(context, geoChunk, timeChunk.comparison());
        if (newer.isEmpty()) return Optional.empty();
        Raster diff = context.analysis().diff(older.get().mosaic, newer.get().mosaic);
        ChunkMetadata metadata = older.get().metadata.overwriteWith(newer.get().metadata);
        // One comparison is one scene, however many acquisitions went into the composites.
        context.progress().increment(1);
        String key = ArtifactStore.chunkKey(geoChunk.index(), timeChunk.index());
        Path path = context.artifacts().write(key, diff);
        return Optional.of(new ChunkResult(path, metadata, geoChunk.index(), timeChunk.index()));
    }

    private Optional<Composite> composite (PipelineContext context, GeographicChunk geoChunk, DateRange period) {
        Optional<RasterCube> cube = context.dataSource().fetchDataset(context.query(geoChunk.bounds(), period));
        if (cube.isEmpty()) {
            LOG.info("No data in geographic chunk {} for period {}.", geoChunk.index(), period);
            return Optional.empty();
        }
        AnalysisDefinition analysis = context.analysis();
        CleanMask mask = CleanMask.forCube(cube.get());
        return Optional.of(new Composite(analysis.composite(cube.get(), mask), analysis.metadata(cube.get(), mask)));
    }

    /// Stitches the chunks and, when animating, renders this temporal chunk's single frame.
    @Override
    public Raster combineGeo (PipelineContext context, TemporalChunk timeChunk, List<ChunkResult> results) {
        List<Raster> rasters = results.stream().map(r -> ArtifactStore.read(r.artifactPath())).toList();
        Raster mosaic = RasterMosaic.stitch(rasters);
        if (context.parameters().animation().enabled()) {
            Path framePath = context.artifacts().framePath(timeChunk.firstStep());
            context.writers().render(context.analysis().animationFrame(context.parameters().animation()),
                  mosaic, framePath);
        }
        return mosaic;
    }

    /// Keeps only the comparison with the latest period.
    @Override
    public Raster combineTime (PipelineContext context, List<CombinedResult> results) {
        return ArtifactStore.read(results.get(results.size() - 1).artifactPath());
    }

}
