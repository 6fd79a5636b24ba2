// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.pipeline;

import io.pfive.chunked.chunk.ChunkPlan;
import io.pfive.chunked.chunk.Chunker;
import io.pfive.chunked.chunk.TemporalChunk;
import io.pfive.chunked.raster.Raster;
import io.pfive.chunked.source.SyntheticDataSource;
import io.pfive.chunked.store.ArtifactStore;
import io.pfive.chunked.task.AnalysisParameters;
import io.pfive.chunked.task.AnimationMode;
import io.pfive.chunked.util.Ret;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GeographicRecombinerTest {

    @TempDir
    Path dir;

    private PipelineContext context;
    private TemporalChunk timeChunk;
    private ChunkResult west;
    private ChunkResult east;
    private GeographicRecombiner recombiner;

    @BeforeEach
    void setUp () {
        List<LocalDate> dates = List.of(LocalDate.of(2000, 3, 1), LocalDate.of(2001, 3, 1));
        var source = new SyntheticDataSource(TaskFixtures.TWO_CHUNK_EXTENT, dates);
        AnalysisParameters parameters = TaskFixtures.coastalChange(TaskFixtures.TWO_CHUNK_EXTENT,
              LocalDate.of(2000, 1, 1), LocalDate.of(2001, 12, 31), 0.5, AnimationMode.NONE);
        ChunkPlan plan = Chunker.plan(parameters, dates);
        context = TaskFixtures.context(dir, parameters, plan, source);
        timeChunk = plan.timeChunks().get(0);
        ChunkProcessor processor = new ChunkProcessor(new BatchDiffStrategy());
        west = processor.process(context, plan.geoChunks().get(0), timeChunk).orElseThrow();
        east = processor.process(context, plan.geoChunks().get(1), timeChunk).orElseThrow();
        recombiner = new GeographicRecombiner(new BatchDiffStrategy());
    }

    @Test
    void arrivalOrderDoesNotMatter () throws Exception {
        CombinedResult forward = recombiner.recombine(context, timeChunk,
              List.of(Optional.of(west), Optional.of(east))).get();
        byte[] forwardBytes = Files.readAllBytes(forward.artifactPath());
        CombinedResult reverse = recombiner.recombine(context, timeChunk,
              List.of(Optional.of(east), Optional.of(west))).get();
        byte[] reverseBytes = Files.readAllBytes(reverse.artifactPath());
        assertArrayEquals(forwardBytes, reverseBytes);
        assertEquals(forward.metadata(), reverse.metadata());
        assertEquals("recombined_geo_0.kryo", forward.artifactPath().getFileName().toString());
        assertEquals(10, ArtifactStore.read(forward.artifactPath()).grid.nCellsWide());
    }

    @Test
    void metadataIsSummedAcrossGeography () {
        CombinedResult combined = recombiner.recombine(context, timeChunk,
              List.of(Optional.of(west), Optional.of(east))).get();
        combined.metadata().scenes().forEach((date, summary) -> {
            assertEquals(50, summary.totalPixels(), date);
            assertEquals(50, summary.cleanPixels(), date);
        });
        assertEquals(2, combined.metadata().scenes().size());
    }

    @Test
    void emptyChunkContributesNothing () {
        Raster eastAlone = ArtifactStore.read(east.artifactPath());
        CombinedResult combined = recombiner.recombine(context, timeChunk,
              List.of(Optional.empty(), Optional.of(east))).get();
        Raster result = ArtifactStore.read(combined.artifactPath());
        assertEquals(eastAlone.grid, result.grid);
        assertEquals(eastAlone.bandNames(), result.bandNames());
        for (String band : eastAlone.bandNames()) {
            assertArrayEquals(eastAlone.band(band), result.band(band), band);
        }
        assertEquals(east.metadata(), combined.metadata());
    }

    @Test
    void allEmptyGroupIsAnError () {
        Ret<CombinedResult> combined = recombiner.recombine(context, timeChunk,
              List.of(Optional.empty(), Optional.empty()));
        assertTrue(combined.isErr());
        assertEquals(String.format(GeographicRecombiner.ALL_EMPTY_GROUP, 0), combined.errorMessage());
    }

}
