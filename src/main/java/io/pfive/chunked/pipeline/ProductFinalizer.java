// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.pipeline;

import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;
import io.pfive.chunked.Configuration;
import io.pfive.chunked.analysis.ImageSpec;
import io.pfive.chunked.geo.Wgs84Bounds;
import io.pfive.chunked.raster.BandStatistics;
import io.pfive.chunked.raster.Raster;
import io.pfive.chunked.store.ArtifactStore;
import io.pfive.chunked.task.TaskRecordStore;
import io.pfive.chunked.task.TaskStatus;
import io.pfive.chunked.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Given the fully recombined result of a task, save it in several formats (native, GeoTIFF, PNG
/// previews, animated GIF) with a metadata file, record everything in the task record and mark the
/// task complete. This is the only stage that removes the task's temporary storage.
public class ProductFinalizer {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static final String COMPLETE_MESSAGE =
          "All products have been generated. Your result will be loaded on the map.";
    public static final String NATIVE_FILE = "data.kryo";
    public static final String GEOTIFF_FILE = "data.tif";
    public static final String ANIMATION_FILE = "animation.gif";
    public static final String METADATA_FILE = "metadata.json";

    public boolean finalizeProducts (PipelineContext context, CombinedResult combined) {
        String taskId = context.taskId();
        TaskRecordStore store = context.store();
        Path resultsDir = context.resultsDirectory();
        createDirectories(resultsDir);
        Raster raster = ArtifactStore.read(combined.artifactPath());

        Path nativePath = resultsDir.resolve(NATIVE_FILE);
        context.writers().writeNative(raster, nativePath);
        store.setOutputPath(taskId, "data", nativePath.toString());

        Path tiffPath = resultsDir.resolve(GEOTIFF_FILE);
        context.writers().writeGeoRaster(raster, tiffPath);
        store.setOutputPath(taskId, "geotiff", tiffPath.toString());

        for (ImageSpec spec : context.analysis().products()) {
            Path pngPath = resultsDir.resolve(spec.product() + ".png");
            context.writers().render(spec, raster, pngPath);
            store.setOutputPath(taskId, spec.product(), pngPath.toString());
        }

        if (context.parameters().animation().enabled()) {
            writeAnimation(context, resultsDir.resolve(ANIMATION_FILE));
        }

        Wgs84Bounds coveredBounds = raster.grid.wgsBounds();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("scenes", combined.metadata().toMap());
        metadata.put("bands", BandStatistics.forRaster(raster));
        metadata.put("bounds", coveredBounds);
        Path metadataPath = resultsDir.resolve(METADATA_FILE);
        Json.write(metadataPath.toFile(), metadata);
        store.setOutputPath(taskId, "metadata", metadataPath.toString());
        store.setMetadata(taskId, metadata, coveredBounds);

        LOG.info("All products created for task {}.", taskId);
        store.markCompleted(taskId, Instant.now());
        store.updateStatus(taskId, TaskStatus.OK, COMPLETE_MESSAGE);
        context.artifacts().deleteAll();
        return true;
    }

    /// Frames are taken in ascending step order. Steps with no frame (no data anywhere for that
    /// acquisition) are left out rather than shown as blank frames.
    private void writeAnimation (PipelineContext context, Path gifPath) {
        int totalSteps = context.requirePlan().totalSteps();
        TIntList presentSteps = new TIntArrayList();
        List<Path> framePaths = new ArrayList<>();
        for (int step = 0; step < totalSteps; step++) {
            Path framePath = context.artifacts().framePath(step);
            if (Files.exists(framePath)) {
                presentSteps.add(step);
                framePaths.add(framePath);
            }
        }
        if (presentSteps.isEmpty()) {
            LOG.warn("Task {} has animation enabled but no frames were produced.", context.taskId());
            return;
        }
        int nFrames = context.writers().assembleAnimation(framePaths, gifPath, Configuration.FRAME_DURATION_SEC);
        LOG.info("Wrote {} animation frames for steps {}.", nFrames, presentSteps);
        context.store().setOutputPath(context.taskId(), "animation", gifPath.toString());
    }

    private static void createDirectories (Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

}
