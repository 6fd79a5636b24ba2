// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.pipeline;

import io.pfive.chunked.analysis.AnalysisDefinition;
import io.pfive.chunked.chunk.ChunkPlan;
import io.pfive.chunked.chunk.DateRange;
import io.pfive.chunked.geo.Wgs84Bounds;
import io.pfive.chunked.output.RasterWriters;
import io.pfive.chunked.source.DataSource;
import io.pfive.chunked.source.DatasetQuery;
import io.pfive.chunked.store.ArtifactStore;
import io.pfive.chunked.task.AnalysisParameters;
import io.pfive.chunked.task.ProgressSink;
import io.pfive.chunked.task.TaskRecordStore;

import java.nio.file.Path;

import static com.google.common.base.Preconditions.checkState;

/// Everything a pipeline stage needs to know about the task it is working on: the immutable
/// parameters and chunk plan, the collaborators it reads from and writes to, and the handle for
/// reporting progress. Stages receive this explicitly rather than looking the task up by ID.
///
/// @param plan null until the task has been validated and chunked.
public record PipelineContext (
      String taskId,
      AnalysisParameters parameters,
      AnalysisDefinition analysis,
      ChunkPlan plan,
      DataSource dataSource,
      TaskRecordStore store,
      ProgressSink progress,
      ArtifactStore artifacts,
      RasterWriters writers,
      Path resultsDirectory
) {

    public ChunkPlan requirePlan () {
        checkState(plan != null, "Task %s has not been chunked.", taskId);
        return plan;
    }

    /// A query for this task's product and measurements over the given area and dates.
    public DatasetQuery query (Wgs84Bounds bounds, DateRange dates) {
        return new DatasetQuery(parameters.product(), bounds, dates, parameters.measurements());
    }

}
