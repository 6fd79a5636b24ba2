// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.pipeline;

import io.pfive.chunked.Configuration;
import io.pfive.chunked.analysis.Analyses;
import io.pfive.chunked.analysis.AnalysisDefinition;
import io.pfive.chunked.chunk.ChunkPlan;
import io.pfive.chunked.chunk.Chunker;
import io.pfive.chunked.output.FileRasterWriters;
import io.pfive.chunked.output.RasterWriters;
import io.pfive.chunked.source.DataSource;
import io.pfive.chunked.store.ArtifactStore;
import io.pfive.chunked.task.AnalysisParameters;
import io.pfive.chunked.task.ProgressSink;
import io.pfive.chunked.task.TaskRecord;
import io.pfive.chunked.task.TaskRecordStore;
import io.pfive.chunked.task.TaskStatus;
import io.pfive.chunked.util.Errors;
import io.pfive.chunked.util.MilliTimer;
import io.pfive.chunked.util.Ret;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/// Runs submitted tasks from start to finish: validate the parameters, split the task into
/// chunks, process and recombine them on a pool of worker threads, then write the products.
/// A single orchestrator may run several tasks at once, their chunks sharing the worker pool.
public class PipelineOrchestrator implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final DataSource dataSource;
    private final TaskRecordStore store;
    private final RasterWriters writers;
    private final Path tempRoot;
    private final Path resultsRoot;
    private final ExecutorService executor;
    private final Redelivery redelivery;

    public PipelineOrchestrator (DataSource dataSource, TaskRecordStore store) {
        this(dataSource, store, new FileRasterWriters(), Path.of(Configuration.TEMP_PATH),
              Path.of(Configuration.RESULTS_PATH), Configuration.WORKER_THREADS, Configuration.MAX_DELIVERIES);
    }

    public PipelineOrchestrator (DataSource dataSource, TaskRecordStore store, RasterWriters writers,
                                 Path tempRoot, Path resultsRoot, int workerThreads, int maxDeliveries) {
        this.dataSource = dataSource;
        this.store = store;
        this.writers = writers;
        this.tempRoot = tempRoot;
        this.resultsRoot = resultsRoot;
        this.executor = Executors.newFixedThreadPool(workerThreads);
        this.redelivery = new Redelivery(executor, maxDeliveries);
    }

    /// Run the task to completion, blocking the calling thread.
    /// @return true if the task ended with status OK, false if it ended with status ERROR.
    public boolean run (String taskId) {
        ArtifactStore artifacts = new ArtifactStore(tempRoot, taskId);
        MilliTimer timer = new MilliTimer();
        try {
            TaskRecord record = store.get(taskId);
            store.setExecutionStart(taskId, Instant.now());
            AnalysisParameters parameters = record.parameters;
            Optional<AnalysisDefinition> analysis = Analyses.forName(parameters.analysisName());
            if (analysis.isEmpty()) {
                return fail(taskId, "Unknown analysis: " + parameters.analysisName());
            }
            Ret<TaskValidator.ValidatedTask> validated =
                  TaskValidator.validate(parameters, analysis.get().mode(), dataSource);
            if (validated.isErr()) {
                return fail(taskId, validated.errorMessage());
            }
            parameters = validated.get().parameters();
            ChunkPlan plan = Chunker.plan(parameters, validated.get().dates());
            LOG.info("Task {} split into {} geographic and {} time chunks.", taskId, plan.geoChunks().size(),
                  plan.timeChunks().size());
            ProgressSink progress = new ProgressSink(taskId, store);
            progress.minTimeBetweenEventsMsec(200);
            PipelineContext context = new PipelineContext(taskId, parameters, analysis.get(), plan, dataSource,
                  store, progress, artifacts, writers, resultsRoot.resolve(taskId));
            progress.beginTask(analysis.get().name(), plan.totalScenes());
            store.updateStatus(taskId, TaskStatus.WAIT, "Starting processing.");
            artifacts.create();

            ProcessingStrategy strategy = ProcessingStrategy.forMode(parameters.mode());
            Ret<CombinedResult> combined = new ChunkGraph(context, strategy, redelivery).execute().join();
            if (combined.isErr()) {
                artifacts.deleteAll();
                return fail(taskId, combined.errorMessage());
            }
            boolean success = new ProductFinalizer().finalizeProducts(context, combined.get());
            LOG.info("Task {} finished in {}.", taskId, timer.getElapsedString());
            return success;
        } catch (Throwable t) {
            LOG.error("Unexpected error running task {}.", taskId, t);
            try {
                artifacts.deleteAll();
                return fail(taskId, Errors.briefThrowableMessage(t));
            } catch (RuntimeException e) {
                // For example the task record itself could not be read.
                LOG.error("Could not record failure of task {}.", taskId, e);
                return false;
            }
        }
    }

    private boolean fail (String taskId, String message) {
        store.updateStatus(taskId, TaskStatus.ERROR, message);
        return false;
    }

    @Override
    public void close () {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

}
