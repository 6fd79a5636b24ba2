// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.task;

import io.pfive.chunked.Configuration;
import io.pfive.chunked.geo.Wgs84Bounds;
import io.pfive.chunked.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.function.Consumer;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/// Stores each task record as a JSON file named after the task ID. Every update is a
/// read-modify-write of the whole file, serialized by synchronizing on the store. Files are written
/// to a temporary file and moved into place so a reader never sees a partially written record.
public class JsonTaskRecordStore implements TaskRecordStore {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());
    private static final String JSON_SUFFIX = ".json";

    private final Path basePath;

    /// A store in the directory given by the store-path configuration key.
    public JsonTaskRecordStore () {
        this(Path.of(Configuration.STORE_PATH));
    }

    public JsonTaskRecordStore (Path basePath) {
        this.basePath = basePath;
        try {
            // Creates parent directories, no exception if directory already exists.
            Files.createDirectories(basePath);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    @Override
    public synchronized TaskRecord get (String taskId) {
        return read(taskId);
    }

    @Override
    public synchronized void create (TaskRecord record) {
        checkState(!Files.exists(recordPath(record.id)), "Task %s already exists.", record.id);
        write(record);
    }

    @Override
    public void updateStatus (String taskId, TaskStatus status, String message) {
        update(taskId, record -> {
            record.status = status;
            record.message = message;
            record.statusHistory.add(message);
        });
        LOG.info("Task {} status {}: {}", taskId, status, message);
    }

    @Override
    public synchronized int atomicIncrement (String taskId, TaskField field, int amount) {
        checkArgument(amount >= 0, "Increment must not be negative.");
        TaskRecord record = read(taskId);
        switch (field) {
            case SCENES_PROCESSED -> record.scenesProcessed =
                  Math.min(record.scenesProcessed + amount, record.totalScenes);
        }
        write(record);
        return record.scenesProcessed;
    }

    @Override
    public void setTotalScenes (String taskId, int totalScenes) {
        update(taskId, record -> record.totalScenes = totalScenes);
    }

    @Override
    public void setOutputPath (String taskId, String product, String path) {
        update(taskId, record -> record.outputs.put(product, path));
    }

    @Override
    public void setMetadata (String taskId, Map<String, Object> metadata, Wgs84Bounds coveredBounds) {
        update(taskId, record -> {
            record.metadata.putAll(metadata);
            record.coveredBounds = coveredBounds;
        });
    }

    @Override
    public void setExecutionStart (String taskId, Instant start) {
        update(taskId, record -> record.executionStart = start);
    }

    @Override
    public void markCompleted (String taskId, Instant end) {
        update(taskId, record -> {
            record.complete = true;
            record.executionEnd = end;
        });
    }

    private synchronized void update (String taskId, Consumer<TaskRecord> change) {
        TaskRecord record = read(taskId);
        change.accept(record);
        write(record);
    }

    private TaskRecord read (String taskId) {
        Path path = recordPath(taskId);
        checkArgument(Files.exists(path), "No task exists with ID %s.", taskId);
        return Json.read(path, TaskRecord.class);
    }

    private void write (TaskRecord record) {
        try {
            File tempJsonFile = File.createTempFile(record.id, JSON_SUFFIX, basePath.toFile());
            Json.write(tempJsonFile, record);
            Files.move(tempJsonFile.toPath(), recordPath(record.id), REPLACE_EXISTING, ATOMIC_MOVE);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    private Path recordPath (String taskId) {
        return basePath.resolve(taskId + JSON_SUFFIX);
    }

}
