// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.task;

import io.pfive.chunked.geo.Wgs84Bounds;
import io.pfive.chunked.pipeline.TaskFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonTaskRecordStoreTest {

    @TempDir
    Path dir;

    private TaskRecordStore store;
    private TaskRecord record;

    @BeforeEach
    void setUp () {
        store = new JsonTaskRecordStore(dir);
        AnalysisParameters parameters = TaskFixtures.waterDetection(TaskFixtures.TWO_CHUNK_EXTENT,
              LocalDate.of(2000, 1, 1), LocalDate.of(2000, 12, 31), 0.5, 2, AnimationMode.RUNNING_STATE);
        record = TaskRecord.newTask(parameters);
        store.create(record);
    }

    @Test
    void recordSurvivesRoundTrip () {
        TaskRecord stored = store.get(record.id);
        assertEquals(record.id, stored.id);
        assertEquals(record.parameters, stored.parameters);
        assertEquals(TaskStatus.WAIT, stored.status);
        assertEquals(List.of("Task submitted."), stored.statusHistory);
        assertFalse(stored.complete);
        assertThrows(IllegalStateException.class, () -> store.create(record));
        assertThrows(IllegalArgumentException.class, () -> store.get("unknown"));
    }

    @Test
    void statusUpdatesAreKeptInHistory () {
        store.updateStatus(record.id, TaskStatus.WAIT, "Starting processing.");
        store.updateStatus(record.id, TaskStatus.ERROR, "Something failed.");
        TaskRecord stored = store.get(record.id);
        assertEquals(TaskStatus.ERROR, stored.status);
        assertEquals("Something failed.", stored.message);
        assertEquals(List.of("Task submitted.", "Starting processing.", "Something failed."), stored.statusHistory);
    }

    @Test
    void returnedRecordsAreCopies () {
        TaskRecord before = store.get(record.id);
        store.setOutputPath(record.id, "data", "/results/data.kryo");
        assertTrue(before.outputs.isEmpty());
        before.outputs.put("other", "/elsewhere");
        assertEquals(Map.of("data", "/results/data.kryo"), store.get(record.id).outputs);
    }

    @Test
    void concurrentIncrementsAreClamped () throws Exception {
        store.setTotalScenes(record.id, 50);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int thread = 0; thread < 8; thread++) {
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 10; i++) store.atomicIncrement(record.id, TaskField.SCENES_PROCESSED, 1);
                }));
            }
            for (Future<?> future : futures) future.get();
        } finally {
            executor.shutdown();
        }
        assertEquals(50, store.get(record.id).scenesProcessed);
        assertThrows(IllegalArgumentException.class,
              () -> store.atomicIncrement(record.id, TaskField.SCENES_PROCESSED, -1));
    }

    @Test
    void completionFields () {
        Instant start = Instant.parse("2024-05-01T10:00:00Z");
        Instant end = Instant.parse("2024-05-01T10:05:00Z");
        Wgs84Bounds covered = Wgs84Bounds.fromMinMax(0, 0, 1, 0.5);
        store.setExecutionStart(record.id, start);
        store.setMetadata(record.id, Map.of("bands", List.of("total_data")), covered);
        store.markCompleted(record.id, end);
        TaskRecord stored = store.get(record.id);
        assertEquals(start, stored.executionStart);
        assertEquals(end, stored.executionEnd);
        assertTrue(stored.complete);
        assertEquals(covered, stored.coveredBounds);
        assertEquals(List.of("total_data"), stored.metadata.get("bands"));
    }

}
