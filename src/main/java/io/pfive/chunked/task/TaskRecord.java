// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.task;

import com.google.common.base.MoreObjects;
import io.pfive.chunked.geo.Wgs84Bounds;
import io.pfive.chunked.util.RandomId;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// The mutable, persisted state of one analysis task. Fields are public for Jackson, but should
/// only be changed through a TaskRecordStore so that concurrent updates are serialized.
public class TaskRecord {

    public String id;
    public AnalysisParameters parameters;
    public TaskStatus status;
    public String message;
    public List<String> statusHistory = new ArrayList<>();
    public boolean complete;
    public int scenesProcessed;
    public int totalScenes;
    public Instant executionStart;
    public Instant executionEnd;
    /// Paths of deliverable files, keyed on product name.
    public Map<String, String> outputs = new LinkedHashMap<>();
    public Map<String, Object> metadata = new LinkedHashMap<>();
    public Wgs84Bounds coveredBounds;

    /// For deserialization.
    private TaskRecord () { }

    public TaskRecord (String id, AnalysisParameters parameters) {
        this.id = id;
        this.parameters = parameters;
        this.status = TaskStatus.WAIT;
        this.message = "Task submitted.";
        this.statusHistory.add(message);
    }

    /// A record for a newly submitted task with a fresh random ID.
    public static TaskRecord newTask (AnalysisParameters parameters) {
        return new TaskRecord(RandomId.createRandomStringId(), parameters);
    }

    /// A detached deep-enough copy, so a caller holding a record cannot see later updates.
    public TaskRecord copy () {
        TaskRecord copy = new TaskRecord();
        copy.id = id;
        copy.parameters = parameters;
        copy.status = status;
        copy.message = message;
        copy.statusHistory = new ArrayList<>(statusHistory);
        copy.complete = complete;
        copy.scenesProcessed = scenesProcessed;
        copy.totalScenes = totalScenes;
        copy.executionStart = executionStart;
        copy.executionEnd = executionEnd;
        copy.outputs = new LinkedHashMap<>(outputs);
        copy.metadata = new LinkedHashMap<>(metadata);
        copy.coveredBounds = coveredBounds;
        return copy;
    }

    @Override
    public String toString () {
        return MoreObjects.toStringHelper(this)
              .add("id", id)
              .add("status", status)
              .add("scenes", scenesProcessed + "/" + totalScenes)
              .add("message", message)
              .toString();
    }
}
