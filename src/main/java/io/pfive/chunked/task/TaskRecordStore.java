// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.task;

import io.pfive.chunked.geo.Wgs84Bounds;

import java.time.Instant;
import java.util.Map;

/// Key-addressed persistent storage for task records. Implementations must make every method
/// atomic with respect to the others, as chunk workers call atomicIncrement concurrently with one
/// another and with the single-threaded pipeline stages.
public interface TaskRecordStore {

    /// @return a copy of the current state of the record, never a live reference.
    /// @throws IllegalArgumentException if no task exists with this id.
    TaskRecord get (String taskId);

    void create (TaskRecord record);

    /// Set the status and its message, appending the message to the status history.
    void updateStatus (String taskId, TaskStatus status, String message);

    /// Add the amount to the field. SCENES_PROCESSED is clamped so it never exceeds totalScenes.
    /// @return the new value of the field.
    int atomicIncrement (String taskId, TaskField field, int amount);

    void setTotalScenes (String taskId, int totalScenes);

    void setOutputPath (String taskId, String product, String path);

    void setMetadata (String taskId, Map<String, Object> metadata, Wgs84Bounds coveredBounds);

    void setExecutionStart (String taskId, Instant start);

    /// Set the complete flag and the execution end time.
    void markCompleted (String taskId, Instant end);

}
