// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.task;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;

/// The handle through which workers report progress on one task. Increments go straight to the
/// record store so they survive a crash, while log messages about progress are throttled.
public class ProgressSink {
    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    // Parameters affecting the maximum number and frequency of log messages for a single task.
    private static final int DEFAULT_MAX_EVENTS = 100;
    private static final int DEFAULT_MIN_MSEC = 1000;

    private final String taskId;
    private final TaskRecordStore store;

    // Variables used in throttling log messages.
    private int totalSteps = 1;
    private int prevLogStep = 0;
    private int logAfter = 0;
    private long startTime;
    private long lastLogTime = 0;
    private int msecBetweenEvents = DEFAULT_MIN_MSEC;

    public ProgressSink (String taskId, TaskRecordStore store) {
        this.taskId = taskId;
        this.store = store;
    }

    public void minTimeBetweenEventsMsec (int msec) {
        this.msecBetweenEvents = msec;
    }

    public synchronized void beginTask (String title, int totalSteps) {
        this.totalSteps = totalSteps;
        this.startTime = System.currentTimeMillis();
        // Throttling will still function if totalSteps <= MAX_EVENTS and logAfter is zero.
        this.logAfter = totalSteps / DEFAULT_MAX_EVENTS;
        this.prevLogStep = 0;
        store.setTotalScenes(taskId, totalSteps);
        LOG.info("Task {} begin: {} ({} scenes)", taskId, title, totalSteps);
    }

    /// Threadsafe: called by many chunk workers at once.
    public synchronized void increment (int scenes) {
        int stepsCompleted = store.atomicIncrement(taskId, TaskField.SCENES_PROCESSED, scenes);
        if (stepsCompleted >= totalSteps) {
            long durationSec = (System.currentTimeMillis() - startTime) / 1000;
            LOG.info("Task {} done: all {} scenes processed in {} sec", taskId, totalSteps, durationSec);
        } else if (stepsCompleted >= prevLogStep + logAfter) {
            long currTime = System.currentTimeMillis();
            if (currTime - lastLogTime < msecBetweenEvents) return;
            LOG.info("Task {} step: {}/{} scenes, about {} sec remaining", taskId, stepsCompleted,
                  totalSteps, estimateRemainingSeconds(currTime, stepsCompleted));
            prevLogStep = stepsCompleted;
            lastLogTime = currTime;
        }
    }

    private int estimateRemainingSeconds (long currentTime, int stepsCompleted) {
        if (stepsCompleted == 0) return -1;
        double activeTimeSeconds = (currentTime - this.startTime) / 1000.0;
        double stepsRemaining = totalSteps - stepsCompleted;
        return (int)(activeTimeSeconds * stepsRemaining / stepsCompleted);
    }

}
