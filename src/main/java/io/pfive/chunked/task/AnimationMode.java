// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.task;

public enum AnimationMode {
    NONE,
    /// One frame per step showing the result of that step alone.
    PER_SCENE,
    /// One frame per step showing the accumulated state after that step.
    RUNNING_STATE;

    public boolean enabled () {
        return this != NONE;
    }
}
