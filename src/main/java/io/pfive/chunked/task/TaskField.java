// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.task;

/// Numeric fields of a task record that workers may increment concurrently.
public enum TaskField {
    SCENES_PROCESSED
}
