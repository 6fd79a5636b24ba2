// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.task;

/// How the temporal chunks of a task relate to one another.
public enum ProcessingMode {
    /// Each later calendar period is compared against the anchor period, yielding a diff.
    BATCH,
    /// Acquisitions are processed in windows and folded into a running accumulation.
    ITERATIVE
}
