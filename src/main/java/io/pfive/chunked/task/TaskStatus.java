// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.task;

public enum TaskStatus {
    WAIT, ERROR, OK
}
