// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.chunk;

import io.pfive.chunked.geo.Wgs84Bounds;

/// One cell of the geographic subdivision of a task's extent. Indexes are assigned row by row
/// starting at the south-west corner.
public record GeographicChunk (int index, Wgs84Bounds bounds) { }
