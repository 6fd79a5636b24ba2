// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.source;

import com.google.common.collect.ImmutableList;
import io.pfive.chunked.chunk.DateRange;
import io.pfive.chunked.geo.Wgs84Bounds;

import java.util.List;

/// Selects the imagery of one product within an extent and an inclusive range of dates.
public record DatasetQuery (String product, Wgs84Bounds bounds, DateRange dates, List<String> measurements) {

    public DatasetQuery {
        measurements = ImmutableList.copyOf(measurements);
    }
}
