// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.source;

import io.pfive.chunked.raster.RasterCube;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/// Where satellite imagery comes from. Implementations must be safe to call from many chunk
/// workers at once.
public interface DataSource {

    /// @return the distinct dates with acquisitions matching the query, in ascending order.
    List<LocalDate> listAcquisitionDates (DatasetQuery query);

    /// Load the requested measurements for every acquisition matching the query.
    /// @return empty if no acquisition intersects the query, rather than an empty cube.
    Optional<RasterCube> fetchDataset (DatasetQuery query);

    /// Whether the product provides all of the named measurements.
    boolean validateMeasurements (String product, List<String> measurements);

}
