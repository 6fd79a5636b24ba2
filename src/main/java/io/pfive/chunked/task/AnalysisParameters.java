// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.task;

import com.google.common.collect.ImmutableList;
import io.pfive.chunked.Configuration;
import io.pfive.chunked.chunk.CalendarPeriod;
import io.pfive.chunked.geo.Wgs84Bounds;

import java.time.LocalDate;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/// The immutable configuration of one analysis task as submitted by the user. This is
/// deserialized by Jackson as part of the task record.
///
/// @param geographicChunkSize the width and height of geographic chunks in degrees, or null to
///        process the whole extent as one chunk.
/// @param timeChunkSize the number of acquisitions per temporal window in iterative mode, or null
///        to process all acquisitions in one window. Ignored in batch mode.
public record AnalysisParameters (
      String analysisName,
      String platform,
      String areaId,
      Wgs84Bounds bounds,
      LocalDate timeStart,
      LocalDate timeEnd,
      List<String> measurements,
      Double geographicChunkSize,
      Integer timeChunkSize,
      boolean reverseTime,
      CalendarPeriod calendarPeriod,
      ProcessingMode mode,
      AnimationMode animation
) {

    public AnalysisParameters {
        checkNotNull(analysisName);
        checkNotNull(bounds);
        checkNotNull(timeStart);
        checkNotNull(timeEnd);
        checkNotNull(mode);
        checkArgument(!timeEnd.isBefore(timeStart), "Task time extent ends before it starts.");
        checkArgument(geographicChunkSize == null || geographicChunkSize > 0,
              "Geographic chunk size must be positive.");
        checkArgument(timeChunkSize == null || timeChunkSize > 0, "Time chunk size must be positive.");
        measurements = measurements == null ? List.of() : ImmutableList.copyOf(measurements);
        if (calendarPeriod == null) calendarPeriod = CalendarPeriod.YEAR;
        if (animation == null) animation = AnimationMode.NONE;
    }

    /// The data source product holding this platform's imagery for this area.
    public String product () {
        return Configuration.productPrefix(platform) + areaId;
    }

    public AnalysisParameters withMeasurements (List<String> replacement) {
        return new AnalysisParameters(analysisName, platform, areaId, bounds, timeStart, timeEnd,
              replacement, geographicChunkSize, timeChunkSize, reverseTime, calendarPeriod, mode,
              animation);
    }

}
