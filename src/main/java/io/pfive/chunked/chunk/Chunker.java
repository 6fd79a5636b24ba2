// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.chunk;

import com.google.common.collect.Lists;
import io.pfive.chunked.geo.Wgs84Bounds;
import io.pfive.chunked.task.AnalysisParameters;
import io.pfive.chunked.task.ProcessingMode;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

import static com.google.common.base.Preconditions.checkArgument;

/// Pure functions splitting a task's extent and acquisition dates into the units of work that are
/// processed in parallel. Validation that the dates are sufficient for the processing mode happens
/// before any of these are called.
public abstract class Chunker {

    /// Fraction of a cell below which a leftover strip at the edge of the extent is not given its
    /// own row or column of chunks, absorbing floating point error in the extent.
    private static final double EPSILON = 1e-9;

    public static ChunkPlan plan (AnalysisParameters parameters, Collection<LocalDate> dates) {
        List<GeographicChunk> geoChunks = geographicChunks(parameters.bounds(),
              parameters.geographicChunkSize());
        List<TemporalChunk> timeChunks = switch (parameters.mode()) {
            case BATCH -> batchChunks(dates, parameters.timeStart(), parameters.calendarPeriod());
            case ITERATIVE -> iterativeChunks(dates, parameters.timeChunkSize(), parameters.reverseTime());
        };
        return new ChunkPlan(geoChunks, timeChunks);
    }

    public static ChunkPlan plan (Wgs84Bounds extent, Collection<LocalDate> dates,
                                  Double geoChunkSize, Integer timeChunkSize, ProcessingMode mode) {
        List<TemporalChunk> timeChunks = switch (mode) {
            case BATCH -> batchChunks(dates, dates.stream().min(LocalDate::compareTo).orElseThrow(),
                  CalendarPeriod.YEAR);
            case ITERATIVE -> iterativeChunks(dates, timeChunkSize, false);
        };
        return new ChunkPlan(geographicChunks(extent, geoChunkSize), timeChunks);
    }

    /// Tile the extent with square cells of the given size in degrees, starting at the south-west
    /// corner. Cells on the north and east edges are clipped to the extent. Indexes increase
    /// eastward along each row, then northward row by row.
    /// @param chunkSize null to cover the whole extent with a single chunk.
    public static List<GeographicChunk> geographicChunks (Wgs84Bounds extent, Double chunkSize) {
        if (chunkSize == null) return List.of(new GeographicChunk(0, extent));
        checkArgument(chunkSize > 0, "Geographic chunk size must be positive.");
        int nWide = Math.max(1, (int) Math.ceil(extent.widthLon() / chunkSize - EPSILON));
        int nHigh = Math.max(1, (int) Math.ceil(extent.heightLat() / chunkSize - EPSILON));
        List<GeographicChunk> chunks = new ArrayList<>(nWide * nHigh);
        for (int y = 0; y < nHigh; y++) {
            double minLat = extent.minLat() + y * chunkSize;
            double maxLat = (y == nHigh - 1) ? extent.maxLat() : minLat + chunkSize;
            for (int x = 0; x < nWide; x++) {
                double minLon = extent.minLon() + x * chunkSize;
                double maxLon = (x == nWide - 1) ? extent.maxLon() : minLon + chunkSize;
                Wgs84Bounds bounds = Wgs84Bounds.fromMinMax(minLon, minLat, maxLon, maxLat);
                chunks.add(new GeographicChunk(chunks.size(), bounds));
            }
        }
        return chunks;
    }

    /// Group dates by calendar period, with keys in ascending order.
    public static SortedMap<String, List<LocalDate>> groupByPeriod (Collection<LocalDate> dates,
                                                                    CalendarPeriod period) {
        SortedMap<String, List<LocalDate>> groups = new TreeMap<>();
        for (LocalDate date : dates.stream().sorted().toList()) {
            groups.computeIfAbsent(period.key(date), k -> new ArrayList<>()).add(date);
        }
        return groups;
    }

    /// Pair the period containing the task start date with every other period that has
    /// acquisitions, in ascending order. Each pair is one animation step.
    public static List<TemporalChunk> batchChunks (Collection<LocalDate> dates, LocalDate start,
                                                   CalendarPeriod period) {
        SortedMap<String, List<LocalDate>> groups = groupByPeriod(dates, period);
        String anchorKey = period.key(start);
        List<LocalDate> anchorDates = groups.get(anchorKey);
        checkArgument(anchorDates != null, "No acquisitions in the anchor period %s.", anchorKey);
        DateRange anchor = DateRange.containing(anchorDates);
        List<TemporalChunk> chunks = new ArrayList<>();
        for (var entry : groups.entrySet()) {
            if (entry.getKey().equals(anchorKey)) continue;
            int index = chunks.size();
            DateRange other = DateRange.containing(entry.getValue());
            chunks.add(new TemporalChunk(index, List.of(anchor, other), index, 1));
        }
        return chunks;
    }

    /// Split the acquisitions into contiguous windows of the given size, in chronological or
    /// reverse chronological order. Each acquisition is one animation step.
    /// @param windowSize null to place all acquisitions in one window.
    public static List<TemporalChunk> iterativeChunks (Collection<LocalDate> dates, Integer windowSize,
                                                       boolean reverse) {
        List<LocalDate> ordered = new ArrayList<>(dates.stream().sorted().distinct().toList());
        if (ordered.isEmpty()) return List.of();
        if (reverse) ordered = Lists.reverse(ordered);
        int size = (windowSize == null) ? ordered.size() : windowSize;
        checkArgument(size > 0, "Time chunk size must be positive.");
        List<TemporalChunk> chunks = new ArrayList<>();
        int firstStep = 0;
        for (List<LocalDate> window : Lists.partition(ordered, size)) {
            List<DateRange> ranges = window.stream().map(DateRange::single).toList();
            chunks.add(new TemporalChunk(chunks.size(), ranges, firstStep, ranges.size()));
            firstStep += ranges.size();
        }
        return chunks;
    }

}
