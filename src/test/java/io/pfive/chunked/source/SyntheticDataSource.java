// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.source;

import io.pfive.chunked.geo.GridScheme;
import io.pfive.chunked.geo.Wgs84Bounds;
import io.pfive.chunked.raster.RasterCube;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/// Deterministic imagery for tests. Pixels are 0.1 degrees square and aligned to whole tenths of a
/// degree. Water covers every pixel west of a shoreline longitude that moves east by one pixel each
/// year after 2000, so coastal change appears between any two years. Acquisitions on cloudy dates
/// have no clean pixels.
public class SyntheticDataSource implements DataSource {

    public static final double PIXEL_SIZE = 0.1;
    public static final List<String> MEASUREMENTS = List.of("blue", "green", "red", "nir", "swir1", "swir2", "pixel_qa");

    private static final float CLEAR_QA = 2; // bit 1, clear land
    private static final float CLOUD_QA = 32;

    private final Wgs84Bounds coverage;
    private final List<LocalDate> dates;
    private final Set<LocalDate> cloudyDates = new HashSet<>();
    private final Set<String> supportedMeasurements = new HashSet<>(MEASUREMENTS);
    private final AtomicInteger failuresRemaining = new AtomicInteger();
    private final AtomicInteger fetches = new AtomicInteger();

    public SyntheticDataSource (Wgs84Bounds coverage, List<LocalDate> dates) {
        this.coverage = coverage;
        this.dates = dates.stream().sorted().toList();
    }

    public SyntheticDataSource cloudyOn (LocalDate date) {
        cloudyDates.add(date);
        return this;
    }

    /// The next n fetches throw, as a transient fault would.
    public SyntheticDataSource failNextFetches (int n) {
        failuresRemaining.set(n);
        return this;
    }

    public SyntheticDataSource withoutMeasurement (String measurement) {
        supportedMeasurements.remove(measurement);
        return this;
    }

    public int fetchCount () {
        return fetches.get();
    }

    public static double shorelineLon (LocalDate date) {
        return 0.3 + PIXEL_SIZE * (date.getYear() - 2000);
    }

    @Override
    public List<LocalDate> listAcquisitionDates (DatasetQuery query) {
        if (overlap(query.bounds()) == null) return List.of();
        return dates.stream().filter(d -> query.dates().contains(d)).toList();
    }

    @Override
    public Optional<RasterCube> fetchDataset (DatasetQuery query) {
        fetches.incrementAndGet();
        if (failuresRemaining.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new IllegalStateException("Simulated transient failure.");
        }
        Wgs84Bounds bounds = overlap(query.bounds());
        List<LocalDate> matching = listAcquisitionDates(query);
        if (bounds == null || matching.isEmpty()) return Optional.empty();
        GridScheme grid = GridScheme.forBounds(bounds, PIXEL_SIZE);
        RasterCube cube = new RasterCube(grid, matching);
        int nTimes = matching.size();
        int nPixels = grid.nElements();
        List<String> requested = new ArrayList<>(query.measurements());
        if (requested.isEmpty()) requested.addAll(MEASUREMENTS);
        for (String band : requested) {
            float[][] values = new float[nTimes][nPixels];
            for (int t = 0; t < nTimes; t++) {
                LocalDate date = matching.get(t);
                for (int i = 0; i < nPixels; i++) {
                    double lon = grid.centerLonForX(grid.xForFlatIndex(i));
                    values[t][i] = value(band, lon < shorelineLon(date), cloudyDates.contains(date));
                }
            }
            cube.putBand(band, values);
        }
        return Optional.of(cube);
    }

    private static float value (String band, boolean water, boolean cloudy) {
        return switch (band) {
            case "green" -> water ? 1000 : 500;
            case "nir" -> water ? 200 : 2500;
            case "pixel_qa" -> cloudy ? CLOUD_QA : CLEAR_QA;
            default -> 800;
        };
    }

    @Override
    public boolean validateMeasurements (String product, List<String> measurements) {
        return !measurements.isEmpty() && supportedMeasurements.containsAll(measurements);
    }

    /// The part of the query inside the covered area, or null if that has no area.
    private Wgs84Bounds overlap (Wgs84Bounds bounds) {
        Wgs84Bounds overlap = bounds.intersection(coverage);
        if (overlap == null || overlap.widthLon() < PIXEL_SIZE / 2 || overlap.heightLat() < PIXEL_SIZE / 2) {
            return null;
        }
        return overlap;
    }

}
