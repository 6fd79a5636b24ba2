// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.analysis;

import io.pfive.chunked.raster.CleanMask;
import io.pfive.chunked.raster.Raster;
import io.pfive.chunked.raster.RasterCube;
import io.pfive.chunked.task.AnimationMode;
import io.pfive.chunked.task.ProcessingMode;

import java.util.List;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;

/// Detects shoreline movement between the anchor period and each later period. Each period is
/// reduced to a most-recent-clean-pixel mosaic, water is classified on both mosaics, and pixels are
/// labeled with the direction of change.
public class CoastalChangeAnalysis implements AnalysisDefinition {

    public static final String NAME = "coastal_change";

    public static final String COASTAL_CHANGE = "coastal_change";
    public static final String COASTLINE_OLD = "coastline_old";
    public static final String COASTLINE_NEW = "coastline_new";

    private static final Set<String> MASK_BANDS = Set.of(CleanMask.CF_MASK_BAND, CleanMask.PIXEL_QA_BAND);
    private static final double SCALE_MAX = 4096;
    private static final int OLD_COAST_COLOR = 0xFFFF0000;
    private static final int NEW_COAST_COLOR = 0xFF00FFFF;
    private static final int WATER_GAIN_COLOR = 0xFF0033CC;
    private static final int LAND_GAIN_COLOR = 0xFFCC9900;

    private static final ImageSpec MOSAIC = ImageSpec.rgb("mosaic", "red", "green", "blue", 0, SCALE_MAX);
    private static final ImageSpec COASTLINES = MOSAIC.named("coastline_change")
          .withOverlay(COASTLINE_OLD, 1, OLD_COAST_COLOR)
          .withOverlay(COASTLINE_NEW, 1, NEW_COAST_COLOR);
    private static final ImageSpec CHANGE = MOSAIC.named("coastal_change")
          .withOverlay(COASTAL_CHANGE, 1, WATER_GAIN_COLOR)
          .withOverlay(COASTAL_CHANGE, -1, LAND_GAIN_COLOR);

    @Override
    public String name () {
        return NAME;
    }

    @Override
    public ProcessingMode mode () {
        return ProcessingMode.BATCH;
    }

    /// For every pixel and band, take the value from the latest acquisition in which that pixel is
    /// clean. Pixels never clean in the period are NaN. Mask bands are dropped.
    @Override
    public Raster composite (RasterCube cube, CleanMask mask) {
        int nPixels = cube.grid.nElements();
        int[] latestClean = new int[nPixels];
        for (int i = 0; i < nPixels; i++) {
            latestClean[i] = -1;
            for (int t = cube.nTimes() - 1; t >= 0; t--) {
                if (mask.isClean(t, i)) {
                    latestClean[i] = t;
                    break;
                }
            }
        }
        Raster mosaic = new Raster(cube.grid);
        for (String bandName : cube.bandNames()) {
            if (MASK_BANDS.contains(bandName)) continue;
            float[][] values = cube.band(bandName);
            float[] out = new float[nPixels];
            for (int i = 0; i < nPixels; i++) {
                out[i] = latestClean[i] < 0 ? Float.NaN : values[latestClean[i]][i];
            }
            mosaic.putBand(bandName, out);
        }
        return mosaic;
    }

    /// The newer mosaic's bands plus the change classification: +1 where water appeared, -1 where
    /// land appeared, 0 where unchanged, and the coastline of each period.
    @Override
    public Raster diff (Raster older, Raster newer) {
        checkArgument(older.grid.equals(newer.grid), "Mosaics to compare must share a grid.");
        float[] oldWater = SpectralIndices.water(older.band("green"), older.band("nir"));
        float[] newWater = SpectralIndices.water(newer.band("green"), newer.band("nir"));
        float[] change = new float[oldWater.length];
        for (int i = 0; i < change.length; i++) {
            change[i] = newWater[i] - oldWater[i];
        }
        Raster result = newer.copy();
        result.putBand(COASTAL_CHANGE, change);
        result.putBand(COASTLINE_OLD, SpectralIndices.coastline(oldWater, older.grid));
        result.putBand(COASTLINE_NEW, SpectralIndices.coastline(newWater, newer.grid));
        return result;
    }

    @Override
    public List<ImageSpec> products () {
        return List.of(COASTLINES, CHANGE, MOSAIC);
    }

    @Override
    public ImageSpec animationFrame (AnimationMode animation) {
        return COASTLINES;
    }

}
